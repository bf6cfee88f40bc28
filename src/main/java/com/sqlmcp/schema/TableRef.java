package com.sqlmcp.schema;

import com.sqlmcp.db.SqlNames;

/**
 * Catalog coordinates of a table or view, exactly as the database reports them.
 */
public record TableRef(String catalog, String schema, String name, String type) {

    public String qualifiedName(String quoteString) {
        return SqlNames.qualify(schema, name, quoteString);
    }

    public boolean isView() {
        return "VIEW".equalsIgnoreCase(type);
    }
}

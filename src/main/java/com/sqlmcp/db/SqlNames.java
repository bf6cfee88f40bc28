package com.sqlmcp.db;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Identifier quoting for statements the gateway builds itself. Callers only pass names that
 * already matched the identifier pattern or came from catalog metadata.
 */
public final class SqlNames {

    private SqlNames() {
    }

    public static String quoteString(DatabaseMetaData metaData) throws SQLException {
        String quoteString = metaData.getIdentifierQuoteString();
        return quoteString == null || quoteString.isBlank() ? "" : quoteString.trim();
    }

    public static String quote(String identifier, String quoteString) {
        if (quoteString == null || quoteString.isEmpty()) {
            return identifier;
        }
        return quoteString + identifier.replace(quoteString, quoteString + quoteString) + quoteString;
    }

    public static String qualify(String schemaName, String identifier, String quoteString) {
        if (schemaName == null || schemaName.isEmpty()) {
            return quote(identifier, quoteString);
        }
        return quote(schemaName, quoteString) + "." + quote(identifier, quoteString);
    }

    /**
     * Escapes the LIKE wildcards in a name passed to a metadata pattern argument.
     */
    public static String escapePattern(String name, String searchEscape) {
        if (name == null || searchEscape == null || searchEscape.isEmpty()) {
            return name;
        }
        return name.replace(searchEscape, searchEscape + searchEscape)
                .replace("_", searchEscape + "_")
                .replace("%", searchEscape + "%");
    }
}

package com.sqlmcp.schema;

import java.util.List;

public record IndexInfo(String name, List<String> columns, boolean unique) {
    public IndexInfo {
        columns = List.copyOf(columns);
    }
}

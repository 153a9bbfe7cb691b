package com.askql.schema;

import java.util.List;

/**
 * Table description used in schema context.
 *
 * @param name short table name
 * @param fullName fully qualified name used in generated SQL
 * @param description optional description
 * @param rowCount row count when known, otherwise null
 * @param columns columns in ordinal order
 */
public record TableSchema(String name, String fullName, String description, Long rowCount, List<ColumnSchema> columns) {

    public TableSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}

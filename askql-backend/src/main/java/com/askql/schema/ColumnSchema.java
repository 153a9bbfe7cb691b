package com.askql.schema;

/**
 * Column description used in schema context.
 *
 * @param name column name
 * @param type engine type name
 * @param mode NULLABLE, REQUIRED or REPEATED
 * @param description optional description
 */
public record ColumnSchema(String name, String type, String mode, String description) {

    public static final String NULLABLE = "NULLABLE";
    public static final String REQUIRED = "REQUIRED";

    public ColumnSchema {
        mode = mode == null || mode.isBlank() ? NULLABLE : mode;
    }
}

package com.askql.schema;

import java.util.List;

/**
 * Tables of one dataset (or JDBC schema) as described to the language model.
 *
 * @param project project or catalog, may be null
 * @param dataset dataset or schema name
 * @param tables tables in listing order
 */
public record DatasetSchema(String project, String dataset, List<TableSchema> tables) {

    public DatasetSchema {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}

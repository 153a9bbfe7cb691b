package com.askql.schema;

import java.util.List;

/**
 * Source of table and column descriptions for prompt building.
 */
public interface SchemaContextProvider {

    /**
     * Describe the tables of a dataset.
     *
     * @param dataset dataset or schema name; null selects the configured default
     * @param tables table names to include; null or empty includes every table
     * @return schema description
     * @throws IllegalArgumentException when the dataset does not exist
     */
    DatasetSchema describe(String dataset, List<String> tables);

    /**
     * List the table names of a dataset.
     *
     * @param dataset dataset or schema name; null selects the configured default
     * @return table names
     */
    List<String> listTables(String dataset);
}

package com.askql.schema;

import com.askql.engine.QueryExecutionException;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SchemaContextProvider} reading BigQuery table metadata.
 */
public class BigQuerySchemaContextProvider implements SchemaContextProvider {

    private static final Logger log = LoggerFactory.getLogger(BigQuerySchemaContextProvider.class);

    private final BigQuery bigQuery;
    private final String projectId;
    private final String defaultDataset;

    public BigQuerySchemaContextProvider(BigQuery bigQuery, String projectId, String defaultDataset) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
        this.defaultDataset = defaultDataset;
    }

    @Override
    public List<String> listTables(String dataset) {
        DatasetId datasetId = datasetId(dataset);
        try {
            List<String> names = new ArrayList<>();
            for (Table table : bigQuery.listTables(datasetId).iterateAll()) {
                names.add(table.getTableId().getTable());
            }
            return names;
        } catch (BigQueryException e) {
            throw new QueryExecutionException("Failed to list tables: " + e.getMessage(), null, e);
        }
    }

    @Override
    public DatasetSchema describe(String dataset, List<String> tables) {
        DatasetId datasetId = datasetId(dataset);
        List<String> names = tables == null || tables.isEmpty() ? listTables(dataset) : tables;

        List<TableSchema> result = new ArrayList<>(names.size());
        try {
            for (String name : names) {
                Table table = bigQuery.getTable(TableId.of(datasetId.getProject(), datasetId.getDataset(), name));
                if (table == null) {
                    throw new IllegalArgumentException("Table not found: " + name);
                }
                result.add(toTableSchema(datasetId, name, table));
            }
        } catch (BigQueryException e) {
            throw new QueryExecutionException("Failed to read schema: " + e.getMessage(), null, e);
        }
        log.debug("Described {} table(s) in dataset {}", result.size(), datasetId.getDataset());
        return new DatasetSchema(datasetId.getProject(), datasetId.getDataset(), result);
    }

    private TableSchema toTableSchema(DatasetId datasetId, String name, Table table) {
        List<ColumnSchema> columns = new ArrayList<>();
        Schema schema = table.getDefinition() != null ? table.getDefinition().getSchema() : null;
        if (schema != null) {
            for (Field field : schema.getFields()) {
                columns.add(new ColumnSchema(
                        field.getName(),
                        String.valueOf(field.getType()),
                        field.getMode() != null ? field.getMode().name() : null,
                        field.getDescription()
                ));
            }
        }
        BigInteger numRows = table.getNumRows();
        String project = datasetId.getProject();
        String fullName = (project != null ? project + "." : "") + datasetId.getDataset() + "." + name;
        return new TableSchema(
                name,
                fullName,
                table.getDescription(),
                numRows != null ? numRows.longValue() : null,
                columns
        );
    }

    private DatasetId datasetId(String dataset) {
        String resolved = dataset != null && !dataset.isBlank() ? dataset.trim() : defaultDataset;
        if (resolved == null || resolved.isBlank()) {
            throw new IllegalArgumentException("dataset is required");
        }
        int dot = resolved.indexOf('.');
        if (dot > 0) {
            return DatasetId.of(resolved.substring(0, dot), resolved.substring(dot + 1));
        }
        return projectId != null && !projectId.isBlank() ? DatasetId.of(projectId, resolved) : DatasetId.of(resolved);
    }
}

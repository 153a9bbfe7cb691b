package com.askql.engine;

import com.askql.config.EngineProperties;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.TableResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryEngine} backed by Google BigQuery.
 *
 * <p>Dry runs use BigQuery's native {@code dryRun} job flag: the query is validated and its scan
 * size estimated without billing. Real runs set {@code maximumBytesBilled}, so BigQuery itself
 * refuses any query that would scan more than the ceiling.
 */
public class BigQueryQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(BigQueryQueryEngine.class);

    private final BigQuery bigQuery;
    private final EngineProperties properties;

    public BigQueryQueryEngine(BigQuery bigQuery, EngineProperties properties) {
        this.bigQuery = bigQuery;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "bigquery";
    }

    @Override
    public TabularResult execute(String sql, long maxBytesBilled, boolean dryRun) {
        if (sql == null || sql.isBlank()) {
            throw new QueryExecutionException("Query text is empty", sql);
        }
        long startTime = System.currentTimeMillis();

        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .setDryRun(dryRun);
        if (properties.getDefaultDataset() != null && !properties.getDefaultDataset().isBlank()) {
            builder.setDefaultDataset(properties.getDefaultDataset());
        }

        try {
            if (dryRun) {
                Job job = bigQuery.create(JobInfo.of(builder.build()));
                JobStatistics.QueryStatistics stats = job.getStatistics();
                long bytes = stats != null && stats.getTotalBytesProcessed() != null ? stats.getTotalBytesProcessed() : 0L;
                log.debug("BigQuery dry run ok (bytes_processed={})", bytes);
                return TabularResult.dryRun(bytes, System.currentTimeMillis() - startTime);
            }

            if (maxBytesBilled > 0) {
                builder.setMaximumBytesBilled(maxBytesBilled);
            }
            if (properties.getQueryTimeoutMs() > 0) {
                builder.setJobTimeoutMs((long) properties.getQueryTimeoutMs());
            }
            TableResult result = bigQuery.query(builder.build());
            return readResult(result, startTime);
        } catch (BigQueryException e) {
            String prefix = dryRun ? "Dry run failed: " : "Query execution failed: ";
            throw new QueryExecutionException(prefix + errorMessage(e), sql, e);
        } catch (JobException e) {
            throw new QueryExecutionException("Query execution failed: " + e.getMessage(), sql, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Query execution interrupted", sql, e);
        }
    }

    private TabularResult readResult(TableResult result, long startTime) {
        List<QueryColumn> columns = new ArrayList<>();
        Schema schema = result.getSchema();
        if (schema != null) {
            for (Field field : schema.getFields()) {
                columns.add(new QueryColumn(field.getName(), String.valueOf(field.getType())));
            }
        }

        int maxRows = properties.getMaxRows();
        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        for (FieldValueList values : result.iterateAll()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size() && i < values.size(); i++) {
                row.put(columns.get(i).name(), toJsonSafe(values.get(i)));
            }
            rows.add(row);
        }

        return new TabularResult(columns, rows, rows.size(), truncated, System.currentTimeMillis() - startTime, 0L);
    }

    private Object toJsonSafe(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.PRIMITIVE) {
            return value.getStringValue();
        }
        return String.valueOf(value.getValue());
    }

    private String errorMessage(BigQueryException e) {
        BigQueryError error = e.getError();
        if (error != null && error.getMessage() != null) {
            return error.getMessage();
        }
        return e.getMessage();
    }
}

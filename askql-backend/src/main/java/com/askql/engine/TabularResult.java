package com.askql.engine;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a {@link QueryEngine}.
 *
 * @param columns result columns in select order
 * @param rows rows keyed by column name; values are JSON-safe
 * @param rowCount number of rows returned
 * @param truncated whether the row cap cut the result short
 * @param durationMs execution time in milliseconds
 * @param bytesProcessed bytes the engine reported (or estimated) for the query
 */
public record TabularResult(
        List<QueryColumn> columns,
        List<Map<String, Object>> rows,
        long rowCount,
        boolean truncated,
        long durationMs,
        long bytesProcessed
) {

    public TabularResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * Result of a dry run: no rows, only the engine's byte estimate.
     *
     * @param bytesProcessed estimated bytes
     * @param durationMs time spent validating
     * @return empty result
     */
    public static TabularResult dryRun(long bytesProcessed, long durationMs) {
        return new TabularResult(List.of(), List.of(), 0, false, durationMs, bytesProcessed);
    }
}

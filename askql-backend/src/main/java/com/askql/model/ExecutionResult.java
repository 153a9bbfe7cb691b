package com.askql.model;

import com.askql.engine.QueryColumn;
import com.askql.engine.TabularResult;

import java.util.List;
import java.util.Map;

/**
 * Result of generating SQL and running it for real.
 *
 * @param success whether generation and execution both succeeded
 * @param sql SQL that was executed, or the last attempted SQL when generation failed (never null)
 * @param columns result columns, empty on failure
 * @param rows result rows, empty on failure
 * @param rowCount number of rows returned
 * @param truncated whether the row cap cut the result short
 * @param durationMs engine execution time
 * @param error generation or execution error, null on success
 * @param attemptsUsed generation attempts used
 */
public record ExecutionResult(
        boolean success,
        String sql,
        List<QueryColumn> columns,
        List<Map<String, Object>> rows,
        long rowCount,
        boolean truncated,
        long durationMs,
        String error,
        int attemptsUsed
) {

    public static ExecutionResult success(String sql, TabularResult result, int attemptsUsed) {
        return new ExecutionResult(
                true,
                sql,
                result.columns(),
                result.rows(),
                result.rowCount(),
                result.truncated(),
                result.durationMs(),
                null,
                attemptsUsed
        );
    }

    public static ExecutionResult failure(String sql, String error, int attemptsUsed) {
        return new ExecutionResult(false, sql != null ? sql : "", List.of(), List.of(), 0, false, 0, error, attemptsUsed);
    }
}

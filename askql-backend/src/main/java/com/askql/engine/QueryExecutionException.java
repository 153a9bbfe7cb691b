package com.askql.engine;

/**
 * Thrown when the query engine rejects or fails to run a query. The message carries the engine's
 * own error text.
 */
public class QueryExecutionException extends RuntimeException {

    private final String sql;

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param sql the query that failed
     * @param cause underlying engine error
     */
    public QueryExecutionException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public QueryExecutionException(String message, String sql) {
        this(message, sql, null);
    }

    public String getSql() {
        return sql;
    }
}

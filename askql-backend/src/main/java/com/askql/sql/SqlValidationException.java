package com.askql.sql;

/**
 * Thrown when SQL fails the read-only safety gate.
 */
public class SqlValidationException extends RuntimeException {

    private final ValidationFailure failure;
    private final String offending;
    private final String sql;

    /**
     * Create a new exception.
     *
     * @param failure rejection reason
     * @param offending the statement type, keyword or matched text that caused the rejection
     * @param message error message
     * @param sql the SQL that was validated
     */
    public SqlValidationException(ValidationFailure failure, String offending, String message, String sql) {
        super(message);
        this.failure = failure;
        this.offending = offending;
        this.sql = sql;
    }

    public ValidationFailure getFailure() {
        return failure;
    }

    public String getOffending() {
        return offending;
    }

    public String getSql() {
        return sql;
    }
}

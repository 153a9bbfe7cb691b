package com.askql.sql;

/**
 * Non-throwing result of running the safety gate.
 *
 * @param accepted whether the SQL passed every check
 * @param cleanedSql comment-stripped, whitespace-normalized SQL (null when rejected)
 * @param failure rejection reason (null when accepted)
 * @param detail human-readable rejection message (null when accepted)
 */
public record ValidationOutcome(boolean accepted, String cleanedSql, ValidationFailure failure, String detail) {

    public static ValidationOutcome accepted(String cleanedSql) {
        return new ValidationOutcome(true, cleanedSql, null, null);
    }

    public static ValidationOutcome rejected(ValidationFailure failure, String detail) {
        return new ValidationOutcome(false, null, failure, detail);
    }
}

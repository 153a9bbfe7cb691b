package com.askql.model;

import java.util.List;

/**
 * Terminal result of one text-to-SQL request.
 *
 * <p>When {@code success} is true, {@code sql} has passed the safety gate and a dry run. When it is
 * false, {@code sql} is the last SQL attempted (possibly null) and {@code error} the last error.
 *
 * @param success whether usable SQL was produced
 * @param sql validated SQL on success, last attempted SQL otherwise
 * @param error last error, null on success
 * @param attemptsUsed number of attempts made, never more than the configured budget
 * @param attempts per-attempt records in order
 */
public record GenerationResult(boolean success, String sql, String error, int attemptsUsed, List<GenerationAttempt> attempts) {

    public GenerationResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static GenerationResult success(String sql, int attemptsUsed, List<GenerationAttempt> attempts) {
        return new GenerationResult(true, sql, null, attemptsUsed, attempts);
    }

    public static GenerationResult failure(String lastSql, String lastError, int attemptsUsed, List<GenerationAttempt> attempts) {
        return new GenerationResult(false, lastSql, lastError, attemptsUsed, attempts);
    }
}

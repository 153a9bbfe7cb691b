package com.askql.model;

/**
 * Immutable record of one pass through the generation loop.
 *
 * @param attemptIndex 1-based attempt number
 * @param promptUsed prompt sent to the language model
 * @param rawModelText raw model response, null on transport failure
 * @param extractedSql SQL found in the response, null when extraction failed
 * @param validatedSql cleaned SQL returned by the safety gate, null when not reached or rejected
 * @param failure failure kind, null when the attempt succeeded
 * @param error failure message, null when the attempt succeeded
 */
public record GenerationAttempt(
        int attemptIndex,
        String promptUsed,
        String rawModelText,
        String extractedSql,
        String validatedSql,
        AttemptFailure failure,
        String error
) {

    public static GenerationAttempt transportFailure(int attemptIndex, String prompt, String error) {
        return new GenerationAttempt(attemptIndex, prompt, null, null, null, AttemptFailure.TRANSPORT, error);
    }

    public static GenerationAttempt extractionFailure(int attemptIndex, String prompt, String rawModelText, String error) {
        return new GenerationAttempt(attemptIndex, prompt, rawModelText, null, null, AttemptFailure.EXTRACTION, error);
    }

    public static GenerationAttempt validationFailure(int attemptIndex, String prompt, String rawModelText, String extractedSql, String error) {
        return new GenerationAttempt(attemptIndex, prompt, rawModelText, extractedSql, null, AttemptFailure.VALIDATION, error);
    }

    public static GenerationAttempt dryRunFailure(int attemptIndex, String prompt, String rawModelText, String extractedSql, String validatedSql, String error) {
        return new GenerationAttempt(attemptIndex, prompt, rawModelText, extractedSql, validatedSql, AttemptFailure.DRY_RUN, error);
    }

    public static GenerationAttempt success(int attemptIndex, String prompt, String rawModelText, String extractedSql, String validatedSql) {
        return new GenerationAttempt(attemptIndex, prompt, rawModelText, extractedSql, validatedSql, null, null);
    }

    public boolean succeeded() {
        return failure == null;
    }

    /**
     * Validation error message, when the safety gate rejected this attempt.
     *
     * @return message or null
     */
    public String validationError() {
        return failure == AttemptFailure.VALIDATION ? error : null;
    }

    /**
     * Dry-run error message, when the query engine rejected this attempt.
     *
     * @return message or null
     */
    public String dryRunError() {
        return failure == AttemptFailure.DRY_RUN ? error : null;
    }

    /**
     * SQL to carry into the next retry prompt: the cleaned form when available, otherwise the raw
     * extraction.
     *
     * @return SQL or null when nothing was extracted
     */
    public String attemptedSql() {
        return validatedSql != null ? validatedSql : extractedSql;
    }
}

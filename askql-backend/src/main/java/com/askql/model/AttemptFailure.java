package com.askql.model;

/**
 * Why a single generation attempt did not produce usable SQL. Every kind is retryable while the
 * attempt budget lasts.
 */
public enum AttemptFailure {
    /** The language-model call failed or returned an empty response. */
    TRANSPORT,
    /** No SQL could be found in the model text. */
    EXTRACTION,
    /** The extracted SQL was rejected by the safety gate. */
    VALIDATION,
    /** The query engine rejected the SQL during a dry run. */
    DRY_RUN
}

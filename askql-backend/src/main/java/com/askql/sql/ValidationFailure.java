package com.askql.sql;

/**
 * Reason a SQL string was rejected by {@link SqlSafetyValidator}.
 */
public enum ValidationFailure {
    /** Input was null, blank, or contained only comments. */
    EMPTY_INPUT,
    /** A statement's leading keyword declares a non-read-only statement. */
    BLOCKED_STATEMENT_TYPE,
    /** A blocked keyword appears as a whole word anywhere in a statement. */
    BLOCKED_KEYWORD,
    /** A statement matches one of the danger patterns, such as {@code SELECT ... INTO t}. */
    BLOCKED_PATTERN
}

package com.askql.sql;

/**
 * A single SQL unit split out of a request.
 *
 * @param leadingKeyword first keyword of the statement, upper-cased (empty when none)
 * @param kind classified statement kind
 * @param text statement text without the terminating semicolon
 */
public record Statement(String leadingKeyword, StatementKind kind, String text) {
}

package com.askql.model;

/**
 * One question/answer exchange of a conversation.
 *
 * <p>Only turns with a non-null {@code sql} are replayed into later prompts.
 *
 * @param question user question
 * @param sql SQL produced for the question, null when generation failed
 * @param error error shown to the user, null on success
 */
public record ChatTurn(String question, String sql, String error) {

    public boolean hasSql() {
        return sql != null && !sql.isBlank();
    }
}

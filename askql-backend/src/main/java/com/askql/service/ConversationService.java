package com.askql.service;

import com.askql.model.ChatTurn;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the question/SQL history of each conversation in memory.
 *
 * <p>Each conversation is bounded; the oldest turns are dropped first. Error messages are trimmed
 * and stripped of credential-like values before they are stored.
 */
@Service
public class ConversationService {

    static final int DEFAULT_MAX_TURNS = 50;
    private static final int DEFAULT_MAX_ERROR_LENGTH = 512;

    private final Map<String, Deque<ChatTurn>> conversations = new ConcurrentHashMap<>();

    /**
     * Record a turn whose question produced SQL.
     *
     * @param conversationId conversation identifier
     * @param question user question
     * @param sql generated SQL
     */
    public void recordSuccess(String conversationId, String question, String sql) {
        if (sql == null || sql.isBlank()) {
            return;
        }
        append(conversationId, new ChatTurn(question, sql, null));
    }

    /**
     * Record a turn whose question produced no usable SQL.
     *
     * @param conversationId conversation identifier
     * @param question user question
     * @param error error shown to the user
     */
    public void recordFailure(String conversationId, String question, String error) {
        append(conversationId, new ChatTurn(question, null, sanitizeErrorMessage(error)));
    }

    /**
     * Get the history of a conversation.
     *
     * @param conversationId conversation identifier
     * @return turns, oldest first
     */
    public List<ChatTurn> getHistory(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return List.of();
        }
        Deque<ChatTurn> deque = conversations.get(conversationId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(new ArrayList<>(deque));
        }
    }

    /**
     * Drop all turns of a conversation.
     *
     * @param conversationId conversation identifier
     */
    public void clear(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return;
        }
        conversations.remove(conversationId);
    }

    private void append(String conversationId, ChatTurn turn) {
        if (conversationId == null || conversationId.isBlank()) {
            return;
        }
        Deque<ChatTurn> deque = conversations.computeIfAbsent(conversationId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(turn);
            while (deque.size() > DEFAULT_MAX_TURNS) {
                deque.removeFirst();
            }
        }
    }

    static String sanitizeErrorMessage(String message) {
        if (message == null) {
            return null;
        }

        String sanitized = message.trim();
        sanitized = sanitized.replaceAll("(?i)^(error:\\s*)+", "");
        sanitized = sanitized.replaceAll("(?i)(password|passwd|token|secret|key)\\s*=\\s*[^\\s]+", "$1=***");

        if (sanitized.length() <= DEFAULT_MAX_ERROR_LENGTH) {
            return sanitized;
        }
        return sanitized.substring(0, DEFAULT_MAX_ERROR_LENGTH);
    }
}

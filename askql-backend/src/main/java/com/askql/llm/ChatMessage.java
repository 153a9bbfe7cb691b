package com.askql.llm;

import java.util.Locale;

/**
 * One message of a multi-turn model conversation.
 *
 * @param role speaker
 * @param content message text
 */
public record ChatMessage(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT;

        /**
         * Role name on the wire.
         *
         * @return lower-case role name
         */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }
}

package com.askql.llm;

/**
 * Thrown when the language-model call fails, is not configured, or returns an empty response.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}

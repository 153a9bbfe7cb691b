package com.askql.llm;

import java.util.List;

/**
 * Language-model text generator used by the SQL pipeline. Calls are synchronous and blocking.
 */
public interface SqlModelClient {

    /**
     * Generate a completion for a single prompt.
     *
     * @param prompt user prompt
     * @param systemInstruction system instruction, may be null
     * @param temperature sampling temperature
     * @param maxTokens maximum tokens to generate
     * @return trimmed, non-empty model text
     * @throws LlmException on transport failure, error status, missing configuration or empty output
     */
    String generate(String prompt, String systemInstruction, double temperature, int maxTokens);

    /**
     * Generate a completion for an ordered list of turns.
     *
     * @param messages conversation turns, oldest first
     * @param systemInstruction system instruction, may be null
     * @param temperature sampling temperature
     * @param maxTokens maximum tokens to generate
     * @return trimmed, non-empty model text
     * @throws LlmException on transport failure, error status, missing configuration or empty output
     */
    String chat(List<ChatMessage> messages, String systemInstruction, double temperature, int maxTokens);
}

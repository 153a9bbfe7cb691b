package com.askql.api;

import com.askql.model.ChatTurn;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for text-to-SQL generation and execution.
 *
 * JSON fields (snake_case):
 * - question: Natural language question
 * - schema_context: Optional rendered schema
 * - dataset / tables: Optional schema source when schema_context is absent
 * - conversation_id: Optional conversation to read history from and record into
 * - history: Optional explicit history (wins over conversation_id)
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskRequest {

    /**
     * Natural language question.
     * Example: "How many orders were placed last month?"
     */
    @NotBlank(message = "Question is required")
    private String question;

    /**
     * Schema description placed in the prompt as is.
     */
    private String schemaContext;

    /**
     * Dataset (BigQuery) or schema (JDBC) to describe when schema_context is absent.
     */
    private String dataset;

    /**
     * Tables to describe. When empty, tables named in the question are used.
     */
    private List<String> tables;

    private String conversationId;

    /**
     * Earlier turns, oldest first.
     */
    private List<ChatTurn> history;
}

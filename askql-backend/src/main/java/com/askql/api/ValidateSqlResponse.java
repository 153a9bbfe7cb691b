package com.askql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ValidateSqlResponse {
    private boolean valid;
    private String cleanedSql;

    /**
     * Values: EMPTY_INPUT, BLOCKED_STATEMENT_TYPE, BLOCKED_KEYWORD, BLOCKED_PATTERN. Null when valid.
     */
    private String failure;

    private String message;
    private List<String> tables;
}

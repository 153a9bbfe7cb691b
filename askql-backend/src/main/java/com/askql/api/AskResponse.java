package com.askql.api;

import com.askql.engine.QueryColumn;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for question answering: generated SQL plus its result set.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskResponse {
    private boolean success;
    private String sql;
    private List<QueryColumn> columns;
    private List<Map<String, Object>> rows;
    private long rowCount;
    private boolean truncated;
    private long durationMs;
    private String error;
    private int attemptsUsed;
    private String traceId;
}

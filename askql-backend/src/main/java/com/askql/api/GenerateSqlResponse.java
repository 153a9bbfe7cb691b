package com.askql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for text-to-SQL generation.
 *
 * On failure, sql holds the last SQL attempted (possibly null) and error the last error.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateSqlResponse {
    private boolean success;
    private String sql;
    private String error;
    private int attemptsUsed;

    /**
     * Tables referenced by the SQL (heuristic).
     */
    private List<String> tables;

    private String traceId;
}

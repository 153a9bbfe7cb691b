package com.askql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for question suggestions and schema summaries.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SuggestRequest {

    private String schemaContext;

    private String dataset;

    private List<String> tables;

    /**
     * Number of questions wanted. Defaults to 5.
     */
    @Min(value = 1, message = "count must be at least 1")
    @Max(value = 10, message = "count must be at most 10")
    private Integer count;
}

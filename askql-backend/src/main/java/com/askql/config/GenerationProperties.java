package com.askql.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Text-to-SQL loop settings.
 */
@Data
@ConfigurationProperties(prefix = "askql.generation")
public class GenerationProperties {

    /** Attempt budget for one question. */
    private int maxRetries = 3;

    /** Sampling temperature for the first attempt. */
    private double initialTemperature = 0.1;

    /** Sampling temperature for retry attempts. */
    private double retryTemperature = 0.2;

    private int maxTokens = 2048;

    /** Overall deadline for one generation request; 0 disables it. */
    private long deadlineMs = 120000;

    /** Rendered schema longer than this is replaced by the column-names-only form; 0 disables it. */
    private int maxSchemaContextChars = 30000;

    /** SQL dialect named in prompts. */
    private String dialect = "BigQuery";
}

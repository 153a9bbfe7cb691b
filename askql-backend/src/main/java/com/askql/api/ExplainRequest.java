package com.askql.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ExplainRequest {

    @NotBlank(message = "SQL is required")
    private String sql;

    /**
     * Question the SQL was generated for, if any.
     */
    private String question;
}

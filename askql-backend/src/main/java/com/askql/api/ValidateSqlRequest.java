package com.askql.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ValidateSqlRequest {

    /**
     * SQL to check. Blank SQL is accepted here and reported as EMPTY_INPUT.
     */
    @NotNull(message = "SQL is required")
    private String sql;
}

package com.fedsearch.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for SQL generation against one connection.
 */
@Data
public class GenerateSqlRequest {

    @NotBlank(message = "Query is required")
    private String query;

    @NotBlank(message = "Connection id is required")
    private String connectionId;

    /**
     * Also run the generated SQL through the cache and return the first page.
     * A rejected query is then reported as an error instead of a REJECTED verdict.
     */
    private boolean execute;

    @Min(value = 1, message = "page_size must be positive")
    private Integer pageSize;
}

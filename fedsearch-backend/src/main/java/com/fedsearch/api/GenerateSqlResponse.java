package com.fedsearch.api;

import com.fedsearch.cache.Page;
import com.fedsearch.sql.GeneratedQuery;
import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for SQL generation.
 *
 * JSON fields (snake_case):
 * - generated: the generated query with verdict, reason, method and warnings
 * - first_page: first page of the result, present only when execution was requested
 * - trace_id: request correlation id
 */
@Data
@Builder
public class GenerateSqlResponse {
    private GeneratedQuery generated;
    private Page firstPage;
    private String traceId;
}

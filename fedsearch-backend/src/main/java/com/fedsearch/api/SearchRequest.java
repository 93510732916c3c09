package com.fedsearch.api;

import com.fedsearch.search.SearchOptions;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for a federated search.
 *
 * JSON fields (snake_case):
 * - query: natural-language question
 * - search_sql / search_docs: enable or disable a retrieval path (default true)
 * - connection_ids: connections for the SQL path (default all)
 * - top_k, timeout_ms, page_size: optional overrides of the configured defaults
 * - filter: payload equality filter for the document path
 */
@Data
public class SearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private Boolean searchSql;
    private Boolean searchDocs;
    private List<String> connectionIds;

    @Min(value = 1, message = "top_k must be positive")
    private Integer topK;

    @Min(value = 1, message = "timeout_ms must be positive")
    private Long timeoutMs;

    @Min(value = 1, message = "page_size must be positive")
    private Integer pageSize;

    private Map<String, Object> filter;

    public SearchOptions toOptions() {
        return SearchOptions.builder()
                .searchSql(searchSql == null || searchSql)
                .searchDocs(searchDocs == null || searchDocs)
                .connectionIds(connectionIds)
                .topK(topK == null ? 0 : topK)
                .timeoutMs(timeoutMs == null ? 0 : timeoutMs)
                .pageSize(pageSize == null ? 0 : pageSize)
                .filter(filter)
                .build();
    }
}

package com.fedsearch.search;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Per-request search options. Zero or null values fall back to the configured defaults.
 */
@Data
@Builder
public class SearchOptions {
    @Builder.Default
    private boolean searchSql = true;
    @Builder.Default
    private boolean searchDocs = true;

    /**
     * Connections to query; null or empty means all configured connections.
     */
    private List<String> connectionIds;
    private int topK;
    private long timeoutMs;
    private int pageSize;

    /**
     * Payload equality filter for the document path.
     */
    private Map<String, Object> filter;

    public static SearchOptions defaults() {
        return SearchOptions.builder().build();
    }
}

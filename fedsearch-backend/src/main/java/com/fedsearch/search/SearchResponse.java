package com.fedsearch.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Unified answer to one search. Every source has a status, including sources that were skipped
 * or failed.
 */
@Value
@Builder
public class SearchResponse {
    String query;
    List<SearchResult> results;
    Map<SourceType, SourceStatus> sourceStatuses;
    InvocationState state;
    long totalLatencyMs;
}

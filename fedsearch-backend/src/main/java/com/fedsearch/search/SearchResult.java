package com.fedsearch.search;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One fused result. {@code rank} is the 1-based position within its own path before fusion.
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {
    SourceType source;
    double rawScore;
    double normalizedScore;
    Map<String, Object> payload;
    String originId;
    int rank;
}

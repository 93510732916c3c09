package com.fedsearch.api;

import com.fedsearch.cache.CacheEntrySummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CacheEntriesResponse {
    private List<CacheEntrySummary> entries;
    private String traceId;
}

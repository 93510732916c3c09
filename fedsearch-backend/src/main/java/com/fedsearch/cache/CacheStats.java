package com.fedsearch.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    long producerRuns;
    long producerFailures;
    long joinedWaiters;
    long evictions;
    long expirations;
    int entryCount;
    long totalBytes;
    long maxBytes;
    double hitRate;
}

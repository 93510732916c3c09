package com.fedsearch.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Listing view of a cached query, without its rows.
 */
@Value
@Builder
public class CacheEntrySummary {
    String key;
    String connectionId;
    String sql;
    int rowCount;
    int totalPages;
    long sizeBytes;
    Instant createdAt;
    Instant expiresAt;
}

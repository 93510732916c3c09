package com.fedsearch.cache;

import com.fedsearch.schema.ColumnDescriptor;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A cached query result, split into JSON-serialized pages when it was stored.
 */
@Value
@Builder
public class CacheEntry {
    String key;
    String connectionId;
    String sql;
    List<ColumnDescriptor> columns;
    List<byte[]> serializedPages;
    int pageSize;
    int rowCount;
    boolean truncated;
    long sizeBytes;
    Instant createdAt;
    Duration ttl;

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    public int totalPages() {
        return serializedPages.size();
    }
}

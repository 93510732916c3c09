package com.fedsearch.connection;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Public, secret-free view of a configured connection. The core refers to connections by {@link #id} only.
 */
@Value
@Builder
public class ConnectionDescriptor {
    String id;
    String dialect;

    /**
     * Cache TTL for this connection, or null to use the cache default.
     */
    Duration cacheTtl;
    int rowLimit;
}

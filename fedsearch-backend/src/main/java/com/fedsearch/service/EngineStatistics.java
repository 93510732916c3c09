package com.fedsearch.service;

import com.fedsearch.cache.CacheStats;
import com.fedsearch.schema.SchemaStatistics;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of configured connections, indexed schemas and the query cache.
 */
@Value
@Builder
public class EngineStatistics {
    int configuredConnections;
    List<String> indexedConnections;
    SchemaStatistics schema;
    CacheStats cache;
}

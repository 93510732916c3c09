package com.fedsearch.schema;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SchemaStatistics {
    Map<String, ConnectionStatistics> connections;
    int totalTables;
    int totalColumns;

    @Value
    @Builder
    public static class ConnectionStatistics {
        int tables;
        int columns;

        /**
         * Tables left out of the snapshot because introspection failed.
         */
        int errors;
        Instant indexedAt;
        boolean expired;
    }
}

package com.fedsearch.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable per-connection set of indexed tables. A new snapshot replaces the old one as a whole.
 */
@Value
@Builder
public class SchemaSnapshot {
    String connectionId;
    @Singular
    List<TableDescriptor> tables;
    @Singular
    List<TableIntrospectionError> errors;
    Instant indexedAt;

    /**
     * Structural hash of table and column names/types, used to detect drift.
     */
    String fingerprint;

    public Optional<TableDescriptor> findTable(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        String wanted = tableName.toLowerCase(Locale.ROOT);
        return tables.stream()
                .filter(t -> t.getName().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    @JsonIgnore
    public boolean isExpired(Instant now, Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative() && indexedAt.plus(ttl).isBefore(now);
    }

    public List<String> tableNames() {
        return tables.stream().map(TableDescriptor::getName).toList();
    }
}

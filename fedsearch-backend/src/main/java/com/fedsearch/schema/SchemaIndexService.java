package com.fedsearch.schema;

import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.embedding.EmbeddingException;
import com.fedsearch.embedding.EmbeddingService;
import com.fedsearch.embedding.Vectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.HashMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Per-connection index of table descriptions and their embeddings.
 *
 * <p>Snapshots are built without holding any lock and published under the write lock, so a
 * reader sees either the previous snapshot or the new one, never a partial one. A table that
 * fails introspection is left out of the snapshot with a recorded error; failing to list
 * tables at all fails the whole build.
 */
@Slf4j
@Service
public class SchemaIndexService {

    private static final int MAX_SAMPLE_VALUE_CHARS = 40;

    private final ConnectionProvider connectionProvider;
    private final EmbeddingService embeddingService;
    private final FedSearchProperties.Schema config;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SchemaSnapshot> snapshots = new HashMap<>();

    public SchemaIndexService(ConnectionProvider connectionProvider,
                              EmbeddingService embeddingService,
                              FedSearchProperties properties,
                              Clock clock) {
        this.connectionProvider = connectionProvider;
        this.embeddingService = embeddingService;
        this.config = properties.getSchema();
        this.clock = clock;
    }

    /**
     * Introspect and embed every table of a connection, replacing any previous snapshot.
     *
     * @param connectionId connection id
     * @return the new snapshot
     * @throws com.fedsearch.connection.UnknownConnectionException if the id is not configured
     * @throws SchemaIntrospectionException if the table list cannot be read
     */
    public SchemaSnapshot indexSchema(String connectionId) {
        SchemaSnapshot snapshot = buildSnapshot(connectionId);
        publish(snapshot);
        return snapshot;
    }

    /**
     * Current snapshot, indexing first when none exists or the existing one has expired.
     */
    public SchemaSnapshot snapshotFor(String connectionId) {
        SchemaSnapshot current = currentSnapshot(connectionId).orElse(null);
        if (current != null && !current.isExpired(clock.instant(), config.getTtl())) {
            return current;
        }
        log.info("Indexing schema: connection={}, reason={}", connectionId, current == null ? "absent" : "expired");
        return indexSchema(connectionId);
    }

    public Optional<SchemaSnapshot> currentSnapshot(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(snapshots.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rank indexed tables by relevance to a natural-language query.
     *
     * @param nlQuery natural-language query
     * @param connectionId connection id
     * @param topK maximum number of matches
     * @return matches by descending relevance, ties by table name; tables below the configured
     *         minimum relevance are dropped
     */
    public List<TableMatch> findRelevantTables(String nlQuery, String connectionId, int topK) {
        SchemaSnapshot snapshot = snapshotFor(connectionId);
        if (snapshot.getTables().isEmpty() || topK <= 0) {
            return List.of();
        }
        float[] queryVector = embeddingService.embed(nlQuery);

        List<TableMatch> matches = new ArrayList<>();
        for (TableDescriptor table : snapshot.getTables()) {
            double relevance = Vectors.clamp01(Vectors.cosine(queryVector, table.getEmbedding()));
            if (relevance > 0.0 && relevance >= config.getMinRelevance()) {
                matches.add(new TableMatch(table, relevance));
            }
        }
        matches.sort(Comparator.comparingDouble(TableMatch::relevance).reversed()
                .thenComparing(m -> m.table().getName()));
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : List.copyOf(matches);
    }

    /**
     * Tables that have every one of the given columns, ranked by relevance to a description
     * naming those columns.
     *
     * @param connectionId connection id
     * @param columnNames column names, matched case-insensitively
     * @return matching tables by descending relevance, ties by table name
     */
    public List<TableMatch> findTablesWithColumns(String connectionId, Collection<String> columnNames) {
        SchemaSnapshot snapshot = snapshotFor(connectionId);
        List<String> wanted = columnNames == null ? List.of() : columnNames.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::trim)
                .toList();
        if (wanted.isEmpty()) {
            return List.of();
        }
        float[] queryVector = embeddingService.embed("table with columns " + String.join(", ", wanted));

        List<TableMatch> matches = new ArrayList<>();
        for (TableDescriptor table : snapshot.getTables()) {
            if (wanted.stream().allMatch(c -> table.findColumn(c).isPresent())) {
                matches.add(new TableMatch(table, Vectors.clamp01(Vectors.cosine(queryVector, table.getEmbedding()))));
            }
        }
        matches.sort(Comparator.comparingDouble(TableMatch::relevance).reversed()
                .thenComparing(m -> m.table().getName()));
        return List.copyOf(matches);
    }

    /**
     * Table, column and error counts of the snapshots currently held. Does not index anything.
     */
    public SchemaStatistics statistics() {
        Map<String, SchemaStatistics.ConnectionStatistics> perConnection = new TreeMap<>();
        lock.readLock().lock();
        try {
            for (SchemaSnapshot snapshot : snapshots.values()) {
                perConnection.put(snapshot.getConnectionId(), SchemaStatistics.ConnectionStatistics.builder()
                        .tables(snapshot.getTables().size())
                        .columns(snapshot.getTables().stream().mapToInt(t -> t.columnNames().size()).sum())
                        .errors(snapshot.getErrors().size())
                        .indexedAt(snapshot.getIndexedAt())
                        .expired(snapshot.isExpired(clock.instant(), config.getTtl()))
                        .build());
            }
        } finally {
            lock.readLock().unlock();
        }
        return SchemaStatistics.builder()
                .connections(perConnection)
                .totalTables(perConnection.values().stream().mapToInt(SchemaStatistics.ConnectionStatistics::getTables).sum())
                .totalColumns(perConnection.values().stream().mapToInt(SchemaStatistics.ConnectionStatistics::getColumns).sum())
                .build();
    }

    /**
     * Re-introspect a connection and swap in the new snapshot if its structure changed.
     *
     * @return true if a new snapshot was published
     */
    public boolean refreshIfDrifted(String connectionId) {
        SchemaSnapshot current = currentSnapshot(connectionId).orElse(null);
        SchemaSnapshot fresh = buildSnapshot(connectionId);
        if (current != null && current.getFingerprint().equals(fresh.getFingerprint())) {
            log.debug("Schema unchanged: connection={}", connectionId);
            return false;
        }
        log.info("Schema drift detected: connection={}, tables={}", connectionId, fresh.tableNames());
        publish(fresh);
        return true;
    }

    public void invalidate(String connectionId) {
        lock.writeLock().lock();
        try {
            snapshots.remove(connectionId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void publish(SchemaSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            snapshots.put(snapshot.getConnectionId(), snapshot);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private SchemaSnapshot buildSnapshot(String connectionId) {
        connectionProvider.descriptor(connectionId);
        long startTime = System.currentTimeMillis();
        List<String> tableNames = connectionProvider.listTables(connectionId);

        SchemaSnapshot.SchemaSnapshotBuilder builder = SchemaSnapshot.builder()
                .connectionId(connectionId)
                .indexedAt(clock.instant());
        List<TableDescriptor> tables = new ArrayList<>();
        for (String tableName : tableNames) {
            try {
                TableDescriptor described = connectionProvider.describeTable(connectionId, tableName, config.getSampleRows());
                String description = describe(described);
                tables.add(described.toBuilder()
                        .description(description)
                        .embedding(embeddingService.embed(description))
                        .build());
            } catch (SchemaIntrospectionException | EmbeddingException e) {
                log.warn("Skipping table during indexing: connection={}, table={}, reason={}",
                        connectionId, tableName, e.getMessage());
                builder.error(new TableIntrospectionError(tableName, e.getMessage()));
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Skipping table after unexpected failure: connection={}, table={}", connectionId, tableName, e);
                builder.error(new TableIntrospectionError(tableName, reason));
            }
        }
        tables.sort(Comparator.comparing(TableDescriptor::getName));

        SchemaSnapshot snapshot = builder.tables(tables).fingerprint(fingerprint(tables)).build();
        log.info("Indexed schema: connection={}, tables={}, errors={}, durationMs={}",
                connectionId, tables.size(), snapshot.getErrors().size(), System.currentTimeMillis() - startTime);
        return snapshot;
    }

    /**
     * One-line description used for embedding, e.g.
     * {@code table orders: columns id(INTEGER), total(REAL); sample rows: id=1, total=9.5 | ...}.
     */
    static String describe(TableDescriptor table) {
        StringBuilder sb = new StringBuilder("table ").append(table.getName()).append(": columns ");
        sb.append(table.getColumns().stream()
                .map(c -> c.getName() + "(" + c.getType() + ")")
                .collect(Collectors.joining(", ")));
        List<Map<String, Object>> samples = table.getSampleRows();
        if (samples != null && !samples.isEmpty()) {
            sb.append("; sample rows: ");
            sb.append(samples.stream()
                    .map(row -> row.entrySet().stream()
                            .map(e -> e.getKey() + "=" + abbreviate(e.getValue()))
                            .collect(Collectors.joining(", ")))
                    .collect(Collectors.joining(" | ")));
        }
        return sb.toString();
    }

    private static String abbreviate(Object value) {
        String s = String.valueOf(value);
        return s.length() <= MAX_SAMPLE_VALUE_CHARS ? s : s.substring(0, MAX_SAMPLE_VALUE_CHARS) + "...";
    }

    static String fingerprint(List<TableDescriptor> tables) {
        StringBuilder sb = new StringBuilder();
        for (TableDescriptor table : tables) {
            sb.append(table.getName()).append('(');
            for (ColumnDescriptor column : table.getColumns()) {
                sb.append(column.getName()).append(':').append(column.getType()).append(',');
            }
            sb.append(");");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

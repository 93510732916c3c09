package com.fedsearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.connection.RowSet;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-through cache of query results with per-entry TTL, a byte budget and at most one
 * concurrent producer per key.
 *
 * <p>Entries live in a Caffeine cache weighed by their serialized size and expired by their own
 * TTL, read from the injected clock. The first caller for a missing key registers an in-flight
 * future and runs the producer on its own thread; concurrent callers for the same key wait on
 * that future and receive the same entry or the same exception. Failures are never stored.
 * Invalidation bumps an epoch so a production that was running at the time is not stored.
 */
@Slf4j
public class QueryCacheManager implements AutoCloseable {

    private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final FedSearchProperties.Cache config;
    private final Cache<String, CacheEntry> entries;

    // guards the epochs and orders stores against invalidation
    private final Object lock = new Object();
    private final Map<String, Long> connectionEpochs = new HashMap<>();
    private long globalEpoch;

    private final Map<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong producerRuns = new AtomicLong();
    private final AtomicLong producerFailures = new AtomicLong();
    private final AtomicLong joinedWaiters = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public QueryCacheManager(ObjectMapper objectMapper, Clock clock, FedSearchProperties.Cache config) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = config;
        this.entries = Caffeine.newBuilder()
                .maximumWeight(config.getMaxBytes())
                .weigher((String key, CacheEntry entry) -> (int) Math.min(Integer.MAX_VALUE, entry.getSizeBytes()))
                .expireAfter(new EntryTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .evictionListener((String key, CacheEntry entry, RemovalCause cause) -> onEviction(key, entry, cause))
                .build();
        log.info("Query cache created (max_bytes={}, page_size={}, default_ttl={})",
                config.getMaxBytes(), config.getPageSize(), config.getDefaultTtl());
    }

    /**
     * Drop every entry.
     */
    @Override
    public void close() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    public Optional<CacheEntry> get(String key) {
        Optional<CacheEntry> entry = lookup(key);
        (entry.isPresent() ? hits : misses).incrementAndGet();
        return entry;
    }

    /**
     * Return the cached entry for {@code key}, producing and storing it on a miss.
     *
     * @param key cache key, see {@link CacheKeys}
     * @param connectionId connection the result belongs to
     * @param producer runs the query; called at most once at a time per key
     * @param ttl time to live, or null for the configured default
     * @return cached or freshly produced entry
     * @throws RuntimeException whatever the producer threw, to this caller and every waiter
     */
    public CacheEntry getOrProduce(String key, String connectionId, Supplier<RowSet> producer, Duration ttl) {
        return getOrProduce(key, connectionId, null, producer, ttl);
    }

    /**
     * Same as {@link #getOrProduce(String, String, Supplier, Duration)}, recording the SQL text
     * for the cached-query listing.
     */
    public CacheEntry getOrProduce(String key, String connectionId, String sql, Supplier<RowSet> producer, Duration ttl) {
        Optional<CacheEntry> cached = lookup(key);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            return cached.get();
        }
        misses.incrementAndGet();

        CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            joinedWaiters.incrementAndGet();
            log.debug("Joining in-flight production: key={}", key);
            return await(existing);
        }

        try {
            // Stored between our lookup and registering the future.
            Optional<CacheEntry> raced = lookup(key);
            if (raced.isPresent()) {
                mine.complete(raced.get());
                return raced.get();
            }

            Epoch epoch = epoch(connectionId);
            producerRuns.incrementAndGet();
            long startTime = System.currentTimeMillis();
            CacheEntry entry;
            try {
                entry = buildEntry(key, connectionId, sql, producer.get(), ttl != null ? ttl : config.getDefaultTtl());
            } catch (RuntimeException | Error e) {
                producerFailures.incrementAndGet();
                log.debug("Producer failed, nothing cached: key={}, reason={}", key, e.getMessage());
                mine.completeExceptionally(e);
                throw e;
            }
            storeIfCurrent(entry, epoch);
            log.debug("Produced cache entry: key={}, rows={}, bytes={}, durationMs={}",
                    key, entry.getRowCount(), entry.getSizeBytes(), System.currentTimeMillis() - startTime);
            mine.complete(entry);
            return entry;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Read one page of a cached result.
     *
     * @param key cache key
     * @param pageNumber 1-based page number
     * @param pageSize rows per page, or 0 for the size the entry was stored with
     * @return the page, or empty if the key is not cached
     * @throws IllegalArgumentException if the page number is out of range
     */
    public Optional<Page> page(String key, int pageNumber, int pageSize) {
        return lookup(key).map(entry -> readPage(entry, pageNumber, pageSize));
    }

    public Page readPage(CacheEntry entry, int pageNumber, int pageSize) {
        int size = pageSize > 0 ? pageSize : entry.getPageSize();
        int totalRows = entry.getRowCount();
        int totalPages = (totalRows + size - 1) / size;
        boolean emptyFirstPage = totalRows == 0 && pageNumber == 1;
        if (pageNumber < 1 || (pageNumber > totalPages && !emptyFirstPage)) {
            throw new IllegalArgumentException("Page " + pageNumber + " out of range (total_pages=" + totalPages + ")");
        }

        List<Map<String, Object>> rows;
        if (totalRows == 0) {
            rows = List.of();
        } else if (size == entry.getPageSize()) {
            rows = decode(entry.getSerializedPages().get(pageNumber - 1));
        } else {
            int start = (pageNumber - 1) * size;
            int end = Math.min(start + size, totalRows);
            int storedSize = entry.getPageSize();
            List<Map<String, Object>> window = new ArrayList<>();
            for (int stored = start / storedSize; stored <= (end - 1) / storedSize; stored++) {
                window.addAll(decode(entry.getSerializedPages().get(stored)));
            }
            int offset = start - (start / storedSize) * storedSize;
            rows = window.subList(offset, offset + (end - start));
        }

        return Page.builder()
                .key(entry.getKey())
                .pageNumber(pageNumber)
                .pageSize(size)
                .totalRows(totalRows)
                .totalPages(totalPages)
                .hasNext(pageNumber < totalPages)
                .hasPrevious(pageNumber > 1)
                .rows(rows)
                .build();
    }

    public boolean invalidateKey(String key) {
        return entries.asMap().remove(key) != null;
    }

    /**
     * Drop every entry of a connection. Results of productions already running for it are
     * still returned to their callers but not stored.
     *
     * @return number of entries removed
     */
    public int invalidateConnection(String connectionId) {
        synchronized (lock) {
            connectionEpochs.merge(connectionId, 1L, Long::sum);
            int removed = 0;
            for (Map.Entry<String, CacheEntry> entry : List.copyOf(entries.asMap().entrySet())) {
                if (entry.getValue().getConnectionId().equals(connectionId)
                        && entries.asMap().remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
            log.info("Invalidated cache: connection={}, entries={}", connectionId, removed);
            return removed;
        }
    }

    public int invalidateAll() {
        synchronized (lock) {
            globalEpoch++;
            int removed = entries.asMap().size();
            entries.invalidateAll();
            log.info("Invalidated cache: entries={}", removed);
            return removed;
        }
    }

    public CacheStats stats() {
        entries.cleanUp();
        long h = hits.get();
        long m = misses.get();
        return CacheStats.builder()
                .hits(h)
                .misses(m)
                .producerRuns(producerRuns.get())
                .producerFailures(producerFailures.get())
                .joinedWaiters(joinedWaiters.get())
                .evictions(evictions.get())
                .expirations(expirations.get())
                .entryCount(entries.asMap().size())
                .totalBytes(entries.policy().eviction()
                        .map(eviction -> eviction.weightedSize().orElse(0L))
                        .orElse(0L))
                .maxBytes(config.getMaxBytes())
                .hitRate(h + m == 0 ? 0.0 : (double) h / (h + m))
                .build();
    }

    /**
     * @param connectionId restrict to one connection, or null for all
     * @return cached queries, newest first
     */
    public List<CacheEntrySummary> entries(String connectionId) {
        Instant now = clock.instant();
        return List.copyOf(entries.asMap().values()).stream()
                .filter(e -> connectionId == null || e.getConnectionId().equals(connectionId))
                .filter(e -> !e.isExpired(now))
                .sorted(Comparator.comparing(CacheEntry::getCreatedAt).reversed().thenComparing(CacheEntry::getKey))
                .map(e -> CacheEntrySummary.builder()
                        .key(e.getKey())
                        .connectionId(e.getConnectionId())
                        .sql(e.getSql())
                        .rowCount(e.getRowCount())
                        .totalPages(e.totalPages())
                        .sizeBytes(e.getSizeBytes())
                        .createdAt(e.getCreatedAt())
                        .expiresAt(e.expiresAt())
                        .build())
                .toList();
    }

    /**
     * Run pending maintenance, reclaiming expired entries.
     *
     * @return number of entries expired by this call
     */
    public int sweepExpired() {
        long before = expirations.get();
        entries.cleanUp();
        int removed = (int) (expirations.get() - before);
        if (removed > 0) {
            log.debug("Swept expired cache entries: count={}", removed);
        }
        return removed;
    }

    private void onEviction(String key, CacheEntry entry, RemovalCause cause) {
        if (cause == RemovalCause.EXPIRED) {
            expirations.incrementAndGet();
        } else if (cause == RemovalCause.SIZE) {
            evictions.incrementAndGet();
            log.debug("Evicted cache entry: key={}, bytes={}", key, entry != null ? entry.getSizeBytes() : 0);
        }
    }

    /**
     * Wait for another caller's production and rethrow its failure unwrapped.
     */
    private static CacheEntry await(CompletableFuture<CacheEntry> inFlightProduction) {
        try {
            return inFlightProduction.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Cache production failed: " + cause.getMessage(), cause);
        }
    }

    private Optional<CacheEntry> lookup(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    private Epoch epoch(String connectionId) {
        synchronized (lock) {
            return new Epoch(globalEpoch, connectionEpochs.getOrDefault(connectionId, 0L));
        }
    }

    private void storeIfCurrent(CacheEntry entry, Epoch epoch) {
        synchronized (lock) {
            if (!epoch.equals(new Epoch(globalEpoch, connectionEpochs.getOrDefault(entry.getConnectionId(), 0L)))) {
                log.debug("Not caching result invalidated during production: key={}", entry.getKey());
                return;
            }
            if (entry.getSizeBytes() > config.getMaxBytes()) {
                log.info("Result larger than cache budget, served uncached: key={}, bytes={}, max_bytes={}",
                        entry.getKey(), entry.getSizeBytes(), config.getMaxBytes());
                return;
            }
            entries.put(entry.getKey(), entry);
        }
    }

    private CacheEntry buildEntry(String key, String connectionId, String sql, RowSet rowSet, Duration ttl) {
        int pageSize = config.getPageSize();
        List<Map<String, Object>> rows = rowSet.getRows() != null ? rowSet.getRows() : List.of();
        List<byte[]> pages = new ArrayList<>();
        long size = 0;
        for (int start = 0; start < rows.size(); start += pageSize) {
            byte[] page = encode(rows.subList(start, Math.min(start + pageSize, rows.size())));
            pages.add(page);
            size += page.length;
        }
        return CacheEntry.builder()
                .key(key)
                .connectionId(connectionId)
                .sql(sql)
                .columns(rowSet.getColumns() != null ? List.copyOf(rowSet.getColumns()) : List.of())
                .serializedPages(List.copyOf(pages))
                .pageSize(pageSize)
                .rowCount(rows.size())
                .truncated(rowSet.isTruncated())
                .sizeBytes(size)
                .createdAt(clock.instant())
                .ttl(ttl)
                .build();
    }

    private byte[] encode(List<Map<String, Object>> rows) {
        try {
            return objectMapper.writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result page: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> decode(byte[] page) {
        try {
            return objectMapper.readValue(page, ROWS_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot deserialize cached page: " + e.getMessage(), e);
        }
    }

    private record Epoch(long global, long connection) {
    }

    /**
     * Expires each entry after its own TTL, counted from creation or replacement.
     */
    private static final class EntryTtl implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

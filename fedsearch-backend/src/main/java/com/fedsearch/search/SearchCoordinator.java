package com.fedsearch.search;

import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.connection.ConnectionDescriptor;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.document.DocumentSearchService;
import com.fedsearch.document.VectorHit;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the SQL and document paths concurrently and fuses their results.
 *
 * <p>Each path runs on the search executor under its own budget, capped by the global timeout.
 * A path that fails or times out is reported on its {@link SourceStatus} and never affects the
 * other path. Work still running when the global timeout fires is left to finish in the
 * background, so a cache production it started still completes and is stored.
 */
@Slf4j
@Service
public class SearchCoordinator {

    private final SqlSearchPath sqlPath;
    private final DocumentSearchService documentSearch;
    private final ConnectionProvider connectionProvider;
    private final ScoreFusion fusion;
    private final ExecutorService executor;
    private final FedSearchProperties.Search config;

    public SearchCoordinator(SqlSearchPath sqlPath,
                             DocumentSearchService documentSearch,
                             ConnectionProvider connectionProvider,
                             ScoreFusion fusion,
                             @Qualifier("searchExecutor") ExecutorService executor,
                             FedSearchProperties properties) {
        this.sqlPath = sqlPath;
        this.documentSearch = documentSearch;
        this.connectionProvider = connectionProvider;
        this.fusion = fusion;
        this.executor = executor;
        this.config = properties.getSearch();
    }

    /**
     * @param nlQuery natural-language query
     * @param options per-request options
     * @return fused results with a status per source
     * @throws IllegalArgumentException if the query is blank
     */
    public SearchResponse search(String nlQuery, SearchOptions options) {
        if (nlQuery == null || nlQuery.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        SearchOptions opts = options != null ? options : SearchOptions.defaults();
        long startTime = System.currentTimeMillis();
        long globalTimeoutMs = opts.getTimeoutMs() > 0 ? opts.getTimeoutMs() : config.getGlobalTimeoutMs();
        long sqlBudgetMs = Math.min(config.getSqlTimeoutMs(), globalTimeoutMs);
        long docBudgetMs = Math.min(config.getDocTimeoutMs(), globalTimeoutMs);
        int topK = opts.getTopK() > 0 ? opts.getTopK() : config.getTopK();
        int pageSize = Math.max(opts.getPageSize(), 0);
        List<String> connectionIds = opts.getConnectionIds() != null && !opts.getConnectionIds().isEmpty()
                ? List.copyOf(opts.getConnectionIds())
                : connectionProvider.listConnections().stream().map(ConnectionDescriptor::getId).toList();

        log.debug("Search {}: sql={}, doc={}, connections={}", InvocationState.RUNNING,
                opts.isSearchSql(), opts.isSearchDocs(), connectionIds);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Map<SourceType, Long> finishedAt = new ConcurrentHashMap<>();
        CompletableFuture<PathOutcome> sqlFuture = opts.isSearchSql()
                ? submit(SourceType.SQL, () -> sqlPath.search(nlQuery, connectionIds, pageSize), mdc, sqlBudgetMs, finishedAt)
                : null;
        CompletableFuture<PathOutcome> docFuture = opts.isSearchDocs()
                ? submit(SourceType.DOC, () -> documentPath(nlQuery, topK, opts.getFilter()), mdc, docBudgetMs, finishedAt)
                : null;

        awaitAll(globalTimeoutMs, sqlFuture, docFuture);

        Map<SourceType, SourceStatus> statuses = new EnumMap<>(SourceType.class);
        Map<SourceType, List<SearchResult>> resultsBySource = new EnumMap<>(SourceType.class);
        collect(SourceType.SQL, sqlFuture, sqlBudgetMs, globalTimeoutMs, startTime, finishedAt, statuses, resultsBySource);
        collect(SourceType.DOC, docFuture, docBudgetMs, globalTimeoutMs, startTime, finishedAt, statuses, resultsBySource);
        log.debug("Search {}: statuses={}", InvocationState.AGGREGATED, statuses.keySet());

        List<SearchResult> fused = fusion.fuse(resultsBySource);
        long totalLatencyMs = System.currentTimeMillis() - startTime;
        log.info("Search completed: sql={}, doc={}, results={}, totalLatencyMs={}",
                statuses.get(SourceType.SQL).getStatus(), statuses.get(SourceType.DOC).getStatus(),
                fused.size(), totalLatencyMs);

        return SearchResponse.builder()
                .query(nlQuery)
                .results(fused)
                .sourceStatuses(statuses)
                .state(InvocationState.RETURNED)
                .totalLatencyMs(totalLatencyMs)
                .build();
    }

    private PathOutcome documentPath(String nlQuery, int topK, Map<String, Object> filter) {
        List<VectorHit> hits = documentSearch.search(nlQuery, topK, filter);
        List<SearchResult> results = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            VectorHit hit = hits.get(i);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("doc_id", hit.docId());
            if (hit.payload() != null) {
                payload.putAll(hit.payload());
            }
            results.add(SearchResult.builder()
                    .source(SourceType.DOC)
                    .rawScore(hit.score())
                    .payload(payload)
                    .originId(hit.docId())
                    .rank(i + 1)
                    .build());
        }
        return PathOutcome.ok(results);
    }

    private CompletableFuture<PathOutcome> submit(SourceType source,
                                                  Supplier<PathOutcome> path,
                                                  Map<String, String> mdc,
                                                  long budgetMs,
                                                  Map<SourceType, Long> finishedAt) {
        try {
            return CompletableFuture.supplyAsync(withMdc(mdc, path), executor)
                    .orTimeout(budgetMs, TimeUnit.MILLISECONDS)
                    .whenComplete((outcome, error) -> finishedAt.put(source, System.currentTimeMillis()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("search executor saturated", e));
        }
    }

    @SafeVarargs
    private void awaitAll(long globalTimeoutMs, CompletableFuture<PathOutcome>... futures) {
        CompletableFuture<?>[] running = Arrays.stream(futures)
                .filter(Objects::nonNull)
                .toArray(CompletableFuture<?>[]::new);
        if (running.length == 0) {
            return;
        }
        try {
            CompletableFuture.allOf(running).get(globalTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Global search timeout reached: timeoutMs={}", globalTimeoutMs);
        } catch (ExecutionException e) {
            // Path failures are reported per source below.
            log.debug("A search path completed exceptionally: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for search paths");
        }
    }

    private void collect(SourceType source,
                         CompletableFuture<PathOutcome> future,
                         long budgetMs,
                         long globalTimeoutMs,
                         long startTime,
                         Map<SourceType, Long> finishedAt,
                         Map<SourceType, SourceStatus> statuses,
                         Map<SourceType, List<SearchResult>> resultsBySource) {
        if (future == null) {
            statuses.put(source, SourceStatus.skipped(source));
            return;
        }
        long latencyMs = finishedAt.getOrDefault(source, System.currentTimeMillis()) - startTime;
        SourceStatus.SourceStatusBuilder status = SourceStatus.builder().source(source).latencyMs(latencyMs);

        if (!future.isDone()) {
            // Leave the task running; only stop waiting for it.
            future.cancel(false);
            PathTimeoutException timeout = new PathTimeoutException(source, globalTimeoutMs);
            log.warn("Search path timed out: source={}, reason={}", source, timeout.getMessage());
            statuses.put(source, status.status(StatusCode.TIMEOUT).pathState(PathState.TIMEOUT)
                    .reason(timeout.getMessage()).build());
            return;
        }

        try {
            PathOutcome outcome = future.join();
            resultsBySource.put(source, outcome.results());
            PathState pathState = outcome.status() == StatusCode.FAILED ? PathState.FAILED : PathState.DONE;
            statuses.put(source, status.status(outcome.status()).pathState(pathState)
                    .reason(outcome.reason()).resultCount(outcome.results().size()).build());
        } catch (CancellationException e) {
            statuses.put(source, status.status(StatusCode.TIMEOUT).pathState(PathState.TIMEOUT)
                    .reason(new PathTimeoutException(source, budgetMs).getMessage()).build());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                PathTimeoutException timeout = new PathTimeoutException(source, budgetMs);
                log.warn("Search path timed out: source={}, reason={}", source, timeout.getMessage());
                statuses.put(source, status.status(StatusCode.TIMEOUT).pathState(PathState.TIMEOUT)
                        .reason(timeout.getMessage()).build());
                return;
            }
            log.warn("Search path failed: source={}, error={}, reason={}",
                    source, cause.getClass().getSimpleName(), cause.getMessage());
            statuses.put(source, status.status(StatusCode.FAILED).pathState(PathState.FAILED)
                    .reason(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                    .build());
        }
    }

    private static <T> Supplier<T> withMdc(Map<String, String> context, Supplier<T> task) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            } else {
                MDC.clear();
            }
            try {
                return task.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}

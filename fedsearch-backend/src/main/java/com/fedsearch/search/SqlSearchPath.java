package com.fedsearch.search;

import com.fedsearch.cache.CacheEntry;
import com.fedsearch.cache.CacheKeys;
import com.fedsearch.cache.Page;
import com.fedsearch.cache.QueryCacheManager;
import com.fedsearch.connection.ConnectionDescriptor;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.sql.GeneratedQuery;
import com.fedsearch.sql.QueryRejectedException;
import com.fedsearch.sql.SqlGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQL retrieval path: generate and validate SQL per connection, then read the result through
 * the cache. Connections are independent; one that fails does not stop the others. A query that
 * returns no rows yields no result and is named in the status reason.
 */
@Slf4j
@Component
public class SqlSearchPath {

    private final SqlGenerator sqlGenerator;
    private final QueryCacheManager cache;
    private final ConnectionProvider connectionProvider;

    public SqlSearchPath(SqlGenerator sqlGenerator, QueryCacheManager cache, ConnectionProvider connectionProvider) {
        this.sqlGenerator = sqlGenerator;
        this.cache = cache;
        this.connectionProvider = connectionProvider;
    }

    PathOutcome search(String nlQuery, List<String> connectionIds, int pageSize) {
        if (connectionIds.isEmpty()) {
            return new PathOutcome(List.of(), StatusCode.FAILED, "no connections configured");
        }

        List<SearchResult> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        for (String connectionId : connectionIds) {
            try {
                GeneratedQuery query = sqlGenerator.generate(nlQuery, connectionId);
                ExecutedQuery executed = execute(query, pageSize);
                if (executed.entry().getRowCount() == 0) {
                    log.debug("SQL path returned no rows: connection={}, sql={}", connectionId, query.getSqlText());
                    empty.add(connectionId);
                    continue;
                }
                results.add(toResult(executed, results.size() + 1));
            } catch (RuntimeException e) {
                log.warn("SQL path failed for connection: connection={}, error={}, reason={}",
                        connectionId, e.getClass().getSimpleName(), e.getMessage());
                failures.add(connectionId + ": " + e.getMessage());
            }
        }

        String noRows = empty.isEmpty() ? null : "no rows from " + String.join(", ", empty);
        if (!failures.isEmpty()) {
            String reason = String.join("; ", failures) + (noRows != null ? "; " + noRows : "");
            return new PathOutcome(results, results.isEmpty() && empty.isEmpty() ? StatusCode.FAILED : StatusCode.DEGRADED,
                    reason);
        }
        return new PathOutcome(results, StatusCode.OK, noRows);
    }

    /**
     * Run an accepted query through the cache.
     *
     * @param query generated query
     * @param pageSize size of the returned first page, or 0 for the cache default
     * @return cached result and its first page
     * @throws QueryRejectedException if the query was not accepted
     */
    public ExecutedQuery execute(GeneratedQuery query, int pageSize) {
        if (!query.isAccepted()) {
            throw new QueryRejectedException(query.getConnectionId(), query.getSqlText(), query.getReason());
        }
        String connectionId = query.getConnectionId();
        ConnectionDescriptor connection = connectionProvider.descriptor(connectionId);
        String sql = query.getSqlText();
        String key = CacheKeys.forQuery(connectionId, sql, List.of());

        CacheEntry entry = cache.getOrProduce(key, connectionId, sql,
                () -> connectionProvider.execute(connectionId, sql, List.of(), connection.getRowLimit()),
                connection.getCacheTtl());
        Page firstPage = cache.readPage(entry, 1, pageSize);
        return new ExecutedQuery(query, entry, firstPage);
    }

    private static SearchResult toResult(ExecutedQuery executed, int rank) {
        GeneratedQuery query = executed.query();
        CacheEntry entry = executed.entry();
        Page page = executed.firstPage();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("connection_id", query.getConnectionId());
        payload.put("sql", query.getSqlText());
        payload.put("method", query.getMethod().name());
        payload.put("tables", query.getTables());
        payload.put("cache_key", entry.getKey());
        payload.put("columns", entry.getColumns());
        payload.put("row_count", entry.getRowCount());
        payload.put("truncated", entry.isTruncated());
        payload.put("page_size", page.getPageSize());
        payload.put("total_pages", page.getTotalPages());
        payload.put("rows", page.getRows());
        if (!query.getWarnings().isEmpty()) {
            payload.put("warnings", query.getWarnings());
        }

        return SearchResult.builder()
                .source(SourceType.SQL)
                .rawScore(query.getConfidence() * query.getRelevance())
                .payload(payload)
                .originId(entry.getKey())
                .rank(rank)
                .build();
    }
}

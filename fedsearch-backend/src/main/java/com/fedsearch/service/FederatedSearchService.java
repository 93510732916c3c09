package com.fedsearch.service;

import com.fedsearch.cache.CacheEntrySummary;
import com.fedsearch.cache.CacheStats;
import com.fedsearch.cache.Page;
import com.fedsearch.cache.QueryCacheManager;
import com.fedsearch.connection.ConnectionDescriptor;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.schema.SchemaIndexService;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.SchemaStatistics;
import com.fedsearch.schema.TableMatch;
import com.fedsearch.search.ExecutedQuery;
import com.fedsearch.search.ExportFormat;
import com.fedsearch.search.ResultExporter;
import com.fedsearch.search.SearchCoordinator;
import com.fedsearch.search.SearchOptions;
import com.fedsearch.search.SearchResponse;
import com.fedsearch.search.SqlSearchPath;
import com.fedsearch.sql.GeneratedQuery;
import com.fedsearch.sql.SqlGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers of the engine, used by the REST controller.
 */
@Slf4j
@Service
public class FederatedSearchService {

    private final SearchCoordinator coordinator;
    private final SqlGenerator sqlGenerator;
    private final SqlSearchPath sqlPath;
    private final SchemaIndexService schemaIndex;
    private final QueryCacheManager cache;
    private final ConnectionProvider connectionProvider;
    private final ResultExporter exporter;

    public FederatedSearchService(SearchCoordinator coordinator,
                                  SqlGenerator sqlGenerator,
                                  SqlSearchPath sqlPath,
                                  SchemaIndexService schemaIndex,
                                  QueryCacheManager cache,
                                  ConnectionProvider connectionProvider,
                                  ResultExporter exporter) {
        this.coordinator = coordinator;
        this.sqlGenerator = sqlGenerator;
        this.sqlPath = sqlPath;
        this.schemaIndex = schemaIndex;
        this.cache = cache;
        this.connectionProvider = connectionProvider;
        this.exporter = exporter;
    }

    public SearchResponse search(String nlQuery, SearchOptions options) {
        return coordinator.search(nlQuery, options);
    }

    /**
     * Generate SQL without running it. Rejections are reported on the verdict.
     */
    public GeneratedQuery generateSql(String nlQuery, String connectionId) {
        return sqlGenerator.generate(nlQuery, connectionId);
    }

    /**
     * Generate SQL and run it through the cache.
     *
     * @throws com.fedsearch.sql.QueryRejectedException if the generated query was rejected
     */
    public ExecutedQuery generateAndExecute(String nlQuery, String connectionId, int pageSize) {
        return sqlPath.execute(sqlGenerator.generate(nlQuery, connectionId), pageSize);
    }

    public SchemaSnapshot indexSchema(String connectionId) {
        return schemaIndex.indexSchema(connectionId);
    }

    /**
     * Re-introspect a connection and swap in a new snapshot if its structure changed. Cached
     * results of a drifted connection are dropped.
     *
     * @return true if drift was detected
     */
    public boolean refreshSchema(String connectionId) {
        boolean drifted = schemaIndex.refreshIfDrifted(connectionId);
        if (drifted) {
            int dropped = cache.invalidateConnection(connectionId);
            log.info("Schema drift handled: connection={}, cacheEntriesDropped={}", connectionId, dropped);
        }
        return drifted;
    }

    public SchemaSnapshot schemaSnapshot(String connectionId) {
        return schemaIndex.snapshotFor(connectionId);
    }

    /**
     * Tables of a connection that have all of the given columns.
     */
    public List<TableMatch> tablesWithColumns(String connectionId, List<String> columnNames) {
        return schemaIndex.findTablesWithColumns(connectionId, columnNames);
    }

    public EngineStatistics statistics() {
        SchemaStatistics schema = schemaIndex.statistics();
        return EngineStatistics.builder()
                .configuredConnections(connectionProvider.listConnections().size())
                .indexedConnections(List.copyOf(schema.getConnections().keySet()))
                .schema(schema)
                .cache(cache.stats())
                .build();
    }

    /**
     * Invalidate by key, by connection, or everything when both are null.
     *
     * @return number of entries removed
     */
    public int invalidateCache(String connectionId, String key) {
        if (key != null && !key.isBlank()) {
            return cache.invalidateKey(key) ? 1 : 0;
        }
        if (connectionId != null && !connectionId.isBlank()) {
            connectionProvider.descriptor(connectionId);
            return cache.invalidateConnection(connectionId);
        }
        return cache.invalidateAll();
    }

    public Optional<Page> page(String key, int pageNumber, int pageSize) {
        return cache.page(key, pageNumber, pageSize);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public List<CacheEntrySummary> cachedQueries(String connectionId) {
        return cache.entries(connectionId);
    }

    public String exportResults(SearchResponse response, ExportFormat format) {
        return exporter.export(response, format);
    }

    public List<ConnectionDescriptor> connections() {
        return connectionProvider.listConnections();
    }
}

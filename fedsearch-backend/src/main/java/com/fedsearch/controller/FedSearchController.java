package com.fedsearch.controller;

import com.fedsearch.api.CacheEntriesResponse;
import com.fedsearch.api.ConnectionsResponse;
import com.fedsearch.api.ErrorResponse;
import com.fedsearch.api.GenerateSqlRequest;
import com.fedsearch.api.GenerateSqlResponse;
import com.fedsearch.api.InvalidateResponse;
import com.fedsearch.api.SchemaIndexResponse;
import com.fedsearch.api.SchemaTablesResponse;
import com.fedsearch.api.SearchRequest;
import com.fedsearch.cache.CacheStats;
import com.fedsearch.cache.Page;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.search.ExecutedQuery;
import com.fedsearch.search.ExportFormat;
import com.fedsearch.search.SearchResponse;
import com.fedsearch.service.EngineStatistics;
import com.fedsearch.service.FederatedSearchService;
import com.fedsearch.sql.GeneratedQuery;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/v1")
public class FedSearchController {

    private static final Logger log = LoggerFactory.getLogger(FedSearchController.class);
    private static final String TRACE_ID = "trace_id";

    private final FederatedSearchService searchService;

    public FedSearchController(FederatedSearchService searchService) {
        this.searchService = searchService;
    }

    /**
     * Run a federated search over the SQL and document paths.
     *
     * POST /v1/search
     *
     * @param request query and options
     * @return fused results with a status per source
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.info("Search requested: trace_id={}, sql={}, docs={}",
                MDC.get(TRACE_ID), request.getSearchSql(), request.getSearchDocs());
        return ResponseEntity.ok(searchService.search(request.getQuery(), request.toOptions()));
    }

    /**
     * Run a search and download its results.
     *
     * POST /v1/search/export?format=csv|json
     */
    @PostMapping("/search/export")
    public ResponseEntity<String> export(@Valid @RequestBody SearchRequest request,
                                         @RequestParam(value = "format", required = false) String format) {
        ExportFormat exportFormat = ExportFormat.parse(format);
        SearchResponse response = searchService.search(request.getQuery(), request.toOptions());
        String body = searchService.exportResults(response, exportFormat);
        MediaType contentType = exportFormat == ExportFormat.CSV
                ? new MediaType("text", "csv")
                : MediaType.APPLICATION_JSON;
        String filename = "search_results." + exportFormat.name().toLowerCase(Locale.ROOT);
        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }

    /**
     * Generate SQL from natural language for one connection, optionally running it.
     *
     * POST /v1/sql/generate
     *
     * @param request query, connection id and execute flag
     * @return generated query, plus the first page of rows when executed
     */
    @PostMapping("/sql/generate")
    public ResponseEntity<GenerateSqlResponse> generateSql(@Valid @RequestBody GenerateSqlRequest request) {
        GenerateSqlResponse.GenerateSqlResponseBuilder response = GenerateSqlResponse.builder()
                .traceId(MDC.get(TRACE_ID));
        if (request.isExecute()) {
            int pageSize = request.getPageSize() == null ? 0 : request.getPageSize();
            ExecutedQuery executed = searchService.generateAndExecute(
                    request.getQuery(), request.getConnectionId(), pageSize);
            return ResponseEntity.ok(response
                    .generated(executed.query())
                    .firstPage(executed.firstPage())
                    .build());
        }
        GeneratedQuery generated = searchService.generateSql(request.getQuery(), request.getConnectionId());
        return ResponseEntity.ok(response.generated(generated).build());
    }

    /**
     * Index (or re-index) the schema of a connection.
     *
     * POST /v1/schema/{connection_id}/index
     */
    @PostMapping("/schema/{connection_id}/index")
    public ResponseEntity<SchemaIndexResponse> indexSchema(@PathVariable("connection_id") String connectionId) {
        SchemaSnapshot snapshot = searchService.indexSchema(connectionId);
        return ResponseEntity.ok(toSchemaResponse(snapshot, null));
    }

    /**
     * Re-introspect a connection and swap the snapshot only if its structure changed.
     *
     * POST /v1/schema/{connection_id}/refresh
     */
    @PostMapping("/schema/{connection_id}/refresh")
    public ResponseEntity<SchemaIndexResponse> refreshSchema(@PathVariable("connection_id") String connectionId) {
        boolean drifted = searchService.refreshSchema(connectionId);
        return ResponseEntity.ok(toSchemaResponse(searchService.schemaSnapshot(connectionId), drifted));
    }

    /**
     * Current schema snapshot of a connection, indexing it first if needed.
     *
     * GET /v1/schema/{connection_id}
     */
    @GetMapping("/schema/{connection_id}")
    public ResponseEntity<SchemaIndexResponse> schema(@PathVariable("connection_id") String connectionId) {
        return ResponseEntity.ok(toSchemaResponse(searchService.schemaSnapshot(connectionId), null));
    }

    /**
     * Tables that have all of the given columns.
     *
     * GET /v1/schema/{connection_id}/tables?columns=customer_id,total
     */
    @GetMapping("/schema/{connection_id}/tables")
    public ResponseEntity<SchemaTablesResponse> tablesWithColumns(
            @PathVariable("connection_id") String connectionId,
            @RequestParam("columns") List<String> columns) {
        return ResponseEntity.ok(SchemaTablesResponse.builder()
                .connectionId(connectionId)
                .columns(columns)
                .tables(searchService.tablesWithColumns(connectionId, columns))
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * Invalidate cached results by key, by connection, or all of them.
     *
     * DELETE /v1/cache?connection_id=...
     * DELETE /v1/cache?key=...
     * DELETE /v1/cache
     */
    @DeleteMapping("/cache")
    public ResponseEntity<InvalidateResponse> invalidateCache(
            @RequestParam(value = "connection_id", required = false) String connectionId,
            @RequestParam(value = "key", required = false) String key) {
        int invalidated = searchService.invalidateCache(connectionId, key);
        String scope = key != null && !key.isBlank() ? "key"
                : connectionId != null && !connectionId.isBlank() ? "connection" : "all";
        String target = "key".equals(scope) ? key : "connection".equals(scope) ? connectionId : null;
        log.info("Cache invalidated: scope={}, target={}, invalidated={}, trace_id={}",
                scope, target, invalidated, MDC.get(TRACE_ID));
        return ResponseEntity.ok(InvalidateResponse.builder()
                .scope(scope)
                .target(target)
                .invalidated(invalidated)
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * Read one page of a cached result.
     *
     * GET /v1/cache/pages?key=...&page=...&page_size=...
     */
    @GetMapping("/cache/pages")
    public ResponseEntity<?> page(@RequestParam("key") String key,
                                  @RequestParam(value = "page", defaultValue = "1") int page,
                                  @RequestParam(value = "page_size", defaultValue = "0") int pageSize) {
        Optional<Page> result = searchService.page(key, page, pageSize);
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                    .code("CACHE_MISS")
                    .message("No cached result for key: " + key)
                    .traceId(MDC.get(TRACE_ID))
                    .build());
        }
        return ResponseEntity.ok(result.get());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(searchService.cacheStats());
    }

    @GetMapping("/cache/entries")
    public ResponseEntity<CacheEntriesResponse> cacheEntries(
            @RequestParam(value = "connection_id", required = false) String connectionId) {
        return ResponseEntity.ok(CacheEntriesResponse.builder()
                .entries(searchService.cachedQueries(connectionId))
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * GET /v1/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<EngineStatistics> statistics() {
        return ResponseEntity.ok(searchService.statistics());
    }

    @GetMapping("/connections")
    public ResponseEntity<ConnectionsResponse> connections() {
        return ResponseEntity.ok(ConnectionsResponse.builder()
                .connections(searchService.connections())
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    private static SchemaIndexResponse toSchemaResponse(SchemaSnapshot snapshot, Boolean drifted) {
        return SchemaIndexResponse.builder()
                .connectionId(snapshot.getConnectionId())
                .tables(snapshot.tableNames())
                .errors(snapshot.getErrors())
                .indexedAt(snapshot.getIndexedAt())
                .fingerprint(snapshot.getFingerprint())
                .drifted(drifted)
                .traceId(MDC.get(TRACE_ID))
                .build();
    }
}

package com.fedsearch.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fedsearch.cache.CacheStats;
import com.fedsearch.cache.Page;
import com.fedsearch.connection.QueryExecutionException;
import com.fedsearch.connection.UnknownConnectionException;
import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.SchemaStatistics;
import com.fedsearch.schema.TableIntrospectionError;
import com.fedsearch.schema.TableMatch;
import com.fedsearch.search.ExportFormat;
import com.fedsearch.search.InvocationState;
import com.fedsearch.search.PathState;
import com.fedsearch.search.SearchOptions;
import com.fedsearch.search.SearchResponse;
import com.fedsearch.search.SearchResult;
import com.fedsearch.search.SourceStatus;
import com.fedsearch.search.SourceType;
import com.fedsearch.search.StatusCode;
import com.fedsearch.service.EngineStatistics;
import com.fedsearch.service.FederatedSearchService;
import com.fedsearch.sql.GeneratedQuery;
import com.fedsearch.sql.GenerationMethod;
import com.fedsearch.sql.QueryRejectedException;
import com.fedsearch.sql.Verdict;
import com.fedsearch.testsupport.Schemas;
import com.fedsearch.web.GlobalExceptionHandler;
import com.fedsearch.web.TraceIdFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("FedSearchController")
class FedSearchControllerTest {

    private FederatedSearchService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(FederatedSearchService.class);
        ObjectMapper objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .registerModule(new JavaTimeModule());
        mockMvc = MockMvcBuilders.standaloneSetup(new FedSearchController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new StringHttpMessageConverter(StandardCharsets.UTF_8),
                        new MappingJackson2HttpMessageConverter(objectMapper))
                .addFilters(new TraceIdFilter())
                .build();
    }

    private static SearchResponse sampleResponse() {
        return SearchResponse.builder()
                .query("refund policy")
                .results(List.of(SearchResult.builder()
                        .source(SourceType.DOC)
                        .rawScore(0.83)
                        .normalizedScore(1.0)
                        .payload(Map.of("doc_id", "doc-1", "content", "Refunds take five days"))
                        .originId("doc-1")
                        .rank(1)
                        .build()))
                .sourceStatuses(Map.of(
                        SourceType.DOC, SourceStatus.builder().source(SourceType.DOC).status(StatusCode.OK)
                                .pathState(PathState.DONE).resultCount(1).build(),
                        SourceType.SQL, SourceStatus.builder().source(SourceType.SQL).status(StatusCode.TIMEOUT)
                                .pathState(PathState.TIMEOUT).reason("SQL path exceeded its 25000ms budget").build()))
                .state(InvocationState.RETURNED)
                .totalLatencyMs(42)
                .build();
    }

    @Nested
    @DisplayName("POST /v1/search")
    class Search {

        @Test
        @DisplayName("returns fused results with per-source statuses")
        void search() throws Exception {
            when(service.search(eq("refund policy"), any(SearchOptions.class))).thenReturn(sampleResponse());

            mockMvc.perform(post("/v1/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"refund policy\", \"search_sql\": false, \"top_k\": 5}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("RETURNED"))
                    .andExpect(jsonPath("$.results[0].origin_id").value("doc-1"))
                    .andExpect(jsonPath("$.results[0].normalized_score").value(1.0))
                    .andExpect(jsonPath("$.source_statuses.SQL.status").value("TIMEOUT"))
                    .andExpect(jsonPath("$.source_statuses.DOC.result_count").value(1));

            ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
            verify(service).search(eq("refund policy"), options.capture());
            assertThat(options.getValue().isSearchSql()).isFalse();
            assertThat(options.getValue().isSearchDocs()).isTrue();
            assertThat(options.getValue().getTopK()).isEqualTo(5);
        }

        @Test
        @DisplayName("rejects a blank query")
        void blankQuery() throws Exception {
            mockMvc.perform(post("/v1/search")
                            .header("X-Request-Id", "req-7")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.details").value("query: Query is required"))
                    .andExpect(jsonPath("$.trace_id").value("req-7"));
        }

        @Test
        @DisplayName("rejects a non-positive top_k")
        void invalidTopK() throws Exception {
            mockMvc.perform(post("/v1/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"orders\", \"top_k\": 0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.details").value("topK: top_k must be positive"));
        }

        @Test
        @DisplayName("rejects malformed JSON")
        void malformed() throws Exception {
            mockMvc.perform(post("/v1/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("exports results as CSV")
        void exportCsv() throws Exception {
            SearchResponse response = sampleResponse();
            when(service.search(eq("refund policy"), any(SearchOptions.class))).thenReturn(response);
            when(service.exportResults(response, ExportFormat.CSV))
                    .thenReturn("_source,_origin_id,_relevance,content\r\nDOC,doc-1,1.0,Refunds take five days\r\n");

            mockMvc.perform(post("/v1/search/export")
                            .param("format", "csv")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"refund policy\"}"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith("text/csv"))
                    .andExpect(header().string("Content-Disposition", "attachment; filename=\"search_results.csv\""))
                    .andExpect(content().string(containsString("DOC,doc-1,1.0")));
        }

        @Test
        @DisplayName("rejects unknown export formats")
        void exportUnknownFormat() throws Exception {
            mockMvc.perform(post("/v1/search/export")
                            .param("format", "xml")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"refund policy\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        }
    }

    @Nested
    @DisplayName("POST /v1/sql/generate")
    class GenerateSql {

        private final GeneratedQuery accepted = GeneratedQuery.builder()
                .nlText("how many customers")
                .connectionId("shop")
                .sqlText("SELECT COUNT(*) FROM customers LIMIT 100")
                .method(GenerationMethod.RULE_BASED)
                .verdict(Verdict.ACCEPTED)
                .table("customers")
                .confidence(0.7)
                .build();

        @Test
        @DisplayName("returns the generated query")
        void generate() throws Exception {
            when(service.generateSql("how many customers", "shop")).thenReturn(accepted);

            mockMvc.perform(post("/v1/sql/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"how many customers\", \"connection_id\": \"shop\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.generated.sql_text").value("SELECT COUNT(*) FROM customers LIMIT 100"))
                    .andExpect(jsonPath("$.generated.verdict").value("ACCEPTED"))
                    .andExpect(jsonPath("$.generated.method").value("RULE_BASED"))
                    .andExpect(jsonPath("$.first_page").doesNotExist());
        }

        @Test
        @DisplayName("answers 422 when an executed query is rejected")
        void rejected() throws Exception {
            when(service.generateAndExecute(eq("drop the orders"), eq("shop"), anyInt()))
                    .thenThrow(new QueryRejectedException("shop", "DROP TABLE orders", "forbidden keyword: DROP"));

            mockMvc.perform(post("/v1/sql/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"drop the orders\", \"connection_id\": \"shop\", \"execute\": true}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.code").value("QUERY_REJECTED"))
                    .andExpect(jsonPath("$.message").value("forbidden keyword: DROP"))
                    .andExpect(jsonPath("$.connection_id").value("shop"))
                    .andExpect(jsonPath("$.sql").value("DROP TABLE orders"))
                    .andExpect(jsonPath("$.details").doesNotExist());
        }

        @Test
        @DisplayName("answers 404 for an unknown connection")
        void unknownConnection() throws Exception {
            when(service.generateSql("orders", "crm")).thenThrow(new UnknownConnectionException("crm"));

            mockMvc.perform(post("/v1/sql/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"orders\", \"connection_id\": \"crm\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("UNKNOWN_CONNECTION"))
                    .andExpect(jsonPath("$.message").value("Unknown connection: crm"))
                    .andExpect(jsonPath("$.connection_id").value("crm"));
        }

        @Test
        @DisplayName("answers 502 when the backend fails")
        void executionError() throws Exception {
            when(service.generateAndExecute(eq("orders"), eq("shop"), anyInt()))
                    .thenThrow(new QueryExecutionException("shop", "Query failed on connection shop: timeout"));

            mockMvc.perform(post("/v1/sql/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"orders\", \"connection_id\": \"shop\", \"execute\": true}"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.code").value("EXECUTION_ERROR"))
                    .andExpect(jsonPath("$.connection_id").value("shop"));
        }
    }

    @Nested
    @DisplayName("cache endpoints")
    class Cache {

        @Test
        @DisplayName("returns a cached page")
        void page() throws Exception {
            when(service.page("shop:abc", 2, 10)).thenReturn(Optional.of(Page.builder()
                    .key("shop:abc")
                    .pageNumber(2)
                    .pageSize(10)
                    .totalRows(15)
                    .totalPages(2)
                    .hasPrevious(true)
                    .rows(List.of(Map.of("id", 11)))
                    .build()));

            mockMvc.perform(get("/v1/cache/pages").param("key", "shop:abc").param("page", "2").param("page_size", "10"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.page_number").value(2))
                    .andExpect(jsonPath("$.has_next").value(false))
                    .andExpect(jsonPath("$.rows[0].id").value(11));
        }

        @Test
        @DisplayName("answers 404 on a cache miss")
        void miss() throws Exception {
            when(service.page("gone", 1, 0)).thenReturn(Optional.empty());

            mockMvc.perform(get("/v1/cache/pages").param("key", "gone"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("CACHE_MISS"));
        }

        @Test
        @DisplayName("answers 400 for a page out of range")
        void outOfRange() throws Exception {
            when(service.page("shop:abc", 9, 0))
                    .thenThrow(new IllegalArgumentException("Page 9 out of range (total_pages=2)"));

            mockMvc.perform(get("/v1/cache/pages").param("key", "shop:abc").param("page", "9"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Page 9 out of range (total_pages=2)"));
        }

        @Test
        @DisplayName("invalidates by connection")
        void invalidateConnection() throws Exception {
            when(service.invalidateCache("shop", null)).thenReturn(2);

            mockMvc.perform(delete("/v1/cache").param("connection_id", "shop"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.scope").value("connection"))
                    .andExpect(jsonPath("$.target").value("shop"))
                    .andExpect(jsonPath("$.invalidated").value(2));
        }

        @Test
        @DisplayName("invalidates everything without parameters")
        void invalidateAll() throws Exception {
            when(service.invalidateCache(null, null)).thenReturn(5);

            mockMvc.perform(delete("/v1/cache"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.scope").value("all"))
                    .andExpect(jsonPath("$.target").doesNotExist())
                    .andExpect(jsonPath("$.invalidated").value(5));
        }
    }

    @Nested
    @DisplayName("schema and statistics endpoints")
    class SchemaAndStatistics {

        @Test
        @DisplayName("returns the current schema snapshot")
        void schema() throws Exception {
            when(service.schemaSnapshot("shop")).thenReturn(SchemaSnapshot.builder()
                    .connectionId("shop")
                    .table(Schemas.customers())
                    .table(Schemas.orders())
                    .error(new TableIntrospectionError("audit", "permission denied"))
                    .indexedAt(Instant.parse("2024-03-01T10:00:00Z"))
                    .fingerprint("abc")
                    .build());

            mockMvc.perform(get("/v1/schema/shop").header("X-Request-Id", "req-9"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.connection_id").value("shop"))
                    .andExpect(jsonPath("$.tables[0]").value("customers"))
                    .andExpect(jsonPath("$.tables[1]").value("orders"))
                    .andExpect(jsonPath("$.errors[0].table").value("audit"))
                    .andExpect(jsonPath("$.fingerprint").value("abc"))
                    .andExpect(jsonPath("$.drifted").doesNotExist())
                    .andExpect(jsonPath("$.trace_id").value("req-9"));
        }

        @Test
        @DisplayName("finds tables by comma-separated column names")
        void tablesWithColumns() throws Exception {
            when(service.tablesWithColumns("shop", List.of("customer_id", "total")))
                    .thenReturn(List.of(new TableMatch(Schemas.orders(), 0.42)));

            mockMvc.perform(get("/v1/schema/shop/tables").param("columns", "customer_id,total"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.columns[1]").value("total"))
                    .andExpect(jsonPath("$.tables[0].table.name").value("orders"))
                    .andExpect(jsonPath("$.tables[0].relevance").value(0.42));
        }

        @Test
        @DisplayName("answers 404 for tables of an unknown connection")
        void tablesUnknownConnection() throws Exception {
            when(service.tablesWithColumns("crm", List.of("id"))).thenThrow(new UnknownConnectionException("crm"));

            mockMvc.perform(get("/v1/schema/crm/tables").param("columns", "id"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("UNKNOWN_CONNECTION"));
        }

        @Test
        @DisplayName("reports engine statistics")
        void statistics() throws Exception {
            when(service.statistics()).thenReturn(EngineStatistics.builder()
                    .configuredConnections(2)
                    .indexedConnections(List.of("shop"))
                    .schema(SchemaStatistics.builder()
                            .connections(Map.of("shop", SchemaStatistics.ConnectionStatistics.builder()
                                    .tables(2).columns(9).errors(1).build()))
                            .totalTables(2)
                            .totalColumns(9)
                            .build())
                    .cache(CacheStats.builder().entryCount(3).hits(4).misses(1).hitRate(0.8).build())
                    .build());

            mockMvc.perform(get("/v1/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.configured_connections").value(2))
                    .andExpect(jsonPath("$.indexed_connections[0]").value("shop"))
                    .andExpect(jsonPath("$.schema.connections.shop.columns").value(9))
                    .andExpect(jsonPath("$.schema.total_tables").value(2))
                    .andExpect(jsonPath("$.cache.entry_count").value(3))
                    .andExpect(jsonPath("$.cache.hit_rate").value(0.8));
        }
    }
}

package com.fedsearch.schema;

import com.fedsearch.config.FedSearchProperties;
import com.fedsearch.connection.ConnectionDescriptor;
import com.fedsearch.connection.ConnectionProvider;
import com.fedsearch.connection.UnknownConnectionException;
import com.fedsearch.embedding.EmbeddingService;
import com.fedsearch.embedding.HashingEmbeddingService;
import com.fedsearch.embedding.Vectors;
import com.fedsearch.testsupport.MutableClock;
import com.fedsearch.testsupport.Schemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SchemaIndexService")
class SchemaIndexServiceTest {

    private ConnectionProvider provider;
    private MutableClock clock;
    private FedSearchProperties properties;

    @BeforeEach
    void setUp() {
        provider = mock(ConnectionProvider.class);
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        properties = new FedSearchProperties();

        when(provider.descriptor("shop")).thenReturn(ConnectionDescriptor.builder().id("shop").dialect("sqlite").build());
        when(provider.descriptor("nope")).thenThrow(new UnknownConnectionException("nope"));
        when(provider.listTables("shop")).thenReturn(List.of("orders", "customers", "broken"));
        when(provider.describeTable(eq("shop"), eq("customers"), anyInt())).thenReturn(Schemas.customers());
        when(provider.describeTable(eq("shop"), eq("orders"), anyInt())).thenReturn(Schemas.orders());
        when(provider.describeTable(eq("shop"), eq("broken"), anyInt()))
                .thenThrow(new SchemaIntrospectionException("shop", "broken", "permission denied", null));
    }

    private SchemaIndexService service(EmbeddingService embeddings) {
        return new SchemaIndexService(provider, embeddings, properties, clock);
    }

    @Nested
    @DisplayName("indexSchema")
    class IndexSchema {

        @Test
        @DisplayName("records a failing table and keeps the others")
        void partialFailure() {
            SchemaSnapshot snapshot = service(new HashingEmbeddingService(64)).indexSchema("shop");

            assertThat(snapshot.tableNames()).containsExactly("customers", "orders");
            assertThat(snapshot.getErrors()).containsExactly(new TableIntrospectionError("broken", "permission denied"));
            assertThat(snapshot.getConnectionId()).isEqualTo("shop");
            assertThat(snapshot.getIndexedAt()).isEqualTo(clock.instant());
            assertThat(snapshot.getTables()).allSatisfy(table -> {
                assertThat(table.getDescription()).startsWith("table " + table.getName() + ": columns ");
                assertThat(table.getEmbedding()).hasSize(64);
            });
        }

        @Test
        @DisplayName("describes a table with its columns and sample rows")
        void description() {
            TableDescriptor orders = Schemas.orders().toBuilder()
                    .sampleRows(List.of(java.util.Map.of("status", "paid")))
                    .build();

            assertThat(SchemaIndexService.describe(orders)).isEqualTo(
                    "table orders: columns id(INTEGER), customer_id(INTEGER), total(REAL), status(TEXT), "
                            + "created_at(TEXT); sample rows: status=paid");
        }

        @Test
        @DisplayName("records a table whose driver fails unexpectedly")
        void unexpectedFailure() {
            doThrow(new IllegalStateException("driver bug"))
                    .when(provider).describeTable(eq("shop"), eq("broken"), anyInt());

            SchemaSnapshot snapshot = service(new HashingEmbeddingService(64)).indexSchema("shop");

            assertThat(snapshot.tableNames()).containsExactly("customers", "orders");
            assertThat(snapshot.getErrors()).containsExactly(new TableIntrospectionError("broken", "driver bug"));
        }

        @Test
        @DisplayName("surfaces a failure to list tables")
        void listFailure() {
            when(provider.listTables("shop")).thenThrow(new SchemaIntrospectionException("shop", "connection refused", null));

            assertThatThrownBy(() -> service(new HashingEmbeddingService(64)).indexSchema("shop"))
                    .isInstanceOf(SchemaIntrospectionException.class)
                    .hasMessage("connection refused");
        }

        @Test
        @DisplayName("rejects unknown connections")
        void unknownConnection() {
            assertThatThrownBy(() -> service(new HashingEmbeddingService(64)).indexSchema("nope"))
                    .isInstanceOf(UnknownConnectionException.class);
        }
    }

    @Nested
    @DisplayName("findRelevantTables")
    class FindRelevantTables {

        @Test
        @DisplayName("ranks the table sharing the most terms first")
        void ranking() {
            SchemaIndexService index = service(new KeywordEmbedding());

            List<TableMatch> matches = index.findRelevantTables("order totals by status", "shop", 3);

            assertThat(matches).isNotEmpty();
            assertThat(matches.get(0).table().getName()).isEqualTo("orders");
            assertThat(matches).allSatisfy(m -> assertThat(m.relevance()).isBetween(0.0, 1.0));
        }

        @Test
        @DisplayName("returns nothing when no table is relevant")
        void noMatch() {
            assertThat(service(new KeywordEmbedding()).findRelevantTables("weather", "shop", 3)).isEmpty();
        }

        @Test
        @DisplayName("orders ties by table name and honours topK")
        void tiesAndTopK() {
            SchemaIndexService index = service(new KeywordEmbedding());

            List<TableMatch> both = index.findRelevantTables("customer order", "shop", 3);
            List<TableMatch> one = index.findRelevantTables("customer order", "shop", 1);

            assertThat(both).extracting(m -> m.table().getName()).containsExactly("customers", "orders");
            assertThat(both.get(0).relevance()).isEqualTo(both.get(1).relevance());
            assertThat(one).extracting(m -> m.table().getName()).containsExactly("customers");
        }

        @Test
        @DisplayName("works with the hashing embedding")
        void hashingEmbedding() {
            List<TableMatch> matches = service(new HashingEmbeddingService(384))
                    .findRelevantTables("orders with total and status", "shop", 3);

            assertThat(matches.get(0).table().getName()).isEqualTo("orders");
        }
    }

    @Nested
    @DisplayName("findTablesWithColumns")
    class FindTablesWithColumns {

        @Test
        @DisplayName("keeps only tables that have every column")
        void allColumns() {
            List<TableMatch> matches = service(new HashingEmbeddingService(64))
                    .findTablesWithColumns("shop", List.of("id", "STATUS"));

            assertThat(matches).extracting(m -> m.table().getName()).containsExactly("orders");
            assertThat(matches.get(0).relevance()).isBetween(0.0, 1.0);
        }

        @Test
        @DisplayName("returns every table sharing a common column")
        void sharedColumn() {
            List<TableMatch> matches = service(new HashingEmbeddingService(64))
                    .findTablesWithColumns("shop", List.of(" id "));

            assertThat(matches).extracting(m -> m.table().getName()).containsExactlyInAnyOrder("customers", "orders");
        }

        @Test
        @DisplayName("returns nothing for unknown or blank columns")
        void noMatch() {
            SchemaIndexService index = service(new HashingEmbeddingService(64));

            assertThat(index.findTablesWithColumns("shop", List.of("salary"))).isEmpty();
            assertThat(index.findTablesWithColumns("shop", List.of(" "))).isEmpty();
        }
    }

    @Nested
    @DisplayName("statistics")
    class Statistics {

        @Test
        @DisplayName("is empty before anything is indexed")
        void empty() {
            SchemaStatistics stats = service(new KeywordEmbedding()).statistics();

            assertThat(stats.getConnections()).isEmpty();
            assertThat(stats.getTotalTables()).isZero();
            verify(provider, never()).listTables("shop");
        }

        @Test
        @DisplayName("counts tables, columns and errors per connection")
        void counts() {
            SchemaIndexService index = service(new KeywordEmbedding());
            index.indexSchema("shop");

            SchemaStatistics stats = index.statistics();

            assertThat(stats.getConnections()).containsOnlyKeys("shop");
            SchemaStatistics.ConnectionStatistics shop = stats.getConnections().get("shop");
            assertThat(shop.getTables()).isEqualTo(2);
            assertThat(shop.getColumns()).isEqualTo(9);
            assertThat(shop.getErrors()).isEqualTo(1);
            assertThat(shop.getIndexedAt()).isEqualTo(clock.instant());
            assertThat(shop.isExpired()).isFalse();
            assertThat(stats.getTotalTables()).isEqualTo(2);
            assertThat(stats.getTotalColumns()).isEqualTo(9);
        }

        @Test
        @DisplayName("flags snapshots past their TTL")
        void expired() {
            SchemaIndexService index = service(new KeywordEmbedding());
            index.indexSchema("shop");
            clock.advance(Duration.ofHours(2));

            assertThat(index.statistics().getConnections().get("shop").isExpired()).isTrue();
        }
    }

    @Nested
    @DisplayName("snapshot lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("indexes lazily and reuses the snapshot within its TTL")
        void lazyAndCached() {
            SchemaIndexService index = service(new KeywordEmbedding());

            SchemaSnapshot first = index.snapshotFor("shop");
            clock.advance(Duration.ofMinutes(30));
            SchemaSnapshot second = index.snapshotFor("shop");

            assertThat(second).isSameAs(first);
            verify(provider, times(1)).listTables("shop");
        }

        @Test
        @DisplayName("re-indexes after the TTL")
        void expires() {
            SchemaIndexService index = service(new KeywordEmbedding());

            SchemaSnapshot first = index.snapshotFor("shop");
            clock.advance(Duration.ofHours(2));
            SchemaSnapshot second = index.snapshotFor("shop");

            assertThat(second).isNotSameAs(first);
            verify(provider, times(2)).listTables("shop");
        }

        @Test
        @DisplayName("swaps the snapshot only when the structure drifted")
        void drift() {
            SchemaIndexService index = service(new KeywordEmbedding());
            SchemaSnapshot original = index.indexSchema("shop");

            assertThat(index.refreshIfDrifted("shop")).isFalse();
            assertThat(index.currentSnapshot("shop")).containsSame(original);

            when(provider.describeTable(eq("shop"), eq("orders"), anyInt())).thenReturn(
                    Schemas.table("orders", "id", "INTEGER", "customer_id", "INTEGER", "total", "REAL",
                            "status", "TEXT", "created_at", "TEXT", "currency", "TEXT"));

            assertThat(index.refreshIfDrifted("shop")).isTrue();
            SchemaSnapshot refreshed = index.currentSnapshot("shop").orElseThrow();
            assertThat(refreshed.getFingerprint()).isNotEqualTo(original.getFingerprint());
            assertThat(refreshed.findTable("orders").orElseThrow().columnNames()).contains("currency");
        }

        @Test
        @DisplayName("drops the snapshot on invalidate")
        void invalidate() {
            SchemaIndexService index = service(new KeywordEmbedding());
            index.indexSchema("shop");

            index.invalidate("shop");

            assertThat(index.currentSnapshot("shop")).isEmpty();
        }
    }

    /**
     * One dimension per whole-word keyword, so relevance is fully predictable.
     * {@code customer_id} stays a single token and does not count as "customer".
     */
    private static class KeywordEmbedding implements EmbeddingService {

        private static final List<String> KEYWORDS = List.of("customer", "order", "weather");

        @Override
        public float[] embed(String text) {
            float[] v = new float[KEYWORDS.size()];
            for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z_]+")) {
                String singular = token.endsWith("s") ? token.substring(0, token.length() - 1) : token;
                int i = KEYWORDS.indexOf(singular);
                if (i >= 0) {
                    v[i] = 1.0f;
                }
            }
            return Vectors.normalize(v);
        }

        @Override
        public int dimension() {
            return KEYWORDS.size();
        }
    }
}

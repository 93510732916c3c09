package com.fedsearch.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResultExporter")
class ResultExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResultExporter exporter = new ResultExporter(objectMapper);

    private static SearchResponse response() {
        Map<String, Object> row1 = new LinkedHashMap<>();
        row1.put("id", 1);
        row1.put("city", "London, UK");
        Map<String, Object> row2 = new LinkedHashMap<>();
        row2.put("id", 2);
        row2.put("city", "Paris");

        Map<String, Object> sqlPayload = new LinkedHashMap<>();
        sqlPayload.put("connection_id", "shop");
        sqlPayload.put("sql", "SELECT id, city FROM customers LIMIT 100");
        sqlPayload.put("row_count", 2);
        sqlPayload.put("rows", List.of(row1, row2));

        Map<String, Object> docPayload = new LinkedHashMap<>();
        docPayload.put("doc_id", "doc-1");
        docPayload.put("content", "Refunds take \"5\" days");
        docPayload.put("category", "policy");

        return SearchResponse.builder()
                .query("customers")
                .results(List.of(
                        SearchResult.builder().source(SourceType.SQL).rawScore(0.42).normalizedScore(1.0)
                                .payload(sqlPayload).originId("shop:k1").rank(1).build(),
                        SearchResult.builder().source(SourceType.DOC).rawScore(0.8).normalizedScore(0.5)
                                .payload(docPayload).originId("doc-1").rank(1).build()))
                .state(InvocationState.RETURNED)
                .build();
    }

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("writes one line per SQL row and per document")
        void lines() {
            String csv = exporter.export(response(), ExportFormat.CSV);

            assertThat(csv.split("\r\n")).containsExactly(
                    "_source,_origin_id,_relevance,id,city,content",
                    "SQL,shop:k1,1.0,1,\"London, UK\",",
                    "SQL,shop:k1,1.0,2,Paris,",
                    "DOC,doc-1,0.5,,,\"Refunds take \"\"5\"\" days\"");
        }

        @Test
        @DisplayName("writes only the header for an empty response")
        void empty() {
            SearchResponse empty = SearchResponse.builder().query("x").results(List.of()).build();

            assertThat(exporter.export(empty, ExportFormat.CSV)).isEqualTo("_source,_origin_id,_relevance\r\n");
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @CsvSource(delimiter = '|', value = {
                "plain|plain",
                "a,b|\"a,b\"",
                "say \"hi\"|\"say \"\"hi\"\"\""
        })
        @DisplayName("quotes fields that need it")
        void quoting(String value, String expected) {
            assertThat(ResultExporter.csvField(value)).isEqualTo(expected);
        }

        @Test
        @DisplayName("quotes fields containing line breaks")
        void lineBreaks() {
            assertThat(ResultExporter.csvField("line1\nline2")).isEqualTo("\"line1\nline2\"");
            assertThat(ResultExporter.csvField(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("separates data from metadata")
        void shape() throws Exception {
            JsonNode items = objectMapper.readTree(exporter.export(response(), ExportFormat.JSON));

            assertThat(items.isArray()).isTrue();
            assertThat(items).hasSize(2);

            JsonNode sql = items.get(0);
            assertThat(sql.get("source").asText()).isEqualTo("SQL");
            assertThat(sql.get("origin_id").asText()).isEqualTo("shop:k1");
            assertThat(sql.get("relevance").asDouble()).isEqualTo(1.0);
            assertThat(sql.get("raw_score").asDouble()).isEqualTo(0.42);
            assertThat(sql.get("data")).hasSize(2);
            assertThat(sql.get("data").get(1).get("city").asText()).isEqualTo("Paris");
            assertThat(sql.get("metadata").get("connection_id").asText()).isEqualTo("shop");
            assertThat(sql.get("metadata").has("rows")).isFalse();

            JsonNode doc = items.get(1);
            assertThat(doc.get("data").get("content").asText()).isEqualTo("Refunds take \"5\" days");
            assertThat(doc.get("metadata").get("category").asText()).isEqualTo("policy");
            assertThat(doc.get("metadata").get("rank").asInt()).isEqualTo(1);
            assertThat(doc.get("metadata").has("content")).isFalse();
        }
    }

    @ParameterizedTest
    @CsvSource({"csv,CSV", "JSON,JSON", "' json ',JSON"})
    @DisplayName("parses export formats case-insensitively")
    void parseFormat(String value, ExportFormat expected) {
        assertThat(ExportFormat.parse(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("rejects unsupported export formats")
    void unsupportedFormat() {
        assertThatThrownBy(() -> ExportFormat.parse("xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported export format: xml (expected csv or json)");
    }
}

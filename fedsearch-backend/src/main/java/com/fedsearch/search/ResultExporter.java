package com.fedsearch.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a search response as CSV or JSON.
 *
 * <p>CSV: one line per SQL row and one line per document, with {@code _source},
 * {@code _origin_id} and {@code _relevance} followed by the union of data columns in first-seen
 * order. JSON: an array of {@code {source, origin_id, relevance, raw_score, data, metadata}}.
 */
@Slf4j
@Component
public class ResultExporter {

    static final String SOURCE_COLUMN = "_source";
    static final String ORIGIN_COLUMN = "_origin_id";
    static final String RELEVANCE_COLUMN = "_relevance";

    private static final Set<String> SQL_METADATA_KEYS = Set.of(
            "connection_id", "sql", "method", "tables", "cache_key", "columns", "row_count",
            "truncated", "page_size", "total_pages", "warnings");

    private final ObjectMapper objectMapper;

    public ResultExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String export(SearchResponse response, ExportFormat format) {
        List<SearchResult> results = response.getResults() != null ? response.getResults() : List.of();
        log.debug("Exporting search results: format={}, results={}", format, results.size());
        return switch (format) {
            case CSV -> toCsv(results);
            case JSON -> toJson(results);
        };
    }

    private String toCsv(List<SearchResult> results) {
        List<Map<String, Object>> lines = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        for (SearchResult result : results) {
            for (Map<String, Object> data : dataRows(result)) {
                Map<String, Object> line = new LinkedHashMap<>();
                line.put(SOURCE_COLUMN, result.getSource().name());
                line.put(ORIGIN_COLUMN, result.getOriginId());
                line.put(RELEVANCE_COLUMN, result.getNormalizedScore());
                line.putAll(data);
                columns.addAll(data.keySet());
                lines.add(line);
            }
        }

        List<String> header = new ArrayList<>(List.of(SOURCE_COLUMN, ORIGIN_COLUMN, RELEVANCE_COLUMN));
        header.addAll(columns);

        StringBuilder out = new StringBuilder();
        appendCsvLine(out, new ArrayList<>(header));
        for (Map<String, Object> line : lines) {
            List<Object> values = new ArrayList<>(header.size());
            for (String column : header) {
                values.add(line.get(column));
            }
            appendCsvLine(out, values);
        }
        return out.toString();
    }

    private String toJson(List<SearchResult> results) {
        List<Map<String, Object>> items = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("source", result.getSource().name());
            item.put("origin_id", result.getOriginId());
            item.put("relevance", result.getNormalizedScore());
            item.put("raw_score", result.getRawScore());
            item.put("data", result.getSource() == SourceType.SQL ? dataRows(result) : documentData(result));
            item.put("metadata", metadata(result));
            items.add(item);
        }
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search results: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> dataRows(SearchResult result) {
        Map<String, Object> payload = result.getPayload() != null ? result.getPayload() : Map.of();
        if (result.getSource() == SourceType.SQL) {
            Object rows = payload.get("rows");
            if (rows instanceof List<?> list) {
                List<Map<String, Object>> data = new ArrayList<>(list.size());
                for (Object row : list) {
                    if (row instanceof Map<?, ?> map) {
                        data.add((Map<String, Object>) map);
                    }
                }
                return data;
            }
            return List.of();
        }
        return List.of(documentData(result));
    }

    private static Map<String, Object> documentData(SearchResult result) {
        Map<String, Object> payload = result.getPayload() != null ? result.getPayload() : Map.of();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", payload.get("content"));
        return data;
    }

    private static Map<String, Object> metadata(SearchResult result) {
        Map<String, Object> payload = result.getPayload() != null ? result.getPayload() : Map.of();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rank", result.getRank());
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            boolean keep = result.getSource() == SourceType.SQL
                    ? SQL_METADATA_KEYS.contains(entry.getKey())
                    : !"content".equals(entry.getKey());
            if (keep) {
                metadata.put(entry.getKey(), entry.getValue());
            }
        }
        return metadata;
    }

    private static void appendCsvLine(StringBuilder out, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(csvField(values.get(i)));
        }
        out.append("\r\n");
    }

    static String csvField(Object value) {
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value);
        if (text.indexOf(',') >= 0 || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }
}

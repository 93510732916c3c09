package com.fedsearch.document;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedsearch.config.FedSearchProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Qdrant REST search: {@code POST {url}/collections/{collection}/points/search}.
 * The filter map becomes a list of {@code must} match conditions.
 */
@Slf4j
public class QdrantVectorStore implements VectorStore {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final FedSearchProperties.Documents config;
    private final String searchUrl;

    public QdrantVectorStore(ObjectMapper objectMapper, FedSearchProperties.Documents config) {
        this.objectMapper = objectMapper;
        this.config = config;
        String base = config.getQdrantUrl().endsWith("/")
                ? config.getQdrantUrl().substring(0, config.getQdrantUrl().length() - 1)
                : config.getQdrantUrl();
        this.searchUrl = base + "/collections/" + config.getCollection() + "/points/search";
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        log.info("Qdrant document store (url={}, collection={}, api_key_configured={})",
                base, config.getCollection(), config.getApiKey() != null && !config.getApiKey().isBlank());
    }

    @Override
    public List<VectorHit> query(float[] vector, int topK, Map<String, Object> filter) {
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("vector", vector);
            body.put("limit", topK);
            body.put("with_payload", true);
            if (filter != null && !filter.isEmpty()) {
                List<Map<String, Object>> must = new ArrayList<>();
                filter.forEach((key, value) -> must.add(Map.of("key", key, "match", Map.of("value", value))));
                body.put("filter", Map.of("must", must));
            }

            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(searchUrl))
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
            if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
                request.header("api-key", config.getApiKey());
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new DocumentSearchException("Qdrant error: HTTP " + response.statusCode() + " - " + response.body());
            }

            List<VectorHit> hits = new ArrayList<>();
            for (JsonNode point : objectMapper.readTree(response.body()).path("result")) {
                Map<String, Object> payload = point.hasNonNull("payload")
                        ? objectMapper.convertValue(point.get("payload"), PAYLOAD_TYPE)
                        : Map.of();
                hits.add(new VectorHit(point.path("id").asText(), point.path("score").asDouble(), payload));
            }
            return hits;
        } catch (IOException e) {
            throw new DocumentSearchException("Qdrant request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentSearchException("Qdrant request interrupted", e);
        }
    }
}

package com.fedsearch.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Embeddings from an Ollama-compatible endpoint: {@code POST {baseUrl}/api/embeddings}
 * with {@code {"model": ..., "prompt": ...}}, answering {@code {"embedding": [...]}}.
 */
@Slf4j
public class HttpEmbeddingService implements EmbeddingService {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String model;
    private final int dimension;
    private final Duration timeout;

    public HttpEmbeddingService(ObjectMapper objectMapper, String baseUrl, String model, int dimension, int timeoutMs) {
        if (baseUrl == null || baseUrl.isBlank() || model == null || model.isBlank()) {
            throw new IllegalArgumentException("fedsearch.embedding.base-url and model are required for the http provider");
        }
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.dimension = dimension;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        log.info("HTTP embeddings enabled (base_url={}, model={}, dimension={})", this.baseUrl, model, dimension);
    }

    @Override
    public float[] embed(String text) {
        try {
            String json = objectMapper.writeValueAsString(Map.of("model", model, "prompt", text == null ? "" : text));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new EmbeddingException("Embedding endpoint error: HTTP " + response.statusCode());
            }

            JsonNode values = objectMapper.readTree(response.body()).path("embedding");
            if (!values.isArray() || values.size() != dimension) {
                throw new EmbeddingException("Embedding endpoint returned " + values.size()
                        + " values, expected " + dimension);
            }
            float[] v = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                v[i] = (float) values.get(i).asDouble();
            }
            return v;
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding request interrupted", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }
}

package com.fedsearch.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Language model client for any OpenAI-compatible chat completions endpoint.
 *
 * Plain HTTP requests (no vendor SDK) so that hosted gateways and local servers such as
 * Ollama or vLLM work alike. Configuration is re-read from the environment on each call.
 */
@Component
public class OpenAiCompatibleLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLanguageModelClient.class);

    private static final int DEFAULT_TIMEOUT_MS = 30000;
    private static final String SYSTEM_PROMPT = "You translate questions into a single read-only SQL SELECT statement. "
            + "Use only the tables and columns you are given. Reply with the SQL only, without explanations.";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    /**
     * Create a new client.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    public OpenAiCompatibleLanguageModelClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether the language model is configured. Never logs the API key.
     */
    @PostConstruct
    public void logConfigStatus() {
        LlmConfig config = LlmConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Language model SQL generation is ENABLED (base_url={}, model={}, api_key_configured={})",
                    config.baseUrl(), config.model(), config.hasApiKey());
            return;
        }
        log.info("Language model SQL generation is DISABLED, rule-based generation only "
                + "(base_url_configured={}, model_configured={})", config.baseUrl() != null, config.model() != null);
    }

    @Override
    public boolean isAvailable() {
        return LlmConfig.fromEnvironment(environment).isEnabled();
    }

    @Override
    public String complete(String prompt) {
        LlmConfig config = LlmConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new LanguageModelException("Language model is not configured");
        }

        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", config.model());
            payload.put("temperature", 0);
            payload.put("messages", List.of(
                    Map.of("role", "system", "content", SYSTEM_PROMPT),
                    Map.of("role", "user", "content", prompt)
            ));

            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8));
            if (config.hasApiKey()) {
                request.header("Authorization", "Bearer " + config.apiKey());
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warn("Language model request failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                throw new LanguageModelException("Language model error: HTTP " + response.statusCode());
            }

            JsonNode contentNode = objectMapper.readTree(response.body())
                    .path("choices").path(0).path("message").path("content");
            if (!contentNode.isTextual() || contentNode.asText().isBlank()) {
                throw new LanguageModelException("Language model returned an empty completion");
            }
            return contentNode.asText();
        } catch (IOException e) {
            throw new LanguageModelException("Language model request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageModelException("Language model request interrupted", e);
        }
    }

    /**
     * Configuration resolved from {@code fedsearch.llm.*}, falling back to {@code OPENAI_*} variables.
     */
    record LlmConfig(String baseUrl, String apiKey, String model, int timeoutMs) {

        static LlmConfig fromEnvironment(Environment environment) {
            String baseUrl = getTrimmed(environment, "fedsearch.llm.base-url", "OPENAI_BASE_URL");
            if (baseUrl != null && baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            String apiKey = getTrimmed(environment, "fedsearch.llm.api-key", "OPENAI_API_KEY");
            String model = getTrimmed(environment, "fedsearch.llm.model", "OPENAI_MODEL");

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeoutRaw = getTrimmed(environment, "fedsearch.llm.timeout-ms", "OPENAI_TIMEOUT_MS");
            if (timeoutRaw != null) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid fedsearch.llm.timeout-ms: {}", timeoutRaw);
                }
            }
            return new LlmConfig(baseUrl, apiKey, model, timeoutMs);
        }

        boolean isEnabled() {
            return baseUrl != null && model != null;
        }

        boolean hasApiKey() {
            return apiKey != null;
        }

        private static String getTrimmed(Environment environment, String propKey, String envKey) {
            if (environment == null) {
                return null;
            }
            String v = environment.getProperty(propKey);
            if (v == null || v.isBlank()) {
                v = environment.getProperty(envKey);
            }
            if (v == null || v.isBlank()) {
                return null;
            }
            return v.trim();
        }
    }
}

package com.fedsearch.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedsearch.testsupport.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenAiCompatibleLanguageModelClient")
class OpenAiCompatibleLanguageModelClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("is unavailable without base URL and model")
        void disabledByDefault() {
            OpenAiCompatibleLanguageModelClient client =
                    new OpenAiCompatibleLanguageModelClient(objectMapper, new MockEnvironment());

            assertThat(client.isAvailable()).isFalse();
            assertThatThrownBy(() -> client.complete("prompt"))
                    .isInstanceOf(LanguageModelException.class)
                    .hasMessage("Language model is not configured");
        }

        @Test
        @DisplayName("falls back to OPENAI_* variables")
        void openAiFallback() {
            MockEnvironment environment = new MockEnvironment()
                    .withProperty("OPENAI_BASE_URL", "http://localhost:11434/")
                    .withProperty("OPENAI_MODEL", "llama3")
                    .withProperty("fedsearch.llm.timeout-ms", "not-a-number");

            OpenAiCompatibleLanguageModelClient.LlmConfig config =
                    OpenAiCompatibleLanguageModelClient.LlmConfig.fromEnvironment(environment);

            assertThat(config.isEnabled()).isTrue();
            assertThat(config.baseUrl()).isEqualTo("http://localhost:11434");
            assertThat(config.model()).isEqualTo("llama3");
            assertThat(config.hasApiKey()).isFalse();
            assertThat(config.timeoutMs()).isEqualTo(30000);
        }

        @Test
        @DisplayName("prefers fedsearch.llm.* properties")
        void propertiesWin() {
            MockEnvironment environment = new MockEnvironment()
                    .withProperty("fedsearch.llm.base-url", " http://gateway ")
                    .withProperty("fedsearch.llm.model", "gpt-4o-mini")
                    .withProperty("fedsearch.llm.api-key", "  ")
                    .withProperty("OPENAI_BASE_URL", "http://ignored")
                    .withProperty("OPENAI_API_KEY", "sk-test");

            OpenAiCompatibleLanguageModelClient.LlmConfig config =
                    OpenAiCompatibleLanguageModelClient.LlmConfig.fromEnvironment(environment);

            assertThat(config.baseUrl()).isEqualTo("http://gateway");
            assertThat(config.model()).isEqualTo("gpt-4o-mini");
            assertThat(config.apiKey()).isEqualTo("sk-test");
        }
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        private StubHttpServer server;
        private OpenAiCompatibleLanguageModelClient client;

        @BeforeEach
        void setUp() throws Exception {
            server = StubHttpServer.serving("/v1/chat/completions");
            MockEnvironment environment = new MockEnvironment()
                    .withProperty("fedsearch.llm.base-url", server.baseUrl())
                    .withProperty("fedsearch.llm.model", "test-model")
                    .withProperty("fedsearch.llm.api-key", "sk-test");
            client = new OpenAiCompatibleLanguageModelClient(objectMapper, environment);
        }

        @AfterEach
        void tearDown() {
            server.close();
        }

        @Test
        @DisplayName("sends a chat request and returns the message content")
        void success() throws Exception {
            server.respond(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"SELECT 1\"}}]}");

            assertThat(client.complete("count customers")).isEqualTo("SELECT 1");

            JsonNode request = objectMapper.readTree(server.lastRequestBody());
            assertThat(request.get("model").asText()).isEqualTo("test-model");
            assertThat(request.get("temperature").asInt()).isZero();
            assertThat(request.get("messages").get(1).get("content").asText()).isEqualTo("count customers");
            assertThat(server.lastHeader("Authorization")).isEqualTo("Bearer sk-test");
        }

        @Test
        @DisplayName("maps HTTP errors to LanguageModelException")
        void httpError() {
            server.respond(503, "{\"error\":\"overloaded\"}");

            assertThatThrownBy(() -> client.complete("count customers"))
                    .isInstanceOf(LanguageModelException.class)
                    .hasMessage("Language model error: HTTP 503");
        }

        @Test
        @DisplayName("rejects an empty completion")
        void emptyCompletion() {
            server.respond(200, "{\"choices\":[{\"message\":{\"content\":\"  \"}}]}");

            assertThatThrownBy(() -> client.complete("count customers"))
                    .isInstanceOf(LanguageModelException.class)
                    .hasMessage("Language model returned an empty completion");
        }
    }
}

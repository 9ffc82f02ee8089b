package me.golemcore.promptforge.adapter.outbound.enhancement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.promptforge.domain.model.EnhancementRequest;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatibleEnhancementAdapterTest {

    private static final String COMPLETION = """
            {"choices":[{"message":{"role":"assistant","content":"Build Habitly with streak tracking."}}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PromptForgeProperties properties;
    private OkHttpMockEngine engine;
    private OpenAiCompatibleEnhancementAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new PromptForgeProperties();
        properties.getEnhancement().setApiUrl("http://llm.local/v1/");
        properties.getEnhancement().setApiKey("secret");
        properties.getEnhancement().setModel("gpt-test");
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new OpenAiCompatibleEnhancementAdapter(properties, client, objectMapper);
    }

    @Test
    void shouldPostChatCompletionAndReturnContent() throws Exception {
        engine.enqueueJson(200, COMPLETION);

        String text = adapter.enhance(request()).get(5, TimeUnit.SECONDS);

        assertEquals("Build Habitly with streak tracking.", text);
        OkHttpMockEngine.CapturedRequest captured = engine.takeRequest();
        assertEquals("POST", captured.method());
        assertEquals("/v1/chat/completions", captured.path());
        assertEquals("Bearer secret", captured.headers().get("Authorization"));

        JsonNode body = objectMapper.readTree(captured.body());
        assertEquals("gpt-test", body.path("model").asText());
        assertEquals(800, body.path("max_tokens").asInt());
        assertEquals(0.4, body.path("temperature").asDouble(), 1e-9);
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertTrue(body.path("messages").path(0).path("content").asText().contains("Lovable"));
        assertTrue(body.path("messages").path(0).path("content").asText().contains("professional tone"));
        String user = body.path("messages").path(1).path("content").asText();
        assertTrue(user.contains("Keep the project name \"Habitly\""));
        assertTrue(user.contains("- Use Supabase for persistence"));
        assertTrue(user.endsWith("Create Habitly."));
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() throws Exception {
        properties.getEnhancement().setApiKey(" ");
        engine.enqueueJson(200, COMPLETION);

        adapter.enhance(request()).get(5, TimeUnit.SECONDS);

        assertNull(engine.takeRequest().headers().get("Authorization"));
    }

    @Test
    void shouldReturnEmptyTextForErrorStatus() throws Exception {
        engine.enqueueJson(503, "{\"error\":\"overloaded\"}");

        assertEquals("", adapter.enhance(request()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldReturnEmptyTextForUnexpectedBody() throws Exception {
        engine.enqueueJson(200, "not json");
        engine.enqueueJson(200, "{\"choices\":[]}");

        assertEquals("", adapter.enhance(request()).get(5, TimeUnit.SECONDS));
        assertEquals("", adapter.enhance(request()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailOnTransportError() {
        engine.enqueueFailure(new IOException("connection reset"));

        CompletableFuture<String> future = adapter.enhance(request());

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void shouldCancelHttpCallWhenFutureIsCancelled() throws Exception {
        engine.enqueueDelayedJson(200, COMPLETION, 5000);

        CompletableFuture<String> future = adapter.enhance(request());
        while (engine.getRequestCount() == 0) {
            Thread.sleep(5);
        }
        future.cancel(true);

        long deadline = System.currentTimeMillis() + 2000;
        while (engine.getCancelledCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, engine.getCancelledCount());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldBoundCallByTimeoutShorterThanRetrieval() throws Exception {
        properties.getRetrieval().setTimeoutMs(300);
        properties.getEnhancement().setTimeoutMs(10_000);
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new OpenAiCompatibleEnhancementAdapter(properties, client, objectMapper);
        engine.enqueueDelayedJson(200, COMPLETION, 5000);

        long startedAt = System.currentTimeMillis();
        CompletableFuture<String> future = adapter.enhance(request());

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(3, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, thrown.getCause());
        assertTrue(System.currentTimeMillis() - startedAt < 3000);
    }

    @Test
    void shouldReportAvailabilityFromApiUrl() {
        assertTrue(adapter.isAvailable());

        properties.getEnhancement().setApiUrl("");

        assertFalse(adapter.isAvailable());
    }

    private static EnhancementRequest request() {
        return EnhancementRequest.builder()
                .draft("Create Habitly.")
                .toolId("lovable")
                .toolDisplayName("Lovable")
                .tone("professional")
                .projectName("Habitly")
                .guideline("Use Supabase for persistence")
                .maxTokens(800)
                .temperature(0.4)
                .build();
    }
}

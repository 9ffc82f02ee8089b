package me.golemcore.promptforge.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.promptforge.domain.model.AppIdea;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldWriteInstantsAsIsoAndIgnoreUnknownFields() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"1970-01-01T00:00:00Z\"", mapper.writeValueAsString(Instant.EPOCH));
        AppIdea idea = mapper.readValue("{\"app_name\":\"Habitly\",\"unknown\":1}", AppIdea.class);
        assertEquals("Habitly", idea.getAppName());
    }

    @Test
    void shouldRunGenerationTasksOnDaemonThreads() throws Exception {
        AutoConfiguration configuration = new AutoConfiguration(new PromptForgeProperties());
        ExecutorService executor = configuration.generationExecutor();
        try {
            Map.Entry<String, Boolean> thread = CompletableFuture
                    .supplyAsync(() -> Map.entry(Thread.currentThread().getName(),
                            Thread.currentThread().isDaemon()), executor)
                    .get(5, TimeUnit.SECONDS);

            assertTrue(thread.getKey().startsWith("prompt-generation-"));
            assertTrue(thread.getValue());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldLogStartupSummary() {
        AutoConfiguration configuration = new AutoConfiguration(new PromptForgeProperties());

        assertDoesNotThrow(configuration::init);
    }
}

package me.golemcore.promptforge.adapter.outbound.embedding;

import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jEmbeddingAdapterTest {

    private PromptForgeProperties properties;
    private ExecutorService executor;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new PromptForgeProperties();
        properties.getEmbedding().setApiKey(" ");
        executor = Executors.newSingleThreadExecutor();
        adapter = new Langchain4jEmbeddingAdapter(properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
        assertFalse(adapter.isAvailable());

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.embed("habit tracker").get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void shouldRunCallsOnProvidedExecutor() {
        executor.shutdown();

        assertThrows(RejectedExecutionException.class, () -> adapter.embed("habit tracker"));
        assertThrows(RejectedExecutionException.class, () -> adapter.embedBatch(List.of("habit tracker")));
    }

    @Test
    void shouldCompleteEmptyBatchImmediately() throws Exception {
        executor.shutdown();

        assertTrue(adapter.embedBatch(List.of()).get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void shouldDescribeConfiguredModel() {
        assertEquals("openai", adapter.getProviderId());
        assertEquals("text-embedding-3-small", adapter.getModel());
        assertEquals(1536, adapter.getDimension());

        properties.getEmbedding().setModel("");
        assertEquals("text-embedding-3-small", adapter.getModel());
    }
}

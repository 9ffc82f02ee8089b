package me.golemcore.promptforge.infrastructure.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptForgePropertiesTest {

    @Test
    void shouldKeepDefaultEnhancementTimeoutInsideRetrievalBudget() {
        PromptForgeProperties properties = new PromptForgeProperties();

        assertTrue(properties.getEnhancement().getTimeoutMs() < properties.getRetrieval().getTimeoutMs());
        assertEquals(properties.getEnhancement().getTimeoutMs(), properties.effectiveEnhancementTimeoutMs());
    }

    @Test
    void shouldDeriveEnhancementTimeoutWhenNotShorterThanRetrieval() {
        PromptForgeProperties properties = new PromptForgeProperties();
        properties.getRetrieval().setTimeoutMs(3000);

        properties.getEnhancement().setTimeoutMs(15_000);
        assertEquals(2400, properties.effectiveEnhancementTimeoutMs());

        properties.getEnhancement().setTimeoutMs(3000);
        assertEquals(2400, properties.effectiveEnhancementTimeoutMs());

        properties.getEnhancement().setTimeoutMs(0);
        assertEquals(2400, properties.effectiveEnhancementTimeoutMs());

        properties.getEnhancement().setTimeoutMs(1000);
        assertEquals(1000, properties.effectiveEnhancementTimeoutMs());
    }

    @Test
    void shouldResolveThresholdsPerEmbeddingProvider() {
        PromptForgeProperties.RetrievalProperties retrieval = new PromptForgeProperties().getRetrieval();

        assertEquals(0.08, retrieval.documentThresholdFor("hashing"));
        assertEquals(0.1, retrieval.templateThresholdFor("hashing"));
        assertEquals(0.6, retrieval.documentThresholdFor("openai"));
        assertEquals(0.55, retrieval.templateThresholdFor("openai"));
        assertEquals(0.6, retrieval.documentThresholdFor(null));
    }
}

package me.golemcore.promptforge.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code promptforge.*} prefix:
 * <ul>
 * <li>{@link ProfilesProperties} - where tool profiles are loaded from</li>
 * <li>{@link KnowledgeProperties} - knowledge base seeding</li>
 * <li>{@link RetrievalProperties} - similarity thresholds, limits and
 * timeouts</li>
 * <li>{@link CompositionProperties} - knowledge excerpt sizing</li>
 * <li>{@link EmbeddingProperties} - embedding provider selection</li>
 * <li>{@link EnhancementProperties} - external enhancement service</li>
 * <li>{@link ValidationProperties} - structural validation limits</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "promptforge")
@Data
public class PromptForgeProperties {

    private GenerationProperties generation = new GenerationProperties();
    private ProfilesProperties profiles = new ProfilesProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private CompositionProperties composition = new CompositionProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private EnhancementProperties enhancement = new EnhancementProperties();
    private ValidationProperties validation = new ValidationProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Enhancement timeout actually applied. The enhancement call must finish
     * within the retrieval budget, so a configured value that is not shorter than
     * {@code retrieval.timeout-ms} is replaced by four fifths of it.
     */
    public long effectiveEnhancementTimeoutMs() {
        long retrievalTimeoutMs = retrieval.getTimeoutMs();
        long configured = enhancement.getTimeoutMs();
        if (configured > 0 && (retrievalTimeoutMs <= 0 || configured < retrievalTimeoutMs)) {
            return configured;
        }
        return Math.max(1, retrievalTimeoutMs * 4 / 5);
    }

    @Data
    public static class GenerationProperties {
        private String defaultTool = "lovable";
    }

    @Data
    public static class ProfilesProperties {
        private String location = "classpath:tool-profiles.yaml";
    }

    @Data
    public static class KnowledgeProperties {
        private boolean seedEnabled = true;
        private String documentsLocation = "classpath:knowledge/seed-documents.yaml";
        private String templatesLocation = "classpath:knowledge/seed-templates.yaml";
    }

    @Data
    public static class RetrievalProperties {
        private double documentThreshold = 0.6;
        private double templateThreshold = 0.55;
        // Bag-of-words vectors score far lower than semantic embeddings.
        private Map<String, ThresholdProperties> providerThresholds = new HashMap<>(
                Map.of("hashing", new ThresholdProperties(0.08, 0.1)));
        private int maxDocuments = 10;
        private int maxTemplates = 5;
        private long timeoutMs = 3000;
        private long embeddingTimeoutMs = 2000;
        private long storeTimeoutMs = 2000;

        public double documentThresholdFor(String provider) {
            ThresholdProperties override = provider != null ? providerThresholds.get(provider) : null;
            return override != null && override.getDocument() != null ? override.getDocument() : documentThreshold;
        }

        public double templateThresholdFor(String provider) {
            ThresholdProperties override = provider != null ? providerThresholds.get(provider) : null;
            return override != null && override.getTemplate() != null ? override.getTemplate() : templateThreshold;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ThresholdProperties {
        private Double document;
        private Double template;
    }

    @Data
    public static class CompositionProperties {
        private int maxExcerptDocuments = 3;
        private int maxExcerptChars = 1200;
    }

    @Data
    public static class EmbeddingProperties {
        private String provider = "hashing";
        private String apiKey;
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
    }

    @Data
    public static class EnhancementProperties {
        private boolean enabled = false;
        private String apiUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 2500;
        private int maxTokens = 2000;
        private double temperature = 0.7;
    }

    @Data
    public static class ValidationProperties {
        private int minLength = 200;
        private int softMaxLength = 8000;
        private int penaltyPerIssue = 20;
        private int vagueWordLimit = 3;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private int maxRequests = 16;
    }
}

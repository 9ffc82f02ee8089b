package me.golemcore.promptforge.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Embedding provider backed by the OpenAI embeddings API through langchain4j.
 *
 * <p>
 * The model client is built on first use. Without an API key the provider
 * reports itself unavailable and every call completes exceptionally, which the
 * retrieval service turns into score-based ranking. Requests are not retried;
 * the caller already bounds them with {@code promptforge.retrieval.embedding-timeout-ms}.
 * Blocking API calls run on the generation executor.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code promptforge.embedding.api-key} - OpenAI API key
 * <li>{@code promptforge.embedding.model} - embedding model name
 * <li>{@code promptforge.embedding.dimension} - vector size requested from
 * text-embedding-3 models
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingProviderAdapter {

    static final String PROVIDER_ID = "openai";

    private static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final String RESIZABLE_MODEL_PREFIX = "text-embedding-3";

    private final PromptForgeProperties properties;
    private final ExecutorService generationExecutor;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        String apiKey = properties.getEmbedding().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] OpenAI API key not configured, provider unavailable");
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .timeout(Duration.ofMillis(properties.getRetrieval().getEmbeddingTimeoutMs()))
                    .maxRetries(0);
            if (model.startsWith(RESIZABLE_MODEL_PREFIX)) {
                builder.dimensions(getDimension());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] OpenAI model initialized: {} ({} dimensions)", model, getDimension());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize OpenAI model {}", model, e);
        }

        initialized = true;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            Response<Embedding> response = requireModel().embed(text);
            return response.content().vector();
        }, generationExecutor);
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = requireModel().embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        }, generationExecutor);
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        if (embeddingModel == null) {
            throw new IllegalStateException("OpenAI embedding model not available");
        }
        return embeddingModel;
    }
}

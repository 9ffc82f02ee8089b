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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EmbeddingPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active embedding adapter from
 * {@code promptforge.embedding.provider}. Falls back to the local hashing
 * embedder when the configured provider is unknown, so retrieval keeps working
 * without external credentials.
 *
 * @see HashingEmbeddingAdapter
 * @see Langchain4jEmbeddingAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class EmbeddingAdapterFactory implements EmbeddingPort {

    private final PromptForgeProperties properties;
    private final List<EmbeddingProviderAdapter> adapters;

    private final Map<String, EmbeddingProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private EmbeddingProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (EmbeddingProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[Embedding] Registered adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getEmbedding().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(HashingEmbeddingAdapter.PROVIDER_ID);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[Embedding] Provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : "none");
        } else {
            log.info("[Embedding] Active provider: {}", provider);
        }
    }

    public EmbeddingPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : null;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No embedding adapter configured"));
        }
        return activeAdapter.embed(text);
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No embedding adapter configured"));
        }
        return activeAdapter.embedBatch(texts);
    }

    @Override
    public int getDimension() {
        return activeAdapter != null ? activeAdapter.getDimension() : 0;
    }

    @Override
    public String getModel() {
        return activeAdapter != null ? activeAdapter.getModel() : "none";
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}

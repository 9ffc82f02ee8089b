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

import lombok.RequiredArgsConstructor;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Local embedding based on the hashing trick: every lower-cased word is hashed
 * into one bucket of a fixed-size vector, which is then L2-normalized. Texts
 * sharing vocabulary get a high cosine similarity. Deterministic and free of
 * network calls, so it is the default provider.
 */
@Component
@RequiredArgsConstructor
public class HashingEmbeddingAdapter implements EmbeddingProviderAdapter {

    static final String PROVIDER_ID = "hashing";

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    private final PromptForgeProperties properties;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.completedFuture(texts.stream()
                .map(this::vectorize)
                .toList());
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        return "hashing-" + getDimension();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    float[] vectorize(String text) {
        float[] vector = new float[getDimension()];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                vector[Math.floorMod(token.hashCode(), vector.length)] += 1.0f;
            }
        }
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}

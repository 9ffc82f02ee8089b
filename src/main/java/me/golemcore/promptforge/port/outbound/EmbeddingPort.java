package me.golemcore.promptforge.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns text into dense vectors for similarity search over the knowledge base.
 * Implementations complete their futures exceptionally on provider errors;
 * callers bound every call with their own timeout.
 */
public interface EmbeddingPort {

    /**
     * Short provider id such as "hashing" or "openai". Retrieval thresholds are
     * calibrated per provider.
     */
    String getProviderId();

    CompletableFuture<float[]> embed(String text);

    /**
     * @return one vector per input text, in input order
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    int getDimension();

    String getModel();

    boolean isAvailable();

    /**
     * Cosine of the angle between two vectors of equal length, in [-1, 1]. A
     * zero vector is similar to nothing and scores 0.
     *
     * @throws IllegalArgumentException
     *             if the vectors differ in length
     */
    default double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Cannot compare vectors of length " + left.length + " and " + right.length);
        }
        double dot = 0;
        double leftSquares = 0;
        double rightSquares = 0;
        for (int index = 0; index < left.length; index++) {
            dot += (double) left[index] * right[index];
            leftSquares += (double) left[index] * left[index];
            rightSquares += (double) right[index] * right[index];
        }
        double magnitude = Math.sqrt(leftSquares * rightSquares);
        return magnitude == 0 ? 0 : dot / magnitude;
    }
}

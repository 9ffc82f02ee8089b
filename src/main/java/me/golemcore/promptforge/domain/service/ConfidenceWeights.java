package me.golemcore.promptforge.domain.service;

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

/**
 * Weights of the confidence sub-signals. They sum to one, so the weighted
 * score stays in [0, 1].
 *
 * <ul>
 * <li>completeness: how much normalized context was available</li>
 * <li>retrieval: how much relevant knowledge was used, and how similar it
 * was</li>
 * <li>enhancement: whether the external rewrite succeeded</li>
 * </ul>
 */
public record ConfidenceWeights(double completeness, double retrieval, double enhancement) {

    public static final ConfidenceWeights DEFAULT = new ConfidenceWeights(0.4, 0.4, 0.2);

    public ConfidenceWeights {
        double total = completeness + retrieval + enhancement;
        if (completeness < 0 || retrieval < 0 || enhancement < 0 || Math.abs(total - 1.0) > 1e-9) {
            throw new IllegalArgumentException("Confidence weights must be non-negative and sum to 1");
        }
    }
}

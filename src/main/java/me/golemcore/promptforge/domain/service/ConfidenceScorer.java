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

import me.golemcore.promptforge.domain.model.RetrievalStats;
import me.golemcore.promptforge.domain.model.TaskContext;
import org.springframework.stereotype.Component;

/**
 * Scores how much a generated prompt can be trusted, from 0 to 1.
 */
@Component
public class ConfidenceScorer {

    static final int DESCRIPTIVE_LENGTH = 50;

    private final ConfidenceWeights weights;

    public ConfidenceScorer() {
        this(ConfidenceWeights.DEFAULT);
    }

    ConfidenceScorer(ConfidenceWeights weights) {
        this.weights = weights;
    }

    public double score(String text, TaskContext taskContext, RetrievalStats retrieval, boolean enhancementApplied) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        double score = weights.completeness() * completeness(taskContext)
                + weights.retrieval() * retrievalSignal(retrieval)
                + weights.enhancement() * (enhancementApplied ? 1.0 : 0.0);
        return clamp(score);
    }

    double completeness(TaskContext taskContext) {
        if (taskContext == null) {
            return 0.0;
        }
        int present = 0;
        if (!taskContext.getTechnicalRequirements().isEmpty()) {
            present++;
        }
        if (!taskContext.getUiRequirements().isEmpty()) {
            present++;
        }
        if (!taskContext.getConstraints().isEmpty()) {
            present++;
        }
        if (taskContext.getDescription() != null && taskContext.getDescription().length() >= DESCRIPTIVE_LENGTH) {
            present++;
        }
        return present / 4.0;
    }

    double retrievalSignal(RetrievalStats retrieval) {
        if (retrieval == null || retrieval.sourcesUsed() <= 0) {
            return 0.0;
        }
        double coverage = retrieval.sourcesExpected() <= 0
                ? 1.0
                : Math.min(1.0, (double) retrieval.sourcesUsed() / retrieval.sourcesExpected());
        return clamp(0.5 * coverage + 0.5 * clamp(retrieval.averageSimilarity()));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

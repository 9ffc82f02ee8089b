package me.golemcore.promptforge.domain.model;

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

/**
 * How much retrieved material actually made it into a prompt.
 */
public record RetrievalStats(int sourcesUsed, int sourcesExpected, double averageSimilarity) {

    public static RetrievalStats empty(int sourcesExpected) {
        return new RetrievalStats(0, sourcesExpected, 0.0);
    }

    public static RetrievalStats of(List<RetrievalResult> used, int sourcesExpected) {
        if (used == null || used.isEmpty()) {
            return empty(sourcesExpected);
        }
        double average = used.stream()
                .mapToDouble(RetrievalResult::similarityScore)
                .average()
                .orElse(0.0);
        return new RetrievalStats(used.size(), sourcesExpected, average);
    }
}

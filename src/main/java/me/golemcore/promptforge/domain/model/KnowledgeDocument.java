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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reference document stored in the knowledge base. Documents are unique by
 * content hash and their retrieval count only ever grows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnowledgeDocument implements KnowledgeEntry {

    private String id;
    private String title;
    private String content;
    private DocumentType documentType;
    @Builder.Default
    private Set<String> targetTools = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> categories = new LinkedHashSet<>();
    private String complexityLevel;
    @JsonIgnore
    private float[] embedding;
    private String contentHash;
    @Builder.Default
    private double qualityScore = 0.5;
    private long retrievalCount;
    @Builder.Default
    private boolean active = true;

    public synchronized void incrementRetrievalCount() {
        retrievalCount++;
    }

    @Override
    public CorpusKind corpus() {
        return CorpusKind.DOCUMENTS;
    }

    @Override
    public String displayTitle() {
        return title;
    }

    @Override
    public double rankingScore() {
        return qualityScore;
    }

    @Override
    public long usageCount() {
        return retrievalCount;
    }

    @Override
    public boolean matches(RetrievalFilters filters) {
        if (filters == null) {
            return true;
        }
        if (!filters.getTargetTools().isEmpty() && !overlaps(targetTools, filters.getTargetTools())) {
            return false;
        }
        if (!filters.getCategories().isEmpty() && !overlaps(categories, filters.getCategories())) {
            return false;
        }
        if (filters.getComplexity() != null && !filters.getComplexity().equalsIgnoreCase(complexityLevel)) {
            return false;
        }
        return filters.getDocumentType() == null || filters.getDocumentType() == documentType;
    }

    private static boolean overlaps(Collection<String> own, Collection<String> wanted) {
        if (own == null) {
            return false;
        }
        return own.stream().anyMatch(wanted::contains);
    }
}

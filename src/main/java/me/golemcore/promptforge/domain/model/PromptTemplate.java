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

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable prompt template stored in the knowledge base. The content may carry
 * {@code {{PLACEHOLDER}}} markers that are filled during composition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate implements KnowledgeEntry {

    private String id;
    private String name;
    private String content;
    private TemplateType templateType;
    private String targetTool;
    private String useCase;
    private String projectComplexity;
    @JsonIgnore
    private float[] embedding;
    private String contentHash;
    @Builder.Default
    private List<String> requiredVariables = new ArrayList<>();
    @Builder.Default
    private List<String> optionalVariables = new ArrayList<>();
    private long usageCount;
    @Builder.Default
    private double successRate = 0.5;
    @Builder.Default
    private boolean active = true;

    public synchronized void incrementUsageCount() {
        usageCount++;
    }

    @Override
    public CorpusKind corpus() {
        return CorpusKind.TEMPLATES;
    }

    @Override
    public String displayTitle() {
        return name;
    }

    @Override
    public double rankingScore() {
        return successRate;
    }

    @Override
    public long usageCount() {
        return usageCount;
    }

    @Override
    public boolean matches(RetrievalFilters filters) {
        if (filters == null) {
            return true;
        }
        if (!filters.getTargetTools().isEmpty() && !filters.getTargetTools().contains(targetTool)) {
            return false;
        }
        if (!filters.getCategories().isEmpty() && !filters.getCategories().contains(useCase)) {
            return false;
        }
        if (filters.getComplexity() != null && !filters.getComplexity().equalsIgnoreCase(projectComplexity)) {
            return false;
        }
        return filters.getTemplateType() == null || filters.getTemplateType() == templateType;
    }
}

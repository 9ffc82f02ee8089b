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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static description of how to prompt one AI development tool. Profiles are
 * loaded once at startup and never change afterwards.
 */
@Value
@Builder
public class ToolProfile {

    private static final Comparator<PromptingStrategy> BY_EFFECTIVENESS = Comparator
            .comparingDouble(PromptingStrategy::getEffectivenessScore).reversed();

    String id;
    String displayName;
    String description;
    ToolCategory category;
    ComplexityTier complexityTier;
    String outputFormat;
    String tone;
    @Singular
    List<PromptingStrategy> strategies;
    @Singular
    List<String> constraints;
    @Singular
    List<String> optimizationTips;
    @Singular
    List<String> guidelines;
    @Singular
    List<CommonPitfall> commonPitfalls;
    @Singular
    Map<PromptStage, String> stageTemplates;

    /**
     * Strategies ordered by descending effectiveness. The sort is stable, so ties
     * keep their declaration order.
     */
    public List<PromptingStrategy> rankedStrategies() {
        return strategies.stream()
                .sorted(BY_EFFECTIVENESS)
                .toList();
    }

    /**
     * Ranked strategies whose use-cases cover the task type or stage. Falls back
     * to every strategy when none of them do.
     */
    public List<PromptingStrategy> strategiesFor(String taskType, PromptStage stage) {
        List<PromptingStrategy> ranked = rankedStrategies();
        List<PromptingStrategy> applicable = ranked.stream()
                .filter(strategy -> strategy.appliesTo(taskType, stage))
                .toList();
        return applicable.isEmpty() ? ranked : applicable;
    }

    public Optional<String> stageTemplate(PromptStage stage) {
        return Optional.ofNullable(stageTemplates.get(stage));
    }
}

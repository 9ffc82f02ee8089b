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

import java.util.List;

/**
 * One prompting strategy declared by a tool profile: a template skeleton with
 * {@code {{PLACEHOLDER}}} markers, the task types it suits, and how effective it
 * has proven to be.
 */
@Value
@Builder(toBuilder = true)
public class PromptingStrategy {

    StrategyKind kind;
    String template;
    @Singular
    List<String> useCases;
    double effectivenessScore;

    public boolean appliesTo(String taskType, PromptStage stage) {
        return (taskType != null && useCases.contains(taskType))
                || (stage != null && useCases.contains(stage.getValue()));
    }
}

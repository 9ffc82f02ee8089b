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

import java.util.Set;

/**
 * Placeholder names available to strategy skeletons and stage templates.
 */
public final class PromptVariables {

    public static final String TOOL_NAME = "TOOL_NAME";
    public static final String TOOL_TONE = "TOOL_TONE";
    public static final String OUTPUT_FORMAT = "OUTPUT_FORMAT";
    public static final String PROJECT_NAME = "PROJECT_NAME";
    public static final String PROJECT_DESCRIPTION = "PROJECT_DESCRIPTION";
    public static final String TECH_STACK = "TECH_STACK";
    public static final String TARGET_AUDIENCE = "TARGET_AUDIENCE";
    public static final String TASK_TYPE = "TASK_TYPE";
    public static final String TASK_DESCRIPTION = "TASK_DESCRIPTION";
    public static final String STAGE = "STAGE";
    public static final String TECHNICAL_REQUIREMENTS = "TECHNICAL_REQUIREMENTS";
    public static final String UI_REQUIREMENTS = "UI_REQUIREMENTS";
    public static final String CONSTRAINTS = "CONSTRAINTS";
    public static final String GUIDELINES = "GUIDELINES";
    public static final String OPTIMIZATION_TIPS = "OPTIMIZATION_TIPS";
    public static final String KNOWLEDGE_EXCERPTS = "KNOWLEDGE_EXCERPTS";

    public static final Set<String> ALL = Set.of(
            TOOL_NAME, TOOL_TONE, OUTPUT_FORMAT,
            PROJECT_NAME, PROJECT_DESCRIPTION, TECH_STACK, TARGET_AUDIENCE,
            TASK_TYPE, TASK_DESCRIPTION, STAGE,
            TECHNICAL_REQUIREMENTS, UI_REQUIREMENTS, CONSTRAINTS,
            GUIDELINES, OPTIMIZATION_TIPS, KNOWLEDGE_EXCERPTS);

    private PromptVariables() {
    }
}

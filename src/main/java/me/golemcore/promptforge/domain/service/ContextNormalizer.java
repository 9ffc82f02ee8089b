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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.exception.MissingRequiredFieldException;
import me.golemcore.promptforge.domain.model.AppIdea;
import me.golemcore.promptforge.domain.model.ComplexityTier;
import me.golemcore.promptforge.domain.model.NormalizedContext;
import me.golemcore.promptforge.domain.model.ProjectComplexity;
import me.golemcore.promptforge.domain.model.ProjectInfo;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.TaskContext;
import me.golemcore.promptforge.domain.model.ValidationAnswers;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static me.golemcore.promptforge.domain.service.NormalizationTables.*;

/**
 * Maps loosely typed wizard input into the canonical {@link TaskContext} and
 * {@link ProjectInfo}.
 *
 * <p>
 * Only the app name and idea description are mandatory. Every other field is
 * optional: values are trimmed and lower-cased before lookup, and unknown
 * values simply contribute nothing. All requirement lists come from
 * {@link NormalizationTables} and are de-duplicated in insertion order.
 */
@Service
@Slf4j
public class ContextNormalizer {

    private final String defaultTool;

    public ContextNormalizer(PromptForgeProperties properties) {
        this.defaultTool = properties.getGeneration().getDefaultTool();
    }

    /**
     * Normalizes input for the tool named in the validation answers, at the first
     * stage.
     */
    public NormalizedContext normalize(AppIdea appIdea, ValidationAnswers answers) {
        String tool = answers != null && hasText(answers.getPreferredAiTool())
                ? answers.getPreferredAiTool()
                : defaultTool;
        return normalize(appIdea, answers, tool, PromptStage.APP_SKELETON);
    }

    public NormalizedContext normalize(AppIdea appIdea, ValidationAnswers answers, String toolId,
            PromptStage stage) {
        if (appIdea == null || !hasText(appIdea.getAppName())) {
            throw new MissingRequiredFieldException("appName");
        }
        if (!hasText(appIdea.getIdeaDescription())) {
            throw new MissingRequiredFieldException("ideaDescription");
        }
        ValidationAnswers safeAnswers = answers != null ? answers : new ValidationAnswers();
        PromptStage effectiveStage = stage != null ? stage : PromptStage.APP_SKELETON;

        Set<String> platforms = normalizePlatforms(appIdea.getPlatforms());
        Optional<ProjectComplexity> complexity = ProjectComplexity.parse(safeAnswers.getProjectComplexity());
        Optional<ComplexityTier> experience = ComplexityTier.parse(safeAnswers.getTechnicalExperience());

        String projectName = appIdea.getAppName().trim();
        String description = appIdea.getIdeaDescription().trim();

        TaskContext taskContext = TaskContext.builder()
                .taskType(effectiveStage.getTaskType())
                .projectName(projectName)
                .description(description)
                .stage(effectiveStage)
                .technicalRequirements(technicalRequirements(platforms, complexity, experience))
                .uiRequirements(uiRequirements(appIdea, platforms))
                .constraints(constraints(platforms, complexity, experience))
                .build();

        ProjectInfo projectInfo = ProjectInfo.builder()
                .name(projectName)
                .description(description)
                .techStack(techStack(toolId, platforms))
                .targetAudience(hasText(appIdea.getTargetAudience())
                        ? appIdea.getTargetAudience().trim()
                        : DEFAULT_TARGET_AUDIENCE)
                .requirements(projectRequirements(safeAnswers))
                .complexity(complexity.orElse(null))
                .experience(experience.orElse(null))
                .build();

        log.debug("[Normalizer] {} for tool {}: {} technical, {} ui, {} constraints",
                projectName, toolId, taskContext.getTechnicalRequirements().size(),
                taskContext.getUiRequirements().size(), taskContext.getConstraints().size());
        return new NormalizedContext(taskContext, projectInfo);
    }

    private List<String> technicalRequirements(Set<String> platforms, Optional<ProjectComplexity> complexity,
            Optional<ComplexityTier> experience) {
        Set<String> result = new LinkedHashSet<>();
        for (String platform : platforms) {
            result.addAll(TECHNICAL_BY_PLATFORM.getOrDefault(platform, List.of()));
        }
        result.addAll(TECHNICAL_BY_COMPLEXITY.get(complexity.orElse(ProjectComplexity.SIMPLE)));
        experience.ifPresent(tier -> result.addAll(TECHNICAL_BY_EXPERIENCE.getOrDefault(tier, List.of())));
        return List.copyOf(result);
    }

    private List<String> uiRequirements(AppIdea appIdea, Set<String> platforms) {
        Set<String> result = new LinkedHashSet<>();
        if (hasText(appIdea.getDesignStyle())) {
            result.addAll(UI_BY_STYLE.getOrDefault(lower(appIdea.getDesignStyle()), List.of()));
        }
        if (hasText(appIdea.getStyleDescription())) {
            result.add("Style preference: " + appIdea.getStyleDescription().trim());
        }
        if (platforms.contains(PLATFORM_MOBILE)) {
            result.addAll(UI_MOBILE);
        }
        result.addAll(UI_BASELINE);
        return List.copyOf(result);
    }

    private List<String> constraints(Set<String> platforms, Optional<ProjectComplexity> complexity,
            Optional<ComplexityTier> experience) {
        Set<String> result = new LinkedHashSet<>();
        if (platforms.size() == 1 && platforms.contains(PLATFORM_WEB)) {
            result.addAll(CONSTRAINTS_WEB_ONLY);
        }
        experience.ifPresent(tier -> result.addAll(CONSTRAINTS_BY_EXPERIENCE.getOrDefault(tier, List.of())));
        complexity.ifPresent(c -> result.addAll(CONSTRAINTS_BY_COMPLEXITY.getOrDefault(c, List.of())));
        result.addAll(CONSTRAINTS_BASELINE);
        return List.copyOf(result);
    }

    private List<String> techStack(String toolId, Set<String> platforms) {
        String key = toolId != null ? lower(toolId) : "";
        Set<String> result = new LinkedHashSet<>(TECH_STACK_BY_TOOL.getOrDefault(key, DEFAULT_TECH_STACK));
        if (platforms.contains(PLATFORM_WEB)) {
            result.addAll(WEB_STACK_ADDITIONS);
        }
        return List.copyOf(result);
    }

    private List<String> projectRequirements(ValidationAnswers answers) {
        Set<String> result = new LinkedHashSet<>();
        if (Boolean.TRUE.equals(answers.getHasValidated())) {
            result.add("Idea validated with potential users");
        }
        if (Boolean.TRUE.equals(answers.getHasDiscussed())) {
            result.add("Idea discussed with the target audience");
        }
        if (hasText(answers.getMotivation())) {
            result.add("Motivation: " + answers.getMotivation().trim());
        }
        return List.copyOf(result);
    }

    private static Set<String> normalizePlatforms(Collection<String> raw) {
        Set<String> result = new LinkedHashSet<>();
        if (raw == null) {
            return result;
        }
        for (String platform : raw) {
            if (hasText(platform)) {
                result.add(lower(platform));
            }
        }
        return result;
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.promptforge.domain.exception.CompositionException;
import me.golemcore.promptforge.domain.model.KnowledgeEntry;
import me.golemcore.promptforge.domain.model.ProjectInfo;
import me.golemcore.promptforge.domain.model.PromptDraft;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.domain.model.PromptingStrategy;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.domain.model.TaskContext;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fills the selected strategy skeleton of a tool profile with the normalized
 * context and retrieved knowledge.
 *
 * <p>
 * Composition is a pure function of its inputs. The best strategy is the most
 * effective one whose use-cases cover the task type or stage; a per-stage
 * template on the profile replaces its skeleton. Requirement sections with no
 * entries, and the knowledge section when nothing was retrieved, are omitted
 * entirely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptComposer {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final String ELLIPSIS = "...";

    private final PlaceholderTemplateEngine templateEngine;
    private final PromptForgeProperties properties;

    public PromptDraft compose(TaskContext taskContext, ProjectInfo projectInfo, ToolProfile profile,
            List<RetrievalResult> documents, List<RetrievalResult> templates, PromptStage stage) {
        if (profile.getStrategies().isEmpty()) {
            throw new CompositionException("Tool profile '" + profile.getId() + "' has no strategies");
        }
        PromptingStrategy strategy = selectStrategy(profile, taskContext.getTaskType(), stage);
        String skeleton = profile.stageTemplate(stage).orElse(strategy.getTemplate());

        Map<String, String> variables = baseVariables(taskContext, projectInfo, profile, stage);
        List<RetrievalResult> used = new ArrayList<>();
        variables.put(PromptVariables.KNOWLEDGE_EXCERPTS,
                knowledgeExcerpts(documents, templates, variables, used));

        String text;
        try {
            text = templateEngine.render(skeleton, variables);
        } catch (RuntimeException e) {
            throw new CompositionException("Failed to fill template for tool '" + profile.getId() + "'", e);
        }
        if (text == null) {
            throw new CompositionException("Tool profile '" + profile.getId() + "' has an empty template");
        }
        text = EXCESS_BLANK_LINES.matcher(text.strip()).replaceAll("\n\n");
        if (text.isEmpty()) {
            throw new CompositionException("Template for tool '" + profile.getId() + "' rendered to nothing");
        }

        log.debug("[Composer] {} strategy for {} ({} chars, {} sources)", strategy.getKind().getValue(),
                profile.getId(), text.length(), used.size());
        return PromptDraft.builder()
                .text(text)
                .strategyKind(strategy.getKind())
                .usedSources(used)
                .build();
    }

    /**
     * Maximum number of knowledge sources a single prompt can cite.
     */
    public int maxKnowledgeSources() {
        return Math.max(0, properties.getComposition().getMaxExcerptDocuments()) + 1;
    }

    PromptingStrategy selectStrategy(ToolProfile profile, String taskType, PromptStage stage) {
        return profile.strategiesFor(taskType, stage).get(0);
    }

    private Map<String, String> baseVariables(TaskContext taskContext, ProjectInfo projectInfo,
            ToolProfile profile, PromptStage stage) {
        Map<String, String> variables = new HashMap<>();
        variables.put(PromptVariables.TOOL_NAME, profile.getDisplayName());
        variables.put(PromptVariables.TOOL_TONE, nullToEmpty(profile.getTone()));
        variables.put(PromptVariables.OUTPUT_FORMAT, nullToEmpty(profile.getOutputFormat()));
        variables.put(PromptVariables.PROJECT_NAME, projectInfo.getName());
        variables.put(PromptVariables.PROJECT_DESCRIPTION, projectInfo.getDescription());
        variables.put(PromptVariables.TECH_STACK, String.join(", ", projectInfo.getTechStack()));
        variables.put(PromptVariables.TARGET_AUDIENCE, nullToEmpty(projectInfo.getTargetAudience()));
        variables.put(PromptVariables.TASK_TYPE, humanize(taskContext.getTaskType()));
        variables.put(PromptVariables.TASK_DESCRIPTION, taskContext.getDescription());
        variables.put(PromptVariables.STAGE, humanize(stage.getValue()));
        variables.put(PromptVariables.TECHNICAL_REQUIREMENTS,
                section("Technical Requirements", taskContext.getTechnicalRequirements()));
        variables.put(PromptVariables.UI_REQUIREMENTS,
                section("UI/UX Requirements", taskContext.getUiRequirements()));
        variables.put(PromptVariables.CONSTRAINTS, section("Constraints", constraints(taskContext, profile)));
        variables.put(PromptVariables.GUIDELINES,
                section(profile.getDisplayName() + " Guidelines", profile.getGuidelines()));
        variables.put(PromptVariables.OPTIMIZATION_TIPS, section("Tips", profile.getOptimizationTips()));
        return variables;
    }

    private List<String> constraints(TaskContext taskContext, ToolProfile profile) {
        List<String> merged = new ArrayList<>(taskContext.getConstraints());
        for (String constraint : profile.getConstraints()) {
            if (!merged.contains(constraint)) {
                merged.add(constraint);
            }
        }
        return merged;
    }

    private String knowledgeExcerpts(List<RetrievalResult> documents, List<RetrievalResult> templates,
            Map<String, String> variables, List<RetrievalResult> used) {
        int maxDocuments = Math.max(0, properties.getComposition().getMaxExcerptDocuments());
        int maxChars = properties.getComposition().getMaxExcerptChars();
        StringBuilder sb = new StringBuilder();

        if (documents != null) {
            for (RetrievalResult result : documents.stream().limit(maxDocuments).toList()) {
                KnowledgeEntry entry = result.entry();
                sb.append("### ").append(entry.displayTitle()).append("\n");
                sb.append(truncate(entry.getContent().strip(), maxChars)).append("\n\n");
                used.add(result);
            }
        }
        if (templates != null && !templates.isEmpty()) {
            RetrievalResult best = templates.get(0);
            sb.append("### Template: ").append(best.entry().displayTitle()).append("\n");
            sb.append(truncate(renderTemplate(best.entry(), variables), maxChars)).append("\n\n");
            used.add(best);
        }

        if (sb.isEmpty()) {
            return "";
        }
        return "## Reference Material\n" + sb.toString().strip();
    }

    private String renderTemplate(KnowledgeEntry entry, Map<String, String> variables) {
        String rendered = templateEngine.render(entry.getContent(), variables).strip();
        if (entry instanceof PromptTemplate template) {
            Set<String> unresolved = templateEngine.placeholders(rendered);
            List<String> missing = template.getRequiredVariables().stream()
                    .filter(unresolved::contains)
                    .toList();
            if (!missing.isEmpty()) {
                log.debug("[Composer] Template {} left required variables unresolved: {}", template.getId(),
                        missing);
            }
        }
        return rendered;
    }

    private static String section(String heading, List<String> items) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("## ").append(heading).append("\n");
        for (String item : items) {
            sb.append("- ").append(item).append("\n");
        }
        return sb.toString().strip();
    }

    private static String truncate(String text, int maxChars) {
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars - ELLIPSIS.length())).stripTrailing() + ELLIPSIS;
    }

    private static String humanize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String spaced = value.replace('_', ' ');
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

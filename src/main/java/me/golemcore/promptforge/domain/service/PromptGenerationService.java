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
import me.golemcore.promptforge.domain.exception.GenerationFailedException;
import me.golemcore.promptforge.domain.model.AppIdea;
import me.golemcore.promptforge.domain.model.CommonPitfall;
import me.golemcore.promptforge.domain.model.EnhancementOutcome;
import me.golemcore.promptforge.domain.model.EnhancementResult;
import me.golemcore.promptforge.domain.model.EnhancementSkipReason;
import me.golemcore.promptforge.domain.model.GeneratedPrompt;
import me.golemcore.promptforge.domain.model.GenerationAnalyticsEvent;
import me.golemcore.promptforge.domain.model.NormalizedContext;
import me.golemcore.promptforge.domain.model.PromptDraft;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.PromptingStrategy;
import me.golemcore.promptforge.domain.model.RetrievalFilters;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.domain.model.RetrievalStats;
import me.golemcore.promptforge.domain.model.StrategyKind;
import me.golemcore.promptforge.domain.model.TaskContext;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.domain.model.ValidationAnswers;
import me.golemcore.promptforge.domain.model.ValidationResult;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.AnalyticsPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Drives one prompt generation request through the pipeline.
 *
 * <p>
 * Input normalization and tool lookup run on the caller thread, so invalid
 * input and unknown tools fail immediately. The rest runs as one short-lived
 * task on the generation executor:
 * <ol>
 * <li>document and template retrieval, concurrently, each bounded by
 * {@code promptforge.retrieval.timeout-ms}</li>
 * <li>composition, the only step whose failure fails the request</li>
 * <li>best-effort enhancement</li>
 * <li>confidence scoring and validation</li>
 * </ol>
 * An analytics event is published after the result is delivered. Cancelling
 * the returned future cancels in-flight retrieval and enhancement, discards
 * partial results and suppresses the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptGenerationService {

    private static final int QUERY_REQUIREMENTS = 3;
    private static final int MANY_TECHNICAL_REQUIREMENTS = 3;

    private final ContextNormalizer contextNormalizer;
    private final ToolProfileRegistry toolProfileRegistry;
    private final KnowledgeRetrievalService retrievalService;
    private final PromptComposer promptComposer;
    private final PromptEnhancementService enhancementService;
    private final ConfidenceScorer confidenceScorer;
    private final PromptValidator promptValidator;
    private final AnalyticsPort analyticsPort;
    private final PromptForgeProperties properties;
    private final ExecutorService generationExecutor;
    private final Clock clock;

    /**
     * Generates a prompt for the target tool and stage.
     *
     * @param appIdea
     *            the application idea, name and description are mandatory
     * @param answers
     *            idea validation answers, may be null
     * @param targetTool
     *            tool id, falls back to the preferred tool in the answers
     * @param stageValue
     *            stage id, null for the first stage
     * @return future completing with the prompt, or exceptionally with
     *         {@link GenerationFailedException}
     * @throws me.golemcore.promptforge.domain.exception.MissingRequiredFieldException
     *             if the app name or description is missing
     * @throws me.golemcore.promptforge.domain.exception.UnsupportedToolException
     *             if the tool has no profile
     */
    public CompletableFuture<GeneratedPrompt> generate(AppIdea appIdea, ValidationAnswers answers, String targetTool,
            String stageValue) {
        PromptStage stage = resolveStage(stageValue);
        String toolId = resolveToolId(targetTool, answers);
        NormalizedContext context = contextNormalizer.normalize(appIdea, answers, toolId, stage);
        ToolProfile profile = toolProfileRegistry.getProfile(toolId);

        long startedAt = clock.millis();
        GenerationRun run = new GenerationRun();
        CompletableFuture<GeneratedPrompt> result = new CompletableFuture<>();
        result.whenComplete((prompt, error) -> {
            if (result.isCancelled()) {
                log.info("[Generation] Request for {} cancelled", profile.getId());
                run.cancel();
            }
        });

        try {
            generationExecutor.execute(() -> runPipeline(context, profile, stage, run, result, startedAt));
        } catch (RejectedExecutionException e) {
            fail(result, profile, stage, startedAt, e);
        }
        return result;
    }

    public ValidationResult validate(String text) {
        return promptValidator.validate(text);
    }

    public ValidationResult validate(String text, String toolId, String projectName) {
        ToolProfile profile = toolId != null && !toolId.isBlank() ? toolProfileRegistry.getProfile(toolId) : null;
        return promptValidator.validate(text, projectName, profile);
    }

    public List<String> listTools() {
        return toolProfileRegistry.listTools();
    }

    public List<PromptingStrategy> listStrategies(String toolId, String stageValue) {
        return toolProfileRegistry.listStrategiesFor(toolId, resolveStage(stageValue));
    }

    PromptStage resolveStage(String stageValue) {
        if (stageValue == null || stageValue.isBlank()) {
            return PromptStage.APP_SKELETON;
        }
        return PromptStage.fromValue(stageValue).orElseGet(() -> {
            log.warn("[Generation] Unknown stage '{}', using {}", stageValue, PromptStage.FEATURE_SPECIFIC.getValue());
            return PromptStage.FEATURE_SPECIFIC;
        });
    }

    private String resolveToolId(String targetTool, ValidationAnswers answers) {
        if (targetTool != null && !targetTool.isBlank()) {
            return targetTool.trim();
        }
        if (answers != null && answers.getPreferredAiTool() != null && !answers.getPreferredAiTool().isBlank()) {
            return answers.getPreferredAiTool().trim();
        }
        return properties.getGeneration().getDefaultTool();
    }

    private void runPipeline(NormalizedContext context, ToolProfile profile, PromptStage stage, GenerationRun run,
            CompletableFuture<GeneratedPrompt> result, long startedAt) {
        TaskContext taskContext = context.taskContext();
        try {
            String query = buildQuery(taskContext);
            long timeoutMs = properties.getRetrieval().getTimeoutMs();

            CompletableFuture<List<RetrievalResult>> documentsFuture = run.track(retrieveAsync(
                    abandoned -> retrievalService.searchDocuments(query, documentFilters(profile), abandoned),
                    timeoutMs, "documents"));
            CompletableFuture<List<RetrievalResult>> templatesFuture = run.track(retrieveAsync(
                    abandoned -> retrievalService.searchTemplates(query, templateFilters(profile, stage), abandoned),
                    timeoutMs, "templates"));
            List<RetrievalResult> documents = documentsFuture.join();
            List<RetrievalResult> templates = templatesFuture.join();
            if (result.isDone()) {
                return;
            }

            PromptDraft draft;
            try {
                draft = promptComposer.compose(taskContext, context.projectInfo(), profile, documents, templates,
                        stage);
            } catch (RuntimeException e) {
                log.error("[Generation] Composition failed for {}", profile.getId(), e);
                fail(result, profile, stage, startedAt, e);
                return;
            }

            EnhancementResult enhancement = run.track(
                    enhancementService.enhance(draft.getText(), profile, taskContext.getProjectName())).join();
            if (result.isDone()) {
                return;
            }

            GeneratedPrompt prompt = assemble(taskContext, profile, stage, draft, enhancement);
            if (result.complete(prompt)) {
                log.info("[Generation] {} prompt for {} ready: {} chars, confidence {}", stage.getValue(),
                        profile.getId(), prompt.getText().length(), String.format("%.2f", prompt.getConfidenceScore()));
                publishAnalytics(prompt.getToolId(), stage, prompt.getConfidenceScore(), prompt.getText().length(),
                        true, startedAt, prompt.getKnowledgeSources().size(), prompt.getEnhancement().isApplied());
            }
        } catch (CancellationException e) {
            log.debug("[Generation] Pipeline for {} stopped after cancellation", profile.getId());
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException) {
                log.debug("[Generation] Pipeline for {} stopped after cancellation", profile.getId());
                return;
            }
            log.error("[Generation] Pipeline failed for {}", profile.getId(), e);
            fail(result, profile, stage, startedAt, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            log.error("[Generation] Pipeline failed for {}", profile.getId(), e);
            fail(result, profile, stage, startedAt, e);
        }
    }

    /**
     * Runs one search on the generation executor. Once the returned future is
     * done, by timeout or cancellation, the search is interrupted and its usage
     * is no longer recorded.
     */
    private CompletableFuture<List<RetrievalResult>> retrieveAsync(
            Function<BooleanSupplier, List<RetrievalResult>> search, long timeoutMs, String corpus) {
        CompletableFuture<List<RetrievalResult>> retrieval = new CompletableFuture<>();
        AtomicBoolean searchFinished = new AtomicBoolean();
        Future<?> task = generationExecutor.submit(() -> {
            List<RetrievalResult> results;
            try {
                results = search.apply(retrieval::isDone);
            } catch (RuntimeException e) {
                log.warn("[Generation] {} retrieval failed, continuing without: {}", corpus, e.getMessage());
                results = List.of();
            }
            searchFinished.set(true);
            retrieval.complete(results);
        });
        retrieval.whenComplete((results, error) -> {
            if (!searchFinished.get()) {
                log.debug("[Generation] {} retrieval abandoned, interrupting search", corpus);
                task.cancel(true);
            }
        });
        return retrieval.completeOnTimeout(List.of(), timeoutMs, TimeUnit.MILLISECONDS);
    }

    private GeneratedPrompt assemble(TaskContext taskContext, ToolProfile profile, PromptStage stage,
            PromptDraft draft, EnhancementResult enhancement) {
        String text = enhancement.getText();
        RetrievalStats stats = RetrievalStats.of(draft.getUsedSources(), promptComposer.maxKnowledgeSources());
        double confidence = confidenceScorer.score(text, taskContext, stats, enhancement.isApplied());
        ValidationResult validation = promptValidator.validate(text, taskContext.getProjectName(), profile);
        List<String> sources = draft.knowledgeSourceIds();

        return GeneratedPrompt.builder()
                .text(text)
                .toolId(profile.getId())
                .stage(stage)
                .strategyKind(draft.getStrategyKind())
                .confidenceScore(confidence)
                .enhancementSuggestions(suggestions(taskContext, profile, validation, sources, enhancement))
                .toolOptimizations(toolOptimizations(taskContext, profile))
                .knowledgeSources(sources)
                .nextSuggestedStage(stage.next().orElse(null))
                .validation(validation)
                .enhancement(EnhancementOutcome.builder()
                        .applied(enhancement.isApplied())
                        .skipReason(enhancement.getSkipReason())
                        .confidence(confidence)
                        .sources(sources)
                        .build())
                .build();
    }

    private List<String> suggestions(TaskContext taskContext, ToolProfile profile, ValidationResult validation,
            List<String> sources, EnhancementResult enhancement) {
        Set<String> suggestions = new LinkedHashSet<>(validation.getSuggestions());
        if (taskContext.getTechnicalRequirements().isEmpty()) {
            suggestions.add("Add specific technical requirements to guide the implementation");
        }
        if (taskContext.getDescription().length() < ConfidenceScorer.DESCRIPTIVE_LENGTH) {
            suggestions.add("Describe the idea in more detail: who uses it, and for what");
        }
        if (sources.isEmpty()) {
            suggestions.add("Add reference material for " + profile.getDisplayName()
                    + " to the knowledge base to ground future prompts");
        }
        if (!enhancement.isApplied() && enhancement.getSkipReason() != EnhancementSkipReason.DISABLED) {
            suggestions.add("Enhancement was skipped; regenerate later for a more detailed prompt");
        }
        for (CommonPitfall pitfall : profile.getCommonPitfalls()) {
            if (pitfall.getPattern() == null && pitfall.getSuggestion() != null) {
                suggestions.add(pitfall.getSuggestion());
            }
        }
        return List.copyOf(suggestions);
    }

    private List<String> toolOptimizations(TaskContext taskContext, ToolProfile profile) {
        List<String> optimizations = new ArrayList<>(profile.getOptimizationTips());
        boolean incremental = profile.getStrategies().stream()
                .anyMatch(strategy -> strategy.getKind() == StrategyKind.INCREMENTAL);
        if (incremental && taskContext.getTechnicalRequirements().size() > MANY_TECHNICAL_REQUIREMENTS) {
            optimizations.add("Build incrementally: start with the core layout, then add one feature at a time");
        }
        return optimizations;
    }

    private String buildQuery(TaskContext taskContext) {
        StringBuilder query = new StringBuilder()
                .append(taskContext.getProjectName()).append(' ')
                .append(taskContext.getDescription()).append(' ')
                .append(taskContext.getTaskType().replace('_', ' '));
        taskContext.getTechnicalRequirements().stream()
                .limit(QUERY_REQUIREMENTS)
                .forEach(requirement -> query.append(' ').append(requirement));
        return query.toString();
    }

    private RetrievalFilters documentFilters(ToolProfile profile) {
        return RetrievalFilters.builder()
                .targetTool(profile.getId())
                .build();
    }

    private RetrievalFilters templateFilters(ToolProfile profile, PromptStage stage) {
        return RetrievalFilters.builder()
                .targetTool(profile.getId())
                .templateType(stage.getTemplateType())
                .build();
    }

    private void fail(CompletableFuture<GeneratedPrompt> result, ToolProfile profile, PromptStage stage,
            long startedAt, Throwable cause) {
        if (result.completeExceptionally(new GenerationFailedException(profile.getId(), cause))) {
            publishAnalytics(profile.getId(), stage, 0.0, 0, false, startedAt, 0, false);
        }
    }

    private void publishAnalytics(String toolId, PromptStage stage, double confidence, int promptLength,
            boolean success, long startedAt, int sourceCount, boolean enhancementApplied) {
        GenerationAnalyticsEvent event = GenerationAnalyticsEvent.builder()
                .toolId(toolId)
                .stage(stage)
                .confidenceScore(confidence)
                .promptLength(promptLength)
                .success(success)
                .latencyMs(Math.max(0, clock.millis() - startedAt))
                .knowledgeSourceCount(sourceCount)
                .enhancementApplied(enhancementApplied)
                .occurredAt(clock.instant())
                .build();
        try {
            analyticsPort.publish(event);
        } catch (RuntimeException e) {
            log.warn("[Generation] Failed to publish analytics for {}: {}", toolId, e.getMessage());
        }
    }

    /**
     * In-flight futures of one request, cancelled together when the caller gives
     * up.
     */
    private static final class GenerationRun {

        private final List<Future<?>> inFlight = new ArrayList<>();
        private boolean cancelled;

        synchronized <T> CompletableFuture<T> track(CompletableFuture<T> future) {
            if (cancelled) {
                future.cancel(true);
            } else {
                inFlight.add(future);
            }
            return future;
        }

        synchronized void cancel() {
            cancelled = true;
            for (Future<?> future : inFlight) {
                future.cancel(true);
            }
            inFlight.clear();
        }
    }
}

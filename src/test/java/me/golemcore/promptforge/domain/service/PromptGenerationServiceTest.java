package me.golemcore.promptforge.domain.service;

import me.golemcore.promptforge.domain.exception.CompositionException;
import me.golemcore.promptforge.domain.exception.GenerationFailedException;
import me.golemcore.promptforge.domain.exception.MissingRequiredFieldException;
import me.golemcore.promptforge.domain.exception.UnsupportedToolException;
import me.golemcore.promptforge.domain.model.AppIdea;
import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.EnhancementSkipReason;
import me.golemcore.promptforge.domain.model.GeneratedPrompt;
import me.golemcore.promptforge.domain.model.GenerationAnalyticsEvent;
import me.golemcore.promptforge.domain.model.KnowledgeDocument;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.domain.model.RetrievalFilters;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.domain.model.StrategyKind;
import me.golemcore.promptforge.domain.model.TemplateType;
import me.golemcore.promptforge.domain.model.ValidationAnswers;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.AnalyticsPort;
import me.golemcore.promptforge.port.outbound.EnhancementPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PromptGenerationServiceTest {

    private static final String DESCRIPTION = "A habit tracker that helps busy professionals build routines "
            + "with daily streaks and gentle reminders";
    private static final long WAIT_SECONDS = 5;

    private PromptForgeProperties properties;
    private ToolProfileRegistry registry;
    private KnowledgeRetrievalService retrievalService;
    private EnhancementPort enhancementPort;
    private AnalyticsPort analyticsPort;
    private PromptComposer composer;
    private ExecutorService executor;
    private PromptGenerationService service;

    @BeforeEach
    void setUp() {
        properties = new PromptForgeProperties();
        properties.getRetrieval().setTimeoutMs(1000);
        properties.getEnhancement().setTimeoutMs(2000);
        PlaceholderTemplateEngine engine = new PlaceholderTemplateEngine();
        registry = new ToolProfileRegistry(properties, new DefaultResourceLoader(), engine);
        registry.init();
        retrievalService = mock(KnowledgeRetrievalService.class);
        enhancementPort = mock(EnhancementPort.class);
        analyticsPort = mock(AnalyticsPort.class);
        composer = new PromptComposer(engine, properties);
        executor = Executors.newCachedThreadPool();
        when(enhancementPort.isAvailable()).thenReturn(true);
        when(retrievalService.searchDocuments(anyString(), any(), any())).thenReturn(List.of());
        when(retrievalService.searchTemplates(anyString(), any(), any())).thenReturn(List.of());
        service = createService(composer);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldGenerateGroundedSkeletonPrompt() throws Exception {
        when(retrievalService.searchDocuments(anyString(), any(), any())).thenReturn(List.of(
                new RetrievalResult(document("doc-structure", "Structuring a first prompt",
                        "List the pages the first version needs."), CorpusKind.DOCUMENTS, 0.8)));
        when(retrievalService.searchTemplates(anyString(), any(), any())).thenReturn(List.of(
                new RetrievalResult(template("tpl-skeleton", "Lovable app skeleton",
                        "Create the skeleton of {{PROJECT_NAME}}."), CorpusKind.TEMPLATES, 0.8)));

        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "lovable", "app_skeleton")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals("lovable", prompt.getToolId());
        assertEquals(PromptStage.APP_SKELETON, prompt.getStage());
        assertEquals(PromptStage.PAGE_UI, prompt.getNextSuggestedStage());
        assertEquals(StrategyKind.STRUCTURED, prompt.getStrategyKind());
        assertTrue(prompt.getText().contains("Habit Tracker"));
        assertTrue(prompt.getText().contains("### Structuring a first prompt"));
        assertTrue(prompt.getText().contains("Create the skeleton of Habit Tracker."));
        assertEquals(List.of("doc-structure", "tpl-skeleton"), prompt.getKnowledgeSources());
        assertTrue(prompt.getValidation().isValid());
        assertEquals(0.4 + 0.4 * (0.5 * 0.5 + 0.5 * 0.8), prompt.getConfidenceScore(), 1e-9);
        assertFalse(prompt.getEnhancement().isApplied());
        assertEquals(EnhancementSkipReason.DISABLED, prompt.getEnhancement().getSkipReason());
        assertEquals(prompt.getKnowledgeSources(), prompt.getEnhancement().getSources());

        ArgumentCaptor<GenerationAnalyticsEvent> captor = ArgumentCaptor.forClass(GenerationAnalyticsEvent.class);
        verify(analyticsPort, timeout(1000)).publish(captor.capture());
        GenerationAnalyticsEvent event = captor.getValue();
        assertTrue(event.isSuccess());
        assertEquals("lovable", event.getToolId());
        assertEquals(prompt.getText().length(), event.getPromptLength());
        assertEquals(2, event.getKnowledgeSourceCount());
    }

    @Test
    void shouldFilterRetrievalByToolAndStage() throws Exception {
        service.generate(habitTracker(), answers(), "cursor", "debugging").get(WAIT_SECONDS, TimeUnit.SECONDS);

        ArgumentCaptor<RetrievalFilters> documentFilters = ArgumentCaptor.forClass(RetrievalFilters.class);
        ArgumentCaptor<RetrievalFilters> templateFilters = ArgumentCaptor.forClass(RetrievalFilters.class);
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(retrievalService).searchDocuments(query.capture(), documentFilters.capture(), any());
        verify(retrievalService).searchTemplates(anyString(), templateFilters.capture(), any());

        assertTrue(query.getValue().startsWith("Habit Tracker " + DESCRIPTION + " debugging"));
        assertEquals(Set.of("cursor"), documentFilters.getValue().getTargetTools());
        assertNull(documentFilters.getValue().getTemplateType());
        assertEquals(TemplateType.DEBUGGING, templateFilters.getValue().getTemplateType());
    }

    @Test
    void shouldDegradeWithoutKnowledge() throws Exception {
        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "lovable", null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(prompt.getKnowledgeSources().isEmpty());
        assertEquals(0.4, prompt.getConfidenceScore(), 1e-9);
        assertFalse(prompt.getText().contains("Reference Material"));
        assertTrue(prompt.getEnhancementSuggestions().contains(
                "Add reference material for Lovable.dev to the knowledge base to ground future prompts"));
    }

    @Test
    void shouldContinueWhenRetrievalIsSlowOrFailing() throws Exception {
        properties.getRetrieval().setTimeoutMs(50);
        when(retrievalService.searchDocuments(anyString(), any(), any())).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return List.of(new RetrievalResult(document("doc-late", "Late", "Too late."), CorpusKind.DOCUMENTS,
                    0.9));
        });
        when(retrievalService.searchTemplates(anyString(), any(), any()))
                .thenThrow(new IllegalStateException("index offline"));

        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "bolt", "page_ui")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(prompt.getKnowledgeSources().isEmpty());
        assertTrue(prompt.getText().contains("Habit Tracker"));
        assertEquals(PromptStage.FLOW_CONNECTIONS, prompt.getNextSuggestedStage());
    }

    @Test
    void shouldUseEnhancedTextWhenAvailable() throws Exception {
        properties.getEnhancement().setEnabled(true);
        String enhanced = "Build Habit Tracker as a React app with Supabase auth, a streak dashboard and "
                + "reminder settings. Create the routing, the shared layout and an empty state for each page, "
                + "and implement accessible forms with inline validation for every input.";
        when(enhancementPort.enhance(any())).thenReturn(CompletableFuture.completedFuture(enhanced));

        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "lovable", "app_skeleton")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(enhanced, prompt.getText());
        assertTrue(prompt.getEnhancement().isApplied());
        assertNull(prompt.getEnhancement().getSkipReason());
        assertEquals(0.4 + 0.2, prompt.getConfidenceScore(), 1e-9);
    }

    @Test
    void shouldKeepDraftWhenEnhancementFails() throws Exception {
        properties.getEnhancement().setEnabled(true);
        when(enhancementPort.enhance(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "lovable", "app_skeleton")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertFalse(prompt.getEnhancement().isApplied());
        assertEquals(EnhancementSkipReason.FAILED, prompt.getEnhancement().getSkipReason());
        assertTrue(prompt.getText().startsWith("# App architecture - Habit Tracker"));
        assertTrue(prompt.getEnhancementSuggestions()
                .contains("Enhancement was skipped; regenerate later for a more detailed prompt"));
    }

    @Test
    void shouldAddPitfallAdviceAndIncrementalTip() throws Exception {
        ValidationAnswers answers = answers();
        answers.setProjectComplexity("complex");

        GeneratedPrompt prompt = service.generate(habitTracker(), answers, "claude", "feature_specific")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(StrategyKind.CONVERSATIONAL, prompt.getStrategyKind());
        assertTrue(prompt.getEnhancementSuggestions()
                .contains("Attach or paste the files the change touches when you use this prompt"));
        assertFalse(prompt.getToolOptimizations().contains(
                "Build incrementally: start with the core layout, then add one feature at a time"));

        GeneratedPrompt boltPrompt = service.generate(habitTracker(), answers, "bolt", "feature_specific")
                .get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertTrue(boltPrompt.getToolOptimizations().contains(
                "Build incrementally: start with the core layout, then add one feature at a time"));
    }

    @Test
    void shouldFallBackToPreferredToolAndDefault() throws Exception {
        ValidationAnswers answers = answers();
        answers.setPreferredAiTool("v0");

        assertEquals("v0", service.generate(habitTracker(), answers, null, null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS).getToolId());
        assertEquals("lovable", service.generate(habitTracker(), null, " ", null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS).getToolId());
    }

    @Test
    void shouldRejectInvalidInputSynchronously() {
        AppIdea nameless = AppIdea.builder().ideaDescription(DESCRIPTION).build();

        assertThrows(MissingRequiredFieldException.class,
                () -> service.generate(nameless, answers(), "lovable", null));
        assertThrows(UnsupportedToolException.class,
                () -> service.generate(habitTracker(), answers(), "notepad", null));
        verify(analyticsPort, never()).publish(any());
    }

    @Test
    void shouldRejectEmptyDescriptionBeforeRetrieval() {
        AppIdea undescribed = AppIdea.builder().appName("TaskMaster Pro").ideaDescription("  ").build();

        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> service.generate(undescribed, null, "lovable", "skeleton"));

        assertEquals("ideaDescription", ex.getField());
        verify(retrievalService, never()).searchDocuments(any(), any(), any());
        verify(retrievalService, never()).searchTemplates(any(), any(), any());
        verify(analyticsPort, never()).publish(any());
    }

    @Test
    void shouldInterruptAndAbandonSearchAfterTimeout() throws Exception {
        properties.getRetrieval().setTimeoutMs(200);
        AtomicReference<BooleanSupplier> abandoned = new AtomicReference<>();
        CountDownLatch interrupted = new CountDownLatch(1);
        when(retrievalService.searchDocuments(anyString(), any(), any())).thenAnswer(invocation -> {
            abandoned.set(invocation.getArgument(2));
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return List.of();
        });

        GeneratedPrompt prompt = service.generate(habitTracker(), answers(), "lovable", null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(prompt.getKnowledgeSources().isEmpty());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        assertTrue(abandoned.get().getAsBoolean());
    }

    @Test
    void shouldFailWhenCompositionFails() {
        PromptComposer failingComposer = mock(PromptComposer.class);
        when(failingComposer.compose(any(), any(), any(), any(), any(), any()))
                .thenThrow(new CompositionException("template exploded"));
        service = createService(failingComposer);

        CompletableFuture<GeneratedPrompt> result = service.generate(habitTracker(), answers(), "lovable", null);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> result.get(WAIT_SECONDS, TimeUnit.SECONDS));
        GenerationFailedException failure = assertInstanceOf(GenerationFailedException.class, ex.getCause());
        assertEquals("lovable", failure.getToolId());
        assertInstanceOf(CompositionException.class, failure.getCause());

        ArgumentCaptor<GenerationAnalyticsEvent> captor = ArgumentCaptor.forClass(GenerationAnalyticsEvent.class);
        verify(analyticsPort, timeout(1000)).publish(captor.capture());
        assertFalse(captor.getValue().isSuccess());
        assertEquals(0.0, captor.getValue().getConfidenceScore());
        assertEquals(0, captor.getValue().getPromptLength());
    }

    @Test
    void shouldCancelInFlightEnhancement() throws Exception {
        properties.getEnhancement().setEnabled(true);
        properties.getRetrieval().setTimeoutMs(20_000);
        properties.getEnhancement().setTimeoutMs(10_000);
        CompletableFuture<String> pendingCall = new CompletableFuture<>();
        when(enhancementPort.enhance(any())).thenReturn(pendingCall);

        CompletableFuture<GeneratedPrompt> result = service.generate(habitTracker(), answers(), "lovable", null);
        verify(enhancementPort, timeout(2000)).enhance(any());
        assertTrue(result.cancel(true));

        long deadline = System.currentTimeMillis() + 2000;
        while (!pendingCall.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(pendingCall.isCancelled());
        verify(analyticsPort, after(200).never()).publish(any());
    }

    @Test
    void shouldResolveUnknownStageToFeatureSpecific() {
        assertEquals(PromptStage.APP_SKELETON, service.resolveStage(null));
        assertEquals(PromptStage.APP_SKELETON, service.resolveStage("skeleton"));
        assertEquals(PromptStage.FEATURE_SPECIFIC, service.resolveStage("moon_landing"));
    }

    @Test
    void shouldValidateWithToolPitfalls() {
        String text = "Build Habit Tracker with Docker containers. ".repeat(6);

        assertTrue(service.validate(text, "bolt", "Habit Tracker").getIssues()
                .contains("Bolt.new pitfall: Container tooling"));
        assertTrue(service.validate(text).isValid());
    }

    @Test
    void shouldListToolsAndStrategies() {
        assertEquals(List.of("lovable", "bolt", "cursor", "v0", "claude", "chatgpt"), service.listTools());
        assertEquals(StrategyKind.INCREMENTAL, service.listStrategies("lovable", "debugging").get(0).getKind());
        assertTrue(service.listStrategies("lovable", "debugging").get(0).getTemplate()
                .startsWith("# Debugging {{PROJECT_NAME}}"));
    }

    private PromptGenerationService createService(PromptComposer promptComposer) {
        return new PromptGenerationService(
                new ContextNormalizer(properties),
                registry,
                retrievalService,
                promptComposer,
                new PromptEnhancementService(enhancementPort, properties),
                new ConfidenceScorer(),
                new PromptValidator(properties),
                analyticsPort,
                properties,
                executor,
                Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));
    }

    private static AppIdea habitTracker() {
        return AppIdea.builder()
                .appName("Habit Tracker")
                .ideaDescription(DESCRIPTION)
                .platforms(List.of("web"))
                .designStyle("minimal")
                .build();
    }

    private static ValidationAnswers answers() {
        return ValidationAnswers.builder()
                .projectComplexity("simple")
                .technicalExperience("beginner")
                .build();
    }

    private static KnowledgeDocument document(String id, String title, String content) {
        return KnowledgeDocument.builder().id(id).title(title).content(content).build();
    }

    private static PromptTemplate template(String id, String name, String content) {
        return PromptTemplate.builder()
                .id(id)
                .name(name)
                .content(content)
                .templateType(TemplateType.SKELETON)
                .build();
    }
}

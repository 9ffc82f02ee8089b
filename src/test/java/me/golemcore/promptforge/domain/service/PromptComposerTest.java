package me.golemcore.promptforge.domain.service;

import me.golemcore.promptforge.domain.exception.CompositionException;
import me.golemcore.promptforge.domain.model.CorpusKind;
import me.golemcore.promptforge.domain.model.KnowledgeDocument;
import me.golemcore.promptforge.domain.model.ProjectInfo;
import me.golemcore.promptforge.domain.model.PromptDraft;
import me.golemcore.promptforge.domain.model.PromptStage;
import me.golemcore.promptforge.domain.model.PromptTemplate;
import me.golemcore.promptforge.domain.model.PromptingStrategy;
import me.golemcore.promptforge.domain.model.RetrievalResult;
import me.golemcore.promptforge.domain.model.StrategyKind;
import me.golemcore.promptforge.domain.model.TaskContext;
import me.golemcore.promptforge.domain.model.TemplateType;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptComposerTest {

    private static final String STRUCTURED_TEMPLATE = """
            # {{TASK_TYPE}} - {{PROJECT_NAME}}
            Tool: {{TOOL_NAME}} ({{TOOL_TONE}})
            {{PROJECT_DESCRIPTION}}
            Stack: {{TECH_STACK}}

            {{TECHNICAL_REQUIREMENTS}}

            {{UI_REQUIREMENTS}}

            {{CONSTRAINTS}}

            {{GUIDELINES}}

            {{KNOWLEDGE_EXCERPTS}}

            Build it.
            """;

    private PromptForgeProperties properties;
    private PromptComposer composer;
    private ToolProfile profile;
    private ProjectInfo projectInfo;

    @BeforeEach
    void setUp() {
        properties = new PromptForgeProperties();
        composer = new PromptComposer(new PlaceholderTemplateEngine(), properties);
        profile = ToolProfile.builder()
                .id("lovable")
                .displayName("Lovable.dev")
                .tone("official yet casual")
                .strategy(PromptingStrategy.builder()
                        .kind(StrategyKind.INCREMENTAL)
                        .template("Continue {{PROJECT_NAME}}: {{TASK_DESCRIPTION}}")
                        .useCase("feature_development")
                        .effectivenessScore(0.85)
                        .build())
                .strategy(PromptingStrategy.builder()
                        .kind(StrategyKind.STRUCTURED)
                        .template(STRUCTURED_TEMPLATE)
                        .useCase("app_architecture")
                        .effectivenessScore(0.9)
                        .build())
                .constraint("Use Supabase for persistence")
                .guideline("Use React with TypeScript")
                .stageTemplate(PromptStage.DEBUGGING, "Fix {{PROJECT_NAME}}: {{TASK_DESCRIPTION}}")
                .build();
        projectInfo = ProjectInfo.builder()
                .name("Habit Tracker")
                .description("Track daily habits")
                .techStackItem("React")
                .techStackItem("Supabase")
                .build();
    }

    @Test
    void shouldComposeWithBestApplicableStrategy() {
        PromptDraft draft = composer.compose(task(PromptStage.APP_SKELETON), projectInfo, profile,
                List.of(), List.of(), PromptStage.APP_SKELETON);

        String text = draft.getText();
        assertEquals(StrategyKind.STRUCTURED, draft.getStrategyKind());
        assertTrue(text.startsWith("# App architecture - Habit Tracker"));
        assertTrue(text.contains("Tool: Lovable.dev (official yet casual)"));
        assertTrue(text.contains("Stack: React, Supabase"));
        assertTrue(text.contains("## Technical Requirements\n- Simple, clean architecture"));
        assertTrue(text.contains("## Constraints\n- Keep feature scope minimal\n- Use Supabase for persistence"));
        assertTrue(text.contains("## Lovable.dev Guidelines\n- Use React with TypeScript"));
        assertTrue(draft.getUsedSources().isEmpty());
    }

    @Test
    void shouldOmitEmptySectionsWithoutBlankRuns() {
        PromptDraft draft = composer.compose(task(PromptStage.APP_SKELETON), projectInfo, profile,
                List.of(), List.of(), PromptStage.APP_SKELETON);

        assertFalse(draft.getText().contains("UI/UX Requirements"));
        assertFalse(draft.getText().contains("Reference Material"));
        assertFalse(draft.getText().contains("\n\n\n"));
        assertFalse(draft.getText().contains("{{"));
    }

    @Test
    void shouldPickStrategyForTaskType() {
        PromptDraft draft = composer.compose(task(PromptStage.FEATURE_SPECIFIC), projectInfo, profile,
                List.of(), List.of(), PromptStage.FEATURE_SPECIFIC);

        assertEquals(StrategyKind.INCREMENTAL, draft.getStrategyKind());
        assertEquals("Continue Habit Tracker: Track daily habits", draft.getText());
    }

    @Test
    void shouldPreferStageTemplateOverride() {
        PromptDraft draft = composer.compose(task(PromptStage.DEBUGGING), projectInfo, profile,
                List.of(), List.of(), PromptStage.DEBUGGING);

        assertEquals("Fix Habit Tracker: Track daily habits", draft.getText());
    }

    @Test
    void shouldIncludeKnowledgeExcerptsAndTrackSources() {
        properties.getComposition().setMaxExcerptDocuments(2);
        List<RetrievalResult> documents = List.of(
                document("doc-1", "Structure first", "Start with the pages.", 0.9),
                document("doc-2", "Supabase tips", "Enable row level security.", 0.8),
                document("doc-3", "Ignored", "Beyond the limit.", 0.7));
        List<RetrievalResult> templates = List.of(
                template("tpl-1", "Skeleton", "Create the skeleton of {{PROJECT_NAME}}.", 0.75),
                template("tpl-2", "Other", "Unused.", 0.6));

        PromptDraft draft = composer.compose(task(PromptStage.APP_SKELETON), projectInfo, profile,
                documents, templates, PromptStage.APP_SKELETON);

        String text = draft.getText();
        assertTrue(text.contains("## Reference Material\n### Structure first\nStart with the pages."));
        assertTrue(text.contains("### Supabase tips"));
        assertFalse(text.contains("Beyond the limit."));
        assertTrue(text.contains("### Template: Skeleton\nCreate the skeleton of Habit Tracker."));
        assertFalse(text.contains("Unused."));
        assertEquals(List.of("doc-1", "doc-2", "tpl-1"), draft.knowledgeSourceIds());
        assertEquals(3, composer.maxKnowledgeSources());
    }

    @Test
    void shouldComposeIdenticalTextForIdenticalInputs() {
        TaskContext task = task(PromptStage.APP_SKELETON);
        List<RetrievalResult> documents = List.of(
                document("doc-1", "Structure first", "Start with the pages.", 0.9));
        List<RetrievalResult> templates = List.of(
                template("tpl-1", "Skeleton", "Create the skeleton of {{PROJECT_NAME}}.", 0.75));

        PromptDraft first = composer.compose(task, projectInfo, profile, documents, templates,
                PromptStage.APP_SKELETON);
        PromptDraft second = composer.compose(task, projectInfo, profile, documents, templates,
                PromptStage.APP_SKELETON);

        assertEquals(first.getText(), second.getText());
        assertEquals(first.getStrategyKind(), second.getStrategyKind());
        assertEquals(first.knowledgeSourceIds(), second.knowledgeSourceIds());
        assertEquals("Create the skeleton of {{PROJECT_NAME}}.", templates.get(0).entry().getContent());
    }

    @Test
    void shouldTruncateLongExcerpts() {
        properties.getComposition().setMaxExcerptChars(20);
        List<RetrievalResult> documents = List.of(
                document("doc-1", "Long", "abcdefghijklmnopqrstuvwxyz", 0.9));

        PromptDraft draft = composer.compose(task(PromptStage.APP_SKELETON), projectInfo, profile,
                documents, List.of(), PromptStage.APP_SKELETON);

        assertTrue(draft.getText().contains("### Long\nabcdefghijklmnopq..."));
    }

    @Test
    void shouldRejectProfileWithoutStrategies() {
        ToolProfile empty = ToolProfile.builder().id("bare").displayName("Bare").build();

        assertThrows(CompositionException.class, () -> composer.compose(task(PromptStage.APP_SKELETON),
                projectInfo, empty, List.of(), List.of(), PromptStage.APP_SKELETON));
    }

    @Test
    void shouldRejectTemplateThatRendersToNothing() {
        ToolProfile hollow = ToolProfile.builder()
                .id("hollow")
                .displayName("Hollow")
                .strategy(PromptingStrategy.builder()
                        .kind(StrategyKind.STRUCTURED)
                        .template("{{KNOWLEDGE_EXCERPTS}}\n\n{{UI_REQUIREMENTS}}")
                        .effectivenessScore(0.5)
                        .build())
                .build();

        CompositionException ex = assertThrows(CompositionException.class,
                () -> composer.compose(task(PromptStage.APP_SKELETON), projectInfo, hollow, List.of(), List.of(),
                        PromptStage.APP_SKELETON));
        assertTrue(ex.getMessage().contains("rendered to nothing"));
    }

    private TaskContext task(PromptStage stage) {
        return TaskContext.builder()
                .taskType(stage.getTaskType())
                .projectName("Habit Tracker")
                .description("Track daily habits")
                .stage(stage)
                .technicalRequirement("Simple, clean architecture")
                .constraint("Keep feature scope minimal")
                .build();
    }

    private static RetrievalResult document(String id, String title, String content, double score) {
        KnowledgeDocument document = KnowledgeDocument.builder()
                .id(id)
                .title(title)
                .content(content)
                .build();
        return new RetrievalResult(document, CorpusKind.DOCUMENTS, score);
    }

    private static RetrievalResult template(String id, String name, String content, double score) {
        PromptTemplate template = PromptTemplate.builder()
                .id(id)
                .name(name)
                .content(content)
                .templateType(TemplateType.SKELETON)
                .requiredVariables(List.of("PROJECT_NAME"))
                .build();
        return new RetrievalResult(template, CorpusKind.TEMPLATES, score);
    }
}

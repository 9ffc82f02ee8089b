package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Development stage a prompt is generated for.
 *
 * <p>
 * Each stage carries the task type used to match prompting strategies, the
 * template type used to filter stored prompt templates, and the stage that is
 * usually worked on next.
 */
public enum PromptStage {

    APP_SKELETON("app_skeleton", "app_architecture", TemplateType.SKELETON),
    PAGE_UI("page_ui", "ui_development", TemplateType.FEATURE),
    FLOW_CONNECTIONS("flow_connections", "navigation_flow", TemplateType.FEATURE),
    FEATURE_SPECIFIC("feature_specific", "feature_development", TemplateType.FEATURE),
    DEBUGGING("debugging", "debugging", TemplateType.DEBUGGING),
    OPTIMIZATION("optimization", "optimization", TemplateType.OPTIMIZATION);

    private final String value;
    private final String taskType;
    private final TemplateType templateType;

    PromptStage(String value, String taskType, TemplateType templateType) {
        this.value = value;
        this.taskType = taskType;
        this.templateType = templateType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getTaskType() {
        return taskType;
    }

    public TemplateType getTemplateType() {
        return templateType;
    }

    @JsonCreator
    public static PromptStage fromJson(String raw) {
        return fromValue(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown prompt stage: " + raw));
    }

    /**
     * Stage usually worked on after this one, or empty once the sequence is
     * finished.
     */
    public Optional<PromptStage> next() {
        return switch (this) {
        case APP_SKELETON -> Optional.of(PAGE_UI);
        case PAGE_UI -> Optional.of(FLOW_CONNECTIONS);
        case FLOW_CONNECTIONS -> Optional.of(FEATURE_SPECIFIC);
        case FEATURE_SPECIFIC, DEBUGGING -> Optional.of(OPTIMIZATION);
        case OPTIMIZATION -> Optional.empty();
        };
    }

    /**
     * Strict lookup by wire id or enum name. Accepts {@code skeleton} as an alias
     * for {@link #APP_SKELETON}.
     */
    public static Optional<PromptStage> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("skeleton".equals(normalized)) {
            return Optional.of(APP_SKELETON);
        }
        for (PromptStage stage : values()) {
            if (stage.value.equals(normalized)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}

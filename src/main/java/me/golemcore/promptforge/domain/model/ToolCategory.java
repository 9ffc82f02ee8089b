package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad family an AI development tool belongs to.
 */
public enum ToolCategory {

    EDITOR, UI_GENERATOR, ASSISTANT, IDE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ToolCategory fromValue(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}

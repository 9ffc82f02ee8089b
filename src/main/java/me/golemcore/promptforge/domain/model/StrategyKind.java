package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Prompting strategy families a tool profile can declare.
 */
public enum StrategyKind {

    STRUCTURED, INCREMENTAL, CONTEXTUAL, COMPONENT_BASED, CONVERSATIONAL, STEP_BY_STEP;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StrategyKind fromValue(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}

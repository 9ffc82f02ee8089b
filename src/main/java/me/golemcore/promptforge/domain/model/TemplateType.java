package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of stored prompt template.
 */
public enum TemplateType {

    SKELETON, FEATURE, OPTIMIZATION, DEBUGGING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TemplateType fromValue(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

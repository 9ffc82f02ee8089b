package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of reference document stored in the knowledge base.
 */
public enum DocumentType {

    BEST_PRACTICE, EXAMPLE, TEMPLATE, GUIDE, REFERENCE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DocumentType fromValue(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}

package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Size of the project the user wants to build.
 */
public enum ProjectComplexity {

    SIMPLE, MEDIUM, COMPLEX;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ProjectComplexity> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ProjectComplexity complexity : values()) {
            if (complexity.name().equals(normalized)) {
                return Optional.of(complexity);
            }
        }
        return Optional.empty();
    }
}

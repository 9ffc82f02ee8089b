package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Experience tier, used both for the tool's learning curve and for the user's
 * technical experience.
 */
public enum ComplexityTier {

    BEGINNER, INTERMEDIATE, ADVANCED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ComplexityTier fromValue(String raw) {
        return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public static Optional<ComplexityTier> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ComplexityTier tier : values()) {
            if (tier.name().equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}

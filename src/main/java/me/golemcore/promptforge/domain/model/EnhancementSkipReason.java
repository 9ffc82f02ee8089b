package me.golemcore.promptforge.domain.model;

/**
 * Why the external enhancement step left the composed draft unchanged.
 */
public enum EnhancementSkipReason {
    DISABLED, UNAVAILABLE, TIMEOUT, FAILED, MALFORMED
}

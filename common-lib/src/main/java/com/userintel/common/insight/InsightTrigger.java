package com.userintel.common.insight;

/** When a queued insight becomes eligible to surface. */
public enum InsightTrigger {
    SESSION_START,
    IDLE,
    CONTEXTUAL,
    EXPLICIT;

    public static InsightTrigger fromString(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

package com.userintel.common.insight;

/**
 * User reaction to a delivered insight. Only {@link #EXPAND} and {@link #ACT}
 * count towards a category's engagement rate.
 */
public enum EngagementAction {
    EXPAND(InsightState.ENGAGED),
    ACT(InsightState.ENGAGED),
    DISMISS(InsightState.DISMISSED),
    IGNORE(InsightState.IGNORED);

    private final InsightState resultingState;

    EngagementAction(InsightState resultingState) {
        this.resultingState = resultingState;
    }

    public InsightState resultingState() { return resultingState; }

    public boolean countsAsEngaged() {
        return resultingState == InsightState.ENGAGED;
    }

    public static EngagementAction fromString(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

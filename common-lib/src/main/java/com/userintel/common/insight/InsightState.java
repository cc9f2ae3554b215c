package com.userintel.common.insight;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a queued insight.
 *
 * <pre>
 * PENDING ──► DELIVERED ──► ENGAGED | DISMISSED | IGNORED
 *    └──────► EXPIRED
 * </pre>
 */
public enum InsightState {
    PENDING,
    DELIVERED,
    ENGAGED,
    DISMISSED,
    IGNORED,
    EXPIRED;

    public boolean canTransitionTo(InsightState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    private Set<InsightState> allowedNext() {
        return switch (this) {
            case PENDING   -> EnumSet.of(DELIVERED, EXPIRED);
            case DELIVERED -> EnumSet.of(ENGAGED, DISMISSED, IGNORED);
            default        -> EnumSet.noneOf(InsightState.class);
        };
    }
}

package com.userintel.common.insight;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-session delivery preferences.
 *
 * @param maxPerSession       0 means unlimited
 * @param maxPerHour          interrupt budget per rolling hour
 * @param minIntervalMinutes  minimum gap between two deliveries
 */
public record InsightPreferences(
    boolean enabled,
    BubbleMode bubbleMode,
    int maxPerSession,
    int maxPerHour,
    int minIntervalMinutes,
    Set<InsightTrigger> enabledTriggers,
    Set<InsightCategory> mutedCategories
) {
    public static final int DEFAULT_MAX_PER_SESSION    = 10;
    public static final int DEFAULT_MAX_PER_HOUR       = 3;
    public static final int DEFAULT_MIN_INTERVAL_MIN   = 10;

    public InsightPreferences {
        bubbleMode         = bubbleMode == null ? BubbleMode.ON : bubbleMode;
        maxPerSession      = Math.max(0, maxPerSession);
        maxPerHour         = Math.max(0, maxPerHour);
        minIntervalMinutes = Math.max(0, minIntervalMinutes);
        enabledTriggers    = enabledTriggers == null || enabledTriggers.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(enabledTriggers));
        mutedCategories    = mutedCategories == null || mutedCategories.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(mutedCategories));
    }

    public static InsightPreferences defaults() {
        return defaults(DEFAULT_MAX_PER_HOUR);
    }

    public static InsightPreferences defaults(int hourlyLimit) {
        return new InsightPreferences(true, BubbleMode.ON, DEFAULT_MAX_PER_SESSION, hourlyLimit,
            DEFAULT_MIN_INTERVAL_MIN,
            EnumSet.of(InsightTrigger.SESSION_START, InsightTrigger.IDLE, InsightTrigger.CONTEXTUAL),
            Set.of());
    }

    public boolean isMuted(InsightCategory category) {
        return mutedCategories.contains(category);
    }

    public InsightPreferences withBubbleMode(BubbleMode mode) {
        return new InsightPreferences(enabled, mode, maxPerSession, maxPerHour,
            minIntervalMinutes, enabledTriggers, mutedCategories);
    }

    public InsightPreferences withMuted(InsightCategory category, boolean muted) {
        EnumSet<InsightCategory> next = mutedCategories.isEmpty()
            ? EnumSet.noneOf(InsightCategory.class) : EnumSet.copyOf(mutedCategories);
        if (muted) next.add(category); else next.remove(category);
        return new InsightPreferences(enabled, bubbleMode, maxPerSession, maxPerHour,
            minIntervalMinutes, enabledTriggers, next);
    }
}

package com.userintel.scheduler.strategy;

import com.userintel.common.reflection.BatchReflectionSummary;

import java.time.Duration;

/**
 * Picks the delay before the next reflection sweep from the outcome of the last one.
 *
 * <ul>
 *   <li>limit filled: backlog remains, sweep again soon</li>
 *   <li>nothing eligible: the fleet is caught up, back off</li>
 *   <li>every profile failed: storage is likely unhealthy, use the fallback</li>
 *   <li>otherwise: steady interval</li>
 * </ul>
 */
public final class SweepTempoStrategy {

    public static final Duration BACKLOG_INTERVAL  = Duration.ofMinutes(1);
    public static final Duration STEADY_INTERVAL   = Duration.ofMinutes(5);
    public static final Duration FALLBACK_INTERVAL = Duration.ofMinutes(10);
    public static final Duration IDLE_INTERVAL     = Duration.ofMinutes(30);

    private SweepTempoStrategy() {}

    /** Null summary means the sweep call itself failed. */
    public static Duration resolve(BatchReflectionSummary summary, int limit) {
        if (summary == null) return FALLBACK_INTERVAL;
        if (summary.processed() == 0) return IDLE_INTERVAL;
        if (summary.failed() > 0 && summary.failed() >= summary.processed()) return FALLBACK_INTERVAL;
        if (limit > 0 && summary.processed() >= limit) return BACKLOG_INTERVAL;
        return STEADY_INTERVAL;
    }
}

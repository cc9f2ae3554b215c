package com.userintel.common.insight;

import java.time.Duration;
import java.time.Instant;

/**
 * Hourly cap on deliveries. The window starts at the last reset and rolls
 * over once a full hour has passed since then, so it slides rather than
 * aligning to clock hours.
 */
public final class InterruptBudget {

    static final Duration WINDOW = Duration.ofHours(1);

    private int hourlyLimit;
    private int usedThisWindow;
    private Instant windowStartedAt;

    public InterruptBudget(int hourlyLimit, Instant now) {
        this.hourlyLimit     = Math.max(0, hourlyLimit);
        this.windowStartedAt = now;
    }

    /** Rolls the window if due and reports whether one more delivery fits. */
    public boolean hasRemaining(Instant now) {
        rollIfDue(now);
        return usedThisWindow < hourlyLimit;
    }

    public void consume(Instant now) {
        rollIfDue(now);
        usedThisWindow++;
    }

    public void setHourlyLimit(int hourlyLimit) {
        this.hourlyLimit = Math.max(0, hourlyLimit);
    }

    private void rollIfDue(Instant now) {
        if (Duration.between(windowStartedAt, now).compareTo(WINDOW) >= 0) {
            usedThisWindow  = 0;
            windowStartedAt = now;
        }
    }

    public int getHourlyLimit()        { return hourlyLimit; }
    public int getUsedThisWindow()     { return usedThisWindow; }
    public Instant getWindowStartedAt() { return windowStartedAt; }
}

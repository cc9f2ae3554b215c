package com.userintel.common.insight;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Leaky estimate of the user's attentional state from input cadence.
 *
 * <p>Typing faster than {@link #DEEP_CPS} characters per second over the
 * recent keystroke window reads as deep focus, above {@link #ACTIVE_CPS} as
 * active. Silence longer than {@link #IDLE_AFTER} reads as idle and longer
 * than {@link #AWAY_AFTER} as away; either one clears the typing velocity.
 * Idle checks observe time passing but are not activity themselves.
 */
public final class EngagementEstimator {

    public enum ActivityType { KEYSTROKE, MESSAGE_SENT, IDLE_CHECK }

    static final double DEEP_CPS      = 3.0;
    static final double ACTIVE_CPS    = 1.0;
    static final Duration IDLE_AFTER  = Duration.ofSeconds(30);
    static final Duration AWAY_AFTER  = Duration.ofSeconds(300);
    static final int KEYSTROKE_WINDOW = 20;

    private record Keystroke(Instant at, int chars) {}

    private final Deque<Keystroke> recentKeystrokes = new ArrayDeque<>();
    private EngagementLevel level = EngagementLevel.ACTIVE;
    private Instant lastActivityAt;
    private double typingVelocity;

    public EngagementEstimator(Instant now) {
        this.lastActivityAt = now;
    }

    public EngagementLevel update(ActivityType type, int charsTyped, Instant now) {
        switch (type) {
            case KEYSTROKE -> {
                lastActivityAt = now;
                if (charsTyped > 0) {
                    recentKeystrokes.addLast(new Keystroke(now, charsTyped));
                    while (recentKeystrokes.size() > KEYSTROKE_WINDOW) recentKeystrokes.removeFirst();
                    typingVelocity = velocity();
                }
            }
            case MESSAGE_SENT -> {
                lastActivityAt = now;
                recentKeystrokes.clear();
            }
            case IDLE_CHECK -> { }
        }
        level = classify(now);
        return level;
    }

    private double velocity() {
        if (recentKeystrokes.size() < 2) return typingVelocity;
        double seconds = Duration.between(recentKeystrokes.getFirst().at(), recentKeystrokes.getLast().at())
            .toMillis() / 1000.0;
        if (seconds <= 0) return typingVelocity;
        int chars = 0;
        for (Keystroke k : recentKeystrokes) chars += k.chars();
        return chars / seconds;
    }

    private EngagementLevel classify(Instant now) {
        Duration idle = Duration.between(lastActivityAt, now);
        if (idle.compareTo(AWAY_AFTER) > 0) {
            typingVelocity = 0;
            return EngagementLevel.AWAY;
        }
        if (idle.compareTo(IDLE_AFTER) > 0) {
            typingVelocity = 0;
            return EngagementLevel.IDLE;
        }
        if (typingVelocity > DEEP_CPS)   return EngagementLevel.DEEP;
        if (typingVelocity > ACTIVE_CPS) return EngagementLevel.ACTIVE;
        return EngagementLevel.ACTIVE;
    }

    public long idleSeconds(Instant now) {
        return Math.max(0, Duration.between(lastActivityAt, now).getSeconds());
    }

    public EngagementLevel getLevel()    { return level; }
    public Instant getLastActivityAt()   { return lastActivityAt; }
    public double getTypingVelocity()    { return typingVelocity; }
}

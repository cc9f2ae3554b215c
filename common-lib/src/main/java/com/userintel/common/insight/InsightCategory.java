package com.userintel.common.insight;

import java.time.Duration;

/**
 * Fixed taxonomy of proactively surfaced insights.
 *
 * <p>{@code magnitude} orders categories by urgency for priority scoring;
 * {@code ttl} is how long a pending insight of this kind stays deliverable.
 */
public enum InsightCategory {

    /** Behaviour contradicts an established pattern. */
    CONTRADICTION(4, Duration.ofHours(24)),
    /** User seems stuck or is communicating differently than usual. */
    CLARIFY(3, Duration.ofHours(24)),
    /** Natural momentum suggests a follow-up. */
    NEXT_STEP(2, Duration.ofHours(48)),
    /** Something from the past is relevant again. */
    RECALL(1, Duration.ofHours(72));

    private final int magnitude;
    private final Duration ttl;

    InsightCategory(int magnitude, Duration ttl) {
        this.magnitude = magnitude;
        this.ttl       = ttl;
    }

    public int magnitude()  { return magnitude; }
    public Duration ttl()   { return ttl; }
}

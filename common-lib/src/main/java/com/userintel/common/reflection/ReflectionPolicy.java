package com.userintel.common.reflection;

import com.userintel.common.confidence.ConfidenceThresholds;
import com.userintel.common.context.StoredBelief;
import com.userintel.common.inference.DimensionInference;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.PrivacyTier;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Eligibility and overwrite rules for reflection passes.
 *
 * <p>A profile moves idle → eligible → running → idle. This class decides the
 * first edge and which inferred values may replace stored ones; running and
 * bookkeeping belong to the caller.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class ReflectionPolicy {

    // ── eligibility ───────────────────────────────────────────────────────────

    /** Unprocessed signals that trigger a pass on their own. */
    public static final int SIGNAL_THRESHOLD = 10;

    /** Unprocessed signals needed for the very first pass. */
    public static final int FIRST_RUN_SIGNALS = 3;

    /** Age of the last pass after which any new signal triggers one. */
    public static final Duration STALE_AFTER = Duration.ofHours(24);

    // ── event triggers ────────────────────────────────────────────────────────

    /** Sessions shorter than this do not trigger a pass on close. */
    public static final int MIN_SESSION_MINUTES = 10;

    /** No session-close pass within this long after the previous pass. */
    public static final Duration SESSION_CLOSE_COOLDOWN = Duration.ofHours(6);

    /** Decisions mentioned in one session that trigger a pass. */
    public static final int DECISION_CLUSTER_SIZE = 3;

    private ReflectionPolicy() {}

    /**
     * Reason the profile is due for a scheduled pass, or empty when it is not.
     * Tier A profiles are never eligible.
     */
    public static Optional<ReflectionReason> eligibility(PrivacyTier tier, long unprocessedSignals,
                                                         Instant lastReflectionAt, Instant nextReflectionAt,
                                                         Instant now) {
        if (tier == null || !tier.allowsDurableInference()) return Optional.empty();

        if (unprocessedSignals >= SIGNAL_THRESHOLD) {
            return Optional.of(ReflectionReason.SIGNAL_THRESHOLD);
        }
        if (nextReflectionAt != null && !now.isBefore(nextReflectionAt)) {
            return Optional.of(ReflectionReason.SCHEDULE_DUE);
        }
        if (lastReflectionAt != null && unprocessedSignals > 0
                && Duration.between(lastReflectionAt, now).compareTo(STALE_AFTER) > 0) {
            return Optional.of(ReflectionReason.STALE_WITH_SIGNALS);
        }
        if (lastReflectionAt == null && unprocessedSignals >= FIRST_RUN_SIGNALS) {
            return Optional.of(ReflectionReason.FIRST_RUN);
        }
        return Optional.empty();
    }

    public static boolean sessionCloseTriggers(double sessionMinutes, Instant lastReflectionAt, Instant now) {
        if (sessionMinutes < MIN_SESSION_MINUTES) return false;
        return lastReflectionAt == null
            || Duration.between(lastReflectionAt, now).compareTo(SESSION_CLOSE_COOLDOWN) >= 0;
    }

    public static boolean decisionClusterTriggers(int decisionsInSession) {
        return decisionsInSession >= DECISION_CLUSTER_SIZE;
    }

    // ── overwrite ─────────────────────────────────────────────────────────────

    /**
     * Whether a freshly inferred value replaces what is stored.
     *
     * <p>Values below {@link ConfidenceThresholds#TREAT_AS_UNKNOWN} are never
     * written. Otherwise a value is written when nothing is stored, when it
     * carries an explicit statement, or when its raw confidence beats the
     * stored confidence after decay.
     */
    public static boolean shouldPersist(double newConfidence, Set<EvidenceSource> sources,
                                        StoredBelief existing, Instant now) {
        if (newConfidence < ConfidenceThresholds.TREAT_AS_UNKNOWN) return false;
        if (existing == null) return true;
        if (sources != null && sources.contains(EvidenceSource.EXPLICIT_PKV)) return true;
        return newConfidence > existing.decayedConfidence(now);
    }

    /**
     * As above, except that a domain no signal of this pass fed keeps its
     * stored belief when the value comes out unchanged. Such a domain only
     * decays; rewriting it would reset its confidence and decay clock.
     *
     * @param evidenceThisPass whether any signal in the batch feeds the domain
     */
    public static boolean shouldPersist(DimensionInference<?> inferred, boolean evidenceThisPass,
                                        StoredBelief existing, Instant now) {
        if (inferred == null || inferred.value() == null) return false;
        if (existing != null && !evidenceThisPass && inferred.value().equals(existing.value())) return false;
        return shouldPersist(inferred.confidence(), inferred.sources(), existing, now);
    }
}

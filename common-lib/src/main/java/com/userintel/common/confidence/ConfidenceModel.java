package com.userintel.common.confidence;

import com.userintel.common.model.EvidenceSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Time decay and evidence fusion for belief confidence.
 *
 * <h3>Decay</h3>
 * <pre>
 *   decayed = confidence × (1 − rate) ^ (daysElapsed / 30)
 * </pre>
 * Identity when no time has elapsed, bounded in [0, confidence], strictly
 * lower for a higher rate once any time has passed.
 *
 * <h3>Merge</h3>
 * Evidence is sorted strongest first and weighted 1, ½, ¼, … The weighted sum
 * of the first {@code k} items is normalised by {@code 2 − 0.5^k}. The merged
 * confidence is the best such score over every {@code k}, so weaker evidence
 * added later can never pull a belief down. Inference alone never reaches
 * {@value #INFERENCE_CEILING}; only a directly stated fact may.
 *
 * <p>No Spring dependency. No I/O. Pure functions.
 */
public final class ConfidenceModel {

    /** Exclusive upper bound for any merged confidence. */
    public static final double INFERENCE_CEILING = 0.95;

    /** Highest value {@link #merge} returns. */
    public static final double MAX_MERGED = 0.94;

    /** Decay rates are expressed per 30-day period. */
    private static final double DAYS_PER_PERIOD = 30.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    private ConfidenceModel() { /* utility class */ }

    // ── Decay ──────────────────────────────────────────────────────

    /**
     * Decays {@code confidence} from {@code lastUpdated} to {@code now}.
     * A {@code now} at or before {@code lastUpdated} leaves the value unchanged.
     */
    public static double decay(double confidence, double decayRate, Instant lastUpdated, Instant now) {
        if (lastUpdated == null || now == null || !now.isAfter(lastUpdated)) {
            return clamp(confidence);
        }
        double days = Duration.between(lastUpdated, now).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return decay(confidence, decayRate, days);
    }

    public static double decay(double confidence, double decayRate, double daysElapsed) {
        double c = clamp(confidence);
        if (daysElapsed <= 0 || Double.isNaN(daysElapsed)) {
            return c;
        }
        double rate = clamp(decayRate);
        double decayed = c * Math.pow(1.0 - rate, daysElapsed / DAYS_PER_PERIOD);
        return Math.max(0.0, Math.min(c, decayed));
    }

    // ── Merge ──────────────────────────────────────────────────────

    /** Returns 0 for an empty collection. Values outside [0, 1] are clamped first. */
    public static double merge(Collection<Double> confidences) {
        if (confidences == null || confidences.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(confidences.size());
        for (Double c : confidences) {
            sorted.add(c == null ? 0.0 : clamp(c));
        }
        sorted.sort(Comparator.reverseOrder());

        double best = 0.0;
        double weightedSum = 0.0;
        double weight = 1.0;
        for (int k = 1; k <= sorted.size(); k++) {
            weightedSum += sorted.get(k - 1) * weight;
            weight *= 0.5;
            double normalised = weightedSum / (2.0 - Math.pow(0.5, k));
            best = Math.max(best, normalised);
        }
        return Math.min(best, MAX_MERGED);
    }

    public static double merge(double... confidences) {
        List<Double> values = new ArrayList<>(confidences.length);
        for (double c : confidences) values.add(c);
        return merge(values);
    }

    /** Merges the base confidences of the given evidence kinds. */
    public static double mergeSources(Collection<EvidenceSource> sources) {
        if (sources == null || sources.isEmpty()) return 0.0;
        return merge(sources.stream().map(EvidenceSource::baseConfidence).toList());
    }

    // ── Helpers ────────────────────────────────────────────────────

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Rounds to two decimals. */
    public static double round(double value) {
        return Math.round(clamp(value) * 100.0) / 100.0;
    }
}

package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.domain.BehavioralPatterns;
import com.userintel.common.model.payload.RetryAction;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Frequency-based: mode distribution, retry and refinement rates, typical
 * session length and preferred time of day. Each statistic needs its own
 * minimum sample before it replaces the stored value.
 */
public class BehavioralPatternsInferrer implements DomainInferrer<BehavioralPatterns> {

    static final int MIN_MODE_SELECTIONS = 3;
    static final int MIN_RETRY_SIGNALS = 3;
    static final int MIN_SESSION_TIMINGS = 2;

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.BEHAVIORAL_PATTERNS;
    }

    @Override
    public Class<BehavioralPatterns> valueType() {
        return BehavioralPatterns.class;
    }

    @Override
    public DimensionInference<BehavioralPatterns> infer(BehavioralPatterns existing, SignalAggregate signals,
                                                        int sessionCount) {
        BehavioralPatterns base = existing != null ? existing : BehavioralPatterns.defaults();
        Map<ResponseMode, Double> modes = base.modeDistribution();
        double retryRate = base.retryRate();
        double refinementRate = base.refinementRate();
        double sessionLength = base.typicalSessionLength();
        String sessionTime = base.preferredSessionTime();
        Set<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);

        // ── Mode distribution ──────────────────────────────────────
        int totalModes = signals.modeSelections().size();
        if (totalModes >= MIN_MODE_SELECTIONS) {
            Map<ResponseMode, Integer> counts = signals.modeCounts();
            Map<ResponseMode, Double> distribution = new EnumMap<>(ResponseMode.class);
            for (ResponseMode m : ResponseMode.values()) {
                distribution.put(m, counts.getOrDefault(m, 0) / (double) totalModes);
            }
            modes = distribution;
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
        }

        // ── Retry behaviour ────────────────────────────────────────
        if (signals.retries().size() >= MIN_RETRY_SIGNALS) {
            retryRate = signals.retryActionRate(RetryAction.RETRY);
            refinementRate = signals.retryActionRate(RetryAction.REFINE);
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
        }

        // ── Session timing ─────────────────────────────────────────
        if (signals.sessionTimings().size() >= MIN_SESSION_TIMINGS) {
            double avg = signals.averageSessionMinutes();
            if (avg > 0) sessionLength = avg;
            int hour = signals.mostCommonStartHour();
            if (hour >= 0) sessionTime = timeOfDay(hour);
            sources.add(EvidenceSource.BEHAVIORAL_REPEATED);
        }

        return DimensionInference.fromSources(new BehavioralPatterns(sessionTime, sessionLength, modes,
            retryRate, refinementRate, base.averageLatencyTolerance()), sources);
    }

    static String timeOfDay(int hour) {
        if (hour >= 5 && hour < 12)  return "morning";
        if (hour >= 12 && hour < 17) return "afternoon";
        if (hour >= 17 && hour < 22) return "evening";
        return "night";
    }
}

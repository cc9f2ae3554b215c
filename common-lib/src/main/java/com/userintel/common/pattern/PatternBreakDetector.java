package com.userintel.common.pattern;

import com.userintel.common.model.ResponseMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares each new observation with the baseline built from earlier ones,
 * then folds the observation into the baseline.
 *
 * <p>Nothing is reported until the baseline holds {@link #MIN_OBSERVATIONS}
 * messages. No Spring dependency. No I/O.
 */
public final class PatternBreakDetector {

    public static final int MIN_OBSERVATIONS = 10;

    // ── thresholds ────────────────────────────────────────────────────────────
    static final double RARE_MODE_SHARE       = 0.15;
    static final double VERY_RARE_MODE_SHARE  = 0.05;
    static final double LENGTH_DEVIATION      = 1.5;
    static final double DURATION_DEVIATION    = 1.0;
    static final double HIGH_DEVIATION        = 2.0;
    static final int    MIN_LENGTH_BASE       = 10;
    static final int    MIN_KNOWN_TOPICS      = 3;

    private PatternBreakDetector() {}

    public static List<PatternBreak> observeMessage(BehaviorBaseline baseline, int wordCount,
                                                    ResponseMode mode, String topic) {
        List<PatternBreak> breaks = new ArrayList<>();
        if (baseline.observations() >= MIN_OBSERVATIONS) {
            modeBreak(baseline, mode, breaks);
            lengthBreak(baseline, wordCount, breaks);
            topicBreak(baseline, topic, breaks);
        }
        baseline.recordMessage(wordCount, mode, topic);
        return breaks;
    }

    public static List<PatternBreak> observeSession(BehaviorBaseline baseline, double durationMinutes) {
        List<PatternBreak> breaks = new ArrayList<>();
        double avg = baseline.averageSessionMinutes();
        if (baseline.observations() >= MIN_OBSERVATIONS && baseline.sessions() > 0 && avg > 0) {
            double deviation = Math.abs(durationMinutes - avg) / avg;
            if (deviation > DURATION_DEVIATION) {
                breaks.add(new PatternBreak(BreakDimension.SESSION_DURATION,
                    format(avg), format(durationMinutes), deviation,
                    deviation > HIGH_DEVIATION ? Significance.HIGH : Significance.MEDIUM,
                    durationMinutes > avg));
            }
        }
        baseline.recordSession(durationMinutes);
        return breaks;
    }

    private static void modeBreak(BehaviorBaseline baseline, ResponseMode mode, List<PatternBreak> out) {
        ResponseMode expected = baseline.preferredMode();
        if (mode == null || expected == null || mode == expected) return;
        double share = baseline.modeShare(mode);
        if (share < RARE_MODE_SHARE) {
            double deviation = share < VERY_RARE_MODE_SHARE ? 3 : share < 0.10 ? 2 : 1;
            out.add(new PatternBreak(BreakDimension.RESPONSE_MODE,
                label(expected), label(mode), deviation,
                share < VERY_RARE_MODE_SHARE ? Significance.HIGH : Significance.MEDIUM,
                mode.ordinal() > expected.ordinal()));
        }
    }

    private static void lengthBreak(BehaviorBaseline baseline, int wordCount, List<PatternBreak> out) {
        double avg = baseline.averageWordCount();
        double deviation = Math.abs(wordCount - avg) / Math.max(avg, MIN_LENGTH_BASE);
        if (deviation > LENGTH_DEVIATION) {
            out.add(new PatternBreak(BreakDimension.MESSAGE_LENGTH,
                format(avg), String.valueOf(wordCount), deviation,
                deviation > HIGH_DEVIATION ? Significance.HIGH : Significance.MEDIUM,
                wordCount > avg));
        }
    }

    private static void topicBreak(BehaviorBaseline baseline, String topic, List<PatternBreak> out) {
        List<String> known = baseline.topTopics();
        if (topic == null || topic.isBlank() || known.size() < MIN_KNOWN_TOPICS || known.contains(topic)) return;
        out.add(new PatternBreak(BreakDimension.TOPIC,
            String.join(", ", known), topic, 2, Significance.MEDIUM, true));
    }

    private static String label(ResponseMode mode) {
        return mode.name().toLowerCase();
    }

    private static String format(double v) {
        return String.valueOf(Math.round(v * 10) / 10.0);
    }
}

package com.userintel.common.inference;

import com.userintel.common.confidence.ConfidenceThresholds;
import com.userintel.common.model.BeliefDomain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Lists domains below {@link ConfidenceThresholds#ACT_WITH_UNCERTAINTY},
 * highest priority first.
 *
 * <pre>
 *   priority = domain.gapPriority + (1 − confidence) × 3
 * </pre>
 */
public final class GapDetector {

    static final double CONFIDENCE_BOOST = 3.0;

    private GapDetector() {}

    /** @param confidences current (decayed) confidence per domain; absent domains count as 0 */
    public static List<BeliefGap> findGaps(Map<BeliefDomain, Double> confidences) {
        List<BeliefGap> gaps = new ArrayList<>();
        for (BeliefDomain domain : BeliefDomain.values()) {
            Double c = confidences == null ? null : confidences.get(domain);
            double confidence = c == null ? 0.0 : c;
            if (confidence < ConfidenceThresholds.ACT_WITH_UNCERTAINTY) {
                double priority = domain.gapPriority() + (1.0 - confidence) * CONFIDENCE_BOOST;
                gaps.add(new BeliefGap(domain, confidence, priority, domain.gapDescription()));
            }
        }
        gaps.sort(Comparator.comparingDouble(BeliefGap::priority).reversed());
        return gaps;
    }
}

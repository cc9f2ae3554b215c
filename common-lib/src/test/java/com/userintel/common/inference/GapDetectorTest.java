package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GapDetectorTest {

    @Test
    @DisplayName("nothing known → every domain is a gap, identity first")
    void empty_allGaps() {
        List<BeliefGap> gaps = GapDetector.findGaps(Map.of());
        assertEquals(BeliefDomain.values().length, gaps.size());
        assertEquals(BeliefDomain.IDENTITY_CONTEXT, gaps.get(0).domain());
        assertEquals(13.0, gaps.get(0).priority(), 1e-9);
    }

    @Test
    @DisplayName("confidence at 0.6 → not a gap")
    void threshold_exclusive() {
        Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
        for (BeliefDomain d : BeliefDomain.values()) conf.put(d, 0.6);
        assertTrue(GapDetector.findGaps(conf).isEmpty());
    }

    @Test
    @DisplayName("lower confidence → boosted priority can overtake a higher base")
    void lowConfidenceBoost() {
        Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
        for (BeliefDomain d : BeliefDomain.values()) conf.put(d, 0.9);
        conf.put(BeliefDomain.GOALS_VALUES, 0.59);
        conf.put(BeliefDomain.COMMUNICATION_PREFS, 0.0);

        List<BeliefGap> gaps = GapDetector.findGaps(conf);
        assertEquals(2, gaps.size());
        assertEquals(BeliefDomain.COMMUNICATION_PREFS, gaps.get(0).domain());
    }
}

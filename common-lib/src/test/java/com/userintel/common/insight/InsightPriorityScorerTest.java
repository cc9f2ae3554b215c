package com.userintel.common.insight;

import com.userintel.common.insight.InsightPriorityScorer.ScoringContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InsightPriorityScorerTest {

    private static InsightDraft draft(InsightCategory category, double base, double confidence,
                                      String expanded, List<String> tags) {
        return new InsightDraft(category, "t", "m", expanded, InsightTrigger.IDLE, 30, tags, base, confidence);
    }

    @Test
    @DisplayName("plain medium draft → base + recency + magnitude")
    void plainDraft() {
        // 5 + 0.5 + 0.9 = 6.4
        assertEquals(6, InsightPriorityScorer.score(draft(InsightCategory.CLARIFY, 5, 0.5, null, List.of()), null));
    }

    @Test
    @DisplayName("category weight orders contradiction > clarify > next step > recall")
    void categoryOrdering() {
        int contradiction = InsightPriorityScorer.score(draft(InsightCategory.CONTRADICTION, 5, 0.5, null, List.of()), null);
        int recall        = InsightPriorityScorer.score(draft(InsightCategory.RECALL, 5, 0.5, null, List.of()), null);
        assertTrue(contradiction > recall);
    }

    @Test
    @DisplayName("goal match, confidence and actionability add up")
    void bonuses() {
        ScoringContext ctx = new ScoringContext(List.of("Fix the pricing page"), Set.of(), null);
        // 5 + 0.5 + 1.2 + 0.8 + 1.0 + 0.3 = 8.8
        assertEquals(9, InsightPriorityScorer.score(
            draft(InsightCategory.CONTRADICTION, 5, 1.0, "more", List.of("Pricing")), ctx));
    }

    @Test
    @DisplayName("recent same category and poor ratings pull the score down")
    void penalties() {
        ScoringContext ctx = new ScoringContext(List.of("Fix the pricing page"),
            Set.of(InsightCategory.CONTRADICTION), -1.0);
        // 8.8 - 0.2 - 2.0 = 6.6
        assertEquals(7, InsightPriorityScorer.score(
            draft(InsightCategory.CONTRADICTION, 5, 1.0, "more", List.of("pricing")), ctx));
    }

    @Test
    @DisplayName("result clamped to 1..10")
    void clamped() {
        assertEquals(10, InsightPriorityScorer.score(draft(InsightCategory.CONTRADICTION, 20, 1.0, null, List.of()), null));
        assertEquals(1, InsightPriorityScorer.score(draft(InsightCategory.RECALL, 0.1, 0.0, null, List.of()), null));
    }
}

package com.userintel.common.pattern;

import com.userintel.common.insight.InsightCategory;
import com.userintel.common.insight.InsightDraft;
import com.userintel.common.insight.InsightTrigger;
import com.userintel.common.model.ResponseMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatternBreakDetectorTest {

    private BehaviorBaseline baseline;

    @BeforeEach
    void setUp() {
        baseline = new BehaviorBaseline();
    }

    /** Twenty 20-word THOUGHTFUL messages spread over three topics. */
    private void warmUp() {
        String[] topics = {"technical", "business", "learning"};
        for (int i = 0; i < 20; i++) {
            PatternBreakDetector.observeMessage(baseline, 20, ResponseMode.THOUGHTFUL, topics[i % 3]);
        }
    }

    @Test
    @DisplayName("fewer than 10 observations → nothing reported")
    void noBaselineYet() {
        for (int i = 0; i < 9; i++) {
            PatternBreakDetector.observeMessage(baseline, 20, ResponseMode.QUICK, "technical");
        }
        assertTrue(PatternBreakDetector.observeMessage(baseline, 500, ResponseMode.COUNCIL, "personal").isEmpty());
        assertEquals(10, baseline.observations());
    }

    @Nested
    @DisplayName("message breaks")
    class MessageTests {

        @Test
        @DisplayName("never-used mode → HIGH response-mode break")
        void rareMode() {
            warmUp();
            List<PatternBreak> breaks = PatternBreakDetector.observeMessage(baseline, 20, ResponseMode.COUNCIL, "technical");
            assertEquals(1, breaks.size());
            assertEquals(BreakDimension.RESPONSE_MODE, breaks.get(0).dimension());
            assertEquals(Significance.HIGH, breaks.get(0).significance());
            assertEquals("thoughtful", breaks.get(0).expected());
        }

        @Test
        @DisplayName("message well above usual length → MEDIUM, far above → HIGH")
        void lengthDeviation() {
            warmUp();
            PatternBreak medium = PatternBreakDetector.observeMessage(baseline, 55, ResponseMode.THOUGHTFUL, "technical").get(0);
            assertEquals(BreakDimension.MESSAGE_LENGTH, medium.dimension());
            assertEquals(Significance.MEDIUM, medium.significance());
            assertTrue(medium.above());

            PatternBreak high = PatternBreakDetector.observeMessage(baseline, 200, ResponseMode.THOUGHTFUL, "technical").get(0);
            assertEquals(Significance.HIGH, high.significance());
        }

        @Test
        @DisplayName("unknown topic once three are known → topic break")
        void newTopic() {
            warmUp();
            List<PatternBreak> breaks = PatternBreakDetector.observeMessage(baseline, 20, ResponseMode.THOUGHTFUL, "creative");
            assertEquals(BreakDimension.TOPIC, breaks.get(0).dimension());
            assertTrue(baseline.topTopics().contains("creative"));
        }

        @Test
        @DisplayName("ordinary message → nothing")
        void ordinary() {
            warmUp();
            assertTrue(PatternBreakDetector.observeMessage(baseline, 22, ResponseMode.THOUGHTFUL, "business").isEmpty());
        }
    }

    @Test
    @DisplayName("session three times the usual length → duration break")
    void longSession() {
        warmUp();
        PatternBreakDetector.observeSession(baseline, 20);
        PatternBreakDetector.observeSession(baseline, 20);
        List<PatternBreak> breaks = PatternBreakDetector.observeSession(baseline, 65);
        assertEquals(BreakDimension.SESSION_DURATION, breaks.get(0).dimension());
        assertEquals(Significance.HIGH, breaks.get(0).significance());
    }

    @Nested
    @DisplayName("InsightDrafts.fromBreak()")
    class DraftTests {

        @Test
        @DisplayName("HIGH break → idle insight, base 8, 30 s minimum idle, dimension tag")
        void highBreak() {
            PatternBreak pb = new PatternBreak(BreakDimension.RESPONSE_MODE, "quick", "council", 3, Significance.HIGH, true);
            InsightDraft draft = InsightDrafts.fromBreak(pb).orElseThrow();
            assertEquals(InsightCategory.CONTRADICTION, draft.category());
            assertEquals(InsightTrigger.IDLE, draft.trigger());
            assertEquals(30, draft.minIdleSeconds());
            assertEquals(8.0, draft.basePriority());
            assertEquals(List.of("response_mode"), draft.contextTags());
            assertTrue(draft.hasExpandedContent());
        }

        @Test
        @DisplayName("LOW break → no draft")
        void lowBreak() {
            PatternBreak pb = new PatternBreak(BreakDimension.TOPIC, "a", "b", 1, Significance.LOW, true);
            assertEquals(Optional.empty(), InsightDrafts.fromBreak(pb));
        }

        @Test
        @DisplayName("each dimension maps to its category")
        void categoryMap() {
            assertEquals(InsightCategory.CLARIFY, BreakDimension.MESSAGE_LENGTH.category());
            assertEquals(InsightCategory.NEXT_STEP, BreakDimension.SESSION_DURATION.category());
            assertEquals(InsightCategory.RECALL, BreakDimension.TOPIC.category());
        }
    }
}

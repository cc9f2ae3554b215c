package com.userintel.common.elicitation;

import com.userintel.common.model.BeliefDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ElicitationSelectorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private static ElicitationProfile profile(int sessions, int asked, Set<String> askedIds,
                                              boolean askedThisSession, Instant lastResponse,
                                              Map<BeliefDomain, Double> confidences, String knownName) {
        return new ElicitationProfile(sessions, asked, askedIds, askedThisSession, lastResponse,
            confidences, knownName, NOW);
    }

    private static ElicitationProfile fresh(int sessions) {
        return profile(sessions, 0, Set.of(), false, null, Map.of(), null);
    }

    @Nested
    @DisplayName("pacing rules")
    class PacingTests {

        @Test
        @DisplayName("null profile → no")
        void nullProfile() {
            assertFalse(ElicitationSelector.shouldAsk(null).ask());
        }

        @Test
        @DisplayName("first session → never asks, whatever the gaps")
        void firstSession_neverAsks() {
            assertFalse(ElicitationSelector.shouldAsk(fresh(1)).ask());
            assertFalse(ElicitationSelector.shouldAsk(fresh(0)).ask());
        }

        @Test
        @DisplayName("already asked this session → no")
        void oncePerSession() {
            assertFalse(ElicitationSelector.shouldAsk(
                profile(3, 1, Set.of(QuestionBank.IDENTITY_ROLE), true, NOW, Map.of(), null)).ask());
        }

        @Test
        @DisplayName("session 2 with identity gap → highest-priority phase-1 question")
        void secondSession_asksRole() {
            ElicitationDecision decision = ElicitationSelector.shouldAsk(fresh(2));
            assertTrue(decision.ask());
            assertEquals(QuestionBank.IDENTITY_ROLE, decision.question().id());
        }

        @Test
        @DisplayName("returned id never appears in prior responses")
        void neverRepeats() {
            Set<String> asked = Set.of(QuestionBank.IDENTITY_ROLE, QuestionBank.IDENTITY_NAME);
            ElicitationDecision decision = ElicitationSelector.shouldAsk(
                profile(3, 2, asked, false, NOW.minus(Duration.ofDays(1)), Map.of(), null));
            assertTrue(decision.ask());
            assertFalse(asked.contains(decision.question().id()));
            assertEquals(BeliefDomain.GOALS_VALUES, decision.question().domain());
        }

        @Test
        @DisplayName("name on file → name question skipped")
        void skipsKnownName() {
            ElicitationDecision decision = ElicitationSelector.shouldAsk(
                profile(2, 1, Set.of(QuestionBank.IDENTITY_ROLE), false, null, Map.of(), "Sam"));
            assertFalse(decision.ask());
        }

        @Test
        @DisplayName("domain confident enough → not a gap, its questions are skipped")
        void confidentDomain_notAsked() {
            Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
            conf.put(BeliefDomain.IDENTITY_CONTEXT, 0.8);
            assertFalse(ElicitationSelector.shouldAsk(
                profile(2, 0, Set.of(), false, null, conf, null)).ask());
        }
    }

    @Nested
    @DisplayName("post-onboarding gap path")
    class GapPathTests {

        private final Set<String> onboarded = Set.of(QuestionBank.IDENTITY_ROLE, QuestionBank.IDENTITY_NAME,
            QuestionBank.GOALS_CURRENT, QuestionBank.GOALS_CHALLENGE);

        @Test
        @DisplayName("asked within 7 days → no")
        void recentAnswer_blocks() {
            assertFalse(ElicitationSelector.shouldAsk(
                profile(8, 4, onboarded, false, NOW.minus(Duration.ofDays(3)), Map.of(), null)).ask());
        }

        @Test
        @DisplayName("significant gap after 7 days → lowest-confidence domain with a fresh question")
        void significantGap_asks() {
            Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
            conf.put(BeliefDomain.IDENTITY_CONTEXT, 0.9);
            conf.put(BeliefDomain.GOALS_VALUES, 0.9);
            conf.put(BeliefDomain.COMMUNICATION_PREFS, 0.7);
            conf.put(BeliefDomain.EXPERTISE_CALIBRATION, 0.2);

            ElicitationDecision decision = ElicitationSelector.shouldAsk(
                profile(8, 4, onboarded, false, NOW.minus(Duration.ofDays(8)), conf, null));
            assertTrue(decision.ask());
            assertEquals(BeliefDomain.EXPERTISE_CALIBRATION, decision.question().domain());
        }

        @Test
        @DisplayName("weakest domain fully asked → no, even with another domain under 0.4")
        void weakestDomainExhausted_doesNotFallBack() {
            Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
            conf.put(BeliefDomain.IDENTITY_CONTEXT, 0.1);
            conf.put(BeliefDomain.GOALS_VALUES, 0.35);
            conf.put(BeliefDomain.COMMUNICATION_PREFS, 0.9);
            conf.put(BeliefDomain.EXPERTISE_CALIBRATION, 0.9);
            Set<String> asked = Set.of(QuestionBank.IDENTITY_ROLE, QuestionBank.IDENTITY_NAME,
                QuestionBank.COMM_VERBOSITY, QuestionBank.COMM_STYLE);

            ElicitationDecision decision = ElicitationSelector.shouldAsk(
                profile(8, 4, asked, false, NOW.minus(Duration.ofDays(10)), conf, null));

            assertFalse(decision.ask());
            assertNull(decision.question());
        }

        @Test
        @DisplayName("all covered domains above 0.4 → no")
        void noSignificantGap() {
            Map<BeliefDomain, Double> conf = new EnumMap<>(BeliefDomain.class);
            for (BeliefDomain d : QuestionBank.coveredDomains()) conf.put(d, 0.5);
            assertFalse(ElicitationSelector.shouldAsk(
                profile(8, 4, onboarded, false, null, conf, null)).ask());
        }
    }

    @Test
    @DisplayName("phaseFor() → session 2 is phase 1, capped at 4")
    void phases() {
        assertEquals(1, ElicitationSelector.phaseFor(2));
        assertEquals(4, ElicitationSelector.phaseFor(40));
    }
}

package com.userintel.common.inference;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.Signal;
import com.userintel.common.model.domain.BehavioralPatterns;
import com.userintel.common.model.domain.CognitiveStyle;
import com.userintel.common.model.domain.CommunicationPrefs;
import com.userintel.common.model.domain.DomainValue;
import com.userintel.common.model.domain.RelationshipState;
import com.userintel.common.model.domain.Verbosity;
import com.userintel.common.signal.BehaviorSignals;
import com.userintel.common.signal.SignalExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DimensionInferenceEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final SignalExtractor extractor = SignalExtractor.withDefaults(Clock.fixed(NOW, ZoneOffset.UTC));
    private final DimensionInferenceEngine engine = new DimensionInferenceEngine();

    private List<Signal> extractAll(String... messages) {
        List<Signal> signals = new ArrayList<>();
        for (String m : messages) signals.addAll(extractor.extract(m));
        return signals;
    }

    @Nested
    @DisplayName("coverage")
    class CoverageTests {

        @Test
        @DisplayName("no signals → all 8 domains present, every confidence < 0.5")
        void emptyBatch_allDomainsLowConfidence() {
            Map<BeliefDomain, DimensionInference<?>> result = engine.inferAll(List.of(), 0, Map.of());
            assertEquals(BeliefDomain.values().length, result.size());
            for (BeliefDomain domain : BeliefDomain.values()) {
                assertTrue(result.get(domain).confidence() < 0.5, domain + " too confident");
            }
        }

        @Test
        @DisplayName("null existing map → treated as empty")
        void nullExisting() {
            assertEquals(8, engine.inferAll(List.of(), 3, null).size());
        }

        @Test
        @DisplayName("cognitive style → fixed default, no signal source")
        void cognitiveStylePlaceholder() {
            DimensionInference<?> cognitive = engine.inferAll(extractAll("hello there", "I prefer detailed answers"), 5, Map.of())
                .get(BeliefDomain.COGNITIVE_STYLE);
            assertEquals(CognitiveStyle.NEUTRAL, cognitive.value());
            assertEquals(0.3, cognitive.confidence(), 1e-9);
            assertTrue(cognitive.sources().isEmpty());
            assertFalse(engine.hasSignalSource(BeliefDomain.COGNITIVE_STYLE));
        }

        @Test
        @DisplayName("no inference ever reaches 0.95")
        void neverCertain() {
            List<Signal> many = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                many.addAll(extractAll("I prefer concise answers", "Thanks, perfect"));
            }
            engine.inferAll(many, 50, Map.of()).values()
                .forEach(inf -> assertTrue(inf.confidence() < 0.95, inf.domain() + " reached " + inf.confidence()));
        }
    }

    @Nested
    @DisplayName("communication preferences")
    class CommunicationTests {

        @Test
        @DisplayName("\"hi\", \"ok thanks\", \"sounds good\" → CONCISE from BEHAVIORAL_REPEATED")
        void casualMessages_concise() {
            DimensionInference<?> comm = engine.inferAll(extractAll("hi", "ok thanks", "sounds good"), 1, Map.of())
                .get(BeliefDomain.COMMUNICATION_PREFS);

            assertEquals(Verbosity.CONCISE, ((CommunicationPrefs) comm.value()).verbosity());
            assertTrue(comm.confidence() > 0);
            assertTrue(comm.hasSource(EvidenceSource.BEHAVIORAL_REPEATED));
        }

        @Test
        @DisplayName("two short messages → below threshold, value unchanged")
        void twoMessages_noBehaviouralReading() {
            DimensionInference<?> comm = engine.inferAll(extractAll("hi", "ok"), 1, Map.of())
                .get(BeliefDomain.COMMUNICATION_PREFS);
            assertEquals(CommunicationPrefs.DEFAULT, comm.value());
            assertTrue(comm.sources().isEmpty());
        }

        @Test
        @DisplayName("\"I prefer detailed responses\" alone → DETAILED from EXPLICIT_PKV over a prior CONCISE")
        void explicitStatement_overridesPrior() {
            Map<BeliefDomain, DomainValue> existing = Map.of(
                BeliefDomain.COMMUNICATION_PREFS, CommunicationPrefs.DEFAULT.withVerbosity(Verbosity.CONCISE));

            DimensionInference<?> comm = engine.inferAll(extractAll("I prefer detailed responses"), 4, existing)
                .get(BeliefDomain.COMMUNICATION_PREFS);

            assertEquals(Verbosity.DETAILED, ((CommunicationPrefs) comm.value()).verbosity());
            assertTrue(comm.isExplicit());
            assertFalse(comm.hasSource(EvidenceSource.BEHAVIORAL_REPEATED));
        }
    }

    @Nested
    @DisplayName("frequency domains")
    class FrequencyTests {

        @Test
        @DisplayName("mode selections → normalised distribution")
        void modeDistribution() {
            List<Signal> signals = List.of(
                BehaviorSignals.modeSelection(ResponseMode.QUICK, "s", NOW),
                BehaviorSignals.modeSelection(ResponseMode.QUICK, "s", NOW),
                BehaviorSignals.modeSelection(ResponseMode.QUICK, "s", NOW),
                BehaviorSignals.modeSelection(ResponseMode.THOUGHTFUL, "s", NOW));

            BehavioralPatterns patterns = (BehavioralPatterns) engine.inferAll(signals, 2, Map.of())
                .get(BeliefDomain.BEHAVIORAL_PATTERNS).value();

            assertEquals(0.75, patterns.modeDistribution().get(ResponseMode.QUICK), 1e-9);
            assertEquals(1.0, patterns.modeDistribution().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        }

        @Test
        @DisplayName("trust grows with session count and stays capped")
        void trustMonotone() {
            double t2  = trust(2);
            double t10 = trust(10);
            double t99 = trust(99);
            assertTrue(t10 > t2);
            assertTrue(t99 >= t10);
            assertTrue(t99 <= 0.9);
        }

        private double trust(int sessions) {
            return ((RelationshipState) engine.inferAll(List.of(), sessions, Map.of())
                .get(BeliefDomain.RELATIONSHIP_STATE).value()).trustMaturity();
        }
    }

    @Test
    @DisplayName("each signal type feeds only its mapped domains")
    void signalsFeedMappedDomainsOnly() {
        DimensionInference<?> goals = engine.inferAll(extractAll("hi", "ok thanks", "sounds good"), 1, Map.of())
            .get(BeliefDomain.GOALS_VALUES);
        assertTrue(goals.sources().isEmpty());
    }
}

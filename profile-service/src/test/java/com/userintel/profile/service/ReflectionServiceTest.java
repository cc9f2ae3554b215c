package com.userintel.profile.service;

import com.userintel.common.inference.DimensionInferenceEngine;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.PrivacyTier;
import com.userintel.common.model.domain.CommunicationPrefs;
import com.userintel.common.model.domain.Verbosity;
import com.userintel.common.reflection.BatchReflectionSummary;
import com.userintel.common.reflection.ReflectionReason;
import com.userintel.profile.codec.ProfileCodec;
import com.userintel.profile.dto.ReflectionResult;
import com.userintel.profile.model.DimensionScoreRecord;
import com.userintel.profile.model.SignalRecord;
import com.userintel.profile.model.UserProfile;
import com.userintel.profile.repository.DimensionScoreRepository;
import com.userintel.profile.repository.SignalRecordRepository;
import com.userintel.profile.repository.UserProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.userintel.profile.ProfileTestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReflectionServiceTest {

    @Mock UserProfileRepository profileRepository;
    @Mock SignalRecordRepository signalRepository;
    @Mock DimensionScoreRepository scoreRepository;

    private final ProfileCodec codec = codec();
    private ReflectionService service;

    @BeforeEach
    void setUp() {
        service = new ReflectionService(profileRepository, signalRepository, scoreRepository,
            new DimensionInferenceEngine(), codec, CLOCK);

        when(profileRepository.markReflected(anyString(), any(), any())).thenReturn(Mono.just(1));
        when(scoreRepository.findByUserId(anyString())).thenReturn(Flux.empty());
        when(scoreRepository.upsertScore(anyString(), anyString(), anyString(), anyDouble(), anyDouble(),
            anyString(), any())).thenReturn(Mono.just(1));
        when(scoreRepository.applyDecay(anyString(), anyString(), anyDouble(), any())).thenReturn(Mono.just(1));
        when(signalRepository.markProcessed(any(), any())).thenAnswer(inv -> Mono.just(((Collection<?>) inv.getArgument(0)).size()));
    }

    private void givenProfile(UserProfile profile, List<SignalRecord> rows) {
        when(profileRepository.findByUserId(profile.getUserId())).thenReturn(Mono.just(profile));
        when(signalRepository.findUnprocessed(eq(profile.getUserId()), anyInt())).thenReturn(Flux.fromIterable(rows));
        when(signalRepository.countUnprocessed(profile.getUserId())).thenReturn(Mono.just((long) rows.size()));
    }

    private DimensionScoreRecord storedComm(String userId, Verbosity verbosity, double confidence) {
        DimensionScoreRecord r = new DimensionScoreRecord();
        r.setId(99L);
        r.setUserId(userId);
        r.setDomain(BeliefDomain.COMMUNICATION_PREFS.name());
        r.setValue(codec.writeValue(CommunicationPrefs.DEFAULT.withVerbosity(verbosity)));
        r.setConfidence(confidence);
        r.setDecayRate(BeliefDomain.COMMUNICATION_PREFS.decayRate());
        r.setSources("BEHAVIORAL_REPEATED");
        r.setLastUpdated(ProfileCodec.toUtc(NOW));
        r.setLastDecayedAt(ProfileCodec.toUtc(NOW));
        return r;
    }

    @Nested
    @DisplayName("manual trigger")
    class ManualTests {

        @Test
        @DisplayName("three short casual messages → communication prefs written, signals marked, next pass in 24h")
        void fullPass() {
            UserProfile profile = profile("u1", PrivacyTier.B, 2);
            List<SignalRecord> rows = signalRows("u1", "hi", "ok thanks", "sounds good");
            givenProfile(profile, rows);

            ReflectionResult result = service.onManualTrigger("u1").block();

            assertNotNull(result);
            assertTrue(result.ran());
            assertEquals(ReflectionReason.MANUAL, result.reason());
            assertEquals(rows.size(), result.signalsProcessed());
            assertTrue(result.domainsUpdated().contains(BeliefDomain.COMMUNICATION_PREFS));
            verify(scoreRepository).upsertScore(eq("u1"), eq("COMMUNICATION_PREFS"), contains("CONCISE"),
                anyDouble(), eq(0.2), contains("BEHAVIORAL_REPEATED"), any());
            verify(signalRepository).markProcessed(argThat(ids -> ids.size() == rows.size()), any());
            verify(profileRepository).markReflected("u1", ProfileCodec.toUtc(NOW),
                ProfileCodec.toUtc(NOW.plus(Duration.ofHours(24))));
            verify(profileRepository, never()).save(any());
        }

        @Test
        @DisplayName("tier A → skipped, nothing read or written")
        void tierA() {
            UserProfile profile = profile("u2", PrivacyTier.A, 5);
            givenProfile(profile, signalRows("u2", "hi"));

            ReflectionResult result = service.onManualTrigger("u2").block();

            assertFalse(result.ran());
            assertEquals("Privacy tier A", result.skipReason());
            verify(signalRepository, never()).findUnprocessed(anyString(), anyInt());
            verify(profileRepository, never()).markReflected(anyString(), any(), any());
        }

        @Test
        @DisplayName("unknown user → skipped, not an error")
        void noProfile() {
            when(profileRepository.findByUserId("ghost")).thenReturn(Mono.empty());

            ReflectionResult result = service.onManualTrigger("ghost").block();

            assertFalse(result.ran());
            assertFalse(result.hasErrors());
            assertEquals("No profile", result.skipReason());
        }
    }

    @Nested
    @DisplayName("overwrite rule")
    class OverwriteTests {

        @Test
        @DisplayName("strong stored belief + weak behavioural batch → value kept, only decay folded in")
        void strongBeliefKept() {
            UserProfile profile = profile("u3", PrivacyTier.B, 4);
            givenProfile(profile, signalRows("u3", "hi", "ok thanks", "sounds good"));
            when(scoreRepository.findByUserId("u3")).thenReturn(Flux.just(storedComm("u3", Verbosity.DETAILED, 0.9)));

            ReflectionResult result = service.onManualTrigger("u3").block();

            assertFalse(result.domainsUpdated().contains(BeliefDomain.COMMUNICATION_PREFS));
            verify(scoreRepository, never()).upsertScore(anyString(), eq("COMMUNICATION_PREFS"), anyString(),
                anyDouble(), anyDouble(), anyString(), any());
            verify(scoreRepository).applyDecay(eq("u3"), eq("COMMUNICATION_PREFS"), eq(0.9), any());
        }

        @Test
        @DisplayName("explicit statement → replaces even a strong stored belief")
        void explicitWins() {
            UserProfile profile = profile("u4", PrivacyTier.C, 4);
            givenProfile(profile, signalRows("u4", "I prefer detailed responses"));
            when(scoreRepository.findByUserId("u4")).thenReturn(Flux.just(storedComm("u4", Verbosity.CONCISE, 0.9)));

            ReflectionResult result = service.onManualTrigger("u4").block();

            assertTrue(result.domainsUpdated().contains(BeliefDomain.COMMUNICATION_PREFS));
            verify(scoreRepository).upsertScore(eq("u4"), eq("COMMUNICATION_PREFS"), contains("DETAILED"),
                anyDouble(), anyDouble(), contains("EXPLICIT_PKV"), any());
        }
    }

    @Nested
    @DisplayName("repeated passes")
    class RepeatedPassTests {

        private final List<DimensionScoreRecord> written = new ArrayList<>();

        @BeforeEach
        void recordWrites() {
            when(scoreRepository.upsertScore(anyString(), anyString(), anyString(), anyDouble(), anyDouble(),
                anyString(), any())).thenAnswer(inv -> {
                    DimensionScoreRecord r = new DimensionScoreRecord();
                    r.setId((long) written.size() + 1);
                    r.setUserId(inv.getArgument(0));
                    r.setDomain(inv.getArgument(1));
                    r.setValue(inv.getArgument(2));
                    r.setConfidence(inv.<Double>getArgument(3));
                    r.setDecayRate(inv.<Double>getArgument(4));
                    r.setSources(inv.getArgument(5));
                    r.setLastUpdated(inv.getArgument(6));
                    r.setLastDecayedAt(inv.getArgument(6));
                    written.add(r);
                    return Mono.just(1);
                });
        }

        @Test
        @DisplayName("second manual pass an hour later with no new signals → no value rewritten, only decay")
        void secondPassOnlyDecays() {
            UserProfile profile = profile("r1", PrivacyTier.B, 3);
            givenProfile(profile, signalRows("r1", "hi", "ok thanks", "sounds good"));

            assertTrue(service.onManualTrigger("r1").block().ran());
            List<DimensionScoreRecord> stored = List.copyOf(written);
            assertFalse(stored.isEmpty());
            assertTrue(stored.stream().anyMatch(r -> r.getDomain().equals("RELATIONSHIP_STATE")));
            assertTrue(stored.stream().anyMatch(r -> r.getDomain().equals("COGNITIVE_STYLE")));

            clearInvocations(scoreRepository);
            givenProfile(profile, List.of());
            when(scoreRepository.findByUserId("r1")).thenReturn(Flux.fromIterable(stored));
            ReflectionService later = new ReflectionService(profileRepository, signalRepository, scoreRepository,
                new DimensionInferenceEngine(), codec, Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC));

            ReflectionResult second = later.onManualTrigger("r1").block();

            assertTrue(second.ran());
            assertTrue(second.domainsUpdated().isEmpty());
            verify(scoreRepository, never()).upsertScore(anyString(), anyString(), anyString(), anyDouble(),
                anyDouble(), anyString(), any());
            verify(scoreRepository, times(stored.size())).applyDecay(eq("r1"), anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("session count moved between passes → relationship trust rewritten, nothing else")
        void sessionCountMoved() {
            UserProfile profile = profile("r2", PrivacyTier.B, 3);
            givenProfile(profile, signalRows("r2", "hi", "ok thanks", "sounds good"));
            service.onManualTrigger("r2").block();
            List<DimensionScoreRecord> stored = List.copyOf(written);

            clearInvocations(scoreRepository);
            givenProfile(profile("r2", PrivacyTier.B, 4), List.of());
            when(scoreRepository.findByUserId("r2")).thenReturn(Flux.fromIterable(stored));
            ReflectionService later = new ReflectionService(profileRepository, signalRepository, scoreRepository,
                new DimensionInferenceEngine(), codec, Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC));

            ReflectionResult second = later.onManualTrigger("r2").block();

            assertEquals(List.of(BeliefDomain.RELATIONSHIP_STATE), second.domainsUpdated());
        }
    }

    @Nested
    @DisplayName("event triggers")
    class TriggerTests {

        @Test
        @DisplayName("session close after 5 minutes → skipped")
        void shortSession() {
            givenProfile(profile("u5", PrivacyTier.B, 3), signalRows("u5", "hi"));

            ReflectionResult result = service.onSessionClose("u5", 5).block();

            assertFalse(result.ran());
            verify(signalRepository, never()).findUnprocessed(anyString(), anyInt());
        }

        @Test
        @DisplayName("decision cluster of 3 → runs")
        void decisionCluster() {
            givenProfile(profile("u6", PrivacyTier.B, 3), signalRows("u6", "hi"));

            ReflectionResult result = service.onDecisionCluster("u6", 3).block();

            assertTrue(result.ran());
            assertEquals(ReflectionReason.DECISION_CLUSTER, result.reason());
        }

        @Test
        @DisplayName("never reflected with 2 signals → not eligible")
        void notEligible() {
            givenProfile(profile("u7", PrivacyTier.B, 1), signalRows("u7", "hi"));
            when(signalRepository.countUnprocessed("u7")).thenReturn(Mono.just(2L));

            ReflectionResult result = service.reflectIfEligible("u7").block();

            assertFalse(result.ran());
            assertEquals("Not eligible", result.skipReason());
        }
    }

    @Nested
    @DisplayName("batch")
    class BatchTests {

        @Test
        @DisplayName("one profile's storage failure → recorded, others still succeed")
        void failureIsolated() {
            UserProfile ok = profile("ok", PrivacyTier.B, 2);
            UserProfile broken = profile("broken", PrivacyTier.B, 2);
            givenProfile(ok, signalRows("ok", "hi", "ok thanks", "sounds good"));
            givenProfile(broken, signalRows("broken", "hi"));
            when(signalRepository.countUnprocessed("broken")).thenReturn(Mono.just(12L));
            when(signalRepository.findUnprocessed(eq("broken"), anyInt()))
                .thenReturn(Flux.error(new IllegalStateException("connection reset")));
            when(profileRepository.findSweepCandidates(any(), anyInt())).thenReturn(Flux.just(broken, ok));

            BatchReflectionSummary summary = service.runBatch(10).block();

            assertEquals(2, summary.processed());
            assertEquals(1, summary.succeeded());
            assertEquals(1, summary.failed());
            assertEquals(List.of("broken: connection reset"), summary.errors());
        }

        @Test
        @DisplayName("candidate that is not eligible → counted as skipped")
        void skippedCandidate() {
            UserProfile idle = profile("idle", PrivacyTier.B, 2);
            idle.setLastReflectionAt(ProfileCodec.toUtc(NOW.minus(Duration.ofHours(2))));
            idle.setNextReflectionAt(ProfileCodec.toUtc(NOW.plus(Duration.ofHours(22))));
            givenProfile(idle, signalRows("idle", "hi"));
            when(profileRepository.findSweepCandidates(any(), anyInt())).thenReturn(Flux.just(idle));

            BatchReflectionSummary summary = service.runBatch(null).block();

            assertEquals(1, summary.processed());
            assertEquals(0, summary.succeeded());
            assertEquals(1, summary.skipped());
            assertTrue(summary.errors().isEmpty());
        }
    }
}

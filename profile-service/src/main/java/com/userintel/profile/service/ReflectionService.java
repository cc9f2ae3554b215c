package com.userintel.profile.service;

import com.userintel.common.confidence.ConfidenceModel;
import com.userintel.common.context.StoredBelief;
import com.userintel.common.inference.DimensionInference;
import com.userintel.common.inference.DimensionInferenceEngine;
import com.userintel.common.inference.GapDetector;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.PrivacyTier;
import com.userintel.common.model.Signal;
import com.userintel.common.model.domain.DomainValue;
import com.userintel.common.reflection.BatchReflectionSummary;
import com.userintel.common.reflection.ReflectionPolicy;
import com.userintel.common.reflection.ReflectionReason;
import com.userintel.profile.codec.ProfileCodec;
import com.userintel.profile.dto.ReflectionResult;
import com.userintel.profile.model.SignalRecord;
import com.userintel.profile.model.UserProfile;
import com.userintel.profile.repository.DimensionScoreRepository;
import com.userintel.profile.repository.SignalRecordRepository;
import com.userintel.profile.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Reflection scheduler: decides when a profile is due, runs the inference
 * engine over its unprocessed signals and writes the results back.
 *
 * <p>Profiles are independent. A profile never reflects concurrently with
 * itself; a second request while one is running is skipped, which is safe
 * because the next pass sees the same unprocessed signals plus decay.
 */
@Service
public class ReflectionService {

    private static final Logger log = LoggerFactory.getLogger(ReflectionService.class);

    private final UserProfileRepository profileRepository;
    private final SignalRecordRepository signalRepository;
    private final DimensionScoreRepository scoreRepository;
    private final DimensionInferenceEngine inferenceEngine;
    private final ProfileCodec codec;
    private final Clock clock;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @Value("${profile.reflection.signal-batch-size:100}")
    private int signalBatchSize = 100;

    @Value("${profile.reflection.interval-hours:24}")
    private long intervalHours = 24;

    @Value("${profile.batch.default-limit:50}")
    private int defaultBatchLimit = 50;

    public ReflectionService(UserProfileRepository profileRepository,
                             SignalRecordRepository signalRepository,
                             DimensionScoreRepository scoreRepository,
                             DimensionInferenceEngine inferenceEngine,
                             ProfileCodec codec,
                             Clock clock) {
        this.profileRepository = profileRepository;
        this.signalRepository  = signalRepository;
        this.scoreRepository   = scoreRepository;
        this.inferenceEngine   = inferenceEngine;
        this.codec             = codec;
        this.clock             = clock;
    }

    // ── Triggers ────────────────────────────────────────────────────────────

    /** Runs a pass only if the profile is currently eligible. */
    public Mono<ReflectionResult> reflectIfEligible(String userId) {
        return profileRepository.findByUserId(userId)
            .flatMap(profile -> signalRepository.countUnprocessed(userId)
                .defaultIfEmpty(0L)
                .flatMap(unprocessed -> eligibility(profile, unprocessed)
                    .map(reason -> runGuarded(profile, reason))
                    .orElseGet(() -> Mono.just(ReflectionResult.skipped(userId, "Not eligible")))))
            .defaultIfEmpty(ReflectionResult.skipped(userId, "No profile"))
            .onErrorResume(e -> {
                log.warn("Eligibility check failed (non-fatal). userId={} error={}", userId, e.getMessage());
                return Mono.just(ReflectionResult.failed(userId, null, e));
            });
    }

    /** Session close: only sessions of meaningful length, and not right after another pass. */
    public Mono<ReflectionResult> onSessionClose(String userId, double sessionMinutes) {
        return trigger(userId, ReflectionReason.SESSION_CLOSE, profile ->
            ReflectionPolicy.sessionCloseTriggers(sessionMinutes,
                ProfileCodec.toInstant(profile.getLastReflectionAt()), clock.instant())
                ? Optional.empty()
                : Optional.of("Session too short or reflected recently"));
    }

    public Mono<ReflectionResult> onDecisionCluster(String userId, int decisionsInSession) {
        return trigger(userId, ReflectionReason.DECISION_CLUSTER, profile ->
            ReflectionPolicy.decisionClusterTriggers(decisionsInSession)
                ? Optional.empty()
                : Optional.of("Too few decisions in session"));
    }

    /** "Update what you know about me": always runs unless the tier forbids it. */
    public Mono<ReflectionResult> onManualTrigger(String userId) {
        return trigger(userId, ReflectionReason.MANUAL, profile -> Optional.empty());
    }

    private Mono<ReflectionResult> trigger(String userId, ReflectionReason reason,
                                           Function<UserProfile, Optional<String>> veto) {
        return profileRepository.findByUserId(userId)
            .flatMap(profile -> {
                if (!tierOf(profile).allowsDurableInference()) {
                    return Mono.just(ReflectionResult.skipped(userId, "Privacy tier A"));
                }
                Optional<String> why = veto.apply(profile);
                return why.map(w -> Mono.just(ReflectionResult.skipped(userId, w)))
                    .orElseGet(() -> runGuarded(profile, reason));
            })
            .defaultIfEmpty(ReflectionResult.skipped(userId, "No profile"));
    }

    // ── Batch ───────────────────────────────────────────────────────────────

    /**
     * Fleet sweep. Candidates are checked and reflected one by one; one
     * profile's failure is recorded and the sweep continues.
     */
    public Mono<BatchReflectionSummary> runBatch(Integer requestedLimit) {
        int limit = requestedLimit != null && requestedLimit > 0 ? requestedLimit : defaultBatchLimit;
        Instant now = clock.instant();
        log.info("BATCH_REFLECTION_START limit={}", limit);

        return profileRepository.findSweepCandidates(ProfileCodec.toUtc(now), limit)
            .concatMap(profile -> signalRepository.countUnprocessed(profile.getUserId())
                .defaultIfEmpty(0L)
                .flatMap(unprocessed -> eligibility(profile, unprocessed)
                    .map(reason -> runGuarded(profile, reason))
                    .orElseGet(() -> Mono.just(ReflectionResult.skipped(profile.getUserId(), "Not eligible"))))
                .onErrorResume(e -> Mono.just(ReflectionResult.failed(profile.getUserId(), null, e))))
            .collectList()
            .map(ReflectionService::summarize)
            .doOnSuccess(s -> log.info("BATCH_REFLECTION_DONE processed={} succeeded={} failed={} skipped={}",
                s.processed(), s.succeeded(), s.failed(), s.skipped()));
    }

    static BatchReflectionSummary summarize(List<ReflectionResult> results) {
        int succeeded = 0, failed = 0, skipped = 0;
        List<String> errors = new ArrayList<>();
        for (ReflectionResult r : results) {
            if (r.hasErrors()) {
                failed++;
                errors.addAll(r.errors());
            } else if (r.ran()) {
                succeeded++;
            } else {
                skipped++;
            }
        }
        return new BatchReflectionSummary(results.size(), succeeded, failed, skipped, errors);
    }

    // ── Pass ────────────────────────────────────────────────────────────────

    Optional<ReflectionReason> eligibility(UserProfile profile, long unprocessed) {
        return ReflectionPolicy.eligibility(tierOf(profile), unprocessed,
            ProfileCodec.toInstant(profile.getLastReflectionAt()),
            ProfileCodec.toInstant(profile.getNextReflectionAt()),
            clock.instant());
    }

    private Mono<ReflectionResult> runGuarded(UserProfile profile, ReflectionReason reason) {
        String userId = profile.getUserId();
        if (!running.add(userId)) {
            log.info("Reflection already running, skipping. userId={}", userId);
            return Mono.just(ReflectionResult.skipped(userId, "Reflection already running"));
        }
        return reflect(profile, reason)
            .onErrorResume(e -> {
                log.error("Reflection failed. userId={} reason={}", userId, reason, e);
                return Mono.just(ReflectionResult.failed(userId, reason, e));
            })
            .doFinally(signal -> running.remove(userId));
    }

    private Mono<ReflectionResult> reflect(UserProfile profile, ReflectionReason reason) {
        String userId = profile.getUserId();
        Instant now = clock.instant();

        Mono<List<SignalRecord>> signalsMono = signalRepository.findUnprocessed(userId, signalBatchSize).collectList();
        Mono<Map<BeliefDomain, StoredBelief>> beliefsMono = scoreRepository.findByUserId(userId)
            .flatMap(r -> Mono.justOrEmpty(codec.toBelief(r)))
            .collectMap(StoredBelief::domain, b -> b, () -> new EnumMap<>(BeliefDomain.class));

        return Mono.zip(signalsMono, beliefsMono).flatMap(tuple -> {
            List<SignalRecord> records = tuple.getT1();
            Map<BeliefDomain, StoredBelief> stored = tuple.getT2();

            List<Signal> signals = new ArrayList<>();
            for (SignalRecord r : records) codec.toSignal(r).ifPresent(signals::add);

            Map<BeliefDomain, DomainValue> existingValues = new EnumMap<>(BeliefDomain.class);
            stored.forEach((domain, belief) -> existingValues.put(domain, belief.value()));

            Map<BeliefDomain, DimensionInference<?>> inferred =
                inferenceEngine.inferAll(signals, profile.getSessionCount(), existingValues);
            Set<BeliefDomain> fed = inferenceEngine.domainsWithEvidence(signals);

            List<BeliefDomain> updated = new ArrayList<>();
            Map<BeliefDomain, Double> confidences = new EnumMap<>(BeliefDomain.class);
            List<Mono<Integer>> writes = new ArrayList<>();

            for (BeliefDomain domain : BeliefDomain.values()) {
                DimensionInference<?> result = inferred.get(domain);
                StoredBelief existing = stored.get(domain);
                if (ReflectionPolicy.shouldPersist(result, fed.contains(domain), existing, now)) {
                    writes.add(scoreRepository.upsertScore(userId, domain.name(), codec.writeValue(result.value()),
                        result.confidence(), domain.decayRate(), ProfileCodec.writeSources(result.sources()),
                        ProfileCodec.toUtc(now)));
                    updated.add(domain);
                    confidences.put(domain, result.confidence());
                } else if (existing != null) {
                    double decayed = ConfidenceModel.round(existing.decayedConfidence(now));
                    writes.add(scoreRepository.applyDecay(userId, domain.name(), decayed, ProfileCodec.toUtc(now)));
                    confidences.put(domain, decayed);
                }
            }

            List<Long> ids = records.stream().map(SignalRecord::getId).toList();
            Mono<Integer> markProcessed = ids.isEmpty()
                ? Mono.just(0)
                : signalRepository.markProcessed(ids, ProfileCodec.toUtc(now));

            Mono<Integer> markReflected = profileRepository.markReflected(userId, ProfileCodec.toUtc(now),
                ProfileCodec.toUtc(now.plus(Duration.ofHours(intervalHours))));

            return Flux.concat(writes)
                .then(markProcessed)
                .then(markReflected)
                .map(rows -> new ReflectionResult(userId, reason, true, records.size(),
                    List.copyOf(updated), GapDetector.findGaps(confidences), null, List.of()))
                .doOnSuccess(r -> log.info("REFLECTION_COMPLETE userId={} reason={} signals={} updated={} gaps={}",
                    userId, reason, r.signalsProcessed(), r.domainsUpdated(), r.gaps().size()));
        });
    }

    static PrivacyTier tierOf(UserProfile profile) {
        return PrivacyTier.fromString(profile.getPrivacyTier());
    }
}

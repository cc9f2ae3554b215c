package com.userintel.profile.service;

import com.userintel.common.context.ContextSummary;
import com.userintel.common.context.ProfileContextAssembler;
import com.userintel.common.context.StoredBelief;
import com.userintel.common.insight.QueuedInsight;
import com.userintel.common.model.KnownFact;
import com.userintel.common.model.PrivacyTier;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.Signal;
import com.userintel.common.model.SignalType;
import com.userintel.common.model.payload.MessageStylePayload;
import com.userintel.common.model.payload.RetryAction;
import com.userintel.common.signal.BehaviorSignals;
import com.userintel.common.signal.MessageMetadata;
import com.userintel.common.signal.SignalExtractor;
import com.userintel.common.signal.TopicClassifier;
import com.userintel.profile.codec.ProfileCodec;
import com.userintel.profile.dto.BehaviorSignalRequest;
import com.userintel.profile.dto.MessageIngestResult;
import com.userintel.profile.dto.MessageRequest;
import com.userintel.profile.dto.ProfileSnapshotDTO;
import com.userintel.profile.dto.ReflectionResult;
import com.userintel.profile.dto.SessionCloseResult;
import com.userintel.profile.dto.SessionRequest;
import com.userintel.profile.model.UserProfile;
import com.userintel.profile.repository.DimensionScoreRepository;
import com.userintel.profile.repository.ProfileFactRepository;
import com.userintel.profile.repository.SignalRecordRepository;
import com.userintel.profile.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for everything the conversational pipeline reports about a
 * user: messages, session boundaries and explicit behaviour events. Also
 * serves the per-turn context summary.
 *
 * <p>Tracking is best effort. Pattern detection and opportunistic reflection
 * never fail an ingest call; the context summary falls back to neutral.
 */
@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final UserProfileRepository profileRepository;
    private final SignalRecordRepository signalRepository;
    private final DimensionScoreRepository scoreRepository;
    private final ProfileFactRepository factRepository;
    private final SignalExtractor signalExtractor;
    private final TopicClassifier topicClassifier;
    private final ReflectionService reflectionService;
    private final InsightService insightService;
    private final InsightSessionStore sessionStore;
    private final ProfileCodec codec;
    private final Clock clock;

    public ProfileService(UserProfileRepository profileRepository,
                          SignalRecordRepository signalRepository,
                          DimensionScoreRepository scoreRepository,
                          ProfileFactRepository factRepository,
                          SignalExtractor signalExtractor,
                          TopicClassifier topicClassifier,
                          ReflectionService reflectionService,
                          InsightService insightService,
                          InsightSessionStore sessionStore,
                          ProfileCodec codec,
                          Clock clock) {
        this.profileRepository = profileRepository;
        this.signalRepository  = signalRepository;
        this.scoreRepository   = scoreRepository;
        this.factRepository    = factRepository;
        this.signalExtractor   = signalExtractor;
        this.topicClassifier   = topicClassifier;
        this.reflectionService = reflectionService;
        this.insightService    = insightService;
        this.sessionStore      = sessionStore;
        this.codec             = codec;
        this.clock             = clock;
    }

    // ── Messages ────────────────────────────────────────────────────────────

    /**
     * Extracts signals from one message, stores them unless the profile is
     * tier A, feeds the pattern detector and runs a reflection pass if the
     * profile has become eligible.
     */
    public Mono<MessageIngestResult> ingestMessage(String userId, MessageRequest request) {
        Instant now = clock.instant();
        ResponseMode mode = ResponseMode.fromString(request.mode());
        MessageMetadata metadata = new MessageMetadata(request.sessionId(), request.messageId(), now, mode);
        List<Signal> signals = signalExtractor.extract(request.text(), metadata);
        List<SignalType> types = signals.stream().map(Signal::signalType).toList();

        int queued = observePattern(userId, request, signals, mode);

        return getOrCreate(userId).flatMap(profile -> {
            if (!ReflectionService.tierOf(profile).allowsDurableInference()) {
                log.debug("Tier A profile, signals not persisted. userId={} signals={}", userId, signals.size());
                return Mono.just(new MessageIngestResult(types, false, queued, null));
            }
            return persist(profile, signals)
                .then(reflectionService.reflectIfEligible(userId))
                .map(r -> new MessageIngestResult(types, true, queued, r.ran() ? r : null));
        }).doOnError(e -> log.error("Message ingest failed. userId={}", userId, e));
    }

    private int observePattern(String userId, MessageRequest request, List<Signal> signals, ResponseMode mode) {
        try {
            int words = signals.stream()
                .filter(s -> s.signalType() == SignalType.MESSAGE_STYLE)
                .findFirst()
                .flatMap(s -> s.payloadAs(MessageStylePayload.class))
                .map(MessageStylePayload::wordCount)
                .orElse(0);
            List<String> topics = request.text() == null ? List.of() : topicClassifier.classify(request.text());
            String topic = topics.isEmpty() ? null : topics.get(0);
            List<QueuedInsight> queued = insightService.observeMessage(userId, request.sessionId(), words, mode, topic);
            return queued.size();
        } catch (RuntimeException e) {
            log.warn("Pattern detection failed (non-fatal). userId={} error={}", userId, e.getMessage());
            return 0;
        }
    }

    // ── Sessions ────────────────────────────────────────────────────────────

    public Mono<ProfileSnapshotDTO> startSession(String userId, SessionRequest request) {
        return getOrCreate(userId).flatMap(profile -> {
            if (request.sessionId() != null) {
                insightService.resetSession(request.sessionId());
            }
            return profileRepository.incrementSessionCount(userId, ProfileCodec.toUtc(clock.instant()))
                .then(profileRepository.findByUserId(userId));
        })
        .doOnNext(p -> log.info("SESSION_START userId={} session={} sessionCount={}",
            userId, request.sessionId(), p.getSessionCount()))
        .map(ProfileService::toSnapshot);
    }

    /**
     * Records session timing, checks the duration for a pattern break and
     * applies the session-close reflection trigger.
     */
    public Mono<SessionCloseResult> closeSession(String userId, SessionRequest request) {
        Instant now = clock.instant();
        Instant startedAt = request.sessionId() == null ? null
            : sessionStore.startedAt(request.sessionId()).orElse(null);
        double minutes = request.durationMinutes() != null
            ? Math.max(0.0, request.durationMinutes())
            : startedAt == null ? 0.0 : Duration.between(startedAt, now).toSeconds() / 60.0;

        int queued = 0;
        try {
            queued = insightService.observeSession(userId, request.sessionId(), minutes).size();
        } catch (RuntimeException e) {
            log.warn("Session pattern detection failed (non-fatal). userId={} error={}", userId, e.getMessage());
        }
        int insightsQueued = queued;

        Instant start = startedAt != null ? startedAt : now.minusSeconds((long) (minutes * 60));
        Signal timing = BehaviorSignals.sessionTiming(start, zoneOf(request.timezone()), minutes,
            request.sessionId(), now);

        return profileRepository.findByUserId(userId)
            .flatMap(profile -> {
                Mono<Void> stored = ReflectionService.tierOf(profile).allowsDurableInference()
                    ? persist(profile, List.of(timing)) : Mono.empty();
                return stored.then(reflectionService.onSessionClose(userId, minutes));
            })
            .defaultIfEmpty(ReflectionResult.skipped(userId, "No profile"))
            .map(r -> new SessionCloseResult(minutes, insightsQueued, r))
            .doOnSuccess(r -> log.info("SESSION_CLOSE userId={} session={} minutes={} reflected={}",
                userId, request.sessionId(), String.format(Locale.ROOT, "%.1f", minutes), r.reflection().ran()));
    }

    // ── Behaviour events ────────────────────────────────────────────────────

    public Mono<Boolean> recordModeSelection(String userId, BehaviorSignalRequest request) {
        ResponseMode mode = ResponseMode.fromString(request.mode());
        if (mode == null) {
            return Mono.error(new IllegalArgumentException("Unknown response mode: " + request.mode()));
        }
        return recordBehavior(userId, BehaviorSignals.modeSelection(mode, request.sessionId(), clock.instant()));
    }

    public Mono<Boolean> recordRetry(String userId, BehaviorSignalRequest request) {
        RetryAction action;
        try {
            action = RetryAction.valueOf(request.action().trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            return Mono.error(new IllegalArgumentException("Unknown retry action: " + request.action(), e));
        }
        int attempt = request.attemptNumber() != null ? request.attemptNumber() : 1;
        return recordBehavior(userId, BehaviorSignals.retry(action, attempt, request.sessionId(), clock.instant()));
    }

    /** @return whether the signal was persisted */
    private Mono<Boolean> recordBehavior(String userId, Signal signal) {
        return getOrCreate(userId).flatMap(profile -> {
            if (!ReflectionService.tierOf(profile).allowsDurableInference()) {
                return Mono.just(false);
            }
            return persist(profile, List.of(signal)).thenReturn(true);
        });
    }

    // ── Context ─────────────────────────────────────────────────────────────

    /** Never fails: an unknown user or a storage error yields a neutral summary. */
    public Mono<ContextSummary> contextSummary(String userId) {
        Instant now = clock.instant();
        Mono<List<StoredBelief>> beliefs = scoreRepository.findByUserId(userId)
            .flatMap(r -> Mono.justOrEmpty(codec.toBelief(r)))
            .collectList();
        Mono<List<KnownFact>> facts = factRepository.findByUserId(userId)
            .map(codec::toFact)
            .collectList();

        return profileRepository.findByUserId(userId)
            .flatMap(profile -> Mono.zip(beliefs, facts))
            .map(t -> ProfileContextAssembler.assemble(t.getT1(), t.getT2(), now))
            .defaultIfEmpty(ContextSummary.unknownUser())
            .onErrorResume(e -> {
                log.warn("Context summary failed, returning neutral. userId={} error={}", userId, e.getMessage());
                return Mono.just(ContextSummary.unknownUser());
            });
    }

    // ── Administration ──────────────────────────────────────────────────────

    public Mono<ProfileSnapshotDTO> getProfile(String userId) {
        return profileRepository.findByUserId(userId).map(ProfileService::toSnapshot);
    }

    public Mono<ProfileSnapshotDTO> updatePrivacyTier(String userId, String tier) {
        PrivacyTier parsed = PrivacyTier.fromString(tier);
        return getOrCreate(userId)
            .flatMap(profile -> profileRepository.updatePrivacyTier(userId, parsed.name(),
                ProfileCodec.toUtc(clock.instant())))
            .then(profileRepository.findByUserId(userId))
        .doOnSuccess(p -> log.info("PRIVACY_TIER_CHANGED userId={} tier={}", userId, parsed))
        .map(ProfileService::toSnapshot);
    }

    /** Explicit reset: the only path that deletes dimension scores. */
    public Mono<Integer> resetDimensions(String userId) {
        return scoreRepository.deleteByUserId(userId)
            .doOnSuccess(n -> log.info("DIMENSIONS_RESET userId={} deleted={}", userId, n));
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    Mono<UserProfile> getOrCreate(String userId) {
        return profileRepository.findByUserId(userId)
            .switchIfEmpty(Mono.defer(() -> {
                UserProfile profile = new UserProfile();
                profile.setUserId(userId);
                profile.setPrivacyTier(PrivacyTier.B.name());
                profile.setCreatedAt(ProfileCodec.toUtc(clock.instant()));
                profile.setUpdatedAt(profile.getCreatedAt());
                return profileRepository.save(profile)
                    .doOnSuccess(p -> log.info("PROFILE_CREATED userId={}", userId))
                    // a concurrent request created the row first
                    .onErrorResume(DataIntegrityViolationException.class,
                        e -> profileRepository.findByUserId(userId));
            }));
    }

    private Mono<Void> persist(UserProfile profile, List<Signal> signals) {
        if (signals.isEmpty()) return Mono.empty();
        return Flux.fromIterable(signals)
            .map(s -> codec.toRecord(profile.getUserId(), s))
            .collectList()
            .flatMapMany(signalRepository::saveAll)
            .then(Mono.defer(() -> profileRepository.addSignalCount(profile.getUserId(), signals.size(),
                ProfileCodec.toUtc(clock.instant()))))
            .then();
    }

    private static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown timezone, using UTC. timezone={}", timezone);
            return ZoneOffset.UTC;
        }
    }

    static ProfileSnapshotDTO toSnapshot(UserProfile p) {
        return new ProfileSnapshotDTO(p.getUserId(), p.getSessionCount(), p.getSignalCount(),
            p.getQuestionsAsked(), PrivacyTier.fromString(p.getPrivacyTier()),
            p.getLastReflectionAt(), p.getNextReflectionAt());
    }
}

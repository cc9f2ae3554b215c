package com.userintel.profile.service;

import com.userintel.common.context.StoredBelief;
import com.userintel.common.elicitation.ElicitationAnswerParser;
import com.userintel.common.elicitation.ElicitationDecision;
import com.userintel.common.elicitation.ElicitationProfile;
import com.userintel.common.elicitation.ElicitationQuestion;
import com.userintel.common.elicitation.ElicitationSelector;
import com.userintel.common.elicitation.QuestionBank;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.KnownFact;
import com.userintel.common.model.domain.IdentityContext;
import com.userintel.profile.codec.ProfileCodec;
import com.userintel.profile.dto.AnswerRequest;
import com.userintel.profile.dto.AnswerResult;
import com.userintel.profile.model.ElicitationResponseRecord;
import com.userintel.profile.model.ProfileFactRecord;
import com.userintel.profile.model.UserProfile;
import com.userintel.profile.repository.DimensionScoreRepository;
import com.userintel.profile.repository.ElicitationResponseRepository;
import com.userintel.profile.repository.ProfileFactRepository;
import com.userintel.profile.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the elicitation pacing rules to persisted state and records answers.
 * A question counts as asked for the session as soon as it is served.
 */
@Service
public class ElicitationService {

    private static final Logger log = LoggerFactory.getLogger(ElicitationService.class);

    private final UserProfileRepository profileRepository;
    private final ElicitationResponseRepository responseRepository;
    private final DimensionScoreRepository scoreRepository;
    private final ProfileFactRepository factRepository;
    private final ProfileCodec codec;
    private final Clock clock;

    public ElicitationService(UserProfileRepository profileRepository,
                              ElicitationResponseRepository responseRepository,
                              DimensionScoreRepository scoreRepository,
                              ProfileFactRepository factRepository,
                              ProfileCodec codec,
                              Clock clock) {
        this.profileRepository  = profileRepository;
        this.responseRepository = responseRepository;
        this.scoreRepository    = scoreRepository;
        this.factRepository     = factRepository;
        this.codec              = codec;
        this.clock              = clock;
    }

    public Mono<ElicitationDecision> nextQuestion(String userId) {
        return profileRepository.findByUserId(userId)
            .flatMap(profile -> snapshot(profile).flatMap(snapshot -> {
                ElicitationDecision decision = ElicitationSelector.shouldAsk(snapshot);
                if (!decision.ask()) {
                    log.debug("No elicitation question. userId={} reason={}", userId, decision.reason());
                    return Mono.just(decision);
                }
                return profileRepository.claimQuestionSlot(userId, profile.getSessionCount(),
                        ProfileCodec.toUtc(clock.instant()))
                    .map(claimed -> {
                        if (claimed == 0) {
                            log.debug("Question slot already taken this session. userId={}", userId);
                            return ElicitationDecision.no("Already asked this session");
                        }
                        log.info("ELICITATION_SERVED userId={} question={} reason={}",
                            userId, decision.question().id(), decision.reason());
                        return decision;
                    });
            }))
            .defaultIfEmpty(ElicitationDecision.no("No profile"))
            .onErrorResume(e -> {
                log.warn("Elicitation selection failed (non-fatal). userId={} error={}", userId, e.getMessage());
                return Mono.just(ElicitationDecision.no("Unavailable"));
            });
    }

    /**
     * Records an answer or a skip. Unknown question ids are rejected; a question
     * already recorded for the profile is not recorded twice.
     */
    public Mono<AnswerResult> recordAnswer(String userId, AnswerRequest request) {
        Optional<ElicitationQuestion> question = QuestionBank.find(request.questionId());
        if (question.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Unknown question: " + request.questionId()));
        }
        ElicitationQuestion q = question.get();

        return profileRepository.findByUserId(userId)
            .flatMap(profile -> responseRepository.findByUserIdOrderByAskedAtDesc(userId)
                .any(r -> q.id().equals(r.getQuestionId()))
                .flatMap(alreadyAsked -> alreadyAsked
                    ? Mono.just(AnswerResult.notRecorded("Question already recorded"))
                    : store(profile, q, request.response())))
            .defaultIfEmpty(AnswerResult.notRecorded("No profile"));
    }

    private Mono<AnswerResult> store(UserProfile profile, ElicitationQuestion question, String response) {
        Instant now = clock.instant();
        boolean skipped = ElicitationAnswerParser.isSkip(response);
        List<KnownFact> facts = ElicitationAnswerParser.parse(question, response);

        ElicitationResponseRecord record = new ElicitationResponseRecord();
        record.setUserId(profile.getUserId());
        record.setQuestionId(question.id());
        record.setDomain(question.domain().name());
        record.setResponse(skipped ? null : response.trim());
        record.setSkipped(skipped);
        record.setSessionNumber(profile.getSessionCount());
        record.setPhase(question.phase());
        record.setExtractedFacts(codec.writeFacts(facts));
        record.setAskedAt(ProfileCodec.toUtc(now));

        return responseRepository.save(record)
            .thenMany(Flux.fromIterable(facts).concatMap(f -> factRepository.upsertFact(profile.getUserId(),
                f.domain() != null ? f.domain().name() : null, f.factType(), f.key(), f.value(),
                f.source().name(), f.explicit(), f.confidence(), ProfileCodec.toUtc(now))))
            .then(profileRepository.recordQuestionAsked(profile.getUserId(), profile.getSessionCount(),
                ProfileCodec.toUtc(now)))
            .map(rows -> new AnswerResult(true, skipped, facts, null))
            .doOnSuccess(r -> log.info("ELICITATION_RECORDED userId={} question={} skipped={} facts={}",
                profile.getUserId(), question.id(), skipped, facts.size()))
            .doOnError(e -> log.error("Failed to record elicitation answer. userId={} question={}",
                profile.getUserId(), question.id(), e));
    }

    // ── Snapshot ────────────────────────────────────────────────────────────

    Mono<ElicitationProfile> snapshot(UserProfile profile) {
        String userId = profile.getUserId();
        Instant now = clock.instant();

        Mono<List<ElicitationResponseRecord>> responses =
            responseRepository.findByUserIdOrderByAskedAtDesc(userId).collectList();
        Mono<List<StoredBelief>> beliefs = scoreRepository.findByUserId(userId)
            .flatMap(r -> Mono.justOrEmpty(codec.toBelief(r)))
            .collectList();
        Mono<List<ProfileFactRecord>> facts = factRepository.findByUserId(userId).collectList();

        return Mono.zip(responses, beliefs, facts).map(t -> {
            Set<String> askedIds = t.getT1().stream()
                .map(ElicitationResponseRecord::getQuestionId)
                .collect(Collectors.toSet());
            Instant lastResponseAt = t.getT1().isEmpty() ? null
                : ProfileCodec.toInstant(t.getT1().get(0).getAskedAt());

            Map<BeliefDomain, Double> confidences = new EnumMap<>(BeliefDomain.class);
            IdentityContext identity = null;
            for (StoredBelief b : t.getT2()) {
                confidences.put(b.domain(), b.decayedConfidence(now));
                if (b.value() instanceof IdentityContext ic) identity = ic;
            }

            boolean askedThisSession = Objects.equals(profile.getLastQuestionSession(), profile.getSessionCount());
            return new ElicitationProfile(profile.getSessionCount(), profile.getQuestionsAsked(), askedIds,
                askedThisSession, lastResponseAt, confidences, knownName(t.getT3(), identity), now);
        });
    }

    static String knownName(List<ProfileFactRecord> facts, IdentityContext identity) {
        for (ProfileFactRecord f : facts) {
            if ("name".equals(f.getFactType()) && f.getFactValue() != null && !f.getFactValue().isBlank()) {
                return f.getFactValue();
            }
        }
        if (identity == null) return null;
        return identity.name() != null ? identity.name() : identity.preferredName();
    }
}

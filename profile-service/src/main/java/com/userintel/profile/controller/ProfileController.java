package com.userintel.profile.controller;

import com.userintel.common.context.ContextSummary;
import com.userintel.common.elicitation.ElicitationDecision;
import com.userintel.profile.dto.AnswerRequest;
import com.userintel.profile.dto.AnswerResult;
import com.userintel.profile.dto.BehaviorSignalRequest;
import com.userintel.profile.dto.MessageIngestResult;
import com.userintel.profile.dto.MessageRequest;
import com.userintel.profile.dto.PrivacyTierRequest;
import com.userintel.profile.dto.ProfileSnapshotDTO;
import com.userintel.profile.dto.SessionCloseResult;
import com.userintel.profile.dto.SessionRequest;
import com.userintel.profile.service.ElicitationService;
import com.userintel.profile.service.ProfileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * API consumed by the conversational pipeline. The chat-facing reads
 * (context, next question) always answer 200 with a neutral body when
 * nothing is known or something fails.
 */
@RestController
@RequestMapping("/api/v1/profile/{userId}")
public class ProfileController {

    private static final Logger log = LoggerFactory.getLogger(ProfileController.class);

    private final ProfileService profileService;
    private final ElicitationService elicitationService;

    public ProfileController(ProfileService profileService, ElicitationService elicitationService) {
        this.profileService     = profileService;
        this.elicitationService = elicitationService;
    }

    @GetMapping
    public Mono<ResponseEntity<ProfileSnapshotDTO>> profile(@PathVariable String userId) {
        return profileService.getProfile(userId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/messages")
    public Mono<ResponseEntity<MessageIngestResult>> message(@PathVariable String userId,
                                                             @RequestBody MessageRequest request) {
        log.debug("Message received. userId={} session={}", userId, request.sessionId());
        return profileService.ingestMessage(userId, request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Message endpoint error. userId={}", userId, e));
    }

    @PostMapping("/sessions/start")
    public Mono<ResponseEntity<ProfileSnapshotDTO>> startSession(@PathVariable String userId,
                                                                 @RequestBody SessionRequest request) {
        return profileService.startSession(userId, request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/sessions/close")
    public Mono<ResponseEntity<SessionCloseResult>> closeSession(@PathVariable String userId,
                                                                 @RequestBody SessionRequest request) {
        return profileService.closeSession(userId, request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/signals/mode")
    public Mono<ResponseEntity<Map<String, Object>>> modeSelection(@PathVariable String userId,
                                                                   @RequestBody BehaviorSignalRequest request) {
        return profileService.recordModeSelection(userId, request)
            .map(persisted -> ResponseEntity.ok(Map.<String, Object>of("persisted", persisted)));
    }

    @PostMapping("/signals/retry")
    public Mono<ResponseEntity<Map<String, Object>>> retry(@PathVariable String userId,
                                                           @RequestBody BehaviorSignalRequest request) {
        return profileService.recordRetry(userId, request)
            .map(persisted -> ResponseEntity.ok(Map.<String, Object>of("persisted", persisted)));
    }

    @GetMapping("/context")
    public Mono<ResponseEntity<ContextSummary>> context(@PathVariable String userId) {
        return profileService.contextSummary(userId)
            .map(ResponseEntity::ok);
    }

    @PutMapping("/privacy-tier")
    public Mono<ResponseEntity<ProfileSnapshotDTO>> privacyTier(@PathVariable String userId,
                                                                @RequestBody PrivacyTierRequest request) {
        log.info("Privacy tier change requested. userId={} tier={}", userId, request.tier());
        return profileService.updatePrivacyTier(userId, request.tier())
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/dimensions")
    public Mono<ResponseEntity<Map<String, Object>>> resetDimensions(@PathVariable String userId) {
        log.info("Dimension reset requested. userId={}", userId);
        return profileService.resetDimensions(userId)
            .map(n -> ResponseEntity.ok(Map.<String, Object>of("deleted", n)));
    }

    // ── Elicitation ─────────────────────────────────────────────────────────

    @GetMapping("/elicitation/next")
    public Mono<ResponseEntity<ElicitationDecision>> nextQuestion(@PathVariable String userId) {
        return elicitationService.nextQuestion(userId)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/elicitation/answers")
    public Mono<ResponseEntity<AnswerResult>> answer(@PathVariable String userId,
                                                     @RequestBody AnswerRequest request) {
        log.info("Elicitation answer received. userId={} question={}", userId, request.questionId());
        return elicitationService.recordAnswer(userId, request)
            .map(ResponseEntity::ok);
    }
}

package com.userintel.profile.controller;

import com.userintel.common.insight.InsightPreferences;
import com.userintel.common.insight.QueuedInsight;
import com.userintel.profile.dto.ActivityRequest;
import com.userintel.profile.dto.EngagementRequest;
import com.userintel.profile.dto.InsightSessionStatus;
import com.userintel.profile.dto.NextInsightRequest;
import com.userintel.profile.dto.QueueInsightRequest;
import com.userintel.profile.service.InsightService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Per-session insight API. {@code /next} answers 204 when nothing should be
 * surfaced, including when the gate itself fails.
 */
@RestController
@RequestMapping("/api/v1/insights/{sessionId}")
public class InsightController {

    private static final Logger log = LoggerFactory.getLogger(InsightController.class);

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @PostMapping
    public Mono<ResponseEntity<QueuedInsight>> queue(@PathVariable String sessionId,
                                                     @RequestBody QueueInsightRequest request) {
        return Mono.fromCallable(() -> insightService.queue(sessionId, request))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/next")
    public Mono<ResponseEntity<QueuedInsight>> next(@PathVariable String sessionId,
                                                    @RequestBody NextInsightRequest request) {
        return Mono.fromCallable(() -> insightService.next(sessionId, request))
            .map(found -> found.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().<QueuedInsight>build()))
            .onErrorResume(e -> {
                log.warn("Insight delivery failed, surfacing nothing. session={} error={}", sessionId, e.getMessage());
                return Mono.just(ResponseEntity.noContent().<QueuedInsight>build());
            });
    }

    @PostMapping("/{insightId}/engagement")
    public Mono<ResponseEntity<Map<String, Object>>> engagement(@PathVariable String sessionId,
                                                                @PathVariable String insightId,
                                                                @RequestBody EngagementRequest request) {
        return Mono.fromCallable(() -> insightService.recordEngagement(sessionId, insightId,
                request.action(), request.rating()))
            .map(recorded -> recorded
                ? ResponseEntity.ok(Map.<String, Object>of("recorded", true))
                : ResponseEntity.notFound().<Map<String, Object>>build());
    }

    @PostMapping("/dismiss-active")
    public Mono<ResponseEntity<QueuedInsight>> dismissActive(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> insightService.dismissActive(sessionId))
            .map(found -> found.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().<QueuedInsight>build()));
    }

    @PostMapping("/activity")
    public Mono<ResponseEntity<Map<String, Object>>> activity(@PathVariable String sessionId,
                                                              @RequestBody ActivityRequest request) {
        return Mono.fromCallable(() -> insightService.recordActivity(sessionId, request.type(), request.charsTyped()))
            .map(level -> ResponseEntity.ok(Map.<String, Object>of("engagementLevel", level)));
    }

    @GetMapping("/preferences")
    public Mono<ResponseEntity<InsightPreferences>> preferences(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(insightService.preferences(sessionId)));
    }

    @PutMapping("/preferences")
    public Mono<ResponseEntity<InsightPreferences>> updatePreferences(@PathVariable String sessionId,
                                                                      @RequestBody InsightPreferences preferences) {
        return Mono.fromCallable(() -> insightService.updatePreferences(sessionId, preferences))
            .map(ResponseEntity::ok);
    }

    @PutMapping("/muted/{category}")
    public Mono<ResponseEntity<InsightPreferences>> mute(@PathVariable String sessionId,
                                                         @PathVariable String category) {
        return Mono.fromCallable(() -> insightService.setMuted(sessionId, category, true))
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/muted/{category}")
    public Mono<ResponseEntity<InsightPreferences>> unmute(@PathVariable String sessionId,
                                                           @PathVariable String category) {
        return Mono.fromCallable(() -> insightService.setMuted(sessionId, category, false))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<InsightSessionStatus>> reset(@PathVariable String sessionId) {
        insightService.resetSession(sessionId);
        return Mono.just(ResponseEntity.ok(insightService.status(sessionId)));
    }

    @DeleteMapping
    public Mono<ResponseEntity<InsightSessionStatus>> clear(@PathVariable String sessionId) {
        log.info("Insight queue clear requested. session={}", sessionId);
        insightService.clearQueue(sessionId);
        return Mono.just(ResponseEntity.ok(insightService.status(sessionId)));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<InsightSessionStatus>> status(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(insightService.status(sessionId)));
    }
}

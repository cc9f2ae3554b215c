package com.userintel.profile.controller;

import com.userintel.common.reflection.BatchReflectionSummary;
import com.userintel.profile.dto.ReflectionResult;
import com.userintel.profile.service.ReflectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/** Reflection triggers for users and the background job runner. */
@RestController
@RequestMapping("/api/v1/reflection")
public class ReflectionController {

    private static final Logger log = LoggerFactory.getLogger(ReflectionController.class);

    private final ReflectionService reflectionService;

    public ReflectionController(ReflectionService reflectionService) {
        this.reflectionService = reflectionService;
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchReflectionSummary>> batch(@RequestParam(required = false) Integer limit) {
        log.info("Batch reflection requested. limit={}", limit);
        return reflectionService.runBatch(limit)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Batch reflection endpoint error. limit={}", limit, e));
    }

    @PostMapping("/{userId}")
    public Mono<ResponseEntity<ReflectionResult>> manual(@PathVariable String userId) {
        log.info("Manual reflection requested. userId={}", userId);
        return reflectionService.onManualTrigger(userId)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{userId}/decision-cluster")
    public Mono<ResponseEntity<ReflectionResult>> decisionCluster(@PathVariable String userId,
                                                                  @RequestParam int decisions) {
        return reflectionService.onDecisionCluster(userId, decisions)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}

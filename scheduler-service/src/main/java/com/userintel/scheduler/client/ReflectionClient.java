package com.userintel.scheduler.client;

import com.userintel.common.reflection.BatchReflectionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Calls the fleet-level reflection sweep on profile-service.
 *
 * <p>Errors are absorbed: a failed call completes empty so the sweep loop
 * can fall back to its default interval instead of stalling.
 */
@Component
public class ReflectionClient {

    private static final Logger log = LoggerFactory.getLogger(ReflectionClient.class);

    private final WebClient profileClient;

    public ReflectionClient(WebClient profileClient) {
        this.profileClient = profileClient;
    }

    /**
     * @param limit maximum number of profiles the sweep may pick up
     * @return the sweep summary, or empty when profile-service could not be reached
     */
    public Mono<BatchReflectionSummary> runSweep(int limit) {
        String traceId = UUID.randomUUID().toString();
        log.info("Triggering reflection sweep. limit={} traceId={}", limit, traceId);

        return profileClient.post()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/reflection/batch")
                .queryParam("limit", limit)
                .build())
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(BatchReflectionSummary.class)
            .doOnNext(s -> log.info("Reflection sweep finished. traceId={} processed={} succeeded={} failed={} skipped={}",
                                    traceId, s.processed(), s.succeeded(), s.failed(), s.skipped()))
            .onErrorResume(e -> {
                log.warn("Reflection sweep call failed. traceId={} reason={}", traceId, e.getMessage());
                return Mono.empty();
            });
    }
}

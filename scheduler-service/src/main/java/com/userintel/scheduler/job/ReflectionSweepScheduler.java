package com.userintel.scheduler.job;

import com.userintel.common.reflection.BatchReflectionSummary;
import com.userintel.scheduler.client.ReflectionClient;
import com.userintel.scheduler.strategy.SweepTempoStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodic fleet-level reflection sweep.
 *
 * <pre>
 *   delay(interval) → POST /reflection/batch → compute next interval → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} pipeline whose terminal {@code subscribe()}
 * schedules the next one, so no thread is held during the wait. The loop never
 * stops: a failed cycle reschedules with {@link SweepTempoStrategy#FALLBACK_INTERVAL}.
 */
@Component
public class ReflectionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReflectionSweepScheduler.class);

    private final ReflectionClient reflectionClient;

    @Value("${scheduler.reflection.batch-limit:50}")
    private int batchLimit;

    @Value("${scheduler.reflection.initial-delay-seconds:60}")
    private long initialDelaySeconds;

    @Value("${scheduler.reflection.enabled:true}")
    private boolean enabled;

    public ReflectionSweepScheduler(ReflectionClient reflectionClient) {
        this.reflectionClient = reflectionClient;
    }

    @PostConstruct
    public void startSweeping() {
        if (!enabled) {
            log.info("Reflection sweep disabled.");
            return;
        }
        Duration initial = Duration.ofSeconds(Math.max(0, initialDelaySeconds));
        log.info("Reflection sweep started. batchLimit={} initialDelaySeconds={}", batchLimit, initial.toSeconds());
        scheduleNextCycle(initial);
    }

    private void scheduleNextCycle(Duration delay) {
        Mono.delay(delay)
            .then(reflectionClient.runSweep(batchLimit))
            .map(this::nextInterval)
            .defaultIfEmpty(SweepTempoStrategy.FALLBACK_INTERVAL)
            .subscribe(
                next -> {
                    log.info("SWEEP_TEMPO_SELECTED batchLimit={} nextIntervalSeconds={}", batchLimit, next.toSeconds());
                    scheduleNextCycle(next);
                },
                err -> {
                    log.error("Sweep cycle failed, rescheduling with fallback interval.", err);
                    scheduleNextCycle(SweepTempoStrategy.FALLBACK_INTERVAL);
                }
            );
    }

    private Duration nextInterval(BatchReflectionSummary summary) {
        if (!summary.errors().isEmpty()) {
            log.warn("Reflection sweep reported failures. failed={} first={}", summary.failed(), summary.errors().get(0));
        }
        return SweepTempoStrategy.resolve(summary, batchLimit);
    }
}

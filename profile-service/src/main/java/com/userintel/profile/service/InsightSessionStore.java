package com.userintel.profile.service;

import com.userintel.common.insight.InsightPreferences;
import com.userintel.common.insight.InsightQueue;
import com.userintel.common.pattern.BehaviorBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local home of per-session insight queues and per-user behaviour
 * baselines. Nothing here survives a restart, and two instances behind a load
 * balancer do not see each other's sessions.
 *
 * <p>Entries untouched for longer than the configured TTL are evicted lazily,
 * at most once per minute, on the next access.
 */
@Component
public class InsightSessionStore {

    private static final Logger log = LoggerFactory.getLogger(InsightSessionStore.class);

    private static final Duration EVICTION_PERIOD = Duration.ofMinutes(1);

    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final Map<String, BaselineEntry> baselines = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final int hourlyLimit;
    private volatile Instant lastEviction;

    public InsightSessionStore(Clock clock,
                               @Value("${profile.session.ttl-minutes:120}") long ttlMinutes,
                               @Value("${profile.insight.hourly-limit:3}") int hourlyLimit) {
        this.clock        = clock;
        this.ttl          = Duration.ofMinutes(ttlMinutes);
        this.hourlyLimit  = hourlyLimit;
        this.lastEviction = clock.instant();
    }

    public InsightQueue queue(String sessionId) {
        evictIfDue();
        SessionEntry entry = sessions.computeIfAbsent(sessionId, id -> {
            log.debug("Insight session created. sessionId={}", id);
            return new SessionEntry(new InsightQueue(id, InsightPreferences.defaults(hourlyLimit), clock),
                clock.instant());
        });
        entry.touch(clock.instant());
        return entry.queue;
    }

    /** Start of the session as first seen by this process. */
    public Optional<Instant> startedAt(String sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.of(entry.startedAt);
    }

    /** Baseline instances are not thread-safe; callers synchronise on them. */
    public BehaviorBaseline baseline(String userId) {
        evictIfDue();
        BaselineEntry entry = baselines.computeIfAbsent(userId, id -> new BaselineEntry(new BehaviorBaseline()));
        entry.touch(clock.instant());
        return entry.baseline;
    }

    public int sessionCount() {
        return sessions.size();
    }

    int evictIdle() {
        Instant cutoff = clock.instant().minus(ttl);
        int before = sessions.size() + baselines.size();
        sessions.entrySet().removeIf(e -> e.getValue().lastTouched.isBefore(cutoff));
        baselines.entrySet().removeIf(e -> e.getValue().lastTouched.isBefore(cutoff));
        int evicted = before - sessions.size() - baselines.size();
        if (evicted > 0) {
            log.info("SESSION_EVICTION evicted={} remaining={}", evicted, sessions.size());
        }
        return evicted;
    }

    private void evictIfDue() {
        Instant now = clock.instant();
        if (Duration.between(lastEviction, now).compareTo(EVICTION_PERIOD) >= 0) {
            lastEviction = now;
            evictIdle();
        }
    }

    private static final class SessionEntry {
        private final InsightQueue queue;
        private final Instant startedAt;
        private volatile Instant lastTouched;

        SessionEntry(InsightQueue queue, Instant startedAt) {
            this.queue       = queue;
            this.startedAt   = startedAt;
            this.lastTouched = startedAt;
        }

        void touch(Instant now) {
            lastTouched = now;
        }
    }

    private static final class BaselineEntry {
        private final BehaviorBaseline baseline;
        private volatile Instant lastTouched = Instant.EPOCH;

        BaselineEntry(BehaviorBaseline baseline) {
            this.baseline = baseline;
        }

        void touch(Instant now) {
            lastTouched = now;
        }
    }
}

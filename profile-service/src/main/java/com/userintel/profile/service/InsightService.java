package com.userintel.profile.service;

import com.userintel.common.insight.EngagementAction;
import com.userintel.common.insight.EngagementEstimator;
import com.userintel.common.insight.EngagementLevel;
import com.userintel.common.insight.InsightCategory;
import com.userintel.common.insight.InsightDeliveryContext;
import com.userintel.common.insight.InsightDraft;
import com.userintel.common.insight.InsightPreferences;
import com.userintel.common.insight.InsightQueue;
import com.userintel.common.insight.InsightTrigger;
import com.userintel.common.insight.QueuedInsight;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.pattern.BehaviorBaseline;
import com.userintel.common.pattern.InsightDrafts;
import com.userintel.common.pattern.PatternBreak;
import com.userintel.common.pattern.PatternBreakDetector;
import com.userintel.profile.dto.InsightSessionStatus;
import com.userintel.profile.dto.NextInsightRequest;
import com.userintel.profile.dto.QueueInsightRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Session-facing side of the insight queue: queueing detector output, the
 * delivery gate, engagement feedback and per-session preferences.
 *
 * <p>Everything here is in memory and synchronous.
 */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final InsightSessionStore store;

    public InsightService(InsightSessionStore store) {
        this.store = store;
    }

    // ── Queueing ────────────────────────────────────────────────────────────

    public QueuedInsight queue(String sessionId, QueueInsightRequest request) {
        InsightCategory category = parseCategory(request.category());
        InsightTrigger trigger = InsightTrigger.fromString(request.trigger());
        if (trigger == null) {
            throw new IllegalArgumentException("Unknown trigger: " + request.trigger());
        }
        InsightDraft draft = new InsightDraft(category, request.title(), request.message(),
            request.expandedContent(), trigger,
            request.minIdleSeconds() != null ? request.minIdleSeconds() : 0,
            request.contextTags(),
            request.basePriority() != null ? request.basePriority() : InsightDraft.DEFAULT_BASE_PRIORITY,
            request.confidence() != null ? request.confidence() : 0.5);
        return store.queue(sessionId).queueInsight(draft,
            request.activeGoals() != null ? request.activeGoals() : List.of());
    }

    /** Feeds one message into the user's baseline and queues any surfacing break. */
    public List<QueuedInsight> observeMessage(String userId, String sessionId, int wordCount,
                                              ResponseMode mode, String topic) {
        BehaviorBaseline baseline = store.baseline(userId);
        List<PatternBreak> breaks;
        synchronized (baseline) {
            breaks = PatternBreakDetector.observeMessage(baseline, wordCount, mode, topic);
        }
        return queueBreaks(sessionId, breaks);
    }

    public List<QueuedInsight> observeSession(String userId, String sessionId, double durationMinutes) {
        BehaviorBaseline baseline = store.baseline(userId);
        List<PatternBreak> breaks;
        synchronized (baseline) {
            breaks = PatternBreakDetector.observeSession(baseline, durationMinutes);
        }
        return queueBreaks(sessionId, breaks);
    }

    private List<QueuedInsight> queueBreaks(String sessionId, List<PatternBreak> breaks) {
        if (breaks.isEmpty() || sessionId == null) return List.of();
        InsightQueue queue = store.queue(sessionId);
        List<QueuedInsight> queued = new ArrayList<>();
        for (PatternBreak pb : breaks) {
            InsightDrafts.fromBreak(pb).ifPresent(draft -> queued.add(queue.queueInsight(draft, List.of())));
        }
        if (!queued.isEmpty()) {
            log.info("PATTERN_BREAKS_QUEUED session={} breaks={} queued={}", sessionId, breaks.size(), queued.size());
        }
        return queued;
    }

    // ── Delivery ────────────────────────────────────────────────────────────

    public Optional<QueuedInsight> next(String sessionId, NextInsightRequest request) {
        InsightTrigger trigger = InsightTrigger.fromString(request.trigger());
        if (trigger == null) {
            throw new IllegalArgumentException("Unknown trigger: " + request.trigger());
        }
        InsightDeliveryContext context = new InsightDeliveryContext(request.idleSeconds(),
            request.currentTopic(), request.conversationActive(), request.focusMode());
        return store.queue(sessionId).getNextInsight(trigger, context);
    }

    /**
     * @return false when the insight is unknown to the session
     * @throws com.userintel.common.insight.InsightTransitionException when it was not delivered
     */
    public boolean recordEngagement(String sessionId, String insightId, String action, Double rating) {
        EngagementAction parsed = EngagementAction.fromString(action);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown engagement action: " + action);
        }
        return store.queue(sessionId).recordEngagement(insightId, parsed, rating);
    }

    public Optional<QueuedInsight> dismissActive(String sessionId) {
        return store.queue(sessionId).dismissActive();
    }

    public EngagementLevel recordActivity(String sessionId, String type, int charsTyped) {
        EngagementEstimator.ActivityType parsed;
        try {
            parsed = EngagementEstimator.ActivityType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown activity type: " + type, e);
        }
        return store.queue(sessionId).updateEngagement(parsed, charsTyped);
    }

    // ── Preferences & session ───────────────────────────────────────────────

    public InsightPreferences preferences(String sessionId) {
        return store.queue(sessionId).getPreferences();
    }

    public InsightPreferences updatePreferences(String sessionId, InsightPreferences preferences) {
        InsightQueue queue = store.queue(sessionId);
        queue.updatePreferences(preferences);
        return queue.getPreferences();
    }

    public InsightPreferences setMuted(String sessionId, String category, boolean muted) {
        InsightQueue queue = store.queue(sessionId);
        InsightCategory parsed = parseCategory(category);
        if (muted) queue.muteCategory(parsed); else queue.unmuteCategory(parsed);
        return queue.getPreferences();
    }

    public void resetSession(String sessionId) {
        store.queue(sessionId).resetSession();
    }

    public void clearQueue(String sessionId) {
        store.queue(sessionId).clearQueue();
    }

    public InsightSessionStatus status(String sessionId) {
        InsightQueue queue = store.queue(sessionId);
        return new InsightSessionStatus(sessionId, queue.pendingCount(),
            queue.activeInsight().orElse(null), queue.engagementLevel(), queue.idleSeconds(),
            queue.deliveredThisSession(), queue.budgetUsed(), queue.categoryEngagementSnapshot());
    }

    private static InsightCategory parseCategory(String raw) {
        try {
            return InsightCategory.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown insight category: " + raw, e);
        }
    }
}

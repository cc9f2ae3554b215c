package com.userintel.common.insight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Pending insights and delivery state for one active session.
 *
 * <p>{@link #getNextInsight} is the only way an insight leaves the queue. It
 * applies the session gates in a fixed order (enabled, live conversation,
 * focus mode, engagement and budget, session cap, minimum interval, trigger
 * preference), then filters and ranks the candidates. Delivery consumes one
 * unit of the interrupt budget and counts the category as shown; engagement
 * feedback counts it as engaged, which breaks future priority ties.
 *
 * <p>Instances are held in process memory by the owning session store and
 * are not shared across processes. All public methods are synchronized.
 */
public class InsightQueue {

    private static final Logger log = LoggerFactory.getLogger(InsightQueue.class);

    /** Maximum insights kept per session. */
    public static final int MAX_PENDING = 20;

    /** Quiet mode only lets through insights at or above this priority. */
    public static final int QUIET_MIN_PRIORITY = 7;

    /** Deliveries within this window count as recent for the novelty penalty. */
    static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private final String sessionId;
    private final Clock clock;
    private final List<QueuedInsight> insights = new ArrayList<>();
    private final CategoryEngagement categoryEngagement = new CategoryEngagement();
    private final InterruptBudget budget;
    private final EngagementEstimator engagement;

    private InsightPreferences preferences;
    private QueuedInsight activeInsight;
    private Instant lastDeliveryAt;
    private int deliveredThisSession;

    public InsightQueue(String sessionId, InsightPreferences preferences, Clock clock) {
        this.sessionId   = Objects.requireNonNull(sessionId, "sessionId");
        this.clock       = Objects.requireNonNull(clock, "clock");
        this.preferences = preferences == null ? InsightPreferences.defaults() : preferences;
        this.budget      = new InterruptBudget(this.preferences.maxPerHour(), clock.instant());
        this.engagement  = new EngagementEstimator(clock.instant());
    }

    // ── queueing ──────────────────────────────────────────────────────────────

    /** Scores the draft against this session's history and the user's goals, then queues it. */
    public synchronized QueuedInsight queueInsight(InsightDraft draft, Collection<String> activeGoals) {
        InsightPriorityScorer.ScoringContext context = new InsightPriorityScorer.ScoringContext(
            activeGoals, recentlyDeliveredCategories(clock.instant()),
            categoryEngagement.averageRating(draft.category()));
        return enqueue(draft, InsightPriorityScorer.score(draft, context));
    }

    /** Queues the draft with a priority the caller already computed. Clamped to 1..10. */
    public synchronized QueuedInsight enqueue(InsightDraft draft, int priority) {
        Instant now = clock.instant();
        QueuedInsight insight = new QueuedInsight(
            "insight_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
            draft, priority, now);
        insights.add(insight);

        if (insights.size() > MAX_PENDING) {
            int before = insights.size();
            insights.removeIf(i -> i.isExpired(now));
            if (insights.size() > MAX_PENDING) {
                insights.sort(Comparator.comparingInt(QueuedInsight::getPriority).reversed());
                insights.subList(MAX_PENDING, insights.size()).clear();
            }
            log.debug("Insight queue pruned. session={} before={} after={}", sessionId, before, insights.size());
        }

        log.info("INSIGHT_QUEUED session={} id={} category={} priority={} trigger={}",
                 sessionId, insight.getId(), insight.getCategory(), insight.getPriority(), insight.getTrigger());
        return insight;
    }

    // ── gate ──────────────────────────────────────────────────────────────────

    public synchronized SurfaceDecision canSurfaceInsight() {
        if (preferences.bubbleMode() == BubbleMode.OFF) {
            return SurfaceDecision.deny("bubble disabled");
        }
        if (engagement.getLevel() == EngagementLevel.DEEP) {
            return SurfaceDecision.deny("user in deep focus");
        }
        if (!budget.hasRemaining(clock.instant())) {
            return SurfaceDecision.deny("interrupt budget exhausted ("
                + budget.getUsedThisWindow() + "/" + budget.getHourlyLimit() + ")");
        }
        if (preferences.bubbleMode() == BubbleMode.QUIET) {
            return SurfaceDecision.allow("quiet mode: high priority only");
        }
        return SurfaceDecision.allow();
    }

    /**
     * Picks, delivers and returns the best eligible insight for this trigger,
     * or empty when a gate refuses or nothing qualifies.
     */
    public synchronized Optional<QueuedInsight> getNextInsight(InsightTrigger trigger, InsightDeliveryContext context) {
        InsightDeliveryContext ctx = context == null ? InsightDeliveryContext.none() : context;
        Instant now = clock.instant();

        if (!preferences.enabled())   return Optional.empty();
        if (ctx.conversationActive()) return Optional.empty();
        if (ctx.focusMode())          return Optional.empty();

        SurfaceDecision decision = canSurfaceInsight();
        if (!decision.canSurface()) {
            log.debug("Insight not surfaced. session={} reason={}", sessionId, decision.reason());
            return Optional.empty();
        }
        if (preferences.maxPerSession() > 0 && deliveredThisSession >= preferences.maxPerSession()) {
            return Optional.empty();
        }
        if (lastDeliveryAt != null
                && Duration.between(lastDeliveryAt, now).compareTo(Duration.ofMinutes(preferences.minIntervalMinutes())) < 0) {
            return Optional.empty();
        }
        if (trigger == null || !preferences.enabledTriggers().contains(trigger)) {
            return Optional.empty();
        }

        expirePending(now);

        Optional<QueuedInsight> next = insights.stream()
            .filter(QueuedInsight::isPending)
            .filter(i -> !preferences.isMuted(i.getCategory()))
            .filter(i -> preferences.bubbleMode() != BubbleMode.QUIET || i.getPriority() >= QUIET_MIN_PRIORITY)
            .filter(i -> i.getTrigger() == trigger)
            .filter(i -> meetsTriggerConstraint(i, trigger, ctx))
            .max(Comparator.comparingInt(QueuedInsight::getPriority)
                .thenComparingDouble(i -> categoryEngagement.engagementRate(i.getCategory())));

        next.ifPresent(insight -> deliver(insight, now));
        return next;
    }

    private static boolean meetsTriggerConstraint(QueuedInsight insight, InsightTrigger trigger, InsightDeliveryContext ctx) {
        if (trigger == InsightTrigger.IDLE && insight.getMinIdleSeconds() > 0) {
            return ctx.idleSeconds() != null && ctx.idleSeconds() >= insight.getMinIdleSeconds();
        }
        if (trigger == InsightTrigger.CONTEXTUAL && !insight.getContextTags().isEmpty()) {
            if (ctx.currentTopic() == null || ctx.currentTopic().isBlank()) return false;
            String topic = ctx.currentTopic().toLowerCase(Locale.ROOT);
            return insight.getContextTags().stream()
                .anyMatch(tag -> topic.contains(tag.toLowerCase(Locale.ROOT)));
        }
        return true;
    }

    private void deliver(QueuedInsight insight, Instant now) {
        insight.markDelivered(now);
        activeInsight  = insight;
        lastDeliveryAt = now;
        deliveredThisSession++;
        budget.consume(now);
        categoryEngagement.recordShown(insight.getCategory());

        log.info("INSIGHT_DELIVERED session={} id={} category={} budget={}/{}",
                 sessionId, insight.getId(), insight.getCategory(),
                 budget.getUsedThisWindow(), budget.getHourlyLimit());
    }

    private void expirePending(Instant now) {
        for (QueuedInsight insight : insights) {
            if (insight.isPending() && insight.isExpired(now)) {
                insight.markExpired();
            }
        }
    }

    // ── engagement ────────────────────────────────────────────────────────────

    /**
     * Resolves a delivered insight. Returns false when the id is unknown.
     *
     * @throws InsightTransitionException when the insight is not in the delivered state
     */
    public synchronized boolean recordEngagement(String insightId, EngagementAction action, Double rating) {
        Objects.requireNonNull(action, "action");
        Optional<QueuedInsight> found = find(insightId);
        if (found.isEmpty()) {
            log.warn("Engagement for unknown insight ignored. session={} id={}", sessionId, insightId);
            return false;
        }
        QueuedInsight insight = found.get();
        insight.resolve(action, rating, clock.instant());

        if (action.countsAsEngaged()) {
            categoryEngagement.recordEngaged(insight.getCategory());
        }
        if (rating != null) {
            categoryEngagement.recordRating(insight.getCategory(), rating);
        }
        if (activeInsight != null && activeInsight.getId().equals(insightId)) {
            activeInsight = null;
        }
        log.info("INSIGHT_ENGAGEMENT session={} id={} action={}", sessionId, insightId, action);
        return true;
    }

    /** Dismisses the insight currently on screen, if any. */
    public synchronized Optional<QueuedInsight> dismissActive() {
        QueuedInsight active = activeInsight;
        if (active == null) return Optional.empty();
        recordEngagement(active.getId(), EngagementAction.DISMISS, null);
        return Optional.of(active);
    }

    public synchronized EngagementLevel updateEngagement(EngagementEstimator.ActivityType type, int charsTyped) {
        return engagement.update(type, charsTyped, clock.instant());
    }

    // ── preferences & session ─────────────────────────────────────────────────

    public synchronized InsightPreferences getPreferences() {
        return preferences;
    }

    public synchronized void updatePreferences(InsightPreferences updated) {
        this.preferences = Objects.requireNonNull(updated, "preferences");
        budget.setHourlyLimit(updated.maxPerHour());
        log.info("Insight preferences updated. session={} bubble={} enabled={}",
                 sessionId, updated.bubbleMode(), updated.enabled());
    }

    public synchronized void muteCategory(InsightCategory category) {
        preferences = preferences.withMuted(category, true);
    }

    public synchronized void unmuteCategory(InsightCategory category) {
        preferences = preferences.withMuted(category, false);
    }

    /** Starts a fresh session: counters and the active insight are cleared, pending insights stay. */
    public synchronized void resetSession() {
        deliveredThisSession = 0;
        lastDeliveryAt       = null;
        activeInsight        = null;
    }

    public synchronized void clearQueue() {
        insights.clear();
        activeInsight = null;
    }

    public synchronized int pendingCount() {
        Instant now = clock.instant();
        return (int) insights.stream().filter(i -> i.isPending() && !i.isExpired(now)).count();
    }

    public synchronized Optional<QueuedInsight> activeInsight() {
        return Optional.ofNullable(activeInsight);
    }

    public synchronized EngagementLevel engagementLevel() {
        return engagement.getLevel();
    }

    public synchronized long idleSeconds() {
        return engagement.idleSeconds(clock.instant());
    }

    public synchronized int deliveredThisSession() {
        return deliveredThisSession;
    }

    public synchronized int budgetUsed() {
        return budget.getUsedThisWindow();
    }

    public synchronized double engagementRate(InsightCategory category) {
        return categoryEngagement.engagementRate(category);
    }

    /** Detached copy of the per-category counters, taken under the queue lock. */
    public synchronized Map<InsightCategory, Map<String, Number>> categoryEngagementSnapshot() {
        return categoryEngagement.snapshot();
    }

    public String sessionId() {
        return sessionId;
    }

    private Optional<QueuedInsight> find(String insightId) {
        if (insightId == null) return Optional.empty();
        if (activeInsight != null && activeInsight.getId().equals(insightId)) return Optional.of(activeInsight);
        return insights.stream().filter(i -> i.getId().equals(insightId)).findFirst();
    }

    private Set<InsightCategory> recentlyDeliveredCategories(Instant now) {
        Set<InsightCategory> recent = EnumSet.noneOf(InsightCategory.class);
        Instant since = now.minus(RECENT_WINDOW);
        for (QueuedInsight insight : insights) {
            if (insight.getDeliveredAt() != null && insight.getDeliveredAt().isAfter(since)) {
                recent.add(insight.getCategory());
            }
        }
        return recent;
    }
}

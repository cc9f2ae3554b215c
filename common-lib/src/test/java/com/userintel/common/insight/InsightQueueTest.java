package com.userintel.common.insight;

import com.userintel.common.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InsightQueueTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private MutableClock clock;
    private InsightQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        queue = new InsightQueue("session-1", InsightPreferences.defaults(), clock);
    }

    private static InsightDraft idleDraft(InsightCategory category, int minIdle) {
        return new InsightDraft(category, "t", "m", null, InsightTrigger.IDLE, minIdle, List.of(), 5, 0.5);
    }

    private static InsightDraft contextualDraft(String tag) {
        return new InsightDraft(InsightCategory.RECALL, "t", "m", null, InsightTrigger.CONTEXTUAL, 0, List.of(tag), 5, 0.5);
    }

    /** Delivers one idle insight and moves past the minimum interval. */
    private QueuedInsight deliverOne() {
        queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
        QueuedInsight delivered = queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(60)).orElseThrow();
        clock.advance(Duration.ofMinutes(InsightPreferences.DEFAULT_MIN_INTERVAL_MIN));
        return delivered;
    }

    // ── trigger and idle matching ─────────────────────────────────────────

    @Nested
    @DisplayName("getNextInsight(): matching")
    class MatchingTests {

        @Test
        @DisplayName("mismatched trigger → empty")
        void mismatchedTrigger() {
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 30), 6);
            assertTrue(queue.getNextInsight(InsightTrigger.SESSION_START, InsightDeliveryContext.idleFor(120)).isEmpty());
        }

        @Test
        @DisplayName("idle threshold unmet → empty, met → delivered exactly once")
        void idleThreshold_deliverOnce() {
            QueuedInsight queued = queue.enqueue(idleDraft(InsightCategory.CLARIFY, 30), 6);

            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(10)).isEmpty());
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.none()).isEmpty());

            Optional<QueuedInsight> delivered = queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(45));
            assertTrue(delivered.isPresent());
            assertEquals(queued.getId(), delivered.get().getId());
            assertEquals(InsightState.DELIVERED, delivered.get().getState());
            assertEquals(START, delivered.get().getDeliveredAt());

            clock.advance(Duration.ofHours(2));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(45)).isEmpty());
            assertEquals(0, queue.pendingCount());
        }

        @Test
        @DisplayName("contextual trigger → needs a tag inside the current topic")
        void contextualTags() {
            queue.enqueue(contextualDraft("pricing"), 6);
            assertTrue(queue.getNextInsight(InsightTrigger.CONTEXTUAL, InsightDeliveryContext.onTopic("hiring plan")).isEmpty());
            assertTrue(queue.getNextInsight(InsightTrigger.CONTEXTUAL, InsightDeliveryContext.onTopic("Q3 Pricing review")).isPresent());
        }

        @Test
        @DisplayName("highest priority wins; ties go to the better-engaged category")
        void ranking() {
            // build engagement history: RECALL engaged, CLARIFY dismissed
            queue.enqueue(idleDraft(InsightCategory.RECALL, 0), 5);
            QueuedInsight recall = queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).orElseThrow();
            queue.recordEngagement(recall.getId(), EngagementAction.EXPAND, null);
            clock.advance(Duration.ofMinutes(11));
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
            QueuedInsight clarify = queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).orElseThrow();
            queue.recordEngagement(clarify.getId(), EngagementAction.DISMISS, null);
            clock.advance(Duration.ofMinutes(11));

            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 6);
            QueuedInsight tieRecall = queue.enqueue(idleDraft(InsightCategory.RECALL, 0), 6);
            queue.enqueue(idleDraft(InsightCategory.NEXT_STEP, 0), 4);

            assertEquals(tieRecall.getId(),
                queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).orElseThrow().getId());
        }

        @Test
        @DisplayName("expired insight → never delivered")
        void expired() {
            queue.enqueue(idleDraft(InsightCategory.CONTRADICTION, 0), 9);
            clock.advance(Duration.ofHours(25));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(60)).isEmpty());
        }
    }

    // ── gates ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("getNextInsight(): gates")
    class GateTests {

        @Test
        @DisplayName("active conversation or focus mode → empty")
        void liveConversationAndFocus() {
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 9);
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, new InsightDeliveryContext(60L, null, true, false)).isEmpty());
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, new InsightDeliveryContext(60L, null, false, true)).isEmpty());
        }

        @Test
        @DisplayName("sustained fast typing → DEEP, and DEEP blocks even priority 10")
        void deepFocus_blocks() {
            queue.enqueue(idleDraft(InsightCategory.CONTRADICTION, 0), 10);
            for (int i = 0; i < 20; i++) {
                queue.updateEngagement(EngagementEstimator.ActivityType.KEYSTROKE, 1);
                clock.advance(Duration.ofMillis(100));
            }
            assertEquals(EngagementLevel.DEEP, queue.engagementLevel());
            assertFalse(queue.canSurfaceInsight().canSurface());
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(0)).isEmpty());
        }

        @Test
        @DisplayName("minimum interval between deliveries")
        void minInterval() {
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isPresent());
            clock.advance(Duration.ofMinutes(5));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());
            clock.advance(Duration.ofMinutes(5));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isPresent());
        }

        @Test
        @DisplayName("quiet mode → only priority ≥ 7")
        void quietMode() {
            queue.updatePreferences(queue.getPreferences().withBubbleMode(BubbleMode.QUIET));
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 6);
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 7);
            assertEquals(7, queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).orElseThrow().getPriority());
        }

        @Test
        @DisplayName("bubble off, disabled, muted category, disabled trigger → empty")
        void preferenceGates() {
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 9);

            queue.updatePreferences(queue.getPreferences().withBubbleMode(BubbleMode.OFF));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());

            InsightPreferences d = InsightPreferences.defaults();
            queue.updatePreferences(new InsightPreferences(false, BubbleMode.ON, 10, 3, 10, d.enabledTriggers(), Set.of()));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());

            queue.updatePreferences(d);
            queue.muteCategory(InsightCategory.CLARIFY);
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());
            queue.unmuteCategory(InsightCategory.CLARIFY);

            queue.updatePreferences(new InsightPreferences(true, BubbleMode.ON, 10, 3, 10,
                EnumSet.of(InsightTrigger.SESSION_START), Set.of()));
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());

            queue.updatePreferences(d);
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isPresent());
        }

        @Test
        @DisplayName("session cap → empty until resetSession()")
        void sessionCap() {
            InsightPreferences d = InsightPreferences.defaults();
            queue.updatePreferences(new InsightPreferences(true, BubbleMode.ON, 1, 10, 0, d.enabledTriggers(), Set.of()));
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
            queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);

            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isPresent());
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isEmpty());

            queue.resetSession();
            assertEquals(1, queue.pendingCount());
            assertTrue(queue.getNextInsight(InsightTrigger.IDLE, InsightDeliveryContext.idleFor(1)).isPresent());
        }
    }

    // ── interrupt budget ──────────────────────────────────────────────────

    @Nested
    @DisplayName("interrupt budget")
    class BudgetTests {

        @Test
        @DisplayName("hourlyLimit deliveries → canSurfaceInsight false; after an hour → reset")
        void exhaustionAndRollover() {
            deliverOne();
            deliverOne();
            deliverOne();
            assertEquals(3, queue.budgetUsed());
            assertFalse(queue.canSurfaceInsight().canSurface());

            clock.advance(Duration.ofMinutes(31));
            assertTrue(queue.canSurfaceInsight().canSurface());
            assertEquals(0, queue.budgetUsed());
        }

        @Test
        @DisplayName("budget check rolls a sliding window from the last reset")
        void slidingWindow() {
            InterruptBudget budget = new InterruptBudget(1, START);
            budget.consume(START.plus(Duration.ofMinutes(50)));
            assertFalse(budget.hasRemaining(START.plus(Duration.ofMinutes(59))));
            assertTrue(budget.hasRemaining(START.plus(Duration.ofMinutes(60))));
            assertEquals(START.plus(Duration.ofMinutes(60)), budget.getWindowStartedAt());
        }
    }

    // ── engagement & lifecycle ────────────────────────────────────────────

    @Nested
    @DisplayName("engagement and lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("engaging a never-delivered insight → InsightTransitionException")
        void engageUndelivered_throws() {
            QueuedInsight pending = queue.enqueue(idleDraft(InsightCategory.CLARIFY, 0), 5);
            assertThrows(InsightTransitionException.class,
                () -> queue.recordEngagement(pending.getId(), EngagementAction.ACT, null));
        }

        @Test
        @DisplayName("resolving twice → InsightTransitionException")
        void resolveTwice_throws() {
            QueuedInsight delivered = deliverOne();
            assertTrue(queue.recordEngagement(delivered.getId(), EngagementAction.IGNORE, null));
            assertThrows(InsightTransitionException.class,
                () -> queue.recordEngagement(delivered.getId(), EngagementAction.EXPAND, null));
        }

        @Test
        @DisplayName("expand/act count as engaged, dismiss/ignore do not")
        void engagementRate() {
            QueuedInsight a = deliverOne();
            QueuedInsight b = deliverOne();
            queue.recordEngagement(a.getId(), EngagementAction.ACT, 1.0);
            queue.recordEngagement(b.getId(), EngagementAction.DISMISS, null);

            assertEquals(0.5, queue.engagementRate(InsightCategory.CLARIFY), 1e-9);
            assertEquals(CategoryEngagement.DEFAULT_RATE, queue.engagementRate(InsightCategory.RECALL), 1e-9);
            assertEquals(InsightState.ENGAGED, a.getState());
            assertEquals(InsightState.DISMISSED, b.getState());
            assertNotNull(b.getDismissedAt());
        }

        @Test
        @DisplayName("dismissActive() → active cleared, unknown id → false")
        void dismissActive() {
            QueuedInsight delivered = deliverOne();
            assertEquals(delivered.getId(), queue.activeInsight().orElseThrow().getId());
            assertTrue(queue.dismissActive().isPresent());
            assertTrue(queue.activeInsight().isEmpty());
            assertFalse(queue.recordEngagement("nope", EngagementAction.ACT, null));
        }

        @Test
        @DisplayName("over capacity → expired dropped, then lowest priority")
        void capacityPruning() {
            queue.enqueue(idleDraft(InsightCategory.CONTRADICTION, 0), 10);
            clock.advance(Duration.ofHours(25));
            for (int i = 0; i < InsightQueue.MAX_PENDING; i++) {
                queue.enqueue(idleDraft(InsightCategory.RECALL, 0), 1 + (i % 9));
            }
            assertEquals(InsightQueue.MAX_PENDING, queue.pendingCount());

            queue.enqueue(idleDraft(InsightCategory.RECALL, 0), 10);
            assertEquals(InsightQueue.MAX_PENDING, queue.pendingCount());
        }

        @Test
        @DisplayName("engagement snapshot → detached from later deliveries and engagement")
        void engagementSnapshotDetached() {
            QueuedInsight first = deliverOne();
            assertTrue(queue.recordEngagement(first.getId(), EngagementAction.ACT, null));

            Map<InsightCategory, Map<String, Number>> before = queue.categoryEngagementSnapshot();
            QueuedInsight second = deliverOne();
            queue.recordEngagement(second.getId(), EngagementAction.ACT, null);

            assertEquals(1, before.get(InsightCategory.CLARIFY).get("engaged").intValue());
            assertEquals(1, before.get(InsightCategory.CLARIFY).get("shown").intValue());
            assertEquals(2, queue.categoryEngagementSnapshot().get(InsightCategory.CLARIFY).get("engaged").intValue());
            assertThrows(UnsupportedOperationException.class,
                () -> before.get(InsightCategory.CLARIFY).put("engaged", 5));
        }

        @Test
        @DisplayName("clearQueue() → nothing pending")
        void clear() {
            queue.enqueue(idleDraft(InsightCategory.RECALL, 0), 3);
            queue.clearQueue();
            assertEquals(0, queue.pendingCount());
        }
    }
}

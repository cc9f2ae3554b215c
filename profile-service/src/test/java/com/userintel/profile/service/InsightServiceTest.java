package com.userintel.profile.service;

import com.userintel.common.insight.BubbleMode;
import com.userintel.common.insight.EngagementLevel;
import com.userintel.common.insight.InsightCategory;
import com.userintel.common.insight.InsightState;
import com.userintel.common.insight.InsightTransitionException;
import com.userintel.common.insight.QueuedInsight;
import com.userintel.common.model.ResponseMode;
import com.userintel.profile.dto.InsightSessionStatus;
import com.userintel.profile.dto.NextInsightRequest;
import com.userintel.profile.dto.QueueInsightRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.userintel.profile.ProfileTestFixtures.CLOCK;
import static org.junit.jupiter.api.Assertions.*;

class InsightServiceTest {

    private InsightService service;

    @BeforeEach
    void setUp() {
        service = new InsightService(new InsightSessionStore(CLOCK, 120, 3));
    }

    private static QueueInsightRequest draft(String category, String trigger) {
        return new QueueInsightRequest(category, "Title", "Message", "More detail", trigger,
            0, List.of("planning"), null, null, List.of());
    }

    private static NextInsightRequest sessionStart() {
        return new NextInsightRequest("session_start", null, null, false, false);
    }

    @Nested
    @DisplayName("delivery")
    class DeliveryTests {

        @Test
        @DisplayName("queued session-start insight → delivered once")
        void deliverOnce() {
            QueuedInsight queued = service.queue("s1", draft("next_step", "session_start"));

            Optional<QueuedInsight> delivered = service.next("s1", sessionStart());

            assertTrue(delivered.isPresent());
            assertEquals(queued.getId(), delivered.get().getId());
            assertEquals(InsightState.DELIVERED, delivered.get().getState());
            assertTrue(service.next("s1", sessionStart()).isEmpty());
        }

        @Test
        @DisplayName("conversation in progress → nothing surfaced, insight stays pending")
        void liveConversation() {
            service.queue("s2", draft("clarify", "session_start"));

            Optional<QueuedInsight> result = service.next("s2",
                new NextInsightRequest("session_start", null, null, true, false));

            assertTrue(result.isEmpty());
            assertEquals(1, service.status("s2").pending());
        }

        @Test
        @DisplayName("muted category → not delivered")
        void muted() {
            service.queue("s3", draft("recall", "session_start"));
            service.setMuted("s3", "recall", true);

            assertTrue(service.next("s3", sessionStart()).isEmpty());
            assertTrue(service.preferences("s3").isMuted(InsightCategory.RECALL));
        }

        @Test
        @DisplayName("bubble mode off → nothing surfaced")
        void bubbleOff() {
            service.queue("s4", draft("contradiction", "session_start"));
            service.updatePreferences("s4", service.preferences("s4").withBubbleMode(BubbleMode.OFF));

            assertTrue(service.next("s4", sessionStart()).isEmpty());
        }

        @Test
        @DisplayName("unknown trigger → IllegalArgumentException")
        void unknownTrigger() {
            assertThrows(IllegalArgumentException.class,
                () -> service.next("s5", new NextInsightRequest("whenever", null, null, false, false)));
        }
    }

    @Nested
    @DisplayName("engagement")
    class EngagementTests {

        @Test
        @DisplayName("expand → engaged, counts towards the category rate")
        void expand() {
            service.queue("e1", draft("clarify", "session_start"));
            QueuedInsight delivered = service.next("e1", sessionStart()).orElseThrow();

            assertTrue(service.recordEngagement("e1", delivered.getId(), "expand", 1.0));

            InsightSessionStatus status = service.status("e1");
            assertEquals(1, status.categoryEngagement().get(InsightCategory.CLARIFY).get("engaged").intValue());
            assertNull(status.activeInsight());
        }

        @Test
        @DisplayName("engaging twice → InsightTransitionException")
        void twice() {
            service.queue("e2", draft("clarify", "session_start"));
            QueuedInsight delivered = service.next("e2", sessionStart()).orElseThrow();
            service.recordEngagement("e2", delivered.getId(), "dismiss", null);

            assertThrows(InsightTransitionException.class,
                () -> service.recordEngagement("e2", delivered.getId(), "act", null));
        }

        @Test
        @DisplayName("engaging a pending insight → InsightTransitionException")
        void pending() {
            QueuedInsight queued = service.queue("e3", draft("clarify", "idle"));

            assertThrows(InsightTransitionException.class,
                () -> service.recordEngagement("e3", queued.getId(), "expand", null));
        }

        @Test
        @DisplayName("unknown insight id → false")
        void unknownId() {
            assertFalse(service.recordEngagement("e4", "missing", "ignore", null));
        }

        @Test
        @DisplayName("message activity → engagement level reported")
        void activity() {
            assertEquals(EngagementLevel.ACTIVE, service.recordActivity("e5", "message_sent", 40));
            assertThrows(IllegalArgumentException.class, () -> service.recordActivity("e5", "scrolling", 0));
        }
    }

    @Nested
    @DisplayName("pattern detection")
    class PatternTests {

        @Test
        @DisplayName("ten 20-word messages then a 200-word one → clarify insight queued")
        void lengthBreak() {
            for (int i = 0; i < 10; i++) {
                assertTrue(service.observeMessage("u1", "p1", 20, ResponseMode.QUICK, "technical").isEmpty());
            }

            List<QueuedInsight> queued = service.observeMessage("u1", "p1", 200, ResponseMode.QUICK, "technical");

            assertEquals(1, queued.size());
            assertEquals(InsightCategory.CLARIFY, queued.get(0).getCategory());
            assertEquals(1, service.status("p1").pending());
        }

        @Test
        @DisplayName("baseline is per user, not per session")
        void baselinePerUser() {
            for (int i = 0; i < 10; i++) {
                service.observeMessage("u2", "session-" + i, 20, ResponseMode.QUICK, "technical");
            }
            assertEquals(1, service.observeMessage("u2", "fresh", 200, ResponseMode.QUICK, "technical").size());
        }
    }
}

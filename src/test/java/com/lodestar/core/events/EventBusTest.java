package com.lodestar.core.events;

import com.lodestar.core.engine.IterationOutcome;
import com.lodestar.core.persistence.SessionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.lodestar.core.events.LodestarEvent.Type.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final SessionKey HELLO_S1 = SessionKey.of("hello", "s1");

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static LodestarEvent event(LodestarEvent.Type type, SessionKey session) {
        return LodestarEvent.of(type, session, 1, "START", Map.of());
    }

    // -- LodestarEvent record tests -------------------------------------------

    @Nested
    @DisplayName("LodestarEvent")
    class LodestarEventTests {

        @Test
        @DisplayName("of copies the payload and keeps its order")
        void ofCopiesPayload() {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("action", "Scan");
            payload.put("reason", "timeout");

            LodestarEvent event = LodestarEvent.of(ACTION_FAILED, HELLO_S1, 3, "PLAN", payload);
            payload.put("late", true);

            assertEquals(List.of("action", "reason"), List.copyOf(event.payload().keySet()));
            assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
            assertEquals(3, event.iteration());
            assertEquals("PLAN", event.phase());
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("every outcome status maps to its own closing event type")
        void typeForStatus() {
            var seen = EnumSet.noneOf(LodestarEvent.Type.class);
            for (IterationOutcome.Status status : IterationOutcome.Status.values()) {
                assertTrue(seen.add(LodestarEvent.Type.of(status)), status.name());
            }
            assertFalse(seen.contains(ITERATION_STARTED));
            assertEquals("iteration.completed", LodestarEvent.Type.of(IterationOutcome.Status.COMPLETED).wireName());
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to session subscriber")
        void deliversToSessionSubscriber() {
            List<LodestarEvent> received = new ArrayList<>();
            eventBus.subscribe(HELLO_S1, received::add);

            var event = event(ITERATION_STARTED, HELLO_S1);
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver to other sessions or other agents")
        void isolatesSessions() {
            List<LodestarEvent> received = new ArrayList<>();
            eventBus.subscribe(SessionKey.of("hello", "s2"), received::add);
            eventBus.subscribe(SessionKey.of("other", "s1"), received::add);

            eventBus.publish(event(ITERATION_STARTED, HELLO_S1));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("type filters limit what a session subscriber sees")
        void typeFilter() {
            List<LodestarEvent.Type> received = new ArrayList<>();
            eventBus.subscribe(HELLO_S1, EnumSet.of(ACTION_FAILED, ITERATION_FAILED), e -> received.add(e.type()));

            eventBus.publish(event(ITERATION_STARTED, HELLO_S1));
            eventBus.publish(event(ACTION_FAILED, HELLO_S1));
            eventBus.publish(event(ITERATION_FAILED, HELLO_S1));

            assertEquals(List.of(ACTION_FAILED, ITERATION_FAILED), received);
        }

        @Test
        @DisplayName("global subscribers receive every event in order")
        void globalSubscribers() {
            List<LodestarEvent.Type> received = new ArrayList<>();
            eventBus.subscribeAll(e -> received.add(e.type()));

            eventBus.publish(event(ITERATION_STARTED, HELLO_S1));
            eventBus.publish(event(ITERATION_COMPLETED, SessionKey.of("other", "s9")));

            assertEquals(List.of(ITERATION_STARTED, ITERATION_COMPLETED), received);
        }
    }

    // -- Unsubscribe and error isolation --------------------------------------

    @Nested
    @DisplayName("unsubscribe and error isolation")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribed consumers receive nothing")
        void unsubscribe() {
            List<LodestarEvent> received = new ArrayList<>();
            EventBus.Subscription session = eventBus.subscribe(HELLO_S1, received::add);
            EventBus.Subscription global = eventBus.subscribeAll(received::add);

            session.unsubscribe();
            global.unsubscribe();
            eventBus.publish(event(ITERATION_STARTED, HELLO_S1));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("the last unsubscribe forgets the session")
        void forgetsIdleSessions() {
            try (EventBus.Subscription first = eventBus.subscribe(HELLO_S1, e -> { })) {
                EventBus.Subscription second = eventBus.subscribe(HELLO_S1, e -> { });
                second.unsubscribe();
                assertEquals(1, eventBus.followedSessions());
            }

            assertEquals(0, eventBus.followedSessions());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to the others")
        void throwingSubscriber() {
            List<LodestarEvent> received = new ArrayList<>();
            eventBus.subscribe(HELLO_S1, e -> {
                throw new IllegalStateException("subscriber failure");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(ACTION_FAILED, HELLO_S1)));
            assertEquals(1, received.size());
        }
    }
}

package com.stepwise.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RunEvent event(String runKey, EventType type) {
        return new RunEvent(runKey, type, Map.of("k", "v"), new StateSnapshot(1, 0, 1));
    }

    // -- RunEvent wire shape ---------------------------------------------------

    @Nested
    @DisplayName("RunEvent")
    class RunEventTests {

        @Test
        @DisplayName("serializes to event_type, data and state_snapshot")
        void wireShape() throws Exception {
            var json = new ObjectMapper().readTree(
                    new ObjectMapper().writeValueAsString(event("STEP-1", EventType.SUBTASK_UPDATE)));

            assertEquals("subtask_update", json.get("event_type").asText());
            assertEquals("v", json.get("data").get("k").asText());
            assertEquals(1, json.get("state_snapshot").get("iteration_count").asInt());
            assertEquals(1, json.get("state_snapshot").get("total_subtasks").asInt());
            assertFalse(json.has("runKey"));
        }

        @Test
        @DisplayName("omits a missing state snapshot")
        void noSnapshot() throws Exception {
            var json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(
                    new RunEvent("STEP-1", EventType.ERROR, Map.of("message", "x"), null)));

            assertFalse(json.has("state_snapshot"));
        }
    }

    // -- Subscribe and publish -------------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversToRunSubscriber() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("STEP-1", received::add);

            var event = event("STEP-1", EventType.REASONING);
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different run")
        void otherRun() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("STEP-2", received::add);

            eventBus.publish(event("STEP-1", EventType.REASONING));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives events from all runs in order")
        void globalSubscriber() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("STEP-1", EventType.REASONING));
            eventBus.publish(event("STEP-2", EventType.DONE));

            assertEquals(2, received.size());
            assertEquals(EventType.DONE, received.get(1).eventType());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<RunEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("STEP-1", received::add);
            var global = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            global.unsubscribe();
            eventBus.publish(event("STEP-1", EventType.REASONING));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriberIsolated() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("STEP-1", e -> {
                throw new RuntimeException("subscriber broke");
            });
            eventBus.subscribe("STEP-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("STEP-1", EventType.REASONING)));
            assertEquals(1, received.size());
        }
    }
}

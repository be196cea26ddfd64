package com.ace.eval.events;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineEventBusTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final PipelineEventBus bus = new PipelineEventBus(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void deliversToSubscribersUntilUnsubscribed() {
        List<PipelineEvent> seen = new ArrayList<>();
        PipelineEventBus.Subscription subscription = bus.subscribe(seen::add);

        bus.publish(PipelineEventTypes.TASK_RECEIVED, "t-1", "l-1", "a-1", Map.of("kind", "MCQ"));
        subscription.unsubscribe();
        bus.publish(PipelineEventTypes.TASK_SUCCEEDED, "t-1", "l-1", "a-1", null);

        assertEquals(1, seen.size());
        assertEquals(PipelineEventTypes.TASK_RECEIVED, seen.get(0).eventType());
        assertEquals(NOW, seen.get(0).timestamp());
        assertEquals("MCQ", seen.get(0).payload().get("kind"));
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        List<PipelineEvent> seen = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("subscriber down");
        });
        bus.subscribe(seen::add);

        bus.publish(PipelineEventTypes.TASK_FAILED, "t-2", "l-1", "a-1", Map.of());

        assertEquals(1, seen.size());
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> bus.publish("task.exploded", "t-3", "l-1", "a-1", Map.of()));
    }
}

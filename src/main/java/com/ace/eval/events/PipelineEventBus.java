package com.ace.eval.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-process pub/sub for pipeline transitions. Every event is also written as one structured log line,
 * so the log alone reconstructs a task's history.
 */
@Service
public class PipelineEventBus {
    private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public PipelineEventBus(Clock clock) {
        this.clock = clock;
    }

    public void publish(String eventType, String taskId, String learnerId, String assignmentId, Map<String, Object> payload) {
        if (!PipelineEventTypes.SUPPORTED.contains(eventType)) {
            throw new IllegalArgumentException("Unknown pipeline event type: " + eventType);
        }
        PipelineEvent event = new PipelineEvent(eventType, taskId, learnerId, assignmentId,
                payload == null ? Map.of() : payload, clock.instant());
        log.info("event={} taskId={} learnerId={} assignmentId={} {}",
                eventType, taskId, learnerId, assignmentId, describe(event.payload()));
        for (Consumer<PipelineEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(Consumer<PipelineEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on event {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
        }
    }

    private static String describe(Map<String, Object> payload) {
        return new TreeMap<>(payload).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}

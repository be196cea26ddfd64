package com.ace.eval.events;

import java.time.Instant;
import java.util.Map;

/**
 * @param eventType    one of {@link PipelineEventTypes}
 * @param taskId       nullable for assignment-level events
 * @param payload      event-specific details
 */
public record PipelineEvent(
        String eventType,
        String taskId,
        String learnerId,
        String assignmentId,
        Map<String, Object> payload,
        Instant timestamp
) {}

package com.ace.eval.events;

import java.util.Set;

public final class PipelineEventTypes {
    public static final String TASK_RECEIVED = "task.received";
    public static final String TASK_EVALUATING = "task.evaluating";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_DEAD_LETTERED = "task.dead_lettered";
    public static final String TASK_DUPLICATE_IGNORED = "task.duplicate_ignored";
    public static final String TASK_RESUBMITTED = "task.resubmitted";
    public static final String TASK_MANUALLY_SCORED = "task.manually_scored";
    public static final String TASK_EXCLUDED = "task.excluded";
    public static final String REPORT_COMPUTED = "report.computed";
    public static final String ASSIGNMENT_WITHDRAWN = "assignment.withdrawn";

    public static final Set<String> SUPPORTED = Set.of(
            TASK_RECEIVED, TASK_EVALUATING, TASK_SUCCEEDED, TASK_FAILED, TASK_DEAD_LETTERED,
            TASK_DUPLICATE_IGNORED, TASK_RESUBMITTED, TASK_MANUALLY_SCORED, TASK_EXCLUDED,
            REPORT_COMPUTED, ASSIGNMENT_WITHDRAWN
    );

    private PipelineEventTypes() {
    }
}

package com.ace.eval.execution;

import java.util.List;

public class ExecutionModels {
    /**
     * Lifecycle of a task inside the coordinator. SUCCEEDED and DEAD_LETTERED are terminal:
     * only an operator action moves a task out of DEAD_LETTERED.
     */
    public enum TaskState {
        PENDING, EVALUATING, FAILED, SUCCEEDED, DEAD_LETTERED;

        public boolean terminal() {
            return this == SUCCEEDED || this == DEAD_LETTERED;
        }
    }

    public record SubmitRejection(String taskId, String reason) {}

    public record SubmitAck(int accepted, List<SubmitRejection> rejected) {}

    public record LaneStatus(String lane, int workers, int capacity, int queued, int inFlight) {}
}

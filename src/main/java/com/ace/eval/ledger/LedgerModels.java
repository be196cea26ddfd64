package com.ace.eval.ledger;

import com.ace.eval.task.TaskModels.FailureReason;

import java.time.Instant;

public class LedgerModels {
    public enum LedgerTransition {
        FAILED, DEAD_LETTERED, RESUBMITTED, MANUALLY_SCORED, EXCLUDED;

        /** Operator actions that take a task out of the dead-letter set. */
        public boolean resolution() {
            return this == RESUBMITTED || this == MANUALLY_SCORED || this == EXCLUDED;
        }
    }

    public record LedgerEntry(Long id, String taskId, String learnerId, String assignmentId, String kind,
                              LedgerTransition transition, int attemptCount, FailureReason failure, Instant recordedAt) {}
}

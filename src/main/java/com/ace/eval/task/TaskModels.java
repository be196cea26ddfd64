package com.ace.eval.task;

import java.time.Instant;
import java.util.*;

public class TaskModels {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 1.0;

    public enum Dimension {
        ANALYSIS, COMMUNICATION, EVALUATION;

        public static Dimension parse(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Dimension name is blank");
            }
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (Dimension d : values()) {
                // single-letter form: A, C, E
                if (d.name().equals(normalized) || normalized.length() == 1 && d.name().startsWith(normalized)) {
                    return d;
                }
            }
            throw new IllegalArgumentException("Unknown dimension: " + value);
        }
    }

    public enum FailureType {
        SCHEMA_ERROR(false),
        UPSTREAM_TIMEOUT(true),
        UPSTREAM_FAILURE(true),
        UNSUPPORTED_KIND(false),
        RETRY_BUDGET_EXHAUSTED(false);

        private final boolean retryable;

        FailureType(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    public enum OutcomeStatus {
        SUCCEEDED, FAILED, DEAD_LETTERED
    }

    public record Task(String taskId, String learnerId, String assignmentId, String kind,
                       Map<String, Object> payload, String rubricRef, String submissionId) {
        public Task {
            requireText(taskId, "taskId");
            requireText(learnerId, "learnerId");
            requireText(assignmentId, "assignmentId");
            requireText(kind, "kind");
            kind = TaskKinds.normalize(kind);
            payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }

        public Task(String taskId, String learnerId, String assignmentId, String kind, Map<String, Object> payload, String rubricRef) {
            this(taskId, learnerId, assignmentId, kind, payload, rubricRef, null);
        }
    }

    // only assessed dimensions are present, each with the rubric weight it was scored under
    public record ScoreVector(String taskId, Map<Dimension, Double> scores, Double confidence,
                              Map<Dimension, Double> weights, String evaluatorKind, Instant evaluatedAt, String feedback) {
        public ScoreVector {
            requireText(taskId, "taskId");
            if (scores == null || scores.isEmpty()) {
                throw new IllegalArgumentException("Score vector for " + taskId + " has no dimensions");
            }
            scores.forEach((d, v) -> {
                if (d == null || v == null || !(v >= MIN_SCORE && v <= MAX_SCORE)) {
                    throw new IllegalArgumentException("Score for " + d + " out of range: " + v);
                }
            });
            if (confidence != null && !(confidence >= 0.0 && confidence <= 1.0)) {
                throw new IllegalArgumentException("Confidence out of range: " + confidence);
            }
            if (weights == null || !weights.keySet().equals(scores.keySet())) {
                throw new IllegalArgumentException("Weights for " + taskId + " must cover exactly the scored dimensions");
            }
            weights.forEach((d, w) -> {
                if (w == null || !(w > 0.0) || w.isInfinite()) {
                    throw new IllegalArgumentException("Weight for " + d + " must be positive: " + w);
                }
            });
            scores = Collections.unmodifiableMap(new EnumMap<>(scores));
            weights = Collections.unmodifiableMap(new EnumMap<>(weights));
        }

        public boolean covers(Dimension dimension) {
            return scores.containsKey(dimension);
        }
    }

    public record FailureReason(FailureType type, String message, String lastCause) {
        public FailureReason {
            Objects.requireNonNull(type, "type");
        }

        public static FailureReason of(FailureType type, String message) {
            return new FailureReason(type, message, null);
        }

        public static FailureReason exhausted(FailureReason last, int attempts) {
            return new FailureReason(FailureType.RETRY_BUDGET_EXHAUSTED,
                    "Gave up after " + attempts + " attempts",
                    last.type() + ": " + last.message());
        }
    }

    public record TaskOutcome(String taskId, String learnerId, String assignmentId, String kind, OutcomeStatus status,
                              ScoreVector scoreVector, FailureReason failure, int attemptCount,
                              Instant recordedAt, Instant nextAttemptAt) {
        public TaskOutcome {
            requireText(taskId, "taskId");
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(recordedAt, "recordedAt");
            if (status == OutcomeStatus.SUCCEEDED && (scoreVector == null || failure != null)) {
                throw new IllegalArgumentException("Succeeded outcome for " + taskId + " needs a score vector and no failure");
            }
            if (status != OutcomeStatus.SUCCEEDED && (failure == null || scoreVector != null)) {
                throw new IllegalArgumentException(status + " outcome for " + taskId + " needs a failure reason and no scores");
            }
            if (attemptCount < 0) {
                throw new IllegalArgumentException("attemptCount must not be negative");
            }
        }

        public static TaskOutcome succeeded(Task task, ScoreVector vector, int attempts, Instant at) {
            return new TaskOutcome(task.taskId(), task.learnerId(), task.assignmentId(), task.kind(),
                    OutcomeStatus.SUCCEEDED, vector, null, attempts, at, null);
        }

        public static TaskOutcome failed(Task task, FailureReason reason, int attempts, Instant at, Instant nextAttemptAt) {
            return new TaskOutcome(task.taskId(), task.learnerId(), task.assignmentId(), task.kind(),
                    OutcomeStatus.FAILED, null, reason, attempts, at, nextAttemptAt);
        }

        public static TaskOutcome deadLettered(Task task, FailureReason reason, int attempts, Instant at) {
            return new TaskOutcome(task.taskId(), task.learnerId(), task.assignmentId(), task.kind(),
                    OutcomeStatus.DEAD_LETTERED, null, reason, attempts, at, null);
        }

        public boolean terminal() {
            return status != OutcomeStatus.FAILED;
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}

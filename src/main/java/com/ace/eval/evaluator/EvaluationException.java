package com.ace.eval.evaluator;

import com.ace.eval.task.TaskModels.FailureReason;
import com.ace.eval.task.TaskModels.FailureType;

public class EvaluationException extends RuntimeException {
    private final FailureType type;

    public EvaluationException(FailureType type, String message) {
        super(message);
        this.type = type;
    }

    public EvaluationException(FailureType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public FailureType type() {
        return type;
    }

    public boolean retryable() {
        return type.retryable();
    }

    public FailureReason toReason() {
        String cause = getCause() == null ? null : getCause().getClass().getSimpleName() + ": " + getCause().getMessage();
        return new FailureReason(type, getMessage(), cause);
    }

    public static EvaluationException schemaError(String message) {
        return new EvaluationException(FailureType.SCHEMA_ERROR, message);
    }

    public static EvaluationException upstreamTimeout(String message) {
        return new EvaluationException(FailureType.UPSTREAM_TIMEOUT, message);
    }

    public static EvaluationException upstreamFailure(String message) {
        return new EvaluationException(FailureType.UPSTREAM_FAILURE, message);
    }

    public static EvaluationException upstreamFailure(String message, Throwable cause) {
        return new EvaluationException(FailureType.UPSTREAM_FAILURE, message, cause);
    }
}

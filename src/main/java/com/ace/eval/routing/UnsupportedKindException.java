package com.ace.eval.routing;

import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.task.TaskModels.FailureType;

import java.util.Set;

public class UnsupportedKindException extends EvaluationException {
    private final String kind;

    public UnsupportedKindException(String kind, Set<String> registered) {
        super(FailureType.UNSUPPORTED_KIND, "No evaluator registered for kind " + kind + " (registered: " + registered + ")");
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}

package com.ace.eval.evaluator;

import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.task.TaskModels.Dimension;

import java.util.Set;

public interface TextScoringModel {

    String name();

    /**
     * Scores the text on the requested dimensions. Scores are on the unit interval.
     * Implementations signal provider problems with {@link EvaluationException}.
     */
    TextScore score(String text, Set<Dimension> dimensions);
}

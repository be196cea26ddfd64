package com.ace.eval.evaluator;

import com.ace.eval.rubric.Rubric;
import com.ace.eval.task.TaskModels.ScoreVector;
import com.ace.eval.task.TaskModels.Task;

/**
 * Scores tasks of one kind against a rubric.
 * <p>
 * Implementations must be safe for concurrent use and must not write any shared state:
 * the result is returned as a score vector or signalled with an {@link EvaluationException}.
 */
public interface Evaluator {

    String kind();

    ScoreVector evaluate(Task task, Rubric rubric);
}

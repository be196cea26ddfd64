package com.ace.eval.evaluator;

import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.rubric.Rubric;
import com.ace.eval.task.TaskKinds;
import com.ace.eval.task.TaskModels.Dimension;
import com.ace.eval.task.TaskModels.ScoreVector;
import com.ace.eval.task.TaskModels.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;

@Component
public class TextEvaluator implements Evaluator {
    private static final Logger log = LoggerFactory.getLogger(TextEvaluator.class);

    private final TextScoringModel model;
    private final Clock clock;

    public TextEvaluator(TextScoringModel model, Clock clock) {
        this.model = model;
        this.clock = clock;
    }

    @Override
    public String kind() {
        return TaskKinds.TEXT;
    }

    @Override
    public ScoreVector evaluate(Task task, Rubric rubric) {
        String text = Payloads.requiredText(task, "text");
        return score(task, text, rubric, kind(), 1.0);
    }

    /**
     * Scores already-extracted text on every dimension the rubric declares.
     * A model answer that omits a declared dimension, has no confidence or is out of range is an upstream failure.
     */
    ScoreVector score(Task task, String text, Rubric rubric, String evaluatorKind, double confidenceFactor) {
        Set<Dimension> dimensions = rubric.declared();
        TextScore answer;
        try {
            answer = model.score(text, dimensions);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw EvaluationException.upstreamFailure("Scoring model " + model.name() + " failed: " + e.getMessage(), e);
        }
        if (answer == null || answer.scores() == null) {
            throw EvaluationException.upstreamFailure("Scoring model " + model.name() + " returned no scores");
        }

        Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
        List<Dimension> missing = new ArrayList<>();
        for (Dimension d : dimensions) {
            Double value = answer.scores().get(d);
            if (value == null) {
                missing.add(d);
            } else if (!(value >= 0.0 && value <= 1.0)) {
                throw EvaluationException.upstreamFailure("Scoring model " + model.name() + " returned " + value + " for " + d);
            } else {
                scores.put(d, value);
            }
        }
        if (!missing.isEmpty()) {
            throw EvaluationException.upstreamFailure("Scoring model " + model.name() + " omitted " + missing);
        }
        if (answer.confidence() == null || !(answer.confidence() >= 0.0 && answer.confidence() <= 1.0)) {
            throw EvaluationException.upstreamFailure("Scoring model " + model.name() + " returned no usable confidence");
        }
        log.debug("Task {} scored by {}: {}", task.taskId(), model.name(), scores);
        return new ScoreVector(task.taskId(), scores, answer.confidence() * confidenceFactor,
                rubric.weightsFor(dimensions), evaluatorKind, clock.instant(), answer.feedback());
    }
}

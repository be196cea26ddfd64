package com.ace.eval.evaluator;

import com.ace.eval.rubric.Rubric;
import com.ace.eval.task.TaskKinds;
import com.ace.eval.task.TaskModels.Dimension;
import com.ace.eval.task.TaskModels.ScoreVector;
import com.ace.eval.task.TaskModels.Task;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;

/**
 * Deterministic key comparison. An MCQ has no communication signal, so only the
 * analysis and evaluation dimensions the rubric declares are scored.
 */
@Component
public class McqEvaluator implements Evaluator {
    private static final Set<Dimension> SCORABLE = EnumSet.of(Dimension.ANALYSIS, Dimension.EVALUATION);

    private final Clock clock;

    public McqEvaluator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String kind() {
        return TaskKinds.MCQ;
    }

    @Override
    public ScoreVector evaluate(Task task, Rubric rubric) {
        List<Dimension> dimensions = rubric.declared().stream().filter(SCORABLE::contains).toList();
        if (dimensions.isEmpty()) {
            throw EvaluationException.schemaError("Rubric " + rubric.ref() + " declares no dimension an MCQ can score");
        }

        List<Map<String, Object>> answers = Payloads.optionalItems(task, "answers").orElseGet(() -> List.of(task.payload()));
        if (answers.isEmpty()) {
            throw EvaluationException.schemaError("Task " + task.taskId() + " has no answers");
        }

        int correct = 0;
        for (Map<String, Object> answer : answers) {
            String selected = Payloads.optionalText(answer, "selected", "selectedOption")
                    .orElseThrow(() -> EvaluationException.schemaError("Task " + task.taskId() + " has an answer without a selection"));
            String key = Payloads.optionalText(answer, "key", "correctOption")
                    .orElseThrow(() -> EvaluationException.schemaError("Task " + task.taskId() + " has an answer without a key"));
            if (normalize(selected).equals(normalize(key))) correct++;
        }

        double fraction = (double) correct / answers.size();
        Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
        dimensions.forEach(d -> scores.put(d, fraction));
        String feedback = band(fraction) + " (" + correct + "/" + answers.size() + " correct)";
        return new ScoreVector(task.taskId(), scores, null, rubric.weightsFor(dimensions), kind(), clock.instant(), feedback);
    }

    static String band(double fraction) {
        if (fraction >= 0.9) return "Excellent";
        if (fraction >= 0.8) return "Good";
        if (fraction >= 0.7) return "Satisfactory";
        return "Needs improvement";
    }

    private static String normalize(String option) {
        return option.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }
}

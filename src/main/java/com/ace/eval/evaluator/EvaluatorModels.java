package com.ace.eval.evaluator;

import com.ace.eval.task.TaskModels.Dimension;

import java.util.Map;

public class EvaluatorModels {
    public record TextScore(Map<Dimension, Double> scores, Double confidence, String feedback) {}

    public record Transcript(String text, Double confidence) {}
}

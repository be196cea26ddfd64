package com.ace.eval.evaluator.backend;

import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.evaluator.TextScoringModel;
import com.ace.eval.task.TaskModels.Dimension;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Offline lexical scorer. Deterministic for a given text; its confidence stays low
 * so downstream consumers can tell it apart from a model-backed score.
 */
@Component
@ConditionalOnProperty(prefix = "ace.scoring.text", name = "provider", havingValue = "heuristic", matchIfMissing = true)
public class HeuristicTextScoringModel implements TextScoringModel {
    static final double MAX_CONFIDENCE = 0.6;

    private static final List<String> REASONING_MARKERS = List.of(
            "because", "therefore", "thus", "since", "as a result", "consequently",
            "which means", "hence", "due to", "so that", "leads to");
    private static final List<String> EVALUATIVE_MARKERS = List.of(
            "however", "although", "on the other hand", "in my view", "i believe", "strength",
            "weakness", "limitation", "overall", "convincing", "evidence", "whereas", "nevertheless");

    private static final int FULL_LENGTH_WORDS = 150;
    private static final double IDEAL_SENTENCE_WORDS = 18.0;

    @Override
    public String name() {
        return "heuristic";
    }

    @Override
    public TextScore score(String text, Set<Dimension> dimensions) {
        String lower = text.toLowerCase(Locale.ROOT);
        String[] words = lower.trim().split("\\s+");
        int wordCount = lower.isBlank() ? 0 : words.length;
        long sentences = Arrays.stream(text.split("[.!?]+")).filter(s -> !s.isBlank()).count();

        double length = Math.min(1.0, wordCount / (double) FULL_LENGTH_WORDS);
        double variety = wordCount == 0 ? 0.0 : new HashSet<>(Arrays.asList(words)).size() / (double) wordCount;
        double reasoning = Math.min(1.0, countMarkers(lower, REASONING_MARKERS) / 3.0);
        double evaluative = Math.min(1.0, countMarkers(lower, EVALUATIVE_MARKERS) / 3.0);
        double sentenceShape = sentences == 0 ? 0.0
                : 1.0 - Math.min(1.0, Math.abs(wordCount / (double) sentences - IDEAL_SENTENCE_WORDS) / IDEAL_SENTENCE_WORDS);

        Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
        for (Dimension d : dimensions) {
            double value = switch (d) {
                case ANALYSIS -> 0.25 * length + 0.45 * reasoning + 0.30 * variety;
                case COMMUNICATION -> 0.40 * sentenceShape + 0.30 * variety + 0.30 * length;
                case EVALUATION -> 0.30 * length + 0.50 * evaluative + 0.20 * variety;
            };
            scores.put(d, clamp(value));
        }
        double confidence = Math.min(MAX_CONFIDENCE, 0.2 + wordCount / 500.0);
        return new TextScore(scores, confidence, feedback(length, reasoning, evaluative));
    }

    private static int countMarkers(String text, List<String> markers) {
        int hits = 0;
        for (String marker : markers) {
            int from = 0;
            while ((from = text.indexOf(marker, from)) >= 0) {
                hits++;
                from += marker.length();
            }
        }
        return hits;
    }

    private static String feedback(double length, double reasoning, double evaluative) {
        List<String> notes = new ArrayList<>();
        if (length < 0.5) notes.add("Develop the answer further.");
        if (reasoning < 0.5) notes.add("Connect claims with explicit reasoning.");
        if (evaluative < 0.5) notes.add("Weigh strengths and limitations before concluding.");
        return notes.isEmpty() ? "Well developed and reasoned." : String.join(" ", notes);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

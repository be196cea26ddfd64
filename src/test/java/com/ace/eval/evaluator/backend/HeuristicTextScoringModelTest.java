package com.ace.eval.evaluator.backend;

import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.task.TaskModels.Dimension;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicTextScoringModelTest {
    private static final String REASONED = "The policy failed because it ignored local incentives. Therefore the rollout stalled. "
            + "However, the evidence from the pilot was convincing, although the sample was small. "
            + "Overall I believe the main weakness was timing, whereas the design itself had real strength.";

    private final HeuristicTextScoringModel model = new HeuristicTextScoringModel();

    @Test
    void scoresOnlyRequestedDimensions() {
        TextScore score = model.score(REASONED, EnumSet.of(Dimension.COMMUNICATION));

        assertEquals(Set.of(Dimension.COMMUNICATION), score.scores().keySet());
    }

    @Test
    void scoresStayInRangeAndAreDeterministic() {
        Set<Dimension> all = EnumSet.allOf(Dimension.class);
        TextScore first = model.score(REASONED, all);
        TextScore second = model.score(REASONED, all);

        assertEquals(first, second);
        first.scores().values().forEach(v -> assertTrue(v >= 0.0 && v <= 1.0));
        assertTrue(first.confidence() > 0.0 && first.confidence() <= HeuristicTextScoringModel.MAX_CONFIDENCE);
    }

    @Test
    void reasoningMarkersRaiseAnalysis() {
        Set<Dimension> analysis = EnumSet.of(Dimension.ANALYSIS);
        double flat = model.score("The policy failed. The rollout stalled. The pilot was small.", analysis)
                .scores().get(Dimension.ANALYSIS);
        double reasoned = model.score("The policy failed because incentives were ignored. Therefore the rollout stalled. "
                + "As a result the pilot was small.", analysis).scores().get(Dimension.ANALYSIS);

        assertTrue(reasoned > flat);
    }

    @Test
    void shortAnswersGetDevelopmentFeedback() {
        TextScore score = model.score("Yes.", EnumSet.allOf(Dimension.class));

        assertTrue(score.feedback().contains("Develop the answer further."));
        assertEquals(0.2 + 1 / 500.0, score.confidence(), 1e-9);
    }
}

package com.ace.eval.evaluator.backend;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.EvaluatorModels.Transcript;
import com.ace.eval.evaluator.Transcriber;
import com.ace.eval.task.TaskModels.Task;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Uses a transcript produced upstream and shipped in the task payload.
 */
@Component
@ConditionalOnProperty(prefix = "ace.scoring.audio", name = "provider", havingValue = "payload", matchIfMissing = true)
public class PayloadTranscriber implements Transcriber {
    private final double defaultConfidence;

    public PayloadTranscriber(AceProperties properties) {
        this.defaultConfidence = properties.getScoring().getAudio().getDefaultConfidence();
    }

    @Override
    public String name() {
        return "payload";
    }

    @Override
    public Transcript transcribe(Task task, String audioRef, String format) {
        Object text = task.payload().get("transcript");
        if (text == null || String.valueOf(text).isBlank()) {
            throw EvaluationException.upstreamFailure("No transcript available yet for " + audioRef);
        }
        Object confidence = task.payload().get("transcriptConfidence");
        return new Transcript(String.valueOf(text),
                confidence instanceof Number n ? n.doubleValue() : defaultConfidence);
    }
}

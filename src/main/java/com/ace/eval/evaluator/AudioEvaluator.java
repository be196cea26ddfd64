package com.ace.eval.evaluator;

import com.ace.eval.evaluator.EvaluatorModels.Transcript;
import com.ace.eval.rubric.Rubric;
import com.ace.eval.task.TaskKinds;
import com.ace.eval.task.TaskModels.ScoreVector;
import com.ace.eval.task.TaskModels.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Transcribes the recording, then scores the transcript exactly like a written answer.
 * The vector keeps the AUDIO evaluator kind and its confidence is discounted by the transcription confidence.
 */
@Component
public class AudioEvaluator implements Evaluator {
    private static final Logger log = LoggerFactory.getLogger(AudioEvaluator.class);

    public static final Set<String> SUPPORTED_FORMATS = Set.of("wav", "mp3", "m4a", "ogg", "flac", "webm");

    private final Transcriber transcriber;
    private final TextEvaluator textEvaluator;

    public AudioEvaluator(Transcriber transcriber, TextEvaluator textEvaluator) {
        this.transcriber = transcriber;
        this.textEvaluator = textEvaluator;
    }

    @Override
    public String kind() {
        return TaskKinds.AUDIO;
    }

    @Override
    public ScoreVector evaluate(Task task, Rubric rubric) {
        String audioRef = Payloads.requiredText(task, "audioRef");
        String format = Payloads.optionalText(task.payload(), "format").map(f -> f.trim().toLowerCase(Locale.ROOT)).orElse(null);
        if (format != null && !SUPPORTED_FORMATS.contains(format)) {
            throw EvaluationException.schemaError("Task " + task.taskId() + " has unsupported audio format " + format);
        }
        Payloads.optionalNumber(task, "durationSeconds").ifPresent(seconds -> {
            if (!(seconds > 0)) {
                throw EvaluationException.schemaError("Task " + task.taskId() + " has non-positive duration " + seconds);
            }
        });

        Transcript transcript;
        try {
            transcript = transcriber.transcribe(task, audioRef, format);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw EvaluationException.upstreamFailure("Transcriber " + transcriber.name() + " failed: " + e.getMessage(), e);
        }
        if (transcript == null || transcript.text() == null || transcript.text().isBlank()) {
            throw EvaluationException.upstreamFailure("Transcriber " + transcriber.name() + " returned an empty transcript");
        }
        double transcriptionConfidence = transcript.confidence() == null ? 1.0 : transcript.confidence();
        if (!(transcriptionConfidence >= 0.0 && transcriptionConfidence <= 1.0)) {
            throw EvaluationException.upstreamFailure("Transcriber " + transcriber.name() + " returned confidence " + transcriptionConfidence);
        }
        log.debug("Task {} transcribed by {} ({} chars, confidence {})",
                task.taskId(), transcriber.name(), transcript.text().length(), transcriptionConfidence);
        return textEvaluator.score(task, transcript.text(), rubric, kind(), transcriptionConfidence);
    }
}

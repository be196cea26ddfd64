package com.ace.eval.evaluator;

import com.ace.eval.evaluator.EvaluatorModels.Transcript;
import com.ace.eval.task.TaskModels.Task;

public interface Transcriber {

    String name();

    Transcript transcribe(Task task, String audioRef, String format);
}

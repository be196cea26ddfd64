package com.ace.eval.logging;

import com.ace.eval.task.TaskModels.Task;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * MDC keys for pipeline logging: taskId, learnerId, assignmentId, taskKind, attempt.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(Task task) {
        MDC.put("taskId", task.taskId());
        MDC.put("learnerId", task.learnerId());
        MDC.put("assignmentId", task.assignmentId());
        MDC.put("taskKind", task.kind());
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("learnerId");
        MDC.remove("assignmentId");
        MDC.remove("taskKind");
        MDC.remove("attempt");
    }

    /**
     * Carries the caller's MDC onto the thread that runs {@code work}.
     */
    public static <T> Callable<T> propagate(Callable<T> work) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) MDC.setContextMap(captured);
            try {
                return work.call();
            } finally {
                if (previous != null) MDC.setContextMap(previous);
                else MDC.clear();
            }
        };
    }
}

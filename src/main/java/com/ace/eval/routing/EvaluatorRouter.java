package com.ace.eval.routing;

import com.ace.eval.evaluator.Evaluator;
import com.ace.eval.task.TaskKinds;
import com.ace.eval.task.TaskModels.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a task kind to exactly one evaluator. Routing is a lookup and never runs evaluation.
 */
@Component
public class EvaluatorRouter {
    private static final Logger log = LoggerFactory.getLogger(EvaluatorRouter.class);

    private final Map<String, Evaluator> evaluators = new ConcurrentHashMap<>();

    public EvaluatorRouter(List<Evaluator> evaluators) {
        evaluators.forEach(this::register);
        log.info("Evaluator routes: {}", registeredKinds());
    }

    public Evaluator route(Task task) {
        Evaluator evaluator = evaluators.get(TaskKinds.normalize(task.kind()));
        if (evaluator == null) {
            throw new UnsupportedKindException(task.kind(), registeredKinds());
        }
        return evaluator;
    }

    /**
     * Adds an evaluator for a new kind, or replaces the one already serving that kind.
     */
    public void register(Evaluator evaluator) {
        String kind = TaskKinds.normalize(evaluator.kind());
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Evaluator " + evaluator.getClass().getSimpleName() + " declares no kind");
        }
        Evaluator previous = evaluators.put(kind, evaluator);
        if (previous != null && previous != evaluator) {
            log.info("Evaluator for {} replaced: {} -> {}", kind,
                    previous.getClass().getSimpleName(), evaluator.getClass().getSimpleName());
        }
    }

    public Set<String> registeredKinds() {
        return new TreeSet<>(evaluators.keySet());
    }
}

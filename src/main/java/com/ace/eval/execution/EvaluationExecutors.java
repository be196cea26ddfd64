package com.ace.eval.execution;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs evaluator calls off the worker thread so a per-kind timeout can be enforced.
 * Each lane has its own pool, which keeps a stuck audio backend from starving text and MCQ evaluation.
 */
@Component
public class EvaluationExecutors {
    private static final Logger log = LoggerFactory.getLogger(EvaluationExecutors.class);

    private final AceProperties properties;
    private final Map<String, ExecutorService> pools = new ConcurrentHashMap<>();

    public EvaluationExecutors(AceProperties properties) {
        this.properties = properties;
    }

    public <T> T call(String kind, Callable<T> work) {
        Duration timeout = properties.timeoutFor(kind);
        String lane = properties.laneFor(kind);
        Future<T> future = pools.computeIfAbsent(lane, EvaluationExecutors::newPool).submit(MdcContext.propagate(work));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw EvaluationException.upstreamTimeout("Evaluation of " + kind + " exceeded " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EvaluationException evaluationException) {
                throw evaluationException;
            }
            log.error("Evaluator for {} failed unexpectedly", kind, cause);
            throw EvaluationException.upstreamFailure("Evaluator for " + kind + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw EvaluationException.upstreamFailure("Interrupted while evaluating " + kind, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        pools.values().forEach(ExecutorService::shutdownNow);
    }

    private static ExecutorService newPool(String lane) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ace-eval-" + lane + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

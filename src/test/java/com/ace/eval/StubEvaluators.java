package com.ace.eval;

import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.Evaluator;
import com.ace.eval.rubric.Rubric;
import com.ace.eval.task.TaskModels.Dimension;
import com.ace.eval.task.TaskModels.ScoreVector;
import com.ace.eval.task.TaskModels.Task;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Evaluators with scripted behaviour, registered on the shared router under per-test kinds.
 */
final class StubEvaluators {
    private StubEvaluators() {
    }

    static ScoreVector fullMarks(Task task, Rubric rubric, String kind) {
        Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
        rubric.declared().forEach(d -> scores.put(d, 1.0));
        return new ScoreVector(task.taskId(), scores, 0.9, rubric.weightsFor(rubric.declared()), kind, Instant.now(), "scripted");
    }

    /**
     * Each call gets its 1-based call number; the script returns null for success or the exception to throw.
     */
    static class Scripted implements Evaluator {
        private final String kind;
        private final IntFunction<EvaluationException> script;
        private final AtomicInteger calls = new AtomicInteger();

        Scripted(String kind, IntFunction<EvaluationException> script) {
            this.kind = kind;
            this.script = script;
        }

        static Scripted alwaysSucceeds(String kind) {
            return new Scripted(kind, n -> null);
        }

        static Scripted alwaysFails(String kind, EvaluationException failure) {
            return new Scripted(kind, n -> failure);
        }

        static Scripted failsFirst(String kind, int failures) {
            return new Scripted(kind, n -> n <= failures ? EvaluationException.upstreamFailure("provider 503 on call " + n) : null);
        }

        @Override
        public String kind() {
            return kind;
        }

        @Override
        public ScoreVector evaluate(Task task, Rubric rubric) {
            EvaluationException failure = script.apply(calls.incrementAndGet());
            if (failure != null) throw failure;
            return fullMarks(task, rubric, kind);
        }

        int calls() {
            return calls.get();
        }
    }

    static class Blocking implements Evaluator {
        private final String kind;
        private final CountDownLatch release;
        private final AtomicInteger calls = new AtomicInteger();

        Blocking(String kind, CountDownLatch release) {
            this.kind = kind;
            this.release = release;
        }

        @Override
        public String kind() {
            return kind;
        }

        @Override
        public ScoreVector evaluate(Task task, Rubric rubric) {
            calls.incrementAndGet();
            try {
                if (!release.await(30, TimeUnit.SECONDS)) {
                    throw EvaluationException.upstreamTimeout("test latch never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw EvaluationException.upstreamFailure("interrupted", e);
            }
            return fullMarks(task, rubric, kind);
        }

        int calls() {
            return calls.get();
        }
    }
}

package com.ace.eval.execution;

import com.ace.eval.aggregation.ReportService;
import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.Evaluator;
import com.ace.eval.events.PipelineEventBus;
import com.ace.eval.events.PipelineEventTypes;
import com.ace.eval.execution.ExecutionModels.TaskState;
import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.logging.MdcContext;
import com.ace.eval.metrics.EvaluationMetrics;
import com.ace.eval.repository.TaskOutcomeJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository.TaskStateRow;
import com.ace.eval.routing.EvaluatorRouter;
import com.ace.eval.rubric.Rubric;
import com.ace.eval.rubric.RubricCatalog;
import com.ace.eval.task.TaskModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Runs one attempt of a task and records its outcome.
 * <p>
 * The task row is claimed with a compare-and-set before the evaluator runs, so a redelivered or
 * concurrently delivered task is evaluated at most once per attempt, and never again once it is
 * SUCCEEDED or DEAD_LETTERED. Failures are classified here: non-retryable ones dead-letter at once,
 * retryable ones are rescheduled with backoff until the attempt budget is spent.
 */
@Service
public class ExecutionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final TaskStateJdbcRepository stateRepository;
    private final TaskOutcomeJdbcRepository outcomeRepository;
    private final EvaluatorRouter router;
    private final RubricCatalog rubrics;
    private final EvaluationExecutors executors;
    private final BackoffPolicy backoff;
    private final FaultLedger faultLedger;
    private final ReportService reportService;
    private final PipelineEventBus events;
    private final EvaluationMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;

    public ExecutionCoordinator(TaskStateJdbcRepository stateRepository, TaskOutcomeJdbcRepository outcomeRepository,
                                EvaluatorRouter router, RubricCatalog rubrics, EvaluationExecutors executors,
                                BackoffPolicy backoff, FaultLedger faultLedger, ReportService reportService,
                                PipelineEventBus events, EvaluationMetrics metrics, Clock clock, AceProperties properties) {
        this.stateRepository = stateRepository;
        this.outcomeRepository = outcomeRepository;
        this.router = router;
        this.rubrics = rubrics;
        this.executors = executors;
        this.backoff = backoff;
        this.faultLedger = faultLedger;
        this.reportService = reportService;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = properties.getExecution().getMaxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ace.execution.max-attempts must be at least 1");
        }
    }

    /**
     * Registers the task if it is new.
     *
     * @return true when this call created the task
     */
    public boolean accept(Task task) {
        boolean created = stateRepository.insertPending(task, clock.instant());
        if (created) {
            events.publish(PipelineEventTypes.TASK_RECEIVED, task.taskId(), task.learnerId(), task.assignmentId(),
                    Map.of("kind", task.kind()));
        }
        return created;
    }

    /**
     * Attempts the task once.
     *
     * @return the recorded outcome, the stored outcome when the task is already terminal,
     * or empty when another worker owns the current attempt
     */
    public Optional<TaskOutcome> process(Task task) {
        MdcContext.setTask(task);
        try {
            accept(task);
            if (!stateRepository.claim(task.taskId(), clock.instant())) {
                return alreadyHandled(task);
            }
            TaskStateRow state = stateRepository.find(task.taskId())
                    .orElseThrow(() -> new IllegalStateException("Claimed task " + task.taskId() + " has no state row"));
            // the stored copy is authoritative; a redelivery may carry a different payload
            return evaluate(state.task(), state.attemptCount());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Ends an attempt whose worker stopped reporting. Counts as an upstream timeout for retry purposes.
     *
     * @return the recorded outcome, or empty when the attempt finished or moved on meanwhile
     */
    public Optional<TaskOutcome> expireClaim(TaskStateRow row) {
        Task task = row.task();
        MdcContext.setTask(task);
        try {
            EvaluationException timeout = EvaluationException.upstreamTimeout(
                    "Claim on attempt " + row.attemptCount() + " expired without a result");
            TaskOutcome outcome = classify(task, row.attemptCount(), timeout);
            if (outcome.status() == OutcomeStatus.FAILED) {
                // retry straight away: the lease wait already served as backoff
                outcome = TaskOutcome.failed(task, outcome.failure(), outcome.attemptCount(), outcome.recordedAt(), outcome.recordedAt());
            }
            TaskState next = outcome.status() == OutcomeStatus.FAILED ? TaskState.FAILED : TaskState.DEAD_LETTERED;
            if (!stateRepository.complete(task.taskId(), row.attemptCount(), next, outcome.nextAttemptAt(), clock.instant())) {
                return Optional.empty();
            }
            log.warn("Claim on task {} attempt {} expired; now {}", task.taskId(), row.attemptCount(), next);
            record(outcome);
            return Optional.of(outcome);
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<TaskOutcome> alreadyHandled(Task task) {
        Optional<TaskStateRow> state = stateRepository.find(task.taskId());
        if (state.isEmpty() || !state.get().status().terminal()) {
            log.debug("Task {} is {} elsewhere; skipping delivery", task.taskId(),
                    state.map(s -> s.status().name()).orElse("unknown"));
            return Optional.empty();
        }
        Optional<TaskOutcome> stored = outcomeRepository.find(task.taskId());
        metrics.recordDuplicate(task.kind());
        events.publish(PipelineEventTypes.TASK_DUPLICATE_IGNORED, task.taskId(), task.learnerId(), task.assignmentId(),
                Map.of("status", state.get().status().name()));
        return stored;
    }

    private Optional<TaskOutcome> evaluate(Task task, int attempt) {
        MdcContext.setAttempt(attempt);
        events.publish(PipelineEventTypes.TASK_EVALUATING, task.taskId(), task.learnerId(), task.assignmentId(),
                Map.of("attempt", attempt));
        long started = System.nanoTime();

        TaskOutcome outcome;
        try {
            Evaluator evaluator = router.route(task);
            Rubric rubric = rubrics.find(task.rubricRef())
                    .orElseThrow(() -> EvaluationException.schemaError("Unknown rubric " + task.rubricRef()));
            ScoreVector vector = executors.call(task.kind(), () -> evaluator.evaluate(task, rubric));
            outcome = TaskOutcome.succeeded(task, vector, attempt, clock.instant());
        } catch (EvaluationException e) {
            outcome = classify(task, attempt, e);
        }
        metrics.recordEvaluation(task.kind(), outcome.status().name(), (System.nanoTime() - started) / 1_000_000);

        TaskState next = switch (outcome.status()) {
            case SUCCEEDED -> TaskState.SUCCEEDED;
            case FAILED -> TaskState.FAILED;
            case DEAD_LETTERED -> TaskState.DEAD_LETTERED;
        };
        if (!stateRepository.complete(task.taskId(), attempt, next, outcome.nextAttemptAt(), clock.instant())) {
            log.warn("Attempt {} of task {} lost its claim before completing; result discarded", attempt, task.taskId());
            return Optional.empty();
        }
        record(outcome);
        return Optional.of(outcome);
    }

    private TaskOutcome classify(Task task, int attempt, EvaluationException e) {
        FailureReason reason = e.toReason();
        Instant now = clock.instant();
        if (!e.retryable()) {
            return TaskOutcome.deadLettered(task, reason, attempt, now);
        }
        if (attempt >= maxAttempts) {
            return TaskOutcome.deadLettered(task, FailureReason.exhausted(reason, attempt), attempt, now);
        }
        log.info("Attempt {} of task {} failed ({}): {}", attempt, task.taskId(), reason.type(), reason.message());
        return TaskOutcome.failed(task, reason, attempt, now, now.plus(backoff.delayFor(attempt)));
    }

    private void record(TaskOutcome outcome) {
        outcomeRepository.save(outcome);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", outcome.attemptCount());
        switch (outcome.status()) {
            case SUCCEEDED -> {
                details.put("evaluator", outcome.scoreVector().evaluatorKind());
                details.put("dimensions", outcome.scoreVector().scores().keySet());
                events.publish(PipelineEventTypes.TASK_SUCCEEDED, outcome.taskId(), outcome.learnerId(), outcome.assignmentId(), details);
            }
            case FAILED -> {
                faultLedger.record(outcome);
                metrics.recordRetry(outcome.kind(), outcome.failure().type().name());
                details.put("failure", outcome.failure().type());
                details.put("nextAttemptAt", outcome.nextAttemptAt());
                events.publish(PipelineEventTypes.TASK_FAILED, outcome.taskId(), outcome.learnerId(), outcome.assignmentId(), details);
            }
            case DEAD_LETTERED -> {
                faultLedger.record(outcome);
                metrics.recordDeadLetter(outcome.kind(), outcome.failure().type().name());
                details.put("failure", outcome.failure().type());
                events.publish(PipelineEventTypes.TASK_DEAD_LETTERED, outcome.taskId(), outcome.learnerId(), outcome.assignmentId(), details);
            }
        }
        reportService.outcomeRecorded(outcome);
    }
}

package com.ace.eval.review;

import com.ace.eval.aggregation.ReportService;
import com.ace.eval.events.PipelineEventBus;
import com.ace.eval.events.PipelineEventTypes;
import com.ace.eval.execution.ExecutionModels.TaskState;
import com.ace.eval.execution.TaskDispatcher;
import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.ledger.LedgerModels.LedgerEntry;
import com.ace.eval.ledger.LedgerModels.LedgerTransition;
import com.ace.eval.repository.TaskOutcomeJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository.TaskStateRow;
import com.ace.eval.rubric.Rubric;
import com.ace.eval.rubric.RubricCatalog;
import com.ace.eval.task.TaskModels.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Operator actions on dead-lettered tasks. Each action is only legal while the task is dead-lettered
 * and leaves a resolution entry in the fault ledger.
 */
@Service
public class OperatorReviewService {
    public static final String MANUAL_EVALUATOR = "MANUAL";

    private final TaskStateJdbcRepository stateRepository;
    private final TaskOutcomeJdbcRepository outcomeRepository;
    private final FaultLedger faultLedger;
    private final ReportService reportService;
    private final TaskDispatcher dispatcher;
    private final RubricCatalog rubrics;
    private final PipelineEventBus events;
    private final Clock clock;

    public OperatorReviewService(TaskStateJdbcRepository stateRepository, TaskOutcomeJdbcRepository outcomeRepository,
                                 FaultLedger faultLedger, ReportService reportService, TaskDispatcher dispatcher,
                                 RubricCatalog rubrics, PipelineEventBus events, Clock clock) {
        this.stateRepository = stateRepository;
        this.outcomeRepository = outcomeRepository;
        this.faultLedger = faultLedger;
        this.reportService = reportService;
        this.dispatcher = dispatcher;
        this.rubrics = rubrics;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Puts the task back into the pipeline with a fresh attempt budget.
     */
    public void resubmit(String taskId) {
        TaskStateRow state = requireState(taskId);
        LedgerEntry deadLetter = requireDeadLettered(taskId);
        Instant now = clock.instant();
        if (!stateRepository.resetForResubmission(taskId, now)) {
            throw new IllegalStateException("Task " + taskId + " is no longer dead-lettered");
        }
        faultLedger.recordResolution(deadLetter, LedgerTransition.RESUBMITTED, now);
        reportService.invalidate(state.task().learnerId(), state.task().assignmentId());
        publish(PipelineEventTypes.TASK_RESUBMITTED, state.task(), Map.of("previousFailure", deadLetter.failure().type()));
        dispatcher.schedule(state.task(), now);
    }

    /**
     * Records operator-supplied scores in place of an evaluator result.
     * Dimensions must be declared by the task's rubric when the rubric is known.
     */
    public TaskOutcome manuallyScore(String taskId, Map<Dimension, Double> scores, String note) {
        if (scores == null || scores.isEmpty()) {
            throw new IllegalArgumentException("Manual score for " + taskId + " has no dimensions");
        }
        TaskStateRow state = requireState(taskId);
        LedgerEntry deadLetter = requireDeadLettered(taskId);
        Task task = state.task();

        Map<Dimension, Double> weights = new EnumMap<>(Dimension.class);
        Optional<Rubric> rubric = rubrics.find(task.rubricRef());
        for (Dimension d : scores.keySet()) {
            if (rubric.isPresent() && !rubric.get().declares(d)) {
                throw new IllegalArgumentException("Rubric " + task.rubricRef() + " does not declare " + d);
            }
            weights.put(d, rubric.map(r -> r.weights().get(d)).orElse(1.0));
        }
        Instant now = clock.instant();
        ScoreVector vector = new ScoreVector(taskId, scores, null, weights, MANUAL_EVALUATOR, now, note);

        if (!stateRepository.transition(taskId, TaskState.DEAD_LETTERED, TaskState.SUCCEEDED, now)) {
            throw new IllegalStateException("Task " + taskId + " is no longer dead-lettered");
        }
        TaskOutcome outcome = TaskOutcome.succeeded(task, vector, state.attemptCount(), now);
        outcomeRepository.save(outcome);
        faultLedger.recordResolution(deadLetter, LedgerTransition.MANUALLY_SCORED, now);
        reportService.outcomeRecorded(outcome);
        publish(PipelineEventTypes.TASK_MANUALLY_SCORED, task, Map.of("dimensions", scores.keySet()));
        return outcome;
    }

    /**
     * Removes the task from the learner's expected set so the report can become final without it.
     */
    public void exclude(String taskId) {
        TaskStateRow state = requireState(taskId);
        LedgerEntry deadLetter = requireDeadLettered(taskId);
        Instant now = clock.instant();
        faultLedger.recordResolution(deadLetter, LedgerTransition.EXCLUDED, now);
        reportService.excludeTask(state.task().learnerId(), state.task().assignmentId(), taskId);
        publish(PipelineEventTypes.TASK_EXCLUDED, state.task(), Map.of());
    }

    private TaskStateRow requireState(String taskId) {
        return stateRepository.find(taskId)
                .orElseThrow(() -> new NoSuchElementException("Unknown task " + taskId));
    }

    private LedgerEntry requireDeadLettered(String taskId) {
        return faultLedger.currentDeadLetter(taskId)
                .orElseThrow(() -> new IllegalStateException("Task " + taskId + " is not dead-lettered"));
    }

    private void publish(String type, Task task, Map<String, Object> payload) {
        events.publish(type, task.taskId(), task.learnerId(), task.assignmentId(), payload);
    }
}

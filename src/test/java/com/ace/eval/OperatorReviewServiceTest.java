package com.ace.eval;

import com.ace.eval.aggregation.ReportModels.Report;
import com.ace.eval.aggregation.ReportModels.ReportStatus;
import com.ace.eval.aggregation.ReportService;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.execution.ExecutionCoordinator;
import com.ace.eval.execution.TaskDispatcher;
import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.ledger.LedgerModels.LedgerEntry;
import com.ace.eval.ledger.LedgerModels.LedgerTransition;
import com.ace.eval.repository.TaskOutcomeJdbcRepository;
import com.ace.eval.review.OperatorReviewService;
import com.ace.eval.routing.EvaluatorRouter;
import com.ace.eval.task.TaskModels.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class OperatorReviewServiceTest {
    @Autowired
    private OperatorReviewService reviewService;
    @Autowired
    private ExecutionCoordinator coordinator;
    @Autowired
    private TaskDispatcher dispatcher;
    @Autowired
    private EvaluatorRouter router;
    @Autowired
    private FaultLedger faultLedger;
    @Autowired
    private ReportService reportService;
    @Autowired
    private TaskOutcomeJdbcRepository outcomeRepository;

    @Test
    void resubmittedTaskIsEvaluatedAgainWithFreshBudget() throws Exception {
        String kind = id("FIXABLE");
        AtomicBoolean fixed = new AtomicBoolean(false);
        var evaluator = new StubEvaluators.Scripted(kind,
                n -> fixed.get() ? null : EvaluationException.schemaError("rubric mismatch"));
        router.register(evaluator);
        Task task = new Task(id("t"), "learner-1", id("asg"), kind, Map.of(), "written-ace");
        assertEquals(OutcomeStatus.DEAD_LETTERED, coordinator.process(task).orElseThrow().status());

        fixed.set(true);
        reviewService.resubmit(task.taskId());
        assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(10)));

        TaskOutcome outcome = outcomeRepository.find(task.taskId()).orElseThrow();
        assertEquals(OutcomeStatus.SUCCEEDED, outcome.status());
        assertEquals(1, outcome.attemptCount());
        assertEquals(2, evaluator.calls());
        List<LedgerEntry> history = faultLedger.history(task.taskId());
        assertEquals(List.of(LedgerTransition.DEAD_LETTERED, LedgerTransition.RESUBMITTED),
                history.stream().map(LedgerEntry::transition).toList());
        assertFalse(faultLedger.isDeadLettered(task.taskId()));
    }

    @Test
    void onlyDeadLetteredTasksCanBeResubmitted() {
        Task task = new Task(id("mcq"), "learner-1", id("asg"), "MCQ", Map.of("selected", "A", "key", "A"), "mcq-analysis");
        coordinator.process(task);

        assertThrows(IllegalStateException.class, () -> reviewService.resubmit(task.taskId()));
        assertThrows(NoSuchElementException.class, () -> reviewService.resubmit(id("missing")));
    }

    @Test
    void manualScoreCompletesTheReport() {
        String assignmentId = id("asg");
        String learnerId = id("learner");
        Task text = new Task(id("text"), learnerId, assignmentId, "TEXT", Map.of("text", " "), "written-ace");
        reportService.registerManifest(assignmentId, learnerId, Set.of(text.taskId()));
        assertEquals(OutcomeStatus.DEAD_LETTERED, coordinator.process(text).orElseThrow().status());

        TaskOutcome outcome = reviewService.manuallyScore(text.taskId(),
                Map.of(Dimension.ANALYSIS, 0.8, Dimension.COMMUNICATION, 0.6), "scored from the paper copy");

        assertEquals(OperatorReviewService.MANUAL_EVALUATOR, outcome.scoreVector().evaluatorKind());
        assertFalse(faultLedger.isDeadLettered(text.taskId()));
        Report report = reportService.report(learnerId, assignmentId);
        assertEquals(ReportStatus.FINAL, report.status());
        assertEquals(0.8, report.dimensions().get(Dimension.ANALYSIS).score(), 1e-9);
        assertTrue(report.deadLetteredTaskIds().isEmpty());
    }

    @Test
    void manualScoreRejectsDimensionsOutsideTheRubric() {
        Task mcq = new Task(id("mcq"), "learner-1", id("asg"), "MCQ", Map.of("selected", "A"), "mcq-analysis");
        coordinator.process(mcq);

        assertThrows(IllegalArgumentException.class,
                () -> reviewService.manuallyScore(mcq.taskId(), Map.of(Dimension.COMMUNICATION, 0.5), null));
        assertTrue(faultLedger.isDeadLettered(mcq.taskId()));
    }

    @Test
    void excludedTaskNoLongerBlocksTheReport() {
        String assignmentId = id("asg");
        String learnerId = id("learner");
        Task good = new Task(id("mcq"), learnerId, assignmentId, "MCQ", Map.of("selected", "A", "key", "A"), "mcq-analysis");
        Task broken = new Task(id("mcq"), learnerId, assignmentId, "MCQ", Map.of("key", "A"), "mcq-analysis");
        reportService.registerManifest(assignmentId, learnerId, Set.of(good.taskId(), broken.taskId()));
        coordinator.process(good);
        coordinator.process(broken);
        assertEquals(ReportStatus.PARTIAL, reportService.report(learnerId, assignmentId).status());
        assertEquals(List.of(broken.taskId()),
                faultLedger.listDeadLettered(assignmentId).stream().map(LedgerEntry::taskId).toList());

        reviewService.exclude(broken.taskId());

        Report report = reportService.report(learnerId, assignmentId);
        assertEquals(ReportStatus.FINAL, report.status());
        assertEquals(1.0, report.completeness(), 1e-9);
        assertTrue(report.deadLetteredTaskIds().isEmpty());
        assertTrue(faultLedger.listDeadLettered(assignmentId).isEmpty());
    }

    private static String id(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}

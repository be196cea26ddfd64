package com.ace.eval.aggregation;

import com.ace.eval.aggregation.ReportModels.*;
import com.ace.eval.events.PipelineEventBus;
import com.ace.eval.events.PipelineEventTypes;
import com.ace.eval.ledger.FaultLedger;
import com.ace.eval.metrics.EvaluationMetrics;
import com.ace.eval.repository.ManifestJdbcRepository;
import com.ace.eval.repository.TaskOutcomeJdbcRepository;
import com.ace.eval.task.TaskModels.OutcomeStatus;
import com.ace.eval.task.TaskModels.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves learner reports computed from stored outcomes. Reports are cached per learner and assignment
 * and dropped whenever an outcome, manifest or withdrawal for that pair changes.
 */
@Service
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final TaskOutcomeJdbcRepository outcomeRepository;
    private final ManifestJdbcRepository manifestRepository;
    private final FaultLedger faultLedger;
    private final ScoreAggregator aggregator;
    private final PipelineEventBus events;
    private final EvaluationMetrics metrics;
    private final Clock clock;
    private final Map<ReportKey, Report> cache = new ConcurrentHashMap<>();

    public ReportService(TaskOutcomeJdbcRepository outcomeRepository, ManifestJdbcRepository manifestRepository,
                         FaultLedger faultLedger, ScoreAggregator aggregator, PipelineEventBus events,
                         EvaluationMetrics metrics, Clock clock) {
        this.outcomeRepository = outcomeRepository;
        this.manifestRepository = manifestRepository;
        this.faultLedger = faultLedger;
        this.aggregator = aggregator;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Report report(String learnerId, String assignmentId) {
        return cache.computeIfAbsent(new ReportKey(learnerId, assignmentId), this::compute);
    }

    public void outcomeRecorded(TaskOutcome outcome) {
        cache.remove(new ReportKey(outcome.learnerId(), outcome.assignmentId()));
    }

    public void invalidate(String learnerId, String assignmentId) {
        cache.remove(new ReportKey(learnerId, assignmentId));
    }

    public AssignmentManifest registerManifest(String assignmentId, String learnerId, Set<String> expectedTaskIds) {
        if (expectedTaskIds == null) {
            throw new IllegalArgumentException("expectedTaskIds must be provided");
        }
        manifestRepository.saveExpected(assignmentId, learnerId, expectedTaskIds, clock.instant());
        invalidate(learnerId, assignmentId);
        log.info("Manifest for learner {} on {} now expects {} task(s)", learnerId, assignmentId, expectedTaskIds.size());
        return manifest(learnerId, assignmentId);
    }

    /**
     * Drops a task from the learner's expected set. Without a manifest, the observed tasks become the manifest first.
     */
    public AssignmentManifest excludeTask(String learnerId, String assignmentId, String taskId) {
        Set<String> expected = new TreeSet<>(manifestRepository.findExpected(assignmentId, learnerId)
                .orElseGet(() -> observedTaskIds(learnerId, assignmentId)));
        expected.remove(taskId);
        return registerManifest(assignmentId, learnerId, expected);
    }

    public WithdrawalAck withdraw(String assignmentId) {
        Instant withdrawnAt = manifestRepository.withdraw(assignmentId, clock.instant());
        cache.keySet().removeIf(k -> k.assignmentId().equals(assignmentId));
        events.publish(PipelineEventTypes.ASSIGNMENT_WITHDRAWN, null, null, assignmentId,
                Map.of("withdrawnAt", withdrawnAt.toString()));
        return new WithdrawalAck(assignmentId, withdrawnAt);
    }

    public AssignmentManifest manifest(String learnerId, String assignmentId) {
        Set<String> expected = manifestRepository.findExpected(assignmentId, learnerId).orElse(null);
        Instant withdrawnAt = manifestRepository.findWithdrawal(assignmentId).orElse(null);
        return new AssignmentManifest(learnerId, assignmentId, expected, withdrawnAt);
    }

    public BatchSummary batchSummary(String assignmentId) {
        SortedSet<String> learners = new TreeSet<>(outcomeRepository.findLearners(assignmentId));
        learners.addAll(manifestRepository.findLearners(assignmentId));

        List<LearnerSummary> rows = new ArrayList<>();
        int finals = 0;
        int passed = 0;
        int excellent = 0;
        int deadLettered = 0;
        double scoreSum = 0.0;
        int scored = 0;
        for (String learnerId : learners) {
            Report r = report(learnerId, assignmentId);
            rows.add(new LearnerSummary(learnerId, r.status(), r.overallScore(), r.band(), r.completeness()));
            if (r.status() == ReportStatus.FINAL) finals++;
            if (r.band() == PerformanceBand.EXCELLENT) excellent++;
            if (r.band() == PerformanceBand.EXCELLENT || r.band() == PerformanceBand.PASSED) passed++;
            if (r.overallScore() != null) {
                scoreSum += r.overallScore();
                scored++;
            }
            deadLettered += r.deadLetteredTaskIds().size();
        }
        int total = learners.size();
        return new BatchSummary(assignmentId, total, finals, total - finals,
                scored == 0 ? null : scoreSum / scored,
                finals == 0 ? 0.0 : (double) passed / finals,
                finals == 0 ? 0.0 : (double) excellent / finals,
                deadLettered, rows);
    }

    private Report compute(ReportKey key) {
        Set<String> stillDeadLettered = faultLedger.deadLetteredTaskIds(key.assignmentId());
        // a dead-lettered outcome the operator already resolved is pending again, not dead
        List<TaskOutcome> outcomes = outcomeRepository.findByLearnerAndAssignment(key.learnerId(), key.assignmentId()).stream()
                .filter(o -> o.status() != OutcomeStatus.DEAD_LETTERED || stillDeadLettered.contains(o.taskId()))
                .toList();
        Report report = aggregator.aggregate(key.learnerId(), key.assignmentId(), outcomes, manifest(key.learnerId(), key.assignmentId()));
        metrics.recordReportCompleteness(report.completeness());
        events.publish(PipelineEventTypes.REPORT_COMPUTED, null, key.learnerId(), key.assignmentId(), Map.of(
                "status", report.status().name(),
                "completeness", report.completeness(),
                "band", report.band().name()));
        return report;
    }

    private Set<String> observedTaskIds(String learnerId, String assignmentId) {
        Set<String> ids = new TreeSet<>();
        outcomeRepository.findByLearnerAndAssignment(learnerId, assignmentId).forEach(o -> ids.add(o.taskId()));
        return ids;
    }

    private record ReportKey(String learnerId, String assignmentId) {}
}

package com.ace.eval.aggregation;

import com.ace.eval.task.TaskModels.Dimension;

import java.time.Instant;
import java.util.*;

public class ReportModels {
    public enum ReportStatus {
        FINAL, PARTIAL
    }

    public enum PerformanceBand {
        EXCELLENT, PASSED, BELOW_PASSING, UNDETERMINED
    }

    // a null expected set means the observed tasks stand in for it
    public record AssignmentManifest(String learnerId, String assignmentId, Set<String> expectedTaskIds, Instant withdrawnAt) {
        public AssignmentManifest {
            expectedTaskIds = expectedTaskIds == null ? null : Collections.unmodifiableSortedSet(new TreeSet<>(expectedTaskIds));
        }

        public static AssignmentManifest unknown(String learnerId, String assignmentId) {
            return new AssignmentManifest(learnerId, assignmentId, null, null);
        }

        public boolean expectationKnown() {
            return expectedTaskIds != null;
        }

        public boolean withdrawn() {
            return withdrawnAt != null;
        }
    }

    public record DimensionScore(double score, double totalWeight, int contributors, Double meanConfidence) {}

    public record Report(
            String learnerId,
            String assignmentId,
            ReportStatus status,
            Map<Dimension, DimensionScore> dimensions,
            Set<Dimension> missingDimensions,
            Double overallScore,
            PerformanceBand band,
            double completeness,
            int succeededCount,
            int expectedCount,
            SortedSet<String> incompleteTaskIds,
            SortedSet<String> deadLetteredTaskIds,
            SortedSet<String> unexpectedTaskIds,
            boolean manifestKnown,
            boolean withdrawn,
            Instant asOf
    ) {}

    public record LearnerSummary(String learnerId, ReportStatus status, Double overallScore, PerformanceBand band, double completeness) {}

    public record BatchSummary(
            String assignmentId,
            int learners,
            int finalReports,
            int partialReports,
            Double averageOverallScore,
            double passRate,
            double excellenceRate,
            int deadLetteredTasks,
            List<LearnerSummary> rows
    ) {}

    public record ManifestRequest(Set<String> expectedTaskIds) {}

    public record WithdrawalAck(String assignmentId, Instant withdrawnAt) {}
}

package com.ace.eval.aggregation;

import com.ace.eval.aggregation.ReportModels.*;
import com.ace.eval.config.AceProperties;
import com.ace.eval.task.TaskModels.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Folds task outcomes into a learner report.
 * <p>
 * Pure: the report depends only on the arguments. Duplicate outcomes for a task collapse to one,
 * and contributions are summed in task id order, so any permutation or repetition of the input
 * gives the same report. Failed and dead-lettered tasks never contribute a score; they only lower completeness.
 */
@Component
public class ScoreAggregator {
    private static final Comparator<TaskOutcome> PREFERENCE = Comparator
            .comparingInt((TaskOutcome o) -> rank(o.status()))
            .thenComparingInt(TaskOutcome::attemptCount)
            .thenComparing(TaskOutcome::recordedAt)
            .thenComparing(o -> o.scoreVector() == null ? Instant.MIN : o.scoreVector().evaluatedAt(),
                    Comparator.nullsFirst(Comparator.naturalOrder()))
            // last resort for equal-looking outcomes with different content
            .thenComparing(TaskOutcome::toString);

    private final Map<Dimension, Double> dimensionWeights;
    private final double passingThreshold;
    private final double excellenceThreshold;

    @Autowired
    public ScoreAggregator(AceProperties properties) {
        this(properties.dimensionWeights(),
                properties.getScoring().getPassingThreshold(),
                properties.getScoring().getExcellenceThreshold());
    }

    public ScoreAggregator(Map<Dimension, Double> dimensionWeights, double passingThreshold, double excellenceThreshold) {
        if (passingThreshold > excellenceThreshold) {
            throw new IllegalArgumentException("Passing threshold exceeds excellence threshold");
        }
        this.dimensionWeights = dimensionWeights.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(dimensionWeights));
        this.passingThreshold = passingThreshold;
        this.excellenceThreshold = excellenceThreshold;
    }

    public Report aggregate(String learnerId, String assignmentId, Collection<TaskOutcome> outcomes, AssignmentManifest manifest) {
        AssignmentManifest scope = manifest == null ? AssignmentManifest.unknown(learnerId, assignmentId) : manifest;

        SortedMap<String, TaskOutcome> latest = new TreeMap<>();
        for (TaskOutcome o : outcomes) {
            if (o == null || !learnerId.equals(o.learnerId()) || !assignmentId.equals(o.assignmentId())) continue;
            if (scope.withdrawn() && !o.recordedAt().isBefore(scope.withdrawnAt())) continue;
            latest.merge(o.taskId(), o, (a, b) -> PREFERENCE.compare(a, b) >= 0 ? a : b);
        }

        Set<String> expected = scope.expectationKnown() ? scope.expectedTaskIds() : latest.keySet();
        SortedSet<String> unexpected = new TreeSet<>();
        SortedSet<String> deadLettered = new TreeSet<>();
        SortedSet<String> succeeded = new TreeSet<>();
        Map<Dimension, Accumulator> sums = new EnumMap<>(Dimension.class);
        Instant asOf = null;

        for (TaskOutcome o : latest.values()) {
            if (asOf == null || o.recordedAt().isAfter(asOf)) asOf = o.recordedAt();
            if (!expected.contains(o.taskId())) {
                unexpected.add(o.taskId());
                continue;
            }
            switch (o.status()) {
                case SUCCEEDED -> {
                    succeeded.add(o.taskId());
                    ScoreVector v = o.scoreVector();
                    v.scores().forEach((d, score) ->
                            sums.computeIfAbsent(d, k -> new Accumulator()).add(score, v.weights().get(d), v.confidence()));
                }
                case DEAD_LETTERED -> deadLettered.add(o.taskId());
                case FAILED -> { }
            }
        }

        SortedSet<String> incomplete = new TreeSet<>(expected);
        incomplete.removeAll(succeeded);
        double completeness = expected.isEmpty() ? 0.0 : (double) succeeded.size() / expected.size();
        boolean complete = scope.expectationKnown() && !scope.withdrawn() && !expected.isEmpty() && incomplete.isEmpty();
        ReportStatus status = complete ? ReportStatus.FINAL : ReportStatus.PARTIAL;

        Map<Dimension, DimensionScore> dimensions = new EnumMap<>(Dimension.class);
        sums.forEach((d, acc) -> dimensions.put(d, acc.toScore()));
        Set<Dimension> missing = EnumSet.allOf(Dimension.class);
        missing.removeAll(dimensions.keySet());

        Double overall = overall(dimensions);
        return new Report(learnerId, assignmentId, status,
                Collections.unmodifiableMap(dimensions), Collections.unmodifiableSet(missing),
                overall, band(status, overall), completeness, succeeded.size(), expected.size(),
                Collections.unmodifiableSortedSet(incomplete), Collections.unmodifiableSortedSet(deadLettered),
                Collections.unmodifiableSortedSet(unexpected), scope.expectationKnown(), scope.withdrawn(), asOf);
    }

    /** Weighted blend of the present dimensions, renormalised over those that were actually assessed. */
    private Double overall(Map<Dimension, DimensionScore> dimensions) {
        double weighted = 0.0;
        double weight = 0.0;
        for (var entry : dimensions.entrySet()) {
            double w = dimensionWeights.getOrDefault(entry.getKey(), 0.0);
            weighted += w * entry.getValue().score();
            weight += w;
        }
        return weight > 0.0 ? weighted / weight : null;
    }

    private PerformanceBand band(ReportStatus status, Double overall) {
        if (status == ReportStatus.PARTIAL || overall == null) return PerformanceBand.UNDETERMINED;
        if (overall >= excellenceThreshold) return PerformanceBand.EXCELLENT;
        if (overall >= passingThreshold) return PerformanceBand.PASSED;
        return PerformanceBand.BELOW_PASSING;
    }

    private static int rank(OutcomeStatus status) {
        return switch (status) {
            case SUCCEEDED -> 3;
            case DEAD_LETTERED -> 2;
            case FAILED -> 1;
        };
    }

    private static final class Accumulator {
        private double weightedSum;
        private double totalWeight;
        private int contributors;
        private double confidenceSum;
        private int confidenceCount;

        void add(double score, double weight, Double confidence) {
            weightedSum += score * weight;
            totalWeight += weight;
            contributors++;
            if (confidence != null) {
                confidenceSum += confidence;
                confidenceCount++;
            }
        }

        DimensionScore toScore() {
            double mean = Math.max(0.0, Math.min(1.0, weightedSum / totalWeight));
            return new DimensionScore(mean, totalWeight, contributors,
                    confidenceCount == 0 ? null : confidenceSum / confidenceCount);
        }
    }
}

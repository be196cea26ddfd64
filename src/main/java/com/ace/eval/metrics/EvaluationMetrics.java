package com.ace.eval.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class EvaluationMetrics {

    private final MeterRegistry registry;

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvaluation(String kind, String status, long ms) {
        Timer.builder("ace.evaluation.duration")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String kind, String failureType) {
        Counter.builder("ace.evaluation.retries")
                .tag("kind", kind)
                .tag("failure", failureType)
                .register(registry)
                .increment();
    }

    public void recordDeadLetter(String kind, String failureType) {
        Counter.builder("ace.evaluation.dead_letters")
                .tag("kind", kind)
                .tag("failure", failureType)
                .register(registry)
                .increment();
    }

    public void recordDuplicate(String kind) {
        Counter.builder("ace.evaluation.duplicates")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRejected(String lane) {
        Counter.builder("ace.dispatch.rejected")
                .tag("lane", lane)
                .register(registry)
                .increment();
    }

    public void recordReportCompleteness(double completeness) {
        DistributionSummary.builder("ace.report.completeness")
                .register(registry)
                .record(completeness);
    }
}

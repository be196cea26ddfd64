package com.ace.eval.execution;

import com.ace.eval.config.AceProperties;
import com.ace.eval.repository.TaskStateJdbcRepository;
import com.ace.eval.repository.TaskStateJdbcRepository.TaskStateRow;
import com.ace.eval.task.TaskModels.OutcomeStatus;
import com.ace.eval.task.TaskModels.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Recovers work the in-memory queues lost: retries that are overdue (for example after a restart)
 * and attempts whose worker died while holding the claim.
 */
@Component
public class RetrySweeper {
    private static final Logger log = LoggerFactory.getLogger(RetrySweeper.class);

    private final TaskStateJdbcRepository stateRepository;
    private final TaskDispatcher dispatcher;
    private final ExecutionCoordinator coordinator;
    private final AceProperties properties;
    private final Clock clock;

    public RetrySweeper(TaskStateJdbcRepository stateRepository, TaskDispatcher dispatcher, ExecutionCoordinator coordinator,
                        AceProperties properties, Clock clock) {
        this.stateRepository = stateRepository;
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${ace.execution.sweep-fixed-delay-ms:30000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return number of tasks put back on a queue
     */
    public int sweep() {
        Instant now = clock.instant();
        Duration grace = properties.getExecution().getSweepGrace();
        int requeued = 0;

        for (TaskStateRow row : stateRepository.findRetriesDueBefore(now.minus(grace))) {
            if (dispatcher.schedule(row.task(), now)) {
                requeued++;
            }
        }

        for (TaskStateRow row : stateRepository.findEvaluatingSince(now.minus(grace))) {
            Instant leaseEnd = row.updatedAt().plus(properties.timeoutFor(row.task().kind())).plus(grace);
            if (leaseEnd.isAfter(now)) continue;
            Optional<TaskOutcome> outcome = coordinator.expireClaim(row);
            if (outcome.filter(o -> o.status() == OutcomeStatus.FAILED).isPresent()) {
                if (dispatcher.schedule(row.task(), now)) {
                    requeued++;
                }
            }
        }
        if (requeued > 0) {
            log.info("Retry sweep re-queued {} task(s)", requeued);
        }
        return requeued;
    }
}

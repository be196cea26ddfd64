package com.ace.eval.ledger;

import com.ace.eval.ledger.LedgerModels.LedgerEntry;
import com.ace.eval.ledger.LedgerModels.LedgerTransition;
import com.ace.eval.repository.FaultLedgerJdbcRepository;
import com.ace.eval.task.TaskModels.OutcomeStatus;
import com.ace.eval.task.TaskModels.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Audit trail of every failed and dead-lettered attempt plus the operator actions that resolved them.
 * A task is dead-lettered while its latest entry is a dead-letter.
 */
@Service
public class FaultLedger {
    private static final Logger log = LoggerFactory.getLogger(FaultLedger.class);

    private final FaultLedgerJdbcRepository repository;

    public FaultLedger(FaultLedgerJdbcRepository repository) {
        this.repository = repository;
    }

    public void record(TaskOutcome outcome) {
        LedgerTransition transition = switch (outcome.status()) {
            case FAILED -> LedgerTransition.FAILED;
            case DEAD_LETTERED -> LedgerTransition.DEAD_LETTERED;
            case SUCCEEDED -> throw new IllegalArgumentException("Succeeded outcomes are not ledger entries: " + outcome.taskId());
        };
        repository.append(new LedgerEntry(null, outcome.taskId(), outcome.learnerId(), outcome.assignmentId(), outcome.kind(),
                transition, outcome.attemptCount(), outcome.failure(), outcome.recordedAt()));
        if (outcome.status() == OutcomeStatus.DEAD_LETTERED) {
            log.warn("Task {} dead-lettered after {} attempt(s): {} {}", outcome.taskId(), outcome.attemptCount(),
                    outcome.failure().type(), outcome.failure().message());
        }
    }

    public void recordResolution(LedgerEntry deadLetter, LedgerTransition transition, Instant at) {
        if (!transition.resolution()) {
            throw new IllegalArgumentException(transition + " is not an operator resolution");
        }
        repository.append(new LedgerEntry(null, deadLetter.taskId(), deadLetter.learnerId(), deadLetter.assignmentId(),
                deadLetter.kind(), transition, deadLetter.attemptCount(), null, at));
        log.info("Task {} resolved by operator: {}", deadLetter.taskId(), transition);
    }

    public List<LedgerEntry> listDeadLettered(String assignmentId) {
        return repository.currentDeadLetters(assignmentId == null || assignmentId.isBlank() ? null : assignmentId);
    }

    public Set<String> deadLetteredTaskIds(String assignmentId) {
        return listDeadLettered(assignmentId).stream().map(LedgerEntry::taskId).collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean isDeadLettered(String taskId) {
        return currentDeadLetter(taskId).isPresent();
    }

    public Optional<LedgerEntry> currentDeadLetter(String taskId) {
        return repository.latest(taskId).filter(e -> e.transition() == LedgerTransition.DEAD_LETTERED);
    }

    public List<LedgerEntry> history(String taskId) {
        return repository.history(taskId);
    }
}

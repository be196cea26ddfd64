package com.ace.eval.repository;

import com.ace.eval.ledger.LedgerModels.LedgerEntry;
import com.ace.eval.ledger.LedgerModels.LedgerTransition;
import com.ace.eval.task.TaskModels.FailureReason;
import com.ace.eval.task.TaskModels.FailureType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;

@Repository
public class FaultLedgerJdbcRepository {
    private static final String COLUMNS =
            "id, task_id, learner_id, assignment_id, kind, transition_type, attempt_count, failure_type, failure_message, failure_cause, recorded_at";

    private final JdbcTemplate jdbcTemplate;

    public FaultLedgerJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void append(LedgerEntry e) {
        FailureReason f = e.failure();
        jdbcTemplate.update(
                "INSERT INTO fault_ledger(task_id, learner_id, assignment_id, kind, transition_type, attempt_count, failure_type, failure_message, failure_cause, recorded_at) VALUES (?,?,?,?,?,?,?,?,?,?)",
                e.taskId(), e.learnerId(), e.assignmentId(), e.kind(), e.transition().name(), e.attemptCount(),
                f == null ? null : f.type().name(), f == null ? null : f.message(), f == null ? null : f.lastCause(),
                e.recordedAt().toString());
    }

    public List<LedgerEntry> history(String taskId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM fault_ledger WHERE task_id = ? ORDER BY id", rowMapper(), taskId);
    }

    public Optional<LedgerEntry> latest(String taskId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fault_ledger WHERE task_id = ? ORDER BY id DESC LIMIT 1", rowMapper(), taskId)
                .stream().findFirst();
    }

    public List<LedgerEntry> currentDeadLetters(String assignmentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fault_ledger f WHERE f.transition_type = ? AND (? IS NULL OR f.assignment_id = ?) " +
                        "AND f.id = (SELECT MAX(g.id) FROM fault_ledger g WHERE g.task_id = f.task_id) ORDER BY f.task_id",
                rowMapper(), LedgerTransition.DEAD_LETTERED.name(), assignmentId, assignmentId);
    }

    private RowMapper<LedgerEntry> rowMapper() {
        return (rs, n) -> {
            String failureType = rs.getString(8);
            FailureReason failure = failureType == null ? null
                    : new FailureReason(FailureType.valueOf(failureType), rs.getString(9), rs.getString(10));
            return new LedgerEntry(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                    LedgerTransition.valueOf(rs.getString(6)), rs.getInt(7), failure, Instant.parse(rs.getString(11)));
        };
    }
}

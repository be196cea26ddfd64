package com.ace.eval.repository;

import com.ace.eval.task.TaskModels.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;

@Repository
public class TaskOutcomeJdbcRepository {
    private static final String COLUMNS =
            "task_id, learner_id, assignment_id, kind, status, score_vector, failure_type, failure_message, failure_cause, attempt_count, recorded_at, next_attempt_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TaskOutcomeJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void save(TaskOutcome o) {
        FailureReason f = o.failure();
        jdbcTemplate.update(
                "MERGE INTO task_outcome(" + COLUMNS + ") KEY(task_id) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                o.taskId(), o.learnerId(), o.assignmentId(), o.kind(), o.status().name(),
                o.scoreVector() == null ? null : writeVector(o.scoreVector()),
                f == null ? null : f.type().name(), f == null ? null : f.message(), f == null ? null : f.lastCause(),
                o.attemptCount(), o.recordedAt().toString(),
                o.nextAttemptAt() == null ? null : o.nextAttemptAt().toString());
    }

    public Optional<TaskOutcome> find(String taskId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM task_outcome WHERE task_id = ?", rowMapper(), taskId)
                .stream().findFirst();
    }

    public List<TaskOutcome> findByLearnerAndAssignment(String learnerId, String assignmentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM task_outcome WHERE learner_id = ? AND assignment_id = ? ORDER BY task_id",
                rowMapper(), learnerId, assignmentId);
    }

    public List<String> findLearners(String assignmentId) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT learner_id FROM task_outcome WHERE assignment_id = ? ORDER BY learner_id",
                String.class, assignmentId);
    }

    private RowMapper<TaskOutcome> rowMapper() {
        return (rs, n) -> {
            String failureType = rs.getString(7);
            FailureReason failure = failureType == null ? null
                    : new FailureReason(FailureType.valueOf(failureType), rs.getString(8), rs.getString(9));
            String vector = rs.getString(6);
            String nextAttempt = rs.getString(12);
            return new TaskOutcome(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                    OutcomeStatus.valueOf(rs.getString(5)), vector == null ? null : readVector(vector), failure,
                    rs.getInt(10), Instant.parse(rs.getString(11)), nextAttempt == null ? null : Instant.parse(nextAttempt));
        };
    }

    private String writeVector(ScoreVector vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Score vector for " + vector.taskId() + " is not serializable", e);
        }
    }

    private ScoreVector readVector(String json) {
        try {
            return objectMapper.readValue(json, ScoreVector.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored score vector is corrupt: " + e.getOriginalMessage(), e);
        }
    }
}

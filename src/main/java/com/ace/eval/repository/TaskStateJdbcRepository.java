package com.ace.eval.repository;

import com.ace.eval.execution.ExecutionModels.TaskState;
import com.ace.eval.task.TaskModels.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;

@Repository
public class TaskStateJdbcRepository {
    private static final String COLUMNS =
            "task_id, learner_id, assignment_id, kind, rubric_ref, submission_id, payload, status, attempt_count, next_attempt_at, updated_at";
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TaskStateJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean insertPending(Task task, Instant now) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO task_state(task_id, learner_id, assignment_id, kind, rubric_ref, submission_id, payload, status, attempt_count, next_attempt_at, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                    task.taskId(), task.learnerId(), task.assignmentId(), task.kind(), task.rubricRef(), task.submissionId(),
                    writePayload(task.payload()), TaskState.PENDING.name(), 0, null, now.toEpochMilli(), now.toEpochMilli());
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public boolean claim(String taskId, Instant now) {
        return jdbcTemplate.update(
                "UPDATE task_state SET status = ?, attempt_count = attempt_count + 1, next_attempt_at = NULL, updated_at = ? WHERE task_id = ? AND status IN (?, ?)",
                TaskState.EVALUATING.name(), now.toEpochMilli(), taskId, TaskState.PENDING.name(), TaskState.FAILED.name()) == 1;
    }

    // the attempt number fences out a worker whose lease was reclaimed
    public boolean complete(String taskId, int attempt, TaskState to, Instant nextAttemptAt, Instant now) {
        return jdbcTemplate.update(
                "UPDATE task_state SET status = ?, next_attempt_at = ?, updated_at = ? WHERE task_id = ? AND status = ? AND attempt_count = ?",
                to.name(), nextAttemptAt == null ? null : nextAttemptAt.toEpochMilli(), now.toEpochMilli(),
                taskId, TaskState.EVALUATING.name(), attempt) == 1;
    }

    public boolean transition(String taskId, TaskState from, TaskState to, Instant now) {
        return jdbcTemplate.update(
                "UPDATE task_state SET status = ?, next_attempt_at = NULL, updated_at = ? WHERE task_id = ? AND status = ?",
                to.name(), now.toEpochMilli(), taskId, from.name()) == 1;
    }

    public boolean resetForResubmission(String taskId, Instant now) {
        return jdbcTemplate.update(
                "UPDATE task_state SET status = ?, attempt_count = 0, next_attempt_at = NULL, updated_at = ? WHERE task_id = ? AND status = ?",
                TaskState.PENDING.name(), now.toEpochMilli(), taskId, TaskState.DEAD_LETTERED.name()) == 1;
    }

    public Optional<TaskStateRow> find(String taskId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM task_state WHERE task_id = ?", rowMapper(), taskId)
                .stream().findFirst();
    }

    public List<TaskStateRow> findRetriesDueBefore(Instant cutoff) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM task_state WHERE status = ? AND next_attempt_at <= ? ORDER BY next_attempt_at",
                rowMapper(), TaskState.FAILED.name(), cutoff.toEpochMilli());
    }

    public List<TaskStateRow> findEvaluatingSince(Instant cutoff) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM task_state WHERE status = ? AND updated_at <= ? ORDER BY updated_at",
                rowMapper(), TaskState.EVALUATING.name(), cutoff.toEpochMilli());
    }

    private RowMapper<TaskStateRow> rowMapper() {
        return (rs, n) -> {
            long nextAttempt = rs.getLong(10);
            Instant nextAttemptAt = rs.wasNull() ? null : Instant.ofEpochMilli(nextAttempt);
            Task task = new Task(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                    readPayload(rs.getString(7)), rs.getString(5), rs.getString(6));
            return new TaskStateRow(task, TaskState.valueOf(rs.getString(8)), rs.getInt(9),
                    nextAttemptAt, Instant.ofEpochMilli(rs.getLong(11)));
        };
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored task payload is corrupt: " + e.getOriginalMessage(), e);
        }
    }

    public record TaskStateRow(Task task, TaskState status, int attemptCount, Instant nextAttemptAt, Instant updatedAt) {
        public String taskId() {
            return task.taskId();
        }
    }
}

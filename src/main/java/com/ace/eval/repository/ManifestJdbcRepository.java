package com.ace.eval.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Repository
public class ManifestJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ManifestJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveExpected(String assignmentId, String learnerId, Set<String> expectedTaskIds, Instant now) {
        jdbcTemplate.update(
                "MERGE INTO assignment_manifest(assignment_id, learner_id, expected_task_ids, updated_at) KEY(assignment_id, learner_id) VALUES (?,?,?,?)",
                assignmentId, learnerId, String.join("\n", new TreeSet<>(expectedTaskIds)), now.toString());
    }

    public Optional<Set<String>> findExpected(String assignmentId, String learnerId) {
        return jdbcTemplate.query(
                "SELECT expected_task_ids FROM assignment_manifest WHERE assignment_id = ? AND learner_id = ?",
                (rs, n) -> parseIds(rs.getString(1)),
                assignmentId, learnerId).stream().findFirst();
    }

    public List<String> findLearners(String assignmentId) {
        return jdbcTemplate.queryForList(
                "SELECT learner_id FROM assignment_manifest WHERE assignment_id = ? ORDER BY learner_id",
                String.class, assignmentId);
    }

    // keeps the earliest withdrawal
    public Instant withdraw(String assignmentId, Instant at) {
        Optional<Instant> existing = findWithdrawal(assignmentId);
        if (existing.isPresent()) return existing.get();
        jdbcTemplate.update("MERGE INTO assignment_withdrawal(assignment_id, withdrawn_at) KEY(assignment_id) VALUES (?,?)",
                assignmentId, at.toString());
        return at;
    }

    public Optional<Instant> findWithdrawal(String assignmentId) {
        return jdbcTemplate.query("SELECT withdrawn_at FROM assignment_withdrawal WHERE assignment_id = ?",
                (rs, n) -> Instant.parse(rs.getString(1)), assignmentId).stream().findFirst();
    }

    private Set<String> parseIds(String value) {
        if (value == null || value.isBlank()) return Set.of();
        return Arrays.stream(value.split("\n"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }
}

package com.ace.eval.evaluator;

import com.ace.eval.task.TaskModels.Task;

import java.util.*;

/**
 * Typed reads from a task payload. Anything malformed is a schema error.
 */
final class Payloads {
    private Payloads() {
    }

    static String requiredText(Task task, String field) {
        return optionalText(task.payload(), field)
                .orElseThrow(() -> EvaluationException.schemaError("Task " + task.taskId() + " is missing '" + field + "'"));
    }

    static Optional<String> optionalText(Map<String, Object> source, String... aliases) {
        for (String field : aliases) {
            Object value = source.get(field);
            if (value != null && !String.valueOf(value).isBlank()) {
                return Optional.of(String.valueOf(value));
            }
        }
        return Optional.empty();
    }

    static Optional<Double> optionalNumber(Task task, String field) {
        Object value = task.payload().get(field);
        if (value == null) return Optional.empty();
        if (value instanceof Number n) return Optional.of(n.doubleValue());
        try {
            return Optional.of(Double.parseDouble(String.valueOf(value).trim()));
        } catch (NumberFormatException e) {
            throw EvaluationException.schemaError("Task " + task.taskId() + " has non-numeric '" + field + "': " + value);
        }
    }

    static Optional<List<Map<String, Object>>> optionalItems(Task task, String field) {
        Object value = task.payload().get(field);
        if (value == null) return Optional.empty();
        if (!(value instanceof List<?> list)) {
            throw EvaluationException.schemaError("Task " + task.taskId() + " has '" + field + "' that is not a list");
        }
        List<Map<String, Object>> items = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> entry)) {
                throw EvaluationException.schemaError("Task " + task.taskId() + " has a malformed entry in '" + field + "'");
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            entry.forEach((k, v) -> copy.put(String.valueOf(k), v));
            items.add(copy);
        }
        return Optional.of(items);
    }
}

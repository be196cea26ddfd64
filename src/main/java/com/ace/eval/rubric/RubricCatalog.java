package com.ace.eval.rubric;

import com.ace.eval.config.AceProperties;
import com.ace.eval.task.TaskModels.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RubricCatalog {
    private static final Logger log = LoggerFactory.getLogger(RubricCatalog.class);

    private final Map<String, Rubric> rubrics = new ConcurrentHashMap<>();

    public RubricCatalog(AceProperties properties) {
        properties.getRubrics().forEach((ref, table) -> register(fromTable(ref, table)));
        log.info("Loaded {} rubric(s): {}", rubrics.size(), new TreeSet<>(rubrics.keySet()));
    }

    public Optional<Rubric> find(String ref) {
        if (ref == null || ref.isBlank()) return Optional.empty();
        return Optional.ofNullable(rubrics.get(ref));
    }

    public void register(Rubric rubric) {
        Rubric previous = rubrics.put(rubric.ref(), rubric);
        if (previous != null) {
            log.info("Replaced rubric {}: {} -> {}", rubric.ref(), previous.weights(), rubric.weights());
        }
    }

    static Rubric fromTable(String ref, Map<String, Double> table) {
        Map<Dimension, Double> weights = new EnumMap<>(Dimension.class);
        table.forEach((name, weight) -> weights.put(Dimension.parse(name), weight));
        return new Rubric(ref, weights);
    }
}

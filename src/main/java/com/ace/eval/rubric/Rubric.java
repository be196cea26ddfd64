package com.ace.eval.rubric;

import com.ace.eval.task.TaskModels.Dimension;

import java.util.*;

/**
 * Weight table for one rubric reference. Declared dimensions are exactly the weight keys.
 */
public record Rubric(String ref, Map<Dimension, Double> weights) {
    public Rubric {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Rubric ref must not be blank");
        }
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("Rubric " + ref + " declares no dimensions");
        }
        weights.forEach((d, w) -> {
            if (w == null || !(w > 0.0) || w.isInfinite()) {
                throw new IllegalArgumentException("Rubric " + ref + " has non-positive weight for " + d);
            }
        });
        weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    public Set<Dimension> declared() {
        return weights.keySet();
    }

    public boolean declares(Dimension dimension) {
        return weights.containsKey(dimension);
    }

    public Map<Dimension, Double> weightsFor(Collection<Dimension> dimensions) {
        Map<Dimension, Double> out = new EnumMap<>(Dimension.class);
        dimensions.forEach(d -> out.put(d, weights.get(d)));
        return out;
    }
}

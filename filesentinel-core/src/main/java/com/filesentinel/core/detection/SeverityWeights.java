package com.filesentinel.core.detection;

import com.filesentinel.core.model.Severity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Multipliers applied to each threat's confidence when computing the risk
 * score. Must not decrease with severity, otherwise a more severe finding
 * could lower the score.
 */
public final class SeverityWeights {

    private final Map<Severity, Double> weights;

    private SeverityWeights(Map<Severity, Double> weights) {
        this.weights = weights;
    }

    /** CRITICAL 1.5, HIGH 1.2, MEDIUM 1.0, LOW 0.8, INFO 0.5. */
    public static SeverityWeights defaults() {
        Map<Severity, Double> w = new EnumMap<>(Severity.class);
        w.put(Severity.INFO, 0.5);
        w.put(Severity.LOW, 0.8);
        w.put(Severity.MEDIUM, 1.0);
        w.put(Severity.HIGH, 1.2);
        w.put(Severity.CRITICAL, 1.5);
        return new SeverityWeights(w);
    }

    public static SeverityWeights of(Map<Severity, Double> weights) {
        Map<Severity, Double> w = new EnumMap<>(Severity.class);
        double previous = 0;
        for (Severity severity : Severity.values()) {
            Double weight = weights.get(severity);
            if (weight == null)
                throw new IllegalArgumentException("Missing weight for " + severity);
            if (weight < previous)
                throw new IllegalArgumentException("Weight for " + severity + " (" + weight
                        + ") is lower than the weight of a less severe tier");
            w.put(severity, weight);
            previous = weight;
        }
        return new SeverityWeights(w);
    }

    public double weight(Severity severity) {
        return weights.get(severity);
    }
}

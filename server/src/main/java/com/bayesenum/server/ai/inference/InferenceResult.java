package com.bayesenum.server.ai.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class InferenceResult {
    private final String queryVariable;
    private final Map<String, String> evidence;
    private final Map<String, Double> distribution;
    private final String mostLikelyValue;
    private final String engineUsed;

    public InferenceResult(String queryVariable, Map<String, String> evidence, Map<String, Double> distribution,
            String engineUsed) {
        this.queryVariable = queryVariable;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        this.distribution = Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
        this.mostLikelyValue = MathUtil.argmax(distribution);
        this.engineUsed = engineUsed;
    }

    public String getQueryVariable() {
        return queryVariable;
    }

    public Map<String, String> getEvidence() {
        return evidence;
    }

    /** Posterior per query value, in the variable's domain order. */
    public Map<String, Double> getDistribution() {
        return distribution;
    }

    public double probability(String value) {
        return distribution.getOrDefault(value, 0.0);
    }

    public String getMostLikelyValue() {
        return mostLikelyValue;
    }

    public double getMostLikelyProbability() {
        return mostLikelyValue != null ? distribution.get(mostLikelyValue) : 0.0;
    }

    /** Entropy of the posterior in nats; 0 when one value is certain. */
    public double getEntropy() {
        return MathUtil.entropy(distribution);
    }

    public String getEngineUsed() {
        return engineUsed;
    }

    @Override
    public String toString() {
        return "InferenceResult{" +
                "query=" + queryVariable +
                ", evidence=" + evidence +
                ", mostLikely=" + mostLikelyValue
                + (mostLikelyValue != null ? String.format(" (%.4f)", getMostLikelyProbability()) : "") +
                ", engine='" + engineUsed + '\'' +
                '}';
    }
}

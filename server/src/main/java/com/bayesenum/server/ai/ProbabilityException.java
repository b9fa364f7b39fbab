package com.bayesenum.server.ai;

import java.util.List;

/**
 * A CPT row is not a distribution: an entry lies outside [0, 1] or the row
 * does not sum to 1.
 */
public class ProbabilityException extends BayesNetworkException {
    private final String node;
    private final List<String> parentValues;
    private final String value;
    private final double sum;

    public ProbabilityException(String node, List<String> parentValues, double sum) {
        this(String.format("CPT row for node %s with parents %s does not sum to 1 (sum=%.6f)",
                node, parentValues, sum), node, parentValues, null, sum);
    }

    private ProbabilityException(String message, String node, List<String> parentValues, String value, double sum) {
        super(message);
        this.node = node;
        this.parentValues = parentValues;
        this.value = value;
        this.sum = sum;
    }

    public static ProbabilityException outOfRange(String node, List<String> parentValues, String value,
                                                  double probability) {
        return new ProbabilityException(String.format(
                "CPT row for node %s with parents %s gives %s probability %s, outside [0, 1]",
                node, parentValues, value, probability), node, parentValues, value, Double.NaN);
    }

    public String getNode() {
        return node;
    }

    public List<String> getParentValues() {
        return parentValues;
    }

    /** The offending value for an out-of-range entry, otherwise null. */
    public String getValue() {
        return value;
    }

    /** Row total; NaN for an out-of-range entry. */
    public double getSum() {
        return sum;
    }
}

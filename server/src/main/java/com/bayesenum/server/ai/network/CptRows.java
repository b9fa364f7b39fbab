package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.ProbabilityException;
import com.bayesenum.server.ai.StructuralException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

final class CptRows {

    static final double SUM_TOLERANCE = 1e-6;

    private CptRows() {
    }

    static double sum(Map<String, Double> row) {
        double total = 0.0;
        for (double p : row.values()) {
            total += p;
        }
        return total;
    }

    static boolean sumsToOne(double total) {
        return Math.abs(total - 1.0) <= SUM_TOLERANCE;
    }

    static boolean inRange(Double p) {
        return p != null && p >= 0.0 && p <= 1.0;
    }

    /**
     * A row must cover exactly the node's domain, hold only probabilities in
     * [0, 1] and sum to 1. The domain check is skipped while the domain is still
     * undeclared.
     */
    static void check(String node, List<String> parentValues, Map<String, Double> row, List<String> domain) {
        if (!domain.isEmpty() && !new HashSet<>(domain).equals(row.keySet())) {
            throw new StructuralException(StructuralException.Kind.DOMAIN_MISMATCH,
                    "CPT row for node " + node + " with parents " + parentValues + " covers " + row.keySet()
                            + " but the domain is " + domain);
        }
        for (Map.Entry<String, Double> entry : row.entrySet()) {
            if (!inRange(entry.getValue())) {
                throw ProbabilityException.outOfRange(node, parentValues, entry.getKey(),
                        entry.getValue() == null ? Double.NaN : entry.getValue());
            }
        }
        double total = sum(row);
        if (!sumsToOne(total)) {
            throw new ProbabilityException(node, parentValues, total);
        }
    }
}

package com.bayesenum.server.ai.inference;

import java.util.LinkedHashMap;
import java.util.Map;

public class MathUtil {

    public static double sum(Map<String, Double> scores) {
        double total = 0.0;
        for (double s : scores.values()) {
            total += s;
        }
        return total;
    }

    /**
     * Divides every score by {@code total}, keeping key order.
     * The caller must rule out a zero total.
     */
    public static Map<String, Double> normalize(Map<String, Double> scores, double total) {
        if (total == 0.0) {
            throw new IllegalArgumentException("Cannot normalize scores with a zero total");
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            normalized.put(e.getKey(), e.getValue() / total);
        }
        return normalized;
    }

    /**
     * Returns the key with the largest value; the first one wins ties.
     * Null for an empty map.
     */
    public static String argmax(Map<String, Double> x) {
        String bestKey = null;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : x.entrySet()) {
            if (e.getValue() > bestVal) {
                bestVal = e.getValue();
                bestKey = e.getKey();
            }
        }
        return bestKey;
    }

    /**
     * Shannon entropy (natural log) of a distribution.
     * H(p) = -sum(p_i * log(p_i))
     */
    public static double entropy(Map<String, Double> probs) {
        double h = 0.0;
        for (double p : probs.values()) {
            if (p > 1e-12) {
                h -= p * Math.log(p);
            }
        }
        return h;
    }
}

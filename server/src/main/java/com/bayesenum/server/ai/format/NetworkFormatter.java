package com.bayesenum.server.ai.format;

import com.bayesenum.server.ai.inference.InferenceResult;
import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.ai.network.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of a network, its tables and query results.
 */
public final class NetworkFormatter {

    private static final String RULE = "=".repeat(50);
    private static final String WIDE_RULE = "=".repeat(60);
    private static final String NONE = "none";

    private NetworkFormatter() {
    }

    public static String structure(BayesianNetwork network) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("BAYESIAN NETWORK STRUCTURE").append('\n');
        sb.append(RULE).append('\n');
        sb.append("Root nodes: ").append(joinOrNone(network.roots())).append("\n\n");

        for (String name : network.topologicalOrder()) {
            Node node = network.getNode(name);
            sb.append("NODE: ").append(name).append('\n');
            sb.append("  Parents:  ").append(joinOrNone(node.getParents())).append('\n');
            sb.append("  Children: ").append(joinOrNone(network.children(name))).append('\n');
            sb.append("  Values:   ").append(String.join(", ", node.getValues())).append("\n\n");
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    public static String cpts(BayesianNetwork network) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("CONDITIONAL PROBABILITY TABLES").append('\n');
        sb.append(RULE).append('\n');
        for (String name : network.topologicalOrder()) {
            sb.append('\n').append(cpt(network.getNode(name)));
        }
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    public static String cpt(Node node) {
        StringBuilder sb = new StringBuilder();
        sb.append("--- Node: ").append(node.getName()).append(" ---\n");
        sb.append("Values: ").append(String.join(", ", node.getValues())).append('\n');

        if (node.isRoot()) {
            Map<String, Double> row = node.getCpt().getOrDefault(List.of(), Map.of());
            sb.append("Probabilities:\n");
            for (String value : node.getValues()) {
                sb.append(String.format(Locale.ROOT, "  P(%s=%s) = %.4f\n", node.getName(), value,
                        row.getOrDefault(value, 0.0)));
            }
            return sb.toString();
        }

        sb.append("Parents: ").append(String.join(", ", node.getParents())).append("\n\n");
        String parentHeader = String.join(" | ", node.getParents());
        String valueHeader = String.join(" | ", node.getValues());
        sb.append(parentHeader).append(" || ").append(valueHeader).append('\n');
        sb.append("-".repeat(parentHeader.length() + valueHeader.length() + 4)).append('\n');

        for (Map.Entry<List<String>, Map<String, Double>> row : node.getCpt().entrySet()) {
            List<String> probs = new ArrayList<>();
            for (String value : node.getValues()) {
                probs.add(String.format(Locale.ROOT, "%.4f", row.getValue().getOrDefault(value, 0.0)));
            }
            sb.append(String.join(" | ", row.getKey())).append(" || ").append(String.join(" | ", probs))
                    .append('\n');
        }
        return sb.toString();
    }

    public static String evidence(Map<String, String> evidence) {
        if (evidence.isEmpty()) {
            return "no evidence";
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> e : evidence.entrySet()) {
            parts.add(e.getKey() + "=" + e.getValue());
        }
        return String.join(", ", parts);
    }

    public static String result(InferenceResult result) {
        String q = result.getQueryVariable();
        StringBuilder sb = new StringBuilder();
        sb.append(WIDE_RULE).append('\n');
        sb.append("INFERENCE RESULT").append('\n');
        sb.append(WIDE_RULE).append('\n');
        sb.append("Distribution of ").append(q).append(" given: ").append(evidence(result.getEvidence()))
                .append('\n');
        sb.append("-".repeat(60)).append('\n');
        for (Map.Entry<String, Double> e : result.getDistribution().entrySet()) {
            sb.append(String.format(Locale.ROOT, "  P(%s=%s | evidence) = %.6f\n", q, e.getKey(), e.getValue()));
        }
        sb.append("-".repeat(60)).append('\n');
        sb.append(String.format(Locale.ROOT, "Most likely: %s=%s with probability %.6f\n", q,
                result.getMostLikelyValue(), result.getMostLikelyProbability()));
        sb.append(WIDE_RULE).append('\n');
        return sb.toString();
    }

    private static String joinOrNone(List<String> names) {
        return names.isEmpty() ? NONE : String.join(", ", names);
    }
}

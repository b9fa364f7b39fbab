package com.bayesenum.server.ai.inference;

import com.bayesenum.server.ai.DegenerateEvidenceException;
import com.bayesenum.server.ai.InferenceCancelledException;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceEvent;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceListener;
import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.ai.network.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact inference by enumeration (ENUMERATION-ASK, Russell and Norvig).
 * <p>
 * Every hidden variable forks the recursion once per domain value, so the cost
 * is the product of the hidden variables' domain sizes. Recursion depth equals
 * the number of variables.
 * <p>
 * Stateless apart from the network it was built with; safe to share between
 * threads.
 */
public class EnumerationInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(EnumerationInferenceEngine.class);

    public static final String NAME = "enumeration";

    private final BayesianNetwork network;

    public EnumerationInferenceEngine(BayesianNetwork network) {
        this.network = network;
    }

    public BayesianNetwork getNetwork() {
        return network;
    }

    /** Posterior distribution only, without tracing. */
    public Map<String, Double> ask(String queryVariable, Map<String, String> evidence) {
        return infer(queryVariable, evidence, EnumerationTraceListener.NONE).getDistribution();
    }

    /**
     * @throws com.bayesenum.server.ai.UnknownVariableException     if the query variable is not in the network
     * @throws com.bayesenum.server.ai.CptLookupException           if an evidence value is outside its domain
     * @throws DegenerateEvidenceException                          if the evidence has zero probability
     * @throws InferenceCancelledException                          if the thread is interrupted between query values
     */
    @Override
    public InferenceResult infer(String queryVariable, Map<String, String> evidence, EnumerationTraceListener trace) {
        Node queryNode = network.getNode(queryVariable);
        EnumerationTraceListener listener = trace != null ? trace : EnumerationTraceListener.NONE;

        if (logger.isDebugEnabled()) {
            for (String name : evidence.keySet()) {
                if (!network.hasNode(name)) {
                    logger.debug("Ignoring evidence on unknown variable {}", name);
                }
            }
        }

        List<String> order = network.topologicalOrder();
        Map<String, Double> raw = new LinkedHashMap<>();

        for (String value : queryNode.getValues()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InferenceCancelledException(queryVariable);
            }
            Map<String, String> extended = new HashMap<>(evidence);
            extended.put(queryVariable, value);

            emit(listener, EnumerationTraceEvent.Type.QUERY_VALUE, 0, queryVariable, value, 0.0);
            double score = enumerateAll(order, 0, extended, listener, 1);
            raw.put(value, score);
            emit(listener, EnumerationTraceEvent.Type.UNNORMALIZED, 0, queryVariable, value, score);
        }

        double total = MathUtil.sum(raw);
        if (total == 0.0) {
            throw new DegenerateEvidenceException(queryVariable, evidence);
        }
        Map<String, Double> distribution = MathUtil.normalize(raw, total);

        if (listener.isEnabled()) {
            for (Map.Entry<String, Double> e : distribution.entrySet()) {
                emit(listener, EnumerationTraceEvent.Type.NORMALIZED, 0, queryVariable, e.getKey(), e.getValue());
            }
        }
        logger.debug("P({} | {}) = {}", queryVariable, evidence, distribution);
        return new InferenceResult(queryVariable, evidence, distribution, NAME);
    }

    /**
     * Joint probability of {@code assignment} summed over every variable of
     * {@code variables} it leaves unbound. {@code variables} must list parents
     * before children.
     */
    public double enumerateAll(List<String> variables, Map<String, String> assignment) {
        return enumerateAll(variables, 0, new HashMap<>(assignment), EnumerationTraceListener.NONE, 1);
    }

    private double enumerateAll(List<String> variables, int from, Map<String, String> assignment,
            EnumerationTraceListener listener, int depth) {
        if (from == variables.size()) {
            return 1.0;
        }

        String name = variables.get(from);
        Node node = network.getNode(name);
        Map<String, String> parentAssignment = new HashMap<>();
        for (String p : node.getParents()) {
            String v = assignment.get(p);
            if (v != null) {
                parentAssignment.put(p, v);
            }
        }

        String bound = assignment.get(name);
        if (bound != null) {
            double p = node.probability(bound, parentAssignment);
            emit(listener, EnumerationTraceEvent.Type.OBSERVED, depth, name, bound, p);
            return p * enumerateAll(variables, from + 1, assignment, listener, depth + 1);
        }

        emit(listener, EnumerationTraceEvent.Type.HIDDEN, depth, name, null, 0.0);
        double total = 0.0;
        for (String value : node.getValues()) {
            double p = node.probability(value, parentAssignment);
            emit(listener, EnumerationTraceEvent.Type.HIDDEN_VALUE, depth, name, value, p);

            assignment.put(name, value);
            double subtotal;
            try {
                subtotal = p * enumerateAll(variables, from + 1, assignment, listener, depth + 1);
            } finally {
                assignment.remove(name);
            }
            total += subtotal;
            emit(listener, EnumerationTraceEvent.Type.HIDDEN_SUBTOTAL, depth, name, value, subtotal);
        }
        emit(listener, EnumerationTraceEvent.Type.HIDDEN_TOTAL, depth, name, null, total);
        return total;
    }

    private static void emit(EnumerationTraceListener listener, EnumerationTraceEvent.Type type, int depth,
            String variable, String value, double amount) {
        if (listener.isEnabled()) {
            listener.onEvent(new EnumerationTraceEvent(type, depth, variable, value, amount));
        }
    }
}

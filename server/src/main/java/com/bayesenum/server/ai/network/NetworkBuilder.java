package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.StructuralException;
import com.bayesenum.server.ai.UnknownVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable construction phase of a Bayesian network.
 * <p>
 * Nodes are created lazily the first time an edge or a domain names them and
 * keep their creation order, which is also the tie-break order of the
 * topological sort. {@link #validate()} checks the whole network and returns an
 * immutable {@link BayesianNetwork}; the builder itself is left untouched, so
 * validation can be repeated.
 * <p>
 * Not thread-safe.
 */
public class NetworkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(NetworkBuilder.class);

    private static final class Draft {
        final String name;
        List<String> values = new ArrayList<>();
        final List<String> parents = new ArrayList<>();
        final Map<List<String>, Map<String, Double>> cpt = new LinkedHashMap<>();

        Draft(String name) {
            this.name = name;
        }
    }

    private final Map<String, Draft> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();

    private Draft getOrCreate(String name) {
        return nodes.computeIfAbsent(name, Draft::new);
    }

    private Draft require(String name) {
        Draft draft = nodes.get(name);
        if (draft == null) {
            throw new UnknownVariableException(name);
        }
        return draft;
    }

    /**
     * Records {@code parent -> child}. Unknown endpoints are created with an
     * empty domain; an edge that already exists is not duplicated.
     */
    public NetworkBuilder addEdge(String parent, String child) {
        getOrCreate(parent);
        Draft c = getOrCreate(child);

        if (!c.parents.contains(parent)) {
            c.parents.add(parent);
        }
        List<String> kids = children.computeIfAbsent(parent, k -> new ArrayList<>());
        if (!kids.contains(child)) {
            kids.add(child);
        }
        return this;
    }

    /** Declares or replaces a node's domain; value order is kept. */
    public NetworkBuilder setDomain(String name, List<String> values) {
        getOrCreate(name).values = new ArrayList<>(values);
        return this;
    }

    /**
     * Stores one CPT row, replacing any previous row for the same parent tuple.
     *
     * @param parentValues parent values in the node's parent order, empty for a root
     * @param valueProbs   probability per own value
     * @throws com.bayesenum.server.ai.ProbabilityException if an entry is outside [0, 1] or the row does
     *                                  not sum to 1 within 1e-6
     * @throws StructuralException      if the row's values differ from a declared domain
     * @throws UnknownVariableException if the node was never declared
     */
    public NetworkBuilder setCptRow(String name, List<String> parentValues, Map<String, Double> valueProbs) {
        Draft draft = require(name);
        CptRows.check(name, List.copyOf(parentValues), valueProbs, draft.values);
        draft.cpt.put(List.copyOf(parentValues), new LinkedHashMap<>(valueProbs));
        return this;
    }

    /**
     * Stores a CPT row without any checks. {@link #validate()} still rejects
     * the network if the row is not a distribution over the node's domain.
     */
    public NetworkBuilder putCptRowUnchecked(String name, List<String> parentValues, Map<String, Double> valueProbs) {
        require(name).cpt.put(List.copyOf(parentValues), new LinkedHashMap<>(valueProbs));
        return this;
    }

    public boolean hasNode(String name) {
        return nodes.containsKey(name);
    }

    public List<String> nodeNames() {
        return List.copyOf(nodes.keySet());
    }

    public List<String> parentsOf(String name) {
        return Collections.unmodifiableList(require(name).parents);
    }

    public List<String> childrenOf(String name) {
        require(name);
        return Collections.unmodifiableList(children.getOrDefault(name, List.of()));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Kahn's algorithm over the current structure.
     *
     * @throws StructuralException of kind {@code CYCLE} if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        return TopologicalOrder.compute(parentLists(), children);
    }

    private Map<String, List<String>> parentLists() {
        Map<String, List<String>> parents = new LinkedHashMap<>();
        for (Draft d : nodes.values()) {
            parents.put(d.name, d.parents);
        }
        return parents;
    }

    /**
     * Checks every node in creation order and fails on the first problem:
     * an empty domain, a parent combination without a CPT row, a root without
     * its empty-key row, or a row that is not a distribution over the node's
     * domain. Finally the graph must
     * be acyclic.
     *
     * @return an immutable snapshot of the validated network
     */
    public BayesianNetwork validate() {
        for (Draft node : nodes.values()) {
            if (node.values.isEmpty()) {
                throw new StructuralException(StructuralException.Kind.EMPTY_DOMAIN,
                        "Node " + node.name + " has no declared domain");
            }

            if (!node.parents.isEmpty()) {
                for (List<String> combination : parentCombinations(node)) {
                    if (!node.cpt.containsKey(combination)) {
                        throw new StructuralException(StructuralException.Kind.MISSING_CPT_ROW,
                                "Missing CPT entry for node " + node.name + " with parents " + node.parents
                                        + " = " + combination);
                    }
                }
            } else if (!node.cpt.containsKey(List.of())) {
                throw new StructuralException(StructuralException.Kind.MISSING_ROOT_CPT,
                        "Missing CPT for root node " + node.name);
            }

            for (Map.Entry<List<String>, Map<String, Double>> row : node.cpt.entrySet()) {
                CptRows.check(node.name, row.getKey(), row.getValue(), node.values);
            }
        }

        List<String> order = topologicalOrder();

        Map<String, Node> frozen = new LinkedHashMap<>();
        for (Draft d : nodes.values()) {
            frozen.put(d.name, new Node(d.name, d.values, d.parents, d.cpt));
        }
        logger.debug("Validated network with {} nodes, order {}", frozen.size(), order);
        return new BayesianNetwork(frozen, children, order);
    }

    // Cartesian product of the parents' domains, first parent varying slowest.
    private List<List<String>> parentCombinations(Draft node) {
        List<List<String>> combinations = new ArrayList<>();
        combinations.add(List.of());
        for (String parentName : node.parents) {
            Draft parent = nodes.get(parentName);
            List<List<String>> extended = new ArrayList<>();
            for (List<String> prefix : combinations) {
                for (String value : parent.values) {
                    List<String> next = new ArrayList<>(prefix);
                    next.add(value);
                    extended.add(next);
                }
            }
            combinations = extended;
        }
        return combinations;
    }
}

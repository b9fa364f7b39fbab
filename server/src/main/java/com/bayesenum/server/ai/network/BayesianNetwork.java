package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.UnknownVariableException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated, immutable Bayesian network. Instances come from
 * {@link NetworkBuilder#validate()} and may be queried from several threads.
 */
public final class BayesianNetwork {
    private final Map<String, Node> nodes;
    private final Map<String, List<String>> children;
    private final List<String> topologicalOrder;

    BayesianNetwork(Map<String, Node> nodes, Map<String, List<String>> children, List<String> topologicalOrder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, List<String>> kids = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : children.entrySet()) {
            kids.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.children = Collections.unmodifiableMap(kids);
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    public boolean hasNode(String name) {
        return nodes.containsKey(name);
    }

    /**
     * @throws UnknownVariableException if no node has that name
     */
    public Node getNode(String name) {
        Node node = nodes.get(name);
        if (node == null) {
            throw new UnknownVariableException(name);
        }
        return node;
    }

    /** Node names in creation order. */
    public List<String> nodeNames() {
        return List.copyOf(nodes.keySet());
    }

    public Collection<Node> getNodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    public List<String> children(String name) {
        getNode(name);
        return children.getOrDefault(name, List.of());
    }

    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (Node n : nodes.values()) {
            if (n.isRoot()) {
                roots.add(n.getName());
            }
        }
        return roots;
    }

    /** Parents before children, roots in creation order. Computed once at validation. */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }
}

package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.StructuralException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kahn's algorithm over a parent/child adjacency.
 * <p>
 * Roots are queued in the iteration order of {@code parents} (node creation
 * order) and children are released in the order they were attached, so the
 * result is deterministic for a given construction sequence.
 */
final class TopologicalOrder {

    private TopologicalOrder() {
    }

    static List<String> compute(Map<String, List<String>> parents, Map<String, List<String>> children) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, List<String>> e : parents.entrySet()) {
            int degree = e.getValue().size();
            inDegree.put(e.getKey(), degree);
            if (degree == 0) {
                queue.addLast(e.getKey());
            }
        }

        List<String> order = new ArrayList<>(parents.size());
        while (!queue.isEmpty()) {
            String current = queue.removeFirst();
            order.add(current);
            for (String child : children.getOrDefault(current, List.of())) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    queue.addLast(child);
                }
            }
        }

        if (order.size() < parents.size()) {
            List<String> stuck = new ArrayList<>();
            for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
                if (e.getValue() > 0) {
                    stuck.add(e.getKey());
                }
            }
            throw new StructuralException(StructuralException.Kind.CYCLE,
                    "Cycle detected: the network is not a directed acyclic graph (nodes on or behind a cycle: "
                            + stuck + ")");
        }
        return order;
    }
}

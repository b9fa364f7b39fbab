package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.CptLookupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One random variable of a validated network: its ordered domain, its ordered
 * parents and its conditional probability table.
 * <p>
 * CPT keys are the parents' values in {@link #getParents()} order; a root node
 * has a single row under the empty key.
 */
public final class Node {
    private final String name;
    private final List<String> values;
    private final List<String> parents;
    private final Map<List<String>, Map<String, Double>> cpt;

    Node(String name, List<String> values, List<String> parents, Map<List<String>, Map<String, Double>> cpt) {
        this.name = name;
        this.values = List.copyOf(values);
        this.parents = List.copyOf(parents);

        Map<List<String>, Map<String, Double>> rows = new LinkedHashMap<>();
        for (Map.Entry<List<String>, Map<String, Double>> e : cpt.entrySet()) {
            rows.put(List.copyOf(e.getKey()), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.cpt = Collections.unmodifiableMap(rows);
    }

    public String getName() {
        return name;
    }

    public List<String> getValues() {
        return values;
    }

    public List<String> getParents() {
        return parents;
    }

    public boolean isRoot() {
        return parents.isEmpty();
    }

    public Map<List<String>, Map<String, Double>> getCpt() {
        return cpt;
    }

    /**
     * Returns P(this = value | parents = parentAssignment).
     *
     * @param value            one of this node's values
     * @param parentAssignment values for (at least) every parent
     * @throws CptLookupException if the parent tuple or the value has no entry
     */
    public double probability(String value, Map<String, String> parentAssignment) {
        List<String> key = parentKey(parentAssignment);
        Map<String, Double> row = cpt.get(key);
        if (row == null) {
            throw new CptLookupException(name, key, value);
        }
        Double p = row.get(value);
        if (p == null) {
            throw new CptLookupException(name, key, value);
        }
        return p;
    }

    /** Builds the CPT key for an assignment; absent parents show up as null entries. */
    public List<String> parentKey(Map<String, String> parentAssignment) {
        if (parents.isEmpty()) {
            return List.of();
        }
        List<String> key = new ArrayList<>(parents.size());
        for (String p : parents) {
            key.add(parentAssignment.get(p));
        }
        return key;
    }

    @Override
    public String toString() {
        return "Node{" + name + ", values=" + values + ", parents=" + (parents.isEmpty() ? "none" : parents) + '}';
    }
}

package com.bayesenum.server.ai;

import java.util.List;

/**
 * A CPT entry was requested for a parent tuple or value the table does not
 * hold. After a successful validation this only happens for evidence values
 * outside a variable's domain.
 */
public class CptLookupException extends BayesNetworkException {
    private final String node;
    private final List<String> parentValues;
    private final String value;

    public CptLookupException(String node, List<String> parentValues, String value) {
        super("Missing CPT entry for node " + node + ", parents " + parentValues + ", value " + value);
        this.node = node;
        this.parentValues = parentValues;
        this.value = value;
    }

    public String getNode() {
        return node;
    }

    public List<String> getParentValues() {
        return parentValues;
    }

    public String getValue() {
        return value;
    }
}

package com.bayesenum.server.ai;

import java.util.Map;

/**
 * The evidence has zero joint probability under the model, so the posterior
 * cannot be normalized.
 */
public class DegenerateEvidenceException extends BayesNetworkException {
    private final Map<String, String> evidence;

    public DegenerateEvidenceException(String queryVariable, Map<String, String> evidence) {
        super("Evidence " + evidence + " has zero total probability; P(" + queryVariable
                + " | evidence) is undefined");
        this.evidence = evidence;
    }

    public Map<String, String> getEvidence() {
        return evidence;
    }
}

package com.bayesenum.server.ai;

/**
 * The network is structurally unusable for inference: it has a cycle, a node
 * without a domain, CPT coverage gaps, or a CPT row whose values differ from
 * the node's domain.
 */
public class StructuralException extends BayesNetworkException {

    public enum Kind {
        CYCLE,
        EMPTY_DOMAIN,
        MISSING_CPT_ROW,
        MISSING_ROOT_CPT,
        DOMAIN_MISMATCH
    }

    private final Kind kind;

    public StructuralException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

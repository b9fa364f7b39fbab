package com.bayesenum.server.ai;

/**
 * Base type for every failure raised while building, validating or querying a
 * Bayesian network.
 */
public class BayesNetworkException extends RuntimeException {

    public BayesNetworkException(String message) {
        super(message);
    }

    public BayesNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.bayesenum.server.ai;

public class InferenceCancelledException extends BayesNetworkException {

    public InferenceCancelledException(String queryVariable) {
        super("Inference for " + queryVariable + " was interrupted");
    }
}

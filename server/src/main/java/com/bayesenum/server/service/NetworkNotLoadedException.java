package com.bayesenum.server.service;

import com.bayesenum.server.ai.BayesNetworkException;

public class NetworkNotLoadedException extends BayesNetworkException {

    public NetworkNotLoadedException() {
        super("No Bayesian network is loaded");
    }
}

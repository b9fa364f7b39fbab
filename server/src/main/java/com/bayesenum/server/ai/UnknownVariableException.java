package com.bayesenum.server.ai;

public class UnknownVariableException extends BayesNetworkException {
    private final String variable;

    public UnknownVariableException(String variable) {
        super("Unknown variable '" + variable + "'");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}

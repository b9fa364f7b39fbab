package com.bayesenum.server.ai.inference;

import com.bayesenum.server.ai.inference.trace.EnumerationTraceListener;

import java.util.Map;

public interface InferenceEngine {
    /**
     * Posterior distribution of {@code queryVariable} given {@code evidence}.
     * Never mutates the network or the evidence map.
     */
    InferenceResult infer(String queryVariable, Map<String, String> evidence, EnumerationTraceListener trace);
}

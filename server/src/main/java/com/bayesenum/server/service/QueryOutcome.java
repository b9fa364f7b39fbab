package com.bayesenum.server.service;

import com.bayesenum.server.ai.inference.InferenceResult;

import java.util.List;

public class QueryOutcome {
    private final InferenceResult result;
    private final List<String> trace;
    private final boolean traceTruncated;

    public QueryOutcome(InferenceResult result, List<String> trace, boolean traceTruncated) {
        this.result = result;
        this.trace = trace;
        this.traceTruncated = traceTruncated;
    }

    public InferenceResult getResult() {
        return result;
    }

    /** Indented trace lines, or null when tracing was not requested. */
    public List<String> getTrace() {
        return trace;
    }

    public boolean isTraceTruncated() {
        return traceTruncated;
    }
}

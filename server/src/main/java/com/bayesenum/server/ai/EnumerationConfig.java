package com.bayesenum.server.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code bayes_config.json}. Missing fields keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnumerationConfig {

    public static class TraceConfig {
        public Boolean enabled;
        public Integer maxEvents;
    }

    public String engine = "enumeration";

    @JsonProperty("data_directory")
    public String dataDirectory;

    public String structureFile;
    public String cptFile;
    public Boolean loadOnStartup;
    public TraceConfig trace;

    public boolean isTraceEnabled() {
        return trace != null && Boolean.TRUE.equals(trace.enabled);
    }

    /** Trace event cap; negative values count as 0. */
    public int traceMaxEvents() {
        return (trace != null && trace.maxEvents != null) ? Math.max(0, trace.maxEvents) : 10_000;
    }

    public boolean shouldLoadOnStartup() {
        return Boolean.TRUE.equals(loadOnStartup) && structureFile != null && cptFile != null;
    }
}

package com.bayesenum.server.service;

import com.bayesenum.server.ai.BayesNetworkException;
import com.bayesenum.server.ai.EnumerationConfig;
import com.bayesenum.server.ai.inference.InferenceEngine;
import com.bayesenum.server.ai.inference.InferenceEngineFactory;
import com.bayesenum.server.ai.inference.InferenceResult;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceListener;
import com.bayesenum.server.ai.inference.trace.LoggingTraceListener;
import com.bayesenum.server.ai.inference.trace.RecordingTraceListener;
import com.bayesenum.server.ai.loader.NetworkLoader;
import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.util.DataPathResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Owns the currently loaded network. Loading swaps in a new validated network
 * atomically; queries run against whichever network was current when they
 * started.
 */
@Service
public class NetworkService {

    private static final Logger logger = LoggerFactory.getLogger(NetworkService.class);

    private static final class Loaded {
        final BayesianNetwork network;
        final InferenceEngine engine;

        Loaded(BayesianNetwork network, InferenceEngine engine) {
            this.network = network;
            this.engine = engine;
        }
    }

    private final EnumerationConfig config;
    private volatile Loaded current;

    public NetworkService() {
        this(loadConfig());
    }

    public NetworkService(EnumerationConfig config) {
        this.config = config;
        if (config.trace != null && config.trace.maxEvents != null && config.trace.maxEvents < 0) {
            logger.warn("trace.maxEvents is {}; recorded traces will be empty", config.trace.maxEvents);
        }
    }

    @PostConstruct
    public void init() {
        if (!config.shouldLoadOnStartup()) {
            logger.info("No startup network configured; waiting for an explicit load");
            return;
        }
        try {
            load(config.structureFile, config.cptFile);
        } catch (BayesNetworkException | UncheckedIOException e) {
            logger.error("Failed to load startup network from {} and {}", config.structureFile, config.cptFile, e);
        }
    }

    public boolean isReady() {
        return current != null;
    }

    public EnumerationConfig getConfig() {
        return config;
    }

    /**
     * Loads and validates a network; the previous one stays active if this fails.
     */
    public BayesianNetwork load(String structureLocation, String cptLocation) {
        BayesianNetwork network = NetworkLoader.load(structureLocation, cptLocation);
        current = new Loaded(network, InferenceEngineFactory.create(config, network));
        return network;
    }

    public BayesianNetwork getNetwork() {
        return snapshot().network;
    }

    /**
     * Runs one query. With {@code trace} the trace lines are returned; the
     * config's trace switch logs them server-side instead.
     */
    public QueryOutcome query(String queryVariable, Map<String, String> evidence, boolean trace) {
        Loaded loaded = snapshot();
        Map<String, String> safeEvidence = evidence != null ? evidence : Map.of();

        RecordingTraceListener recorder = trace ? new RecordingTraceListener(config.traceMaxEvents()) : null;
        EnumerationTraceListener listener = recorder != null ? recorder : EnumerationTraceListener.NONE;
        if (config.isTraceEnabled()) {
            listener = listener.andThen(new LoggingTraceListener());
        }

        InferenceResult result = loaded.engine.infer(queryVariable, safeEvidence, listener);
        if (recorder == null) {
            return new QueryOutcome(result, null, false);
        }
        if (recorder.isTruncated()) {
            logger.warn("Trace for {} truncated after {} events ({} dropped)", queryVariable,
                    recorder.getEvents().size(), recorder.getDropped());
        }
        return new QueryOutcome(result, recorder.lines(), recorder.isTruncated());
    }

    private Loaded snapshot() {
        Loaded loaded = current;
        if (loaded == null) {
            throw new NetworkNotLoadedException();
        }
        return loaded;
    }

    static EnumerationConfig loadConfig() {
        try (InputStream is = NetworkService.class.getResourceAsStream(DataPathResolver.CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", DataPathResolver.CONFIG_RESOURCE);
                return new EnumerationConfig();
            }
            return new ObjectMapper().readValue(is, EnumerationConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DataPathResolver.CONFIG_RESOURCE, e);
        }
    }
}

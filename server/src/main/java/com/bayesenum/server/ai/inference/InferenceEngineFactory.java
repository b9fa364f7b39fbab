package com.bayesenum.server.ai.inference;

import com.bayesenum.server.ai.EnumerationConfig;
import com.bayesenum.server.ai.network.BayesianNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the engine named by {@code engine} in the config. Enumeration is the
 * only engine; any other name is logged and replaced by it.
 */
public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static InferenceEngine create(EnumerationConfig config, BayesianNetwork network) {
        String engine = (config != null) ? config.engine : null;

        if (engine == null || engine.trim().isEmpty()) {
            logger.warn("Engine not specified, defaulting to '{}'", EnumerationInferenceEngine.NAME);
        } else if (!EnumerationInferenceEngine.NAME.equals(engine.trim().toLowerCase())) {
            logger.warn("Unknown engine '{}', defaulting to '{}'", engine, EnumerationInferenceEngine.NAME);
        }
        return new EnumerationInferenceEngine(network);
    }

    public static InferenceEngine create(String engine, BayesianNetwork network) {
        EnumerationConfig cfg = new EnumerationConfig();
        cfg.engine = engine;
        return create(cfg, network);
    }
}

package com.bayesenum.server.ai.inference.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event as an indented INFO line.
 */
public class LoggingTraceListener implements EnumerationTraceListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingTraceListener.class);

    @Override
    public void onEvent(EnumerationTraceEvent event) {
        logger.info("{}", event.indented());
    }
}

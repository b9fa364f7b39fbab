package com.bayesenum.server.ai.inference.trace;

/**
 * Receives trace events from the enumeration engine, on the querying thread.
 */
@FunctionalInterface
public interface EnumerationTraceListener {

    EnumerationTraceListener NONE = event -> {
    };

    void onEvent(EnumerationTraceEvent event);

    default boolean isEnabled() {
        return this != NONE;
    }

    /** Delivers each event to this listener, then to {@code next}. */
    default EnumerationTraceListener andThen(EnumerationTraceListener next) {
        if (!next.isEnabled()) {
            return this;
        }
        if (!isEnabled()) {
            return next;
        }
        return event -> {
            onEvent(event);
            next.onEvent(event);
        };
    }
}

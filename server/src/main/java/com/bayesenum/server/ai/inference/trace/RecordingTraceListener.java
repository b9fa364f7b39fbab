package com.bayesenum.server.ai.inference.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps events in memory, up to {@code maxEvents}; anything past the cap is
 * counted but dropped.
 */
public class RecordingTraceListener implements EnumerationTraceListener {

    private final int maxEvents;
    private final List<EnumerationTraceEvent> events = new ArrayList<>();
    private long dropped = 0;

    public RecordingTraceListener() {
        this(Integer.MAX_VALUE);
    }

    public RecordingTraceListener(int maxEvents) {
        if (maxEvents < 0) {
            throw new IllegalArgumentException("maxEvents must not be negative");
        }
        this.maxEvents = maxEvents;
    }

    @Override
    public void onEvent(EnumerationTraceEvent event) {
        if (events.size() < maxEvents) {
            events.add(event);
        } else {
            dropped++;
        }
    }

    public List<EnumerationTraceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>(events.size());
        for (EnumerationTraceEvent e : events) {
            lines.add(e.indented());
        }
        return lines;
    }

    public boolean isTruncated() {
        return dropped > 0;
    }

    public long getDropped() {
        return dropped;
    }
}

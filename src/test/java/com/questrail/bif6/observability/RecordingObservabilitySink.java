package com.questrail.bif6.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements Bif6ObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onIntervalDecoded(Bif6IntervalDecodedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStreamCompleted(Bif6StreamCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(Bif6ErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> getEventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

package com.questrail.wfs.osc.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps every traffic entry, status change, REMOTE phase change and error in
 * arrival order so tests can assert on them.
 */
public final class RecordingObservabilitySink implements OscObservabilitySink {

    private final List<Object> seen = new ArrayList<>();

    @Override
    public void onTraffic(OscLogEntry entry) {
        record(entry);
    }

    @Override
    public void onConnectionStatus(ConnectionStatusEvent event) {
        record(event);
    }

    @Override
    public void onRemotePhase(RemotePhaseEvent event) {
        record(event);
    }

    @Override
    public void onError(OscErrorEvent event) {
        record(event);
    }

    private synchronized void record(Object event) {
        seen.add(event);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> kind) {
        List<T> matching = new ArrayList<>();
        for (Object event : seen) {
            if (kind.isInstance(event)) {
                matching.add(kind.cast(event));
            }
        }
        return matching;
    }

    public <T> boolean hasEventOfType(Class<T> kind) {
        return !eventsOfType(kind).isEmpty();
    }

    /** Logged messages travelling in one direction. */
    public List<OscLogEntry> traffic(OscLogEntry.Direction direction) {
        return eventsOfType(OscLogEntry.class).stream()
                .filter(entry -> entry.direction() == direction)
                .collect(Collectors.toList());
    }

    public synchronized void clear() {
        seen.clear();
    }
}

package com.questrail.wfs.osc.observability;

/**
 * Receives observability events from the network layer.
 *
 * <p>Implementations are called from network threads, the scheduler thread and
 * the caller's thread, often concurrently, and must not block.</p>
 */
public interface OscObservabilitySink {
    /**
     * Called per transmitted, received or rejected message while logging is
     * enabled.
     */
    void onTraffic(OscLogEntry entry);

    /**
     * Called when a target's recorded connection status changes.
     */
    void onConnectionStatus(ConnectionStatusEvent event);

    /**
     * Called when a REMOTE target's handshake phase changes.
     */
    void onRemotePhase(RemotePhaseEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(OscErrorEvent event);
}

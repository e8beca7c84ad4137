package com.questrail.wfs.osc.observability;

/**
 * No-op implementation of OscObservabilitySink.
 */
public final class NullOscObservabilitySink implements OscObservabilitySink {
    public static final NullOscObservabilitySink INSTANCE = new NullOscObservabilitySink();

    private NullOscObservabilitySink() {}

    @Override
    public void onTraffic(OscLogEntry entry) {}

    @Override
    public void onConnectionStatus(ConnectionStatusEvent event) {}

    @Override
    public void onRemotePhase(RemotePhaseEvent event) {}

    @Override
    public void onError(OscErrorEvent event) {}
}

package com.questrail.wfs.osc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OscObservabilitySink that emits logs via SLF4J.
 *
 * <p>Traffic goes to a separate {@code .traffic} logger at DEBUG so it can be
 * switched on without the rest of the layer's debug output.</p>
 */
public final class Slf4jOscObservabilitySink implements OscObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOscObservabilitySink.class);
    private static final Logger traffic = LoggerFactory.getLogger(Slf4jOscObservabilitySink.class.getName() + ".traffic");

    @Override
    public void onTraffic(OscLogEntry entry) {
        if (entry.direction() == OscLogEntry.Direction.REJECTED) {
            traffic.info("{}", entry);
        }
        else {
            traffic.debug("{}", entry);
        }
    }

    @Override
    public void onConnectionStatus(ConnectionStatusEvent event) {
        log.info("OSC target {}: {} -> {}",
            event.targetIndex() + 1,
            event.oldStatus(),
            event.newStatus());
    }

    @Override
    public void onRemotePhase(RemotePhaseEvent event) {
        log.info("REMOTE target {}: Phase {} -> {}",
            event.targetIndex() + 1,
            event.oldPhase(),
            event.newPhase());
    }

    @Override
    public void onError(OscErrorEvent event) {
        if (event.targetIndex() >= 0) {
            log.warn("OSC target {} error: {}", event.targetIndex() + 1, event.message(), event.cause());
        }
        else {
            log.error("OSC error: {}", event.message(), event.cause());
        }
    }
}

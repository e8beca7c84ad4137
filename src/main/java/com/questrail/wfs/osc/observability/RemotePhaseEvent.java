package com.questrail.wfs.osc.observability;

import com.questrail.wfs.osc.manager.RemoteConnectionState;

import java.time.Instant;

/**
 * REMOTE handshake phase of a target changed.
 */
public record RemotePhaseEvent(
    Instant timestamp,
    int targetIndex,
    RemoteConnectionState.Phase oldPhase,
    RemoteConnectionState.Phase newPhase
) {
}

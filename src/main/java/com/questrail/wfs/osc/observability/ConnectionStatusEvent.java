package com.questrail.wfs.osc.observability;

import com.questrail.wfs.osc.connection.ConnectionStatus;

import java.time.Instant;

/**
 * Recorded connection status of a target changed.
 */
public record ConnectionStatusEvent(
    Instant timestamp,
    int targetIndex,
    ConnectionStatus oldStatus,
    ConnectionStatus newStatus
) {
}

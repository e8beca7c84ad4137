package com.questrail.wfs.osc.observability;

import java.time.Instant;

/**
 * An error or anomaly in the network layer. {@code targetIndex} is {@code -1}
 * when the error is not tied to a target (receiver bind failures, for example).
 */
public record OscErrorEvent(
    Instant timestamp,
    int targetIndex,
    String message,
    Throwable cause
) {
}

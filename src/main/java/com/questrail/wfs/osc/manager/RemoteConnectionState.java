package com.questrail.wfs.osc.manager;

import java.util.Objects;

/**
 * Snapshot of one target's REMOTE handshake.
 *
 * <p>Times are monotonic nanoseconds, {@code 0} when the event has not
 * happened. {@code pendingSequenceNumber} is {@link #NO_PENDING} while no
 * ping is awaiting its pong.</p>
 */
public record RemoteConnectionState(
    Phase phase,
    long lastPingSentNanos,
    long lastPongReceivedNanos,
    int pendingSequenceNumber,
    int nextSequenceNumber,
    boolean wasConnectedBefore
) {
    public static final int NO_PENDING = -1;

    public enum Phase {
        DISCONNECTED,
        CONNECTING,
        CONNECTED
    }

    public RemoteConnectionState {
        Objects.requireNonNull(phase, "phase");
    }

    public static RemoteConnectionState initial() {
        return new RemoteConnectionState(Phase.DISCONNECTED, 0L, 0L, NO_PENDING, 1, false);
    }

    public boolean awaitingPong() {
        return pendingSequenceNumber != NO_PENDING;
    }
}

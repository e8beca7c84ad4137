package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.connection.ConnectionStatus;

/**
 * Notifications for the control surface. All methods default to no-ops.
 *
 * <p>Called from network threads and timer threads; implementations hand
 * work off to their own thread if they need one.</p>
 */
public interface OscManagerCallbacks
{
    OscManagerCallbacks NONE = new OscManagerCallbacks() {};

    default void onConnectionStatusChanged(int targetIndex, ConnectionStatus status) {}

    /**
     * A REMOTE client selected a channel (1-based).
     */
    default void onRemoteChannelSelect(int channelId) {}

    /**
     * A position change from a REMOTE client was written, after clamping.
     */
    default void onRemotePositionReceived(int channelId, float x, float y, float z) {}

    /**
     * A REMOTE target answered its first ping after being disconnected.
     */
    default void onRemoteConnectionReady(int targetIndex) {}

    /**
     * A connected REMOTE target stopped answering pings.
     */
    default void onRemoteDisconnected(int targetIndex) {}
}

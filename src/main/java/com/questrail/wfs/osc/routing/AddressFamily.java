package com.questrail.wfs.osc.routing;

/**
 * Which handler an inbound address belongs to, decided by prefix alone.
 */
public enum AddressFamily
{
    INPUT,
    OUTPUT,
    REVERB,
    CONFIG,
    REMOTE_INPUT,
    ARRAY_ADJUST,
    CLUSTER_MOVE,
    REMOTE_PING,
    REMOTE_PONG,
    UNKNOWN;

    /**
     * Families that arrive over the REMOTE dialect rather than the standard
     * {@code /wfs} namespace.
     */
    public boolean isRemoteDialect()
    {
        return this == REMOTE_INPUT || this == ARRAY_ADJUST || this == CLUSTER_MOVE
                || this == REMOTE_PING || this == REMOTE_PONG;
    }
}

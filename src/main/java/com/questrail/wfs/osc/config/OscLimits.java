package com.questrail.wfs.osc.config;

/**
 * Fixed limits of the network layer.
 */
public final class OscLimits
{
    /** Number of independently configured target slots. */
    public static final int MAX_TARGETS = 6;

    /** Default outbound rate per target. */
    public static final int MAX_RATE_HZ = 50;

    /** Minimum interval between flushes to one target at {@link #MAX_RATE_HZ}. */
    public static final int MIN_INTERVAL_MS = 1000 / MAX_RATE_HZ;

    /** Concurrent clients accepted by the TCP receiver. */
    public static final int MAX_TCP_CLIENTS = 16;

    /** Largest TCP frame payload accepted by the TCP receiver. */
    public static final int MAX_TCP_PACKET_SIZE = 65536;

    /** Receive buffer for one UDP datagram. */
    public static final int MAX_UDP_PACKET_SIZE = 65536;

    /** Cluster ids accepted by cluster commands are {@code 1..MAX_CLUSTERS}. */
    public static final int MAX_CLUSTERS = 10;

    private OscLimits() {}

    public static boolean isValidTargetIndex(int targetIndex) {
        return targetIndex >= 0 && targetIndex < MAX_TARGETS;
    }
}

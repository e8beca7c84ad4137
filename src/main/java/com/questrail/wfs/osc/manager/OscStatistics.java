package com.questrail.wfs.osc.manager;

/**
 * Aggregate traffic counters since the manager was built or last reset.
 */
public record OscStatistics(
    long messagesSent,
    long messagesReceived,
    long messagesCoalesced,
    long parseErrors
) {
    public static final OscStatistics EMPTY = new OscStatistics(0, 0, 0, 0);
}

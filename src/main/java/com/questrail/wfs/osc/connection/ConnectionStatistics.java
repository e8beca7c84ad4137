package com.questrail.wfs.osc.connection;

/**
 * Snapshot of one connection's counters since its last successful connect.
 *
 * @param messagesSent messages written; a bundle counts its top-level elements
 * @param sendErrors failed writes
 */
public record ConnectionStatistics(long messagesSent, long sendErrors)
{
    public static final ConnectionStatistics EMPTY = new ConnectionStatistics(0, 0);
}

package com.questrail.wfs.osc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the network layer: the per
 * target send gate, heartbeat deadlines, and TCP connect timeouts.
 *
 * <p>Wall-clock time is only used for log entry timestamps.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();

    default long nowMillis()
    {
        return nowNanos() / 1_000_000L;
    }
}

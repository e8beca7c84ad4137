package com.questrail.wfs.osc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned for every scheduled task: rate limiter ticks, heartbeat pings,
 * heartbeat timeouts and the manager's status poll.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran (one-shot) or was cancelled before.
     */
    boolean cancel();
}

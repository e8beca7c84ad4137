package com.questrail.wfs.osc.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timers for heartbeats, REMOTE timeouts, rate-limiter flushes and status
 * polling.
 *
 * <p>Deadlines are monotonic nanoseconds read from a {@link MonotonicClock};
 * a wall-clock jump never fires or delays a timer.</p>
 *
 * <p>Only one-shot scheduling is abstract. Periodic timers re-arm themselves
 * through it, so a manual test scheduler sees exactly the deadlines that
 * production does.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once the clock reaches {@code deadlineNanos}. A deadline
     * already passed runs as soon as possible.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} every {@code period}, starting one period from now.
     *
     * <p>Each deadline is the previous deadline plus {@code period}, so a slow
     * run does not push later ones back. A run that throws still arms the next
     * one.</p>
     *
     * @return handle that stops all future runs
     */
    default Cancellable scheduleRepeating(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("timer period must be positive, was " + period);
        }

        RepeatingTask repeating = new RepeatingTask(this, period.toNanos(), task);
        repeating.start(clock.nowNanos());
        return repeating;
    }
}

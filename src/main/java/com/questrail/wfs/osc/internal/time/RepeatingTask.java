package com.questrail.wfs.osc.internal.time;

/**
 * Self re-arming task behind {@link MonotonicScheduler#scheduleRepeating}.
 */
final class RepeatingTask implements Cancellable, Runnable
{
    private final MonotonicScheduler scheduler;
    private final long periodNanos;
    private final Runnable task;

    private long deadlineNanos;
    private Cancellable pending;
    private boolean cancelled;

    RepeatingTask(MonotonicScheduler scheduler, long periodNanos, Runnable task)
    {
        this.scheduler = scheduler;
        this.periodNanos = periodNanos;
        this.task = task;
    }

    synchronized void start(long nowNanos)
    {
        deadlineNanos = nowNanos + periodNanos;
        pending = scheduler.scheduleAtNanos(deadlineNanos, this);
    }

    @Override
    public void run()
    {
        synchronized (this) {
            if (cancelled) {
                return;
            }
        }
        try {
            task.run();
        }
        finally {
            synchronized (this) {
                if (!cancelled) {
                    deadlineNanos += periodNanos;
                    pending = scheduler.scheduleAtNanos(deadlineNanos, this);
                }
            }
        }
    }

    @Override
    public synchronized boolean cancel()
    {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        if (pending != null) {
            pending.cancel();
        }
        return true;
    }
}

package com.questrail.wfs.osc.internal.time;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs timers against a {@link ManualMonotonicClock}, on the test thread,
 * only when the test advances time. Timers due at the same instant fire in
 * the order they were armed.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private static final Comparator<Timer> FIRING_ORDER =
            Comparator.comparingLong((Timer t) -> t.dueNanos).thenComparingLong(t -> t.armedOrder);

    private final ManualMonotonicClock clock;
    private final List<Timer> armed = new ArrayList<>();
    private long armedCount;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Timer timer = new Timer(deadlineNanos, armedCount++, task);
        armed.add(timer);
        return timer;
    }

    /**
     * Moves time forward one millisecond at a time and fires whatever is due
     * after each step, so a periodic timer fires at every one of its deadlines.
     */
    public void advanceMillis(long millis) {
        for (long step = 0; step < millis; step++) {
            clock.advanceMillis(1);
            fireDue();
        }
    }

    /** Fires due timers, including ones armed by a firing timer that are already due. */
    public void fireDue() {
        Timer next;
        while ((next = takeDue()) != null) {
            if (next.cancel()) {
                next.task.run();
            }
        }
    }

    private synchronized Timer takeDue() {
        armed.removeIf(t -> !t.live);
        Timer first = armed.stream().min(FIRING_ORDER).orElse(null);
        if (first == null || first.dueNanos > clock.nowNanos()) {
            return null;
        }
        armed.remove(first);
        return first;
    }

    /** Timers armed and not yet fired or cancelled. */
    public synchronized int pendingTaskCount() {
        armed.removeIf(t -> !t.live);
        return armed.size();
    }

    private static final class Timer implements Cancellable {
        final long dueNanos;
        final long armedOrder;
        final Runnable task;
        volatile boolean live = true;

        Timer(long dueNanos, long armedOrder, Runnable task) {
            this.dueNanos = dueNanos;
            this.armedOrder = armedOrder;
            this.task = task;
        }

        @Override
        public synchronized boolean cancel() {
            if (!live) {
                return false;
            }
            live = false;
            return true;
        }
    }
}

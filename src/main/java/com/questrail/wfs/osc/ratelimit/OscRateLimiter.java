package com.questrail.wfs.osc.ratelimit;

import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.internal.time.Cancellable;
import com.questrail.wfs.osc.internal.time.MonotonicClock;
import com.questrail.wfs.osc.internal.time.MonotonicScheduler;
import com.questrail.wfs.osc.model.OscMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * OscRateLimiter
 * =============================================================================
 * Per-target outbound queues with coalescing and a bounded flush rate.
 *
 * <h2>Coalescing</h2>
 * Each queued message has a key: {@code address:channel} when its first
 * argument is an int32, otherwise {@code address}. A target's queue holds
 * only the latest message per key; replacing a pending one counts as
 * coalesced.
 *
 * <p>Only the first int32 is part of the key. Banded messages such as
 * {@code /wfs/output/EQfreq <channel> <band> <value>} therefore share one
 * key per channel: two bands of one channel changed within the same flush
 * interval leave only the later band's message queued.</p>
 *
 * <h2>Flush policy</h2>
 * A tick runs every half minimum interval. A target is flushed when it has
 * never sent, or when at least the minimum interval has passed since its
 * last flush. A flush sends <em>every</em> pending key of that target, so
 * the limiter bounds how often a target is flushed, not how many messages
 * a flush carries.
 *
 * <h2>Broadcast</h2>
 * {@link #queueBroadcast(OscMessage)} entries are folded into the queue of
 * every enabled target at the next tick, then follow that target's gate.
 *
 * <h2>Threading</h2>
 * All queues share one lock, and sends happen after it is released so that
 * producers never wait on the network. A separate delivery lock is held from
 * drain to last send, so a tick and {@link #flushAll()} racing on two
 * threads deliver in drain order and a newer value is never overtaken by an
 * older one.
 */
public final class OscRateLimiter
{
    private static final Logger log = LoggerFactory.getLogger(OscRateLimiter.class);

    /**
     * Delivers one flushed message. Called from the tick thread, or from the
     * caller of {@link #flushAll()}, never from both at once.
     */
    @FunctionalInterface
    public interface Sender
    {
        void send(int targetIndex, OscMessage message);
    }

    private record Outgoing(int targetIndex, OscMessage message) {}

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final IntPredicate targetEnabled;
    private final Sender sender;

    private final Object lock = new Object();
    private final Object deliveryLock = new Object();

    // Guarded by lock.
    private final List<LinkedHashMap<String, OscMessage>> queues = new ArrayList<>(OscLimits.MAX_TARGETS);
    private final LinkedHashMap<String, OscMessage> broadcast = new LinkedHashMap<>();
    private final long[] lastSendNanos = new long[OscLimits.MAX_TARGETS];
    private final boolean[] hasSent = new boolean[OscLimits.MAX_TARGETS];
    private long minIntervalNanos;
    private long totalSent;
    private long totalCoalesced;
    private Cancellable ticker;

    public OscRateLimiter(MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          int maxRateHz,
                          IntPredicate targetEnabled,
                          Sender sender)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.targetEnabled = Objects.requireNonNull(targetEnabled, "targetEnabled");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.minIntervalNanos = intervalNanos(maxRateHz);

        for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
            queues.add(new LinkedHashMap<>());
        }
    }

    // -------------------------------------------------------------------------
    // Queueing
    // -------------------------------------------------------------------------

    /**
     * Queue a message for one target. Ignored for an invalid index.
     */
    public void queueMessage(int targetIndex, OscMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return;
        }
        synchronized (lock) {
            putCoalescing(queues.get(targetIndex), message);
        }
    }

    /**
     * Queue a message for every target enabled at the time of the next tick.
     */
    public void queueBroadcast(OscMessage message)
    {
        Objects.requireNonNull(message, "message");
        synchronized (lock) {
            putCoalescing(broadcast, message);
        }
    }

    static String coalescingKey(OscMessage message)
    {
        Optional<Integer> channel = message.firstIntArgument();
        return channel.isPresent() ? message.address() + ":" + channel.get() : message.address();
    }

    private void putCoalescing(Map<String, OscMessage> queue, OscMessage message)
    {
        if (queue.put(coalescingKey(message), message) != null) {
            totalCoalesced++;
        }
    }

    // -------------------------------------------------------------------------
    // Flushing
    // -------------------------------------------------------------------------

    /**
     * One tick: fold broadcasts, then drain every target whose gate is open.
     */
    void tick()
    {
        synchronized (deliveryLock) {
            List<Outgoing> due = new ArrayList<>();
            long now = clock.nowNanos();

            synchronized (lock) {
                foldBroadcastLocked();
                for (int t = 0; t < OscLimits.MAX_TARGETS; t++) {
                    LinkedHashMap<String, OscMessage> queue = queues.get(t);
                    if (queue.isEmpty()) {
                        continue;
                    }
                    if (hasSent[t] && now - lastSendNanos[t] < minIntervalNanos) {
                        continue;
                    }
                    drainLocked(t, queue, due);
                    hasSent[t] = true;
                    lastSendNanos[t] = now;
                }
            }

            deliver(due);
        }
    }

    /**
     * Send everything pending now, ignoring the rate gate. Does not move
     * any target's last-flush time.
     */
    public void flushAll()
    {
        synchronized (deliveryLock) {
            List<Outgoing> due = new ArrayList<>();
            synchronized (lock) {
                foldBroadcastLocked();
                for (int t = 0; t < OscLimits.MAX_TARGETS; t++) {
                    drainLocked(t, queues.get(t), due);
                }
            }
            deliver(due);
        }
    }

    private void foldBroadcastLocked()
    {
        if (broadcast.isEmpty()) {
            return;
        }
        for (int t = 0; t < OscLimits.MAX_TARGETS; t++) {
            if (!targetEnabled.test(t)) {
                continue;
            }
            LinkedHashMap<String, OscMessage> queue = queues.get(t);
            for (OscMessage message : broadcast.values()) {
                putCoalescing(queue, message);
            }
        }
        broadcast.clear();
    }

    private void drainLocked(int targetIndex, LinkedHashMap<String, OscMessage> queue, List<Outgoing> due)
    {
        for (OscMessage message : queue.values()) {
            due.add(new Outgoing(targetIndex, message));
        }
        totalSent += queue.size();
        queue.clear();
    }

    private void deliver(List<Outgoing> due)
    {
        for (Outgoing out : due) {
            try {
                sender.send(out.targetIndex(), out.message());
            }
            catch (RuntimeException e) {
                log.warn("Send of {} to target {} failed", out.message().address(), out.targetIndex() + 1, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle and rate
    // -------------------------------------------------------------------------

    public void start()
    {
        synchronized (lock) {
            if (ticker != null) {
                return;
            }
            ticker = scheduler.scheduleRepeating(tickPeriodLocked(), clock, this::tick);
        }
    }

    public void stop()
    {
        Cancellable running;
        synchronized (lock) {
            running = ticker;
            ticker = null;
        }
        if (running != null) {
            running.cancel();
        }
    }

    public boolean isRunning()
    {
        synchronized (lock) {
            return ticker != null;
        }
    }

    /**
     * Change the per-target rate. Values below 1 Hz are raised to 1 Hz. A
     * running tick is restarted at the new period.
     */
    public void setMaxRate(int hz)
    {
        boolean wasRunning;
        synchronized (lock) {
            minIntervalNanos = intervalNanos(hz);
            wasRunning = ticker != null;
        }
        if (wasRunning) {
            stop();
            start();
        }
    }

    public Duration minInterval()
    {
        synchronized (lock) {
            return Duration.ofNanos(minIntervalNanos);
        }
    }

    private Duration tickPeriodLocked()
    {
        return Duration.ofNanos(Math.max(1_000_000L, minIntervalNanos / 2));
    }

    private static long intervalNanos(int hz)
    {
        return Duration.ofMillis(1000L / Math.max(1, hz)).toNanos();
    }

    // -------------------------------------------------------------------------
    // Inspection
    // -------------------------------------------------------------------------

    public void clearAll()
    {
        synchronized (lock) {
            queues.forEach(Map::clear);
            broadcast.clear();
        }
    }

    /**
     * Pending keys across all targets, broadcast entries counted once.
     */
    public int pendingCount()
    {
        synchronized (lock) {
            int count = broadcast.size();
            for (Map<String, OscMessage> queue : queues) {
                count += queue.size();
            }
            return count;
        }
    }

    public long totalSent()
    {
        synchronized (lock) {
            return totalSent;
        }
    }

    public long totalCoalesced()
    {
        synchronized (lock) {
            return totalCoalesced;
        }
    }

    public void resetStats()
    {
        synchronized (lock) {
            totalSent = 0;
            totalCoalesced = 0;
        }
    }
}

package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.config.OscTimingPolicy;
import com.questrail.wfs.osc.internal.time.Cancellable;
import com.questrail.wfs.osc.internal.time.MonotonicClock;
import com.questrail.wfs.osc.internal.time.MonotonicScheduler;
import com.questrail.wfs.osc.internal.time.WallClock;
import com.questrail.wfs.osc.manager.RemoteConnectionState.Phase;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.observability.OscObservabilitySink;
import com.questrail.wfs.osc.observability.RemotePhaseEvent;
import com.questrail.wfs.osc.routing.OscMessageBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * RemoteHeartbeat
 * =============================================================================
 * Ping/pong handshake with every REMOTE target.
 *
 * <h2>Phases</h2>
 * <ul>
 *   <li>{@code DISCONNECTED -> CONNECTING} when a ping is sent.</li>
 *   <li>{@code CONNECTING -> CONNECTED} on a pong carrying the pending
 *       sequence number. A target that was connected before is resynced
 *       first, then reported ready.</li>
 *   <li>{@code CONNECTED -> DISCONNECTED} when the oldest unanswered ping is
 *       older than the connection timeout; reported once as lost.</li>
 *   <li>{@code CONNECTING -> DISCONNECTED} on the same timeout, unreported.</li>
 *   <li>Any phase to {@code DISCONNECTED} on {@link #reset(int)}, unreported.</li>
 * </ul>
 *
 * <h2>Timeout arming</h2>
 * The timeout is armed once per unanswered run of pings, at the first ping
 * of the run. Each arming carries a token; a pong or reset advances the
 * token so that a timeout already queued on the scheduler does nothing.
 *
 * <h2>Threading</h2>
 * Slot state is guarded by one lock. Pings, port callbacks and phase events
 * run after the lock is released.
 */
final class RemoteHeartbeat
{
    private static final Logger log = LoggerFactory.getLogger(RemoteHeartbeat.class);

    /**
     * What the heartbeat needs from the manager.
     */
    interface Port
    {
        /** Target is configured for the REMOTE protocol. */
        boolean isRemoteTarget(int targetIndex);

        /** Target's outbound connection is up. */
        boolean isLinkUp(int targetIndex);

        /** Send without rate limiting. */
        void sendDirect(int targetIndex, OscMessage message);

        /** Bring a reconnected client up to date. */
        void resync(int targetIndex);

        void onReady(int targetIndex);

        void onLost(int targetIndex);
    }

    private static final class Slot
    {
        Phase phase = Phase.DISCONNECTED;
        long lastPingSentNanos;
        long lastPongReceivedNanos;
        int pendingSequence = RemoteConnectionState.NO_PENDING;
        int nextSequence = 1;
        boolean awaiting;
        long token;
        Cancellable timeout;
        boolean wasConnectedBefore;
    }

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final OscTimingPolicy timing;
    private final Port port;
    private final OscObservabilitySink sink;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private final Slot[] slots = new Slot[OscLimits.MAX_TARGETS];

    private Cancellable ticker;

    RemoteHeartbeat(MonotonicClock clock,
                    MonotonicScheduler scheduler,
                    OscTimingPolicy timing,
                    Port port,
                    OscObservabilitySink sink,
                    WallClock wallClock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.port = Objects.requireNonNull(port, "port");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new Slot();
        }
    }

    void start()
    {
        synchronized (lock) {
            if (ticker != null) {
                return;
            }
            ticker = scheduler.scheduleRepeating(timing.heartbeatInterval(), clock, this::tick);
        }
    }

    void stop()
    {
        Cancellable stopping;
        synchronized (lock) {
            stopping = ticker;
            ticker = null;
        }
        if (stopping != null) {
            stopping.cancel();
        }
        for (int i = 0; i < slots.length; i++) {
            reset(i);
        }
    }

    // -------------------------------------------------------------------------
    // Ping
    // -------------------------------------------------------------------------

    /**
     * Ping every REMOTE target whose link is up.
     */
    void tick()
    {
        for (int i = 0; i < slots.length; i++) {
            if (port.isRemoteTarget(i) && port.isLinkUp(i)) {
                ping(i);
            }
        }
    }

    private void ping(int targetIndex)
    {
        long now = clock.nowNanos();
        int sequence;
        Phase before;
        Phase after;

        synchronized (lock) {
            Slot slot = slots[targetIndex];
            sequence = slot.nextSequence;
            slot.nextSequence = sequence == Integer.MAX_VALUE ? 1 : sequence + 1;
            slot.pendingSequence = sequence;
            slot.lastPingSentNanos = now;

            if (!slot.awaiting) {
                slot.awaiting = true;
                long token = ++slot.token;
                long deadline = now + timing.connectionTimeout().toNanos();
                slot.timeout = scheduler.scheduleAtNanos(deadline, () -> onTimeout(targetIndex, token));
            }

            before = slot.phase;
            if (before == Phase.DISCONNECTED) {
                slot.phase = Phase.CONNECTING;
            }
            after = slot.phase;
        }

        firePhase(targetIndex, before, after);
        port.sendDirect(targetIndex, OscMessageBuilder.buildPing(sequence));
    }

    // -------------------------------------------------------------------------
    // Pong
    // -------------------------------------------------------------------------

    /**
     * Accept a pong from a target.
     *
     * @return {@code false} if {@code sequence} is not the pending one
     */
    boolean onPong(int targetIndex, int sequence)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return false;
        }

        Cancellable armed;
        Phase before;
        Phase after;
        boolean resync = false;

        synchronized (lock) {
            Slot slot = slots[targetIndex];
            if (slot.pendingSequence == RemoteConnectionState.NO_PENDING || slot.pendingSequence != sequence) {
                return false;
            }

            slot.lastPongReceivedNanos = clock.nowNanos();
            slot.pendingSequence = RemoteConnectionState.NO_PENDING;
            slot.awaiting = false;
            slot.token++;
            armed = slot.timeout;
            slot.timeout = null;

            before = slot.phase;
            if (before == Phase.CONNECTING) {
                slot.phase = Phase.CONNECTED;
                resync = slot.wasConnectedBefore;
                slot.wasConnectedBefore = true;
            }
            after = slot.phase;
        }

        if (armed != null) {
            armed.cancel();
        }

        if (before != after) {
            firePhase(targetIndex, before, after);
            if (resync) {
                port.resync(targetIndex);
            }
            port.onReady(targetIndex);
        }
        return true;
    }

    // -------------------------------------------------------------------------
    // Timeout and reset
    // -------------------------------------------------------------------------

    private void onTimeout(int targetIndex, long token)
    {
        Phase before;
        synchronized (lock) {
            Slot slot = slots[targetIndex];
            if (slot.token != token || !slot.awaiting) {
                return;
            }
            before = slot.phase;
            clearLocked(slot);
        }

        log.debug("REMOTE target {}: no pong within {}", targetIndex + 1, timing.connectionTimeout());
        firePhase(targetIndex, before, Phase.DISCONNECTED);
        if (before == Phase.CONNECTED) {
            port.onLost(targetIndex);
        }
    }

    /**
     * Return a target to {@code DISCONNECTED} without reporting it lost.
     * Whether it was connected before is remembered.
     */
    void reset(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return;
        }

        Cancellable armed;
        Phase before;
        synchronized (lock) {
            Slot slot = slots[targetIndex];
            armed = slot.timeout;
            before = slot.phase;
            clearLocked(slot);
        }

        if (armed != null) {
            armed.cancel();
        }
        firePhase(targetIndex, before, Phase.DISCONNECTED);
    }

    private static void clearLocked(Slot slot)
    {
        slot.token++;
        slot.timeout = null;
        slot.awaiting = false;
        slot.pendingSequence = RemoteConnectionState.NO_PENDING;
        slot.phase = Phase.DISCONNECTED;
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    RemoteConnectionState state(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return RemoteConnectionState.initial();
        }
        synchronized (lock) {
            Slot slot = slots[targetIndex];
            return new RemoteConnectionState(slot.phase, slot.lastPingSentNanos, slot.lastPongReceivedNanos,
                    slot.pendingSequence, slot.nextSequence, slot.wasConnectedBefore);
        }
    }

    Phase phase(int targetIndex)
    {
        return state(targetIndex).phase();
    }

    private void firePhase(int targetIndex, Phase before, Phase after)
    {
        if (before != after) {
            sink.onRemotePhase(new RemotePhaseEvent(wallClock.now(), targetIndex, before, after));
        }
    }
}

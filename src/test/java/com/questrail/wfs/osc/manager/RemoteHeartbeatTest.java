package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.config.OscTimingPolicy;
import com.questrail.wfs.osc.internal.time.DeterministicScheduler;
import com.questrail.wfs.osc.internal.time.ManualMonotonicClock;
import com.questrail.wfs.osc.internal.time.SystemWallClock;
import com.questrail.wfs.osc.manager.RemoteConnectionState.Phase;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.observability.RecordingObservabilitySink;
import com.questrail.wfs.osc.observability.RemotePhaseEvent;
import com.questrail.wfs.osc.routing.OscMessageRouter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RemoteHeartbeatTest
 * -----------------------------------------------------------------------------
 * Ping/pong phases of REMOTE targets on a manual clock.
 *
 * <p>Heartbeat every 100 ms, timeout 350 ms so that no deadline lands on a
 * tick.</p>
 */
final class RemoteHeartbeatTest
{
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakePort port = new FakePort();

    private final OscTimingPolicy timing = new OscTimingPolicy(
            Duration.ofMillis(20), Duration.ofMillis(100), Duration.ofMillis(350),
            Duration.ofMillis(1000), Duration.ofMillis(500));

    private final RemoteHeartbeat heartbeat =
            new RemoteHeartbeat(clock, scheduler, timing, port, sink, SystemWallClock.INSTANCE);

    /**
     * Target 1 is a REMOTE target with its link up; the rest are not REMOTE.
     */
    private static final class FakePort implements RemoteHeartbeat.Port
    {
        final List<Integer> pings = new ArrayList<>();
        final List<String> calls = new ArrayList<>();
        boolean linkUp = true;

        @Override
        public boolean isRemoteTarget(int targetIndex)
        {
            return targetIndex == 1;
        }

        @Override
        public boolean isLinkUp(int targetIndex)
        {
            return linkUp;
        }

        @Override
        public void sendDirect(int targetIndex, OscMessage message)
        {
            assertEquals(OscMessageRouter.REMOTE_PING, message.address());
            pings.add(OscMessageRouter.parseHeartbeatSequence(message).getAsInt());
        }

        @Override
        public void resync(int targetIndex)
        {
            calls.add("resync " + targetIndex);
        }

        @Override
        public void onReady(int targetIndex)
        {
            calls.add("ready " + targetIndex);
        }

        @Override
        public void onLost(int targetIndex)
        {
            calls.add("lost " + targetIndex);
        }

        int lastPing()
        {
            return pings.get(pings.size() - 1);
        }
    }

    @Test
    void pingMovesToConnectingAndMatchingPongConnects()
    {
        heartbeat.start();

        scheduler.advanceMillis(100);
        assertEquals(List.of(1), port.pings);
        assertEquals(Phase.CONNECTING, heartbeat.phase(1));
        assertEquals(Phase.DISCONNECTED, heartbeat.phase(0));

        assertTrue(heartbeat.onPong(1, 1));

        assertEquals(Phase.CONNECTED, heartbeat.phase(1));
        assertEquals(List.of("ready 1"), port.calls);
        assertFalse(heartbeat.state(1).awaitingPong());
    }

    @Test
    void sequenceNumbersIncreaseWithEachPing()
    {
        heartbeat.start();

        scheduler.advanceMillis(250);

        assertEquals(List.of(1, 2), port.pings);
        assertEquals(2, heartbeat.state(1).pendingSequenceNumber());
        assertEquals(3, heartbeat.state(1).nextSequenceNumber());
    }

    @Test
    void mismatchedPongIsIgnored()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);

        assertFalse(heartbeat.onPong(1, 99));
        assertFalse(heartbeat.onPong(1, 0));

        assertEquals(Phase.CONNECTING, heartbeat.phase(1));
        assertTrue(port.calls.isEmpty());
    }

    @Test
    void onlyTheLatestPingCanBeAnswered()
    {
        heartbeat.start();
        scheduler.advanceMillis(200);

        assertFalse(heartbeat.onPong(1, 1));
        assertTrue(heartbeat.onPong(1, 2));
    }

    @Test
    void pongWithNothingPendingIsIgnored()
    {
        assertFalse(heartbeat.onPong(1, 1));
        assertFalse(heartbeat.onPong(-1, 1));
    }

    @Test
    void silenceAfterConnectReportsLostExactlyOnce()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);
        heartbeat.onPong(1, port.lastPing());
        port.calls.clear();

        // GIVEN: the client stops answering; first unanswered ping at 200 ms
        // WHEN: the timeout armed at that ping expires at 550 ms
        scheduler.advanceMillis(449);
        assertEquals(Phase.CONNECTED, heartbeat.phase(1));
        scheduler.advanceMillis(1);

        // THEN
        assertEquals(List.of("lost 1"), port.calls);

        // Pings continue; a second silence from CONNECTING is not reported again
        scheduler.advanceMillis(1000);
        assertEquals(List.of("lost 1"), port.calls);
        assertNotEquals(Phase.CONNECTED, heartbeat.phase(1));
    }

    @Test
    void timeoutIsNotExtendedByLaterPings()
    {
        heartbeat.start();

        // first ping at 100 ms arms the timeout for 450 ms
        scheduler.advanceMillis(349);
        assertEquals(Phase.CONNECTING, heartbeat.phase(1));
        scheduler.advanceMillis(1);

        assertEquals(Phase.DISCONNECTED, heartbeat.phase(1));
        assertTrue(port.calls.isEmpty(), "never connected, so nothing is reported lost");
    }

    @Test
    void answeredPingCancelsTheTimeout()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);
        heartbeat.onPong(1, 1);

        // keep answering every ping for a while
        for (int i = 0; i < 20; i++) {
            scheduler.advanceMillis(100);
            assertTrue(heartbeat.onPong(1, port.lastPing()));
        }

        assertEquals(Phase.CONNECTED, heartbeat.phase(1));
        assertEquals(List.of("ready 1"), port.calls);
    }

    @Test
    void reconnectResyncsBeforeReady()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);
        heartbeat.onPong(1, port.lastPing());

        // lost at 550 ms
        scheduler.advanceMillis(450);
        assertEquals(List.of("ready 1", "lost 1"), port.calls);
        port.calls.clear();

        // the ping at 600 ms is answered
        scheduler.advanceMillis(50);
        assertTrue(heartbeat.onPong(1, port.lastPing()));

        assertEquals(List.of("resync 1", "ready 1"), port.calls);
        assertTrue(heartbeat.state(1).wasConnectedBefore());
    }

    @Test
    void resetIsSilentAndStopsTheTimeout()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);
        heartbeat.onPong(1, 1);
        scheduler.advanceMillis(100);

        heartbeat.reset(1);

        assertEquals(Phase.DISCONNECTED, heartbeat.phase(1));
        port.linkUp = false;
        scheduler.advanceMillis(1000);
        assertEquals(List.of("ready 1"), port.calls);
    }

    @Test
    void noPingsWhileTheLinkIsDown()
    {
        port.linkUp = false;
        heartbeat.start();

        scheduler.advanceMillis(500);

        assertTrue(port.pings.isEmpty());
        assertEquals(Phase.DISCONNECTED, heartbeat.phase(1));
    }

    @Test
    void phaseChangesAreObservable()
    {
        heartbeat.start();
        scheduler.advanceMillis(100);
        heartbeat.onPong(1, 1);

        List<RemotePhaseEvent> events = sink.eventsOfType(RemotePhaseEvent.class);
        assertEquals(2, events.size());
        assertEquals(Phase.DISCONNECTED, events.get(0).oldPhase());
        assertEquals(Phase.CONNECTING, events.get(0).newPhase());
        assertEquals(Phase.CONNECTED, events.get(1).newPhase());
    }

    @Test
    void stopCancelsTheTick()
    {
        heartbeat.start();
        heartbeat.stop();

        scheduler.advanceMillis(500);

        assertTrue(port.pings.isEmpty());
        assertEquals(0, scheduler.pendingTaskCount());
    }
}

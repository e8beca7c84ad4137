package com.questrail.wfs.osc.internal.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonotonicSchedulerTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);

    @Test
    void oneShotRunsOnlyOnceDeadlineReached() {
        List<String> runs = new ArrayList<>();
        scheduler.scheduleAtNanos(clock.nowNanos() + Duration.ofMillis(10).toNanos(), () -> runs.add("x"));

        scheduler.advanceMillis(9);
        assertTrue(runs.isEmpty());

        scheduler.advanceMillis(1);
        assertEquals(List.of("x"), runs);
    }

    @Test
    void repeatingTaskKeepsCadence() {
        List<Long> runTimes = new ArrayList<>();
        scheduler.scheduleRepeating(Duration.ofMillis(10), clock, () -> runTimes.add(clock.nowMillis()));

        scheduler.advanceMillis(35);

        assertEquals(List.of(10L, 20L, 30L), runTimes);
    }

    @Test
    void cancellingRepeatingTaskStopsFutureRuns() {
        List<Long> runTimes = new ArrayList<>();
        Cancellable handle = scheduler.scheduleRepeating(Duration.ofMillis(10), clock,
                () -> runTimes.add(clock.nowMillis()));

        scheduler.advanceMillis(15);
        assertTrue(handle.cancel());
        assertFalse(handle.cancel(), "second cancel reports nothing left to cancel");

        scheduler.advanceMillis(50);
        assertEquals(List.of(10L), runTimes);
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void repeatingTaskMaySelfCancel() {
        List<Long> runTimes = new ArrayList<>();
        Cancellable[] handle = new Cancellable[1];
        handle[0] = scheduler.scheduleRepeating(Duration.ofMillis(5), clock, () -> {
            runTimes.add(clock.nowMillis());
            if (runTimes.size() == 2) {
                handle[0].cancel();
            }
        });

        scheduler.advanceMillis(40);
        assertEquals(List.of(5L, 10L), runTimes);
    }

    @Test
    void timersDueTogetherFireInArmingOrder() {
        List<String> runs = new ArrayList<>();
        long due = clock.nowNanos() + Duration.ofMillis(3).toNanos();
        scheduler.scheduleAtNanos(due, () -> runs.add("first"));
        scheduler.scheduleAtNanos(due, () -> runs.add("second"));

        scheduler.advanceMillis(3);

        assertEquals(List.of("first", "second"), runs);
    }

    @Test
    void zeroPeriodRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleRepeating(Duration.ZERO, clock, () -> {}));
    }
}

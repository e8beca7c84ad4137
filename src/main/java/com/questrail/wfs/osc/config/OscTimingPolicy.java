package com.questrail.wfs.osc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * OscTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the network layer.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>minSendInterval</b>: Minimum spacing between two flushes to the same
 *       target. The rate limiter ticks at half this interval.</li>
 *   <li><b>heartbeatInterval</b>: Spacing between REMOTE pings.</li>
 *   <li><b>connectionTimeout</b>: How long a REMOTE target may leave its oldest
 *       ping unanswered before it is demoted to disconnected.</li>
 *   <li><b>tcpConnectTimeout</b>: Upper bound for one background TCP connect.</li>
 *   <li><b>statusPollInterval</b>: Spacing of the manager's reconciliation of
 *       recorded target status against each connection's live status.</li>
 * </ul>
 *
 * <p>All values are interpreted against a monotonic clock.</p>
 */
public record OscTimingPolicy(
        Duration minSendInterval,
        Duration heartbeatInterval,
        Duration connectionTimeout,
        Duration tcpConnectTimeout,
        Duration statusPollInterval
) {
    public OscTimingPolicy {
        requirePositive(minSendInterval, "minSendInterval");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(connectionTimeout, "connectionTimeout");
        requirePositive(tcpConnectTimeout, "tcpConnectTimeout");
        requirePositive(statusPollInterval, "statusPollInterval");
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>minSendInterval: 20ms (50 Hz)</li>
     *   <li>heartbeatInterval: 2000ms</li>
     *   <li>connectionTimeout: 6000ms</li>
     *   <li>tcpConnectTimeout: 2000ms</li>
     *   <li>statusPollInterval: 500ms</li>
     * </ul>
     */
    public static OscTimingPolicy defaults() {
        return new OscTimingPolicy(
                Duration.ofMillis(OscLimits.MIN_INTERVAL_MS),
                Duration.ofMillis(2000),
                Duration.ofMillis(6000),
                Duration.ofMillis(2000),
                Duration.ofMillis(500)
        );
    }

    /**
     * Returns a copy with the send interval derived from a rate in Hz
     * (clamped to at least 1 Hz).
     */
    public OscTimingPolicy withMaxRateHz(int hz) {
        int clamped = Math.max(1, hz);
        return new OscTimingPolicy(Duration.ofMillis(1000 / clamped),
                heartbeatInterval, connectionTimeout, tcpConnectTimeout, statusPollInterval);
    }
}

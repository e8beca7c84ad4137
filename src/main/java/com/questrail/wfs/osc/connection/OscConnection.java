package com.questrail.wfs.osc.connection;

import com.questrail.wfs.osc.codec.OscPacketEncoder;
import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.config.TargetConfig;
import com.questrail.wfs.osc.internal.time.WallClock;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscPacket;
import com.questrail.wfs.osc.observability.ConnectionStatusEvent;
import com.questrail.wfs.osc.observability.OscErrorEvent;
import com.questrail.wfs.osc.observability.OscObservabilitySink;
import com.questrail.wfs.osc.transport.OscLink;
import com.questrail.wfs.osc.transport.OscLinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * OscConnection
 * =============================================================================
 * Outbound connection to one target slot.
 *
 * <h2>Transports</h2>
 * <ul>
 *   <li><b>UDP</b>: {@link #connect()} opens the sender on the caller's thread
 *       and returns the outcome directly.</li>
 *   <li><b>TCP</b>: {@link #connect()} moves to {@code CONNECTING} and hands
 *       the blocking connect to the connect executor. The result is
 *       published through the status listener.</li>
 * </ul>
 *
 * <h2>Cancellation</h2>
 * Every connect attempt is stamped with a generation number. {@link #disconnect()}
 * and {@link #configure(TargetConfig)} advance the generation and interrupt
 * the attempt in flight; a result whose generation is no longer current is
 * closed and dropped. The connection lock is never held while cancelling or
 * while calling the status listener.
 *
 * <h2>Failures</h2>
 * Nothing here throws across threads. An invalid config or failed connect
 * becomes {@code ERROR}; a failed TCP write becomes {@code DISCONNECTED} so
 * the manager can reconnect. Writes are never retried.
 */
public final class OscConnection
{
    private static final Logger log = LoggerFactory.getLogger(OscConnection.class);

    private final int targetIndex;
    private final OscLinkFactory links;
    private final OscPacketEncoder encoder;
    private final ExecutorService connectExecutor;
    private final Duration tcpConnectTimeout;
    private final OscObservabilitySink sink;
    private final WallClock wallClock;
    private final BiConsumer<Integer, ConnectionStatus> statusListener;

    private final Object lock = new Object();

    // Guarded by lock.
    private TargetConfig config = TargetConfig.disabled();
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private OscLink link;
    private Future<?> pendingConnect;
    private long generation;

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong sendErrors = new AtomicLong();

    public OscConnection(int targetIndex,
                         OscLinkFactory links,
                         OscPacketEncoder encoder,
                         ExecutorService connectExecutor,
                         Duration tcpConnectTimeout,
                         OscObservabilitySink sink,
                         WallClock wallClock,
                         BiConsumer<Integer, ConnectionStatus> statusListener)
    {
        this.targetIndex = targetIndex;
        this.links = Objects.requireNonNull(links, "links");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
        this.tcpConnectTimeout = Objects.requireNonNull(tcpConnectTimeout, "tcpConnectTimeout");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.statusListener = Objects.requireNonNull(statusListener, "statusListener");
    }

    public int targetIndex()
    {
        return targetIndex;
    }

    // -------------------------------------------------------------------------
    // Configuration
    // -------------------------------------------------------------------------

    /**
     * Replace the target configuration and bring the connection in line with it.
     *
     * <ul>
     *   <li>Should not transmit (disabled protocol or tx off): disconnect,
     *       which also clears an earlier error.</li>
     *   <li>Endpoint (ip, port, mode) changed: disconnect, then connect.</li>
     *   <li>Not connected or connecting: connect.</li>
     *   <li>Otherwise keep the current link.</li>
     * </ul>
     */
    public void configure(TargetConfig next)
    {
        Objects.requireNonNull(next, "next");

        TargetConfig previous;
        boolean engaged;
        boolean idle;
        synchronized (lock) {
            previous = config;
            config = next;
            engaged = status == ConnectionStatus.CONNECTED || status == ConnectionStatus.CONNECTING;
            idle = status == ConnectionStatus.DISCONNECTED;
        }

        if (!next.shouldTransmit()) {
            if (!idle) {
                disconnect();
            }
            return;
        }

        if (engaged && !previous.endpointDiffers(next)) {
            return;
        }
        if (engaged) {
            disconnect();
        }
        connect();
    }

    public TargetConfig config()
    {
        synchronized (lock) {
            return config;
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Start connecting with the current configuration. Any link or attempt in
     * progress is dropped first.
     *
     * @return for UDP, whether the sender is open; for TCP, whether the
     *         background attempt was started
     */
    public boolean connect()
    {
        Future<?> superseded;
        OscLink stale;
        TargetConfig cfg;
        long attempt;
        ConnectionStatus previous;
        boolean valid;

        synchronized (lock) {
            cfg = config;
            attempt = ++generation;
            superseded = pendingConnect;
            pendingConnect = null;
            stale = link;
            link = null;
            previous = status;
            valid = cfg.isValid();
            status = valid
                    ? (cfg.mode() == ConnectionMode.TCP ? ConnectionStatus.CONNECTING : status)
                    : ConnectionStatus.ERROR;
        }

        cancel(superseded);
        closeQuietly(stale);

        if (!valid) {
            fireStatus(previous, ConnectionStatus.ERROR);
            reportError("Invalid target configuration " + describe(cfg), null);
            return false;
        }

        if (cfg.mode() == ConnectionMode.UDP) {
            return connectUdp(cfg, attempt, previous);
        }

        fireStatus(previous, ConnectionStatus.CONNECTING);
        return startTcpConnect(cfg, attempt);
    }

    private boolean connectUdp(TargetConfig cfg, long attempt, ConnectionStatus previous)
    {
        OscLink opened;
        try {
            opened = links.openUdp(new InetSocketAddress(cfg.ipAddress(), cfg.port()));
        }
        catch (IOException e) {
            if (publishFailure(attempt)) {
                fireStatus(previous, ConnectionStatus.ERROR);
                reportError("UDP sender for " + describe(cfg) + " failed", e);
            }
            return false;
        }

        ConnectionStatus before = publishLink(attempt, opened);
        if (before == null) {
            closeQuietly(opened);
            return false;
        }
        fireStatus(before, ConnectionStatus.CONNECTED);
        return true;
    }

    private boolean startTcpConnect(TargetConfig cfg, long attempt)
    {
        Future<?> future;
        try {
            future = connectExecutor.submit(() -> runTcpConnect(cfg, attempt));
        }
        catch (RejectedExecutionException e) {
            if (publishFailure(attempt)) {
                fireStatus(ConnectionStatus.CONNECTING, ConnectionStatus.ERROR);
                reportError("TCP connect to " + describe(cfg) + " could not be started", e);
            }
            return false;
        }

        boolean current;
        synchronized (lock) {
            current = attempt == generation && status == ConnectionStatus.CONNECTING;
            if (current) {
                pendingConnect = future;
            }
        }
        if (!current) {
            future.cancel(true);
        }
        return true;
    }

    private void runTcpConnect(TargetConfig cfg, long attempt)
    {
        OscLink opened;
        try {
            opened = links.openTcp(new InetSocketAddress(cfg.ipAddress(), cfg.port()), tcpConnectTimeout);
        }
        catch (IOException e) {
            if (publishFailure(attempt)) {
                fireStatus(ConnectionStatus.CONNECTING, ConnectionStatus.ERROR);
                reportError("TCP connect to " + describe(cfg) + " failed", e);
            }
            return;
        }

        ConnectionStatus before = publishLink(attempt, opened);
        if (before == null) {
            log.debug("Target {}: dropping superseded TCP connection to {}", targetIndex + 1, describe(cfg));
            closeQuietly(opened);
            return;
        }
        fireStatus(before, ConnectionStatus.CONNECTED);
    }

    /**
     * Install a freshly opened link if {@code attempt} is still current.
     *
     * @return the status replaced, or {@code null} if the attempt is stale
     */
    private ConnectionStatus publishLink(long attempt, OscLink opened)
    {
        synchronized (lock) {
            if (attempt != generation) {
                return null;
            }
            ConnectionStatus before = status;
            link = opened;
            pendingConnect = null;
            status = ConnectionStatus.CONNECTED;
            messagesSent.set(0);
            sendErrors.set(0);
            return before;
        }
    }

    /**
     * @return {@code true} if {@code attempt} was current and now owns the ERROR status
     */
    private boolean publishFailure(long attempt)
    {
        synchronized (lock) {
            if (attempt != generation) {
                return false;
            }
            pendingConnect = null;
            status = ConnectionStatus.ERROR;
            return true;
        }
    }

    /**
     * Close the link, cancel any connect attempt in flight and move to
     * {@code DISCONNECTED}.
     */
    public void disconnect()
    {
        Future<?> inFlight;
        OscLink closing;
        ConnectionStatus previous;

        synchronized (lock) {
            generation++;
            inFlight = pendingConnect;
            pendingConnect = null;
            closing = link;
            link = null;
            previous = status;
            status = ConnectionStatus.DISCONNECTED;
        }

        cancel(inFlight);
        closeQuietly(closing);
        fireStatus(previous, ConnectionStatus.DISCONNECTED);
    }

    public ConnectionStatus status()
    {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isConnected()
    {
        return status() == ConnectionStatus.CONNECTED;
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    /**
     * Encode and write one packet.
     *
     * @return {@code false} when not connected, tx is off, or the write failed
     */
    public boolean send(OscPacket packet)
    {
        Objects.requireNonNull(packet, "packet");

        OscLink out;
        TargetConfig cfg;
        synchronized (lock) {
            if (status != ConnectionStatus.CONNECTED || link == null || !config.txEnabled()) {
                return false;
            }
            out = link;
            cfg = config;
        }

        if (out.write(encoder.encode(packet))) {
            messagesSent.addAndGet(packet instanceof OscBundle b ? b.elements().size() : 1);
            return true;
        }

        sendErrors.incrementAndGet();
        if (cfg.mode() == ConnectionMode.TCP) {
            demoteAfterWriteFailure(out, cfg);
        }
        return false;
    }

    private void demoteAfterWriteFailure(OscLink failed, TargetConfig cfg)
    {
        ConnectionStatus previous;
        synchronized (lock) {
            if (link != failed) {
                return;
            }
            generation++;
            link = null;
            previous = status;
            status = ConnectionStatus.DISCONNECTED;
        }

        closeQuietly(failed);
        fireStatus(previous, ConnectionStatus.DISCONNECTED);
        reportError("TCP write to " + describe(cfg) + " failed", null);
    }

    public ConnectionStatistics statistics()
    {
        return new ConnectionStatistics(messagesSent.get(), sendErrors.get());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void fireStatus(ConnectionStatus previous, ConnectionStatus next)
    {
        if (previous == next) {
            return;
        }
        sink.onConnectionStatus(new ConnectionStatusEvent(wallClock.now(), targetIndex, previous, next));
        statusListener.accept(targetIndex, next);
    }

    private void reportError(String message, Throwable cause)
    {
        sink.onError(new OscErrorEvent(wallClock.now(), targetIndex, message, cause));
    }

    private static void cancel(Future<?> future)
    {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static void closeQuietly(OscLink link)
    {
        if (link != null) {
            link.close();
        }
    }

    private static String describe(TargetConfig cfg)
    {
        return cfg.mode() + " " + cfg.ipAddress() + ":" + cfg.port();
    }
}

package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.codec.OscPacketEncoder;
import com.questrail.wfs.osc.codec.impl.DefaultOscPacketEncoder;
import com.questrail.wfs.osc.config.GlobalConfig;
import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.config.OscProtocol;
import com.questrail.wfs.osc.config.OscTimingPolicy;
import com.questrail.wfs.osc.config.TargetConfig;
import com.questrail.wfs.osc.connection.ConnectionStatus;
import com.questrail.wfs.osc.connection.OscConnection;
import com.questrail.wfs.osc.internal.time.Cancellable;
import com.questrail.wfs.osc.internal.time.MonotonicClock;
import com.questrail.wfs.osc.internal.time.MonotonicScheduler;
import com.questrail.wfs.osc.internal.time.ScheduledExecutorScheduler;
import com.questrail.wfs.osc.internal.time.SystemMonotonicClock;
import com.questrail.wfs.osc.internal.time.SystemWallClock;
import com.questrail.wfs.osc.internal.time.WallClock;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.observability.NullOscObservabilitySink;
import com.questrail.wfs.osc.observability.OscErrorEvent;
import com.questrail.wfs.osc.observability.OscLogEntry;
import com.questrail.wfs.osc.observability.OscObservabilitySink;
import com.questrail.wfs.osc.ratelimit.OscRateLimiter;
import com.questrail.wfs.osc.routing.OscMessageBuilder;
import com.questrail.wfs.osc.routing.ParameterId;
import com.questrail.wfs.osc.routing.ParameterScope;
import com.questrail.wfs.osc.routing.ParameterValue;
import com.questrail.wfs.osc.transport.OscLinkFactory;
import com.questrail.wfs.osc.transport.OscPacketSource;
import com.questrail.wfs.osc.transport.OscReceiver;
import com.questrail.wfs.osc.transport.OscReceiverFactory;
import com.questrail.wfs.osc.transport.netty.NettyOscTransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OscManager
 * =============================================================================
 * Composition root and integration point of the OSC network layer.
 *
 * <h2>Owns</h2>
 * <ul>
 *   <li>one {@link OscConnection} per target slot,</li>
 *   <li>the {@link OscRateLimiter} every queued send goes through,</li>
 *   <li>the UDP and TCP receivers while listening,</li>
 *   <li>the REMOTE heartbeat and position constraints.</li>
 * </ul>
 *
 * <h2>Outbound</h2>
 * The application reports parameter changes through
 * {@link #onParameterChanged(ParameterId, int, ParameterValue)}. Standard OSC
 * targets receive the {@code /wfs} form; REMOTE targets receive the REMOTE
 * form, and only for the channel the REMOTE client has selected. Stage
 * changes push the stage description to connected REMOTE targets instead.
 * A change made while applying an inbound message is not sent back to
 * targets of the protocol it arrived on.
 *
 * <h2>Timers</h2>
 * Three independent repeating timers run on the scheduler: the rate limiter
 * tick, the REMOTE heartbeat, and a status poll that reconciles each
 * target's recorded status with its connection.
 *
 * <h2>Threading</h2>
 * Configuration and recorded statuses share one lock, held only to read or
 * replace values. No I/O and no callback runs under it. Nothing here throws
 * across threads: failures become statuses, counters, {@code false} returns
 * and {@link OscObservabilitySink#onError} events.
 */
public final class OscManager implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OscManager.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ParameterStore store;
    private final OscManagerCallbacks callbacks;
    private final OscObservabilitySink sink;
    private final OscTimingPolicy timing;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final OscReceiverFactory receiverFactory;

    private final ExecutorService ownedConnectExecutor;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final NettyOscTransportFactory ownedTransport;

    private final OscConnection[] connections = new OscConnection[OscLimits.MAX_TARGETS];
    private final OscRateLimiter rateLimiter;
    private final RemoteHeartbeat heartbeat;
    private final PositionConstraints constraints;
    private final InboundDispatcher inbound;

    private final Object configLock = new Object();

    // Guarded by configLock.
    private GlobalConfig globalConfig = GlobalConfig.defaults();
    private final TargetConfig[] targetConfigs = new TargetConfig[OscLimits.MAX_TARGETS];
    private final ConnectionStatus[] targetStatuses = new ConnectionStatus[OscLimits.MAX_TARGETS];

    private final Object listenLock = new Object();

    // Guarded by listenLock.
    private OscReceiver udpReceiver;
    private OscReceiver tcpReceiver;

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong retiredReceiverParseErrors = new AtomicLong();
    private final AtomicLong receiverParseErrorOffset = new AtomicLong();

    private volatile boolean loggingEnabled = true;
    private volatile int remoteSelectedChannel = 1;
    private volatile boolean closed;
    private volatile Cancellable statusPoll;

    private OscManager(Builder b)
    {
        this.store = b.store;
        this.callbacks = b.callbacks;
        this.sink = b.sink;
        this.timing = b.timing;
        this.clock = b.clock;
        this.wallClock = b.wallClock;

        if (b.scheduler != null) {
            this.scheduler = b.scheduler;
            this.ownedSchedulerExecutor = null;
        }
        else {
            this.ownedSchedulerExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("wfs-osc-timer"));
            this.scheduler = new ScheduledExecutorScheduler(ownedSchedulerExecutor, clock);
        }

        ExecutorService connectExecutor;
        if (b.connectExecutor != null) {
            connectExecutor = b.connectExecutor;
            this.ownedConnectExecutor = null;
        }
        else {
            connectExecutor = Executors.newCachedThreadPool(daemonThreads("wfs-osc-connect"));
            this.ownedConnectExecutor = connectExecutor;
        }

        OscLinkFactory links = b.linkFactory;
        OscReceiverFactory receivers = b.receiverFactory;
        if (links == null || receivers == null) {
            this.ownedTransport = new NettyOscTransportFactory();
            links = links != null ? links : ownedTransport;
            receivers = receivers != null ? receivers : ownedTransport;
        }
        else {
            this.ownedTransport = null;
        }
        this.receiverFactory = receivers;

        Arrays.fill(targetConfigs, TargetConfig.disabled());
        Arrays.fill(targetStatuses, ConnectionStatus.DISCONNECTED);

        for (int i = 0; i < connections.length; i++) {
            connections[i] = new OscConnection(i, links, b.encoder, connectExecutor, timing.tcpConnectTimeout(),
                    sink, wallClock, this::updateTargetStatus);
        }

        int maxRateHz = (int) Math.max(1, 1000 / Math.max(1, timing.minSendInterval().toMillis()));
        this.rateLimiter = new OscRateLimiter(clock, scheduler, maxRateHz,
                i -> targetConfig(i).shouldTransmit(), this::transmit);
        this.heartbeat = new RemoteHeartbeat(clock, scheduler, timing, new HeartbeatPort(), sink, wallClock);
        this.constraints = new PositionConstraints(store);
        this.inbound = new InboundDispatcher(this, store, constraints, callbacks, heartbeat);
    }

    private void startTimers()
    {
        rateLimiter.start();
        heartbeat.start();
        statusPoll = scheduler.scheduleRepeating(timing.statusPollInterval(), clock, this::pollStatus);
    }

    // -------------------------------------------------------------------------
    // Configuration
    // -------------------------------------------------------------------------

    /**
     * Adopt receive ports, interface and IP filter settings. Listening is
     * restarted when a receive port or the interface changed while listening.
     */
    public void applyGlobalConfig(GlobalConfig config)
    {
        Objects.requireNonNull(config, "config");
        GlobalConfig previous;
        synchronized (configLock) {
            previous = globalConfig;
            globalConfig = config;
        }

        if (isListening() && config.receivePortsDiffer(previous)) {
            log.info("Receive ports changed ({} -> {} UDP, {} -> {} TCP); restarting listeners",
                    previous.udpReceivePort(), config.udpReceivePort(),
                    previous.tcpReceivePort(), config.tcpReceivePort());
            stopListening();
            startListening();
        }
    }

    public GlobalConfig globalConfig()
    {
        synchronized (configLock) {
            return globalConfig;
        }
    }

    /**
     * Replace one target's configuration and reconnect, connect or disconnect
     * it as the new configuration requires. Ignored for an invalid index.
     */
    public void applyTargetConfig(int targetIndex, TargetConfig config)
    {
        Objects.requireNonNull(config, "config");
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return;
        }

        TargetConfig previous;
        synchronized (configLock) {
            previous = targetConfigs[targetIndex];
            targetConfigs[targetIndex] = config;
        }

        if (previous.protocol() == OscProtocol.REMOTE
                && (config.protocol() != OscProtocol.REMOTE || previous.endpointDiffers(config))) {
            heartbeat.reset(targetIndex);
        }
        connections[targetIndex].configure(config);
    }

    /**
     * @return the target's configuration, or a disabled one for an invalid index
     */
    public TargetConfig targetConfig(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return TargetConfig.disabled();
        }
        synchronized (configLock) {
            return targetConfigs[targetIndex];
        }
    }

    public void setIpFilteringEnabled(boolean enabled)
    {
        synchronized (configLock) {
            globalConfig = globalConfig.toBuilder().withIpFilteringEnabled(enabled).build();
        }
    }

    public boolean isIpFilteringEnabled()
    {
        return globalConfig().ipFilteringEnabled();
    }

    public void setLoggingEnabled(boolean enabled)
    {
        this.loggingEnabled = enabled;
    }

    public boolean isLoggingEnabled()
    {
        return loggingEnabled;
    }

    // -------------------------------------------------------------------------
    // Listening
    // -------------------------------------------------------------------------

    /**
     * Bind the UDP and TCP receivers. A UDP bind failure fails the call; a
     * TCP bind failure is reported and listening continues on UDP alone.
     *
     * @return {@code true} if listening (or already listening)
     */
    public boolean startListening()
    {
        if (closed) {
            return false;
        }
        GlobalConfig config = globalConfig();

        synchronized (listenLock) {
            if (udpReceiver != null) {
                return true;
            }

            OscReceiver udp = receiverFactory.udp(bindAddress(config, config.udpReceivePort()), inbound);
            if (!udp.start()) {
                reportError(-1, "UDP receiver could not bind port " + config.udpReceivePort(), null);
                return false;
            }

            OscReceiver tcp = receiverFactory.tcp(bindAddress(config, config.tcpReceivePort()), inbound);
            if (!tcp.start()) {
                reportError(-1, "TCP receiver could not bind port " + config.tcpReceivePort()
                        + "; continuing with UDP only", null);
                tcp = null;
            }

            udpReceiver = udp;
            tcpReceiver = tcp;
        }

        log.info("Listening for OSC on UDP {} and TCP {}", udpListenPort(), tcpListenPort());
        return true;
    }

    public void stopListening()
    {
        OscReceiver udp;
        OscReceiver tcp;
        synchronized (listenLock) {
            udp = udpReceiver;
            tcp = tcpReceiver;
            udpReceiver = null;
            tcpReceiver = null;
        }

        for (OscReceiver receiver : new OscReceiver[] { udp, tcp }) {
            if (receiver != null) {
                receiver.stop();
                retiredReceiverParseErrors.addAndGet(receiver.parseErrorCount());
            }
        }
        if (udp != null) {
            log.info("Stopped listening for OSC");
        }
    }

    public boolean isListening()
    {
        synchronized (listenLock) {
            return udpReceiver != null && udpReceiver.isListening();
        }
    }

    /**
     * Bound UDP port, or {@code -1} when not listening.
     */
    public int udpListenPort()
    {
        synchronized (listenLock) {
            return udpReceiver != null ? udpReceiver.localPort() : -1;
        }
    }

    /**
     * Bound TCP port, or {@code -1} when not listening on TCP.
     */
    public int tcpListenPort()
    {
        synchronized (listenLock) {
            return tcpReceiver != null ? tcpReceiver.localPort() : -1;
        }
    }

    private static InetSocketAddress bindAddress(GlobalConfig config, int port)
    {
        return config.networkInterface().isEmpty()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(config.networkInterface(), port);
    }

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    public boolean connectTarget(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return false;
        }
        return connections[targetIndex].connect();
    }

    public void disconnectTarget(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return;
        }
        connections[targetIndex].disconnect();
        heartbeat.reset(targetIndex);
    }

    public void disconnectAll()
    {
        for (int i = 0; i < connections.length; i++) {
            disconnectTarget(i);
        }
    }

    /**
     * Recorded status of a target; {@code DISCONNECTED} for an invalid index.
     */
    public ConnectionStatus targetStatus(int targetIndex)
    {
        if (!OscLimits.isValidTargetIndex(targetIndex)) {
            return ConnectionStatus.DISCONNECTED;
        }
        synchronized (configLock) {
            return targetStatuses[targetIndex];
        }
    }

    private void updateTargetStatus(int targetIndex, ConnectionStatus status)
    {
        boolean remote;
        synchronized (configLock) {
            if (targetStatuses[targetIndex] == status) {
                return;
            }
            targetStatuses[targetIndex] = status;
            remote = targetConfigs[targetIndex].protocol() == OscProtocol.REMOTE;
        }

        if (remote && status == ConnectionStatus.CONNECTED) {
            pushStageConfig();
        }
        callbacks.onConnectionStatusChanged(targetIndex, status);
    }

    /**
     * Pick up status changes the connections made on their own, such as a
     * TCP write failure.
     */
    void pollStatus()
    {
        for (int i = 0; i < connections.length; i++) {
            updateTargetStatus(i, connections[i].status());
        }
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    /**
     * Queue a message for one target.
     *
     * @return {@code false} for an invalid index or a target that does not transmit
     */
    public boolean sendMessage(int targetIndex, OscMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!OscLimits.isValidTargetIndex(targetIndex) || !targetConfig(targetIndex).shouldTransmit()) {
            return false;
        }
        rateLimiter.queueMessage(targetIndex, message);
        return true;
    }

    /**
     * Queue a message for every transmitting target.
     */
    public void broadcastMessage(OscMessage message)
    {
        rateLimiter.queueBroadcast(message);
    }

    /**
     * Send everything queued now, ignoring the rate limit.
     */
    public void flushMessages()
    {
        rateLimiter.flushAll();
    }

    /**
     * Write one message on a target's connection. Used by the rate limiter
     * and for heartbeat traffic.
     */
    boolean transmit(int targetIndex, OscMessage message)
    {
        OscConnection connection = connections[targetIndex];
        if (!connection.send(message)) {
            return false;
        }
        messagesSent.incrementAndGet();
        if (loggingEnabled) {
            TargetConfig config = connection.config();
            sink.onTraffic(OscLogEntry.transmitted(wallClock.now(), targetIndex, message,
                    config.protocol(), config.ipAddress(), config.port(), config.mode()));
        }
        return true;
    }

    void sendDirect(int targetIndex, OscMessage message)
    {
        transmit(targetIndex, message);
    }

    // -------------------------------------------------------------------------
    // Outbound parameter changes
    // -------------------------------------------------------------------------

    /**
     * Translate a parameter change into OSC for every transmitting target.
     *
     * @param channelIndex 0-based channel, or {@link ParameterStore#GLOBAL} for configuration
     */
    public void onParameterChanged(ParameterId parameter, int channelIndex, ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");

        if (parameter.isStage()) {
            pushStageConfig();
            return;
        }

        OscProtocol origin = inbound.incomingProtocol();
        int channelId = channelIndex + 1;
        boolean remoteVisible = parameter.scope() == ParameterScope.INPUT
                && channelId == remoteSelectedChannel;

        for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
            TargetConfig config = targetConfig(i);
            if (!config.shouldTransmit() || config.protocol() == origin) {
                continue;
            }

            Optional<OscMessage> message;
            if (config.protocol() == OscProtocol.OSC) {
                message = standardMessage(parameter, channelId, value);
            }
            else if (config.protocol() == OscProtocol.REMOTE && remoteVisible) {
                message = OscMessageBuilder.buildRemoteOutputMessage(parameter, channelId, value);
            }
            else {
                message = Optional.empty();
            }

            if (message.isPresent()) {
                sendMessage(i, message.get());
            }
        }
    }

    /**
     * Translate a change of one EQ band. Only standard OSC targets carry
     * band parameters.
     */
    public void onBandParameterChanged(ParameterId parameter, int channelIndex, int band, ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");

        OscProtocol origin = inbound.incomingProtocol();
        Optional<OscMessage> message = OscMessageBuilder.buildBandMessage(parameter, channelIndex + 1, band, value);
        if (message.isEmpty()) {
            return;
        }

        for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
            TargetConfig config = targetConfig(i);
            if (config.shouldTransmit() && config.protocol() == OscProtocol.OSC && config.protocol() != origin) {
                sendMessage(i, message.get());
            }
        }
    }

    /**
     * The number of input channels changed; REMOTE clients learn it with the
     * stage description.
     */
    public void onInputCountChanged()
    {
        pushStageConfig();
    }

    private static Optional<OscMessage> standardMessage(ParameterId parameter, int channelId, ParameterValue value)
    {
        switch (parameter.scope()) {
            case INPUT:
                return OscMessageBuilder.buildInputMessage(parameter, channelId, value);
            case OUTPUT:
                return OscMessageBuilder.buildOutputMessage(parameter, channelId, value);
            case REVERB:
                return OscMessageBuilder.buildReverbMessage(parameter, channelId, value);
            default:
                return OscMessageBuilder.buildConfigMessage(parameter, value);
        }
    }

    // -------------------------------------------------------------------------
    // REMOTE
    // -------------------------------------------------------------------------

    /**
     * Send the stage description and input count to every connected REMOTE
     * target.
     */
    public void pushStageConfig()
    {
        List<OscMessage> messages = stageMessages();
        for (int targetIndex : connectedRemoteTargets()) {
            messages.forEach(m -> sendMessage(targetIndex, m));
        }
    }

    private List<OscMessage> stageMessages()
    {
        return OscMessageBuilder.buildStageConfig(constraints.stage(), store.inputChannelCount());
    }

    /**
     * Ask every connected REMOTE client to identify itself.
     */
    public void sendFindDevice(String password)
    {
        OscMessage message = OscMessageBuilder.buildFindDevice(password);
        int sent = 0;
        for (int targetIndex : connectedRemoteTargets()) {
            if (sendMessage(targetIndex, message)) {
                sent++;
            }
        }
        log.debug("findDevice queued for {} REMOTE target(s)", sent);
    }

    public void setRemoteSelectedChannel(int channelId)
    {
        this.remoteSelectedChannel = channelId;
    }

    /**
     * Channel (1-based) REMOTE clients currently follow.
     */
    public int remoteSelectedChannel()
    {
        return remoteSelectedChannel;
    }

    public RemoteConnectionState.Phase remotePhase(int targetIndex)
    {
        return heartbeat.phase(targetIndex);
    }

    public RemoteConnectionState remoteState(int targetIndex)
    {
        return heartbeat.state(targetIndex);
    }

    /**
     * Send the values of one input channel to every transmitting REMOTE target.
     */
    void sendRemoteChannelDump(int channelId)
    {
        List<OscMessage> dump = channelDump(channelId);
        if (dump.isEmpty()) {
            return;
        }
        for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
            TargetConfig config = targetConfig(i);
            if (config.protocol() == OscProtocol.REMOTE && config.shouldTransmit()) {
                int targetIndex = i;
                dump.forEach(m -> sendMessage(targetIndex, m));
            }
        }
    }

    private List<OscMessage> channelDump(int channelId)
    {
        int channelIndex = channelId - 1;
        if (channelIndex < 0) {
            return List.of();
        }
        Map<ParameterId, ParameterValue> values = new EnumMap<>(ParameterId.class);
        for (ParameterId parameter : ParameterId.remoteChannelDump()) {
            store.get(parameter, channelIndex).ifPresent(v -> values.put(parameter, v));
        }
        return OscMessageBuilder.buildRemoteChannelDump(channelId, values);
    }

    /**
     * Bring a reconnected REMOTE client up to date: stage, then position,
     * name and tracking state of every input, then the selected channel.
     */
    private void resync(int targetIndex)
    {
        log.info("REMOTE target {}: resyncing after reconnect", targetIndex + 1);
        stageMessages().forEach(m -> sendMessage(targetIndex, m));

        List<ParameterId> perInput = List.of(
                ParameterId.INPUT_POSITION_X, ParameterId.INPUT_POSITION_Y, ParameterId.INPUT_POSITION_Z,
                ParameterId.INPUT_NAME, ParameterId.INPUT_TRACKING_ACTIVE);
        int inputs = store.inputChannelCount();
        for (int channelIndex = 0; channelIndex < inputs; channelIndex++) {
            for (ParameterId parameter : perInput) {
                int channelId = channelIndex + 1;
                store.get(parameter, channelIndex)
                        .flatMap(v -> OscMessageBuilder.buildRemoteOutputMessage(parameter, channelId, v))
                        .ifPresent(m -> sendMessage(targetIndex, m));
            }
        }

        channelDump(remoteSelectedChannel).forEach(m -> sendMessage(targetIndex, m));
    }

    private List<Integer> connectedRemoteTargets()
    {
        List<Integer> targets = new ArrayList<>();
        synchronized (configLock) {
            for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
                if (targetConfigs[i].protocol() == OscProtocol.REMOTE
                        && targetStatuses[i] == ConnectionStatus.CONNECTED) {
                    targets.add(i);
                }
            }
        }
        return targets;
    }

    /**
     * REMOTE targets configured with the given IP address.
     */
    List<Integer> remoteTargetsAt(String ip)
    {
        List<Integer> targets = new ArrayList<>();
        synchronized (configLock) {
            for (int i = 0; i < OscLimits.MAX_TARGETS; i++) {
                if (targetConfigs[i].protocol() == OscProtocol.REMOTE && targetConfigs[i].ipAddress().equals(ip)) {
                    targets.add(i);
                }
            }
        }
        return targets;
    }

    private final class HeartbeatPort implements RemoteHeartbeat.Port
    {
        @Override
        public boolean isRemoteTarget(int targetIndex)
        {
            return targetConfig(targetIndex).protocol() == OscProtocol.REMOTE;
        }

        @Override
        public boolean isLinkUp(int targetIndex)
        {
            return connections[targetIndex].isConnected();
        }

        @Override
        public void sendDirect(int targetIndex, OscMessage message)
        {
            transmit(targetIndex, message);
        }

        @Override
        public void resync(int targetIndex)
        {
            OscManager.this.resync(targetIndex);
        }

        @Override
        public void onReady(int targetIndex)
        {
            callbacks.onRemoteConnectionReady(targetIndex);
        }

        @Override
        public void onLost(int targetIndex)
        {
            log.info("REMOTE target {}: heartbeat lost", targetIndex + 1);
            callbacks.onRemoteDisconnected(targetIndex);
        }
    }

    // -------------------------------------------------------------------------
    // Inbound bookkeeping
    // -------------------------------------------------------------------------

    /**
     * Whether a packet from {@code ip} passes the IP filter. The allow-list is
     * the configured list plus the address of every enabled target.
     */
    boolean isAllowedSender(String ip)
    {
        synchronized (configLock) {
            if (!globalConfig.ipFilteringEnabled() || globalConfig.allowedIPs().contains(ip)) {
                return true;
            }
            for (TargetConfig config : targetConfigs) {
                if (config.protocol() != OscProtocol.DISABLED && config.ipAddress().equals(ip)) {
                    return true;
                }
            }
            return false;
        }
    }

    void recordReceived(OscMessage message, OscProtocol protocol, OscPacketSource source)
    {
        messagesReceived.incrementAndGet();
        if (loggingEnabled) {
            sink.onTraffic(OscLogEntry.received(wallClock.now(), message, protocol,
                    source.senderIp(), source.port(), source.transport()));
        }
    }

    void logRejected(String address, OscPacketSource source, String reason)
    {
        log.debug("Rejected {} from {}: {}", address, source.senderIp(), reason);
        if (loggingEnabled) {
            sink.onTraffic(OscLogEntry.rejected(wallClock.now(), address,
                    source.senderIp(), source.port(), source.transport(), reason));
        }
    }

    void recordParseError()
    {
        parseErrors.incrementAndGet();
    }

    /**
     * Current protocol marker of the calling thread. Exposed for the
     * application's store listener and for tests.
     */
    OscProtocol incomingProtocol()
    {
        return inbound.incomingProtocol();
    }

    // -------------------------------------------------------------------------
    // Statistics
    // -------------------------------------------------------------------------

    public OscStatistics statistics()
    {
        long receiverErrors = receiverParseErrors() - receiverParseErrorOffset.get();
        return new OscStatistics(
                messagesSent.get(),
                messagesReceived.get(),
                rateLimiter.totalCoalesced(),
                parseErrors.get() + receiverErrors);
    }

    public void resetStatistics()
    {
        messagesSent.set(0);
        messagesReceived.set(0);
        parseErrors.set(0);
        receiverParseErrorOffset.set(receiverParseErrors());
        rateLimiter.resetStats();
    }

    private long receiverParseErrors()
    {
        long total = retiredReceiverParseErrors.get();
        synchronized (listenLock) {
            if (udpReceiver != null) {
                total += udpReceiver.parseErrorCount();
            }
            if (tcpReceiver != null) {
                total += tcpReceiver.parseErrorCount();
            }
        }
        return total;
    }

    // -------------------------------------------------------------------------
    // Shutdown
    // -------------------------------------------------------------------------

    /**
     * Stop listening, stop every timer, disconnect every target and release
     * the executors and transport this manager created.
     */
    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        stopListening();

        Cancellable poll = statusPoll;
        if (poll != null) {
            poll.cancel();
        }
        heartbeat.stop();
        rateLimiter.stop();
        disconnectAll();

        if (ownedConnectExecutor != null) {
            ownedConnectExecutor.shutdownNow();
            awaitTermination(ownedConnectExecutor);
        }
        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            awaitTermination(ownedSchedulerExecutor);
        }
        if (ownedTransport != null) {
            ownedTransport.close();
        }
    }

    private static void awaitTermination(ExecutorService executor)
    {
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void reportError(int targetIndex, String message, Throwable cause)
    {
        sink.onError(new OscErrorEvent(wallClock.now(), targetIndex, message, cause));
    }

    private static ThreadFactory daemonThreads(String name)
    {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private ParameterStore store;
        private OscManagerCallbacks callbacks = OscManagerCallbacks.NONE;
        private OscObservabilitySink sink = NullOscObservabilitySink.INSTANCE;
        private OscTimingPolicy timing = OscTimingPolicy.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ExecutorService connectExecutor;
        private OscLinkFactory linkFactory;
        private OscReceiverFactory receiverFactory;
        private OscPacketEncoder encoder = new DefaultOscPacketEncoder();

        private Builder() {}

        public Builder withParameterStore(ParameterStore store)
        {
            this.store = store;
            return this;
        }

        public Builder withCallbacks(OscManagerCallbacks callbacks)
        {
            this.callbacks = callbacks;
            return this;
        }

        public Builder withObservabilitySink(OscObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public Builder withTimingPolicy(OscTimingPolicy timing)
        {
            this.timing = timing;
            return this;
        }

        /**
         * Clock for rate gating, heartbeats and timeouts. A supplied
         * scheduler must compute deadlines from the same clock.
         */
        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for all timers. When absent the manager creates and owns a
         * single-thread scheduler.
         */
        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Executor for background TCP connects. When absent the manager
         * creates and owns one.
         */
        public Builder withConnectExecutor(ExecutorService connectExecutor)
        {
            this.connectExecutor = connectExecutor;
            return this;
        }

        public Builder withLinkFactory(OscLinkFactory linkFactory)
        {
            this.linkFactory = linkFactory;
            return this;
        }

        public Builder withReceiverFactory(OscReceiverFactory receiverFactory)
        {
            this.receiverFactory = receiverFactory;
            return this;
        }

        public Builder withEncoder(OscPacketEncoder encoder)
        {
            this.encoder = encoder;
            return this;
        }

        /**
         * Build the manager and start its timers. Listening starts only on
         * {@link OscManager#startListening()}.
         */
        public OscManager build()
        {
            Objects.requireNonNull(store, "store");
            Objects.requireNonNull(callbacks, "callbacks");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(timing, "timing");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(encoder, "encoder");

            OscManager manager = new OscManager(this);
            manager.startTimers();
            return manager;
        }
    }
}

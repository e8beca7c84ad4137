package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.config.OscProtocol;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;
import com.questrail.wfs.osc.routing.AddressFamily;
import com.questrail.wfs.osc.routing.ArrayAdjust;
import com.questrail.wfs.osc.routing.ChannelParameterMessage;
import com.questrail.wfs.osc.routing.ClusterMove;
import com.questrail.wfs.osc.routing.ConfigParameterMessage;
import com.questrail.wfs.osc.routing.OscMessageBuilder;
import com.questrail.wfs.osc.routing.OscMessageRouter;
import com.questrail.wfs.osc.routing.ParameterId;
import com.questrail.wfs.osc.routing.ParameterValue;
import com.questrail.wfs.osc.routing.RemoteCommand;
import com.questrail.wfs.osc.transport.OscPacketListener;
import com.questrail.wfs.osc.transport.OscPacketSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * InboundDispatcher
 * =============================================================================
 * Turns received messages into parameter store writes and REMOTE actions.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>IP filter: a rejected message or bundle is logged and dropped.</li>
 *   <li>Each message, including every message nested in a bundle, is counted
 *       and logged as received.</li>
 *   <li>The address family picks the handler. Parse failures are counted.</li>
 * </ol>
 *
 * <h2>Loop prevention</h2>
 * Store writes run on the receiving thread with the incoming protocol
 * recorded in a thread-local marker: {@code OSC} for the {@code /wfs}
 * namespace, {@code REMOTE} for everything else. The manager reads the
 * marker when the store reports the change back, and skips targets of the
 * same protocol.
 *
 * <h2>Channel numbering</h2>
 * Channel ids on the wire are 1-based; store indices are 0-based. Messages
 * with a channel id below 1 are ignored.
 */
final class InboundDispatcher implements OscPacketListener
{
    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    static final String REJECTED_BUNDLE = "[bundle]";
    static final String REJECT_REASON = "IP not in allowed list";

    private final OscManager manager;
    private final ParameterStore store;
    private final PositionConstraints constraints;
    private final OscManagerCallbacks callbacks;
    private final RemoteHeartbeat heartbeat;

    private final ThreadLocal<OscProtocol> incoming = ThreadLocal.withInitial(() -> OscProtocol.DISABLED);

    InboundDispatcher(OscManager manager,
                      ParameterStore store,
                      PositionConstraints constraints,
                      OscManagerCallbacks callbacks,
                      RemoteHeartbeat heartbeat)
    {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.store = Objects.requireNonNull(store, "store");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
    }

    /**
     * Protocol of the message being applied on this thread, or
     * {@code DISABLED} outside inbound dispatch.
     */
    OscProtocol incomingProtocol()
    {
        return incoming.get();
    }

    // -------------------------------------------------------------------------
    // OscPacketListener
    // -------------------------------------------------------------------------

    @Override
    public void onMessage(OscMessage message, OscPacketSource source)
    {
        if (!manager.isAllowedSender(source.senderIp())) {
            manager.logRejected(message.address(), source, REJECT_REASON);
            return;
        }
        handle(message, source);
    }

    @Override
    public void onBundle(OscBundle bundle, OscPacketSource source)
    {
        if (!manager.isAllowedSender(source.senderIp())) {
            manager.logRejected(REJECTED_BUNDLE, source, REJECT_REASON);
            return;
        }
        walk(bundle, source);
    }

    private void walk(OscBundle bundle, OscPacketSource source)
    {
        for (OscPacket element : bundle.elements()) {
            if (element instanceof OscBundle nested) {
                walk(nested, source);
            }
            else {
                handle((OscMessage) element, source);
            }
        }
    }

    private void handle(OscMessage message, OscPacketSource source)
    {
        AddressFamily family = OscMessageRouter.classify(message.address());
        OscProtocol protocol = family.isRemoteDialect() ? OscProtocol.REMOTE : OscProtocol.OSC;
        manager.recordReceived(message, protocol, source);

        switch (family) {
            case INPUT:
                applyChannel(OscMessageRouter.parseInputMessage(message));
                break;
            case OUTPUT:
                applyChannel(OscMessageRouter.parseOutputMessage(message));
                break;
            case REVERB:
                applyChannel(OscMessageRouter.parseReverbMessage(message));
                break;
            case CONFIG:
                applyConfig(OscMessageRouter.parseConfigMessage(message));
                break;
            case REMOTE_INPUT:
                applyRemote(OscMessageRouter.parseRemoteInputMessage(message));
                break;
            case ARRAY_ADJUST:
                applyArrayAdjust(OscMessageRouter.parseArrayAdjustMessage(message));
                break;
            case CLUSTER_MOVE:
                applyClusterMove(OscMessageRouter.parseClusterMoveMessage(message));
                break;
            case REMOTE_PING:
                answerPing(OscMessageRouter.parseHeartbeatSequence(message), source);
                break;
            case REMOTE_PONG:
                acceptPong(OscMessageRouter.parseHeartbeatSequence(message), source);
                break;
            default:
                log.debug("Ignoring unhandled address {} from {}", message.address(), source.senderIp());
                break;
        }
    }

    private void runAs(OscProtocol protocol, Runnable writes)
    {
        OscProtocol previous = incoming.get();
        incoming.set(protocol);
        try {
            writes.run();
        }
        finally {
            incoming.set(previous);
        }
    }

    // -------------------------------------------------------------------------
    // Standard namespace
    // -------------------------------------------------------------------------

    private void applyChannel(Optional<ChannelParameterMessage> parsed)
    {
        if (parsed.isEmpty()) {
            manager.recordParseError();
            return;
        }
        ChannelParameterMessage m = parsed.get();
        int channelIndex = m.channelId() - 1;
        if (channelIndex < 0) {
            return;
        }

        runAs(OscProtocol.OSC, () -> {
            if (m.hasBand()) {
                store.setBanded(m.parameter(), channelIndex, m.band(), m.value());
            }
            else if (m.parameter().isInputPosition()) {
                writePosition(channelIndex, m.parameter(), m.value().floatValue());
            }
            else {
                store.set(m.parameter(), channelIndex, m.value());
            }
        });
    }

    private void applyConfig(Optional<ConfigParameterMessage> parsed)
    {
        if (parsed.isEmpty()) {
            manager.recordParseError();
            return;
        }
        ConfigParameterMessage m = parsed.get();
        runAs(OscProtocol.OSC, () -> store.set(m.parameter(), ParameterStore.GLOBAL, m.value()));
    }

    // -------------------------------------------------------------------------
    // REMOTE dialect
    // -------------------------------------------------------------------------

    private void applyRemote(Optional<RemoteCommand> parsed)
    {
        if (parsed.isEmpty()) {
            manager.recordParseError();
            return;
        }
        RemoteCommand command = parsed.get();

        if (command instanceof RemoteCommand.ChannelSelect select) {
            manager.setRemoteSelectedChannel(select.channelId());
            callbacks.onRemoteChannelSelect(select.channelId());
            manager.sendRemoteChannelDump(select.channelId());
            return;
        }

        int channelIndex = command.channelId() - 1;
        if (channelIndex < 0) {
            return;
        }

        if (command instanceof RemoteCommand.PositionXY xy) {
            runAs(OscProtocol.REMOTE, () -> {
                PositionConstraints.Position current = constraints.current(channelIndex);
                writeRemotePosition(channelIndex, new PositionConstraints.Position(xy.x(), xy.y(), current.z()));
            });
        }
        else if (command instanceof RemoteCommand.ParameterSet set) {
            runAs(OscProtocol.REMOTE, () -> applyRemoteValue(set.parameter(), channelIndex, set.value()));
        }
        else if (command instanceof RemoteCommand.ParameterDelta delta) {
            runAs(OscProtocol.REMOTE, () -> {
                float current = store.getFloat(delta.parameter(), channelIndex, 0.0f);
                applyRemoteValue(delta.parameter(), channelIndex,
                        ParameterValue.of(current + delta.signedAmount()));
            });
        }
    }

    private void applyRemoteValue(ParameterId parameter, int channelIndex, ParameterValue value)
    {
        Optional<ParameterValue> coerced = parameter.coerce(value);
        if (coerced.isEmpty()) {
            return;
        }
        if (parameter.isInputPosition()) {
            float v = coerced.get().floatValue();
            PositionConstraints.Position current = constraints.current(channelIndex);
            writeRemotePosition(channelIndex, withAxis(current, parameter, v));
        }
        else {
            store.set(parameter, channelIndex, coerced.get());
        }
    }

    private void writeRemotePosition(int channelIndex, PositionConstraints.Position requested)
    {
        PositionConstraints.Position written = writeConstrained(channelIndex, requested);
        callbacks.onRemotePositionReceived(channelIndex + 1, written.x(), written.y(), written.z());
    }

    private void applyArrayAdjust(Optional<ArrayAdjust> parsed)
    {
        if (parsed.isEmpty()) {
            manager.recordParseError();
            return;
        }
        ArrayAdjust adjust = parsed.get();

        runAs(OscProtocol.REMOTE, () -> {
            int outputs = store.outputChannelCount();
            for (int outputIndex = 0; outputIndex < outputs; outputIndex++) {
                if (store.getInt(ParameterId.OUTPUT_ARRAY, outputIndex, 0) != adjust.arrayId()) {
                    continue;
                }
                float current = store.getFloat(adjust.parameter(), outputIndex, 0.0f);
                store.setFloat(adjust.parameter(), outputIndex, current + adjust.delta());
            }
        });
    }

    private void applyClusterMove(Optional<ClusterMove> parsed)
    {
        if (parsed.isEmpty()) {
            manager.recordParseError();
            return;
        }
        ClusterMove move = parsed.get();

        runAs(OscProtocol.REMOTE, () -> {
            int inputs = store.inputChannelCount();
            for (int inputIndex = 0; inputIndex < inputs; inputIndex++) {
                if (store.getInt(ParameterId.INPUT_CLUSTER, inputIndex, 0) != move.clusterId()) {
                    continue;
                }
                PositionConstraints.Position current = constraints.current(inputIndex);
                writeConstrained(inputIndex, new PositionConstraints.Position(
                        current.x() + move.dx(), current.y() + move.dy(), current.z()));
            }
        });
    }

    // -------------------------------------------------------------------------
    // Heartbeat
    // -------------------------------------------------------------------------

    private void answerPing(OptionalInt sequence, OscPacketSource source)
    {
        if (sequence.isEmpty()) {
            manager.recordParseError();
            return;
        }
        OscMessage pong = OscMessageBuilder.buildPong(sequence.getAsInt());
        for (int targetIndex : manager.remoteTargetsAt(source.senderIp())) {
            manager.sendDirect(targetIndex, pong);
        }
    }

    private void acceptPong(OptionalInt sequence, OscPacketSource source)
    {
        if (sequence.isEmpty()) {
            manager.recordParseError();
            return;
        }
        for (int targetIndex : manager.remoteTargetsAt(source.senderIp())) {
            if (!heartbeat.onPong(targetIndex, sequence.getAsInt())) {
                log.debug("REMOTE target {}: ignoring pong {}", targetIndex + 1, sequence.getAsInt());
            }
        }
    }

    // -------------------------------------------------------------------------
    // Positions
    // -------------------------------------------------------------------------

    private void writePosition(int channelIndex, ParameterId axisParameter, float value)
    {
        PositionConstraints.Position current = constraints.current(channelIndex);
        writeConstrained(channelIndex, withAxis(current, axisParameter, value));
    }

    /**
     * Clamp all three axes and write back the ones that differ from the store.
     */
    private PositionConstraints.Position writeConstrained(int channelIndex, PositionConstraints.Position requested)
    {
        PositionConstraints.Position stored = constraints.current(channelIndex);
        PositionConstraints.Position clamped = constraints.constrain(channelIndex, requested);
        writeIfChanged(ParameterId.INPUT_POSITION_X, channelIndex, stored.x(), clamped.x());
        writeIfChanged(ParameterId.INPUT_POSITION_Y, channelIndex, stored.y(), clamped.y());
        writeIfChanged(ParameterId.INPUT_POSITION_Z, channelIndex, stored.z(), clamped.z());
        return clamped;
    }

    private void writeIfChanged(ParameterId axis, int channelIndex, float stored, float clamped)
    {
        if (Float.compare(stored, clamped) != 0) {
            store.setFloat(axis, channelIndex, clamped);
        }
    }

    private static PositionConstraints.Position withAxis(PositionConstraints.Position p, ParameterId axisParameter, float value)
    {
        switch (axisParameter) {
            case INPUT_POSITION_X:
                return new PositionConstraints.Position(value, p.y(), p.z());
            case INPUT_POSITION_Y:
                return new PositionConstraints.Position(p.x(), value, p.z());
            case INPUT_POSITION_Z:
                return new PositionConstraints.Position(p.x(), p.y(), value);
            default:
                throw new IllegalArgumentException("Not an input position: " + axisParameter);
        }
    }
}

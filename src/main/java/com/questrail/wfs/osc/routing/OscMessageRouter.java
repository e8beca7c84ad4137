package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscMessage;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * OscMessageRouter
 * =============================================================================
 * Inbound half of the address table: turns OSC messages into typed results.
 *
 * <h2>Accepted shapes</h2>
 * <pre>
 *   /wfs/input|output|reverb/&lt;name&gt;  &lt;channel:int&gt; &lt;value&gt;
 *   /wfs/output|reverb/EQ&lt;x&gt;         &lt;channel:int&gt; &lt;band:int&gt; &lt;value&gt;
 *   /wfs/config/&lt;path&gt;               &lt;value&gt;
 *   /remoteInput/inputNumber          &lt;channel&gt;
 *   /remoteInput/positionXY           &lt;channel&gt; &lt;x&gt; &lt;y&gt;
 *   /remoteInput/&lt;name&gt;               &lt;channel&gt; inc|dec [amount]
 *   /remoteInput/&lt;name&gt;               &lt;channel&gt; &lt;value&gt;
 *   /arrayAdjust/&lt;name&gt;               &lt;array&gt; &lt;delta&gt;
 *   /cluster/move | /cluster/barycenter/move  &lt;cluster&gt; &lt;dx&gt; &lt;dy&gt;
 *   /remote/ping | /remote/pong       &lt;sequence:int&gt;
 * </pre>
 *
 * Every parse fails closed: a wrong address, too few arguments or a value of
 * the wrong kind yields {@link Optional#empty()}.
 */
public final class OscMessageRouter
{
    public static final String REMOTE_PREFIX = "/remoteInput/";
    public static final String REMOTE_INPUT_NUMBER = REMOTE_PREFIX + "inputNumber";
    public static final String REMOTE_POSITION_XY = REMOTE_PREFIX + "positionXY";
    public static final String ARRAY_ADJUST_PREFIX = "/arrayAdjust/";
    public static final String CLUSTER_MOVE = "/cluster/move";
    public static final String CLUSTER_BARYCENTER_MOVE = "/cluster/barycenter/move";
    public static final String REMOTE_PING = "/remote/ping";
    public static final String REMOTE_PONG = "/remote/pong";

    private OscMessageRouter() {}

    public static AddressFamily classify(String address)
    {
        Objects.requireNonNull(address, "address");

        if (address.startsWith(ParameterScope.INPUT.oscPrefix())) {
            return AddressFamily.INPUT;
        }
        if (address.startsWith(ParameterScope.OUTPUT.oscPrefix())) {
            return AddressFamily.OUTPUT;
        }
        if (address.startsWith(ParameterScope.REVERB.oscPrefix())) {
            return AddressFamily.REVERB;
        }
        if (address.startsWith(ParameterScope.CONFIG.oscPrefix())) {
            return AddressFamily.CONFIG;
        }
        if (address.startsWith(REMOTE_PREFIX)) {
            return AddressFamily.REMOTE_INPUT;
        }
        if (address.startsWith(ARRAY_ADJUST_PREFIX)) {
            return AddressFamily.ARRAY_ADJUST;
        }
        if (address.equals(CLUSTER_MOVE) || address.equals(CLUSTER_BARYCENTER_MOVE)) {
            return AddressFamily.CLUSTER_MOVE;
        }
        if (address.equals(REMOTE_PING)) {
            return AddressFamily.REMOTE_PING;
        }
        if (address.equals(REMOTE_PONG)) {
            return AddressFamily.REMOTE_PONG;
        }
        return AddressFamily.UNKNOWN;
    }

    // -------------------------------------------------------------------------
    // Standard namespace
    // -------------------------------------------------------------------------

    public static Optional<ChannelParameterMessage> parseInputMessage(OscMessage message)
    {
        return parseChannelMessage(message, ParameterScope.INPUT);
    }

    public static Optional<ChannelParameterMessage> parseOutputMessage(OscMessage message)
    {
        return parseChannelMessage(message, ParameterScope.OUTPUT);
    }

    public static Optional<ChannelParameterMessage> parseReverbMessage(OscMessage message)
    {
        return parseChannelMessage(message, ParameterScope.REVERB);
    }

    private static Optional<ChannelParameterMessage> parseChannelMessage(OscMessage message, ParameterScope scope)
    {
        Optional<ParameterId> found = ParameterId.fromOscAddress(message.address());
        if (found.isEmpty() || found.get().scope() != scope) {
            return Optional.empty();
        }

        ParameterId parameter = found.get();
        int valueIndex = parameter.isBanded() ? 2 : 1;
        if (message.size() <= valueIndex || !message.argument(0).isNumeric()) {
            return Optional.empty();
        }

        int channelId = message.argument(0).asInt();
        int band = ChannelParameterMessage.NO_BAND;
        if (parameter.isBanded()) {
            if (!message.argument(1).isNumeric()) {
                return Optional.empty();
            }
            band = message.argument(1).asInt();
        }

        int bandId = band;
        return ParameterValue.fromArgument(message.argument(valueIndex))
                .flatMap(parameter::coerce)
                .map(value -> new ChannelParameterMessage(parameter, channelId, bandId, value));
    }

    public static Optional<ConfigParameterMessage> parseConfigMessage(OscMessage message)
    {
        Optional<ParameterId> found = ParameterId.fromOscAddress(message.address());
        if (found.isEmpty() || found.get().scope() != ParameterScope.CONFIG || message.size() < 1) {
            return Optional.empty();
        }

        ParameterId parameter = found.get();
        return ParameterValue.fromArgument(message.argument(0))
                .flatMap(parameter::coerce)
                .map(value -> new ConfigParameterMessage(parameter, value));
    }

    // -------------------------------------------------------------------------
    // REMOTE dialect
    // -------------------------------------------------------------------------

    public static Optional<RemoteCommand> parseRemoteInputMessage(OscMessage message)
    {
        String address = message.address();
        if (!address.startsWith(REMOTE_PREFIX) || message.size() < 1 || !message.argument(0).isNumeric()) {
            return Optional.empty();
        }

        int channelId = message.argument(0).asInt();

        if (address.equals(REMOTE_INPUT_NUMBER)) {
            return Optional.of(new RemoteCommand.ChannelSelect(channelId));
        }

        if (address.equals(REMOTE_POSITION_XY)) {
            if (message.size() < 3 || !message.argument(1).isNumeric() || !message.argument(2).isNumeric()) {
                return Optional.empty();
            }
            return Optional.of(new RemoteCommand.PositionXY(
                    channelId, message.argument(1).asFloat(), message.argument(2).asFloat()));
        }

        Optional<ParameterId> found = ParameterId.fromRemoteAddress(address);
        if (found.isEmpty() || message.size() < 2) {
            return Optional.empty();
        }
        ParameterId parameter = found.get();
        OscArgument second = message.argument(1);

        if (second instanceof OscArgument.Str s) {
            Optional<DeltaDirection> direction = deltaDirection(s.value());
            if (direction.isPresent() && parameter.kind() != ParameterId.ValueKind.STRING) {
                float amount = message.size() >= 3 && message.argument(2).isNumeric()
                        ? message.argument(2).asFloat()
                        : 1.0f;
                return Optional.of(new RemoteCommand.ParameterDelta(
                        parameter, channelId, direction.get(), amount, parameter.axis().orElse(null)));
            }
        }

        return ParameterValue.fromArgument(second)
                .flatMap(parameter::coerce)
                .map(value -> new RemoteCommand.ParameterSet(parameter, channelId, value));
    }

    private static Optional<DeltaDirection> deltaDirection(String directive)
    {
        if (directive.equalsIgnoreCase("inc")) {
            return Optional.of(DeltaDirection.INCREMENT);
        }
        if (directive.equalsIgnoreCase("dec")) {
            return Optional.of(DeltaDirection.DECREMENT);
        }
        return Optional.empty();
    }

    public static Optional<ArrayAdjust> parseArrayAdjustMessage(OscMessage message)
    {
        String address = message.address();
        if (!address.startsWith(ARRAY_ADJUST_PREFIX) || message.size() < 2
                || !message.argument(0).isNumeric() || !message.argument(1).isNumeric()) {
            return Optional.empty();
        }

        ParameterId parameter;
        switch (address.substring(ARRAY_ADJUST_PREFIX.length())) {
            case "delayLatency":
                parameter = ParameterId.OUTPUT_DELAY_LATENCY;
                break;
            case "attenuation":
                parameter = ParameterId.OUTPUT_ATTENUATION;
                break;
            case "Hparallax":
                parameter = ParameterId.OUTPUT_H_PARALLAX;
                break;
            case "Vparallax":
                parameter = ParameterId.OUTPUT_V_PARALLAX;
                break;
            default:
                return Optional.empty();
        }

        return Optional.of(new ArrayAdjust(parameter, message.argument(0).asInt(), message.argument(1).asFloat()));
    }

    public static Optional<ClusterMove> parseClusterMoveMessage(OscMessage message)
    {
        ClusterMove.Kind kind;
        if (message.address().equals(CLUSTER_MOVE)) {
            kind = ClusterMove.Kind.CLUSTER;
        }
        else if (message.address().equals(CLUSTER_BARYCENTER_MOVE)) {
            kind = ClusterMove.Kind.BARYCENTER;
        }
        else {
            return Optional.empty();
        }

        if (message.size() < 3) {
            return Optional.empty();
        }
        for (int i = 0; i < 3; i++) {
            if (!message.argument(i).isNumeric()) {
                return Optional.empty();
            }
        }

        int clusterId = message.argument(0).asInt();
        if (clusterId < 1 || clusterId > OscLimits.MAX_CLUSTERS) {
            return Optional.empty();
        }
        return Optional.of(new ClusterMove(kind, clusterId, message.argument(1).asFloat(), message.argument(2).asFloat()));
    }

    /**
     * Sequence number of a {@code /remote/ping} or {@code /remote/pong}.
     */
    public static OptionalInt parseHeartbeatSequence(OscMessage message)
    {
        String address = message.address();
        if (!(address.equals(REMOTE_PING) || address.equals(REMOTE_PONG))
                || message.size() < 1
                || !(message.argument(0) instanceof OscArgument.Int32 seq)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(seq.value());
    }
}

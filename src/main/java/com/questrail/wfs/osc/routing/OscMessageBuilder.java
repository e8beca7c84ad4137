package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * OscMessageBuilder
 * =============================================================================
 * Outbound half of the address table.
 *
 * <h2>Argument typing</h2>
 * <ul>
 *   <li>Standard {@code /wfs} messages carry numbers as float32, whatever the
 *       parameter's kind, and strings as strings.</li>
 *   <li>REMOTE messages carry int parameters as int32, float parameters as
 *       float32.</li>
 *   <li>The channel id and EQ band are always int32.</li>
 * </ul>
 *
 * Builders return {@link Optional#empty()} for a parameter of the wrong scope,
 * a parameter with no REMOTE name, or a value its kind does not accept.
 */
public final class OscMessageBuilder
{
    public static final String STAGE_PREFIX = "/stage/";
    public static final String INPUT_COUNT = "/inputs";
    public static final String FIND_DEVICE = "/findDevice";

    private OscMessageBuilder() {}

    // -------------------------------------------------------------------------
    // Standard namespace
    // -------------------------------------------------------------------------

    public static Optional<OscMessage> buildInputMessage(ParameterId parameter, int channelId, ParameterValue value)
    {
        return buildChannelMessage(ParameterScope.INPUT, parameter, channelId, value);
    }

    public static Optional<OscMessage> buildOutputMessage(ParameterId parameter, int channelId, ParameterValue value)
    {
        return buildChannelMessage(ParameterScope.OUTPUT, parameter, channelId, value);
    }

    public static Optional<OscMessage> buildReverbMessage(ParameterId parameter, int channelId, ParameterValue value)
    {
        return buildChannelMessage(ParameterScope.REVERB, parameter, channelId, value);
    }

    private static Optional<OscMessage> buildChannelMessage(ParameterScope scope,
                                                            ParameterId parameter,
                                                            int channelId,
                                                            ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
        if (parameter.scope() != scope || parameter.isBanded()) {
            return Optional.empty();
        }
        return parameter.coerce(value)
                .map(v -> OscMessage.of(parameter.oscAddress(), OscArgument.of(channelId), standardArgument(v)));
    }

    /**
     * {@code <address> <channel> <band> <value>} for EQ band parameters.
     */
    public static Optional<OscMessage> buildBandMessage(ParameterId parameter, int channelId, int band, ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
        if (!parameter.isBanded()) {
            return Optional.empty();
        }
        return parameter.coerce(value)
                .map(v -> OscMessage.of(parameter.oscAddress(),
                        OscArgument.of(channelId), OscArgument.of(band), standardArgument(v)));
    }

    public static Optional<OscMessage> buildConfigMessage(ParameterId parameter, ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
        if (parameter.scope() != ParameterScope.CONFIG) {
            return Optional.empty();
        }
        return parameter.coerce(value).map(v -> OscMessage.of(parameter.oscAddress(), standardArgument(v)));
    }

    private static OscArgument standardArgument(ParameterValue value)
    {
        if (value instanceof ParameterValue.Text t) {
            return OscArgument.of(t.value());
        }
        return OscArgument.of(value.floatValue());
    }

    // -------------------------------------------------------------------------
    // REMOTE dialect
    // -------------------------------------------------------------------------

    public static Optional<OscMessage> buildRemoteOutputMessage(ParameterId parameter, int channelId, ParameterValue value)
    {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
        Optional<String> address = parameter.remoteAddress();
        if (address.isEmpty() || parameter.isBanded()) {
            return Optional.empty();
        }
        return parameter.coerce(value)
                .map(v -> OscMessage.of(address.get(), OscArgument.of(channelId), remoteArgument(v)));
    }

    private static OscArgument remoteArgument(ParameterValue value)
    {
        if (value instanceof ParameterValue.Text t) {
            return OscArgument.of(t.value());
        }
        if (value instanceof ParameterValue.Integral i) {
            return OscArgument.of(i.value());
        }
        return OscArgument.of(value.floatValue());
    }

    /**
     * One REMOTE message per value with a REMOTE address, in table order.
     */
    public static List<OscMessage> buildRemoteChannelDump(int channelId, Map<ParameterId, ParameterValue> values)
    {
        Objects.requireNonNull(values, "values");
        Map<ParameterId, ParameterValue> ordered = values.isEmpty() ? Map.of() : new EnumMap<>(values);

        List<OscMessage> messages = new ArrayList<>(ordered.size());
        for (Map.Entry<ParameterId, ParameterValue> entry : ordered.entrySet()) {
            buildRemoteOutputMessage(entry.getKey(), channelId, entry.getValue()).ifPresent(messages::add);
        }
        return messages;
    }

    /**
     * Stage description sent to REMOTE clients when they connect and when
     * the stage changes.
     */
    public static List<OscMessage> buildStageConfig(StageGeometry stage, int inputCount)
    {
        Objects.requireNonNull(stage, "stage");
        return List.of(
                OscMessage.of(STAGE_PREFIX + "originX", OscArgument.of(stage.originX())),
                OscMessage.of(STAGE_PREFIX + "originY", OscArgument.of(stage.originY())),
                OscMessage.of(STAGE_PREFIX + "originZ", OscArgument.of(stage.originZ())),
                OscMessage.of(STAGE_PREFIX + "width", OscArgument.of(stage.width())),
                OscMessage.of(STAGE_PREFIX + "depth", OscArgument.of(stage.depth())),
                OscMessage.of(STAGE_PREFIX + "height", OscArgument.of(stage.height())),
                OscMessage.of(STAGE_PREFIX + "shape", OscArgument.of(stage.shape())),
                OscMessage.of(STAGE_PREFIX + "diameter", OscArgument.of(stage.diameter())),
                OscMessage.of(INPUT_COUNT, OscArgument.of(inputCount)));
    }

    public static OscMessage buildPing(int sequence)
    {
        return OscMessage.of(OscMessageRouter.REMOTE_PING, OscArgument.of(sequence));
    }

    public static OscMessage buildPong(int sequence)
    {
        return OscMessage.of(OscMessageRouter.REMOTE_PONG, OscArgument.of(sequence));
    }

    public static OscMessage buildFindDevice(String password)
    {
        return OscMessage.of(FIND_DEVICE, OscArgument.of(Objects.requireNonNull(password, "password")));
    }

    public static OscBundle createBundle(List<? extends OscPacket> elements)
    {
        return new OscBundle(new ArrayList<>(elements));
    }
}

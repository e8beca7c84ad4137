package com.questrail.wfs.osc.routing;

import java.util.Objects;

/**
 * A parsed {@code /remoteInput/...} message from a REMOTE client.
 */
public sealed interface RemoteCommand
        permits RemoteCommand.ChannelSelect,
                RemoteCommand.ParameterSet,
                RemoteCommand.ParameterDelta,
                RemoteCommand.PositionXY
{
    /** 1-based channel the command applies to. */
    int channelId();

    /** {@code /remoteInput/inputNumber <id>} */
    record ChannelSelect(int channelId) implements RemoteCommand {}

    /** {@code /remoteInput/<name> <id> <value>} */
    record ParameterSet(ParameterId parameter, int channelId, ParameterValue value) implements RemoteCommand
    {
        public ParameterSet {
            Objects.requireNonNull(parameter, "parameter");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * {@code /remoteInput/<name> <id> inc|dec [amount]}
     *
     * @param axis set for position and offset parameters, otherwise {@code null}
     */
    record ParameterDelta(ParameterId parameter,
                          int channelId,
                          DeltaDirection direction,
                          float amount,
                          Axis axis) implements RemoteCommand
    {
        public ParameterDelta {
            Objects.requireNonNull(parameter, "parameter");
            Objects.requireNonNull(direction, "direction");
        }

        public float signedAmount() {
            return direction.apply(amount);
        }
    }

    /** {@code /remoteInput/positionXY <id> <x> <y>} */
    record PositionXY(int channelId, float x, float y) implements RemoteCommand {}
}

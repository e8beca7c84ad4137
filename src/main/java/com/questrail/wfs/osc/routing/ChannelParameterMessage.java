package com.questrail.wfs.osc.routing;

import java.util.Objects;

/**
 * A parsed {@code /wfs/input|output|reverb/<name>} message.
 *
 * @param parameter the addressed parameter
 * @param channelId 1-based channel id as sent on the wire
 * @param band EQ band for banded parameters, otherwise {@link #NO_BAND}
 * @param value value already coerced to the parameter's kind
 */
public record ChannelParameterMessage(ParameterId parameter, int channelId, int band, ParameterValue value)
{
    public static final int NO_BAND = -1;

    public ChannelParameterMessage {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
    }

    public boolean hasBand() {
        return band != NO_BAND;
    }
}

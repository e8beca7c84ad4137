package com.questrail.wfs.osc.routing;

import java.util.Objects;

/**
 * A parsed {@code /wfs/config/...} message. Config parameters are global and
 * carry no channel id.
 */
public record ConfigParameterMessage(ParameterId parameter, ParameterValue value)
{
    public ConfigParameterMessage {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
    }
}

package com.questrail.wfs.osc.routing;

import java.util.Objects;

/**
 * {@code /arrayAdjust/<name> <array> <delta>}: add {@code delta} to one output
 * parameter on every output assigned to {@code arrayId}.
 */
public record ArrayAdjust(ParameterId parameter, int arrayId, float delta)
{
    public ArrayAdjust {
        Objects.requireNonNull(parameter, "parameter");
    }
}

package com.questrail.wfs.osc.routing;

/**
 * Direction of a REMOTE {@code inc}/{@code dec} command.
 */
public enum DeltaDirection
{
    INCREMENT,
    DECREMENT;

    public float apply(float amount)
    {
        return this == INCREMENT ? amount : -amount;
    }
}

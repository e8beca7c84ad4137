package com.questrail.wfs.osc.routing;

/**
 * Cartesian axis of a position or offset parameter.
 */
public enum Axis
{
    X, Y, Z
}

package com.questrail.wfs.osc.routing;

import java.util.Objects;

/**
 * {@code /cluster/move} or {@code /cluster/barycenter/move}: shift every input
 * of a cluster by {@code (dx, dy)}.
 */
public record ClusterMove(Kind kind, int clusterId, float dx, float dy)
{
    public enum Kind
    {
        /** Cluster moved by its reference input. */
        CLUSTER,
        /** Cluster moved by its barycenter. */
        BARYCENTER
    }

    public ClusterMove {
        Objects.requireNonNull(kind, "kind");
    }
}

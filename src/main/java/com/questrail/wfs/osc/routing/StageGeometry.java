package com.questrail.wfs.osc.routing;

/**
 * Stage dimensions pushed to REMOTE clients.
 *
 * @param shape 0 for a box; other values use {@code diameter}
 */
public record StageGeometry(
    int shape,
    float width,
    float depth,
    float height,
    float diameter,
    float originX,
    float originY,
    float originZ
) {
    public static final int SHAPE_BOX = 0;

    public boolean isBox() {
        return shape == SHAPE_BOX;
    }
}

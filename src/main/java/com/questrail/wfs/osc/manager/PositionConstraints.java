package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.routing.ParameterId;
import com.questrail.wfs.osc.routing.StageGeometry;

import java.util.Objects;

/**
 * PositionConstraints
 * =============================================================================
 * Clamps inbound input positions to the stage.
 *
 * <h2>Axis bounds</h2>
 * <ul>
 *   <li>X: {@code [-half - originX, half - originX]}, where {@code half} is
 *       half the width for a box stage and half the diameter otherwise.</li>
 *   <li>Y: the same with depth and {@code originY}.</li>
 *   <li>Z: {@code [-originZ, height - originZ]}.</li>
 * </ul>
 * Each axis is clamped only while the channel's constraint flag for it is
 * on. A missing or non-numeric flag counts as on.
 *
 * <h2>Distance shell</h2>
 * For coordinate mode 1 (cylindrical) or 2 (spherical) with the distance
 * constraint on, the position is scaled so its distance from the origin
 * lies in {@code [min, max]}: the XY radius for cylindrical, the XYZ radius
 * for spherical. Defaults are {@code min = 0} and {@code max = 50}.
 *
 * <p>Stage values missing from the store fall back to a 20 x 10 x 5 box
 * centred on the origin.</p>
 */
public final class PositionConstraints
{
    static final float DEFAULT_STAGE_WIDTH = 20.0f;
    static final float DEFAULT_STAGE_DEPTH = 10.0f;
    static final float DEFAULT_STAGE_HEIGHT = 5.0f;
    static final float DEFAULT_DISTANCE_MIN = 0.0f;
    static final float DEFAULT_DISTANCE_MAX = 50.0f;

    static final int COORDINATES_CYLINDRICAL = 1;
    static final int COORDINATES_SPHERICAL = 2;

    private static final float MIN_DISTANCE = 0.0001f;

    /**
     * An input position in stage metres.
     */
    public record Position(float x, float y, float z) {}

    private final ParameterStore store;

    public PositionConstraints(ParameterStore store)
    {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Current stage geometry, with defaults for missing values.
     */
    public StageGeometry stage()
    {
        return new StageGeometry(
                store.getInt(ParameterId.CONFIG_STAGE_SHAPE, ParameterStore.GLOBAL, StageGeometry.SHAPE_BOX),
                stageFloat(ParameterId.CONFIG_STAGE_WIDTH, DEFAULT_STAGE_WIDTH),
                stageFloat(ParameterId.CONFIG_STAGE_DEPTH, DEFAULT_STAGE_DEPTH),
                stageFloat(ParameterId.CONFIG_STAGE_HEIGHT, DEFAULT_STAGE_HEIGHT),
                stageFloat(ParameterId.CONFIG_STAGE_DIAMETER, DEFAULT_STAGE_WIDTH),
                stageFloat(ParameterId.CONFIG_STAGE_ORIGIN_X, 0.0f),
                stageFloat(ParameterId.CONFIG_STAGE_ORIGIN_Y, 0.0f),
                stageFloat(ParameterId.CONFIG_STAGE_ORIGIN_Z, 0.0f));
    }

    private float stageFloat(ParameterId parameter, float fallback)
    {
        return store.getFloat(parameter, ParameterStore.GLOBAL, fallback);
    }

    /**
     * Current stored position of an input, {@code 0} for missing axes.
     */
    public Position current(int channelIndex)
    {
        return new Position(
                store.getFloat(ParameterId.INPUT_POSITION_X, channelIndex, 0.0f),
                store.getFloat(ParameterId.INPUT_POSITION_Y, channelIndex, 0.0f),
                store.getFloat(ParameterId.INPUT_POSITION_Z, channelIndex, 0.0f));
    }

    /**
     * Apply the axis bounds and then the distance shell.
     */
    public Position constrain(int channelIndex, Position position)
    {
        Objects.requireNonNull(position, "position");
        StageGeometry stage = stage();

        float x = position.x();
        float y = position.y();
        float z = position.z();

        if (axisConstrained(ParameterId.INPUT_CONSTRAINT_X, channelIndex)) {
            float half = (stage.isBox() ? stage.width() : stage.diameter()) / 2.0f;
            x = clamp(x, -half - stage.originX(), half - stage.originX());
        }
        if (axisConstrained(ParameterId.INPUT_CONSTRAINT_Y, channelIndex)) {
            float half = (stage.isBox() ? stage.depth() : stage.diameter()) / 2.0f;
            y = clamp(y, -half - stage.originY(), half - stage.originY());
        }
        if (axisConstrained(ParameterId.INPUT_CONSTRAINT_Z, channelIndex)) {
            z = clamp(z, -stage.originZ(), stage.height() - stage.originZ());
        }

        return applyDistance(channelIndex, new Position(x, y, z));
    }

    private boolean axisConstrained(ParameterId flag, int channelIndex)
    {
        return store.getInt(flag, channelIndex, 1) != 0;
    }

    Position applyDistance(int channelIndex, Position position)
    {
        int mode = store.getInt(ParameterId.INPUT_COORDINATE_MODE, channelIndex, 0);
        if (mode != COORDINATES_CYLINDRICAL && mode != COORDINATES_SPHERICAL) {
            return position;
        }
        if (store.getInt(ParameterId.INPUT_CONSTRAINT_DISTANCE, channelIndex, 0) == 0) {
            return position;
        }

        float min = store.getFloat(ParameterId.INPUT_CONSTRAINT_DISTANCE_MIN, channelIndex, DEFAULT_DISTANCE_MIN);
        float max = store.getFloat(ParameterId.INPUT_CONSTRAINT_DISTANCE_MAX, channelIndex, DEFAULT_DISTANCE_MAX);

        float x = position.x();
        float y = position.y();
        float z = position.z();
        boolean spherical = mode == COORDINATES_SPHERICAL;

        float distance = (float) Math.sqrt(x * x + y * y + (spherical ? z * z : 0.0f));
        distance = Math.max(distance, MIN_DISTANCE);

        float target = clamp(distance, min, max);
        if (target == distance) {
            return position;
        }

        float scale = target / distance;
        return spherical
                ? new Position(x * scale, y * scale, z * scale)
                : new Position(x * scale, y * scale, z);
    }

    private static float clamp(float value, float min, float max)
    {
        return Math.max(min, Math.min(max, value));
    }
}

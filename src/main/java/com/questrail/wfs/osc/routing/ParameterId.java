package com.questrail.wfs.osc.routing;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.questrail.wfs.osc.routing.ParameterId.ValueKind.FLOAT;
import static com.questrail.wfs.osc.routing.ParameterId.ValueKind.INT;
import static com.questrail.wfs.osc.routing.ParameterId.ValueKind.STRING;
import static com.questrail.wfs.osc.routing.ParameterScope.CONFIG;
import static com.questrail.wfs.osc.routing.ParameterScope.INPUT;
import static com.questrail.wfs.osc.routing.ParameterScope.OUTPUT;
import static com.questrail.wfs.osc.routing.ParameterScope.REVERB;

/**
 * ParameterId
 * =============================================================================
 * The address table. Every parameter the network layer can send or receive
 * appears here exactly once, with its scope, its name in the standard
 * {@code /wfs/...} namespace, its name in the REMOTE {@code /remoteInput/...}
 * dialect, and the kind of value it carries.
 *
 * <h2>Addresses</h2>
 * <pre>
 *   standard:  scope.oscPrefix()    + oscName     e.g. /wfs/input/attenuation
 *   REMOTE:    scope.remotePrefix() + remoteName  e.g. /remoteInput/inputName
 * </pre>
 * Config parameters carry their sub-path in {@code oscName}
 * ({@code stage/width}) and have no REMOTE form.
 *
 * <h2>Banded parameters</h2>
 * Output and reverb EQ parameters other than {@code EQenable} address one EQ
 * band and carry a band index before the value.
 *
 * <p>Both {@link OscMessageRouter} and {@link OscMessageBuilder} read this
 * table, so anything the builder produces parses back to the same constant.</p>
 */
public enum ParameterId
{
    // Inputs
    INPUT_NAME(                       INPUT,  "name", "inputName", STRING),
    INPUT_ATTENUATION(                INPUT,  "attenuation", FLOAT),
    INPUT_DELAY_LATENCY(              INPUT,  "delayLatency", FLOAT),
    INPUT_MINIMAL_LATENCY(            INPUT,  "minimalLatency", INT),
    INPUT_POSITION_X(                 INPUT,  "positionX", FLOAT),
    INPUT_POSITION_Y(                 INPUT,  "positionY", FLOAT),
    INPUT_POSITION_Z(                 INPUT,  "positionZ", FLOAT),
    INPUT_OFFSET_X(                   INPUT,  "offsetX", FLOAT),
    INPUT_OFFSET_Y(                   INPUT,  "offsetY", FLOAT),
    INPUT_OFFSET_Z(                   INPUT,  "offsetZ", FLOAT),
    INPUT_COORDINATE_MODE(            INPUT,  "coordinateMode", INT),
    INPUT_CONSTRAINT_X(               INPUT,  "constraintX", INT),
    INPUT_CONSTRAINT_Y(               INPUT,  "constraintY", INT),
    INPUT_CONSTRAINT_Z(               INPUT,  "constraintZ", INT),
    INPUT_CONSTRAINT_DISTANCE(        INPUT,  "constraintDistance", INT),
    INPUT_CONSTRAINT_DISTANCE_MIN(    INPUT,  "constraintDistanceMin", FLOAT),
    INPUT_CONSTRAINT_DISTANCE_MAX(    INPUT,  "constraintDistanceMax", FLOAT),
    INPUT_FLIP_X(                     INPUT,  "flipX", INT),
    INPUT_FLIP_Y(                     INPUT,  "flipY", INT),
    INPUT_FLIP_Z(                     INPUT,  "flipZ", INT),
    INPUT_CLUSTER(                    INPUT,  "cluster", INT),
    INPUT_TRACKING_ACTIVE(            INPUT,  "trackingActive", INT),
    INPUT_TRACKING_ID(                INPUT,  "trackingID", INT),
    INPUT_TRACKING_SMOOTH(            INPUT,  "trackingSmooth", FLOAT),
    INPUT_MAX_SPEED_ACTIVE(           INPUT,  "maxSpeedActive", INT),
    INPUT_MAX_SPEED(                  INPUT,  "maxSpeed", FLOAT),
    INPUT_PATH_MODE_ACTIVE(           INPUT,  "pathModeActive", INT),
    INPUT_HEIGHT_FACTOR(              INPUT,  "heightFactor", FLOAT),
    INPUT_ATTENUATION_LAW(            INPUT,  "attenuationLaw", INT),
    INPUT_DISTANCE_ATTENUATION(       INPUT,  "distanceAttenuation", FLOAT),
    INPUT_DISTANCE_RATIO(             INPUT,  "distanceRatio", FLOAT),
    INPUT_COMMON_ATTEN(               INPUT,  "commonAtten", FLOAT),
    INPUT_DIRECTIVITY(                INPUT,  "directivity", FLOAT),
    INPUT_ROTATION(                   INPUT,  "rotation", FLOAT),
    INPUT_TILT(                       INPUT,  "tilt", FLOAT),
    INPUT_HF_SHELF(                   INPUT,  "HFshelf", FLOAT),
    INPUT_LS_ACTIVE(                  INPUT,  "LSactive", "liveSourceActive", INT),
    INPUT_LS_RADIUS(                  INPUT,  "LSradius", "liveSourceRadius", FLOAT),
    INPUT_LS_SHAPE(                   INPUT,  "LSshape", "liveSourceShape", INT),
    INPUT_LS_ATTENUATION(             INPUT,  "LSattenuation", "liveSourceAttenuation", FLOAT),
    INPUT_LS_PEAK_THRESHOLD(          INPUT,  "LSpeakThreshold", "liveSourcePeakThreshold", FLOAT),
    INPUT_LS_PEAK_RATIO(              INPUT,  "LSpeakRatio", "liveSourcePeakRatio", FLOAT),
    INPUT_LS_SLOW_THRESHOLD(          INPUT,  "LSslowThreshold", "liveSourceSlowThreshold", FLOAT),
    INPUT_LS_SLOW_RATIO(              INPUT,  "LSslowRatio", "liveSourceSlowRatio", FLOAT),
    INPUT_FR_ACTIVE(                  INPUT,  "FRactive", INT),
    INPUT_FR_ATTENUATION(             INPUT,  "FRattenuation", FLOAT),
    INPUT_FR_LOW_CUT_ACTIVE(          INPUT,  "FRlowCutActive", INT),
    INPUT_FR_LOW_CUT_FREQ(            INPUT,  "FRlowCutFreq", FLOAT),
    INPUT_FR_HIGH_SHELF_ACTIVE(       INPUT,  "FRhighShelfActive", INT),
    INPUT_FR_HIGH_SHELF_FREQ(         INPUT,  "FRhighShelfFreq", FLOAT),
    INPUT_FR_HIGH_SHELF_GAIN(         INPUT,  "FRhighShelfGain", FLOAT),
    INPUT_FR_HIGH_SHELF_SLOPE(        INPUT,  "FRhighShelfSlope", FLOAT),
    INPUT_FR_DIFFUSION(               INPUT,  "FRdiffusion", FLOAT),
    INPUT_JITTER(                     INPUT,  "jitter", FLOAT),
    INPUT_LFO_ACTIVE(                 INPUT,  "LFOactive", INT),
    INPUT_LFO_PERIOD(                 INPUT,  "LFOperiod", FLOAT),
    INPUT_LFO_PHASE(                  INPUT,  "LFOphase", FLOAT),
    INPUT_LFO_SHAPE_X(                INPUT,  "LFOshapeX", INT),
    INPUT_LFO_SHAPE_Y(                INPUT,  "LFOshapeY", INT),
    INPUT_LFO_SHAPE_Z(                INPUT,  "LFOshapeZ", INT),
    INPUT_LFO_RATE_X(                 INPUT,  "LFOrateX", FLOAT),
    INPUT_LFO_RATE_Y(                 INPUT,  "LFOrateY", FLOAT),
    INPUT_LFO_RATE_Z(                 INPUT,  "LFOrateZ", FLOAT),
    INPUT_LFO_AMPLITUDE_X(            INPUT,  "LFOamplitudeX", FLOAT),
    INPUT_LFO_AMPLITUDE_Y(            INPUT,  "LFOamplitudeY", FLOAT),
    INPUT_LFO_AMPLITUDE_Z(            INPUT,  "LFOamplitudeZ", FLOAT),
    INPUT_LFO_PHASE_X(                INPUT,  "LFOphaseX", FLOAT),
    INPUT_LFO_PHASE_Y(                INPUT,  "LFOphaseY", FLOAT),
    INPUT_LFO_PHASE_Z(                INPUT,  "LFOphaseZ", FLOAT),
    INPUT_LFO_GYROPHONE(              INPUT,  "LFOgyrophone", INT),
    INPUT_OTOMO_X(                    INPUT,  "otomoX", null, FLOAT),
    INPUT_OTOMO_Y(                    INPUT,  "otomoY", null, FLOAT),
    INPUT_OTOMO_Z(                    INPUT,  "otomoZ", null, FLOAT),
    INPUT_OTOMO_ABSOLUTE_RELATIVE(    INPUT,  "otomoAbsoluteRelative", null, INT),
    INPUT_OTOMO_STAY_RETURN(          INPUT,  "otomoStayReturn", null, INT),
    INPUT_OTOMO_DURATION(             INPUT,  "otomoDuration", null, FLOAT),
    INPUT_OTOMO_CURVE(                INPUT,  "otomoCurve", null, FLOAT),
    INPUT_OTOMO_SPEED(                INPUT,  "otomoSpeed", null, FLOAT),
    INPUT_OTOMO_TRIGGER(              INPUT,  "otomoTrigger", null, INT),
    INPUT_OTOMO_TRIGGER_THRESHOLD(    INPUT,  "otomoTriggerThreshold", null, FLOAT),
    INPUT_OTOMO_TRIGGER_RESET(        INPUT,  "otomoTriggerReset", null, FLOAT),
    INPUT_OTOMO_PAUSE_RESUME(         INPUT,  "otomoPauseResume", null, INT),
    INPUT_SIDELINES_ACTIVE(           INPUT,  "sidelinesEnable", "sidelinesActive", INT),
    INPUT_SIDELINES_FRINGE(           INPUT,  "sidelinesFringe", FLOAT),
    INPUT_REVERB_SEND(                INPUT,  "reverbSend", FLOAT),
    INPUT_MUTE_MACRO(                 INPUT,  "muteMacro", INT),

    // Outputs
    OUTPUT_NAME(                      OUTPUT, "name", STRING),
    OUTPUT_ARRAY(                     OUTPUT, "array", INT),
    OUTPUT_APPLY_TO_ARRAY(            OUTPUT, "applyToArray", INT),
    OUTPUT_ATTENUATION(               OUTPUT, "attenuation", FLOAT),
    OUTPUT_DELAY_LATENCY(             OUTPUT, "delayLatency", FLOAT),
    OUTPUT_POSITION_X(                OUTPUT, "positionX", FLOAT),
    OUTPUT_POSITION_Y(                OUTPUT, "positionY", FLOAT),
    OUTPUT_POSITION_Z(                OUTPUT, "positionZ", FLOAT),
    OUTPUT_COORDINATE_MODE(           OUTPUT, "coordinateMode", INT),
    OUTPUT_ORIENTATION(               OUTPUT, "orientation", FLOAT),
    OUTPUT_ANGLE_ON(                  OUTPUT, "angleOn", FLOAT),
    OUTPUT_ANGLE_OFF(                 OUTPUT, "angleOff", FLOAT),
    OUTPUT_PITCH(                     OUTPUT, "pitch", FLOAT),
    OUTPUT_HF_DAMPING(                OUTPUT, "HFdamping", FLOAT),
    OUTPUT_MINI_LATENCY_ENABLE(       OUTPUT, "miniLatencyEnable", INT),
    OUTPUT_LS_ENABLE(                 OUTPUT, "LSenable", INT),
    OUTPUT_FR_ENABLE(                 OUTPUT, "FRenable", INT),
    OUTPUT_DISTANCE_ATTEN_PERCENT(    OUTPUT, "DistanceAttenPercent", FLOAT),
    OUTPUT_H_PARALLAX(                OUTPUT, "Hparallax", FLOAT),
    OUTPUT_V_PARALLAX(                OUTPUT, "Vparallax", FLOAT),
    OUTPUT_EQ_ENABLE(                 OUTPUT, "EQenable", INT),
    OUTPUT_EQ_SHAPE(                  OUTPUT, "EQshape", INT),
    OUTPUT_EQ_FREQ(                   OUTPUT, "EQfreq", FLOAT),
    OUTPUT_EQ_GAIN(                   OUTPUT, "EQgain", FLOAT),
    OUTPUT_EQ_Q(                      OUTPUT, "EQq", FLOAT),
    OUTPUT_EQ_SLOPE(                  OUTPUT, "EQslope", FLOAT),

    // Reverb channels
    REVERB_NAME(                      REVERB, "name", STRING),
    REVERB_ATTENUATION(               REVERB, "attenuation", FLOAT),
    REVERB_DELAY_LATENCY(             REVERB, "delayLatency", FLOAT),
    REVERB_POSITION_X(                REVERB, "positionX", FLOAT),
    REVERB_POSITION_Y(                REVERB, "positionY", FLOAT),
    REVERB_POSITION_Z(                REVERB, "positionZ", FLOAT),
    REVERB_RETURN_OFFSET_X(           REVERB, "returnOffsetX", FLOAT),
    REVERB_RETURN_OFFSET_Y(           REVERB, "returnOffsetY", FLOAT),
    REVERB_RETURN_OFFSET_Z(           REVERB, "returnOffsetZ", FLOAT),
    REVERB_ORIENTATION(               REVERB, "orientation", FLOAT),
    REVERB_ANGLE_ON(                  REVERB, "angleOn", FLOAT),
    REVERB_ANGLE_OFF(                 REVERB, "angleOff", FLOAT),
    REVERB_PITCH(                     REVERB, "pitch", FLOAT),
    REVERB_HF_DAMPING(                REVERB, "HFdamping", FLOAT),
    REVERB_MINI_LATENCY_ENABLE(       REVERB, "miniLatencyEnable", INT),
    REVERB_LS_ENABLE(                 REVERB, "LSenable", INT),
    REVERB_DISTANCE_ATTEN_PERCENT(    REVERB, "DistanceAttenPercent", FLOAT),
    REVERB_DISTANCE_ATTENUATION(      REVERB, "distanceAttenuation", FLOAT),
    REVERB_COMMON_ATTEN(              REVERB, "commonAtten", FLOAT),
    REVERB_MUTE_MACRO(                REVERB, "muteMacro", INT),
    REVERB_EQ_ENABLE(                 REVERB, "EQenable", INT),
    REVERB_EQ_SHAPE(                  REVERB, "EQshape", INT),
    REVERB_EQ_FREQ(                   REVERB, "EQfreq", FLOAT),
    REVERB_EQ_GAIN(                   REVERB, "EQgain", FLOAT),
    REVERB_EQ_Q(                      REVERB, "EQq", FLOAT),
    REVERB_EQ_SLOPE(                  REVERB, "EQslope", FLOAT),

    // Global configuration
    CONFIG_STAGE_SHAPE(               CONFIG, "stage/shape", INT),
    CONFIG_STAGE_WIDTH(               CONFIG, "stage/width", FLOAT),
    CONFIG_STAGE_DEPTH(               CONFIG, "stage/depth", FLOAT),
    CONFIG_STAGE_HEIGHT(              CONFIG, "stage/height", FLOAT),
    CONFIG_STAGE_DIAMETER(            CONFIG, "stage/diameter", FLOAT),
    CONFIG_STAGE_DOME_ELEVATION(      CONFIG, "stage/domeElevation", FLOAT),
    CONFIG_STAGE_ORIGIN_X(            CONFIG, "stage/originX", FLOAT),
    CONFIG_STAGE_ORIGIN_Y(            CONFIG, "stage/originY", FLOAT),
    CONFIG_STAGE_ORIGIN_Z(            CONFIG, "stage/originZ", FLOAT),
    CONFIG_REVERB_ALGORITHM(          CONFIG, "reverb/algoType", INT),
    CONFIG_REVERB_RT60(               CONFIG, "reverb/rt60", FLOAT),
    CONFIG_REVERB_WET_LEVEL(          CONFIG, "reverb/wetLevel", FLOAT),
    CONFIG_REVERB_DIFFUSION(          CONFIG, "reverb/diffusion", FLOAT);

    public enum ValueKind
    {
        FLOAT, INT, STRING
    }

    private static final Map<String, ParameterId> BY_OSC_ADDRESS = new HashMap<>();
    private static final Map<String, ParameterId> BY_REMOTE_ADDRESS = new HashMap<>();

    static {
        for (ParameterId id : values()) {
            BY_OSC_ADDRESS.put(id.oscAddress, id);
            if (id.remoteAddress != null) {
                BY_REMOTE_ADDRESS.put(id.remoteAddress, id);
            }
        }
    }

    /** Input parameters a REMOTE client receives when it selects a channel. */
    private static final Set<ParameterId> REMOTE_CHANNEL_DUMP = Collections.unmodifiableSet(EnumSet.of(
            INPUT_ATTENUATION, INPUT_DELAY_LATENCY, INPUT_MINIMAL_LATENCY,
            INPUT_POSITION_X, INPUT_POSITION_Y, INPUT_POSITION_Z,
            INPUT_OFFSET_X, INPUT_OFFSET_Y, INPUT_OFFSET_Z,
            INPUT_CLUSTER, INPUT_MAX_SPEED_ACTIVE, INPUT_MAX_SPEED, INPUT_PATH_MODE_ACTIVE, INPUT_HEIGHT_FACTOR,
            INPUT_ATTENUATION_LAW, INPUT_DISTANCE_ATTENUATION, INPUT_DISTANCE_RATIO, INPUT_COMMON_ATTEN,
            INPUT_DIRECTIVITY, INPUT_ROTATION, INPUT_TILT, INPUT_HF_SHELF,
            INPUT_LS_ACTIVE, INPUT_LS_RADIUS, INPUT_LS_SHAPE, INPUT_LS_ATTENUATION,
            INPUT_LS_PEAK_THRESHOLD, INPUT_LS_PEAK_RATIO, INPUT_LS_SLOW_THRESHOLD, INPUT_LS_SLOW_RATIO,
            INPUT_FR_ACTIVE, INPUT_FR_ATTENUATION, INPUT_FR_LOW_CUT_ACTIVE, INPUT_FR_LOW_CUT_FREQ,
            INPUT_FR_HIGH_SHELF_ACTIVE, INPUT_FR_HIGH_SHELF_FREQ, INPUT_FR_HIGH_SHELF_GAIN, INPUT_FR_HIGH_SHELF_SLOPE,
            INPUT_FR_DIFFUSION, INPUT_JITTER,
            INPUT_LFO_ACTIVE, INPUT_LFO_PERIOD, INPUT_LFO_PHASE,
            INPUT_LFO_SHAPE_X, INPUT_LFO_SHAPE_Y, INPUT_LFO_SHAPE_Z,
            INPUT_LFO_RATE_X, INPUT_LFO_RATE_Y, INPUT_LFO_RATE_Z,
            INPUT_LFO_AMPLITUDE_X, INPUT_LFO_AMPLITUDE_Y, INPUT_LFO_AMPLITUDE_Z,
            INPUT_LFO_PHASE_X, INPUT_LFO_PHASE_Y, INPUT_LFO_PHASE_Z,
            INPUT_LFO_GYROPHONE, INPUT_TRACKING_ACTIVE));

    private final ParameterScope scope;
    private final String oscName;
    private final String remoteName;
    private final ValueKind kind;
    private final String oscAddress;
    private final String remoteAddress;

    /** REMOTE name equal to the standard name, where the scope has a REMOTE form. */
    ParameterId(ParameterScope scope, String oscName, ValueKind kind)
    {
        this(scope, oscName, scope.remotePrefix() != null ? oscName : null, kind);
    }

    /** Explicit REMOTE name; {@code null} keeps the parameter out of the REMOTE dialect. */
    ParameterId(ParameterScope scope, String oscName, String remoteName, ValueKind kind)
    {
        this.scope = scope;
        this.oscName = oscName;
        this.remoteName = remoteName;
        this.kind = kind;
        this.oscAddress = scope.oscPrefix() + oscName;
        this.remoteAddress = remoteName != null ? scope.remotePrefix() + remoteName : null;
    }

    public ParameterScope scope()
    {
        return scope;
    }

    public String oscName()
    {
        return oscName;
    }

    public Optional<String> remoteName()
    {
        return Optional.ofNullable(remoteName);
    }

    public ValueKind kind()
    {
        return kind;
    }

    public String oscAddress()
    {
        return oscAddress;
    }

    public Optional<String> remoteAddress()
    {
        return Optional.ofNullable(remoteAddress);
    }

    public boolean isBanded()
    {
        return (scope == OUTPUT || scope == REVERB)
                && oscName.startsWith("EQ")
                && !oscName.equals("EQenable");
    }

    public boolean isStage()
    {
        return scope == CONFIG && oscName.startsWith("stage/");
    }

    /**
     * The axis of an input position or offset parameter.
     */
    public Optional<Axis> axis()
    {
        switch (this) {
            case INPUT_POSITION_X:
            case INPUT_OFFSET_X:
                return Optional.of(Axis.X);
            case INPUT_POSITION_Y:
            case INPUT_OFFSET_Y:
                return Optional.of(Axis.Y);
            case INPUT_POSITION_Z:
            case INPUT_OFFSET_Z:
                return Optional.of(Axis.Z);
            default:
                return Optional.empty();
        }
    }

    public boolean isInputPosition()
    {
        return this == INPUT_POSITION_X || this == INPUT_POSITION_Y || this == INPUT_POSITION_Z;
    }

    public static ParameterId inputPosition(Axis axis)
    {
        switch (axis) {
            case X:
                return INPUT_POSITION_X;
            case Y:
                return INPUT_POSITION_Y;
            default:
                return INPUT_POSITION_Z;
        }
    }

    /**
     * Convert a received value to this parameter's kind. Numbers convert
     * between float and int; text is only accepted by string parameters.
     */
    public Optional<ParameterValue> coerce(ParameterValue value)
    {
        if (kind == STRING) {
            return value instanceof ParameterValue.Text ? Optional.of(value) : Optional.empty();
        }
        if (!value.isNumeric()) {
            return Optional.empty();
        }
        return Optional.of(kind == INT ? ParameterValue.of(value.intValue()) : ParameterValue.of(value.floatValue()));
    }

    public static Optional<ParameterId> fromOscAddress(String address)
    {
        return Optional.ofNullable(BY_OSC_ADDRESS.get(address));
    }

    public static Optional<ParameterId> fromRemoteAddress(String address)
    {
        return Optional.ofNullable(BY_REMOTE_ADDRESS.get(address));
    }

    public static Set<ParameterId> remoteChannelDump()
    {
        return REMOTE_CHANNEL_DUMP;
    }
}

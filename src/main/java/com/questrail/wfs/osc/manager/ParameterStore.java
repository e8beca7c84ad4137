package com.questrail.wfs.osc.manager;

import com.questrail.wfs.osc.routing.ParameterId;
import com.questrail.wfs.osc.routing.ParameterValue;

import java.util.Optional;

/**
 * Application parameter state the manager reads from and writes to.
 *
 * <p>Channel indices are 0-based. Configuration parameters are addressed with
 * {@link #GLOBAL}. A store that notifies the application about writes should
 * do so synchronously on the writing thread, so that the manager can tell a
 * change it caused itself from one made by the application.</p>
 */
public interface ParameterStore
{
    /** Channel index used for {@code CONFIG} scope parameters. */
    int GLOBAL = -1;

    Optional<ParameterValue> get(ParameterId parameter, int channelIndex);

    void set(ParameterId parameter, int channelIndex, ParameterValue value);

    /**
     * Write one band of an EQ parameter.
     */
    void setBanded(ParameterId parameter, int channelIndex, int band, ParameterValue value);

    int inputChannelCount();

    int outputChannelCount();

    default float getFloat(ParameterId parameter, int channelIndex, float fallback)
    {
        return get(parameter, channelIndex)
                .filter(ParameterValue::isNumeric)
                .map(ParameterValue::floatValue)
                .orElse(fallback);
    }

    /**
     * Numeric value rounded to int, or {@code fallback} when absent or text.
     */
    default int getInt(ParameterId parameter, int channelIndex, int fallback)
    {
        return get(parameter, channelIndex)
                .filter(ParameterValue::isNumeric)
                .map(ParameterValue::intValue)
                .orElse(fallback);
    }

    default void setFloat(ParameterId parameter, int channelIndex, float value)
    {
        set(parameter, channelIndex, ParameterValue.of(value));
    }

    default void setInt(ParameterId parameter, int channelIndex, int value)
    {
        set(parameter, channelIndex, ParameterValue.of(value));
    }
}

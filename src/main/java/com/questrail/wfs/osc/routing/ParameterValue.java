package com.questrail.wfs.osc.routing;

import com.questrail.wfs.osc.model.OscArgument;

import java.util.Objects;
import java.util.Optional;

/**
 * A typed parameter value as it travels between the parameter store and the
 * wire.
 */
public sealed interface ParameterValue
        permits ParameterValue.Real, ParameterValue.Integral, ParameterValue.Text
{
    static ParameterValue of(float value) {
        return new Real(value);
    }

    static ParameterValue of(int value) {
        return new Integral(value);
    }

    static ParameterValue of(String value) {
        return new Text(value);
    }

    /**
     * Value carried by an OSC argument. Booleans become 1 or 0; blobs have
     * no parameter meaning.
     */
    static Optional<ParameterValue> fromArgument(OscArgument argument) {
        if (argument instanceof OscArgument.Float32 f) {
            return Optional.of(new Real(f.value()));
        }
        if (argument instanceof OscArgument.Int32 i) {
            return Optional.of(new Integral(i.value()));
        }
        if (argument instanceof OscArgument.Str s) {
            return Optional.of(new Text(s.value()));
        }
        if (argument instanceof OscArgument.Bool b) {
            return Optional.of(new Integral(b.value() ? 1 : 0));
        }
        return Optional.empty();
    }

    default boolean isNumeric() {
        return !(this instanceof Text);
    }

    /**
     * Numeric value as float; {@code 0} for text.
     */
    default float floatValue() {
        if (this instanceof Real r) {
            return r.value();
        }
        if (this instanceof Integral i) {
            return i.value();
        }
        return 0.0f;
    }

    /**
     * Numeric value rounded to int; {@code 0} for text.
     */
    default int intValue() {
        if (this instanceof Integral i) {
            return i.value();
        }
        if (this instanceof Real r) {
            return Math.round(r.value());
        }
        return 0;
    }

    record Real(float value) implements ParameterValue {
        @Override
        public boolean equals(Object o) {
            return o instanceof Real that
                    && Float.floatToIntBits(value) == Float.floatToIntBits(that.value);
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }
    }

    record Integral(int value) implements ParameterValue {}

    record Text(String value) implements ParameterValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }
}

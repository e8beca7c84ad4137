package com.questrail.wfs.osc.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * OscArgument
 * =============================================================================
 * A single typed OSC argument.
 *
 * <h2>Supported types</h2>
 * <ul>
 *   <li>{@link Int32} - type tag {@code i}</li>
 *   <li>{@link Float32} - type tag {@code f}</li>
 *   <li>{@link Str} - type tag {@code s}</li>
 *   <li>{@link Blob} - type tag {@code b}</li>
 *   <li>{@link Bool} - type tags {@code T} / {@code F} (no payload)</li>
 * </ul>
 *
 * <p>Helpers {@link #asFloat()} and {@link #asInt()} apply the numeric
 * coercions used by the router: ints widen to floats, floats truncate to
 * ints, anything else reads as zero.</p>
 */
public sealed interface OscArgument
        permits OscArgument.Int32, OscArgument.Float32, OscArgument.Str, OscArgument.Blob, OscArgument.Bool
{
    /**
     * The OSC type tag character for this argument.
     */
    char typeTag();

    /**
     * Human readable rendering for traffic logs.
     */
    String render();

    default boolean isNumeric() {
        return this instanceof Int32 || this instanceof Float32;
    }

    default float asFloat() {
        if (this instanceof Float32 f) {
            return f.value();
        }
        if (this instanceof Int32 i) {
            return i.value();
        }
        return 0.0f;
    }

    default int asInt() {
        if (this instanceof Int32 i) {
            return i.value();
        }
        if (this instanceof Float32 f) {
            return (int) f.value();
        }
        return 0;
    }

    static OscArgument of(int value) {
        return new Int32(value);
    }

    static OscArgument of(float value) {
        return new Float32(value);
    }

    static OscArgument of(String value) {
        return new Str(value);
    }

    static OscArgument of(boolean value) {
        return new Bool(value);
    }

    record Int32(int value) implements OscArgument {
        @Override
        public char typeTag() {
            return 'i';
        }

        @Override
        public String render() {
            return Integer.toString(value);
        }
    }

    record Float32(float value) implements OscArgument {
        @Override
        public char typeTag() {
            return 'f';
        }

        @Override
        public String render() {
            return Float.toString(value);
        }

        // Bitwise equality so NaN payloads compare equal after a codec pass.
        @Override
        public boolean equals(Object o) {
            return o instanceof Float32 that
                    && Float.floatToIntBits(value) == Float.floatToIntBits(that.value);
        }

        @Override
        public int hashCode() {
            return Float.floatToIntBits(value);
        }
    }

    record Str(String value) implements OscArgument {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public char typeTag() {
            return 's';
        }

        @Override
        public String render() {
            return '"' + value + '"';
        }
    }

    record Blob(byte[] value) implements OscArgument {
        public Blob {
            Objects.requireNonNull(value, "value");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public char typeTag() {
            return 'b';
        }

        @Override
        public String render() {
            return "[blob " + value.length + " bytes]";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Blob that && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Blob[" + Arrays.toString(value) + "]";
        }
    }

    record Bool(boolean value) implements OscArgument {
        @Override
        public char typeTag() {
            return value ? 'T' : 'F';
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }
}

package com.questrail.wfs.osc.codec.impl;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * OscStreamFraming
 * -----------------------------------------------------------------------------
 * Length-prefix framing for OSC over TCP.
 *
 * <p>Every packet on a stream is preceded by its size as a 4-byte big-endian
 * integer. This is a local convention (OSC 1.0 leaves stream framing open)
 * and the outbound link and the TCP receiver must agree on it exactly, so
 * both take their constants from here.</p>
 */
public final class OscStreamFraming
{
    /** Size of the length prefix in bytes. */
    public static final int LENGTH_FIELD_BYTES = 4;

    private OscStreamFraming() {}

    /**
     * Returns {@code payload} preceded by its 4-byte big-endian length.
     */
    public static byte[] frame(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        return ByteBuffer.allocate(LENGTH_FIELD_BYTES + payload.length)
                .order(ByteOrder.BIG_ENDIAN)
                .putInt(payload.length)
                .put(payload)
                .array();
    }
}

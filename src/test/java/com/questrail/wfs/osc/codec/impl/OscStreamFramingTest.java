package com.questrail.wfs.osc.codec.impl;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

final class OscStreamFramingTest
{
    @Test
    void framePrefixesBigEndianLength()
    {
        byte[] payload = new byte[300];
        payload[299] = 42;

        byte[] framed = OscStreamFraming.frame(payload);

        assertEquals(OscStreamFraming.LENGTH_FIELD_BYTES + 300, framed.length);
        assertArrayEquals(new byte[] { 0, 0, 1, 44 }, new byte[] { framed[0], framed[1], framed[2], framed[3] });
        assertEquals(300, ByteBuffer.wrap(framed).getInt());
        assertEquals(42, framed[framed.length - 1]);
    }

    @Test
    void emptyPayloadFramesToLengthOnly()
    {
        assertArrayEquals(new byte[] { 0, 0, 0, 0 }, OscStreamFraming.frame(new byte[0]));
    }
}

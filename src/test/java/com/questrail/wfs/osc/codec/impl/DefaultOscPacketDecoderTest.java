package com.questrail.wfs.osc.codec.impl;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drop-on-malformed behaviour at the decoder port.
 */
final class DefaultOscPacketDecoderTest
{
    private final DefaultOscPacketDecoder decoder = new DefaultOscPacketDecoder();
    private final DefaultOscPacketEncoder encoder = new DefaultOscPacketEncoder();

    @Test
    void wellFormedPacketDecodes()
    {
        OscMessage message = OscMessage.of("/wfs/config/stage/width", OscArgument.of(24.0f));

        assertEquals(message, decoder.decode(encoder.encode(message)).orElseThrow());
    }

    @Test
    void emptyPacketIsDropped()
    {
        assertTrue(decoder.decode(new byte[0]).isEmpty());
    }

    @Test
    void garbageIsDroppedWithoutThrowing()
    {
        assertTrue(decoder.decode("not osc".getBytes(StandardCharsets.US_ASCII)).isEmpty());
        assertTrue(decoder.decode(new byte[] { '/', 'a', 0, 0, 'x', 0, 0, 0 }).isEmpty());
    }
}

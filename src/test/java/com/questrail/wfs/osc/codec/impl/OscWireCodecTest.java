package com.questrail.wfs.osc.codec.impl;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OscWireCodecTest
 * -----------------------------------------------------------------------------
 * Wire-level tests for {@link OscWireCodec}.
 *
 * <p>Byte layouts are written out by hand so that padding and byte order are
 * checked against the OSC 1.0 rules rather than against the encoder itself.</p>
 */
final class OscWireCodecTest
{
    @Test
    void encodesChannelMessageToExactBytes()
    {
        OscMessage message = OscMessage.of("/wfs/input/attenuation",
                OscArgument.of(1), OscArgument.of(-6.0f));

        byte[] expected = concat(
                ascii("/wfs/input/attenuation"), new byte[] { 0, 0 },   // 22 chars + 2 = 24
                ascii(",if"), new byte[] { 0 },                          // 3 chars + 1 = 4
                new byte[] { 0, 0, 0, 1 },
                new byte[] { (byte) 0xC0, (byte) 0xC0, 0, 0 });          // -6.0f

        assertArrayEquals(expected, OscWireCodec.encode(message));
        assertEquals(36, expected.length);
    }

    @Test
    void stringOfFourBytesGetsAFullWordOfPadding()
    {
        byte[] encoded = OscWireCodec.encode(OscMessage.of("/abc", OscArgument.of("wxyz")));

        // "/abc" -> 8, ",s" -> 4, "wxyz" -> 8
        assertEquals(20, encoded.length);
        assertEquals(0, encoded[4]);
        assertEquals(0, encoded[16]);
        assertEquals(0, encoded[19]);
    }

    @Test
    void decodesWhatItEncodes()
    {
        OscMessage message = OscMessage.of("/remoteInput/inputName",
                OscArgument.of(3), OscArgument.of("Violin é"), OscArgument.of(0.25f),
                new OscArgument.Blob(new byte[] { 1, 2, 3, 4, 5 }));

        OscPacket decoded = OscWireCodec.decode(OscWireCodec.encode(message));

        assertEquals(message, decoded);
    }

    @Test
    void booleansCarryNoPayload()
    {
        OscMessage message = OscMessage.of("/t", OscArgument.of(true), OscArgument.of(false));

        byte[] encoded = OscWireCodec.encode(message);

        assertEquals(8, encoded.length);
        assertEquals(message, OscWireCodec.decode(encoded));
    }

    @Test
    void unknownTypeTagIsSkippedWithoutConsumingPayload()
    {
        byte[] packet = concat(
                ascii("/x"), new byte[] { 0, 0 },
                ascii(",ihi"), new byte[] { 0, 0, 0, 0 },
                new byte[] { 0, 0, 0, 7 },
                new byte[] { 0, 0, 0, 9 });

        OscMessage decoded = (OscMessage) OscWireCodec.decode(packet);

        assertEquals(2, decoded.size());
        assertEquals(OscArgument.of(7), decoded.argument(0));
        assertEquals(OscArgument.of(9), decoded.argument(1));
    }

    @Test
    void messageWithoutTypeTagsDecodesWithNoArguments()
    {
        byte[] packet = concat(ascii("/ping"), new byte[] { 0, 0, 0 });

        OscMessage decoded = (OscMessage) OscWireCodec.decode(packet);

        assertEquals("/ping", decoded.address());
        assertEquals(0, decoded.size());
    }

    @Test
    void addressWithoutLeadingSlashIsRejected()
    {
        byte[] packet = concat(ascii("abc"), new byte[] { 0 }, ascii(",i"), new byte[] { 0, 0 },
                new byte[] { 0, 0, 0, 1 });

        assertThrows(OscFormatException.class, () -> OscWireCodec.decode(packet));
    }

    @Test
    void truncatedArgumentIsRejected()
    {
        byte[] packet = concat(ascii("/a"), new byte[] { 0, 0 }, ascii(",i"), new byte[] { 0, 0 },
                new byte[] { 0, 1 });

        assertThrows(OscFormatException.class, () -> OscWireCodec.decode(packet));
    }

    @Test
    void unterminatedStringIsRejected()
    {
        assertThrows(OscFormatException.class, () -> OscWireCodec.decode(ascii("/abcd")));
    }

    @Test
    void bundleCarriesImmediateTimetagAndSizedElements()
    {
        OscMessage first = OscMessage.of("/a", OscArgument.of(1));
        OscBundle bundle = OscBundle.of(first);

        ByteBuffer in = ByteBuffer.wrap(OscWireCodec.encode(bundle));

        byte[] header = new byte[8];
        in.get(header);
        assertArrayEquals(OscWireCodec.BUNDLE_HEADER, header);
        assertEquals(OscWireCodec.IMMEDIATE_TIMETAG, in.getLong());
        assertEquals(OscWireCodec.sizeOf(first), in.getInt());
    }

    @Test
    void nestedBundlesDecode()
    {
        OscBundle inner = OscBundle.of(OscMessage.of("/inner", OscArgument.of(2.5f)));
        OscBundle outer = OscBundle.of(OscMessage.of("/outer", OscArgument.of(1)), inner);

        OscBundle decoded = (OscBundle) OscWireCodec.decode(OscWireCodec.encode(outer));

        assertEquals(outer, decoded);
    }

    @Test
    void bundleStopsAtOversizedElementAndKeepsEarlierOnes()
    {
        OscMessage first = OscMessage.of("/first", OscArgument.of(1));
        OscMessage second = OscMessage.of("/second", OscArgument.of(2));
        byte[] encoded = OscWireCodec.encode(OscBundle.of(first, second));

        // GIVEN: the second element's size prefix claims more bytes than remain
        int secondSizeOffset = 16 + 4 + OscWireCodec.sizeOf(first);
        ByteBuffer.wrap(encoded).putInt(secondSizeOffset, 10_000);

        // WHEN
        OscBundle decoded = (OscBundle) OscWireCodec.decode(encoded);

        // THEN: the first element survives
        assertEquals(1, decoded.size());
        assertEquals(first, decoded.elements().get(0));
    }

    @Test
    void bundleStopsAtZeroSizedElement()
    {
        OscMessage first = OscMessage.of("/first");
        byte[] encoded = OscWireCodec.encode(OscBundle.of(first, OscMessage.of("/second")));
        ByteBuffer.wrap(encoded).putInt(16 + 4 + OscWireCodec.sizeOf(first), 0);

        OscBundle decoded = (OscBundle) OscWireCodec.decode(encoded);

        assertEquals(1, decoded.size());
    }

    @Test
    void shortPacketStartingWithHashIsNotABundle()
    {
        assertFalse(OscWireCodec.isBundle(ByteBuffer.wrap(ascii("#bund"))));
    }

    private static byte[] ascii(String s)
    {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}

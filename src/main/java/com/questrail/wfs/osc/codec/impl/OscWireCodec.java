package com.questrail.wfs.osc.codec.impl;

import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OscWireCodec
 * =============================================================================
 * OSC 1.0 binary encoding and decoding of messages and bundles.
 *
 * <h2>Wire rules</h2>
 * <ul>
 *   <li>Strings are UTF-8, null terminated, then zero padded to a multiple of
 *       four bytes.</li>
 *   <li>Blobs are an {@code int32} length, the bytes, then zero padding.</li>
 *   <li>Numbers are big-endian; floats are written through
 *       {@link Float#floatToIntBits(float)}.</li>
 *   <li>A bundle is {@code "#bundle\0"}, an 8-byte timetag (always written as
 *       "immediate"), then each element prefixed by its {@code int32} size.</li>
 * </ul>
 *
 * <h2>Lenient decoding</h2>
 * <p>Two degradations are intentional and covered by tests:</p>
 * <ul>
 *   <li>Unknown type tag characters are skipped without consuming payload.</li>
 *   <li>Bundle parsing stops quietly at the first element whose size prefix is
 *       zero, negative or larger than the bytes left; the elements decoded so
 *       far are returned.</li>
 * </ul>
 *
 * <p>All methods are static and stateless. Decode methods throw
 * {@link OscFormatException}; callers at the port boundary convert that into
 * an empty result.</p>
 */
public final class OscWireCodec
{
    /** Literal bundle header including its null terminator. */
    static final byte[] BUNDLE_HEADER = "#bundle\0".getBytes(StandardCharsets.US_ASCII);

    /** Bytes compared when sniffing a bundle element or datagram. */
    static final int BUNDLE_PREFIX_LENGTH = 7;

    /** OSC "immediately" timetag. */
    static final long IMMEDIATE_TIMETAG = 1L;

    private OscWireCodec() {}

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    public static byte[] encode(OscPacket packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (packet instanceof OscBundle b) {
            return encodeBundle(b);
        }
        return encodeMessage((OscMessage) packet);
    }

    public static byte[] encodeMessage(OscMessage message)
    {
        Objects.requireNonNull(message, "message");
        ByteBuffer out = newBuffer(sizeOf(message));
        writeMessage(out, message);
        return out.array();
    }

    public static byte[] encodeBundle(OscBundle bundle)
    {
        Objects.requireNonNull(bundle, "bundle");
        ByteBuffer out = newBuffer(sizeOf(bundle));
        writeBundle(out, bundle);
        return out.array();
    }

    private static ByteBuffer newBuffer(int size)
    {
        return ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
    }

    private static void writeMessage(ByteBuffer out, OscMessage message)
    {
        writeString(out, message.address());
        writeString(out, typeTagString(message));

        for (OscArgument argument : message.arguments()) {
            if (argument instanceof OscArgument.Int32 i) {
                out.putInt(i.value());
            }
            else if (argument instanceof OscArgument.Float32 f) {
                out.putInt(Float.floatToIntBits(f.value()));
            }
            else if (argument instanceof OscArgument.Str s) {
                writeString(out, s.value());
            }
            else if (argument instanceof OscArgument.Blob b) {
                writeBlob(out, b.value());
            }
            // Bool: T and F carry no payload bytes.
        }
    }

    private static void writeBundle(ByteBuffer out, OscBundle bundle)
    {
        out.put(BUNDLE_HEADER);
        out.putLong(IMMEDIATE_TIMETAG);

        for (OscPacket element : bundle.elements()) {
            out.putInt(sizeOf(element));
            if (element instanceof OscBundle b) {
                writeBundle(out, b);
            }
            else {
                writeMessage(out, (OscMessage) element);
            }
        }
    }

    static String typeTagString(OscMessage message)
    {
        StringBuilder tags = new StringBuilder(message.size() + 1).append(',');
        for (OscArgument argument : message.arguments()) {
            tags.append(argument.typeTag());
        }
        return tags.toString();
    }

    private static void writeString(ByteBuffer out, String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.put(bytes);
        int padded = OscPadding.paddedStringLength(bytes.length);
        for (int i = bytes.length; i < padded; i++) {
            out.put((byte) 0);
        }
    }

    private static void writeBlob(ByteBuffer out, byte[] bytes)
    {
        out.putInt(bytes.length);
        out.put(bytes);
        int padded = OscPadding.align4(bytes.length);
        for (int i = bytes.length; i < padded; i++) {
            out.put((byte) 0);
        }
    }

    static int sizeOf(OscPacket packet)
    {
        if (packet instanceof OscBundle b) {
            return sizeOf(b);
        }
        return sizeOf((OscMessage) packet);
    }

    private static int sizeOf(OscMessage message)
    {
        int size = stringSize(message.address()) + stringSize(typeTagString(message));
        for (OscArgument argument : message.arguments()) {
            if (argument instanceof OscArgument.Str s) {
                size += stringSize(s.value());
            }
            else if (argument instanceof OscArgument.Blob b) {
                size += 4 + OscPadding.align4(b.length());
            }
            else if (argument.isNumeric()) {
                size += 4;
            }
        }
        return size;
    }

    private static int sizeOf(OscBundle bundle)
    {
        int size = BUNDLE_HEADER.length + 8;
        for (OscPacket element : bundle.elements()) {
            size += 4 + sizeOf(element);
        }
        return size;
    }

    private static int stringSize(String value)
    {
        return OscPadding.paddedStringLength(value.getBytes(StandardCharsets.UTF_8).length);
    }

    // ---------------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------------

    /**
     * Decode a complete packet, choosing bundle or message by its leading bytes.
     */
    public static OscPacket decode(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        ByteBuffer in = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        return isBundle(in) ? decodeBundle(in) : decodeMessage(in);
    }

    /**
     * Returns true if the bytes from the buffer's position start with the
     * {@code #bundle} marker. A packet shorter than the full 8-byte header is
     * never treated as a bundle.
     */
    public static boolean isBundle(ByteBuffer in)
    {
        if (in.remaining() < BUNDLE_HEADER.length) {
            return false;
        }
        int start = in.position();
        for (int i = 0; i < BUNDLE_PREFIX_LENGTH; i++) {
            if (in.get(start + i) != BUNDLE_HEADER[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decode one message starting at the buffer's position. On return the
     * position is just past the message's last argument.
     */
    public static OscMessage decodeMessage(ByteBuffer in)
    {
        String address = readString(in);
        if (!address.startsWith("/")) {
            throw new OscFormatException("OSC address must start with '/': '" + address + "'");
        }

        List<OscArgument> arguments = new ArrayList<>();
        if (!in.hasRemaining()) {
            return new OscMessage(address, arguments);
        }

        String tags = readString(in);
        if (tags.isEmpty() || tags.charAt(0) != ',') {
            throw new OscFormatException("Missing type tag string after " + address);
        }

        for (int i = 1; i < tags.length(); i++) {
            char tag = tags.charAt(i);
            switch (tag) {
                case 'i' -> arguments.add(new OscArgument.Int32(readInt(in)));
                case 'f' -> arguments.add(new OscArgument.Float32(Float.intBitsToFloat(readInt(in))));
                case 's' -> arguments.add(new OscArgument.Str(readString(in)));
                case 'b' -> arguments.add(new OscArgument.Blob(readBlob(in)));
                case 'T' -> arguments.add(new OscArgument.Bool(true));
                case 'F' -> arguments.add(new OscArgument.Bool(false));
                default -> {
                    // Unsupported tag: skipped, no payload consumed.
                }
            }
        }

        return new OscMessage(address, arguments);
    }

    /**
     * Decode one bundle starting at the buffer's position and running to the
     * buffer's limit.
     */
    public static OscBundle decodeBundle(ByteBuffer in)
    {
        if (!isBundle(in)) {
            throw new OscFormatException("Missing #bundle header");
        }
        in.position(in.position() + BUNDLE_HEADER.length);

        require(in, 8, "bundle timetag");
        in.getLong(); // timetag, not used

        List<OscPacket> elements = new ArrayList<>();
        while (in.remaining() >= 4) {
            int size = in.getInt();
            if (size <= 0 || size > in.remaining()) {
                // Truncated or corrupt element size: keep what was decoded.
                break;
            }

            ByteBuffer element = in.slice(in.position(), size).order(ByteOrder.BIG_ENDIAN);
            in.position(in.position() + size);

            elements.add(isBundle(element) ? decodeBundle(element) : decodeMessage(element));
        }

        return new OscBundle(elements);
    }

    private static void require(ByteBuffer in, int bytes, String what)
    {
        if (in.remaining() < bytes) {
            throw new OscFormatException("Packet truncated reading " + what
                    + " (need " + bytes + ", have " + in.remaining() + ")");
        }
    }

    private static int readInt(ByteBuffer in)
    {
        require(in, 4, "int32");
        return in.getInt();
    }

    private static String readString(ByteBuffer in)
    {
        int start = in.position();
        int end = -1;
        for (int i = start; i < in.limit(); i++) {
            if (in.get(i) == 0) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            throw new OscFormatException("Unterminated OSC string at offset " + start);
        }

        byte[] bytes = new byte[end - start];
        in.get(bytes);

        int consumed = OscPadding.paddedStringLength(bytes.length);
        int next = Math.min(start + consumed, in.limit());
        in.position(next);

        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] readBlob(ByteBuffer in)
    {
        int length = readInt(in);
        if (length < 0) {
            throw new OscFormatException("Negative blob length " + length);
        }
        require(in, length, "blob");

        byte[] bytes = new byte[length];
        in.get(bytes);

        int padding = OscPadding.align4(length) - length;
        in.position(Math.min(in.position() + padding, in.limit()));
        return bytes;
    }
}

package com.questrail.wfs.osc.codec.impl;

/**
 * Indicates that a byte sequence is not a well-formed OSC packet.
 *
 * This typically reflects:
 * <ul>
 *   <li>An address that does not start with {@code '/'}</li>
 *   <li>A string without a null terminator inside the packet</li>
 *   <li>An argument that runs past the end of the packet</li>
 *   <li>A bundle without the {@code #bundle} header and timetag</li>
 * </ul>
 *
 * <p>This exception never crosses the {@code OscPacketDecoder} port; it is
 * converted to an empty result there.</p>
 */
public final class OscFormatException extends RuntimeException
{
    public OscFormatException(String message) {
        super(message);
    }

    public OscFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.wfs.osc.codec;

import com.questrail.wfs.osc.model.OscPacket;

import java.util.Optional;

/**
 * OscPacketDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw transport payloads and the packet model.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Deciding between bundle and message by the leading bytes</li>
 *   <li>Validating OSC structure (address, type tags, padding)</li>
 *   <li>Constructing an {@link OscPacket} on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for routing, counting
 * failures, or buffering partial data. Every call receives one complete
 * packet (a UDP datagram or one length-delimited TCP frame).</p>
 */
public interface OscPacketDecoder
{
    /**
     * Attempt to decode one complete OSC packet.
     *
     * @param packet raw bytes of exactly one packet
     * @return the decoded packet, or {@link Optional#empty()} if the bytes are
     *         not a well-formed OSC packet
     */
    Optional<OscPacket> decode(byte[] packet);
}

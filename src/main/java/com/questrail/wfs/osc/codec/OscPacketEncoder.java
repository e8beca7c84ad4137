package com.questrail.wfs.osc.codec;

import com.questrail.wfs.osc.model.OscPacket;

/**
 * OscPacketEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between the packet model and raw OSC 1.0 bytes.
 *
 * <p>The encoder produces the bare OSC payload. Transport framing (the 4-byte
 * length prefix used on TCP) is applied by the caller, not here.</p>
 */
public interface OscPacketEncoder
{
    /**
     * Encode a message or bundle into its OSC 1.0 binary form.
     *
     * @param packet packet to encode
     * @return encoded bytes; length is always a multiple of four
     */
    byte[] encode(OscPacket packet);
}

package com.questrail.wfs.osc.codec.impl;

import com.questrail.wfs.osc.codec.OscPacketDecoder;
import com.questrail.wfs.osc.model.OscPacket;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultOscPacketDecoder
 * -----------------------------------------------------------------------------
 * {@link OscPacketDecoder} backed by {@link OscWireCodec}.
 *
 * <p>Implements the drop-on-malformed rule at the port boundary: any
 * {@link OscFormatException} (or an address rejected by the model) becomes
 * {@link Optional#empty()}. Callers decide whether to count the drop.</p>
 */
public final class DefaultOscPacketDecoder implements OscPacketDecoder
{
    @Override
    public Optional<OscPacket> decode(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");

        if (packet.length == 0) {
            return Optional.empty();
        }

        try {
            return Optional.of(OscWireCodec.decode(packet));
        }
        catch (OscFormatException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

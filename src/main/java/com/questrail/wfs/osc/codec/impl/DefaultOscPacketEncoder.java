package com.questrail.wfs.osc.codec.impl;

import com.questrail.wfs.osc.codec.OscPacketEncoder;
import com.questrail.wfs.osc.model.OscPacket;

import java.util.Objects;

/**
 * DefaultOscPacketEncoder
 * -----------------------------------------------------------------------------
 * {@link OscPacketEncoder} backed by {@link OscWireCodec}.
 */
public final class DefaultOscPacketEncoder implements OscPacketEncoder
{
    @Override
    public byte[] encode(OscPacket packet)
    {
        return OscWireCodec.encode(Objects.requireNonNull(packet, "packet"));
    }
}

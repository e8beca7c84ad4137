package com.questrail.wfs.osc.transport;

import com.questrail.wfs.osc.config.ConnectionMode;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Where an inbound packet came from: the sender's IP as text, its port, and
 * the transport the packet arrived on.
 */
public record OscPacketSource(String senderIp, int port, ConnectionMode transport)
{
    public OscPacketSource {
        Objects.requireNonNull(senderIp, "senderIp");
        Objects.requireNonNull(transport, "transport");
    }

    public static OscPacketSource of(InetSocketAddress sender, ConnectionMode transport) {
        Objects.requireNonNull(sender, "sender");
        String ip = sender.getAddress() != null
                ? sender.getAddress().getHostAddress()
                : sender.getHostString();
        return new OscPacketSource(ip, sender.getPort(), transport);
    }
}

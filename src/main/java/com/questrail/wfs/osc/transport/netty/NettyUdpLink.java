package com.questrail.wfs.osc.transport.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.socket.DatagramPacket;

import java.net.InetSocketAddress;

/**
 * UDP sender bound to an ephemeral local port. Every packet is one datagram
 * to the fixed remote endpoint.
 */
final class NettyUdpLink extends NettyChannelLink
{
    private final InetSocketAddress remote;

    NettyUdpLink(Channel channel, InetSocketAddress remote)
    {
        super(channel);
        this.remote = remote;
    }

    @Override
    protected Object outbound(byte[] packet)
    {
        return new DatagramPacket(Unpooled.wrappedBuffer(packet), remote);
    }

    @Override
    public String toString()
    {
        return "udp:" + remote;
    }
}

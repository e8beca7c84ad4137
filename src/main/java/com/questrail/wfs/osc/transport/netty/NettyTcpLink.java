package com.questrail.wfs.osc.transport.netty;

import com.questrail.wfs.osc.codec.impl.OscStreamFraming;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

/**
 * Connected TCP stream. Each packet goes out with its 4-byte length prefix.
 */
final class NettyTcpLink extends NettyChannelLink
{
    NettyTcpLink(Channel channel)
    {
        super(channel);
    }

    @Override
    protected Object outbound(byte[] packet)
    {
        return Unpooled.wrappedBuffer(OscStreamFraming.frame(packet));
    }

    @Override
    public String toString()
    {
        return "tcp:" + channel.remoteAddress();
    }
}

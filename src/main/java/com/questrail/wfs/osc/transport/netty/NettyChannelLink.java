package com.questrail.wfs.osc.transport.netty;

import com.questrail.wfs.osc.transport.OscLink;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous write over a Netty channel.
 *
 * <p>A write waits up to {@link #WRITE_TIMEOUT_MS} for the flush to complete.
 * When called on the channel's own event loop it cannot wait, so the write is
 * queued and reported as successful.</p>
 */
abstract class NettyChannelLink implements OscLink
{
    private static final Logger log = LoggerFactory.getLogger(NettyChannelLink.class);

    static final long WRITE_TIMEOUT_MS = 1_000;

    protected final Channel channel;

    NettyChannelLink(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /** Wrap one encoded packet in whatever the channel pipeline expects. */
    protected abstract Object outbound(byte[] packet);

    @Override
    public boolean write(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (!channel.isActive()) {
            return false;
        }

        ChannelFuture f = channel.writeAndFlush(outbound(packet));
        if (channel.eventLoop().inEventLoop()) {
            return true;
        }
        if (!f.awaitUninterruptibly(WRITE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            log.debug("Write to {} did not complete within {} ms", channel.remoteAddress(), WRITE_TIMEOUT_MS);
            return false;
        }
        if (!f.isSuccess()) {
            log.debug("Write to {} failed", channel.remoteAddress(), f.cause());
            return false;
        }
        return true;
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void close()
    {
        channel.close();
    }
}

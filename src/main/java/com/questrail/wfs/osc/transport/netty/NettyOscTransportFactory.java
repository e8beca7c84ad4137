package com.questrail.wfs.osc.transport.netty;

import com.questrail.wfs.osc.codec.OscPacketDecoder;
import com.questrail.wfs.osc.codec.impl.DefaultOscPacketDecoder;
import com.questrail.wfs.osc.transport.OscLink;
import com.questrail.wfs.osc.transport.OscLinkFactory;
import com.questrail.wfs.osc.transport.OscPacketDispatcher;
import com.questrail.wfs.osc.transport.OscPacketListener;
import com.questrail.wfs.osc.transport.OscReceiver;
import com.questrail.wfs.osc.transport.OscReceiverFactory;
import com.questrail.wfs.osc.transport.tcp.netty.NettyTcpReceiver;
import com.questrail.wfs.osc.transport.udp.OscUdpReceiver;
import com.questrail.wfs.osc.transport.udp.netty.NettyUdpDatagramEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyOscTransportFactory
 * =============================================================================
 * Production wiring of the transport ports onto Netty NIO.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>Outbound links share one event loop group owned by this factory.</li>
 *   <li>Each receiver owns its own groups, created per start of listening,
 *       so a receiver restart never disturbs open links.</li>
 * </ul>
 *
 * <p>Outbound channels discard anything the remote sends back.</p>
 */
public final class NettyOscTransportFactory implements OscLinkFactory, OscReceiverFactory
{
    private final OscPacketDecoder decoder;
    private final EventLoopGroup linkGroup = new NioEventLoopGroup(1);

    public NettyOscTransportFactory()
    {
        this(new DefaultOscPacketDecoder());
    }

    public NettyOscTransportFactory(OscPacketDecoder decoder)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    // -------------------------------------------------------------------------
    // OscReceiverFactory
    // -------------------------------------------------------------------------

    @Override
    public OscReceiver udp(InetSocketAddress bindAddress, OscPacketListener listener)
    {
        return new OscUdpReceiver(new NettyUdpDatagramEndpoint(bindAddress),
                new OscPacketDispatcher(decoder, listener));
    }

    @Override
    public OscReceiver tcp(InetSocketAddress bindAddress, OscPacketListener listener)
    {
        return new NettyTcpReceiver(bindAddress, new OscPacketDispatcher(decoder, listener));
    }

    // -------------------------------------------------------------------------
    // OscLinkFactory
    // -------------------------------------------------------------------------

    @Override
    public OscLink openUdp(InetSocketAddress remote) throws IOException
    {
        requireResolved(remote);

        ChannelFuture f = new Bootstrap()
                .group(linkGroup)
                .channel(NioDatagramChannel.class)
                .handler(new DiscardInbound())
                .bind(0);

        Channel channel = await(f, Duration.ofMillis(NettyChannelLink.WRITE_TIMEOUT_MS), "UDP bind for " + remote);
        return new NettyUdpLink(channel, remote);
    }

    @Override
    public OscLink openTcp(InetSocketAddress remote, Duration timeout) throws IOException
    {
        requireResolved(remote);
        Objects.requireNonNull(timeout, "timeout");

        ChannelFuture f = new Bootstrap()
                .group(linkGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new DiscardInbound())
                .connect(remote);

        Channel channel = await(f, timeout.plusMillis(100), "TCP connect to " + remote);
        return new NettyTcpLink(channel);
    }

    @Override
    public void close()
    {
        linkGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    private static void requireResolved(InetSocketAddress remote) throws IOException
    {
        Objects.requireNonNull(remote, "remote");
        if (remote.isUnresolved()) {
            throw new IOException("Unresolved address " + remote.getHostString());
        }
    }

    private static Channel await(ChannelFuture f, Duration timeout, String what) throws IOException
    {
        boolean done;
        try {
            done = f.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            f.channel().close();
            throw new InterruptedIOException(what + " interrupted");
        }

        if (!done) {
            f.cancel(false);
            f.channel().close();
            throw new IOException(what + " timed out after " + timeout.toMillis() + " ms");
        }
        if (!f.isSuccess()) {
            f.channel().close();
            throw new IOException(what + " failed", f.cause());
        }
        return f.channel();
    }

    private static final class DiscardInbound extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ReferenceCountUtil.release(msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            ctx.close();
        }
    }
}

package com.questrail.wfs.osc.transport.tcp.netty;

import com.questrail.wfs.osc.codec.impl.OscStreamFraming;
import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.transport.OscPacketDispatcher;
import com.questrail.wfs.osc.transport.OscReceiver;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyTcpReceiver
 * =============================================================================
 * Accepts TCP clients and turns their length-prefixed frames into OSC packets.
 *
 * <h2>Framing</h2>
 * Each packet on the stream is a 4-byte big-endian length followed by that
 * many bytes of OSC packet. {@link LengthFieldBasedFrameDecoder} reassembles
 * frames across reads, so a frame split over several TCP segments is handled.
 *
 * <h2>Client policy</h2>
 * <ul>
 *   <li>At most {@link OscLimits#MAX_TCP_CLIENTS} clients are served; an
 *       extra client is closed as soon as it is accepted.</li>
 *   <li>A frame whose length is zero, negative or larger than
 *       {@link OscLimits#MAX_TCP_PACKET_SIZE} closes that client. Other
 *       clients are unaffected.</li>
 *   <li>Closed clients leave the active set immediately.</li>
 * </ul>
 *
 * <p>Netty types MUST NOT escape this package.</p>
 */
public final class NettyTcpReceiver implements OscReceiver
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpReceiver.class);

    private static final long BIND_TIMEOUT_MS = 2_000;

    private final InetSocketAddress bindAddress;
    private final OscPacketDispatcher dispatcher;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final AtomicInteger admitted = new AtomicInteger();

    private volatile Channel serverChannel;

    public NettyTcpReceiver(InetSocketAddress bindAddress, OscPacketDispatcher dispatcher)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public boolean start()
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        admit(ch);
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress);
        if (!f.awaitUninterruptibly(BIND_TIMEOUT_MS, TimeUnit.MILLISECONDS) || !f.isSuccess()) {
            log.warn("TCP receiver could not bind {}", bindAddress, f.cause());
            f.channel().close();
            shutdownGroups();
            return false;
        }

        serverChannel = f.channel();
        log.info("TCP receiver listening on {}", serverChannel.localAddress());
        return true;
    }

    private void admit(SocketChannel ch)
    {
        if (admitted.incrementAndGet() > OscLimits.MAX_TCP_CLIENTS) {
            admitted.decrementAndGet();
            log.warn("Rejecting TCP client {}: {} clients already connected",
                    ch.remoteAddress(), OscLimits.MAX_TCP_CLIENTS);
            ch.close();
            return;
        }

        clients.add(ch);
        ch.closeFuture().addListener(done -> admitted.decrementAndGet());

        ch.pipeline()
                .addLast(new LengthFieldBasedFrameDecoder(
                        OscLimits.MAX_TCP_PACKET_SIZE + OscStreamFraming.LENGTH_FIELD_BYTES,
                        0, OscStreamFraming.LENGTH_FIELD_BYTES,
                        0, OscStreamFraming.LENGTH_FIELD_BYTES))
                .addLast(new FrameHandler());
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly(BIND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }
        clients.close().awaitUninterruptibly(BIND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        shutdownGroups();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        workerGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isListening()
    {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    @Override
    public long parseErrorCount()
    {
        return dispatcher.parseErrorCount();
    }

    @Override
    public int localPort()
    {
        Channel ch = serverChannel;
        return ch != null && ch.isActive() ? ((InetSocketAddress) ch.localAddress()).getPort() : -1;
    }

    /**
     * Clients currently connected.
     */
    public int activeClientCount()
    {
        return clients.size();
    }

    /**
     * FrameHandler
     * -------------------------------------------------------------------------
     * One per client. Receives frames with the length prefix already stripped.
     */
    private final class FrameHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            if (!frame.isReadable()) {
                log.debug("Closing TCP client {}: empty frame", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }

            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            dispatcher.dispatch(bytes, (InetSocketAddress) ctx.channel().remoteAddress(), ConnectionMode.TCP);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Corrupt or oversized length prefix: the stream cannot be resynchronised.
            log.debug("Closing TCP client {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}

package com.questrail.wfs.osc.transport.udp.netty;

import com.questrail.wfs.osc.config.OscLimits;
import com.questrail.wfs.osc.transport.DatagramEndpoint;
import com.questrail.wfs.osc.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * The UDP socket behind an OSC receive port, on one Netty NIO thread.
 *
 * <p>Every datagram up to {@link OscLimits#MAX_UDP_PACKET_SIZE} bytes is
 * copied out of its buffer and handed to the listener as raw bytes on the
 * receive thread. Decoding, sender filtering and routing happen above this
 * class. Netty types stay inside this package.</p>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} blocks until the port is bound or the bind fails; a failed
 * bind is reported through {@code onTransportDown} and leaves nothing running.
 * {@link #stop()} releases the port. An endpoint is started at most once; a
 * receiver restarted on a new port gets a new endpoint.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private static final long SETTLE_TIMEOUT_MS = 2_000;

    private final InetSocketAddress bindAddress;
    private final AtomicBoolean bound = new AtomicBoolean();

    private volatile DatagramEndpointListener listener;
    private volatile EventLoopGroup receiveLoop;
    private volatile Channel socket;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public boolean start()
    {
        DatagramEndpointListener target = listener;
        if (target == null) {
            throw new IllegalStateException("listener must be set before the UDP port " + bindAddress.getPort() + " is opened");
        }
        if (receiveLoop != null) {
            throw new IllegalStateException("UDP endpoint for " + bindAddress + " was already started");
        }

        EventLoopGroup loop = new NioEventLoopGroup(1);
        receiveLoop = loop;

        ChannelFuture binding = new Bootstrap()
                .group(loop)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(OscLimits.MAX_UDP_PACKET_SIZE))
                .handler(new DatagramForwarder())
                .bind(bindAddress);

        boolean settled = binding.awaitUninterruptibly(SETTLE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (settled && binding.isSuccess()) {
            socket = binding.channel();
            bound.set(true);
            log.debug("UDP endpoint bound to {}", socket.localAddress());
            target.onTransportUp();
            return true;
        }

        Throwable failure = binding.cause();
        if (failure == null) {
            failure = new IllegalStateException("no UDP bind on " + bindAddress + " within " + SETTLE_TIMEOUT_MS + " ms");
        }
        binding.channel().close();
        loop.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        target.onTransportDown(failure);
        return false;
    }

    @Override
    public void stop()
    {
        Channel ch = socket;
        socket = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly(SETTLE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }

        EventLoopGroup loop = receiveLoop;
        if (loop != null) {
            loop.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
        }
        reportClosed();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = socket;
        if (ch != null) {
            ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), (InetSocketAddress) remote));
        }
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = socket;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    /** Reports the socket gone, once per successful bind. */
    private void reportClosed()
    {
        if (!bound.getAndSet(false)) {
            return;
        }
        DatagramEndpointListener target = listener;
        if (target != null) {
            target.onTransportDown(null);
        }
    }

    private final class DatagramForwarder extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket datagram)
        {
            DatagramEndpointListener target = listener;
            if (target == null) {
                return;
            }
            // The packet is released when this method returns.
            ByteBuf body = datagram.content();
            byte[] packet = new byte[body.readableBytes()];
            body.getBytes(body.readerIndex(), packet);
            target.onDatagram(datagram.sender(), packet);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportClosed();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // One bad read does not close a datagram socket.
            log.warn("Receive error on UDP port {}", bindAddress.getPort(), cause);
        }
    }
}

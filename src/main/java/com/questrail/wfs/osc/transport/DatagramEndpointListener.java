package com.questrail.wfs.osc.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are serialized by the implementation (Netty endpoints deliver
 * them on the channel's event loop).</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with one complete datagram. Netty-backed implementations copy out
     * of the {@code ByteBuf} and release it before this call returns.
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}

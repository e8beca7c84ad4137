package com.questrail.wfs.osc.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a bound datagram socket.
 *
 * <p>The UDP receiver feeds inbound datagrams into the decode pipeline; the
 * endpoint itself never looks inside a payload.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving datagrams.
     *
     * <p>Blocks until the bind has succeeded or failed. On success the listener
     * sees {@link DatagramEndpointListener#onTransportUp()}; on failure it sees
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} with the bind
     * error.</p>
     *
     * @return {@code true} if the socket is bound
     */
    boolean start();

    /**
     * Close the socket and release all transport resources. The listener is
     * notified at most once per up/down transition.
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Ignored when the
     * endpoint is not bound.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * The bound local address, or {@code null} before a successful start.
     */
    InetSocketAddress localAddress();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}

package com.questrail.wfs.osc.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Opens outbound links. Connections call {@link #openUdp} on the caller's
 * thread and {@link #openTcp} on a background connect thread.
 */
public interface OscLinkFactory extends AutoCloseable
{
    /**
     * Create a UDP sender addressed to {@code remote}. Completes immediately.
     *
     * @throws IOException if the address is unresolved or no socket can be bound
     */
    OscLink openUdp(InetSocketAddress remote) throws IOException;

    /**
     * Open a TCP connection to {@code remote}, blocking up to {@code timeout}.
     *
     * @throws IOException if the connect fails, times out or is interrupted
     */
    OscLink openTcp(InetSocketAddress remote, Duration timeout) throws IOException;

    /**
     * Release resources shared by links created here. Links still open are
     * closed as a side effect.
     */
    @Override
    default void close() {}
}

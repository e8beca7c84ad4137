package com.questrail.wfs.osc.transport;

/**
 * A listening socket that turns inbound traffic into {@link OscPacketListener}
 * calls.
 */
public interface OscReceiver
{
    /**
     * Bind and start receiving.
     *
     * @return {@code false} if the socket could not be bound
     */
    boolean start();

    /**
     * Stop receiving and release the socket. Safe to call more than once.
     */
    void stop();

    boolean isListening();

    /**
     * Packets dropped because they did not decode.
     */
    long parseErrorCount();

    /**
     * The bound port, or {@code -1} when not listening.
     */
    int localPort();
}

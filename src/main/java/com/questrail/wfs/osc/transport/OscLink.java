package com.questrail.wfs.osc.transport;

/**
 * An open outbound path to one target.
 *
 * <p>{@link #write(byte[])} takes one encoded OSC packet. Stream links apply
 * the length-prefix framing themselves, so callers never frame.</p>
 */
public interface OscLink extends AutoCloseable
{
    /**
     * Write one packet and wait (bounded) for the write to complete.
     *
     * @return {@code false} if the link is closed or the write failed
     */
    boolean write(byte[] packet);

    boolean isOpen();

    @Override
    void close();
}

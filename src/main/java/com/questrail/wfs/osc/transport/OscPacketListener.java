package com.questrail.wfs.osc.transport;

import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;

/**
 * Receives decoded inbound packets together with their source.
 *
 * <p>Called synchronously on the receiving thread: the UDP event loop, or the
 * event loop serving the TCP client the packet came from. Implementations must
 * be safe for concurrent calls from several receivers.</p>
 */
public interface OscPacketListener
{
    void onMessage(OscMessage message, OscPacketSource source);

    void onBundle(OscBundle bundle, OscPacketSource source);
}

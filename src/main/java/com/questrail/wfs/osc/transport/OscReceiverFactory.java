package com.questrail.wfs.osc.transport;

import java.net.InetSocketAddress;

/**
 * Creates the receivers the manager listens with. A new receiver is created
 * on every (re)start of listening.
 */
public interface OscReceiverFactory
{
    OscReceiver udp(InetSocketAddress bindAddress, OscPacketListener listener);

    OscReceiver tcp(InetSocketAddress bindAddress, OscPacketListener listener);
}

package com.questrail.wfs.osc.transport.udp;

import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.transport.DatagramEndpoint;
import com.questrail.wfs.osc.transport.DatagramEndpointListener;
import com.questrail.wfs.osc.transport.OscPacketDispatcher;
import com.questrail.wfs.osc.transport.OscReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * OscUdpReceiver
 * =============================================================================
 * UDP receiver built on the {@link DatagramEndpoint} port.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → OscPacketDispatcher (OscPacketDecoder)
 *            → OscPacketListener
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class MUST NOT add retries, timing or sender filtering. Invalid
 * datagrams are counted by the dispatcher and dropped.
 */
public final class OscUdpReceiver implements OscReceiver, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(OscUdpReceiver.class);

    private final DatagramEndpoint endpoint;
    private final OscPacketDispatcher dispatcher;

    private volatile boolean listening;

    public OscUdpReceiver(DatagramEndpoint endpoint, OscPacketDispatcher dispatcher)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");

        this.endpoint.setListener(this);
    }

    @Override
    public boolean start()
    {
        return endpoint.start();
    }

    @Override
    public void stop()
    {
        endpoint.stop();
        listening = false;
    }

    @Override
    public boolean isListening()
    {
        return listening;
    }

    @Override
    public long parseErrorCount()
    {
        return dispatcher.parseErrorCount();
    }

    @Override
    public int localPort()
    {
        InetSocketAddress local = endpoint.localAddress();
        return listening && local != null ? local.getPort() : -1;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        listening = true;
        log.info("UDP receiver listening on {}", endpoint.localAddress());
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        listening = false;
        if (cause != null) {
            log.warn("UDP receiver down", cause);
        }
        else {
            log.info("UDP receiver stopped");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        if (!(remote instanceof InetSocketAddress sender)) {
            return;
        }
        dispatcher.dispatch(payload, sender, ConnectionMode.UDP);
    }
}

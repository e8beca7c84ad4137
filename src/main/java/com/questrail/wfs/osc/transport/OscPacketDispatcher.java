package com.questrail.wfs.osc.transport;

import com.questrail.wfs.osc.codec.OscPacketDecoder;
import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OscPacketDispatcher
 * =============================================================================
 * Decode-before-dispatch step shared by the UDP and TCP receivers.
 *
 * <pre>
 *   byte[] payload
 *        → OscPacketDecoder
 *            → OscPacketListener.onBundle   (payload starts with "#bundle")
 *            → OscPacketListener.onMessage  (anything else that decodes)
 * </pre>
 *
 * <p>Undecodable payloads are counted and dropped. A listener that throws is
 * logged and the receive loop carries on with the next packet.</p>
 */
public final class OscPacketDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(OscPacketDispatcher.class);

    private final OscPacketDecoder decoder;
    private final OscPacketListener listener;
    private final AtomicLong parseErrors = new AtomicLong();

    public OscPacketDispatcher(OscPacketDecoder decoder, OscPacketListener listener)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public void dispatch(byte[] payload, InetSocketAddress sender, ConnectionMode transport)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(sender, "sender");

        Optional<OscPacket> decoded = decoder.decode(payload);
        if (decoded.isEmpty()) {
            parseErrors.incrementAndGet();
            log.debug("Dropped undecodable {} packet ({} bytes) from {}", transport, payload.length, sender);
            return;
        }

        OscPacketSource source = OscPacketSource.of(sender, transport);
        OscPacket packet = decoded.get();
        try {
            if (packet instanceof OscBundle bundle) {
                listener.onBundle(bundle, source);
            }
            else {
                listener.onMessage((OscMessage) packet, source);
            }
        }
        catch (RuntimeException e) {
            log.warn("Listener failed handling {} packet from {}", transport, sender, e);
        }
    }

    public long parseErrorCount()
    {
        return parseErrors.get();
    }
}

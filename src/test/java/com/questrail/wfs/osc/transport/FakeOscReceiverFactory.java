package com.questrail.wfs.osc.transport;

import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Test-only {@link OscReceiverFactory}. Receivers never touch a socket;
 * tests push decoded packets through the captured listener instead.
 */
public final class FakeOscReceiverFactory implements OscReceiverFactory {

    private FakeReceiver udp;
    private FakeReceiver tcp;
    private boolean failUdpBind;
    private boolean failTcpBind;

    @Override
    public synchronized OscReceiver udp(InetSocketAddress bindAddress, OscPacketListener listener) {
        udp = new FakeReceiver(bindAddress, listener, failUdpBind);
        return udp;
    }

    @Override
    public synchronized OscReceiver tcp(InetSocketAddress bindAddress, OscPacketListener listener) {
        tcp = new FakeReceiver(bindAddress, listener, failTcpBind);
        return tcp;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized void failUdpBind(boolean fail) {
        failUdpBind = fail;
    }

    public synchronized void failTcpBind(boolean fail) {
        failTcpBind = fail;
    }

    public synchronized FakeReceiver udpReceiver() {
        return udp;
    }

    public synchronized FakeReceiver tcpReceiver() {
        return tcp;
    }

    /**
     * Deliver a message as if it arrived over UDP from {@code senderIp}.
     */
    public void receiveUdp(String senderIp, OscMessage message) {
        FakeReceiver receiver = udpReceiver();
        if (receiver == null || !receiver.isListening()) {
            throw new IllegalStateException("UDP receiver not listening");
        }
        receiver.listener.onMessage(message, new OscPacketSource(senderIp, 50000, ConnectionMode.UDP));
    }

    public void receiveUdpBundle(String senderIp, OscBundle bundle) {
        FakeReceiver receiver = udpReceiver();
        if (receiver == null || !receiver.isListening()) {
            throw new IllegalStateException("UDP receiver not listening");
        }
        receiver.listener.onBundle(bundle, new OscPacketSource(senderIp, 50000, ConnectionMode.UDP));
    }

    public static final class FakeReceiver implements OscReceiver {
        private final InetSocketAddress bindAddress;
        private final OscPacketListener listener;
        private final boolean failBind;
        private volatile boolean listening;
        private volatile long parseErrors;

        FakeReceiver(InetSocketAddress bindAddress, OscPacketListener listener, boolean failBind) {
            this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
            this.listener = Objects.requireNonNull(listener, "listener");
            this.failBind = failBind;
        }

        @Override
        public boolean start() {
            listening = !failBind;
            return listening;
        }

        @Override
        public void stop() {
            listening = false;
        }

        @Override
        public boolean isListening() {
            return listening;
        }

        @Override
        public long parseErrorCount() {
            return parseErrors;
        }

        @Override
        public int localPort() {
            return listening ? bindAddress.getPort() : -1;
        }

        public InetSocketAddress bindAddress() {
            return bindAddress;
        }

        public void addParseErrors(long count) {
            parseErrors += count;
        }
    }
}

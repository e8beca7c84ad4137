package com.questrail.wfs.osc.transport;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * In-memory UDP port for receiver tests. Datagrams are pushed in by the test
 * with {@link #injectDatagram}; a bind failure can be staged beforehand.
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    private final InetSocketAddress port;
    private DatagramEndpointListener listener;
    private boolean open;
    private boolean portTaken;

    public FakeDatagramEndpoint(InetSocketAddress port) {
        this.port = Objects.requireNonNull(port, "port");
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public boolean start() {
        if (portTaken) {
            listener.onTransportDown(new BindException("UDP port " + port.getPort() + " in use"));
            return false;
        }
        open = true;
        listener.onTransportUp();
        return true;
    }

    @Override
    public void stop() {
        if (open) {
            open = false;
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        // Receivers never reply on their listening port.
    }

    @Override
    public InetSocketAddress localAddress() {
        return open ? port : null;
    }

    /** The next {@link #start()} fails as if another process held the port. */
    public void failNextBind() {
        portTaken = true;
    }

    public void injectDatagram(SocketAddress sender, byte[] packet) {
        listener.onDatagram(sender, packet);
    }
}

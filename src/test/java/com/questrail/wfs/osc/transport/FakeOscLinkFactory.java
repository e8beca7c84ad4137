package com.questrail.wfs.osc.transport;

import com.questrail.wfs.osc.codec.impl.DefaultOscPacketDecoder;
import com.questrail.wfs.osc.model.OscBundle;
import com.questrail.wfs.osc.model.OscMessage;
import com.questrail.wfs.osc.model.OscPacket;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Test-only {@link OscLinkFactory}. Links record every packet written to
 * them, decoded, keyed by the remote address they were opened for.
 */
public final class FakeOscLinkFactory implements OscLinkFactory {

    public record Written(InetSocketAddress remote, OscPacket packet) {}

    private final List<Written> written = new ArrayList<>();
    private final List<FakeLink> links = new ArrayList<>();
    private final Set<InetSocketAddress> refused = new HashSet<>();
    private final DefaultOscPacketDecoder decoder = new DefaultOscPacketDecoder();
    private CompletableFuture<Void> tcpGate;
    private int tcpOpens;
    private int udpOpens;

    @Override
    public synchronized OscLink openUdp(InetSocketAddress remote) throws IOException {
        udpOpens++;
        return open(remote);
    }

    @Override
    public OscLink openTcp(InetSocketAddress remote, Duration timeout) throws IOException {
        CompletableFuture<Void> gate;
        synchronized (this) {
            gate = tcpGate;
        }
        if (gate != null) {
            awaitIgnoringInterrupts(gate);
        }
        synchronized (this) {
            tcpOpens++;
            return open(remote);
        }
    }

    private static void awaitIgnoringInterrupts(CompletableFuture<Void> gate) {
        boolean interrupted = false;
        while (!gate.isDone()) {
            try {
                gate.get();
            }
            catch (InterruptedException e) {
                interrupted = true;
            }
            catch (ExecutionException e) {
                throw new IllegalStateException(e);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private OscLink open(InetSocketAddress remote) throws IOException {
        Objects.requireNonNull(remote, "remote");
        if (refused.contains(remote)) {
            throw new ConnectException("Connection refused: " + remote);
        }
        FakeLink link = new FakeLink(remote);
        links.add(link);
        return link;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Hold every TCP connect until {@code gate} completes. Interrupts do not
     * release the hold, so a cancelled attempt still returns a link late.
     */
    public synchronized void holdTcpConnects(CompletableFuture<Void> gate) {
        tcpGate = gate;
    }

    public synchronized void refuse(InetSocketAddress remote) {
        refused.add(remote);
    }

    public synchronized List<Written> written() {
        return new ArrayList<>(written);
    }

    /**
     * Messages written to {@code remote}, bundles flattened.
     */
    public synchronized List<OscMessage> messagesTo(InetSocketAddress remote) {
        List<OscMessage> out = new ArrayList<>();
        for (Written w : written) {
            if (w.remote().equals(remote)) {
                flatten(w.packet(), out);
            }
        }
        return out;
    }

    public synchronized List<OscMessage> messagesTo(InetSocketAddress remote, String address) {
        List<OscMessage> out = new ArrayList<>();
        for (OscMessage m : messagesTo(remote)) {
            if (m.address().equals(address)) {
                out.add(m);
            }
        }
        return out;
    }

    public synchronized void clearWritten() {
        written.clear();
    }

    /**
     * Make the most recently opened link to {@code remote} fail its writes.
     */
    public synchronized void breakLink(InetSocketAddress remote) {
        for (int i = links.size() - 1; i >= 0; i--) {
            if (links.get(i).remote.equals(remote)) {
                links.get(i).broken = true;
                return;
            }
        }
    }

    public synchronized int openLinkCount() {
        int open = 0;
        for (FakeLink link : links) {
            if (link.open) {
                open++;
            }
        }
        return open;
    }

    public synchronized int tcpOpens() {
        return tcpOpens;
    }

    public synchronized int udpOpens() {
        return udpOpens;
    }

    private static void flatten(OscPacket packet, List<OscMessage> out) {
        if (packet instanceof OscMessage message) {
            out.add(message);
        }
        else if (packet instanceof OscBundle bundle) {
            for (OscPacket element : bundle.elements()) {
                flatten(element, out);
            }
        }
    }

    private final class FakeLink implements OscLink {
        private final InetSocketAddress remote;
        private boolean open = true;
        private boolean broken;

        FakeLink(InetSocketAddress remote) {
            this.remote = remote;
        }

        @Override
        public boolean write(byte[] packet) {
            synchronized (FakeOscLinkFactory.this) {
                if (!open || broken) {
                    return false;
                }
                OscPacket decoded = decoder.decode(packet)
                        .orElseThrow(() -> new AssertionError("link received an undecodable packet"));
                written.add(new Written(remote, decoded));
                return true;
            }
        }

        @Override
        public boolean isOpen() {
            synchronized (FakeOscLinkFactory.this) {
                return open && !broken;
            }
        }

        @Override
        public void close() {
            synchronized (FakeOscLinkFactory.this) {
                open = false;
            }
        }
    }
}

package com.questrail.wfs.osc.observability;

import com.questrail.wfs.osc.config.ConnectionMode;
import com.questrail.wfs.osc.config.OscProtocol;
import com.questrail.wfs.osc.model.OscArgument;
import com.questrail.wfs.osc.model.OscMessage;

import java.time.Instant;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One line of network traffic: a message sent to a target, received from a
 * peer, or rejected by the IP filter.
 *
 * <p>{@code targetIndex} is {@code -1} for inbound traffic. {@code rejectReason}
 * is empty unless the direction is {@link Direction#REJECTED}.</p>
 */
public record OscLogEntry(
    Instant timestamp,
    Direction direction,
    int targetIndex,
    String address,
    String arguments,
    OscProtocol protocol,
    String remoteAddress,
    int port,
    ConnectionMode transport,
    String rejectReason
) {
    public enum Direction {
        RX,
        TX,
        REJECTED
    }

    public OscLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(rejectReason, "rejectReason");
    }

    public static OscLogEntry transmitted(Instant timestamp, int targetIndex, OscMessage message,
                                          OscProtocol protocol, String remoteAddress, int port,
                                          ConnectionMode transport) {
        return new OscLogEntry(timestamp, Direction.TX, targetIndex, message.address(),
                renderArguments(message), protocol, remoteAddress, port, transport, "");
    }

    public static OscLogEntry received(Instant timestamp, OscMessage message, OscProtocol protocol,
                                       String remoteAddress, int port, ConnectionMode transport) {
        return new OscLogEntry(timestamp, Direction.RX, -1, message.address(),
                renderArguments(message), protocol, remoteAddress, port, transport, "");
    }

    public static OscLogEntry rejected(Instant timestamp, String address, String remoteAddress,
                                       int port, ConnectionMode transport, String reason) {
        return new OscLogEntry(timestamp, Direction.REJECTED, -1, address, "",
                OscProtocol.DISABLED, remoteAddress, port, transport, reason);
    }

    static String renderArguments(OscMessage message) {
        return message.arguments().stream()
                .map(OscArgument::render)
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(direction).append("] ");
        if (targetIndex >= 0) {
            sb.append("target ").append(targetIndex + 1).append(' ');
        }
        sb.append(address);
        if (!arguments.isEmpty()) {
            sb.append(' ').append(arguments);
        }
        sb.append(" (").append(transport).append(' ').append(remoteAddress).append(':').append(port).append(')');
        if (!rejectReason.isEmpty()) {
            sb.append(" - ").append(rejectReason);
        }
        return sb.toString();
    }
}

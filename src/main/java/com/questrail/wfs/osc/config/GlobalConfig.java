package com.questrail.wfs.osc.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Receive-side configuration shared by all targets.
 *
 * <p>Read by the receivers when listening (re)starts. An empty
 * {@code networkInterface} binds the wildcard address.</p>
 */
public record GlobalConfig(
    int udpReceivePort,
    int tcpReceivePort,
    String networkInterface,
    boolean ipFilteringEnabled,
    List<String> allowedIPs
) {
    public static final int DEFAULT_UDP_RECEIVE_PORT = 8000;
    public static final int DEFAULT_TCP_RECEIVE_PORT = 8001;

    public GlobalConfig {
        Objects.requireNonNull(networkInterface, "networkInterface");
        Objects.requireNonNull(allowedIPs, "allowedIPs");
        if (udpReceivePort < 0 || udpReceivePort > 65535) {
            throw new IllegalArgumentException("udpReceivePort out of range: " + udpReceivePort);
        }
        if (tcpReceivePort < 0 || tcpReceivePort > 65535) {
            throw new IllegalArgumentException("tcpReceivePort out of range: " + tcpReceivePort);
        }
        allowedIPs = List.copyOf(allowedIPs);
    }

    public static GlobalConfig defaults() {
        return builder().build();
    }

    public boolean receivePortsDiffer(GlobalConfig other) {
        return other == null
                || udpReceivePort != other.udpReceivePort
                || tcpReceivePort != other.tcpReceivePort
                || !networkInterface.equals(other.networkInterface);
    }

    public Builder toBuilder() {
        return new Builder()
                .withUdpReceivePort(udpReceivePort)
                .withTcpReceivePort(tcpReceivePort)
                .withNetworkInterface(networkInterface)
                .withIpFilteringEnabled(ipFilteringEnabled)
                .withAllowedIPs(allowedIPs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int udpReceivePort = DEFAULT_UDP_RECEIVE_PORT;
        private int tcpReceivePort = DEFAULT_TCP_RECEIVE_PORT;
        private String networkInterface = "";
        private boolean ipFilteringEnabled = false;
        private final List<String> allowedIPs = new ArrayList<>();

        public Builder withUdpReceivePort(int port) {
            this.udpReceivePort = port;
            return this;
        }

        public Builder withTcpReceivePort(int port) {
            this.tcpReceivePort = port;
            return this;
        }

        public Builder withNetworkInterface(String networkInterface) {
            this.networkInterface = networkInterface;
            return this;
        }

        public Builder withIpFilteringEnabled(boolean enabled) {
            this.ipFilteringEnabled = enabled;
            return this;
        }

        public Builder withAllowedIPs(List<String> ips) {
            this.allowedIPs.clear();
            this.allowedIPs.addAll(ips);
            return this;
        }

        public Builder withAllowedIP(String ip) {
            this.allowedIPs.add(Objects.requireNonNull(ip, "ip"));
            return this;
        }

        public GlobalConfig build() {
            return new GlobalConfig(udpReceivePort, tcpReceivePort, networkInterface, ipFilteringEnabled, allowedIPs);
        }
    }
}

package com.questrail.wfs.osc.config;

import java.util.Objects;

/**
 * Configuration of one target slot.
 *
 * <p>Replaced wholesale on every change; never mutated in place. The
 * {@link #isValid()} and {@link #isActive()} predicates drive connection
 * decisions.</p>
 */
public record TargetConfig(
    String name,
    String ipAddress,
    int port,
    OscProtocol protocol,
    ConnectionMode mode,
    boolean rxEnabled,
    boolean txEnabled,
    int qlabPatchNumber
) {
    public static final String DEFAULT_IP_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 9000;

    public TargetConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ipAddress, "ipAddress");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * A disabled target with default address and port.
     */
    public static TargetConfig disabled() {
        return builder().build();
    }

    /**
     * Protocol is set, the IP is non-empty and the port is in {@code 1..65535}.
     */
    public boolean isValid() {
        return protocol != OscProtocol.DISABLED
                && !ipAddress.isBlank()
                && port >= 1 && port <= 65535;
    }

    /**
     * QLab targets are always active; any other target needs rx or tx enabled.
     */
    public boolean isActive() {
        if (protocol == OscProtocol.QLAB) {
            return true;
        }
        return rxEnabled || txEnabled;
    }

    /**
     * True when outbound traffic should flow: a protocol is selected and tx is on.
     */
    public boolean shouldTransmit() {
        return protocol != OscProtocol.DISABLED && txEnabled;
    }

    /**
     * True if reaching the target requires a different socket than {@code other}.
     */
    public boolean endpointDiffers(TargetConfig other) {
        return other == null
                || !ipAddress.equals(other.ipAddress)
                || port != other.port
                || mode != other.mode;
    }

    public Builder toBuilder() {
        return new Builder()
                .withName(name)
                .withIpAddress(ipAddress)
                .withPort(port)
                .withProtocol(protocol)
                .withMode(mode)
                .withRxEnabled(rxEnabled)
                .withTxEnabled(txEnabled)
                .withQlabPatchNumber(qlabPatchNumber);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "";
        private String ipAddress = DEFAULT_IP_ADDRESS;
        private int port = DEFAULT_PORT;
        private OscProtocol protocol = OscProtocol.DISABLED;
        private ConnectionMode mode = ConnectionMode.UDP;
        private boolean rxEnabled = true;
        private boolean txEnabled = true;
        private int qlabPatchNumber = 1;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withIpAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withProtocol(OscProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder withMode(ConnectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder withRxEnabled(boolean rxEnabled) {
            this.rxEnabled = rxEnabled;
            return this;
        }

        public Builder withTxEnabled(boolean txEnabled) {
            this.txEnabled = txEnabled;
            return this;
        }

        public Builder withQlabPatchNumber(int qlabPatchNumber) {
            this.qlabPatchNumber = qlabPatchNumber;
            return this;
        }

        public TargetConfig build() {
            return new TargetConfig(name, ipAddress, port, protocol, mode, rxEnabled, txEnabled, qlabPatchNumber);
        }
    }
}

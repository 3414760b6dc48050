package com.questrail.mdoc.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Configuration of one mdoc BLE transport connection.
 *
 * @param serviceUuid     UUID of the reader's mdoc GATT service
 * @param characteristics characteristic UUIDs within that service
 * @param requestedMtu    MTU asked for during negotiation
 * @param mtuTimeout      how long to wait for the MTU callback before assuming the default
 * @param shutdownLinger  grace period between draining the queue and tearing the link down
 * @param l2capEnabled    whether the socket path may be used when the peer offers it
 * @param expectedIdent   expected BLE ident value, or {@code null} to skip the ident exchange
 */
public record MdocTransportConfig(
    UUID serviceUuid,
    MdocServiceUuids characteristics,
    int requestedMtu,
    Duration mtuTimeout,
    Duration shutdownLinger,
    boolean l2capEnabled,
    byte[] expectedIdent
) {
    public static final int DEFAULT_REQUESTED_MTU = 515;
    public static final Duration DEFAULT_MTU_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_LINGER = Duration.ofMillis(1000);

    public MdocTransportConfig {
        Objects.requireNonNull(serviceUuid, "serviceUuid");
        Objects.requireNonNull(characteristics, "characteristics");
        Objects.requireNonNull(mtuTimeout, "mtuTimeout");
        Objects.requireNonNull(shutdownLinger, "shutdownLinger");
        if (requestedMtu < 23) {
            throw new IllegalArgumentException("requestedMtu must be >= 23");
        }
        if (mtuTimeout.isNegative() || shutdownLinger.isNegative()) {
            throw new IllegalArgumentException("durations must be >= 0");
        }
        expectedIdent = expectedIdent == null ? null : expectedIdent.clone();
    }

    @Override
    public byte[] expectedIdent() {
        return expectedIdent == null ? null : expectedIdent.clone();
    }

    public Optional<byte[]> expectedIdentValue() {
        return Optional.ofNullable(expectedIdent());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MdocTransportConfig other)) {
            return false;
        }
        return requestedMtu == other.requestedMtu
                && l2capEnabled == other.l2capEnabled
                && serviceUuid.equals(other.serviceUuid)
                && characteristics.equals(other.characteristics)
                && mtuTimeout.equals(other.mtuTimeout)
                && shutdownLinger.equals(other.shutdownLinger)
                && Arrays.equals(expectedIdent, other.expectedIdent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceUuid, characteristics, requestedMtu, mtuTimeout,
                shutdownLinger, l2capEnabled, Arrays.hashCode(expectedIdent));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID serviceUuid;
        private MdocServiceUuids characteristics = MdocServiceUuids.centralClientMode();
        private int requestedMtu = DEFAULT_REQUESTED_MTU;
        private Duration mtuTimeout = DEFAULT_MTU_TIMEOUT;
        private Duration shutdownLinger = DEFAULT_SHUTDOWN_LINGER;
        private boolean l2capEnabled = true;
        private byte[] expectedIdent;

        private Builder() {}

        public Builder withServiceUuid(UUID serviceUuid) {
            this.serviceUuid = serviceUuid;
            return this;
        }

        public Builder withCharacteristics(MdocServiceUuids characteristics) {
            this.characteristics = characteristics;
            return this;
        }

        public Builder withRequestedMtu(int requestedMtu) {
            this.requestedMtu = requestedMtu;
            return this;
        }

        public Builder withMtuTimeout(Duration mtuTimeout) {
            this.mtuTimeout = mtuTimeout;
            return this;
        }

        public Builder withShutdownLinger(Duration shutdownLinger) {
            this.shutdownLinger = shutdownLinger;
            return this;
        }

        public Builder withL2capEnabled(boolean enabled) {
            this.l2capEnabled = enabled;
            return this;
        }

        public Builder withExpectedIdent(byte[] expectedIdent) {
            this.expectedIdent = expectedIdent;
            return this;
        }

        public MdocTransportConfig build() {
            return new MdocTransportConfig(serviceUuid, characteristics, requestedMtu,
                    mtuTimeout, shutdownLinger, l2capEnabled, expectedIdent);
        }
    }
}

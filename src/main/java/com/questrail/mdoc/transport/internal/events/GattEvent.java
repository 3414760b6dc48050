package com.questrail.mdoc.transport.internal.events;

import com.questrail.mdoc.transport.gatt.GattServiceInfo;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * GattEvent
 * -----------------------------------------------------------------------------
 * Completions and notifications reported by the GATT client port.
 *
 * <p>One event type per {@link com.questrail.mdoc.transport.gatt.GattClientPortListener}
 * callback. Value arrays are copied on the way in.</p>
 */
public sealed interface GattEvent extends LinkEvent
        permits GattEvent.Connected,
                GattEvent.Disconnected,
                GattEvent.ServicesDiscovered,
                GattEvent.MtuChanged,
                GattEvent.CharacteristicRead,
                GattEvent.CharacteristicWritten,
                GattEvent.DescriptorWritten,
                GattEvent.CharacteristicChanged
{
    /** GATT connection established. */
    final class Connected extends LinkEvent.Base implements GattEvent {
        public Connected(Instant timestamp) {
            super(timestamp);
        }
    }

    /** GATT connection lost or refused. */
    final class Disconnected extends LinkEvent.Base implements GattEvent {
        private final Throwable cause;

        public Disconnected(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        /** Platform diagnostic, or {@code null}. */
        public Throwable cause() {
            return cause;
        }
    }

    final class ServicesDiscovered extends LinkEvent.Base implements GattEvent {
        private final boolean success;
        private final List<GattServiceInfo> services;

        public ServicesDiscovered(Instant timestamp, boolean success, List<GattServiceInfo> services) {
            super(timestamp);
            this.success = success;
            this.services = services == null ? List.of() : List.copyOf(services);
        }

        public boolean success() {
            return success;
        }

        public List<GattServiceInfo> services() {
            return services;
        }
    }

    final class MtuChanged extends LinkEvent.Base implements GattEvent {
        private final int mtu;
        private final boolean success;

        public MtuChanged(Instant timestamp, int mtu, boolean success) {
            super(timestamp);
            this.mtu = mtu;
            this.success = success;
        }

        public int mtu() {
            return mtu;
        }

        public boolean success() {
            return success;
        }

        @Override
        public String toString() {
            return "MtuChanged[mtu=" + mtu + ", success=" + success + "]";
        }
    }

    final class CharacteristicRead extends LinkEvent.Base implements GattEvent {
        private final UUID characteristic;
        private final byte[] value;
        private final boolean success;

        public CharacteristicRead(Instant timestamp, UUID characteristic, byte[] value, boolean success) {
            super(timestamp);
            this.characteristic = Objects.requireNonNull(characteristic, "characteristic");
            this.value = value == null ? new byte[0] : value.clone();
            this.success = success;
        }

        public UUID characteristic() {
            return characteristic;
        }

        public byte[] value() {
            return value.clone();
        }

        public boolean success() {
            return success;
        }
    }

    final class CharacteristicWritten extends LinkEvent.Base implements GattEvent {
        private final UUID characteristic;
        private final boolean success;

        public CharacteristicWritten(Instant timestamp, UUID characteristic, boolean success) {
            super(timestamp);
            this.characteristic = Objects.requireNonNull(characteristic, "characteristic");
            this.success = success;
        }

        public UUID characteristic() {
            return characteristic;
        }

        public boolean success() {
            return success;
        }
    }

    final class DescriptorWritten extends LinkEvent.Base implements GattEvent {
        private final UUID characteristic;
        private final UUID descriptor;
        private final boolean success;

        public DescriptorWritten(Instant timestamp, UUID characteristic, UUID descriptor, boolean success) {
            super(timestamp);
            this.characteristic = Objects.requireNonNull(characteristic, "characteristic");
            this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
            this.success = success;
        }

        public UUID characteristic() {
            return characteristic;
        }

        public UUID descriptor() {
            return descriptor;
        }

        public boolean success() {
            return success;
        }
    }

    /** Notification from the peer. */
    final class CharacteristicChanged extends LinkEvent.Base implements GattEvent {
        private final UUID characteristic;
        private final byte[] value;

        public CharacteristicChanged(Instant timestamp, UUID characteristic, byte[] value) {
            super(timestamp);
            this.characteristic = Objects.requireNonNull(characteristic, "characteristic");
            this.value = Objects.requireNonNull(value, "value").clone();
        }

        public UUID characteristic() {
            return characteristic;
        }

        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }
    }
}

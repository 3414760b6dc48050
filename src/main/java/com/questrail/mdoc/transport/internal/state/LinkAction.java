package com.questrail.mdoc.transport.internal.state;

import com.questrail.mdoc.api.TransportError;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * LinkAction
 * -----------------------------------------------------------------------------
 * One side effect requested by the {@link LinkReducer}.
 *
 * <p>Platform actions drive the GATT client, the socket connector and the
 * timers. Notification actions reach the application listener and are never
 * emitted while the link is inhibited. Warnings go to the observability sink
 * only.</p>
 */
public sealed interface LinkAction
{
    // ---------------------------------------------------------------------
    // Platform
    // ---------------------------------------------------------------------

    record ConnectGatt(String deviceId) implements LinkAction {
        public ConnectGatt {
            Objects.requireNonNull(deviceId, "deviceId");
        }
    }

    /** Platform quirk hook run before service discovery. */
    record RefreshGattCache(String deviceId) implements LinkAction {}

    record DiscoverServices() implements LinkAction {}

    record RequestMtu(int mtu) implements LinkAction {}

    record ScheduleMtuTimeout(Duration timeout) implements LinkAction {}

    /** Cancels every pending link timer. */
    record CancelTimers() implements LinkAction {}

    record ReadCharacteristic(UUID characteristic) implements LinkAction {}

    record EnableNotifications(UUID characteristic) implements LinkAction {}

    record WriteCharacteristic(UUID characteristic, byte[] value) implements LinkAction {
        public WriteCharacteristic {
            Objects.requireNonNull(characteristic, "characteristic");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public String toString() {
            return "WriteCharacteristic[" + characteristic + ", " + value.length + " bytes]";
        }
    }

    record OpenL2cap(String deviceId, int psm) implements LinkAction {}

    record SendL2cap(byte[] message) implements LinkAction {
        public SendL2cap {
            message = message.clone();
        }

        @Override
        public byte[] message() {
            return message.clone();
        }

        @Override
        public String toString() {
            return "SendL2cap[" + message.length + " bytes]";
        }
    }

    record CloseL2cap() implements LinkAction {}

    record ScheduleLinger(Duration linger) implements LinkAction {}

    record CloseGatt() implements LinkAction {}

    // ---------------------------------------------------------------------
    // Listener notifications
    // ---------------------------------------------------------------------

    record NotifyPeerConnected() implements LinkAction {}

    record NotifyMessageReceived(byte[] message) implements LinkAction {
        public NotifyMessageReceived {
            message = message.clone();
        }

        @Override
        public byte[] message() {
            return message.clone();
        }

        @Override
        public String toString() {
            return "NotifyMessageReceived[" + message.length + " bytes]";
        }
    }

    record NotifyPeerDisconnected() implements LinkAction {}

    record NotifyTransportSpecificTermination() implements LinkAction {}

    record NotifyError(TransportError error) implements LinkAction {
        public NotifyError {
            Objects.requireNonNull(error, "error");
        }
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    record ReportWarning(String message) implements LinkAction {
        public ReportWarning {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * {@code true} for actions that call the application listener.
     */
    default boolean isNotification() {
        return this instanceof NotifyPeerConnected
                || this instanceof NotifyMessageReceived
                || this instanceof NotifyPeerDisconnected
                || this instanceof NotifyTransportSpecificTermination
                || this instanceof NotifyError;
    }
}

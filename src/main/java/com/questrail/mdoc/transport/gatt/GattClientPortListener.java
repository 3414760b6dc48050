package com.questrail.mdoc.transport.gatt;

import java.util.List;
import java.util.UUID;

/**
 * Callback sink for {@link GattClientPort}.
 */
public interface GattClientPortListener
{
    void onConnected();

    /**
     * The link is gone.
     *
     * @param cause platform diagnostic; {@code null} for an orderly disconnect
     */
    void onDisconnected(Throwable cause);

    void onServicesDiscovered(boolean success, List<GattServiceInfo> services);

    /**
     * @param mtu     negotiated ATT MTU; meaningless if {@code success} is false
     * @param success whether negotiation succeeded
     */
    void onMtuChanged(int mtu, boolean success);

    void onCharacteristicRead(UUID characteristic, byte[] value, boolean success);

    void onCharacteristicWritten(UUID characteristic, boolean success);

    void onDescriptorWritten(UUID characteristic, UUID descriptor, boolean success);

    /** Notification received. {@code value} is a copy owned by the listener. */
    void onCharacteristicChanged(UUID characteristic, byte[] value);
}

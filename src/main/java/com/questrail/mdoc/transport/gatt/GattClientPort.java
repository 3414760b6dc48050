package com.questrail.mdoc.transport.gatt;

import java.util.UUID;

/**
 * GattClientPort
 * -----------------------------------------------------------------------------
 * Port to the platform's GATT client for one remote device.
 *
 * <p>Every operation is asynchronous and completes through exactly one
 * {@link GattClientPortListener} callback. The state machine never issues
 * a second operation before the previous one completed, matching the
 * one-outstanding-operation rule of most BLE stacks.</p>
 *
 * <p>Implementations must deliver callbacks serially.</p>
 */
public interface GattClientPort
{
    /**
     * Registers the callback sink. Must be called before {@link #connect(String)}.
     */
    void setListener(GattClientPortListener listener);

    void connect(String deviceId);

    void discoverServices();

    void requestMtu(int mtu);

    void readCharacteristic(UUID service, UUID characteristic);

    /**
     * Enables notifications locally and writes the CCCD of the characteristic.
     * Completes with {@link GattClientPortListener#onDescriptorWritten}.
     */
    void enableNotifications(UUID service, UUID characteristic);

    void writeCharacteristic(UUID service, UUID characteristic, byte[] value);

    /**
     * Disconnects and releases the GATT client. No callbacks follow.
     */
    void close();
}

package com.questrail.mdoc.scan;

import java.util.UUID;

/**
 * Port to the platform's BLE scanner.
 */
public interface BleScannerPort
{
    /**
     * Starts scanning for advertisements carrying {@code serviceUuid}.
     * Platforms that cannot filter deliver everything; filtering is repeated
     * on this side.
     */
    void startScan(UUID serviceUuid, BleScanCallback callback);

    void stopScan();
}

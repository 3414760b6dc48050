package com.questrail.mdoc.scan;

import java.util.List;
import java.util.UUID;

/**
 * Callback sink for {@link BleScannerPort}. May be called from any thread.
 */
public interface BleScanCallback
{
    /**
     * @param deviceId     platform handle of the advertiser
     * @param rssi         received signal strength in dBm
     * @param serviceUuids service UUIDs listed in the advertisement
     */
    void onAdvertisement(String deviceId, int rssi, List<UUID> serviceUuids);

    /**
     * The platform reported a scan failure. Scanning may or may not continue.
     */
    void onScanFailed(Throwable cause);
}

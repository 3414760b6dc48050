package com.questrail.mdoc.api;

import java.util.Objects;
import java.util.UUID;

/**
 * A device seen advertising the expected mdoc service during a scan window.
 *
 * @param deviceId    platform handle used to connect (BLE address, host name)
 * @param rssi        received signal strength in dBm, larger is stronger
 * @param serviceUuid advertised service UUID that matched the filter
 * @param sequence    order in which this sighting was observed within its scan window
 */
public record PeerCandidate(String deviceId, int rssi, UUID serviceUuid, long sequence)
{
    public PeerCandidate {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(serviceUuid, "serviceUuid");
    }
}

package com.questrail.mdoc.transport.gatt;

/**
 * Hook for platforms whose GATT attribute cache goes stale between
 * sessions. Called right before service discovery.
 */
public interface GattCacheControl
{
    GattCacheControl NONE = deviceId -> { };

    void refresh(String deviceId);
}

package com.questrail.mdoc.transport.gatt;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A discovered GATT service and the UUIDs of its characteristics.
 */
public record GattServiceInfo(UUID serviceUuid, Set<UUID> characteristics)
{
    public GattServiceInfo {
        Objects.requireNonNull(serviceUuid, "serviceUuid");
        characteristics = Set.copyOf(Objects.requireNonNull(characteristics, "characteristics"));
    }

    public boolean has(UUID characteristic) {
        return characteristic != null && characteristics.contains(characteristic);
    }
}

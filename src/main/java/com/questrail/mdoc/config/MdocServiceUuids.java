package com.questrail.mdoc.config;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Characteristic UUIDs of the mdoc GATT service.
 *
 * <p>The two standard sets differ only in the leading 32 bits. Ident and
 * L2CAP are optional; a {@code null} value means the characteristic is not
 * looked for.</p>
 *
 * @param state         handshake and termination signalling
 * @param client2Server chunks written by the GATT client
 * @param server2Client chunks notified by the GATT server
 * @param ident         BLE ident value, or {@code null}
 * @param l2cap         L2CAP PSM value, or {@code null}
 */
public record MdocServiceUuids(UUID state,
                               UUID client2Server,
                               UUID server2Client,
                               UUID ident,
                               UUID l2cap)
{
    /** Client Characteristic Configuration Descriptor. */
    public static final UUID CCCD = UUID.fromString("00002902-0000-1000-8000-00805f9b34fb");

    private static final String SUFFIX = "-a123-48ce-896b-4c76973373e6";

    public MdocServiceUuids {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(client2Server, "client2Server");
        Objects.requireNonNull(server2Client, "server2Client");
    }

    /**
     * UUIDs used when the reader runs the GATT server (mdoc central client mode).
     */
    public static MdocServiceUuids centralClientMode() {
        return new MdocServiceUuids(
                uuid("00000005"),
                uuid("00000006"),
                uuid("00000007"),
                uuid("00000008"),
                uuid("0000000b"));
    }

    /**
     * UUIDs used when the mdoc runs the GATT server (mdoc peripheral server mode).
     * This mode defines no Ident characteristic.
     */
    public static MdocServiceUuids peripheralServerMode() {
        return new MdocServiceUuids(
                uuid("00000001"),
                uuid("00000002"),
                uuid("00000003"),
                null,
                uuid("0000000a"));
    }

    public Optional<UUID> identUuid() {
        return Optional.ofNullable(ident);
    }

    public Optional<UUID> l2capUuid() {
        return Optional.ofNullable(l2cap);
    }

    public MdocServiceUuids withoutIdent() {
        return new MdocServiceUuids(state, client2Server, server2Client, null, l2cap);
    }

    public MdocServiceUuids withoutL2cap() {
        return new MdocServiceUuids(state, client2Server, server2Client, ident, null);
    }

    private static UUID uuid(String prefix) {
        return UUID.fromString(prefix + SUFFIX);
    }
}

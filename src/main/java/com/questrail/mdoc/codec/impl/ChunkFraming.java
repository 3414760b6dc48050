package com.questrail.mdoc.codec.impl;

/**
 * ChunkFraming
 * =============================================================================
 * Wire constants of the chunk protocol and the attribute size arithmetic
 * derived from a negotiated ATT MTU.
 */
public final class ChunkFraming
{
    private ChunkFraming() {}

    /** Marker of a chunk that is followed by more chunks of the same message. */
    public static final byte MORE_FOLLOWS = 0x01;

    /** Marker of the last (or only) chunk of a message. */
    public static final byte LAST_CHUNK = 0x00;

    /** ATT MTU assumed when negotiation fails or never completes. */
    public static final int DEFAULT_MTU = 23;

    /** ATT header bytes carried by every write or notification. */
    public static final int ATT_OVERHEAD = 3;

    /** Largest attribute value the Bluetooth core specification allows. */
    public static final int MAX_ATTRIBUTE_SIZE = 512;

    /**
     * Characteristic value size usable with {@code mtu}: the MTU minus the ATT
     * header, capped at {@link #MAX_ATTRIBUTE_SIZE}.
     */
    public static int attributeSizeForMtu(int mtu) {
        if (mtu < DEFAULT_MTU) {
            throw new IllegalArgumentException("MTU below protocol minimum: " + mtu);
        }
        if (mtu > MAX_ATTRIBUTE_SIZE + ATT_OVERHEAD) {
            return MAX_ATTRIBUTE_SIZE;
        }
        return mtu - ATT_OVERHEAD;
    }

    /**
     * Payload bytes per chunk for a given attribute size (one byte goes to the marker).
     */
    public static int payloadSizeForAttribute(int attributeSize) {
        return attributeSize - 1;
    }
}

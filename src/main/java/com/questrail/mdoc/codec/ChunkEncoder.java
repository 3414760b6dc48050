package com.questrail.mdoc.codec;

import java.util.List;

/**
 * Splits a message into marker-prefixed chunks.
 */
public interface ChunkEncoder
{
    /**
     * Encodes {@code message} into chunks carrying at most
     * {@code maxPayloadSize} payload bytes each.
     *
     * @param message        message bytes; zero length encodes the shutdown sentinel
     * @param maxPayloadSize payload bytes per chunk, excluding the marker; must be &gt;= 1
     * @return chunks in transmission order, never empty
     */
    List<byte[]> encode(byte[] message, int maxPayloadSize);
}

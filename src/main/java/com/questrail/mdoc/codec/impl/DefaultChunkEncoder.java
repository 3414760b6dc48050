package com.questrail.mdoc.codec.impl;

import com.questrail.mdoc.codec.ChunkEncoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link ChunkEncoder}.
 */
public final class DefaultChunkEncoder implements ChunkEncoder
{
    @Override
    public List<byte[]> encode(byte[] message, int maxPayloadSize) {
        Objects.requireNonNull(message, "message");
        if (maxPayloadSize < 1) {
            throw new IllegalArgumentException("maxPayloadSize must be >= 1, got " + maxPayloadSize);
        }

        if (message.length == 0) {
            return Collections.singletonList(new byte[] { ChunkFraming.LAST_CHUNK });
        }

        int count = (message.length + maxPayloadSize - 1) / maxPayloadSize;
        List<byte[]> chunks = new ArrayList<>(count);

        for (int offset = 0; offset < message.length; offset += maxPayloadSize) {
            int length = Math.min(maxPayloadSize, message.length - offset);
            boolean last = offset + length == message.length;

            byte[] chunk = new byte[length + 1];
            chunk[0] = last ? ChunkFraming.LAST_CHUNK : ChunkFraming.MORE_FOLLOWS;
            System.arraycopy(message, offset, chunk, 1, length);
            chunks.add(chunk);
        }

        return Collections.unmodifiableList(chunks);
    }
}

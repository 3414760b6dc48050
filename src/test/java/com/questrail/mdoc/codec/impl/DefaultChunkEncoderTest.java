package com.questrail.mdoc.codec.impl;

import com.questrail.mdoc.codec.ChunkEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultChunkEncoderTest
 * -----------------------------------------------------------------------------
 * Marker placement and payload splitting of the chunk encoder.
 */
class DefaultChunkEncoderTest {

    private ChunkEncoder encoder;

    @BeforeEach
    void setUp() {
        encoder = new DefaultChunkEncoder();
    }

    @Test
    void messageThatFitsIsOneLastChunk() {
        List<byte[]> chunks = encoder.encode(new byte[] { 1, 2, 3 }, 19);

        assertEquals(1, chunks.size());
        assertArrayEquals(new byte[] { 0x00, 1, 2, 3 }, chunks.get(0));
    }

    @Test
    void helloMdocAtAttributeSizeTwentySplitsInTwo() {
        byte[] message = "hello-mdoc".getBytes(StandardCharsets.US_ASCII);

        List<byte[]> chunks = encoder.encode(message, 5);

        assertEquals(2, chunks.size());
        assertArrayEquals(new byte[] { 0x01, 'h', 'e', 'l', 'l', 'o' }, chunks.get(0));
        assertArrayEquals(new byte[] { 0x00, '-', 'm', 'd', 'o', 'c' }, chunks.get(1));
    }

    @Test
    void exactMultipleDoesNotProduceTrailingEmptyChunk() {
        List<byte[]> chunks = encoder.encode(new byte[38], 19);

        assertEquals(2, chunks.size());
        assertEquals(20, chunks.get(0).length);
        assertEquals(20, chunks.get(1).length);
        assertEquals(ChunkFraming.MORE_FOLLOWS, chunks.get(0)[0]);
        assertEquals(ChunkFraming.LAST_CHUNK, chunks.get(1)[0]);
    }

    @Test
    void onlyTheLastChunkMayBeShort() {
        List<byte[]> chunks = encoder.encode(new byte[45], 19);

        assertEquals(3, chunks.size());
        assertEquals(20, chunks.get(0).length);
        assertEquals(20, chunks.get(1).length);
        assertEquals(8, chunks.get(2).length);
    }

    @Test
    void emptyMessageIsShutdownSentinel() {
        List<byte[]> chunks = encoder.encode(new byte[0], 19);

        assertEquals(1, chunks.size());
        assertArrayEquals(new byte[] { 0x00 }, chunks.get(0));
    }

    @Test
    void payloadSizeBelowOneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(new byte[] { 1 }, 0));
    }

    @Test
    void resultIsUnmodifiable() {
        List<byte[]> chunks = encoder.encode(new byte[] { 1 }, 19);
        assertThrows(UnsupportedOperationException.class, () -> chunks.add(new byte[0]));
    }
}

package com.questrail.mdoc.codec.impl;

import com.questrail.mdoc.codec.ChunkDecodeResult;
import com.questrail.mdoc.codec.ChunkDecoder;
import com.questrail.mdoc.codec.ChunkReassembly;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultChunkDecoderTest
 * -----------------------------------------------------------------------------
 * Marker validation, sentinel recognition and reassembly of the stateless
 * chunk decoder.
 */
class DefaultChunkDecoderTest {

    private ChunkDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new DefaultChunkDecoder();
    }

    @Test
    void singleLastChunkCompletesMessage() {
        ChunkDecodeResult result = decoder.decode(ChunkReassembly.empty(), new byte[] { 0x00, 7, 8 });

        ChunkDecodeResult.Complete complete = assertInstanceOf(ChunkDecodeResult.Complete.class, result);
        assertArrayEquals(new byte[] { 7, 8 }, complete.message());
    }

    @Test
    void moreFollowsAccumulates() {
        ChunkDecodeResult first = decoder.decode(ChunkReassembly.empty(), new byte[] { 0x01, 1, 2 });
        ChunkReassembly pending = assertInstanceOf(ChunkDecodeResult.Partial.class, first).pending();
        assertEquals(2, pending.size());

        ChunkDecodeResult second = decoder.decode(pending, new byte[] { 0x01, 3 });
        pending = assertInstanceOf(ChunkDecodeResult.Partial.class, second).pending();
        assertEquals(2, pending.fragmentCount());

        ChunkDecodeResult last = decoder.decode(pending, new byte[] { 0x00, 4, 5 });
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5 },
                assertInstanceOf(ChunkDecodeResult.Complete.class, last).message());
    }

    static Stream<Arguments> payloadSizesAndLengths() {
        return IntStream.of(1, 2, 19, 511).boxed().flatMap(size ->
                IntStream.of(1, size, size + 1, 3 * size).distinct()
                        .mapToObj(length -> Arguments.of(size, length)));
    }

    @ParameterizedTest(name = "payload {0}, message {1}")
    @MethodSource("payloadSizesAndLengths")
    void decodesWhatTheEncoderProduced(int payloadSize, int length) {
        byte[] message = new byte[length];
        for (int i = 0; i < message.length; i++) {
            message[i] = (byte) (i * 31 + 7);
        }
        List<byte[]> chunks = new DefaultChunkEncoder().encode(message, payloadSize);
        assertEquals((length + payloadSize - 1) / payloadSize, chunks.size());

        ChunkReassembly pending = ChunkReassembly.empty();
        ChunkDecodeResult result = null;
        for (byte[] chunk : chunks) {
            assertTrue(chunk.length <= payloadSize + 1);
            result = decoder.decode(pending, chunk);
            if (result instanceof ChunkDecodeResult.Partial partial) {
                pending = partial.pending();
            }
        }

        assertArrayEquals(message, assertInstanceOf(ChunkDecodeResult.Complete.class, result).message());
    }

    @Test
    void loneZeroWithNothingPendingIsShutdown() {
        ChunkDecodeResult result = decoder.decode(ChunkReassembly.empty(), new byte[] { 0x00 });
        assertInstanceOf(ChunkDecodeResult.Shutdown.class, result);
    }

    @Test
    void loneZeroAfterPartialTerminatesMessage() {
        ChunkReassembly pending = ChunkReassembly.empty().append(new byte[] { 9, 9 }, 0, 2);

        ChunkDecodeResult result = decoder.decode(pending, new byte[] { 0x00 });

        assertArrayEquals(new byte[] { 9, 9 },
                assertInstanceOf(ChunkDecodeResult.Complete.class, result).message());
    }

    @Test
    void emptyChunkIsInvalid() {
        ChunkDecodeResult result = decoder.decode(ChunkReassembly.empty(), new byte[0]);
        assertInstanceOf(ChunkDecodeResult.Invalid.class, result);
    }

    @Test
    void unknownMarkerIsInvalid() {
        ChunkDecodeResult result = decoder.decode(ChunkReassembly.empty(), new byte[] { 0x02, 1 });

        ChunkDecodeResult.Invalid invalid = assertInstanceOf(ChunkDecodeResult.Invalid.class, result);
        assertTrue(invalid.reason().contains("0x02"));
    }

    @Test
    void pendingInputIsNotMutated() {
        ChunkReassembly pending = ChunkReassembly.empty().append(new byte[] { 1 }, 0, 1);

        decoder.decode(pending, new byte[] { 0x01, 2 });

        assertEquals(1, pending.size());
        assertArrayEquals(new byte[] { 1 }, pending.join());
    }
}

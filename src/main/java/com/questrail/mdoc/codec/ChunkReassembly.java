package com.questrail.mdoc.codec;

/**
 * Immutable accumulation of chunk payloads awaiting the final chunk.
 *
 * <p>Appending is constant time: fragments are kept as a persistent
 * linked list and only joined once the message is complete.</p>
 */
public final class ChunkReassembly
{
    private static final ChunkReassembly EMPTY = new ChunkReassembly(null, 0, 0);

    private final Fragment last;
    private final int size;
    private final int fragmentCount;

    private ChunkReassembly(Fragment last, int size, int fragmentCount) {
        this.last = last;
        this.size = size;
        this.fragmentCount = fragmentCount;
    }

    public static ChunkReassembly empty() {
        return EMPTY;
    }

    /**
     * Returns a new reassembly with {@code length} bytes of {@code source}
     * starting at {@code offset} appended. The bytes are copied.
     */
    public ChunkReassembly append(byte[] source, int offset, int length) {
        byte[] copy = new byte[length];
        System.arraycopy(source, offset, copy, 0, length);
        return new ChunkReassembly(new Fragment(copy, last), size + length, fragmentCount + 1);
    }

    /** Number of payload bytes accumulated so far. */
    public int size() {
        return size;
    }

    /** Number of chunks accumulated so far. */
    public int fragmentCount() {
        return fragmentCount;
    }

    public boolean isEmpty() {
        return fragmentCount == 0;
    }

    /**
     * Joins all accumulated payloads in arrival order.
     */
    public byte[] join() {
        byte[] out = new byte[size];
        int end = size;
        for (Fragment f = last; f != null; f = f.previous) {
            end -= f.payload.length;
            System.arraycopy(f.payload, 0, out, end, f.payload.length);
        }
        return out;
    }

    private record Fragment(byte[] payload, Fragment previous) {}
}

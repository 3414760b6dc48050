package com.questrail.mdoc.transport.l2cap;

import java.util.OptionalInt;

/**
 * Decoding of the L2CAP PSM characteristic value: one to four bytes,
 * unsigned big-endian.
 */
public final class L2capPsm
{
    private L2capPsm() {}

    /**
     * @return the PSM, or empty if {@code value} is not 1 to 4 bytes long or decodes to zero
     */
    public static OptionalInt decode(byte[] value) {
        if (value == null || value.length < 1 || value.length > 4) {
            return OptionalInt.empty();
        }
        long psm = 0;
        for (byte b : value) {
            psm = (psm << 8) | (b & 0xff);
        }
        if (psm == 0 || psm > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) psm);
    }
}

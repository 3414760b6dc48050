package com.questrail.mdoc.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * HKDF-HMAC-SHA256 (RFC 5869) via BouncyCastle.
 */
public final class Hkdf
{
    private Hkdf() {}

    /**
     * Extract-then-expand.
     *
     * @param ikm    input keying material
     * @param salt   salt; empty or {@code null} means HashLen zero bytes
     * @param info   context string
     * @param length output length in bytes
     */
    public static byte[] sha256(byte[] ikm, byte[] salt, byte[] info, int length) {
        Objects.requireNonNull(ikm, "ikm");
        Objects.requireNonNull(info, "info");
        if (length <= 0 || length > 255 * 32) {
            throw new IllegalArgumentException("Invalid HKDF output length: " + length);
        }

        byte[] actualSalt = (salt == null || salt.length == 0) ? null : salt;

        HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
        generator.init(new HKDFParameters(ikm, actualSalt, info));

        byte[] out = new byte[length];
        generator.generateBytes(out, 0, length);
        return out;
    }

    public static byte[] sha256(byte[] ikm, byte[] salt, String info, int length) {
        return sha256(ikm, salt, info.getBytes(StandardCharsets.UTF_8), length);
    }
}

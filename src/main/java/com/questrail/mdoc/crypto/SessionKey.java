package com.questrail.mdoc.crypto;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * SessionKey
 * -----------------------------------------------------------------------------
 * One direction of a session: an AES-256 key plus its message counter.
 *
 * <p>The 12-byte AES-GCM nonce is</p>
 * <pre>
 *   00 00 00 00 | direction (4 bytes, BE) | counter (4 bytes, BE)
 * </pre>
 * <p>with direction {@code 1} for device to reader and {@code 0} for reader to
 * device. The counter starts at 1 and moves forward after every successful
 * operation. It is never reset and never wraps: once it would exceed
 * {@code 0xFFFFFFFF} the key refuses further use.</p>
 *
 * <p>Not thread-safe. A key belongs to exactly one session.</p>
 */
public final class SessionKey
{
    public static final int DIRECTION_DEVICE_TO_READER = 0x00000001;
    public static final int DIRECTION_READER_TO_DEVICE = 0x00000000;

    static final long MAX_COUNTER = 0xFFFFFFFFL;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final int direction;
    private long counter;

    SessionKey(byte[] keyBytes, int direction) {
        this(keyBytes, direction, 1);
    }

    SessionKey(byte[] keyBytes, int direction, long initialCounter) {
        Objects.requireNonNull(keyBytes, "keyBytes");
        if (keyBytes.length != 32) {
            throw new IllegalArgumentException("AES-256 key must be 32 bytes");
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
        this.direction = direction;
        this.counter = initialCounter;
    }

    /** Counter value the next operation will use. */
    public long counter() {
        return counter;
    }

    /** Number of completed operations. */
    public long operations() {
        return counter - 1;
    }

    /** Nonce the next operation will use. */
    public byte[] nonce() {
        requireCounterAvailable();
        ByteBuffer nonce = ByteBuffer.allocate(12);
        nonce.putInt(0);
        nonce.putInt(direction);
        nonce.putInt((int) counter);
        return nonce.array();
    }

    /**
     * Encrypts and advances the counter.
     *
     * @return ciphertext followed by the 16-byte tag
     */
    public byte[] seal(byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        byte[] out;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce()));
            out = cipher.doFinal(plaintext);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
        counter++;
        return out;
    }

    /**
     * Decrypts and verifies; the counter only advances on success.
     *
     * @throws SessionCryptoException of kind {@code DECRYPTION_FAILED} if the tag does not verify
     */
    public byte[] open(byte[] ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        byte[] nonce = nonce();

        Cipher cipher;
        try {
            cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption unavailable", e);
        }

        byte[] plaintext;
        try {
            plaintext = cipher.doFinal(ciphertext);
        }
        catch (GeneralSecurityException e) {
            throw new SessionCryptoException(SessionCryptoException.Kind.DECRYPTION_FAILED,
                    "Message authentication failed at counter " + counter, e);
        }
        counter++;
        return plaintext;
    }

    private void requireCounterAvailable() {
        if (counter > MAX_COUNTER) {
            throw new SessionCryptoException(SessionCryptoException.Kind.SESSION_EXHAUSTED,
                    "Message counter exhausted for direction " + direction);
        }
    }
}

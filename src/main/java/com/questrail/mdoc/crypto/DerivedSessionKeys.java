package com.questrail.mdoc.crypto;

import com.questrail.mdoc.cbor.SessionTranscript;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Raw SKDevice and SKReader bytes of a session.
 *
 * <pre>
 *   salt     = SHA-256(#6.24(bstr .cbor SessionTranscript))
 *   SKDevice = HKDF-SHA256(sharedSecret, salt, "SKDevice", 32)
 *   SKReader = HKDF-SHA256(sharedSecret, salt, "SKReader", 32)
 * </pre>
 */
public record DerivedSessionKeys(byte[] skDevice, byte[] skReader)
{
    public static final String INFO_SK_DEVICE = "SKDevice";
    public static final String INFO_SK_READER = "SKReader";
    public static final int KEY_LENGTH = 32;

    public DerivedSessionKeys {
        Objects.requireNonNull(skDevice, "skDevice");
        Objects.requireNonNull(skReader, "skReader");
    }

    public static DerivedSessionKeys derive(byte[] sharedSecret, SessionTranscript transcript) {
        Objects.requireNonNull(sharedSecret, "sharedSecret");
        Objects.requireNonNull(transcript, "transcript");

        byte[] salt = transcriptSalt(transcript);
        return new DerivedSessionKeys(
                Hkdf.sha256(sharedSecret, salt, INFO_SK_DEVICE, KEY_LENGTH),
                Hkdf.sha256(sharedSecret, salt, INFO_SK_READER, KEY_LENGTH));
    }

    /**
     * SHA-256 of the tag-24 wrapped transcript; the salt of every session HKDF.
     */
    public static byte[] transcriptSalt(SessionTranscript transcript) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(transcript.taggedEncoding());
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.questrail.mdoc.crypto;

import com.questrail.mdoc.cbor.SessionTranscript;

import javax.crypto.KeyAgreement;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Derivation of the key behind MAC-based device authentication:
 *
 * <pre>
 *   EMacKey = HKDF-SHA256(ECDH(SDeviceKey, EReaderKey), salt(transcript), "EMacKey", 32)
 * </pre>
 *
 * <p>The salt is the same transcript hash the session keys use.</p>
 */
public final class EMacKey
{
    public static final String INFO = "EMacKey";

    private EMacKey() {}

    public static byte[] derive(PrivateKey deviceStaticKey, PublicKey eReaderKey, SessionTranscript transcript) {
        Objects.requireNonNull(deviceStaticKey, "deviceStaticKey");
        Objects.requireNonNull(eReaderKey, "eReaderKey");
        Objects.requireNonNull(transcript, "transcript");

        byte[] sharedSecret;
        try {
            KeyAgreement agreement = KeyAgreement.getInstance("ECDH");
            agreement.init(deviceStaticKey);
            agreement.doPhase(eReaderKey, true);
            sharedSecret = agreement.generateSecret();
        }
        catch (GeneralSecurityException e) {
            throw new SessionCryptoException(SessionCryptoException.Kind.KEY_AGREEMENT_FAILED,
                    "ECDH for EMacKey failed", e);
        }

        try {
            return Hkdf.sha256(sharedSecret, DerivedSessionKeys.transcriptSalt(transcript),
                    INFO, DerivedSessionKeys.KEY_LENGTH);
        }
        finally {
            Arrays.fill(sharedSecret, (byte) 0);
        }
    }
}

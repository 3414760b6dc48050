package com.questrail.mdoc.crypto;

import com.questrail.mdoc.cbor.SessionTranscript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyAgreement;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * SessionCryptoEngine
 * =============================================================================
 * Session encryption for one mdoc presentation.
 *
 * <h2>States</h2>
 * <pre>
 *   NO_KEYS ──setPeerPublicKey──▶ SHARED_SECRET_COMPUTED ──first use──▶ KEYS_DERIVED
 * </pre>
 * <p>The session transcript may be fixed at any point before first use.
 * Keys are derived lazily, on the first encrypt or decrypt, once both the
 * shared secret and the transcript are known. Using the engine earlier is a
 * contract violation and throws {@link IllegalStateException}.</p>
 *
 * <h2>Directions</h2>
 * <p>A {@link SessionRole#DEVICE} engine encrypts with SKDevice and decrypts
 * with SKReader; a {@link SessionRole#READER} engine does the opposite. Each
 * direction carries its own counter (see {@link SessionKey}).</p>
 *
 * <p>Not thread-safe. Instances must not be shared between sessions.</p>
 */
public final class SessionCryptoEngine
{
    private static final Logger log = LoggerFactory.getLogger(SessionCryptoEngine.class);

    public enum State {
        NO_KEYS,
        SHARED_SECRET_COMPUTED,
        KEYS_DERIVED
    }

    private final SessionRole role;
    private final KeyPair localKeyPair;
    private final EcCurve curve;

    private byte[] sharedSecret;
    private SessionTranscript transcript;
    private SessionKey outbound;
    private SessionKey inbound;
    private boolean destroyed;

    public SessionCryptoEngine(SessionRole role, KeyPair localKeyPair) {
        this.role = Objects.requireNonNull(role, "role");
        this.localKeyPair = Objects.requireNonNull(localKeyPair, "localKeyPair");
        if (!(localKeyPair.getPublic() instanceof ECPublicKey ecPublic)) {
            throw new IllegalArgumentException("Local key pair must be an EC key pair");
        }
        this.curve = EcCurve.of(ecPublic);
    }

    public SessionRole role() {
        return role;
    }

    public EcCurve curve() {
        return curve;
    }

    public State state() {
        if (outbound != null) {
            return State.KEYS_DERIVED;
        }
        return sharedSecret != null ? State.SHARED_SECRET_COMPUTED : State.NO_KEYS;
    }

    /**
     * Computes the ECDH shared secret with the peer's ephemeral public key.
     *
     * @throws IllegalStateException  if a peer key was already set or the session
     *                                was destroyed
     * @throws SessionCryptoException of kind {@code KEY_AGREEMENT_FAILED} if the key
     *                                is on another curve or rejected by the provider
     */
    public void setPeerPublicKey(PublicKey peerPublicKey) {
        Objects.requireNonNull(peerPublicKey, "peerPublicKey");
        if (destroyed) {
            throw new IllegalStateException("Session keys destroyed");
        }
        if (sharedSecret != null) {
            throw new IllegalStateException("Peer public key already set");
        }
        if (!(peerPublicKey instanceof ECPublicKey ecPeer) || EcCurve.of(ecPeer) != curve) {
            throw new SessionCryptoException(SessionCryptoException.Kind.KEY_AGREEMENT_FAILED,
                    "Peer key is not an EC key on " + curve);
        }

        try {
            KeyAgreement agreement = KeyAgreement.getInstance("ECDH");
            agreement.init(localKeyPair.getPrivate());
            agreement.doPhase(peerPublicKey, true);
            sharedSecret = agreement.generateSecret();
        }
        catch (GeneralSecurityException e) {
            throw new SessionCryptoException(SessionCryptoException.Kind.KEY_AGREEMENT_FAILED,
                    "ECDH key agreement failed", e);
        }
        log.debug("{} session: shared secret computed on {}", role, curve);
    }

    /**
     * Fixes the session transcript. It can be set only once.
     */
    public void setSessionTranscript(SessionTranscript transcript) {
        Objects.requireNonNull(transcript, "transcript");
        if (this.transcript != null) {
            throw new IllegalStateException("Session transcript already set");
        }
        this.transcript = transcript;
    }

    public byte[] encryptToReader(byte[] plaintext) {
        requireRole(SessionRole.DEVICE, "encryptToReader");
        return outbound().seal(plaintext);
    }

    public byte[] decryptFromReader(byte[] ciphertext) {
        requireRole(SessionRole.DEVICE, "decryptFromReader");
        return inbound().open(ciphertext);
    }

    public byte[] encryptToDevice(byte[] plaintext) {
        requireRole(SessionRole.READER, "encryptToDevice");
        return outbound().seal(plaintext);
    }

    public byte[] decryptFromDevice(byte[] ciphertext) {
        requireRole(SessionRole.READER, "decryptFromDevice");
        return inbound().open(ciphertext);
    }

    /** Messages encrypted so far. */
    public long messagesEncrypted() {
        return outbound == null ? 0 : outbound.operations();
    }

    /** Messages successfully decrypted so far. */
    public long messagesDecrypted() {
        return inbound == null ? 0 : inbound.operations();
    }

    /**
     * Drops key material. The engine is unusable afterwards.
     */
    public void destroy() {
        if (sharedSecret != null) {
            Arrays.fill(sharedSecret, (byte) 0);
            sharedSecret = null;
        }
        destroyed = true;
        outbound = null;
        inbound = null;
        transcript = null;
    }

    SessionKey outboundKey() {
        return outbound();
    }

    private SessionKey outbound() {
        deriveIfNeeded();
        return outbound;
    }

    private SessionKey inbound() {
        deriveIfNeeded();
        return inbound;
    }

    private void deriveIfNeeded() {
        if (destroyed) {
            throw new IllegalStateException("Session keys destroyed");
        }
        if (outbound != null) {
            return;
        }
        if (sharedSecret == null) {
            throw new IllegalStateException("Peer public key not set; session keys cannot be derived");
        }
        if (transcript == null) {
            throw new IllegalStateException("Session transcript not set; session keys cannot be derived");
        }

        DerivedSessionKeys keys = DerivedSessionKeys.derive(sharedSecret, transcript);
        SessionKey device = new SessionKey(keys.skDevice(), SessionKey.DIRECTION_DEVICE_TO_READER);
        SessionKey reader = new SessionKey(keys.skReader(), SessionKey.DIRECTION_READER_TO_DEVICE);
        Arrays.fill(keys.skDevice(), (byte) 0);
        Arrays.fill(keys.skReader(), (byte) 0);

        if (role == SessionRole.DEVICE) {
            outbound = device;
            inbound = reader;
        }
        else {
            outbound = reader;
            inbound = device;
        }
        log.debug("{} session: keys derived", role);
    }

    private void requireRole(SessionRole expected, String operation) {
        if (role != expected) {
            throw new IllegalStateException(operation + " is not available to a " + role + " session");
        }
    }
}

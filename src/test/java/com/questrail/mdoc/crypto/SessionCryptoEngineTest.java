package com.questrail.mdoc.crypto;

import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.SessionTranscript;
import com.questrail.mdoc.crypto.cose.CoseKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import javax.crypto.KeyAgreement;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.interfaces.ECPublicKey;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionCryptoEngineTest
 * -----------------------------------------------------------------------------
 * Both ends of a session run against each other: key agreement, derivation
 * from the transcript and the per-direction counters.
 */
class SessionCryptoEngineTest {

    private KeyPair deviceKeys;
    private KeyPair readerKeys;
    private SessionTranscript transcript;

    @BeforeEach
    void setUp() {
        deviceKeys = EcCurve.P256.generateKeyPair();
        readerKeys = EcCurve.P256.generateKeyPair();
        transcript = SessionTranscript.of(
                Cbor.encode(new CBORString("device-engagement")),
                CoseKey.encode((ECPublicKey) readerKeys.getPublic()),
                null);
    }

    private SessionCryptoEngine engine(SessionRole role, KeyPair local, KeyPair peer) {
        SessionCryptoEngine engine = new SessionCryptoEngine(role, local);
        engine.setPeerPublicKey(peer.getPublic());
        engine.setSessionTranscript(transcript);
        return engine;
    }

    @Test
    void deviceAndReaderExchangeMessagesBothWays() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);
        SessionCryptoEngine reader = engine(SessionRole.READER, readerKeys, deviceKeys);

        byte[] request = "DeviceRequest".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(request, device.decryptFromReader(reader.encryptToDevice(request)));

        byte[] response = "DeviceResponse".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(response, reader.decryptFromDevice(device.encryptToReader(response)));

        assertEquals(1, device.messagesEncrypted());
        assertEquals(1, device.messagesDecrypted());
    }

    @Test
    void directionsUseDistinctKeys() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);
        SessionCryptoEngine reader = engine(SessionRole.READER, readerKeys, deviceKeys);

        byte[] plaintext = new byte[] { 1, 2, 3, 4 };
        assertFalse(MessageDigest.isEqual(device.encryptToReader(plaintext), reader.encryptToDevice(plaintext)));
    }

    @Test
    void stateFollowsSetupSteps() {
        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);
        assertEquals(SessionCryptoEngine.State.NO_KEYS, device.state());

        device.setPeerPublicKey(readerKeys.getPublic());
        assertEquals(SessionCryptoEngine.State.SHARED_SECRET_COMPUTED, device.state());

        device.setSessionTranscript(transcript);
        device.encryptToReader(new byte[] { 0 });
        assertEquals(SessionCryptoEngine.State.KEYS_DERIVED, device.state());
    }

    @Test
    void encryptingWithoutTranscriptIsRejected() {
        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);
        device.setPeerPublicKey(readerKeys.getPublic());

        assertThrows(IllegalStateException.class, () -> device.encryptToReader(new byte[] { 0 }));
    }

    @Test
    void encryptingWithoutPeerKeyIsRejected() {
        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);
        device.setSessionTranscript(transcript);

        assertThrows(IllegalStateException.class, () -> device.encryptToReader(new byte[] { 0 }));
    }

    @Test
    void roleMismatchedOperationsAreRejected() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);

        assertThrows(IllegalStateException.class, () -> device.encryptToDevice(new byte[] { 0 }));
        assertThrows(IllegalStateException.class, () -> device.decryptFromDevice(new byte[16]));
    }

    @Test
    void peerKeyOnOtherCurveFailsKeyAgreement() {
        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);
        KeyPair p384 = EcCurve.P384.generateKeyPair();

        SessionCryptoException e = assertThrows(SessionCryptoException.class,
                () -> device.setPeerPublicKey(p384.getPublic()));
        assertEquals(SessionCryptoException.Kind.KEY_AGREEMENT_FAILED, e.kind());
    }

    @Test
    void peerKeyAndTranscriptAreSetOnce() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);

        assertThrows(IllegalStateException.class, () -> device.setPeerPublicKey(readerKeys.getPublic()));
        assertThrows(IllegalStateException.class, () -> device.setSessionTranscript(transcript));
    }

    @Test
    void derivedKeysMatchHkdfOverTranscriptSalt() throws Exception {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);

        KeyAgreement agreement = KeyAgreement.getInstance("ECDH");
        agreement.init(readerKeys.getPrivate());
        agreement.doPhase(deviceKeys.getPublic(), true);
        byte[] shared = agreement.generateSecret();

        byte[] salt = MessageDigest.getInstance("SHA-256").digest(transcript.taggedEncoding());
        assertArrayEquals(salt, DerivedSessionKeys.transcriptSalt(transcript));

        DerivedSessionKeys keys = DerivedSessionKeys.derive(shared, transcript);
        assertArrayEquals(Hkdf.sha256(shared, salt, "SKDevice", 32), keys.skDevice());
        assertArrayEquals(Hkdf.sha256(shared, salt, "SKReader", 32), keys.skReader());

        SessionKey expected = new SessionKey(keys.skDevice(), SessionKey.DIRECTION_DEVICE_TO_READER);
        byte[] plaintext = new byte[] { 42 };
        assertArrayEquals(expected.seal(plaintext), device.encryptToReader(plaintext));
    }

    @Test
    void destroyedEngineRefusesWork() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);
        device.encryptToReader(new byte[] { 1 });

        device.destroy();

        assertThrows(IllegalStateException.class, () -> device.encryptToReader(new byte[] { 2 }));
    }

    @Test
    void peerKeyAfterDestroyReportsDestroyedSession() {
        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);

        device.destroy();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> device.setPeerPublicKey(readerKeys.getPublic()));
        assertEquals("Session keys destroyed", e.getMessage());
    }

    @Test
    void secondPeerKeyIsRejected() {
        SessionCryptoEngine device = engine(SessionRole.DEVICE, deviceKeys, readerKeys);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> device.setPeerPublicKey(readerKeys.getPublic()));
        assertEquals("Peer public key already set", e.getMessage());
    }

    @Test
    void nonEcKeyPairIsRejected() throws Exception {
        KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
        rsa.initialize(1024);
        KeyPair rsaKeys = rsa.generateKeyPair();

        assertThrows(IllegalArgumentException.class, () -> new SessionCryptoEngine(SessionRole.DEVICE, rsaKeys));
    }
}

package com.questrail.mdoc.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionKeyTest
 * -----------------------------------------------------------------------------
 * Nonce layout and counter discipline of one session direction.
 */
class SessionKeyTest {

    private static final HexFormat HEX = HexFormat.of();

    private static byte[] keyBytes() {
        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }
        return key;
    }

    @Test
    void firstDeviceNonceUsesDirectionOneAndCounterOne() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        assertEquals("000000000000000100000001", HEX.formatHex(key.nonce()));
    }

    @Test
    void readerNonceUsesDirectionZero() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_READER_TO_DEVICE);
        assertEquals("000000000000000000000001", HEX.formatHex(key.nonce()));
    }

    @Test
    void counterAdvancesAfterEachSeal() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);

        key.seal(new byte[] { 1 });
        key.seal(new byte[] { 2 });

        assertEquals(3, key.counter());
        assertEquals(2, key.operations());
        assertEquals("000000000000000100000003", HEX.formatHex(key.nonce()));
    }

    @Test
    void sealOutputCarriesSixteenByteTag() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        assertEquals(5 + 16, key.seal(new byte[5]).length);
    }

    @Test
    void peersWithSameKeyAndDirectionInteroperate() {
        SessionKey sender = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        SessionKey receiver = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);

        for (String text : new String[] { "first", "second" }) {
            byte[] plaintext = text.getBytes(StandardCharsets.UTF_8);
            assertArrayEquals(plaintext, receiver.open(sender.seal(plaintext)));
        }
    }

    @Test
    void failedOpenDoesNotAdvanceCounter() {
        SessionKey sender = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        SessionKey receiver = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        byte[] ciphertext = sender.seal(new byte[] { 1, 2, 3 });
        byte[] tampered = ciphertext.clone();
        tampered[0] ^= 0x01;

        SessionCryptoException e = assertThrows(SessionCryptoException.class, () -> receiver.open(tampered));
        assertEquals(SessionCryptoException.Kind.DECRYPTION_FAILED, e.kind());
        assertEquals(1, receiver.counter());

        assertArrayEquals(new byte[] { 1, 2, 3 }, receiver.open(ciphertext));
    }

    @Test
    void tamperedTagIsRejectedWithoutAdvancingCounter() {
        SessionKey sender = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        SessionKey receiver = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        byte[] ciphertext = sender.seal("tagged".getBytes(StandardCharsets.UTF_8));
        byte[] tampered = ciphertext.clone();
        tampered[tampered.length - 1] ^= (byte) 0x80;

        SessionCryptoException e = assertThrows(SessionCryptoException.class, () -> receiver.open(tampered));
        assertEquals(SessionCryptoException.Kind.DECRYPTION_FAILED, e.kind());
        assertEquals(1, receiver.counter());

        assertArrayEquals("tagged".getBytes(StandardCharsets.UTF_8), receiver.open(ciphertext));
    }

    @Test
    void consecutiveNoncesNeverRepeat() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(HEX.formatHex(key.nonce())), "nonce repeated at message " + i);
            key.seal(new byte[] { (byte) i });
        }

        assertEquals(1000, seen.size());
    }

    @Test
    void replayedMessageFailsAfterCounterMoved() {
        SessionKey sender = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        SessionKey receiver = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER);
        byte[] ciphertext = sender.seal(new byte[] { 9 });

        receiver.open(ciphertext);

        assertThrows(SessionCryptoException.class, () -> receiver.open(ciphertext));
    }

    @Test
    void lastCounterValueIsUsableThenKeyIsExhausted() {
        SessionKey key = new SessionKey(keyBytes(), SessionKey.DIRECTION_DEVICE_TO_READER, SessionKey.MAX_COUNTER);
        assertEquals("0000000000000001ffffffff", HEX.formatHex(key.nonce()));

        key.seal(new byte[] { 1 });

        SessionCryptoException e = assertThrows(SessionCryptoException.class, () -> key.seal(new byte[] { 2 }));
        assertEquals(SessionCryptoException.Kind.SESSION_EXHAUSTED, e.kind());
    }

    @Test
    void keyMustBe256Bits() {
        assertThrows(IllegalArgumentException.class,
                () -> new SessionKey(new byte[16], SessionKey.DIRECTION_DEVICE_TO_READER));
    }
}

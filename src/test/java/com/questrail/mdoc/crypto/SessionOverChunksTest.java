package com.questrail.mdoc.crypto;

import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.SessionTranscript;
import com.questrail.mdoc.codec.ChunkDecodeResult;
import com.questrail.mdoc.codec.impl.ChunkFraming;
import com.questrail.mdoc.codec.impl.ChunkReassembler;
import com.questrail.mdoc.codec.impl.DefaultChunkEncoder;
import com.questrail.mdoc.crypto.cose.CoseKey;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionOverChunksTest
 * -----------------------------------------------------------------------------
 * A device response goes through the whole outbound path at the default MTU:
 * encrypted, split into characteristic writes, reassembled on the reader
 * side and decrypted.
 */
class SessionOverChunksTest {

    @Test
    void helloMdocSurvivesEncryptionAndChunkingAtDefaultMtu() {
        KeyPair deviceKeys = EcCurve.P256.generateKeyPair();
        KeyPair readerKeys = EcCurve.P256.generateKeyPair();
        SessionTranscript transcript = SessionTranscript.of(
                Cbor.encode(new CBORString("device-engagement")),
                CoseKey.encode((ECPublicKey) readerKeys.getPublic()),
                null);

        SessionCryptoEngine device = new SessionCryptoEngine(SessionRole.DEVICE, deviceKeys);
        device.setPeerPublicKey(readerKeys.getPublic());
        device.setSessionTranscript(transcript);
        SessionCryptoEngine reader = new SessionCryptoEngine(SessionRole.READER, readerKeys);
        reader.setPeerPublicKey(deviceKeys.getPublic());
        reader.setSessionTranscript(transcript);

        byte[] plaintext = "hello-mdoc".getBytes(StandardCharsets.US_ASCII);
        byte[] ciphertext = device.encryptToReader(plaintext);
        assertEquals(plaintext.length + 16, ciphertext.length);

        int attributeSize = ChunkFraming.attributeSizeForMtu(ChunkFraming.DEFAULT_MTU);
        int payloadSize = ChunkFraming.payloadSizeForAttribute(attributeSize);
        assertEquals(20, attributeSize);
        assertEquals(19, payloadSize);

        List<byte[]> chunks = new DefaultChunkEncoder().encode(ciphertext, payloadSize);
        assertEquals(2, chunks.size());
        assertEquals(ChunkFraming.MORE_FOLLOWS, chunks.get(0)[0]);
        assertEquals(attributeSize, chunks.get(0).length);
        assertEquals(ChunkFraming.LAST_CHUNK, chunks.get(1)[0]);
        assertEquals(ciphertext.length - payloadSize + 1, chunks.get(1).length);

        ChunkReassembler reassembler = new ChunkReassembler();
        assertInstanceOf(ChunkDecodeResult.Partial.class, reassembler.accept(chunks.get(0)));
        ChunkDecodeResult.Complete complete =
                assertInstanceOf(ChunkDecodeResult.Complete.class, reassembler.accept(chunks.get(1)));

        assertArrayEquals(ciphertext, complete.message());
        assertArrayEquals(plaintext, reader.decryptFromDevice(complete.message()));
    }
}

package com.questrail.mdoc.crypto.cose;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORItem;
import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORNull;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;
import com.questrail.mdoc.crypto.SessionCryptoException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;

/**
 * COSE_Mac0 with HMAC 256/256, used for MAC-based device authentication.
 *
 * <pre>
 *   COSE_Mac0 = [ protected: bstr, unprotected: map, payload: bstr / nil, tag: bstr ]
 *
 *   MAC_structure = [ "MAC0", protected, h'', payload ]
 * </pre>
 */
public record CoseMac0(byte[] protectedHeader, byte[] payload, byte[] tag)
{
    public CoseMac0 {
        Objects.requireNonNull(protectedHeader, "protectedHeader");
        Objects.requireNonNull(tag, "tag");
    }

    public static CoseMac0 create(byte[] key, byte[] content, boolean detached) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");

        byte[] protectedHeader = CoseSign1.encodeProtectedHeader(CoseAlgorithm.HMAC_256_256);
        byte[] tag = hmacSha256(key, macStructure(protectedHeader, content));
        return new CoseMac0(protectedHeader, detached ? null : content, tag);
    }

    /**
     * Recomputes the tag and compares in constant time.
     *
     * @throws IllegalArgumentException if both or neither of the embedded payload and
     *                                  {@code detachedContent} are present
     */
    public boolean verify(byte[] key, byte[] detachedContent) {
        Objects.requireNonNull(key, "key");
        if (payload != null && detachedContent != null) {
            throw new IllegalArgumentException("Payload is embedded; detached content must not be supplied");
        }
        if (payload == null && detachedContent == null) {
            throw new IllegalArgumentException("Payload is detached; detached content is required");
        }

        CBORPairList header = Cbor.asMap(Cbor.decode(protectedHeader));
        long alg = Cbor.asLong(Cbor.require(header, CoseLabels.HEADER_ALG));
        if (alg != CoseAlgorithm.HMAC_256_256.coseId()) {
            throw new SessionCryptoException(SessionCryptoException.Kind.MALFORMED_MESSAGE,
                    "Unsupported MAC algorithm " + alg);
        }

        byte[] expected = hmacSha256(key, macStructure(protectedHeader,
                payload != null ? payload : detachedContent));
        return MessageDigest.isEqual(expected, tag);
    }

    public byte[] encode() {
        return Cbor.encode(new CBORItemList(
                new CBORByteArray(protectedHeader),
                new CBORPairList(List.<CBORPair>of()),
                payload == null ? CBORNull.INSTANCE : new CBORByteArray(payload),
                new CBORByteArray(tag)));
    }

    public static CoseMac0 decode(byte[] encoded) {
        List<? extends CBORItem> items = Cbor.asArray(Cbor.decode(encoded));
        if (items.size() != 4) {
            throw new CborDecodeException("COSE_Mac0 must have 4 elements, found " + items.size());
        }
        Cbor.asMap(items.get(1));
        CBORItem payloadItem = items.get(2);
        return new CoseMac0(
                Cbor.asBytes(items.get(0)),
                payloadItem instanceof CBORNull ? null : Cbor.asBytes(payloadItem),
                Cbor.asBytes(items.get(3)));
    }

    static byte[] macStructure(byte[] protectedHeader, byte[] content) {
        return Cbor.encode(new CBORItemList(
                new CBORString(CoseLabels.CONTEXT_MAC0),
                new CBORByteArray(protectedHeader),
                new CBORByteArray(new byte[0]),
                new CBORByteArray(content)));
    }

    private static byte[] hmacSha256(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }
}

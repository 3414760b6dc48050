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
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.SessionCryptoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.ECKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CoseSign1
 * =============================================================================
 * COSE_Sign1 with a single ECDSA signer.
 *
 * <pre>
 *   COSE_Sign1 = [ protected: bstr, unprotected: map, payload: bstr / nil, signature: bstr ]
 *
 *   Sig_structure = [ "Signature1", protected, h'', payload ]
 * </pre>
 *
 * <p>The protected header carries only {@code alg}. A certificate chain, when
 * present, sits in the unprotected header under {@code x5chain}: a single
 * certificate as a bstr, several as an array of bstr. With a detached payload
 * the payload slot is nil and the content is supplied again at verification.</p>
 */
public record CoseSign1(byte[] protectedHeader,
                        List<byte[]> x5chain,
                        byte[] payload,
                        byte[] signature)
{
    private static final Logger log = LoggerFactory.getLogger(CoseSign1.class);

    public CoseSign1 {
        Objects.requireNonNull(protectedHeader, "protectedHeader");
        Objects.requireNonNull(signature, "signature");
        x5chain = x5chain == null ? List.of() : List.copyOf(x5chain);
    }

    /**
     * Signs {@code content}.
     *
     * @param key      signing key; its curve must match {@code alg}
     * @param alg      ES256, ES384 or ES512
     * @param content  content to sign
     * @param detached if {@code true} the content is left out of the structure
     * @param x5chain  DER certificates to carry; may be empty
     */
    public static CoseSign1 sign(PrivateKey key, CoseAlgorithm alg, byte[] content,
                                 boolean detached, List<byte[]> x5chain) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(alg, "alg");
        Objects.requireNonNull(content, "content");

        EcCurve curve = alg.curve().orElseThrow(
                () -> new IllegalArgumentException(alg + " is not a signature algorithm"));
        if (!(key instanceof ECKey ecKey) || EcCurve.of(ecKey) != curve) {
            throw new IllegalArgumentException("Signing key does not match " + alg);
        }

        byte[] protectedHeader = encodeProtectedHeader(alg);
        byte[] toBeSigned = sigStructure(protectedHeader, content);

        byte[] der;
        try {
            Signature signer = Signature.getInstance(alg.jcaName());
            signer.initSign(key);
            signer.update(toBeSigned);
            der = signer.sign();
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing with " + alg + " failed", e);
        }

        byte[] raw = EcdsaSignatureCodec.derToRaw(der, curve.coordinateSize());
        return new CoseSign1(protectedHeader, x5chain, detached ? null : content, raw);
    }

    /**
     * Verifies the signature.
     *
     * @param key             public key of the purported signer
     * @param detachedContent content for a detached structure; {@code null} when the payload is embedded
     * @return {@code true} if the signature is valid over the content
     * @throws IllegalArgumentException if both or neither of the embedded payload and
     *                                  {@code detachedContent} are present
     * @throws SessionCryptoException   if the structure itself is malformed
     */
    public boolean verify(PublicKey key, byte[] detachedContent) {
        Objects.requireNonNull(key, "key");
        if (payload != null && detachedContent != null) {
            throw new IllegalArgumentException("Payload is embedded; detached content must not be supplied");
        }
        if (payload == null && detachedContent == null) {
            throw new IllegalArgumentException("Payload is detached; detached content is required");
        }

        CoseAlgorithm alg = algorithm();
        EcCurve curve = alg.curve().orElseThrow(() -> new SessionCryptoException(
                SessionCryptoException.Kind.MALFORMED_MESSAGE, alg + " is not a signature algorithm"));

        if (!(key instanceof ECKey ecKey) || EcCurve.of(ecKey) != curve) {
            log.debug("Verification key is not on {}", curve);
            return false;
        }

        byte[] der = EcdsaSignatureCodec.rawToDer(signature, curve.coordinateSize());
        byte[] toBeSigned = sigStructure(protectedHeader, payload != null ? payload : detachedContent);

        try {
            Signature verifier = Signature.getInstance(alg.jcaName());
            verifier.initVerify(key);
            verifier.update(toBeSigned);
            return verifier.verify(der);
        }
        catch (GeneralSecurityException e) {
            throw new SessionCryptoException(SessionCryptoException.Kind.MALFORMED_MESSAGE,
                    "Signature could not be verified", e);
        }
    }

    /** Algorithm named by the protected header. */
    public CoseAlgorithm algorithm() {
        CBORPairList header = Cbor.asMap(Cbor.decode(protectedHeader));
        try {
            return CoseAlgorithm.fromCoseId(Cbor.asLong(Cbor.require(header, CoseLabels.HEADER_ALG)));
        }
        catch (IllegalArgumentException | CborDecodeException e) {
            throw new SessionCryptoException(SessionCryptoException.Kind.MALFORMED_MESSAGE,
                    "Protected header has no usable alg", e);
        }
    }

    public CBORItemList toCbor() {
        List<CBORPair> unprotected = new ArrayList<>();
        if (x5chain.size() == 1) {
            unprotected.add(new CBORPair(Cbor.integer(CoseLabels.HEADER_X5CHAIN),
                    new CBORByteArray(x5chain.get(0))));
        }
        else if (x5chain.size() > 1) {
            List<CBORItem> certs = new ArrayList<>();
            for (byte[] cert : x5chain) {
                certs.add(new CBORByteArray(cert));
            }
            unprotected.add(new CBORPair(Cbor.integer(CoseLabels.HEADER_X5CHAIN), new CBORItemList(certs)));
        }

        return new CBORItemList(
                new CBORByteArray(protectedHeader),
                new CBORPairList(unprotected),
                payload == null ? CBORNull.INSTANCE : new CBORByteArray(payload),
                new CBORByteArray(signature));
    }

    public byte[] encode() {
        return Cbor.encode(toCbor());
    }

    public static CoseSign1 decode(byte[] encoded) {
        return fromCbor(Cbor.decode(encoded));
    }

    public static CoseSign1 fromCbor(CBORItem item) {
        List<? extends CBORItem> items = Cbor.asArray(item);
        if (items.size() != 4) {
            throw new CborDecodeException("COSE_Sign1 must have 4 elements, found " + items.size());
        }

        byte[] protectedHeader = Cbor.asBytes(items.get(0));
        CBORPairList unprotected = Cbor.asMap(items.get(1));
        CBORItem payloadItem = items.get(2);
        byte[] payload = payloadItem instanceof CBORNull ? null : Cbor.asBytes(payloadItem);
        byte[] signature = Cbor.asBytes(items.get(3));

        List<byte[]> chain = new ArrayList<>();
        Cbor.lookup(unprotected, CoseLabels.HEADER_X5CHAIN).ifPresent(x5 -> {
            if (x5 instanceof CBORByteArray single) {
                chain.add(single.getValue());
            }
            else {
                for (CBORItem cert : Cbor.asArray(x5)) {
                    chain.add(Cbor.asBytes(cert));
                }
            }
        });

        return new CoseSign1(protectedHeader, chain, payload, signature);
    }

    static byte[] encodeProtectedHeader(CoseAlgorithm alg) {
        return Cbor.encode(new CBORPairList(
                new CBORPair(Cbor.integer(CoseLabels.HEADER_ALG), Cbor.integer(alg.coseId()))));
    }

    static byte[] sigStructure(byte[] protectedHeader, byte[] content) {
        return Cbor.encode(new CBORItemList(
                new CBORString(CoseLabels.CONTEXT_SIGNATURE1),
                new CBORByteArray(protectedHeader),
                new CBORByteArray(new byte[0]),
                new CBORByteArray(content)));
    }
}

package com.questrail.mdoc.crypto.cose;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORItem;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;
import com.questrail.mdoc.crypto.EcCurve;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.util.Arrays;
import java.util.Objects;

/**
 * EC2 COSE_Key encoding of ephemeral public keys:
 *
 * <pre>
 *   { 1: 2, -1: crv, -2: x, -3: y }
 * </pre>
 *
 * <p>Coordinates are unsigned big-endian, left-padded to the curve's
 * coordinate size.</p>
 */
public final class CoseKey
{
    private CoseKey() {}

    public static CBORPairList toCbor(ECPublicKey key) {
        Objects.requireNonNull(key, "key");
        EcCurve curve = EcCurve.of(key);
        ECPoint w = key.getW();

        return new CBORPairList(
                new CBORPair(Cbor.integer(CoseLabels.KEY_KTY), Cbor.integer(CoseLabels.KTY_EC2)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_CRV), Cbor.integer(curve.coseCurveId())),
                new CBORPair(Cbor.integer(CoseLabels.EC2_X),
                        new CBORByteArray(fixed(w.getAffineX(), curve.coordinateSize()))),
                new CBORPair(Cbor.integer(CoseLabels.EC2_Y),
                        new CBORByteArray(fixed(w.getAffineY(), curve.coordinateSize()))));
    }

    public static byte[] encode(ECPublicKey key) {
        return Cbor.encode(toCbor(key));
    }

    public static ECPublicKey decode(byte[] encoded) {
        return fromCbor(Cbor.decode(encoded));
    }

    /**
     * Rebuilds a public key from a COSE_Key map.
     *
     * @throws CborDecodeException if the map is not a valid EC2 key or the point is not on the curve
     */
    public static ECPublicKey fromCbor(CBORItem item) {
        CBORPairList map = Cbor.asMap(item);

        long kty = Cbor.asLong(Cbor.require(map, CoseLabels.KEY_KTY));
        if (kty != CoseLabels.KTY_EC2) {
            throw new CborDecodeException("Unsupported COSE_Key kty: " + kty);
        }

        EcCurve curve;
        try {
            curve = EcCurve.fromCoseId(Cbor.asLong(Cbor.require(map, CoseLabels.EC2_CRV)));
        }
        catch (IllegalArgumentException e) {
            throw new CborDecodeException(e.getMessage(), e);
        }

        byte[] x = Cbor.asBytes(Cbor.require(map, CoseLabels.EC2_X));
        byte[] y = Cbor.asBytes(Cbor.require(map, CoseLabels.EC2_Y));
        if (x.length != curve.coordinateSize() || y.length != curve.coordinateSize()) {
            throw new CborDecodeException("COSE_Key coordinates must be "
                    + curve.coordinateSize() + " bytes on " + curve);
        }

        BigInteger affineX = new BigInteger(1, x);
        BigInteger affineY = new BigInteger(1, y);
        if (!curve.contains(affineX, affineY)) {
            throw new CborDecodeException("COSE_Key point is not on " + curve);
        }

        ECPoint point = new ECPoint(affineX, affineY);
        try {
            return (ECPublicKey) KeyFactory.getInstance("EC")
                    .generatePublic(new ECPublicKeySpec(point, curve.parameterSpec()));
        }
        catch (GeneralSecurityException e) {
            throw new CborDecodeException("COSE_Key does not describe a valid " + curve + " point", e);
        }
    }

    static byte[] fixed(BigInteger value, int size) {
        byte[] bytes = value.toByteArray();
        if (bytes.length == size) {
            return bytes;
        }
        if (bytes.length > size) {
            // Leading sign byte only.
            return Arrays.copyOfRange(bytes, bytes.length - size, bytes.length);
        }
        byte[] out = new byte[size];
        System.arraycopy(bytes, 0, out, size - bytes.length, bytes.length);
        return out;
    }
}

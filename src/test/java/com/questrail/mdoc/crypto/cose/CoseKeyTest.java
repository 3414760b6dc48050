package com.questrail.mdoc.crypto.cose;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;
import com.questrail.mdoc.crypto.EcCurve;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.security.interfaces.ECPublicKey;

import static org.junit.jupiter.api.Assertions.*;

class CoseKeyTest {

    @ParameterizedTest
    @EnumSource(EcCurve.class)
    void encodedKeyCarriesFixedWidthCoordinates(EcCurve curve) {
        ECPublicKey key = (ECPublicKey) curve.generateKeyPair().getPublic();

        CBORPairList map = Cbor.asMap(Cbor.decode(CoseKey.encode(key)));

        assertEquals(CoseLabels.KTY_EC2, Cbor.asLong(Cbor.require(map, CoseLabels.KEY_KTY)));
        assertEquals(curve.coseCurveId(), Cbor.asLong(Cbor.require(map, CoseLabels.EC2_CRV)));
        assertEquals(curve.coordinateSize(), Cbor.asBytes(Cbor.require(map, CoseLabels.EC2_X)).length);
        assertEquals(curve.coordinateSize(), Cbor.asBytes(Cbor.require(map, CoseLabels.EC2_Y)).length);
    }

    @ParameterizedTest
    @EnumSource(EcCurve.class)
    void decodedKeyIsTheSamePoint(EcCurve curve) {
        ECPublicKey key = (ECPublicKey) curve.generateKeyPair().getPublic();

        ECPublicKey decoded = CoseKey.decode(CoseKey.encode(key));

        assertEquals(key.getW(), decoded.getW());
        assertEquals(curve, EcCurve.of(decoded));
    }

    @Test
    void pointOffTheCurveIsRejected() {
        byte[] coordinate = new byte[32];
        coordinate[31] = 1;
        CBORPairList map = new CBORPairList(
                new CBORPair(Cbor.integer(CoseLabels.KEY_KTY), Cbor.integer(CoseLabels.KTY_EC2)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_CRV), Cbor.integer(1)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_X), new CBORByteArray(coordinate)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_Y), new CBORByteArray(coordinate)));

        assertThrows(CborDecodeException.class, () -> CoseKey.fromCbor(map));
    }

    @Test
    void nonEc2KeyTypeIsRejected() {
        CBORPairList okp = new CBORPairList(
                new CBORPair(Cbor.integer(CoseLabels.KEY_KTY), Cbor.integer(1)));

        assertThrows(CborDecodeException.class, () -> CoseKey.fromCbor(okp));
    }

    @Test
    void shortCoordinatesAreRejected() {
        CBORPairList map = new CBORPairList(
                new CBORPair(Cbor.integer(CoseLabels.KEY_KTY), Cbor.integer(CoseLabels.KTY_EC2)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_CRV), Cbor.integer(1)),
                new CBORPair(Cbor.integer(CoseLabels.EC2_X), new CBORByteArray(new byte[31])),
                new CBORPair(Cbor.integer(CoseLabels.EC2_Y), new CBORByteArray(new byte[32])));

        assertThrows(CborDecodeException.class, () -> CoseKey.fromCbor(map));
    }
}

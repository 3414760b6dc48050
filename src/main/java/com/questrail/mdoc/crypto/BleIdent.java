package com.questrail.mdoc.crypto;

import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.crypto.cose.CoseKey;

import java.security.interfaces.ECPublicKey;
import java.util.Objects;

/**
 * Value of the GATT Ident characteristic: a 16-byte HKDF output over the
 * encoded EDeviceKey, letting the reader confirm it reached the device that
 * displayed the engagement.
 */
public final class BleIdent
{
    public static final String INFO = "BLEIdent";
    public static final int LENGTH = 16;

    private BleIdent() {}

    /**
     * @param encodedEDeviceKey encoded COSE_Key of the device's ephemeral key
     */
    public static byte[] compute(byte[] encodedEDeviceKey) {
        Objects.requireNonNull(encodedEDeviceKey, "encodedEDeviceKey");
        return Hkdf.sha256(encodedEDeviceKey, new byte[0], INFO, LENGTH);
    }

    /**
     * Ident for an ephemeral device key, using EDeviceKeyBytes
     * ({@code #6.24(bstr .cbor COSE_Key)}) as input keying material.
     */
    public static byte[] forKey(ECPublicKey eDeviceKey) {
        Objects.requireNonNull(eDeviceKey, "eDeviceKey");
        return compute(Cbor.encode(Cbor.tag24(CoseKey.encode(eDeviceKey))));
    }
}

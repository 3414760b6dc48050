package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.crypto.SessionCryptoException;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * EcdsaSignatureCodec
 * -----------------------------------------------------------------------------
 * Converts between the DER {@code SEQUENCE { r INTEGER, s INTEGER }} produced
 * by JCA ECDSA and the COSE wire form {@code r || s}, where each value is
 * left-padded with zeros to the curve's coordinate size.
 */
public final class EcdsaSignatureCodec
{
    private EcdsaSignatureCodec() {}

    public static byte[] derToRaw(byte[] der, int coordinateSize) {
        BigInteger r;
        BigInteger s;
        try {
            ASN1Sequence seq = ASN1Sequence.getInstance(der);
            if (seq.size() != 2) {
                throw malformed("DER signature must hold exactly two integers", null);
            }
            r = ASN1Integer.getInstance(seq.getObjectAt(0)).getPositiveValue();
            s = ASN1Integer.getInstance(seq.getObjectAt(1)).getPositiveValue();
        }
        catch (IllegalArgumentException e) {
            throw malformed("Malformed DER signature", e);
        }

        byte[] raw = new byte[coordinateSize * 2];
        writeFixed(r, raw, 0, coordinateSize);
        writeFixed(s, raw, coordinateSize, coordinateSize);
        return raw;
    }

    public static byte[] rawToDer(byte[] raw, int coordinateSize) {
        if (raw.length != coordinateSize * 2) {
            throw malformed("Raw signature must be " + coordinateSize * 2
                    + " bytes, found " + raw.length, null);
        }

        BigInteger r = new BigInteger(1, Arrays.copyOfRange(raw, 0, coordinateSize));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(raw, coordinateSize, raw.length));

        try {
            return new DERSequence(new ASN1Encodable[] { new ASN1Integer(r), new ASN1Integer(s) })
                    .getEncoded(ASN1Encoding.DER);
        }
        catch (IOException e) {
            throw new IllegalStateException("DER encoding failed", e);
        }
    }

    private static void writeFixed(BigInteger value, byte[] out, int offset, int size) {
        byte[] bytes = value.toByteArray();
        int start = 0;
        // toByteArray() adds a sign byte when the top bit is set.
        while (start < bytes.length - 1 && bytes[start] == 0) {
            start++;
        }
        int length = bytes.length - start;
        if (length > size) {
            throw malformed("Signature component longer than " + size + " bytes", null);
        }
        System.arraycopy(bytes, start, out, offset + size - length, length);
    }

    private static SessionCryptoException malformed(String message, Throwable cause) {
        return new SessionCryptoException(SessionCryptoException.Kind.MALFORMED_MESSAGE, message, cause);
    }
}

package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.crypto.EcCurve;

import java.util.Optional;

/**
 * COSE algorithms supported for signing and MACing.
 */
public enum CoseAlgorithm
{
    ES256(-7, "SHA256withECDSA", EcCurve.P256),
    ES384(-35, "SHA384withECDSA", EcCurve.P384),
    ES512(-36, "SHA512withECDSA", EcCurve.P521),
    HMAC_256_256(5, "HmacSHA256", null);

    private final int coseId;
    private final String jcaName;
    private final EcCurve curve;

    CoseAlgorithm(int coseId, String jcaName, EcCurve curve) {
        this.coseId = coseId;
        this.jcaName = jcaName;
        this.curve = curve;
    }

    public int coseId() {
        return coseId;
    }

    public String jcaName() {
        return jcaName;
    }

    /** Curve an ECDSA algorithm is bound to; empty for MAC algorithms. */
    public Optional<EcCurve> curve() {
        return Optional.ofNullable(curve);
    }

    public boolean isSignature() {
        return curve != null;
    }

    public static CoseAlgorithm fromCoseId(long coseId) {
        for (CoseAlgorithm alg : values()) {
            if (alg.coseId == coseId) {
                return alg;
            }
        }
        throw new IllegalArgumentException("Unsupported COSE algorithm: " + coseId);
    }

    /** ECDSA algorithm whose hash size matches {@code curve}. */
    public static CoseAlgorithm forCurve(EcCurve curve) {
        return switch (curve) {
            case P256 -> ES256;
            case P384 -> ES384;
            case P521 -> ES512;
        };
    }
}

package com.questrail.mdoc.crypto;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.ECKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.EllipticCurve;
import java.security.spec.ECParameterSpec;

/**
 * NIST curves usable for session keys and ECDSA signatures, with their
 * COSE identifiers and fixed coordinate widths.
 */
public enum EcCurve
{
    P256("secp256r1", 32, 1),
    P384("secp384r1", 48, 2),
    P521("secp521r1", 66, 3);

    private final String jcaName;
    private final int coordinateSize;
    private final int coseCurveId;

    EcCurve(String jcaName, int coordinateSize, int coseCurveId) {
        this.jcaName = jcaName;
        this.coordinateSize = coordinateSize;
        this.coseCurveId = coseCurveId;
    }

    public String jcaName() {
        return jcaName;
    }

    /** Bytes of one affine coordinate, and of each of r and s in a raw signature. */
    public int coordinateSize() {
        return coordinateSize;
    }

    /** COSE Elliptic Curves registry value ({@code crv}). */
    public int coseCurveId() {
        return coseCurveId;
    }

    public ECParameterSpec parameterSpec() {
        try {
            AlgorithmParameters params = AlgorithmParameters.getInstance("EC");
            params.init(new ECGenParameterSpec(jcaName));
            return params.getParameterSpec(ECParameterSpec.class);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Curve not available: " + jcaName, e);
        }
    }

    /**
     * Whether {@code (x, y)} satisfies {@code y^2 = x^3 + ax + b} over this
     * curve's prime field. JCA key factories do not all check this.
     */
    public boolean contains(BigInteger x, BigInteger y) {
        EllipticCurve curve = parameterSpec().getCurve();
        BigInteger p = ((ECFieldFp) curve.getField()).getP();
        if (x.signum() < 0 || y.signum() < 0 || x.compareTo(p) >= 0 || y.compareTo(p) >= 0) {
            return false;
        }
        BigInteger lhs = y.multiply(y).mod(p);
        BigInteger rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(p);
        return lhs.equals(rhs);
    }

    /**
     * Generates a fresh key pair on this curve.
     */
    public KeyPair generateKeyPair(SecureRandom random) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(jcaName), random);
            return generator.generateKeyPair();
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot generate key pair on " + jcaName, e);
        }
    }

    public KeyPair generateKeyPair() {
        return generateKeyPair(new SecureRandom());
    }

    public static EcCurve fromCoseId(long coseCurveId) {
        for (EcCurve curve : values()) {
            if (curve.coseCurveId == coseCurveId) {
                return curve;
            }
        }
        throw new IllegalArgumentException("Unsupported COSE curve: " + coseCurveId);
    }

    /**
     * Identifies the curve of an EC key by its full domain parameters: field,
     * coefficients, generator, order and cofactor must all match.
     */
    public static EcCurve of(ECKey key) {
        ECParameterSpec params = key.getParams();
        for (EcCurve curve : values()) {
            if (sameDomain(curve.parameterSpec(), params)) {
                return curve;
            }
        }
        throw new IllegalArgumentException("Unsupported EC domain parameters, field size "
                + params.getCurve().getField().getFieldSize());
    }

    private static boolean sameDomain(ECParameterSpec known, ECParameterSpec candidate) {
        EllipticCurve a = known.getCurve();
        EllipticCurve b = candidate.getCurve();
        return a.getField().equals(b.getField())
                && a.getA().equals(b.getA())
                && a.getB().equals(b.getB())
                && known.getGenerator().equals(candidate.getGenerator())
                && known.getOrder().equals(candidate.getOrder())
                && known.getCofactor() == candidate.getCofactor();
    }
}

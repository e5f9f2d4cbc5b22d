package com.questrail.mdoc.crypto;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.interfaces.ECKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.EllipticCurve;
import java.util.Optional;

/**
 * NIST curves supported for ephemeral session keys, device keys and reader keys.
 *
 * <p>Each constant carries its COSE {@code crv} identifier, the JCA standard name
 * and the matching ECDSA algorithm.</p>
 */
public enum EcCurve
{
    P256(1, "secp256r1", 32, CoseAlgorithm.ES256),
    P384(2, "secp384r1", 48, CoseAlgorithm.ES384),
    P521(3, "secp521r1", 66, CoseAlgorithm.ES512);

    private final int coseCurveIdentifier;
    private final String jcaName;
    private final int coordinateSize;
    private final CoseAlgorithm signatureAlgorithm;

    private volatile ECParameterSpec parameterSpec;

    EcCurve(int coseCurveIdentifier, String jcaName, int coordinateSize, CoseAlgorithm signatureAlgorithm) {
        this.coseCurveIdentifier = coseCurveIdentifier;
        this.jcaName = jcaName;
        this.coordinateSize = coordinateSize;
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public int coseCurveIdentifier() {
        return coseCurveIdentifier;
    }

    public String jcaName() {
        return jcaName;
    }

    /** Size in bytes of one affine coordinate (and of one half of a raw signature). */
    public int coordinateSize() {
        return coordinateSize;
    }

    public CoseAlgorithm signatureAlgorithm() {
        return signatureAlgorithm;
    }

    public ECParameterSpec parameterSpec() {
        ECParameterSpec spec = parameterSpec;
        if (spec == null) {
            try {
                AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
                parameters.init(new ECGenParameterSpec(jcaName));
                spec = parameters.getParameterSpec(ECParameterSpec.class);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("JCA provider does not support " + jcaName, e);
            }
            parameterSpec = spec;
        }
        return spec;
    }

    /**
     * Checks that {@code point} satisfies {@code y^2 = x^3 + ax + b (mod p)}.
     */
    public boolean isOnCurve(ECPoint point) {
        if (point == null || ECPoint.POINT_INFINITY.equals(point)) {
            return false;
        }
        EllipticCurve curve = parameterSpec().getCurve();
        BigInteger p = ((ECFieldFp) curve.getField()).getP();
        BigInteger x = point.getAffineX();
        BigInteger y = point.getAffineY();
        if (x.signum() < 0 || x.compareTo(p) >= 0 || y.signum() < 0 || y.compareTo(p) >= 0) {
            return false;
        }
        BigInteger lhs = y.modPow(BigInteger.TWO, p);
        BigInteger rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(p);
        return lhs.equals(rhs);
    }

    public static Optional<EcCurve> fromCoseIdentifier(int identifier) {
        for (EcCurve curve : values()) {
            if (curve.coseCurveIdentifier == identifier) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    /**
     * Identifies the curve a JCA key lives on by comparing domain parameters.
     */
    public static Optional<EcCurve> fromKey(ECKey key) {
        EllipticCurve keyCurve = key.getParams().getCurve();
        for (EcCurve curve : values()) {
            if (curve.parameterSpec().getCurve().equals(keyCurve)) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }
}

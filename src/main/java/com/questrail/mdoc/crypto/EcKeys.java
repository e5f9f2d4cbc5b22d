package com.questrail.mdoc.crypto;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.KeyAgreement;

/**
 * JCA helpers for elliptic-curve keys: generation, point import, ECDH and the
 * fixed-width coordinate encoding COSE requires.
 */
public final class EcKeys
{
    private static final SecureRandom RANDOM = new SecureRandom();

    private EcKeys() {}

    public static KeyPair generateKeyPair(EcCurve curve) {
        Objects.requireNonNull(curve, "curve");
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(curve.jcaName()), RANDOM);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to generate " + curve + " key pair", e);
        }
    }

    /**
     * Imports an affine point as a public key, rejecting points not on the curve.
     */
    public static ECPublicKey publicKey(EcCurve curve, byte[] x, byte[] y) {
        ECPoint point = new ECPoint(new BigInteger(1, x), new BigInteger(1, y));
        if (!curve.isOnCurve(point)) {
            throw new IllegalArgumentException("Point is not on curve " + curve);
        }
        try {
            KeyFactory factory = KeyFactory.getInstance("EC");
            return (ECPublicKey) factory.generatePublic(new ECPublicKeySpec(point, curve.parameterSpec()));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Unable to import " + curve + " public key", e);
        }
    }

    /** Left-pads (or strips the sign byte of) a coordinate to {@code size} bytes. */
    public static byte[] toFixedLength(BigInteger value, int size) {
        byte[] raw = value.toByteArray();
        if (raw.length == size) {
            return raw;
        }
        if (raw.length > size) {
            return Arrays.copyOfRange(raw, raw.length - size, raw.length);
        }
        byte[] padded = new byte[size];
        System.arraycopy(raw, 0, padded, size - raw.length, raw.length);
        return padded;
    }

    /**
     * Raw ECDH shared secret (the X coordinate of the shared point).
     *
     * @throws IllegalArgumentException if the keys are on different curves
     */
    public static byte[] keyAgreement(ECPrivateKey privateKey, ECPublicKey peerPublicKey) {
        EcCurve ours = EcCurve.fromKey(privateKey)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported curve for private key"));
        EcCurve theirs = EcCurve.fromKey(peerPublicKey)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported curve for peer key"));
        if (ours != theirs) {
            throw new IllegalArgumentException("Curve mismatch: " + ours + " vs " + theirs);
        }
        try {
            KeyAgreement agreement = KeyAgreement.getInstance("ECDH");
            agreement.init(privateKey);
            agreement.doPhase(peerPublicKey, true);
            return agreement.generateSecret();
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("ECDH failed", e);
        }
    }

    public static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }
}

package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.CoseAlgorithm;
import com.upokecenter.cbor.CBORObject;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CoseSign1
 * =============================================================================
 * Single-signer COSE structure (RFC 9052 section 4.2) as used by {@code issuerAuth},
 * {@code readerAuth} and {@code deviceSignature}.
 *
 * <p>The protected header is kept as the exact bytes received so that
 * verification hashes what the signer hashed. The payload may be detached
 * ({@code null} on the wire); the verifier then supplies it.</p>
 */
public final class CoseSign1
{
    private static final int COSE_SIGN1_TAG = 18;

    private final byte[] protectedHeader;
    private final CBORObject unprotectedHeader;
    private final byte[] payload;
    private final byte[] signature;

    private CoseSign1(byte[] protectedHeader, CBORObject unprotectedHeader, byte[] payload, byte[] signature) {
        this.protectedHeader = protectedHeader;
        this.unprotectedHeader = unprotectedHeader;
        this.payload = payload;
        this.signature = signature;
    }

    /**
     * Signs {@code payload}.
     *
     * @param detached when {@code true} the payload is not carried in the structure
     * @param x5chain  certificates for the unprotected header; may be empty
     */
    public static CoseSign1 sign(CoseSigner signer, byte[] payload, boolean detached, List<X509Certificate> x5chain) {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(x5chain, "x5chain");

        CBORObject protectedMap = MdocCbor.newMap();
        protectedMap.Add(CoseLabels.HEADER_ALG, signer.algorithm().identifier());
        byte[] protectedHeader = protectedMap.EncodeToBytes();

        CBORObject unprotected = MdocCbor.newMap();
        if (!x5chain.isEmpty()) {
            unprotected.Add(CoseLabels.HEADER_X5CHAIN, X5Chain.toCbor(x5chain));
        }

        byte[] signature = signer.sign(toBeSigned(protectedHeader, payload));
        return new CoseSign1(protectedHeader, unprotected, detached ? null : payload, signature);
    }

    public static CoseSign1 fromCbor(CBORObject item) {
        try {
            CBORObject array = item.HasMostOuterTag(COSE_SIGN1_TAG) ? item.UntagOne() : item;
            MdocCbor.requireArray(array, "COSE_Sign1");
            if (array.size() != 4) {
                throw new CoseException("COSE_Sign1 must have 4 elements, got " + array.size());
            }
            byte[] protectedHeader = MdocCbor.requireBytes(array.get(0), "COSE_Sign1 protected");
            CBORObject unprotected = MdocCbor.requireMap(array.get(1), "COSE_Sign1 unprotected");
            byte[] payload = array.get(2).isNull() ? null : MdocCbor.requireBytes(array.get(2), "COSE_Sign1 payload");
            byte[] signature = MdocCbor.requireBytes(array.get(3), "COSE_Sign1 signature");
            return new CoseSign1(protectedHeader, unprotected, payload, signature);
        } catch (CborStructureException e) {
            throw new CoseException("Malformed COSE_Sign1: " + e.getMessage(), e);
        }
    }

    public CBORObject toCbor() {
        CBORObject array = CBORObject.NewArray();
        array.Add(protectedHeader);
        array.Add(unprotectedHeader);
        array.Add(payload == null ? CBORObject.Null : CBORObject.FromObject(payload));
        array.Add(signature);
        return array;
    }

    public byte[] encode() {
        return toCbor().EncodeToBytes();
    }

    public Optional<byte[]> payload() {
        return Optional.ofNullable(payload);
    }

    public Optional<CoseAlgorithm> algorithm() {
        if (protectedHeader.length == 0) {
            return Optional.empty();
        }
        CBORObject alg = MdocCbor.decode(protectedHeader, "protected header").get(CBORObject.FromObject(CoseLabels.HEADER_ALG));
        if (alg == null) {
            return Optional.empty();
        }
        return CoseAlgorithm.fromIdentifier(MdocCbor.requireInt(alg, "alg"));
    }

    /** Certificates from the unprotected {@code x5chain} header, leaf first. */
    public List<X509Certificate> x5chain() {
        return X5Chain.fromCbor(unprotectedHeader.get(CBORObject.FromObject(CoseLabels.HEADER_X5CHAIN)));
    }

    /**
     * Verifies the signature.
     *
     * @param detachedPayload payload to use when the structure carries none; ignored otherwise
     * @return {@code false} for any signature mismatch, unsupported algorithm or missing payload
     */
    public boolean verify(PublicKey key, byte[] detachedPayload) {
        Objects.requireNonNull(key, "key");
        byte[] content = payload != null ? payload : detachedPayload;
        Optional<CoseAlgorithm> alg = algorithm();
        if (content == null || alg.isEmpty() || alg.get() == CoseAlgorithm.HMAC_256_256) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(alg.get().jcaName());
            verifier.initVerify(key);
            verifier.update(toBeSigned(protectedHeader, content));
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    private static byte[] toBeSigned(byte[] protectedHeader, byte[] payload) {
        CBORObject structure = CBORObject.NewArray();
        structure.Add("Signature1");
        structure.Add(protectedHeader);
        structure.Add(new byte[0]);
        structure.Add(payload);
        return structure.EncodeToBytes();
    }
}

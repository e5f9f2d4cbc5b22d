package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.CoseAlgorithm;
import com.upokecenter.cbor.CBORObject;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * COSE_Mac0 with HMAC 256/256, used for {@code deviceMac} authentication.
 * The payload is always detached.
 */
public final class CoseMac0
{
    private static final int COSE_MAC0_TAG = 17;

    private final byte[] protectedHeader;
    private final byte[] tag;

    private CoseMac0(byte[] protectedHeader, byte[] tag) {
        this.protectedHeader = protectedHeader;
        this.tag = tag;
    }

    public static CoseMac0 create(byte[] key, byte[] detachedPayload) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(detachedPayload, "detachedPayload");
        CBORObject protectedMap = MdocCbor.newMap();
        protectedMap.Add(CoseLabels.HEADER_ALG, CoseAlgorithm.HMAC_256_256.identifier());
        byte[] protectedHeader = protectedMap.EncodeToBytes();
        return new CoseMac0(protectedHeader, hmac(key, protectedHeader, detachedPayload));
    }

    public static CoseMac0 fromCbor(CBORObject item) {
        try {
            CBORObject array = item.HasMostOuterTag(COSE_MAC0_TAG) ? item.UntagOne() : item;
            MdocCbor.requireArray(array, "COSE_Mac0");
            if (array.size() != 4) {
                throw new CoseException("COSE_Mac0 must have 4 elements, got " + array.size());
            }
            byte[] protectedHeader = MdocCbor.requireBytes(array.get(0), "COSE_Mac0 protected");
            byte[] tag = MdocCbor.requireBytes(array.get(3), "COSE_Mac0 tag");
            return new CoseMac0(protectedHeader, tag);
        } catch (CborStructureException e) {
            throw new CoseException("Malformed COSE_Mac0: " + e.getMessage(), e);
        }
    }

    public CBORObject toCbor() {
        CBORObject array = CBORObject.NewArray();
        array.Add(protectedHeader);
        array.Add(MdocCbor.newMap());
        array.Add(CBORObject.Null);
        array.Add(tag);
        return array;
    }

    /** Constant-time comparison of the carried tag against one recomputed with {@code key}. */
    public boolean verify(byte[] key, byte[] detachedPayload) {
        return MessageDigest.isEqual(tag, hmac(key, protectedHeader, detachedPayload));
    }

    private static byte[] hmac(byte[] key, byte[] protectedHeader, byte[] payload) {
        CBORObject structure = CBORObject.NewArray();
        structure.Add("MAC0");
        structure.Add(protectedHeader);
        structure.Add(new byte[0]);
        structure.Add(payload);
        try {
            Mac mac = Mac.getInstance(CoseAlgorithm.HMAC_256_256.jcaName());
            mac.init(new SecretKeySpec(key, CoseAlgorithm.HMAC_256_256.jcaName()));
            return mac.doFinal(structure.EncodeToBytes());
        } catch (GeneralSecurityException e) {
            throw new CoseException("HMAC-SHA256 unavailable", e);
        }
    }
}

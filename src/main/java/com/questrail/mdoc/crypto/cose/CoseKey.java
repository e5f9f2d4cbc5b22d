package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.upokecenter.cbor.CBORObject;

import java.security.interfaces.ECPublicKey;
import java.util.Objects;

/**
 * COSE_Key encoding of EC2 public keys ({@code kty 2}, {@code crv}, {@code x}, {@code y}).
 */
public final class CoseKey
{
    private CoseKey() {}

    public static CBORObject toCbor(ECPublicKey key) {
        Objects.requireNonNull(key, "key");
        EcCurve curve = EcCurve.fromKey(key)
                .orElseThrow(() -> new CoseException("Unsupported curve for COSE_Key"));
        int size = curve.coordinateSize();
        CBORObject map = MdocCbor.newMap();
        map.Add(CoseLabels.KEY_KTY, CoseLabels.KTY_EC2);
        map.Add(CoseLabels.KEY_CRV, curve.coseCurveIdentifier());
        map.Add(CoseLabels.KEY_X, EcKeys.toFixedLength(key.getW().getAffineX(), size));
        map.Add(CoseLabels.KEY_Y, EcKeys.toFixedLength(key.getW().getAffineY(), size));
        return map;
    }

    public static byte[] encode(ECPublicKey key) {
        return toCbor(key).EncodeToBytes();
    }

    public static ECPublicKey decode(byte[] encoded) {
        return fromCbor(MdocCbor.decode(encoded, "COSE_Key"));
    }

    /**
     * @throws CoseException if the key is not an EC2 key on a supported curve
     */
    public static ECPublicKey fromCbor(CBORObject item) {
        try {
            int kty = MdocCbor.requireInt(MdocCbor.field(item, CoseLabels.KEY_KTY), "kty");
            if (kty != CoseLabels.KTY_EC2) {
                throw new CoseException("Unsupported COSE_Key kty " + kty);
            }
            int crv = MdocCbor.requireInt(MdocCbor.field(item, CoseLabels.KEY_CRV), "crv");
            EcCurve curve = EcCurve.fromCoseIdentifier(crv)
                    .orElseThrow(() -> new CoseException("Unsupported COSE_Key curve " + crv));
            byte[] x = MdocCbor.requireBytes(MdocCbor.field(item, CoseLabels.KEY_X), "x");
            byte[] y = MdocCbor.requireBytes(MdocCbor.field(item, CoseLabels.KEY_Y), "y");
            if (x.length != curve.coordinateSize() || y.length != curve.coordinateSize()) {
                throw new CoseException("COSE_Key coordinate length does not match " + curve);
            }
            return EcKeys.publicKey(curve, x, y);
        } catch (CborStructureException e) {
            throw new CoseException("Malformed COSE_Key: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CoseException("Invalid COSE_Key point", e);
        }
    }
}

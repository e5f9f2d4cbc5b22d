package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Hkdf;
import com.questrail.mdoc.crypto.cose.CoseKey;

import java.security.MessageDigest;
import java.security.interfaces.ECPublicKey;

/**
 * Value of the ident characteristic in central-client mode:
 * {@code HKDF-SHA256(#6.24(bstr .cbor EDeviceKey), salt = "", info = "BLEIdent", 16)}.
 */
public final class BleIdent
{
    public static final int LENGTH = 16;

    private BleIdent() {
    }

    public static byte[] compute(ECPublicKey eDeviceKey) {
        byte[] ikm = MdocCbor.encodeTag24(CoseKey.encode(eDeviceKey));
        return Hkdf.sha256(ikm, new byte[0], "BLEIdent", LENGTH);
    }

    public static boolean matches(byte[] ident, ECPublicKey eDeviceKey) {
        return ident != null && MessageDigest.isEqual(ident, compute(eDeviceKey));
    }
}

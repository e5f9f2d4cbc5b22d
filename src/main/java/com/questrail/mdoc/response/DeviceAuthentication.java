package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.Hkdf;
import com.questrail.mdoc.session.SessionTranscript;
import com.upokecenter.cbor.CBORObject;

/**
 * Device authentication inputs shared by generator and parser.
 *
 * <pre>
 * DeviceAuthenticationBytes = #6.24(bstr .cbor ["DeviceAuthentication",
 *     SessionTranscript, DocType, DeviceNameSpacesBytes])
 * EMacKey = HKDF-SHA256(ECDH(SDeviceKey, EReaderKey), SHA-256(SessionTranscriptBytes), "EMacKey", 32)
 * </pre>
 */
final class DeviceAuthentication
{
    private static final int EMAC_KEY_LENGTH = 32;

    private DeviceAuthentication() {
    }

    static byte[] bytes(byte[] sessionTranscript, String docType, byte[] encodedDeviceNamespaces) {
        CBORObject array = CBORObject.NewArray();
        array.Add("DeviceAuthentication");
        array.Add(MdocCbor.decode(sessionTranscript, "SessionTranscript"));
        array.Add(docType);
        array.Add(MdocCbor.tag24(encodedDeviceNamespaces));
        return MdocCbor.encodeTag24(array.EncodeToBytes());
    }

    static byte[] eMacKey(byte[] sharedSecret, byte[] sessionTranscript) {
        byte[] salt = Digests.SHA_256.digest(SessionTranscript.toSessionTranscriptBytes(sessionTranscript));
        return Hkdf.sha256(sharedSecret, salt, "EMacKey", EMAC_KEY_LENGTH);
    }
}

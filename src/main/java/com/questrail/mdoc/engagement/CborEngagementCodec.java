package com.questrail.mdoc.engagement;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.connectionmethod.ConnectionMethods;
import com.questrail.mdoc.crypto.cose.CoseException;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.upokecenter.cbor.CBORObject;

import java.security.interfaces.ECPublicKey;
import java.util.List;

/**
 * ISO 18013-5 engagement encoding:
 * <pre>
 * Engagement = {
 *   0: tstr,                          ; version
 *   1: [1, #6.24(bstr .cbor COSE_Key)], ; Security: cipher suite 1 + ephemeral key
 *   ? 2: [+ DeviceRetrievalMethod]
 * }
 * </pre>
 */
public final class CborEngagementCodec implements EngagementCodec
{
    static final int KEY_VERSION = 0;
    static final int KEY_SECURITY = 1;
    static final int KEY_DEVICE_RETRIEVAL_METHODS = 2;
    static final int CIPHER_SUITE_1 = 1;

    private static final int SUPPORTED_MAJOR_VERSION = 1;

    private record Decoded(String version, ECPublicKey key, List<ConnectionMethod> methods) {}

    @Override
    public byte[] encode(DeviceEngagement engagement) {
        return encode(engagement.version(), engagement.eDeviceKey(), engagement.connectionMethods());
    }

    @Override
    public DeviceEngagement decode(byte[] encoded) {
        Decoded d = decodeCommon(encoded, "device engagement");
        return new DeviceEngagement(d.version(), d.key(), d.methods());
    }

    @Override
    public byte[] encodeReaderEngagement(ReaderEngagement engagement) {
        return encode(engagement.version(), engagement.eReaderKey(), engagement.connectionMethods());
    }

    @Override
    public ReaderEngagement decodeReaderEngagement(byte[] encoded) {
        Decoded d = decodeCommon(encoded, "reader engagement");
        return new ReaderEngagement(d.version(), d.key(), d.methods());
    }

    private static byte[] encode(String version, ECPublicKey key, List<ConnectionMethod> methods) {
        CBORObject security = CBORObject.NewArray();
        security.Add(CIPHER_SUITE_1);
        security.Add(MdocCbor.tag24(CoseKey.encode(key)));

        CBORObject map = MdocCbor.newMap();
        map.Add(KEY_VERSION, version);
        map.Add(KEY_SECURITY, security);
        map.Add(KEY_DEVICE_RETRIEVAL_METHODS, ConnectionMethods.toCbor(methods));
        return map.EncodeToBytes();
    }

    private static Decoded decodeCommon(byte[] encoded, String what) {
        if (encoded == null || encoded.length == 0) {
            throw new EngagementParseException("Empty " + what);
        }
        try {
            CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, what), what);

            String version = MdocCbor.requireString(MdocCbor.field(map, KEY_VERSION), "version");
            checkVersion(version);

            CBORObject security = MdocCbor.optionalField(map, KEY_SECURITY);
            if (security == null) {
                throw new EngagementParseException(what + " carries no ephemeral key");
            }
            MdocCbor.requireArray(security, "Security");
            if (security.size() < 2) {
                throw new EngagementParseException(what + ": Security must be [cipherSuite, eKey]");
            }
            int cipherSuite = MdocCbor.requireInt(security.get(0), "cipherSuite");
            if (cipherSuite != CIPHER_SUITE_1) {
                throw new EngagementParseException(what + ": unsupported cipher suite " + cipherSuite);
            }
            ECPublicKey key = CoseKey.decode(MdocCbor.untag24(security.get(1), "eKey"));

            CBORObject methodsItem = MdocCbor.optionalField(map, KEY_DEVICE_RETRIEVAL_METHODS);
            List<ConnectionMethod> methods = methodsItem == null ? List.of() : ConnectionMethods.fromCbor(methodsItem);
            if (methods.isEmpty()) {
                throw new EngagementParseException(what + " lists no usable connection method");
            }
            return new Decoded(version, key, methods);
        } catch (CborStructureException | CoseException e) {
            throw new EngagementParseException("Malformed " + what + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new EngagementParseException("Invalid " + what + ": " + e.getMessage(), e);
        }
    }

    private static void checkVersion(String version) {
        int dot = version.indexOf('.');
        String major = dot < 0 ? version : version.substring(0, dot);
        try {
            if (Integer.parseInt(major) != SUPPORTED_MAJOR_VERSION) {
                throw new EngagementParseException("Unsupported engagement version " + version);
            }
        } catch (NumberFormatException e) {
            throw new EngagementParseException("Unparseable engagement version " + version, e);
        }
    }
}

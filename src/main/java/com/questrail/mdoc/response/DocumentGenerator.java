package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.cose.CoseMac0;
import com.questrail.mdoc.crypto.cose.CoseSign1;
import com.questrail.mdoc.securearea.SecureArea;
import com.upokecenter.cbor.CBORObject;

import java.security.interfaces.ECPublicKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DocumentGenerator
 * =============================================================================
 * Builds one mdoc {@code Document} for a {@code DeviceResponse}.
 *
 * <pre>
 * Document = {
 *   "docType": tstr,
 *   "issuerSigned": { ? "nameSpaces": { * tstr => [+ #6.24(bstr .cbor IssuerSignedItem)] }, "issuerAuth": COSE_Sign1 },
 *   "deviceSigned": { "nameSpaces": #6.24(bstr .cbor DeviceNameSpaces), "deviceAuth": DeviceAuth }
 * }
 * DeviceAuth = { "deviceSignature": COSE_Sign1 } / { "deviceMac": COSE_Mac0 }
 * </pre>
 *
 * <h2>Device authentication</h2>
 * Both forms authenticate {@code DeviceAuthenticationBytes} with the device key
 * held in a {@link SecureArea}. A signature uses it directly; a MAC uses the
 * {@code EMacKey} derived from ECDH between the device key and the reader's
 * ephemeral key.
 */
public final class DocumentGenerator
{
    private final String docType;
    private final byte[] issuerAuth;
    private final byte[] sessionTranscript;
    private IssuerNamespaces issuerNamespaces = IssuerNamespaces.of(Map.of());
    private Map<String, Map<String, CBORObject>> deviceNamespaces = Map.of();

    public DocumentGenerator(String docType, byte[] encodedIssuerAuth, byte[] sessionTranscript) {
        this.docType = Objects.requireNonNull(docType, "docType");
        this.issuerAuth = Objects.requireNonNull(encodedIssuerAuth, "encodedIssuerAuth").clone();
        this.sessionTranscript = Objects.requireNonNull(sessionTranscript, "sessionTranscript").clone();
    }

    public DocumentGenerator setIssuerNamespaces(IssuerNamespaces namespaces) {
        this.issuerNamespaces = Objects.requireNonNull(namespaces, "namespaces");
        return this;
    }

    public DocumentGenerator setDeviceNamespaces(Map<String, Map<String, CBORObject>> namespaces) {
        this.deviceNamespaces = new LinkedHashMap<>(Objects.requireNonNull(namespaces, "namespaces"));
        return this;
    }

    public byte[] generateWithSignature(SecureArea secureArea, String deviceKeyAlias) {
        byte[] deviceNs = encodeDeviceNamespaces();
        byte[] payload = DeviceAuthentication.bytes(sessionTranscript, docType, deviceNs);
        CoseSign1 signature = CoseSign1.sign(secureArea.signer(deviceKeyAlias), payload, true, List.of());
        CBORObject deviceAuth = MdocCbor.newMap();
        deviceAuth.Add("deviceSignature", signature.toCbor());
        return assemble(deviceNs, deviceAuth);
    }

    public byte[] generateWithMac(SecureArea secureArea, String deviceKeyAlias, ECPublicKey eReaderKey) {
        Objects.requireNonNull(eReaderKey, "eReaderKey");
        byte[] deviceNs = encodeDeviceNamespaces();
        byte[] payload = DeviceAuthentication.bytes(sessionTranscript, docType, deviceNs);
        byte[] sharedSecret = secureArea.keyAgreement(deviceKeyAlias, eReaderKey);
        CoseMac0 mac = CoseMac0.create(DeviceAuthentication.eMacKey(sharedSecret, sessionTranscript), payload);
        CBORObject deviceAuth = MdocCbor.newMap();
        deviceAuth.Add("deviceMac", mac.toCbor());
        return assemble(deviceNs, deviceAuth);
    }

    // -------------------------------------------------------------------------

    private byte[] encodeDeviceNamespaces() {
        CBORObject map = MdocCbor.newMap();
        deviceNamespaces.forEach((ns, elements) -> {
            CBORObject e = MdocCbor.newMap();
            elements.forEach(e::Add);
            map.Add(ns, e);
        });
        return map.EncodeToBytes();
    }

    private byte[] assemble(byte[] deviceNs, CBORObject deviceAuth)
    {
        CBORObject issuerSigned = MdocCbor.newMap();
        Map<String, List<byte[]>> items = issuerNamespaces.encodedItems();
        if (!items.isEmpty()) {
            CBORObject nameSpaces = MdocCbor.newMap();
            items.forEach((ns, encoded) -> {
                CBORObject array = CBORObject.NewArray();
                for (byte[] item : encoded) {
                    array.Add(MdocCbor.tag24(item));
                }
                nameSpaces.Add(ns, array);
            });
            issuerSigned.Add("nameSpaces", nameSpaces);
        }
        issuerSigned.Add("issuerAuth", MdocCbor.decode(issuerAuth, "issuerAuth"));

        CBORObject deviceSigned = MdocCbor.newMap();
        deviceSigned.Add("nameSpaces", MdocCbor.tag24(deviceNs));
        deviceSigned.Add("deviceAuth", deviceAuth);

        CBORObject document = MdocCbor.newMap();
        document.Add("docType", docType);
        document.Add("issuerSigned", issuerSigned);
        document.Add("deviceSigned", deviceSigned);
        return document.EncodeToBytes();
    }
}

package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseException;
import com.questrail.mdoc.crypto.cose.CoseMac0;
import com.questrail.mdoc.crypto.cose.CoseSign1;
import com.questrail.mdoc.model.MdocProtocolException;
import com.questrail.mdoc.zkp.ZkDocument;
import com.questrail.mdoc.zkp.ZkSystemRepository;
import com.upokecenter.cbor.CBORObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.X509Certificate;
import java.security.interfaces.ECPrivateKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DeviceResponseParser
 * =============================================================================
 * Reader-side parsing and verification of a {@code DeviceResponse}.
 *
 * <h2>Verification</h2>
 * Per mdoc document:
 * <ul>
 *   <li>issuerAuth is verified with the first certificate of its x5chain and its
 *       MSO docType must equal the document's;</li>
 *   <li>every issuer-signed item digest is recomputed and compared with the MSO;</li>
 *   <li>deviceSignature is verified with the MSO device key, or deviceMac with the
 *       EMacKey derived from the reader's ephemeral private key.</li>
 * </ul>
 * Outcomes are reported as flags on {@link MdocDocument}; only a response that
 * is not a {@code DeviceResponse} at all raises {@link CborStructureException}.
 * A document that cannot be decoded is logged and dropped. Certificate chain
 * trust is the caller's concern.
 *
 * <h2>ZK documents</h2>
 * Verified through a {@link ZkSystemRepository}; a missing backend or a failed
 * proof affects that document only.
 */
public final class DeviceResponseParser
{
    private static final Logger log = LoggerFactory.getLogger(DeviceResponseParser.class);

    private DeviceResponseParser() {
    }

    /**
     * @param eReaderKey     reader ephemeral private key, needed for deviceMac; may be {@code null}
     * @param zkSystems      backends for ZK documents; may be {@code null}
     * @throws CborStructureException if the bytes are not a DeviceResponse
     */
    public static DeviceResponse parse(byte[] encodedDeviceResponse,
                                       byte[] sessionTranscript,
                                       ECPrivateKey eReaderKey,
                                       ZkSystemRepository zkSystems) {
        Objects.requireNonNull(sessionTranscript, "sessionTranscript");
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encodedDeviceResponse, "DeviceResponse"), "DeviceResponse");
        String version = MdocCbor.requireString(MdocCbor.field(map, "version"), "version");
        int status = MdocCbor.requireInt(MdocCbor.field(map, "status"), "status");

        List<MdocDocument> documents = new ArrayList<>();
        List<VerifiedZkDocument> zkDocuments = new ArrayList<>();
        for (DocumentFormat format : DocumentFormat.values()) {
            CBORObject array = MdocCbor.optionalField(map, format.responseKey());
            if (array == null) {
                continue;
            }
            MdocCbor.requireArray(array, format.responseKey());
            for (int i = 0; i < array.size(); i++) {
                CBORObject item = array.get(i);
                try {
                    switch (format) {
                        case MDOC -> documents.add(parseDocument(item, sessionTranscript, eReaderKey));
                        case MDOC_ZK -> zkDocuments.add(parseZkDocument(item, sessionTranscript, zkSystems));
                    }
                } catch (MdocProtocolException | IllegalArgumentException e) {
                    log.warn("Dropping undecodable {} entry {}: {}", format, i, e.getMessage());
                }
            }
        }
        return new DeviceResponse(version, status, documents, zkDocuments);
    }

    // -------------------------------------------------------------------------
    // mdoc
    // -------------------------------------------------------------------------

    private static MdocDocument parseDocument(CBORObject item, byte[] sessionTranscript, ECPrivateKey eReaderKey) {
        CBORObject document = MdocCbor.requireMap(item, "Document");
        String docType = MdocCbor.requireString(MdocCbor.field(document, "docType"), "docType");
        CBORObject issuerSigned = MdocCbor.requireMap(MdocCbor.field(document, "issuerSigned"), "issuerSigned");
        CBORObject deviceSigned = MdocCbor.requireMap(MdocCbor.field(document, "deviceSigned"), "deviceSigned");

        CoseSign1 issuerAuth = CoseSign1.fromCbor(MdocCbor.field(issuerSigned, "issuerAuth"));
        List<X509Certificate> chain = issuerAuth.x5chain();
        byte[] msoBytes = MdocCbor.untag24(
                MdocCbor.decode(issuerAuth.payload()
                        .orElseThrow(() -> new CborStructureException("issuerAuth has no payload")), "MSO payload"),
                "MSO payload");
        MobileSecurityObject mso = MobileSecurityObject.decode(msoBytes);

        boolean issuerAuthenticated = !chain.isEmpty() && issuerAuth.verify(chain.get(0).getPublicKey(), null);
        if (!mso.docType().equals(docType)) {
            log.warn("MSO docType {} does not match document docType {}", mso.docType(), docType);
            issuerAuthenticated = false;
        }

        Map<String, Map<String, IssuerEntry>> issuerEntries = new LinkedHashMap<>();
        int digestFailures = 0;
        CBORObject nameSpaces = MdocCbor.optionalField(issuerSigned, "nameSpaces");
        if (nameSpaces != null) {
            MdocCbor.requireMap(nameSpaces, "issuerSigned nameSpaces");
            for (CBORObject nsKey : nameSpaces.getKeys()) {
                String ns = MdocCbor.requireString(nsKey, "namespace");
                CBORObject items = MdocCbor.requireArray(nameSpaces.get(nsKey), "IssuerSignedItems");
                Map<String, IssuerEntry> entries = new LinkedHashMap<>();
                for (int i = 0; i < items.size(); i++) {
                    byte[] encodedItem = MdocCbor.untag24(items.get(i), "IssuerSignedItemBytes");
                    IssuerSignedItem signedItem = IssuerSignedItem.decode(encodedItem);
                    boolean match = mso.digestMatches(ns, signedItem.digestId(),
                            IssuerSignedItem.digest(mso.digestAlgorithm(), encodedItem));
                    if (!match) {
                        digestFailures++;
                    }
                    entries.put(signedItem.elementIdentifier(), new IssuerEntry(signedItem.elementValue(), match));
                }
                issuerEntries.put(ns, entries);
            }
        }

        byte[] deviceNsBytes = MdocCbor.untag24(MdocCbor.field(deviceSigned, "nameSpaces"), "DeviceNameSpacesBytes");
        Map<String, Map<String, CBORObject>> deviceEntries = decodeDeviceNamespaces(deviceNsBytes);
        byte[] deviceAuthBytes = DeviceAuthentication.bytes(sessionTranscript, docType, deviceNsBytes);

        CBORObject deviceAuth = MdocCbor.requireMap(MdocCbor.field(deviceSigned, "deviceAuth"), "deviceAuth");
        CBORObject signature = MdocCbor.optionalField(deviceAuth, "deviceSignature");
        CBORObject mac = MdocCbor.optionalField(deviceAuth, "deviceMac");
        boolean deviceAuthenticated;
        boolean withMac = false;
        if (signature != null) {
            deviceAuthenticated = CoseSign1.fromCbor(signature).verify(mso.deviceKey(), deviceAuthBytes);
        } else if (mac != null) {
            withMac = true;
            deviceAuthenticated = verifyMac(CoseMac0.fromCbor(mac), mso, eReaderKey, sessionTranscript, deviceAuthBytes);
        } else {
            throw new CborStructureException("deviceAuth has neither deviceSignature nor deviceMac");
        }

        if (!issuerAuthenticated || !deviceAuthenticated || digestFailures > 0) {
            log.info("Document {} verification: issuer={} device={} digestFailures={}",
                    docType, issuerAuthenticated, deviceAuthenticated, digestFailures);
        }
        return new MdocDocument(docType, mso.validityInfo(), mso.deviceKey(), chain, issuerEntries, deviceEntries,
                issuerAuthenticated, deviceAuthenticated, withMac, digestFailures);
    }

    private static boolean verifyMac(CoseMac0 mac, MobileSecurityObject mso, ECPrivateKey eReaderKey,
                                     byte[] sessionTranscript, byte[] deviceAuthBytes) {
        if (eReaderKey == null) {
            log.warn("deviceMac present but no reader ephemeral key supplied");
            return false;
        }
        byte[] sharedSecret;
        try {
            sharedSecret = EcKeys.keyAgreement(eReaderKey, mso.deviceKey());
        } catch (IllegalArgumentException e) {
            log.warn("Cannot derive EMacKey: {}", e.getMessage());
            return false;
        }
        return mac.verify(DeviceAuthentication.eMacKey(sharedSecret, sessionTranscript), deviceAuthBytes);
    }

    private static Map<String, Map<String, CBORObject>> decodeDeviceNamespaces(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "DeviceNameSpaces"), "DeviceNameSpaces");
        Map<String, Map<String, CBORObject>> result = new LinkedHashMap<>();
        for (CBORObject nsKey : map.getKeys()) {
            CBORObject elements = MdocCbor.requireMap(map.get(nsKey), "DeviceSignedItems");
            Map<String, CBORObject> values = new LinkedHashMap<>();
            for (CBORObject element : elements.getKeys()) {
                values.put(MdocCbor.requireString(element, "elementIdentifier"), elements.get(element));
            }
            result.put(MdocCbor.requireString(nsKey, "namespace"), values);
        }
        return result;
    }

    // -------------------------------------------------------------------------
    // ZK
    // -------------------------------------------------------------------------

    private static VerifiedZkDocument parseZkDocument(CBORObject item, byte[] sessionTranscript,
                                                      ZkSystemRepository zkSystems) {
        ZkDocument document = ZkDocument.fromCbor(item);
        if (zkSystems == null) {
            return new VerifiedZkDocument(document, false, "No ZK systems configured");
        }
        try {
            zkSystems.verify(document, sessionTranscript);
            return new VerifiedZkDocument(document, true, null);
        } catch (MdocProtocolException e) {
            log.warn("ZK proof for {} not accepted: {}", document.documentData().docType(), e.getMessage());
            return new VerifiedZkDocument(document, false, e.getMessage());
        }
    }
}

package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.crypto.cose.CoseSign1;
import com.questrail.mdoc.crypto.cose.CoseSigner;
import com.upokecenter.cbor.CBORObject;

import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds and signs a {@code MobileSecurityObject}. Used by issuers, and by tests
 * acting as one.
 */
public final class MobileSecurityObjectGenerator
{
    public static final String VERSION = "1.0";

    private final Digests digestAlgorithm;
    private final String docType;
    private final ECPublicKey deviceKey;
    private final Map<String, Map<Long, byte[]>> valueDigests = new LinkedHashMap<>();
    private ValidityInfo validityInfo;

    public MobileSecurityObjectGenerator(Digests digestAlgorithm, String docType, ECPublicKey deviceKey) {
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
        this.docType = Objects.requireNonNull(docType, "docType");
        this.deviceKey = Objects.requireNonNull(deviceKey, "deviceKey");
    }

    public MobileSecurityObjectGenerator addDigestIdsForNamespace(String namespace, Map<Long, byte[]> digests) {
        if (digests.isEmpty()) {
            throw new IllegalArgumentException("No digests for namespace " + namespace);
        }
        valueDigests.put(namespace, new LinkedHashMap<>(digests));
        return this;
    }

    /** Adds the digests of every element in {@code namespaces}. */
    public MobileSecurityObjectGenerator addIssuerNamespaces(IssuerNamespaces namespaces) {
        namespaces.digests(digestAlgorithm).forEach(this::addDigestIdsForNamespace);
        return this;
    }

    public MobileSecurityObjectGenerator setValidityInfo(ValidityInfo validityInfo) {
        this.validityInfo = Objects.requireNonNull(validityInfo, "validityInfo");
        return this;
    }

    public byte[] generate() {
        if (valueDigests.isEmpty()) {
            throw new IllegalStateException("No value digests");
        }
        if (validityInfo == null) {
            throw new IllegalStateException("No validity info");
        }
        CBORObject map = MdocCbor.newMap();
        map.Add("version", VERSION);
        map.Add("digestAlgorithm", digestAlgorithm.isoName());
        CBORObject digests = MdocCbor.newMap();
        valueDigests.forEach((ns, ids) -> {
            CBORObject m = MdocCbor.newMap();
            ids.forEach(m::Add);
            digests.Add(ns, m);
        });
        map.Add("valueDigests", digests);
        CBORObject deviceKeyInfo = MdocCbor.newMap();
        deviceKeyInfo.Add("deviceKey", CoseKey.toCbor(deviceKey));
        map.Add("deviceKeyInfo", deviceKeyInfo);
        map.Add("docType", docType);
        CBORObject validity = MdocCbor.newMap();
        validity.Add("signed", MdocCbor.tdate(validityInfo.signed()));
        validity.Add("validFrom", MdocCbor.tdate(validityInfo.validFrom()));
        validity.Add("validUntil", MdocCbor.tdate(validityInfo.validUntil()));
        if (validityInfo.expectedUpdate() != null) {
            validity.Add("expectedUpdate", MdocCbor.tdate(validityInfo.expectedUpdate()));
        }
        map.Add("validityInfo", validity);
        return map.EncodeToBytes();
    }

    /**
     * Signs the MSO into an encoded {@code issuerAuth}: a COSE_Sign1 whose payload is
     * {@code #6.24(bstr .cbor MobileSecurityObject)} and whose x5chain is the issuer chain.
     */
    public static byte[] signIssuerAuth(byte[] encodedMso, CoseSigner issuerKey, List<X509Certificate> issuerChain) {
        return CoseSign1.sign(issuerKey, MdocCbor.encodeTag24(encodedMso), false, issuerChain).encode();
    }
}

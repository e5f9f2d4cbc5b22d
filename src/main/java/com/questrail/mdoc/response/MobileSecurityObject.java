package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.upokecenter.cbor.CBORObject;

import java.security.interfaces.ECPublicKey;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded {@code MobileSecurityObject}, the payload of issuerAuth.
 *
 * <pre>
 * MobileSecurityObject = {
 *   "version": tstr, "digestAlgorithm": tstr,
 *   "valueDigests": { * tstr => { * uint => bstr } },
 *   "deviceKeyInfo": { "deviceKey": COSE_Key },
 *   "docType": tstr,
 *   "validityInfo": { "signed": tdate, "validFrom": tdate, "validUntil": tdate, ? "expectedUpdate": tdate }
 * }
 * </pre>
 */
public record MobileSecurityObject(
    String version,
    Digests digestAlgorithm,
    Map<String, Map<Long, byte[]>> valueDigests,
    ECPublicKey deviceKey,
    String docType,
    ValidityInfo validityInfo
) {
    public Optional<byte[]> digest(String namespace, long digestId) {
        Map<Long, byte[]> digests = valueDigests.get(namespace);
        return digests == null ? Optional.empty() : Optional.ofNullable(digests.get(digestId));
    }

    public boolean digestMatches(String namespace, long digestId, byte[] digest) {
        return digest(namespace, digestId).map(d -> Arrays.equals(d, digest)).orElse(false);
    }

    /**
     * @throws CborStructureException if the bytes are not a well-formed MSO
     */
    public static MobileSecurityObject decode(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "MobileSecurityObject"), "MobileSecurityObject");
        String algorithmName = MdocCbor.requireString(MdocCbor.field(map, "digestAlgorithm"), "digestAlgorithm");
        Digests algorithm = Digests.fromIsoName(algorithmName)
                .orElseThrow(() -> new CborStructureException("Unsupported digest algorithm " + algorithmName));

        Map<String, Map<Long, byte[]>> valueDigests = new LinkedHashMap<>();
        CBORObject digestsMap = MdocCbor.requireMap(MdocCbor.field(map, "valueDigests"), "valueDigests");
        for (CBORObject ns : digestsMap.getKeys()) {
            CBORObject ids = MdocCbor.requireMap(digestsMap.get(ns), "valueDigests namespace");
            Map<Long, byte[]> digests = new LinkedHashMap<>();
            for (CBORObject id : ids.getKeys()) {
                digests.put(MdocCbor.requireLong(id, "digestID"), MdocCbor.requireBytes(ids.get(id), "digest"));
            }
            valueDigests.put(MdocCbor.requireString(ns, "namespace"), digests);
        }

        CBORObject deviceKeyInfo = MdocCbor.requireMap(MdocCbor.field(map, "deviceKeyInfo"), "deviceKeyInfo");
        ECPublicKey deviceKey = CoseKey.fromCbor(MdocCbor.field(deviceKeyInfo, "deviceKey"));

        CBORObject validity = MdocCbor.requireMap(MdocCbor.field(map, "validityInfo"), "validityInfo");
        CBORObject expected = MdocCbor.optionalField(validity, "expectedUpdate");
        ValidityInfo validityInfo = new ValidityInfo(
                MdocCbor.requireTdate(MdocCbor.field(validity, "signed"), "signed"),
                MdocCbor.requireTdate(MdocCbor.field(validity, "validFrom"), "validFrom"),
                MdocCbor.requireTdate(MdocCbor.field(validity, "validUntil"), "validUntil"),
                expected == null ? null : MdocCbor.requireTdate(expected, "expectedUpdate"));

        return new MobileSecurityObject(
                MdocCbor.requireString(MdocCbor.field(map, "version"), "version"),
                algorithm,
                valueDigests,
                deviceKey,
                MdocCbor.requireString(MdocCbor.field(map, "docType"), "docType"),
                validityInfo);
    }
}

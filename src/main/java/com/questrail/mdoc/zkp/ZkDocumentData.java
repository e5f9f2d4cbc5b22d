package com.questrail.mdoc.zkp;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.cose.X5Chain;
import com.upokecenter.cbor.CBORObject;

import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The disclosed part of a document presented with a zero-knowledge proof.
 *
 * <pre>
 * ZkDocumentData = {
 *   "id": tstr,                                  ; ZkSystemSpec id
 *   "docType": tstr,
 *   "timestamp": tdate,
 *   "issuerSigned": { * tstr => { * tstr => any } },
 *   ? "msoX5chain": COSE_X509
 * }
 * </pre>
 */
public record ZkDocumentData(
    String zkSystemSpecId,
    String docType,
    Instant timestamp,
    Map<String, Map<String, CBORObject>> issuerSigned,
    List<X509Certificate> msoX5chain
) {
    public ZkDocumentData {
        Objects.requireNonNull(zkSystemSpecId, "zkSystemSpecId");
        Objects.requireNonNull(docType, "docType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(issuerSigned, "issuerSigned");
        msoX5chain = msoX5chain == null ? List.of() : List.copyOf(msoX5chain);
        Map<String, Map<String, CBORObject>> copy = new LinkedHashMap<>();
        issuerSigned.forEach((ns, values) -> copy.put(ns, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        issuerSigned = Collections.unmodifiableMap(copy);
    }

    public byte[] encode() {
        CBORObject map = MdocCbor.newMap();
        map.Add("id", zkSystemSpecId);
        map.Add("docType", docType);
        map.Add("timestamp", MdocCbor.tdate(timestamp));
        CBORObject namespaces = MdocCbor.newMap();
        issuerSigned.forEach((ns, values) -> {
            CBORObject elements = MdocCbor.newMap();
            values.forEach(elements::Add);
            namespaces.Add(ns, elements);
        });
        map.Add("issuerSigned", namespaces);
        if (!msoX5chain.isEmpty()) {
            map.Add("msoX5chain", X5Chain.toCbor(msoX5chain));
        }
        return map.EncodeToBytes();
    }

    public static ZkDocumentData decode(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "ZkDocumentData"), "ZkDocumentData");
        Map<String, Map<String, CBORObject>> issuerSigned = new LinkedHashMap<>();
        CBORObject namespaces = MdocCbor.requireMap(MdocCbor.field(map, "issuerSigned"), "issuerSigned");
        for (CBORObject ns : namespaces.getKeys()) {
            CBORObject elements = MdocCbor.requireMap(namespaces.get(ns), "issuerSigned namespace");
            Map<String, CBORObject> values = new LinkedHashMap<>();
            for (CBORObject element : elements.getKeys()) {
                values.put(MdocCbor.requireString(element, "element identifier"), elements.get(element));
            }
            issuerSigned.put(MdocCbor.requireString(ns, "namespace"), values);
        }
        CBORObject chain = MdocCbor.optionalField(map, "msoX5chain");
        return new ZkDocumentData(
                MdocCbor.requireString(MdocCbor.field(map, "id"), "id"),
                MdocCbor.requireString(MdocCbor.field(map, "docType"), "docType"),
                MdocCbor.requireTdate(MdocCbor.field(map, "timestamp"), "timestamp"),
                issuerSigned,
                chain == null ? List.of() : X5Chain.fromCbor(chain));
    }
}

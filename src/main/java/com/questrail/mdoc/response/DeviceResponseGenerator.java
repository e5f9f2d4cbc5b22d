package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.zkp.ZkDocument;
import com.upokecenter.cbor.CBORObject;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@code DeviceResponse}.
 *
 * <pre>
 * DeviceResponse = { "version": "1.0", ? "documents": [+ Document], ? "zkDocuments": [+ ZkDocument], "status": uint }
 * </pre>
 *
 * <p>Document arrays are only emitted when non-empty.</p>
 */
public final class DeviceResponseGenerator
{
    public static final String VERSION = "1.0";

    public static final int STATUS_OK = 0;
    public static final int STATUS_GENERAL_ERROR = 10;
    public static final int STATUS_CBOR_DECODING_ERROR = 11;
    public static final int STATUS_CBOR_VALIDATION_ERROR = 12;

    private final int status;
    private final Map<DocumentFormat, List<CBORObject>> documents = new EnumMap<>(DocumentFormat.class);

    public DeviceResponseGenerator(int status) {
        this.status = status;
    }

    public DeviceResponseGenerator addDocument(byte[] encodedDocument) {
        Objects.requireNonNull(encodedDocument, "encodedDocument");
        return add(DocumentFormat.MDOC, MdocCbor.decode(encodedDocument, "Document"));
    }

    public DeviceResponseGenerator addZkDocument(ZkDocument document) {
        Objects.requireNonNull(document, "document");
        return add(DocumentFormat.MDOC_ZK, document.toCbor());
    }

    public byte[] generate() {
        CBORObject map = MdocCbor.newMap();
        map.Add("version", VERSION);
        for (DocumentFormat format : DocumentFormat.values()) {
            List<CBORObject> docs = documents.get(format);
            if (docs == null || docs.isEmpty()) {
                continue;
            }
            CBORObject array = CBORObject.NewArray();
            docs.forEach(array::Add);
            map.Add(format.responseKey(), array);
        }
        map.Add("status", status);
        return map.EncodeToBytes();
    }

    private DeviceResponseGenerator add(DocumentFormat format, CBORObject document) {
        documents.computeIfAbsent(format, f -> new ArrayList<>()).add(document);
        return this;
    }
}

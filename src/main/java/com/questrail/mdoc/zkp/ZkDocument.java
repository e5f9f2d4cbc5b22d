package com.questrail.mdoc.zkp;

import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORObject;

import java.util.Objects;

/**
 * A document presented as disclosed data plus a proof over it.
 *
 * <pre>
 * ZkDocument = { "documentData": #6.24(bstr .cbor ZkDocumentData), "proof": bstr }
 * </pre>
 *
 * <p>The encoded document data is kept verbatim; proofs are checked against
 * these bytes, not a re-encoding.</p>
 */
public final class ZkDocument
{
    private final ZkDocumentData documentData;
    private final byte[] encodedDocumentData;
    private final byte[] proof;

    private ZkDocument(ZkDocumentData documentData, byte[] encodedDocumentData, byte[] proof) {
        this.documentData = documentData;
        this.encodedDocumentData = encodedDocumentData;
        this.proof = proof;
    }

    public static ZkDocument of(ZkDocumentData documentData, byte[] proof) {
        Objects.requireNonNull(documentData, "documentData");
        Objects.requireNonNull(proof, "proof");
        return new ZkDocument(documentData, documentData.encode(), proof.clone());
    }

    public ZkDocumentData documentData() {
        return documentData;
    }

    public byte[] encodedDocumentData() {
        return encodedDocumentData.clone();
    }

    public byte[] proof() {
        return proof.clone();
    }

    public CBORObject toCbor() {
        CBORObject map = MdocCbor.newMap();
        map.Add("documentData", MdocCbor.tag24(encodedDocumentData));
        map.Add("proof", proof);
        return map;
    }

    public static ZkDocument fromCbor(CBORObject item) {
        CBORObject map = MdocCbor.requireMap(item, "ZkDocument");
        byte[] encoded = MdocCbor.untag24(MdocCbor.field(map, "documentData"), "documentData");
        byte[] proof = MdocCbor.requireBytes(MdocCbor.field(map, "proof"), "proof");
        return new ZkDocument(ZkDocumentData.decode(encoded), encoded, proof);
    }
}

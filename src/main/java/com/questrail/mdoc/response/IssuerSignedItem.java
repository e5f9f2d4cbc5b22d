package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Digests;
import com.upokecenter.cbor.CBORObject;

import java.util.Objects;

/**
 * One issuer-signed data element.
 *
 * <pre>
 * IssuerSignedItem = { "digestID": uint, "random": bstr, "elementIdentifier": tstr, "elementValue": any }
 * </pre>
 *
 * <p>The MSO digest is taken over {@code #6.24(bstr .cbor IssuerSignedItem)},
 * i.e. over the exact bytes carried in the response.</p>
 */
public record IssuerSignedItem(long digestId, byte[] random, String elementIdentifier, CBORObject elementValue)
{
    public IssuerSignedItem {
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(elementIdentifier, "elementIdentifier");
        Objects.requireNonNull(elementValue, "elementValue");
        if (digestId < 0) {
            throw new IllegalArgumentException("digestID must be non-negative");
        }
    }

    public byte[] encode() {
        CBORObject map = MdocCbor.newMap();
        map.Add("digestID", digestId);
        map.Add("random", random);
        map.Add("elementIdentifier", elementIdentifier);
        map.Add("elementValue", elementValue);
        return map.EncodeToBytes();
    }

    public static IssuerSignedItem decode(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "IssuerSignedItem"), "IssuerSignedItem");
        return new IssuerSignedItem(
                MdocCbor.requireLong(MdocCbor.field(map, "digestID"), "digestID"),
                MdocCbor.requireBytes(MdocCbor.field(map, "random"), "random"),
                MdocCbor.requireString(MdocCbor.field(map, "elementIdentifier"), "elementIdentifier"),
                MdocCbor.field(map, "elementValue"));
    }

    /** Digest of an encoded item as it appears in the MSO value digests. */
    public static byte[] digest(Digests algorithm, byte[] encodedItem) {
        return algorithm.digest(MdocCbor.encodeTag24(encodedItem));
    }
}

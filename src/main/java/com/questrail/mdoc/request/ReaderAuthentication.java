package com.questrail.mdoc.request;

import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORObject;

/**
 * {@code ReaderAuthenticationBytes = #6.24(bstr .cbor ["ReaderAuthentication",
 * SessionTranscript, ItemsRequestBytes])}, the detached payload of readerAuth.
 */
final class ReaderAuthentication
{
    private ReaderAuthentication() {
    }

    static byte[] bytes(byte[] sessionTranscript, byte[] itemsRequest) {
        CBORObject array = CBORObject.NewArray();
        array.Add("ReaderAuthentication");
        array.Add(MdocCbor.decode(sessionTranscript, "SessionTranscript"));
        array.Add(MdocCbor.tag24(itemsRequest));
        return MdocCbor.encodeTag24(array.EncodeToBytes());
    }
}

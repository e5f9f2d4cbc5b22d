package com.questrail.mdoc.request;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.cose.CoseSign1;
import com.questrail.mdoc.crypto.cose.CoseSigner;
import com.upokecenter.cbor.CBORObject;

import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * DeviceRequestGenerator
 * =============================================================================
 * Builds the reader's {@code DeviceRequest}.
 *
 * <pre>
 * DeviceRequest = { "version": "1.0", "docRequests": [+ DocRequest] }
 * DocRequest    = { "itemsRequest": #6.24(bstr .cbor ItemsRequest), ? "readerAuth": COSE_Sign1 }
 * </pre>
 *
 * <p>When a reader key is given, {@code readerAuth} is a COSE_Sign1 with detached
 * payload {@code ReaderAuthenticationBytes} and the reader certificate chain in
 * the {@code x5chain} header.</p>
 */
public final class DeviceRequestGenerator
{
    public static final String VERSION = "1.0";

    private final byte[] sessionTranscript;
    private final CBORObject docRequests = CBORObject.NewArray();

    public DeviceRequestGenerator(byte[] sessionTranscript) {
        this.sessionTranscript = Objects.requireNonNull(sessionTranscript, "sessionTranscript").clone();
    }

    /**
     * @param readerKey       signer for readerAuth, or {@code null} for an unauthenticated request
     * @param readerCertChain chain placed in x5chain; ignored without {@code readerKey}
     */
    public DeviceRequestGenerator addDocumentRequest(DocRequest request,
                                                     CoseSigner readerKey,
                                                     List<X509Certificate> readerCertChain) {
        Objects.requireNonNull(request, "request");
        byte[] itemsRequest = request.toItemsRequest().EncodeToBytes();
        CBORObject docRequest = MdocCbor.newMap();
        docRequest.Add("itemsRequest", MdocCbor.tag24(itemsRequest));
        if (readerKey != null) {
            byte[] payload = ReaderAuthentication.bytes(sessionTranscript, itemsRequest);
            CoseSign1 readerAuth = CoseSign1.sign(readerKey, payload, true,
                    readerCertChain == null ? List.of() : readerCertChain);
            docRequest.Add("readerAuth", readerAuth.toCbor());
        }
        docRequests.Add(docRequest);
        return this;
    }

    public byte[] generate() {
        if (docRequests.size() == 0) {
            throw new IllegalStateException("DeviceRequest needs at least one document request");
        }
        CBORObject map = MdocCbor.newMap();
        map.Add("version", VERSION);
        map.Add("docRequests", docRequests);
        return map.EncodeToBytes();
    }

    /**
     * One-shot form: every document request is signed with the same reader key, if any.
     */
    public static byte[] generateRequest(byte[] sessionTranscript,
                                         List<DocRequest> docRequests,
                                         CoseSigner readerKey,
                                         List<X509Certificate> readerCertChain) {
        DeviceRequestGenerator generator = new DeviceRequestGenerator(sessionTranscript);
        for (DocRequest request : docRequests) {
            generator.addDocumentRequest(request, readerKey, readerCertChain);
        }
        return generator.generate();
    }
}

package com.questrail.mdoc.request;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.cose.CoseException;
import com.questrail.mdoc.crypto.cose.CoseSign1;
import com.upokecenter.cbor.CBORObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Holder-side parsing of a {@code DeviceRequest}.
 *
 * <p>Structural problems fail the whole request with {@link CborStructureException}.
 * A readerAuth that does not verify only clears
 * {@link ParsedDocRequest#readerAuthenticated()}; what to do about it is the
 * holder's policy.</p>
 */
public final class DeviceRequestParser
{
    private static final Logger log = LoggerFactory.getLogger(DeviceRequestParser.class);

    private DeviceRequestParser() {
    }

    public record ParsedDeviceRequest(String version, List<ParsedDocRequest> docRequests) {
        public ParsedDeviceRequest {
            docRequests = List.copyOf(docRequests);
        }
    }

    public record ParsedDocRequest(
        DocRequest request,
        List<X509Certificate> readerCertChain,
        boolean readerAuthenticated
    ) {
        public ParsedDocRequest {
            readerCertChain = List.copyOf(readerCertChain);
        }
    }

    /**
     * @throws CborStructureException if the request is malformed or of an unsupported version
     */
    public static ParsedDeviceRequest parse(byte[] encodedDeviceRequest, byte[] sessionTranscript) {
        Objects.requireNonNull(sessionTranscript, "sessionTranscript");
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encodedDeviceRequest, "DeviceRequest"), "DeviceRequest");
        String version = MdocCbor.requireString(MdocCbor.field(map, "version"), "version");
        if (!version.startsWith("1.")) {
            throw new CborStructureException("Unsupported DeviceRequest version " + version);
        }
        CBORObject array = MdocCbor.requireArray(MdocCbor.field(map, "docRequests"), "docRequests");
        List<ParsedDocRequest> parsed = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            CBORObject docRequest = MdocCbor.requireMap(array.get(i), "DocRequest");
            byte[] itemsRequest = MdocCbor.untag24(MdocCbor.field(docRequest, "itemsRequest"), "itemsRequest");
            DocRequest request = DocRequest.fromItemsRequest(MdocCbor.decode(itemsRequest, "ItemsRequest"));

            List<X509Certificate> chain = List.of();
            boolean authenticated = false;
            CBORObject readerAuth = MdocCbor.optionalField(docRequest, "readerAuth");
            if (readerAuth != null) {
                try {
                    CoseSign1 sign1 = CoseSign1.fromCbor(readerAuth);
                    chain = sign1.x5chain();
                    authenticated = !chain.isEmpty() && sign1.verify(chain.get(0).getPublicKey(),
                            ReaderAuthentication.bytes(sessionTranscript, itemsRequest));
                } catch (CoseException e) {
                    log.warn("Ignoring malformed readerAuth for {}: {}", request.docType(), e.getMessage());
                }
                if (!authenticated) {
                    log.warn("readerAuth for {} did not verify", request.docType());
                }
            }
            parsed.add(new ParsedDocRequest(request, chain, authenticated));
        }
        return new ParsedDeviceRequest(version, parsed);
    }
}

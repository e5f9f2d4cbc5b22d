package com.questrail.mdoc.presentment;

import com.questrail.mdoc.request.DeviceRequestParser.ParsedDeviceRequest;
import com.questrail.mdoc.request.DeviceRequestParser.ParsedDocRequest;
import com.questrail.mdoc.request.DocRequest;
import com.questrail.mdoc.response.DeviceResponseGenerator;
import com.questrail.mdoc.response.DocumentGenerator;
import com.questrail.mdoc.zkp.ZkSystem;
import com.questrail.mdoc.zkp.ZkSystemRepository;
import com.questrail.mdoc.zkp.ZkSystemSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.interfaces.ECPublicKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Answers a parsed request from the holder's credentials.
 *
 * <p>Each document request is served by the first credential of the same docType,
 * disclosing only the requested elements. When the reader accepts a proof system
 * the holder also supports, the document is presented as a ZK document instead.
 * Requests that cannot be served are left out of the response.</p>
 */
final class ResponseComposer
{
    private static final Logger log = LoggerFactory.getLogger(ResponseComposer.class);

    private final List<MdocCredential> credentials;
    private final ZkSystemRepository zkSystems;
    private final boolean deviceMac;

    ResponseComposer(List<MdocCredential> credentials, ZkSystemRepository zkSystems, boolean deviceMac) {
        this.credentials = List.copyOf(credentials);
        this.zkSystems = zkSystems;
        this.deviceMac = deviceMac;
    }

    byte[] compose(ParsedDeviceRequest request, byte[] sessionTranscript, ECPublicKey eReaderKey) {
        DeviceResponseGenerator generator = new DeviceResponseGenerator(DeviceResponseGenerator.STATUS_OK);
        for (ParsedDocRequest parsed : request.docRequests()) {
            DocRequest docRequest = parsed.request();
            Optional<MdocCredential> credential = credentials.stream()
                    .filter(c -> c.docType().equals(docRequest.docType()))
                    .findFirst();
            if (credential.isEmpty()) {
                log.info("No credential for requested docType {}", docRequest.docType());
                continue;
            }
            byte[] document = generateDocument(credential.get(), docRequest, sessionTranscript, eReaderKey);

            Optional<ZkSystemSpec> zkSpec = docRequest.hasZkRequest() && zkSystems != null
                    ? zkSystems.findMatchingSpec(docRequest.zkSystemSpecs())
                    : Optional.empty();
            if (zkSpec.isPresent()) {
                ZkSystem system = zkSystems.lookup(zkSpec.get().system()).orElseThrow();
                generator.addZkDocument(system.generateProof(zkSpec.get(), document, sessionTranscript, Instant.now()));
            } else if (docRequest.zkRequired()) {
                log.info("Reader requires a proof system we do not support for {}", docRequest.docType());
            } else {
                generator.addDocument(document);
            }
        }
        return generator.generate();
    }

    private byte[] generateDocument(MdocCredential credential, DocRequest request,
                                    byte[] sessionTranscript, ECPublicKey eReaderKey) {
        DocumentGenerator generator = new DocumentGenerator(
                credential.docType(), credential.encodedIssuerAuth(), sessionTranscript)
                .setIssuerNamespaces(credential.issuerNamespaces().filter(request.namespaces()));
        if (deviceMac) {
            return generator.generateWithMac(credential.secureArea(), credential.deviceKeyAlias(), eReaderKey);
        }
        return generator.generateWithSignature(credential.secureArea(), credential.deviceKeyAlias());
    }
}

package com.questrail.mdoc.response;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.zkp.FakeZkSystem;
import com.questrail.mdoc.zkp.ZkDocument;
import com.questrail.mdoc.zkp.ZkSystemRepository;
import com.upokecenter.cbor.CBORObject;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DeviceResponseTest
{
    private static final TestCredentials CREDENTIALS = new TestCredentials();
    private static final String NS = TestCredentials.NAMESPACE;

    private final KeyPair eReaderKey = EcKeys.generateKeyPair(EcCurve.P256);
    private final byte[] transcript = TestCredentials.sessionTranscript((ECPublicKey) eReaderKey.getPublic());

    private DocumentGenerator generator(IssuerNamespaces namespaces) {
        return new DocumentGenerator(TestCredentials.DOC_TYPE, CREDENTIALS.encodedIssuerAuth(), transcript)
                .setIssuerNamespaces(namespaces);
    }

    private byte[] signedDocument() {
        return generator(CREDENTIALS.issuerNamespaces())
                .generateWithSignature(CREDENTIALS.secureArea(), TestCredentials.DEVICE_KEY_ALIAS);
    }

    private DeviceResponse parse(byte[] response) {
        return DeviceResponseParser.parse(response, transcript, (ECPrivateKey) eReaderKey.getPrivate(), null);
    }

    // ---------------------------------------------------------------------
    // mdoc documents
    // ---------------------------------------------------------------------

    @Test
    void signedDocumentVerifiesCompletely() {
        byte[] response = new DeviceResponseGenerator(DeviceResponseGenerator.STATUS_OK)
                .addDocument(signedDocument())
                .generate();

        DeviceResponse parsed = parse(response);

        assertEquals("1.0", parsed.version());
        assertEquals(0, parsed.status());
        assertEquals(1, parsed.documents().size());
        MdocDocument doc = parsed.documents().get(0);
        assertTrue(doc.isFullyAuthenticated());
        assertFalse(doc.deviceSignedWithMac());
        assertArrayEquals(CREDENTIALS.devicePublicKey().getEncoded(), doc.deviceKey().getEncoded());
        assertEquals(List.of(CREDENTIALS.issuerCertificate()), doc.issuerCertificateChain());
        assertEquals("Mustermann", doc.getIssuerEntryString(NS, "family_name").orElseThrow());
        assertTrue(doc.getIssuerEntryBoolean(NS, "age_over_21").orElseThrow());
        assertTrue(doc.getIssuerEntryLong(NS, "family_name").isEmpty());
        assertTrue(doc.getIssuerEntry(NS, "portrait").isEmpty());
        assertTrue(doc.validityInfo().validUntil().isAfter(Instant.now()));
    }

    @Test
    void macDocumentNeedsTheReaderEphemeralKey() {
        byte[] document = generator(CREDENTIALS.issuerNamespaces()).generateWithMac(CREDENTIALS.secureArea(),
                TestCredentials.DEVICE_KEY_ALIAS, (ECPublicKey) eReaderKey.getPublic());
        byte[] response = new DeviceResponseGenerator(0).addDocument(document).generate();

        MdocDocument withKey = parse(response).documents().get(0);
        assertTrue(withKey.deviceSignedWithMac());
        assertTrue(withKey.deviceSignedAuthenticated());

        MdocDocument withoutKey = DeviceResponseParser.parse(response, transcript, null, null).documents().get(0);
        assertFalse(withoutKey.deviceSignedAuthenticated());
        assertTrue(withoutKey.issuerSignedAuthenticated());
    }

    @Test
    void deviceSignatureIsBoundToTheSession() {
        byte[] response = new DeviceResponseGenerator(0).addDocument(signedDocument()).generate();
        byte[] otherTranscript = TestCredentials.sessionTranscript((ECPublicKey) eReaderKey.getPublic());

        MdocDocument doc = DeviceResponseParser.parse(response, otherTranscript, null, null).documents().get(0);

        assertFalse(doc.deviceSignedAuthenticated());
        assertTrue(doc.issuerSignedAuthenticated());
        assertEquals(0, doc.numIssuerEntryDigestMatchFailures());
    }

    @Test
    void alteredElementFailsOnlyItsOwnDigest() {
        // GIVEN family_name replaced but keeping its digest id and random
        Map<String, List<byte[]>> items = new LinkedHashMap<>();
        List<byte[]> altered = new ArrayList<>();
        for (byte[] encoded : CREDENTIALS.issuerNamespaces().encodedItems().get(NS)) {
            IssuerSignedItem item = IssuerSignedItem.decode(encoded);
            if (item.elementIdentifier().equals("family_name")) {
                altered.add(new IssuerSignedItem(item.digestId(), item.random(), "family_name",
                        CBORObject.FromObject("Musterfrau")).encode());
            } else {
                altered.add(encoded);
            }
        }
        items.put(NS, altered);
        byte[] tampered = generator(IssuerNamespaces.of(items))
                .generateWithSignature(CREDENTIALS.secureArea(), TestCredentials.DEVICE_KEY_ALIAS);

        // WHEN sent alongside an intact copy
        byte[] response = new DeviceResponseGenerator(0)
                .addDocument(tampered)
                .addDocument(signedDocument())
                .generate();
        List<MdocDocument> docs = parse(response).documents();

        // THEN only the altered element of the first document is flagged
        MdocDocument first = docs.get(0);
        assertEquals(1, first.numIssuerEntryDigestMatchFailures());
        assertFalse(first.getIssuerEntry(NS, "family_name").orElseThrow().digestMatch());
        assertTrue(first.getIssuerEntry(NS, "given_name").orElseThrow().digestMatch());
        assertTrue(first.issuerSignedAuthenticated());
        assertFalse(first.isFullyAuthenticated());
        assertTrue(docs.get(1).isFullyAuthenticated());
    }

    @Test
    void docTypeMismatchWithMsoFailsIssuerAuthentication() {
        byte[] document = new DocumentGenerator("org.example.not-an-mdl", CREDENTIALS.encodedIssuerAuth(), transcript)
                .setIssuerNamespaces(CREDENTIALS.issuerNamespaces())
                .generateWithSignature(CREDENTIALS.secureArea(), TestCredentials.DEVICE_KEY_ALIAS);

        MdocDocument doc = parse(new DeviceResponseGenerator(0).addDocument(document).generate()).documents().get(0);

        assertFalse(doc.issuerSignedAuthenticated());
    }

    @Test
    void filteredNamespacesDiscloseOnlyRequestedElements() {
        IssuerNamespaces filtered = CREDENTIALS.issuerNamespaces()
                .filter(TestCredentials.mdlRequest().namespaces());
        byte[] document = generator(filtered)
                .generateWithSignature(CREDENTIALS.secureArea(), TestCredentials.DEVICE_KEY_ALIAS);

        MdocDocument doc = parse(new DeviceResponseGenerator(0).addDocument(document).generate()).documents().get(0);

        assertTrue(doc.isFullyAuthenticated());
        assertEquals(3, doc.issuerEntries().get(NS).size());
        assertTrue(doc.getIssuerEntry(NS, "document_number").isEmpty());
    }

    @Test
    void undecodableDocumentIsDropped() {
        byte[] response = new DeviceResponseGenerator(0)
                .addDocument(CBORObject.FromObject("not a document").EncodeToBytes())
                .addDocument(signedDocument())
                .generate();

        assertEquals(1, parse(response).documents().size());
    }

    @Test
    void errorStatusWithoutDocuments() {
        DeviceResponse parsed = parse(new DeviceResponseGenerator(DeviceResponseGenerator.STATUS_GENERAL_ERROR).generate());

        assertEquals(10, parsed.status());
        assertTrue(parsed.documents().isEmpty());
        assertTrue(parsed.zkDocuments().isEmpty());
    }

    @Test
    void notADeviceResponse() {
        assertThrows(CborStructureException.class, () -> parse(CBORObject.NewArray().EncodeToBytes()));
        assertThrows(CborStructureException.class,
                () -> parse(CBORObject.NewMap().Add("version", "1.0").EncodeToBytes()));
    }

    // ---------------------------------------------------------------------
    // ZK documents
    // ---------------------------------------------------------------------

    private ZkDocument proof(FakeZkSystem system) {
        return system.generateProof(system.systemSpecs().get(0), signedDocument(), transcript, Instant.now());
    }

    @Test
    void zkDocumentVerifiesThroughRepository() {
        FakeZkSystem system = new FakeZkSystem();
        byte[] response = new DeviceResponseGenerator(0)
                .addDocument(signedDocument())
                .addZkDocument(proof(system))
                .generate();

        DeviceResponse parsed = DeviceResponseParser.parse(response, transcript, null,
                new ZkSystemRepository().add(new FakeZkSystem()));

        assertEquals(1, parsed.documents().size());
        assertEquals(1, parsed.zkDocuments().size());
        VerifiedZkDocument zk = parsed.zkDocuments().get(0);
        assertTrue(zk.proofVerified());
        assertTrue(zk.failureReasonOptional().isEmpty());
        assertEquals(TestCredentials.DOC_TYPE, zk.document().documentData().docType());
        assertEquals(CBORObject.FromObject("Erika"),
                zk.document().documentData().issuerSigned().get(NS).get("given_name"));
    }

    @Test
    void zkDocumentWithoutRepositoryIsReportedUnverified() {
        byte[] response = new DeviceResponseGenerator(0).addZkDocument(proof(new FakeZkSystem())).generate();

        VerifiedZkDocument zk = DeviceResponseParser.parse(response, transcript, null, null).zkDocuments().get(0);

        assertFalse(zk.proofVerified());
        assertTrue(zk.failureReasonOptional().isPresent());
    }

    @Test
    void zkProofFromAnotherProverFails() {
        byte[] response = new DeviceResponseGenerator(0)
                .addZkDocument(proof(new FakeZkSystem("someone-else")))
                .generate();

        VerifiedZkDocument zk = DeviceResponseParser.parse(response, transcript, null,
                new ZkSystemRepository().add(new FakeZkSystem())).zkDocuments().get(0);

        assertFalse(zk.proofVerified());
        assertTrue(zk.failureReason().contains("Proof"));
    }
}

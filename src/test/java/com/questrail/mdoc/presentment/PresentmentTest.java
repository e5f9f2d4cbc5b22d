package com.questrail.mdoc.presentment;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.connectionmethod.NfcConnectionMethod;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.RecordingObservabilitySink;
import com.questrail.mdoc.observability.SessionObservabilityEvent.Kind;
import com.questrail.mdoc.request.DeviceRequestParser.ParsedDocRequest;
import com.questrail.mdoc.request.DocRequest;
import com.questrail.mdoc.response.DeviceResponse;
import com.questrail.mdoc.response.MdocDocument;
import com.questrail.mdoc.response.TestCredentials;
import com.questrail.mdoc.response.VerifiedZkDocument;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.DefaultMdocTransportFactory;
import com.questrail.mdoc.transport.MdocTransportFactory;
import com.questrail.mdoc.transport.TransportClosedException;
import com.questrail.mdoc.transport.TransportState;
import com.questrail.mdoc.transport.ble.LoopbackBleRadio;
import com.questrail.mdoc.transport.nfc.LoopbackIsoTag;
import com.questrail.mdoc.transport.nfc.NfcMdocTransport;
import com.questrail.mdoc.zkp.FakeZkSystem;
import com.questrail.mdoc.zkp.ZkSystemRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class PresentmentTest
{
    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String NS = TestCredentials.NAMESPACE;

    private final TestCredentials credentials = new TestCredentials();
    private final LoopbackBleRadio radio = new LoopbackBleRadio();
    private final MdocTransportOptions options = MdocTransportOptions.builder()
            .withConnectTimeout(WAIT)
            .build();
    private final MdocTransportFactory bleFactory = DefaultMdocTransportFactory.builder()
            .withCentralLinks(radio::newCentral)
            .withPeripheralLinks(radio::newPeripheral)
            .build();
    private final RecordingObservabilitySink holderSink = new RecordingObservabilitySink();
    private final RecordingObservabilitySink readerSink = new RecordingObservabilitySink();
    private final CancellationToken token = new CancellationToken();
    private final ExecutorService holderThread = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        token.cancel();
        holderThread.shutdownNow();
    }

    private HolderPresentment.Builder holder(ConnectionMethod method) {
        return HolderPresentment.builder()
                .withTransportFactory(bleFactory)
                .withTransportOptions(options)
                .withConnectionMethod(method)
                .withCredential(credentials.mdl())
                .withMessageTimeout(WAIT)
                .withObservabilitySink(holderSink);
    }

    private ReaderPresentment.Builder reader(MdocTransportFactory factory) {
        return ReaderPresentment.builder()
                .withTransportFactory(factory)
                .withTransportOptions(options)
                .withMessageTimeout(WAIT)
                .withObservabilitySink(readerSink);
    }

    private static final class Outcome
    {
        final PresentmentResult holder;
        final PresentmentResult reader;

        Outcome(PresentmentResult holder, PresentmentResult reader) {
            this.holder = holder;
            this.reader = reader;
        }
    }

    private Outcome present(HolderPresentment holder, ReaderPresentment.Builder reader, TerminationStyle style)
            throws Exception
    {
        HolderPresentment.PreparedEngagement prepared = holder.prepare();
        return present(prepared, reader.build(), style);
    }

    private Outcome present(HolderPresentment.PreparedEngagement prepared, ReaderPresentment reader,
                            TerminationStyle style) throws Exception
    {
        Future<PresentmentResult> holderRun = holderThread.submit(() -> prepared.run(style, token));
        PresentmentResult readerResult = reader.run(prepared.encodedDeviceEngagement(), style, token);
        return new Outcome(holderRun.get(10, TimeUnit.SECONDS), readerResult);
    }

    private void assertMdlDelivered(Outcome outcome, TerminationStyle style) {
        assertEquals(Role.HOLDER, outcome.holder.role());
        assertEquals(Role.READER, outcome.reader.role());
        assertEquals(style, outcome.holder.terminationStyle());
        assertEquals(TransportState.CLOSED, outcome.holder.finalTransportState());
        assertEquals(TransportState.CLOSED, outcome.reader.finalTransportState());

        DocRequest received = outcome.holder.requestOptional().orElseThrow().docRequests().get(0).request();
        assertEquals(TestCredentials.mdlRequest(), received);

        DeviceResponse response = outcome.reader.responseOptional().orElseThrow();
        assertEquals(0, response.status());
        assertEquals(1, response.documents().size());
        MdocDocument mdl = response.documents().get(0);
        assertTrue(mdl.isFullyAuthenticated());
        assertEquals("Mustermann", mdl.getIssuerEntryString(NS, "family_name").orElseThrow());
        assertEquals("Erika", mdl.getIssuerEntryString(NS, "given_name").orElseThrow());
        assertTrue(mdl.getIssuerEntryBoolean(NS, "age_over_21").orElseThrow());
        // not requested, so not disclosed
        assertTrue(mdl.getIssuerEntry(NS, "document_number").isEmpty());
    }

    // ---------------------------------------------------------------------
    // BLE, every way of ending the session
    // ---------------------------------------------------------------------

    private void presentOverBle(TerminationStyle style) throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        Outcome outcome = present(holder(method).build(),
                reader(bleFactory).withDocRequest(TestCredentials.mdlRequest()), style);

        assertMdlDelivered(outcome, style);
        // the holder was the GATT central in this mode
        assertTrue(outcome.holder.scanningTimeOptional().isPresent());
        assertTrue(outcome.reader.scanningTimeOptional().isEmpty());
        assertTrue(radio.isIdle());
    }

    @Test
    void bleSessionEndedByInBandStatus() throws Exception {
        presentOverBle(TerminationStyle.IN_BAND_STATUS);
    }

    @Test
    void bleSessionEndedByHolderTerminationMessage() throws Exception {
        presentOverBle(TerminationStyle.HOLDER_TERMINATION_MESSAGE);
    }

    @Test
    void bleSessionEndedByHolderTransportTermination() throws Exception {
        presentOverBle(TerminationStyle.HOLDER_TRANSPORT_SPECIFIC);
    }

    @Test
    void bleSessionEndedByReaderTerminationMessage() throws Exception {
        presentOverBle(TerminationStyle.READER_TERMINATION_MESSAGE);
    }

    @Test
    void bleSessionEndedByReaderTransportTermination() throws Exception {
        presentOverBle(TerminationStyle.READER_TRANSPORT_SPECIFIC);
    }

    @Test
    void peripheralServerModeOverL2cap() throws Exception {
        MdocTransportOptions l2cap = MdocTransportOptions.builder()
                .withConnectTimeout(WAIT)
                .withBleUseL2cap(true)
                .build();
        BleConnectionMethod method = BleConnectionMethod.peripheralServer(UUID.randomUUID());
        Outcome outcome = present(holder(method).withTransportOptions(l2cap).build(),
                reader(bleFactory).withTransportOptions(l2cap).withDocRequest(TestCredentials.mdlRequest()),
                TerminationStyle.IN_BAND_STATUS);

        assertMdlDelivered(outcome, TerminationStyle.IN_BAND_STATUS);
        assertTrue(outcome.reader.scanningTimeOptional().isPresent());
        assertTrue(outcome.holder.scanningTimeOptional().isEmpty());
    }

    @Test
    void sessionEventsAreReportedOnBothSides() throws Exception {
        presentOverBle(TerminationStyle.IN_BAND_STATUS);

        assertEquals(List.of(Kind.ENGAGEMENT_CREATED, Kind.SESSION_ESTABLISHED, Kind.REQUEST_RECEIVED,
                Kind.RESPONSE_SENT, Kind.TERMINATED), holderSink.getSessionEventKinds());
        assertEquals(List.of(Kind.SESSION_ESTABLISHED, Kind.REQUEST_SENT, Kind.RESPONSE_RECEIVED,
                Kind.TERMINATED), readerSink.getSessionEventKinds());
    }

    // ---------------------------------------------------------------------
    // NFC
    // ---------------------------------------------------------------------

    private void presentOverNfc(TerminationStyle style) throws Exception {
        HolderPresentment holder = holder(new NfcConnectionMethod(255, 256)).build();
        HolderPresentment.PreparedEngagement prepared = holder.prepare();
        NfcMdocTransport holderTransport = (NfcMdocTransport) prepared.transport();
        MdocTransportFactory nfcReader = DefaultMdocTransportFactory.builder()
                .withNfcTags(() -> new LoopbackIsoTag(holderTransport, 261))
                .build();

        Outcome outcome = present(prepared,
                reader(nfcReader).withDocRequest(TestCredentials.mdlRequest()).build(), style);

        assertMdlDelivered(outcome, style);
        assertTrue(outcome.reader.scanningTimeOptional().isEmpty());
    }

    @Test
    void nfcSessionEndedByReaderRemovingTheField() throws Exception {
        presentOverNfc(TerminationStyle.READER_TRANSPORT_SPECIFIC);
    }

    @Test
    void nfcSessionEndedByInBandStatus() throws Exception {
        presentOverNfc(TerminationStyle.IN_BAND_STATUS);
    }

    // ---------------------------------------------------------------------
    // Request and response variants
    // ---------------------------------------------------------------------

    @Test
    void readerAuthenticationIsVerifiedByTheHolder() throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        Outcome outcome = present(holder(method).build(),
                reader(bleFactory)
                        .withDocRequest(TestCredentials.mdlRequest())
                        .withReaderAuthentication(credentials.readerSigner(), credentials.readerCertChain()),
                TerminationStyle.IN_BAND_STATUS);

        ParsedDocRequest request = outcome.holder.requestOptional().orElseThrow().docRequests().get(0);
        assertTrue(request.readerAuthenticated());
        assertEquals(credentials.readerCertChain(), request.readerCertChain());
    }

    @Test
    void deviceMacAuthenticatesWithTheSessionKeys() throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        Outcome outcome = present(holder(method).withDeviceMac(true).build(),
                reader(bleFactory).withDocRequest(TestCredentials.mdlRequest()),
                TerminationStyle.READER_TERMINATION_MESSAGE);

        MdocDocument mdl = outcome.reader.responseOptional().orElseThrow().documents().get(0);
        assertTrue(mdl.deviceSignedWithMac());
        assertTrue(mdl.isFullyAuthenticated());
    }

    @Test
    void zkRequestIsAnsweredWithAVerifiedProof() throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        DocRequest zkRequest = TestCredentials.mdlRequest()
                .withZkRequest(List.of(FakeZkSystem.spec("reader-side-id", 1L)), true);
        Outcome outcome = present(
                holder(method).withZkSystems(new ZkSystemRepository().add(new FakeZkSystem())).build(),
                reader(bleFactory).withDocRequest(zkRequest)
                        .withZkSystems(new ZkSystemRepository().add(new FakeZkSystem())),
                TerminationStyle.IN_BAND_STATUS);

        DeviceResponse response = outcome.reader.responseOptional().orElseThrow();
        assertTrue(response.documents().isEmpty());
        assertEquals(1, response.zkDocuments().size());
        VerifiedZkDocument zk = response.zkDocuments().get(0);
        assertTrue(zk.proofVerified());
        assertEquals(TestCredentials.DOC_TYPE, zk.document().documentData().docType());
    }

    @Test
    void requiredZkWithoutAMatchingSystemIsLeftOut() throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        DocRequest zkRequest = TestCredentials.mdlRequest()
                .withZkRequest(List.of(FakeZkSystem.spec("reader-side-id", 2L)), true);
        Outcome outcome = present(
                holder(method).withZkSystems(new ZkSystemRepository().add(new FakeZkSystem())).build(),
                reader(bleFactory).withDocRequest(zkRequest),
                TerminationStyle.IN_BAND_STATUS);

        DeviceResponse response = outcome.reader.responseOptional().orElseThrow();
        assertEquals(0, response.status());
        assertTrue(response.documents().isEmpty());
        assertTrue(response.zkDocuments().isEmpty());
    }

    @Test
    void unknownDocTypeGetsAnEmptyResponse() throws Exception {
        BleConnectionMethod method = BleConnectionMethod.centralClient(UUID.randomUUID());
        DocRequest other = DocRequest.of("org.example.loyalty.1",
                Map.of("org.example.loyalty", Map.of("member_id", false)));
        Outcome outcome = present(holder(method).build(),
                reader(bleFactory).withDocRequest(other),
                TerminationStyle.IN_BAND_STATUS);

        DeviceResponse response = outcome.reader.responseOptional().orElseThrow();
        assertEquals(0, response.status());
        assertTrue(response.documents().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void cancellingAWaitingHolderClosesItsTransport() throws Exception {
        HolderPresentment.PreparedEngagement prepared =
                holder(BleConnectionMethod.peripheralServer(UUID.randomUUID())).build().prepare();
        Future<PresentmentResult> run = holderThread.submit(
                () -> prepared.run(TerminationStyle.IN_BAND_STATUS, token));

        Thread.sleep(100);
        token.cancel();

        ExecutionException e = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportClosedException.class, e.getCause());
        assertEquals(TransportState.CLOSED, prepared.transport().state());
        assertTrue(radio.isIdle());
    }

    @Test
    void readerNeedsAtLeastOneDocumentRequest() {
        assertThrows(IllegalArgumentException.class, () -> reader(bleFactory).build());
    }

    @Test
    void holderNeedsAConnectionMethod() {
        assertThrows(NullPointerException.class, () -> HolderPresentment.builder()
                .withTransportFactory(bleFactory)
                .build());
    }
}

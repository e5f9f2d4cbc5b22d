package com.questrail.mdoc.presentment;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.connectionmethod.ConnectionMethodSelector;
import com.questrail.mdoc.connectionmethod.ConnectionMethods;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.crypto.cose.CoseSigner;
import com.questrail.mdoc.engagement.CborEngagementCodec;
import com.questrail.mdoc.engagement.DeviceEngagement;
import com.questrail.mdoc.engagement.EngagementCodec;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.observability.SessionObservabilityEvent;
import com.questrail.mdoc.observability.SessionObservabilityEvent.Kind;
import com.questrail.mdoc.request.DeviceRequestGenerator;
import com.questrail.mdoc.request.DocRequest;
import com.questrail.mdoc.response.DeviceResponse;
import com.questrail.mdoc.response.DeviceResponseParser;
import com.questrail.mdoc.session.DecryptedMessage;
import com.questrail.mdoc.session.Handover;
import com.questrail.mdoc.session.KeyAgreementException;
import com.questrail.mdoc.session.SessionData;
import com.questrail.mdoc.session.SessionEncryption;
import com.questrail.mdoc.session.SessionTranscript;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.MdocTransport;
import com.questrail.mdoc.transport.MdocTransportFactory;
import com.questrail.mdoc.transport.TransportClosedException;
import com.questrail.mdoc.zkp.ZkSystemRepository;

import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ReaderPresentment
 * =============================================================================
 * Runs the reader side of one proximity presentment from a scanned device
 * engagement.
 *
 * <h2>Flow</h2>
 * Decode the engagement, disambiguate its connection methods and let the
 * {@link ConnectionMethodSelector} pick one, open the matching transport,
 * create an ephemeral key on the holder's curve, send the encrypted
 * DeviceRequest inside a SessionEstablishment, and parse the DeviceResponse.
 * The session then ends in the requested {@link TerminationStyle}; a response
 * that already carries status 20 ends it regardless of style.
 *
 * <p>The transport is always released before {@link #run} returns or throws.</p>
 */
public final class ReaderPresentment
{
    private final MdocTransportFactory transportFactory;
    private final MdocTransportOptions transportOptions;
    private final EngagementCodec engagementCodec;
    private final ConnectionMethodSelector selector;
    private final Handover handover;
    private final List<DocRequest> docRequests;
    private final CoseSigner readerKey;
    private final List<X509Certificate> readerCertChain;
    private final ZkSystemRepository zkSystems;
    private final Duration messageTimeout;
    private final MdocObservabilitySink sink;
    private final MonotonicClock clock;

    private ReaderPresentment(Builder b) {
        this.transportFactory = Objects.requireNonNull(b.transportFactory, "transportFactory");
        if (b.docRequests.isEmpty()) {
            throw new IllegalArgumentException("At least one document request is required");
        }
        this.transportOptions = b.transportOptions;
        this.engagementCodec = b.engagementCodec;
        this.selector = b.selector;
        this.handover = b.handover;
        this.docRequests = List.copyOf(b.docRequests);
        this.readerKey = b.readerKey;
        this.readerCertChain = List.copyOf(b.readerCertChain);
        this.zkSystems = b.zkSystems;
        this.messageTimeout = b.messageTimeout;
        this.sink = b.sink;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param encodedDeviceEngagement engagement bytes exactly as scanned
     * @param token                   cancelling it closes the transport
     */
    public PresentmentResult run(byte[] encodedDeviceEngagement, TerminationStyle style, CancellationToken token) {
        Objects.requireNonNull(encodedDeviceEngagement, "encodedDeviceEngagement");
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(token, "token");

        DeviceEngagement engagement = engagementCodec.decode(encodedDeviceEngagement);
        List<ConnectionMethod> methods = ConnectionMethods.disambiguate(engagement.connectionMethods(), Role.READER);
        ConnectionMethod method = selector.select(methods);
        MdocTransport transport = transportFactory.createTransport(method, Role.READER, transportOptions);

        long start = clock.nowNanos();
        DeviceResponse response;
        try {
            response = exchange(transport, engagement, encodedDeviceEngagement, style, token);
        } finally {
            transport.close();
        }
        event(Kind.TERMINATED, style.name());
        return new PresentmentResult(Role.READER, style, Duration.ofNanos(Math.max(0L, clock.nowNanos() - start)),
                transport.scanningTime().orElse(null), null, response, transport.state());
    }

    private DeviceResponse exchange(MdocTransport transport, DeviceEngagement engagement,
                                    byte[] encodedDeviceEngagement, TerminationStyle style, CancellationToken token) {
        ECPublicKey eDeviceKey = engagement.eDeviceKey();
        transport.open(eDeviceKey, token);

        EcCurve curve = EcCurve.fromKey(eDeviceKey)
                .orElseThrow(() -> new KeyAgreementException("Device key is on an unsupported curve"));
        KeyPair eReaderKey = EcKeys.generateKeyPair(curve);
        byte[] encodedEReaderKey = CoseKey.encode((ECPublicKey) eReaderKey.getPublic());
        byte[] transcript = SessionTranscript.compute(encodedDeviceEngagement, encodedEReaderKey, handover);
        SessionEncryption session = SessionEncryption.establish(Role.READER, eReaderKey, eDeviceKey, transcript);
        event(Kind.SESSION_ESTABLISHED, transport.connectionMethod().toString());

        byte[] request = DeviceRequestGenerator.generateRequest(transcript, docRequests, readerKey, readerCertChain);
        transport.sendMessage(session.encryptMessage(request, null));
        event(Kind.REQUEST_SENT, docRequests.size() + " document request(s)");

        byte[] message = transport.waitForMessage(messageTimeout, token);
        if (message.length == 0) {
            throw new TransportClosedException("Holder terminated before responding");
        }
        DecryptedMessage decrypted = session.decryptMessage(message);
        if (decrypted.plaintext() == null) {
            throw new UnexpectedMessageException("Holder sent status "
                    + decrypted.statusOptional().orElse(-1) + " instead of a response");
        }
        DeviceResponse response = DeviceResponseParser.parse(
                decrypted.plaintext(), transcript, (ECPrivateKey) eReaderKey.getPrivate(), zkSystems);
        event(Kind.RESPONSE_RECEIVED, response.documents().size() + " document(s), "
                + response.zkDocuments().size() + " ZK document(s)");

        if (decrypted.isSessionTermination()) {
            return response;
        }
        switch (style) {
            case IN_BAND_STATUS:
                throw new UnexpectedMessageException("Response did not carry session termination status");
            case HOLDER_TERMINATION_MESSAGE:
            case HOLDER_TRANSPORT_SPECIFIC:
                awaitHolderTermination(transport, session, token);
                break;
            case READER_TERMINATION_MESSAGE:
                transport.sendMessage(SessionEncryption.encodeStatus(SessionData.STATUS_SESSION_TERMINATION));
                break;
            case READER_TRANSPORT_SPECIFIC:
                transport.sendMessage(new byte[0]);
                break;
        }
        return response;
    }

    private void awaitHolderTermination(MdocTransport transport, SessionEncryption session, CancellationToken token) {
        byte[] message = transport.waitForMessage(messageTimeout, token);
        if (message.length == 0) {
            return;
        }
        if (!session.decryptMessage(message).isSessionTermination()) {
            throw new UnexpectedMessageException("Expected session termination, got another message");
        }
    }

    private void event(Kind kind, String detail) {
        sink.onSessionEvent(new SessionObservabilityEvent(Instant.now(), Role.READER, kind, detail));
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private MdocTransportFactory transportFactory;
        private MdocTransportOptions transportOptions = MdocTransportOptions.defaults();
        private EngagementCodec engagementCodec = new CborEngagementCodec();
        private ConnectionMethodSelector selector = ConnectionMethodSelector.first();
        private Handover handover = Handover.qr();
        private final List<DocRequest> docRequests = new ArrayList<>();
        private CoseSigner readerKey;
        private List<X509Certificate> readerCertChain = List.of();
        private ZkSystemRepository zkSystems;
        private Duration messageTimeout = Duration.ofSeconds(10);
        private MdocObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withTransportFactory(MdocTransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder withTransportOptions(MdocTransportOptions transportOptions) {
            this.transportOptions = Objects.requireNonNull(transportOptions, "transportOptions");
            return this;
        }

        public Builder withEngagementCodec(EngagementCodec engagementCodec) {
            this.engagementCodec = Objects.requireNonNull(engagementCodec, "engagementCodec");
            return this;
        }

        public Builder withConnectionMethodSelector(ConnectionMethodSelector selector) {
            this.selector = Objects.requireNonNull(selector, "selector");
            return this;
        }

        public Builder withHandover(Handover handover) {
            this.handover = Objects.requireNonNull(handover, "handover");
            return this;
        }

        public Builder withDocRequest(DocRequest docRequest) {
            this.docRequests.add(Objects.requireNonNull(docRequest, "docRequest"));
            return this;
        }

        /** Signs every document request with {@code readerKey}, carrying {@code certChain} in x5chain. */
        public Builder withReaderAuthentication(CoseSigner readerKey, List<X509Certificate> certChain) {
            this.readerKey = Objects.requireNonNull(readerKey, "readerKey");
            this.readerCertChain = Objects.requireNonNull(certChain, "certChain");
            return this;
        }

        public Builder withZkSystems(ZkSystemRepository zkSystems) {
            this.zkSystems = zkSystems;
            return this;
        }

        public Builder withMessageTimeout(Duration messageTimeout) {
            this.messageTimeout = Objects.requireNonNull(messageTimeout, "messageTimeout");
            return this;
        }

        public Builder withObservabilitySink(MdocObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ReaderPresentment build() {
            return new ReaderPresentment(this);
        }
    }
}

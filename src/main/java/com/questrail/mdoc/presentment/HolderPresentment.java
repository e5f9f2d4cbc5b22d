package com.questrail.mdoc.presentment;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseException;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.engagement.CborEngagementCodec;
import com.questrail.mdoc.engagement.DeviceEngagement;
import com.questrail.mdoc.engagement.EngagementCodec;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.model.MdocProtocolException;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.observability.SessionObservabilityEvent;
import com.questrail.mdoc.observability.SessionObservabilityEvent.Kind;
import com.questrail.mdoc.request.DeviceRequestParser;
import com.questrail.mdoc.request.DeviceRequestParser.ParsedDeviceRequest;
import com.questrail.mdoc.session.DecryptedMessage;
import com.questrail.mdoc.session.DecryptionException;
import com.questrail.mdoc.session.Handover;
import com.questrail.mdoc.session.SessionData;
import com.questrail.mdoc.session.SessionEncryption;
import com.questrail.mdoc.session.SessionTranscript;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.MdocTransport;
import com.questrail.mdoc.transport.MdocTransportFactory;
import com.questrail.mdoc.transport.TransportClosedException;
import com.questrail.mdoc.zkp.ZkSystemRepository;

import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * HolderPresentment
 * =============================================================================
 * Runs the holder side of one proximity presentment.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>{@link #prepare()} creates the ephemeral device key and the transport,
 *       lets the transport advertise, and encodes the device engagement to be
 *       shown to the reader (QR code or NFC handover).</li>
 *   <li>{@link PreparedEngagement#run} opens the transport, waits for the
 *       reader's SessionEstablishment, derives the session, answers the request
 *       from the configured credentials and ends the session in the requested
 *       {@link TerminationStyle}.</li>
 * </ol>
 *
 * <h2>Errors</h2>
 * A request that cannot be decrypted is answered with status 10, one that cannot
 * be parsed with status 11, before the exception propagates. The transport is
 * always released before {@code run} returns or throws.
 */
public final class HolderPresentment
{
    private final MdocTransportFactory transportFactory;
    private final MdocTransportOptions transportOptions;
    private final ConnectionMethod connectionMethod;
    private final EngagementCodec engagementCodec;
    private final Handover handover;
    private final EcCurve ephemeralCurve;
    private final ResponseComposer composer;
    private final Duration messageTimeout;
    private final MdocObservabilitySink sink;
    private final MonotonicClock clock;

    private HolderPresentment(Builder b) {
        this.transportFactory = Objects.requireNonNull(b.transportFactory, "transportFactory");
        this.connectionMethod = Objects.requireNonNull(b.connectionMethod, "connectionMethod");
        this.transportOptions = b.transportOptions;
        this.engagementCodec = b.engagementCodec;
        this.handover = b.handover;
        this.ephemeralCurve = b.ephemeralCurve;
        this.composer = new ResponseComposer(b.credentials, b.zkSystems, b.deviceMac);
        this.messageTimeout = b.messageTimeout;
        this.sink = b.sink;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the transport and the device engagement for one session.
     */
    public PreparedEngagement prepare() {
        KeyPair eDeviceKey = EcKeys.generateKeyPair(ephemeralCurve);
        MdocTransport transport = transportFactory.createTransport(connectionMethod, Role.HOLDER, transportOptions);
        byte[] encoded;
        try {
            transport.advertise();
            DeviceEngagement engagement = DeviceEngagement.of(
                    (ECPublicKey) eDeviceKey.getPublic(), List.of(transport.connectionMethod()));
            encoded = engagementCodec.encode(engagement);
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
        event(Kind.ENGAGEMENT_CREATED, transport.connectionMethod().toString());
        return new PreparedEngagement(eDeviceKey, transport, encoded);
    }

    private void event(Kind kind, String detail) {
        sink.onSessionEvent(new SessionObservabilityEvent(Instant.now(), Role.HOLDER, kind, detail));
    }

    // -------------------------------------------------------------------------
    // Session
    // -------------------------------------------------------------------------

    /**
     * A device engagement that has been handed out, and the transport waiting behind it.
     */
    public final class PreparedEngagement
    {
        private final KeyPair eDeviceKey;
        private final MdocTransport transport;
        private final byte[] encodedDeviceEngagement;

        private PreparedEngagement(KeyPair eDeviceKey, MdocTransport transport, byte[] encodedDeviceEngagement) {
            this.eDeviceKey = eDeviceKey;
            this.transport = transport;
            this.encodedDeviceEngagement = encodedDeviceEngagement;
        }

        public byte[] encodedDeviceEngagement() {
            return encodedDeviceEngagement.clone();
        }

        public MdocTransport transport() {
            return transport;
        }

        /**
         * Runs the session to completion. Cancelling {@code token} closes the transport.
         */
        public PresentmentResult run(TerminationStyle style, CancellationToken token) {
            Objects.requireNonNull(style, "style");
            Objects.requireNonNull(token, "token");
            long start = clock.nowNanos();
            ParsedDeviceRequest request;
            try {
                request = exchange(style, token);
            } finally {
                transport.close();
            }
            event(Kind.TERMINATED, style.name());
            return new PresentmentResult(Role.HOLDER, style, Duration.ofNanos(Math.max(0L, clock.nowNanos() - start)),
                    transport.scanningTime().orElse(null), request, null, transport.state());
        }

        private ParsedDeviceRequest exchange(TerminationStyle style, CancellationToken token) {
            transport.open((ECPublicKey) eDeviceKey.getPublic(), token);

            byte[] establishment = transport.waitForMessage(messageTimeout, token);
            if (establishment.length == 0) {
                throw new TransportClosedException("Reader terminated before sending a request");
            }
            byte[] encodedEReaderKey = SessionEncryption.extractEncodedEReaderKey(establishment);
            ECPublicKey eReaderKey;
            try {
                eReaderKey = CoseKey.decode(encodedEReaderKey);
            } catch (CoseException e) {
                throw new DecryptionException("Malformed reader ephemeral key", e);
            }
            byte[] transcript = SessionTranscript.compute(encodedDeviceEngagement, encodedEReaderKey, handover);
            SessionEncryption session = SessionEncryption.establish(Role.HOLDER, eDeviceKey, eReaderKey, transcript);
            event(Kind.SESSION_ESTABLISHED, transport.connectionMethod().toString());

            DecryptedMessage decrypted;
            try {
                decrypted = session.decryptMessage(establishment);
            } catch (DecryptionException e) {
                sendErrorStatus(SessionData.STATUS_SESSION_ENCRYPTION_ERROR, e);
                throw e;
            }
            byte[] requestBytes = decrypted.plaintextOptional()
                    .orElseThrow(() -> new UnexpectedMessageException("SessionEstablishment without a request"));
            ParsedDeviceRequest request;
            try {
                request = DeviceRequestParser.parse(requestBytes, transcript);
            } catch (CborStructureException e) {
                sendErrorStatus(SessionData.STATUS_CBOR_DECODING_ERROR, e);
                throw e;
            }
            event(Kind.REQUEST_RECEIVED, request.docRequests().size() + " document request(s)");

            byte[] response = composer.compose(request, transcript, eReaderKey);
            Integer status = style == TerminationStyle.IN_BAND_STATUS ? SessionData.STATUS_SESSION_TERMINATION : null;
            transport.sendMessage(session.encryptMessage(response, status));
            event(Kind.RESPONSE_SENT, response.length + " bytes");

            switch (style) {
                case IN_BAND_STATUS:
                    break;
                case HOLDER_TERMINATION_MESSAGE:
                    transport.sendMessage(SessionEncryption.encodeStatus(SessionData.STATUS_SESSION_TERMINATION));
                    break;
                case HOLDER_TRANSPORT_SPECIFIC:
                    transport.sendMessage(new byte[0]);
                    break;
                case READER_TERMINATION_MESSAGE:
                case READER_TRANSPORT_SPECIFIC:
                    awaitReaderTermination(session, token);
                    break;
            }
            return request;
        }

        private void sendErrorStatus(int status, RuntimeException cause) {
            try {
                transport.sendMessage(SessionEncryption.encodeStatus(status));
            } catch (MdocProtocolException | IllegalStateException e) {
                cause.addSuppressed(e);
            }
        }

        private void awaitReaderTermination(SessionEncryption session, CancellationToken token) {
            byte[] message = transport.waitForMessage(messageTimeout, token);
            if (message.length == 0) {
                return;
            }
            DecryptedMessage decrypted = session.decryptMessage(message);
            if (!decrypted.isSessionTermination()) {
                throw new UnexpectedMessageException("Expected session termination, got another message");
            }
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private MdocTransportFactory transportFactory;
        private MdocTransportOptions transportOptions = MdocTransportOptions.defaults();
        private ConnectionMethod connectionMethod;
        private EngagementCodec engagementCodec = new CborEngagementCodec();
        private Handover handover = Handover.qr();
        private EcCurve ephemeralCurve = EcCurve.P256;
        private final List<MdocCredential> credentials = new ArrayList<>();
        private ZkSystemRepository zkSystems;
        private boolean deviceMac;
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

        public Builder withConnectionMethod(ConnectionMethod connectionMethod) {
            this.connectionMethod = connectionMethod;
            return this;
        }

        public Builder withEngagementCodec(EngagementCodec engagementCodec) {
            this.engagementCodec = Objects.requireNonNull(engagementCodec, "engagementCodec");
            return this;
        }

        public Builder withHandover(Handover handover) {
            this.handover = Objects.requireNonNull(handover, "handover");
            return this;
        }

        public Builder withEphemeralCurve(EcCurve ephemeralCurve) {
            this.ephemeralCurve = Objects.requireNonNull(ephemeralCurve, "ephemeralCurve");
            return this;
        }

        public Builder withCredential(MdocCredential credential) {
            this.credentials.add(Objects.requireNonNull(credential, "credential"));
            return this;
        }

        public Builder withZkSystems(ZkSystemRepository zkSystems) {
            this.zkSystems = zkSystems;
            return this;
        }

        /** Authenticate device data with deviceMac instead of deviceSignature. */
        public Builder withDeviceMac(boolean deviceMac) {
            this.deviceMac = deviceMac;
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

        public HolderPresentment build() {
            return new HolderPresentment(this);
        }
    }
}

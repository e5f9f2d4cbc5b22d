package com.questrail.mdoc.harness;

import com.questrail.mdoc.config.HarnessConfig;
import com.questrail.mdoc.crypto.cose.CoseSigner;
import com.questrail.mdoc.harness.ControlMessage.Done;
import com.questrail.mdoc.harness.ControlMessage.Failed;
import com.questrail.mdoc.harness.ControlMessage.Plan;
import com.questrail.mdoc.harness.ControlMessage.Prepare;
import com.questrail.mdoc.harness.ControlMessage.Prepared;
import com.questrail.mdoc.harness.ControlMessage.Result;
import com.questrail.mdoc.harness.ControlMessage.Start;
import com.questrail.mdoc.harness.ControlMessage.Success;
import com.questrail.mdoc.harness.ControlMessage.Timeout;
import com.questrail.mdoc.harness.netty.NettyControlClient;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.Slf4jMdocObservabilitySink;
import com.questrail.mdoc.presentment.PresentmentResult;
import com.questrail.mdoc.presentment.ReaderPresentment;
import com.questrail.mdoc.request.DocRequest;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.ConnectionTimeoutException;
import com.questrail.mdoc.transport.MdocTransportFactory;
import com.questrail.mdoc.transport.MessageTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * HarnessClient
 * =============================================================================
 * Reader side of the multi-device test harness.
 *
 * <p>Connects to a {@link HarnessServer} by its connection code and follows
 * its lead: for every {@link Prepare} it builds a reader for the announced
 * transport flavour, acknowledges, and on {@link Start} runs the presentment
 * against the engagement it was given. The outcome goes back as
 * {@link Success}, {@link Timeout} or {@link Failed}.</p>
 */
public final class HarnessClient implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HarnessClient.class);

    private final HarnessConfig config;
    private final MdocTransportFactory transportFactory;
    private final List<DocRequest> docRequests;
    private final CoseSigner readerKey;
    private final List<X509Certificate> readerCertChain;
    private final MdocObservabilitySink sink;
    private final MonotonicClock clock;
    private final ScheduledExecutorService deadlines;

    private volatile TestPlan plan;

    private HarnessClient(Builder b) {
        this.config = b.config;
        this.transportFactory = Objects.requireNonNull(b.transportFactory, "transportFactory");
        if (b.docRequests.isEmpty()) {
            throw new IllegalArgumentException("At least one document request is required");
        }
        this.docRequests = List.copyOf(b.docRequests);
        this.readerKey = b.readerKey;
        this.readerCertChain = List.copyOf(b.readerCertChain);
        this.sink = b.sink;
        this.clock = b.clock;
        this.deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mdoc-harness-client-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a {@code host:port} connection code.
     *
     * @throws IllegalArgumentException if the code is malformed
     */
    public static InetSocketAddress parseConnectionCode(String connectionCode) {
        Objects.requireNonNull(connectionCode, "connectionCode");
        int colon = connectionCode.lastIndexOf(':');
        if (colon <= 0 || colon == connectionCode.length() - 1) {
            throw new IllegalArgumentException("Connection code must be host:port, got '" + connectionCode + "'");
        }
        int port;
        try {
            port = Integer.parseInt(connectionCode.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in connection code '" + connectionCode + "'", e);
        }
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("Port out of range in connection code '" + connectionCode + "'");
        }
        return new InetSocketAddress(connectionCode.substring(0, colon), port);
    }

    /**
     * The plan announced by the server, once it has been received.
     */
    public TestPlan plan() {
        return plan;
    }

    /**
     * Connects and takes part in the server's plan until it is done.
     *
     * @return the result reported by the server
     * @throws HarnessException if the control channel fails or the server
     *                          deviates from the control protocol
     */
    public TestResult run(String connectionCode) {
        InetSocketAddress address = parseConnectionCode(connectionCode);
        Duration idle = config.iterationTimeout().multipliedBy(2);
        TestResult result = null;
        try (ControlConnection connection = NettyControlClient.connect(address, config.messageTimeout())) {
            log.info("Connected to harness server at {}", address);
            while (true) {
                ControlMessage message = connection.receive(idle);
                if (message instanceof Plan p) {
                    plan = p.plan();
                    log.info("Harness plan received: {} iteration(s)", plan.totalIterations());
                } else if (message instanceof Prepare prepare) {
                    runIteration(connection, prepare);
                } else if (message instanceof Result r) {
                    result = r.result();
                } else if (message == Done.INSTANCE) {
                    if (result == null) {
                        throw new HarnessException("Server finished without a result");
                    }
                    return result;
                } else {
                    throw new HarnessException("Unexpected control message " + message);
                }
            }
        }
    }

    private void runIteration(ControlConnection connection, Prepare prepare) {
        int iteration = prepare.iteration();
        ReaderPresentment.Builder reader = ReaderPresentment.builder()
                .withTransportFactory(transportFactory)
                .withTransportOptions(config.transportOptions().withBleUseL2cap(prepare.transport().useL2cap()))
                .withMessageTimeout(config.messageTimeout())
                .withObservabilitySink(sink)
                .withClock(clock);
        docRequests.forEach(reader::withDocRequest);
        if (readerKey != null) {
            reader.withReaderAuthentication(readerKey, readerCertChain);
        }

        connection.send(new Prepared(iteration));
        ControlMessage start = connection.receive(config.iterationTimeout());
        if (!(start instanceof Start s) || s.iteration() != iteration) {
            throw new HarnessException("Iteration " + iteration + ": expected Start, got " + start);
        }

        CancellationToken token = new CancellationToken();
        ScheduledFuture<?> deadline = deadlines.schedule(
                token::cancel, config.iterationTimeout().toNanos(), TimeUnit.NANOSECONDS);
        ControlMessage outcome;
        try {
            PresentmentResult result = reader.build().run(prepare.deviceEngagement(), prepare.style(), token);
            outcome = new Success(iteration, result.transactionTime().toMillis(),
                    result.scanningTimeOptional().map(Duration::toMillis).orElse(null));
        } catch (ConnectionTimeoutException | MessageTimeoutException e) {
            log.warn("Iteration {}: reader timed out: {}", iteration, e.getMessage());
            outcome = new Timeout(iteration);
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.warn("Iteration {}: reader cut off by iteration deadline", iteration);
                outcome = new Timeout(iteration);
            } else {
                log.warn("Iteration {}: reader failed", iteration, e);
                outcome = new Failed(iteration, String.valueOf(e));
            }
        } finally {
            deadline.cancel(false);
        }
        connection.send(outcome);
    }

    @Override
    public void close() {
        deadlines.shutdownNow();
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private HarnessConfig config = HarnessConfig.defaults();
        private MdocTransportFactory transportFactory;
        private final List<DocRequest> docRequests = new ArrayList<>();
        private CoseSigner readerKey;
        private List<X509Certificate> readerCertChain = List.of();
        private MdocObservabilitySink sink = new Slf4jMdocObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        private Builder() {}

        public Builder withConfig(HarnessConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withTransportFactory(MdocTransportFactory transportFactory) {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
            return this;
        }

        public Builder withDocRequest(DocRequest docRequest) {
            this.docRequests.add(Objects.requireNonNull(docRequest, "docRequest"));
            return this;
        }

        public Builder withReaderAuthentication(CoseSigner readerKey, List<X509Certificate> certChain) {
            this.readerKey = Objects.requireNonNull(readerKey, "readerKey");
            this.readerCertChain = List.copyOf(certChain);
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

        public HarnessClient build() {
            return new HarnessClient(this);
        }
    }
}

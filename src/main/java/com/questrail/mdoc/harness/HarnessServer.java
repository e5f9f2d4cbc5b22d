package com.questrail.mdoc.harness;

import com.questrail.mdoc.config.HarnessConfig;
import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.harness.ControlMessage.Done;
import com.questrail.mdoc.harness.ControlMessage.Failed;
import com.questrail.mdoc.harness.ControlMessage.Plan;
import com.questrail.mdoc.harness.ControlMessage.Prepare;
import com.questrail.mdoc.harness.ControlMessage.Prepared;
import com.questrail.mdoc.harness.ControlMessage.Result;
import com.questrail.mdoc.harness.ControlMessage.Start;
import com.questrail.mdoc.harness.ControlMessage.Success;
import com.questrail.mdoc.harness.ControlMessage.Timeout;
import com.questrail.mdoc.harness.netty.NettyControlServer;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.Slf4jMdocObservabilitySink;
import com.questrail.mdoc.presentment.HolderPresentment;
import com.questrail.mdoc.presentment.HolderPresentment.PreparedEngagement;
import com.questrail.mdoc.presentment.MdocCredential;
import com.questrail.mdoc.presentment.PresentmentResult;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.ConnectionTimeoutException;
import com.questrail.mdoc.transport.MdocTransportFactory;
import com.questrail.mdoc.transport.MessageTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HarnessServer
 * =============================================================================
 * Holder side of the multi-device test harness.
 *
 * <p>The server binds the control socket, hands its connection code
 * ({@code host:port}) to the operator, and drives a {@link TestPlan} against
 * the single {@link HarnessClient} that connects. Each iteration presents one
 * credential over a fresh BLE connection method while the client runs the
 * reader side; both outcomes are folded into one {@link TestResult}.</p>
 *
 * <h2>Timeouts</h2>
 * Every iteration runs under its own {@link CancellationToken} which is
 * cancelled once {@link HarnessConfig#iterationTimeout()} has elapsed. A holder
 * session that ends with a connection or message timeout, or that was cut
 * short by that deadline, counts as a holder timeout; any other failure is a
 * holder error.
 *
 * <h2>Threading</h2>
 * {@link #run(Duration)} blocks the calling thread. {@link #cancel()} may be
 * called from any thread; the current iteration is aborted and the plan stops
 * after it.
 */
public final class HarnessServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HarnessServer.class);

    private final HarnessConfig config;
    private final TestPlan plan;
    private final MdocTransportFactory transportFactory;
    private final List<MdocCredential> credentials;
    private final MdocObservabilitySink sink;
    private final MonotonicClock clock;

    private final NettyControlServer controlServer = new NettyControlServer();
    private final ScheduledExecutorService deadlines;
    private final AtomicReference<CancellationToken> currentIteration = new AtomicReference<>();

    private volatile InetSocketAddress boundAddress;
    private volatile boolean cancelled;

    private HarnessServer(Builder b) {
        this.config = b.config;
        this.plan = Objects.requireNonNull(b.plan, "plan");
        this.transportFactory = Objects.requireNonNull(b.transportFactory, "transportFactory");
        if (b.credentials.isEmpty()) {
            throw new IllegalArgumentException("At least one credential is required");
        }
        this.credentials = List.copyOf(b.credentials);
        this.sink = b.sink;
        this.clock = b.clock;
        this.deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mdoc-harness-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds the control socket.
     *
     * @return the connection code the client needs
     */
    public String start() {
        boundAddress = controlServer.bind(config.bindAddress());
        return connectionCode();
    }

    /**
     * @throws IllegalStateException before {@link #start()}
     */
    public String connectionCode() {
        InetSocketAddress address = boundAddress;
        if (address == null) {
            throw new IllegalStateException("Harness server not started");
        }
        return address.getHostString() + ":" + address.getPort();
    }

    /**
     * Waits for the client and runs the whole plan.
     *
     * @param acceptTimeout how long to wait for the client to connect
     * @return the aggregated result, also sent to the client
     * @throws HarnessException if the control channel fails
     */
    public TestResult run(Duration acceptTimeout) {
        Objects.requireNonNull(acceptTimeout, "acceptTimeout");
        try (ControlConnection connection = controlServer.accept(acceptTimeout)) {
            log.info("Harness client connected, running {} iteration(s)", plan.totalIterations());
            connection.send(new Plan(plan));

            TestResult.Accumulator accumulator = new TestResult.Accumulator(plan.totalIterations());
            int iteration = 0;
            outer:
            for (TestPlan.Entry entry : plan.entries()) {
                for (int n = 0; n < entry.iterations(); n++) {
                    if (cancelled) {
                        log.info("Harness cancelled after {} iteration(s)", iteration);
                        break outer;
                    }
                    iteration++;
                    runIteration(connection, entry, iteration, accumulator);
                }
            }

            TestResult result = accumulator.snapshot();
            connection.send(new Result(result));
            connection.send(Done.INSTANCE);
            log.info("Harness finished: {}/{} successful", result.numIterationsSuccessful(),
                    result.numIterationsTotal());
            return result;
        }
    }

    private void runIteration(ControlConnection connection,
                              TestPlan.Entry entry,
                              int iteration,
                              TestResult.Accumulator accumulator)
    {
        HarnessTransport flavour = entry.transport();
        MdocTransportOptions options = config.transportOptions().withBleUseL2cap(flavour.useL2cap());
        HolderPresentment.Builder holder = HolderPresentment.builder()
                .withTransportFactory(transportFactory)
                .withTransportOptions(options)
                .withConnectionMethod(flavour.newConnectionMethod())
                .withMessageTimeout(config.messageTimeout())
                .withObservabilitySink(sink)
                .withClock(clock);
        credentials.forEach(holder::withCredential);

        CancellationToken token = new CancellationToken();
        currentIteration.set(token);
        ScheduledFuture<?> deadline = deadlines.schedule(
                token::cancel, config.iterationTimeout().toNanos(), TimeUnit.NANOSECONDS);

        boolean started = false;
        boolean holderSuccess = false;
        Duration holderScanning = null;
        PreparedEngagement prepared = null;
        try {
            prepared = holder.build().prepare();
            connection.send(new Prepare(iteration, accumulator.total(), flavour, entry.style(),
                    prepared.encodedDeviceEngagement()));
            expect(connection.receive(config.iterationTimeout()), Prepared.class, iteration);
            connection.send(new Start(iteration));
            started = true;

            PresentmentResult result = prepared.run(entry.style(), token);
            holderSuccess = true;
            holderScanning = result.scanningTime();
        } catch (HarnessException e) {
            throw e;
        } catch (ConnectionTimeoutException | MessageTimeoutException e) {
            log.warn("Iteration {}: holder timed out: {}", iteration, e.getMessage());
            accumulator.holderTimeout();
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.warn("Iteration {}: holder cut off by iteration deadline", iteration);
                accumulator.holderTimeout();
            } else {
                log.warn("Iteration {}: holder failed", iteration, e);
                accumulator.holderError();
            }
        } finally {
            deadline.cancel(false);
            currentIteration.set(null);
            if (prepared != null && !started) {
                // Never handed to run(); stop advertising
                prepared.transport().close();
            }
        }

        if (!started) {
            accumulator.iterationDone(iteration, false);
            return;
        }

        boolean readerSuccess = false;
        Long readerScanning = null;
        ControlMessage outcome = connection.receive(config.iterationTimeout().plus(config.messageTimeout()));
        if (outcome instanceof Success success) {
            expectIteration(success.iteration(), iteration);
            readerSuccess = true;
            readerScanning = success.scanningMillis();
            accumulator.transactionTime(success.transactionMillis());
        } else if (outcome instanceof Timeout timeout) {
            expectIteration(timeout.iteration(), iteration);
            accumulator.readerTimeout();
        } else if (outcome instanceof Failed failed) {
            expectIteration(failed.iteration(), iteration);
            log.warn("Iteration {}: reader failed: {}", iteration, failed.reason());
            accumulator.readerError();
        } else {
            throw new HarnessException("Unexpected control message " + outcome);
        }

        if (holderScanning != null) {
            accumulator.scanningTime(holderScanning.toNanos() / 1_000_000.0);
        } else if (readerScanning != null) {
            accumulator.scanningTime(readerScanning);
        }
        boolean success = holderSuccess && readerSuccess;
        accumulator.iterationDone(iteration, success);
        log.info("Iteration {}/{} ({}, {}): {}", iteration, accumulator.total(), flavour, entry.style(),
                success ? "ok" : "FAILED");
    }

    private static void expect(ControlMessage message, Class<? extends ControlMessage> type, int iteration) {
        if (!type.isInstance(message)) {
            throw new HarnessException("Iteration " + iteration + ": expected " + type.getSimpleName()
                    + ", got " + message);
        }
        if (message instanceof Prepared prepared) {
            expectIteration(prepared.iteration(), iteration);
        }
    }

    private static void expectIteration(int actual, int expected) {
        if (actual != expected) {
            throw new HarnessException("Client answered for iteration " + actual + ", expected " + expected);
        }
    }

    /**
     * Aborts the running iteration and stops the plan after it.
     */
    public void cancel() {
        cancelled = true;
        CancellationToken token = currentIteration.get();
        if (token != null) {
            token.cancel();
        }
    }

    @Override
    public void close() {
        cancel();
        controlServer.close();
        deadlines.shutdownNow();
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private HarnessConfig config = HarnessConfig.defaults();
        private TestPlan plan;
        private MdocTransportFactory transportFactory;
        private final List<MdocCredential> credentials = new ArrayList<>();
        private MdocObservabilitySink sink = new Slf4jMdocObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        private Builder() {}

        public Builder withConfig(HarnessConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withPlan(TestPlan plan) {
            this.plan = Objects.requireNonNull(plan, "plan");
            return this;
        }

        public Builder withTransportFactory(MdocTransportFactory transportFactory) {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
            return this;
        }

        public Builder withCredential(MdocCredential credential) {
            this.credentials.add(Objects.requireNonNull(credential, "credential"));
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

        public HarnessServer build() {
            return new HarnessServer(this);
        }
    }
}

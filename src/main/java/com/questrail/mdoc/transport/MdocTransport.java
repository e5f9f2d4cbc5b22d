package com.questrail.mdoc.transport;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.internal.time.Cancellable;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocErrorEvent;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.TransportStateTransitionEvent;
import com.questrail.mdoc.session.SessionData;

import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * MdocTransport
 * =============================================================================
 * One message pipe between holder and reader over one connection method, in
 * one role.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * INITIALIZING --open()--> CONNECTING --link up--> CONNECTED
 * CONNECTED --close() / status 20 / transport termination / empty message--> CLOSING
 * CLOSING --released--> CLOSED
 * any I/O failure --> FAILED
 * </pre>
 *
 * <p>{@code CLOSED} and {@code FAILED} are terminal. Once there, every blocked or
 * later {@link #sendMessage(byte[])} and {@link #waitForMessage(Duration, CancellationToken)}
 * fails with {@link TransportClosedException} or {@link TransportFailedException}.</p>
 *
 * <h2>Termination sentinel</h2>
 * A transport-specific termination from the peer (BLE state END, BLE disconnect,
 * NFC deactivation) is delivered as a zero-length message. Sending a zero-length
 * message performs the transport-specific termination towards the peer.
 *
 * <h2>Subclass contract</h2>
 * Subclasses implement the physical link in {@link #doOpen}, {@link #doSend} and
 * {@link #doClose}, and feed inbound traffic through {@link #deliverMessage(byte[])},
 * {@link #onPeerTerminated()} and {@link #fail(Throwable)}. Port callbacks may
 * arrive on any thread.
 */
public abstract class MdocTransport
{
    /** Marker put on the inbox to wake a blocked reader after close or failure. */
    private sealed interface Inbound permits Message, Wakeup {}

    private record Message(byte[] bytes) implements Inbound {}

    private enum Wakeup implements Inbound { INSTANCE }

    private static final long POLL_MILLIS = 20;

    private final Role role;
    private final ConnectionMethod connectionMethod;
    protected final MdocTransportOptions options;
    protected final MdocObservabilitySink sink;
    protected final MonotonicClock clock;

    private final Object lock = new Object();
    private final LinkedBlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private TransportState state = TransportState.INITIALIZING;
    private Throwable failureCause;
    private Cancellable cancelRegistration;

    protected MdocTransport(Role role,
                            ConnectionMethod connectionMethod,
                            MdocTransportOptions options,
                            MdocObservabilitySink sink,
                            MonotonicClock clock)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.connectionMethod = Objects.requireNonNull(connectionMethod, "connectionMethod");
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    public final Role role() {
        return role;
    }

    /**
     * The connection method as the peer should see it. Transports that only learn
     * parts of it while advertising (an L2CAP PSM) return the completed method.
     */
    public ConnectionMethod connectionMethod() {
        return connectionMethod;
    }

    public final TransportState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Time the GATT central spent scanning before it found the peer, if this
     * transport scanned.
     */
    public Optional<Duration> scanningTime() {
        return Optional.empty();
    }

    /**
     * Makes the transport discoverable before {@link #open} so that an engagement
     * can advertise what it learns. Transports without an advertising phase do
     * nothing.
     */
    public void advertise() {
    }

    /**
     * Establishes the physical link. Blocks until CONNECTED.
     *
     * @param eDeviceKey the holder's ephemeral device key from the engagement
     * @param token      cancelling it closes this transport
     * @throws ConnectionTimeoutException if the link is not up within the connect timeout
     * @throws TransportClosedException   if the transport was closed or cancelled meanwhile
     * @throws TransportFailedException   on I/O failure
     */
    public final void open(ECPublicKey eDeviceKey, CancellationToken token) {
        Objects.requireNonNull(eDeviceKey, "eDeviceKey");
        Objects.requireNonNull(token, "token");
        synchronized (lock) {
            if (state != TransportState.INITIALIZING) {
                throw new IllegalStateException("open() called in state " + state);
            }
            transition(TransportState.CONNECTING);
        }
        cancelRegistration = token.onCancel(this::close);
        try {
            doOpen(eDeviceKey, token);
        } catch (ConnectionTimeoutException e) {
            fail(e);
            throw e;
        } catch (TransportFailedException e) {
            fail(e);
            throw e;
        } catch (TransportClosedException e) {
            throwIfNotUsable();
            throw e;
        } catch (RuntimeException e) {
            fail(e);
            throw new TransportFailedException("Failed to open " + name(), e);
        }
        synchronized (lock) {
            if (state == TransportState.CONNECTING) {
                transition(TransportState.CONNECTED);
                return;
            }
        }
        throwIfNotUsable();
    }

    /**
     * Sends one message. A zero-length message performs the transport-specific
     * termination and moves to CLOSING. A SessionData carrying status 20 also
     * moves to CLOSING once sent.
     */
    public final void sendMessage(byte[] message) {
        Objects.requireNonNull(message, "message");
        synchronized (lock) {
            switch (state) {
                case CONNECTED:
                    break;
                case INITIALIZING:
                case CONNECTING:
                    throw new IllegalStateException("sendMessage() called in state " + state);
                default:
                    throwIfNotUsable();
            }
        }
        try {
            if (message.length == 0) {
                doSendTransportSpecificTermination();
            } else {
                doSend(message);
            }
        } catch (TransportClosedException | TransportFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(e);
            throw new TransportFailedException("Failed to send on " + name(), e);
        }
        if (message.length == 0 || isSessionTermination(message)) {
            enterClosing();
        }
    }

    /**
     * Waits for the next message.
     *
     * @return the message, or a zero-length array for a transport-specific termination
     * @throws MessageTimeoutException  if nothing arrives within {@code timeout}
     * @throws TransportClosedException if the transport is closed, is closed while waiting, or is
     *                                  closing with no message left to read
     * @throws TransportFailedException if the transport failed
     */
    public final byte[] waitForMessage(Duration timeout, CancellationToken token) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(token, "token");
        synchronized (lock) {
            if (state == TransportState.INITIALIZING) {
                throw new IllegalStateException("waitForMessage() called before open()");
            }
        }
        Cancellable registration = token.onCancel(this::close);
        try {
            Inbound item;
            if (state().isTerminal()) {
                throwIfNotUsable();
            }
            // A termination is queued before CLOSING is entered, so an empty inbox here is final.
            if (state() == TransportState.CLOSING && inbox.isEmpty()) {
                throw new TransportClosedException(name() + " is closing and has nothing left to read");
            }
            try {
                item = inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new TransportClosedException("Interrupted while waiting for a message", e);
            }
            if (item == null) {
                throw new MessageTimeoutException("No message within " + timeout);
            }
            if (item instanceof Message m) {
                if (m.bytes().length == 0 || isSessionTermination(m.bytes())) {
                    enterClosing();
                }
                return m.bytes();
            }
            // Woken by close or failure; keep the marker for other waiters.
            inbox.offer(Wakeup.INSTANCE);
            throwIfNotUsable();
            throw new TransportClosedException(name() + " woken in state " + state());
        } finally {
            registration.cancel();
        }
    }

    /**
     * Releases the link and moves to CLOSED. Idempotent; does nothing once FAILED.
     */
    public final void close() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            if (state != TransportState.CLOSING) {
                transition(TransportState.CLOSING);
            }
        }
        try {
            doClose();
        } catch (RuntimeException e) {
            sink.onError(new MdocErrorEvent(Instant.now(), "Error while closing " + name(), e));
        }
        synchronized (lock) {
            if (!state.isTerminal()) {
                transition(TransportState.CLOSED);
            }
        }
        wakeWaiters();
        Cancellable registration = cancelRegistration;
        if (registration != null) {
            registration.cancel();
        }
    }

    // -------------------------------------------------------------------------
    // Subclass hooks
    // -------------------------------------------------------------------------

    /** Short human-readable name used in events and messages. */
    protected abstract String name();

    /**
     * Brings up the physical link. Returns once the link is usable; the base
     * class then moves to CONNECTED.
     */
    protected abstract void doOpen(ECPublicKey eDeviceKey, CancellationToken token);

    protected abstract void doSend(byte[] message);

    /** Signals termination to the peer without a message (BLE state END, disconnect). */
    protected abstract void doSendTransportSpecificTermination();

    /** Releases all resources. Must be idempotent and must not block on the peer. */
    protected abstract void doClose();

    // -------------------------------------------------------------------------
    // Inbound events from subclasses
    // -------------------------------------------------------------------------

    /** Queues one complete inbound message. */
    protected final void deliverMessage(byte[] message) {
        Objects.requireNonNull(message, "message");
        if (state().isTerminal()) {
            return;
        }
        inbox.offer(new Message(message));
        if (message.length == 0 || isSessionTermination(message)) {
            enterClosing();
        }
    }

    /** The peer terminated in the transport-specific way. */
    protected final void onPeerTerminated() {
        if (state() == TransportState.CONNECTING) {
            fail(new TransportFailedException("Peer went away while connecting"));
            return;
        }
        deliverMessage(new byte[0]);
    }

    /** Moves to FAILED and wakes all waiters. */
    protected final void fail(Throwable cause) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            failureCause = cause;
            transition(TransportState.FAILED);
        }
        sink.onError(new MdocErrorEvent(Instant.now(), name() + " failed", cause));
        try {
            doClose();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        wakeWaiters();
    }

    /**
     * Blocks until {@code latch} opens, the transport leaves CONNECTING, the
     * token is cancelled, or the connect timeout passes.
     *
     * @throws ConnectionTimeoutException on timeout
     * @throws TransportClosedException   if closed or cancelled meanwhile
     * @throws TransportFailedException   if failed meanwhile
     */
    protected final void awaitLink(CountDownLatch latch, CancellationToken token, String what) {
        long deadline = clock.nowNanos() + options.connectTimeout().toNanos();
        try {
            while (!latch.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled() || state() != TransportState.CONNECTING) {
                    throwIfNotUsable();
                    throw new TransportClosedException(name() + " closed while waiting for " + what);
                }
                if (clock.nowNanos() - deadline >= 0) {
                    throw new ConnectionTimeoutException("Timed out waiting for " + what);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportClosedException("Interrupted while waiting for " + what, e);
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void enterClosing() {
        synchronized (lock) {
            if (state == TransportState.CONNECTED) {
                transition(TransportState.CLOSING);
            }
        }
    }

    private void wakeWaiters() {
        inbox.clear();
        inbox.offer(Wakeup.INSTANCE);
    }

    private void throwIfNotUsable() {
        synchronized (lock) {
            if (state == TransportState.FAILED) {
                throw new TransportFailedException(name() + " has failed", failureCause);
            }
            if (state == TransportState.CLOSING || state == TransportState.CLOSED) {
                throw new TransportClosedException(name() + " is " + state);
            }
        }
    }

    private void transition(TransportState newState) {
        // Caller holds the lock.
        TransportState old = state;
        state = newState;
        sink.onTransportStateTransition(
                new TransportStateTransitionEvent(Instant.now(), name(), role, old, newState));
    }

    private static boolean isSessionTermination(byte[] message) {
        return SessionData.peekStatus(message).orElse(-1) == SessionData.STATUS_SESSION_TERMINATION;
    }
}

package com.questrail.mdoc.transport.nfc;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.NfcConnectionMethod;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.MdocTransport;
import com.questrail.mdoc.transport.TransportState;

import java.io.ByteArrayOutputStream;
import java.security.interfaces.ECPublicKey;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

/**
 * NfcMdocTransport
 * =============================================================================
 * Holder side of NFC data retrieval, driven by host card emulation.
 *
 * <p>The platform's card emulation service forwards every APDU routed to the
 * data transfer AID to {@link #processCommandApdu(byte[], Consumer)} and reports
 * field loss through {@link #onDeactivated()}. There is no global registry; the
 * service holds the instance of the current session.</p>
 *
 * <h2>Command handling</h2>
 * <ul>
 *   <li>SELECT (P1 {@code 04}) of the data transfer AID: {@code 90 00}, link up;
 *       any other AID: {@code 6A 82}</li>
 *   <li>ENVELOPE with CLA {@code 10}: chunk buffered, {@code 90 00}</li>
 *   <li>ENVELOPE with CLA {@code 00}: the buffered DO53 is unwrapped and delivered,
 *       Le is remembered; the response is deferred until {@link #sendMessage}</li>
 *   <li>GET RESPONSE: next chunk of the outgoing message</li>
 *   <li>other instructions: {@code 6D 00}; any processing error: {@code 6F 00}</li>
 * </ul>
 *
 * <p>Outgoing messages are answered Le bytes at a time with {@code 90 00} on the
 * last chunk, {@code 61 XX} when at most 255 bytes remain and {@code 61 00}
 * otherwise. A message sent while no ENVELOPE is outstanding waits for the
 * reader's next ENVELOPE. After a clean close, GET RESPONSE still drains what
 * was already queued; every other command gets {@code 6F 00}.</p>
 *
 * <p>NFC has no way for the holder to signal termination without a message, so
 * sending a zero-length message only moves this side to CLOSING.</p>
 */
public final class NfcMdocTransport extends MdocTransport
{
    private final NfcConnectionMethod nfc;
    private final Object apduLock = new Object();
    private final CountDownLatch selected = new CountDownLatch(1);

    private final ByteArrayOutputStream incoming = new ByteArrayOutputStream();
    private final Deque<byte[]> outgoing = new ArrayDeque<>();
    private byte[] current;
    private int currentOffset;
    private int leReceived;
    private Consumer<byte[]> deferredResponder;
    private boolean applicationSelected;
    private boolean inError;

    public NfcMdocTransport(NfcConnectionMethod connectionMethod,
                            MdocTransportOptions options,
                            MdocObservabilitySink sink,
                            MonotonicClock clock)
    {
        super(Role.HOLDER, connectionMethod, options, sink, clock);
        this.nfc = connectionMethod;
    }

    @Override
    protected String name() {
        return "NFC (holder)";
    }

    // -------------------------------------------------------------------------
    // Card emulation entry points
    // -------------------------------------------------------------------------

    /**
     * Processes one command APDU. The response is passed to {@code sendResponse},
     * either before this method returns or later, when a deferred ENVELOPE
     * response becomes available.
     */
    public void processCommandApdu(byte[] commandApdu, Consumer<byte[]> sendResponse) {
        Objects.requireNonNull(commandApdu, "commandApdu");
        Objects.requireNonNull(sendResponse, "sendResponse");
        ResponseApdu response;
        byte[] delivered = null;
        synchronized (apduLock) {
            if (!inError && state() == TransportState.CLOSED && hasPendingResponse()) {
                response = drainAfterClose(commandApdu);
            } else if (inError || state().isTerminal()) {
                response = ResponseApdu.ofStatus(Nfc.STATUS_NO_PRECISE_DIAGNOSIS);
            } else {
                try {
                    CommandApdu command = CommandApdu.decode(commandApdu);
                    switch (command.ins()) {
                        case Nfc.INS_SELECT:
                            response = processSelect(command);
                            break;
                        case Nfc.INS_ENVELOPE:
                            if (!applicationSelected) {
                                throw new IllegalStateException("ENVELOPE before SELECT");
                            }
                            delivered = processEnvelope(command);
                            response = delivered == null
                                    ? ResponseApdu.ofStatus(Nfc.STATUS_SUCCESS)
                                    : nextChunk(leReceived);
                            if (response == null) {
                                deferredResponder = sendResponse;
                            }
                            break;
                        case Nfc.INS_GET_RESPONSE:
                            if (!applicationSelected) {
                                throw new IllegalStateException("GET RESPONSE before SELECT");
                            }
                            response = nextChunk(command.le() == 0 ? leReceived : command.le());
                            if (response == null) {
                                throw new IllegalStateException("GET RESPONSE with nothing pending");
                            }
                            break;
                        default:
                            inError = true;
                            response = ResponseApdu.ofStatus(Nfc.STATUS_INSTRUCTION_NOT_SUPPORTED);
                            break;
                    }
                } catch (ApplicationNotFound e) {
                    inError = true;
                    response = ResponseApdu.ofStatus(Nfc.STATUS_FILE_OR_APPLICATION_NOT_FOUND);
                } catch (RuntimeException e) {
                    inError = true;
                    fail(e);
                    response = ResponseApdu.ofStatus(Nfc.STATUS_NO_PRECISE_DIAGNOSIS);
                }
            }
        }
        if (delivered != null) {
            deliverMessage(delivered);
        }
        if (response != null) {
            sendResponse.accept(response.encode());
        }
    }

    /** The reader's field went away; a transport-specific termination. */
    public void onDeactivated() {
        if (state() == TransportState.INITIALIZING) {
            return;
        }
        onPeerTerminated();
    }

    // -------------------------------------------------------------------------
    // APDU processing, under apduLock
    // -------------------------------------------------------------------------

    private static final class ApplicationNotFound extends RuntimeException
    {
        ApplicationNotFound() {
            super(null, null, false, false);
        }
    }

    private ResponseApdu processSelect(CommandApdu command) {
        if (command.p1() != Nfc.INS_SELECT_P1_APPLICATION) {
            throw new IllegalStateException("Unsupported SELECT P1 " + command.p1());
        }
        if (!Arrays.equals(command.data(), Nfc.dataTransferApplicationId())) {
            throw new ApplicationNotFound();
        }
        applicationSelected = true;
        selected.countDown();
        return ResponseApdu.ofStatus(Nfc.STATUS_SUCCESS);
    }

    /** @return the complete message on the last ENVELOPE, otherwise {@code null} */
    private byte[] processEnvelope(CommandApdu command) {
        incoming.write(command.data(), 0, command.data().length);
        if (command.cla() == Nfc.CLA_CHAIN_NOT_LAST) {
            return null;
        }
        if (command.cla() != Nfc.CLA_CHAIN_LAST) {
            throw new IllegalStateException("Unexpected ENVELOPE CLA " + command.cla());
        }
        leReceived = command.le() == 0 ? nfc.responseDataFieldMaxLength() : command.le();
        byte[] message = Do53.unwrap(incoming.toByteArray());
        incoming.reset();
        return message;
    }

    private boolean hasPendingResponse() {
        return current != null || !outgoing.isEmpty();
    }

    /** After a clean close the reader may still fetch the rest of the last response. */
    private ResponseApdu drainAfterClose(byte[] commandApdu) {
        CommandApdu command;
        try {
            command = CommandApdu.decode(commandApdu);
        } catch (IllegalArgumentException e) {
            return ResponseApdu.ofStatus(Nfc.STATUS_NO_PRECISE_DIAGNOSIS);
        }
        if (command.ins() != Nfc.INS_GET_RESPONSE) {
            return ResponseApdu.ofStatus(Nfc.STATUS_NO_PRECISE_DIAGNOSIS);
        }
        return nextChunk(command.le() == 0 ? leReceived : command.le());
    }

    private ResponseApdu nextChunk(int le) {
        if (current == null) {
            current = outgoing.poll();
            currentOffset = 0;
            if (current == null) {
                return null;
            }
        }
        int available = current.length - currentOffset;
        int size = Math.min(le, available);
        byte[] chunk = Arrays.copyOfRange(current, currentOffset, currentOffset + size);
        currentOffset += size;
        int remaining = available - size;
        if (remaining == 0) {
            current = null;
            return new ResponseApdu(chunk, Nfc.STATUS_SUCCESS);
        }
        if (remaining <= 255) {
            return new ResponseApdu(chunk, Nfc.STATUS_BYTES_STILL_AVAILABLE | remaining);
        }
        return new ResponseApdu(chunk, Nfc.STATUS_BYTES_STILL_AVAILABLE);
    }

    // -------------------------------------------------------------------------
    // MdocTransport
    // -------------------------------------------------------------------------

    @Override
    protected void doOpen(ECPublicKey eDeviceKey, CancellationToken token) {
        awaitLink(selected, token, "the reader to select the application");
    }

    @Override
    protected void doSend(byte[] message) {
        ResponseApdu response = null;
        Consumer<byte[]> responder;
        synchronized (apduLock) {
            if (leReceived == 0) {
                throw new IllegalStateException("Cannot send before a message was received");
            }
            outgoing.add(Do53.wrap(message));
            responder = deferredResponder;
            if (responder != null) {
                deferredResponder = null;
                response = nextChunk(leReceived);
            }
        }
        if (response != null) {
            responder.accept(response.encode());
        }
    }

    @Override
    protected void doSendTransportSpecificTermination() {
        // Nothing to put on the wire.
    }

    @Override
    protected void doClose() {
        synchronized (apduLock) {
            deferredResponder = null;
            if (state() == TransportState.FAILED) {
                outgoing.clear();
                current = null;
            }
        }
    }
}

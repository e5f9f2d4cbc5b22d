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
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * NfcReaderTransport
 * =============================================================================
 * Reader side of NFC data retrieval.
 *
 * <p>Each sent message is one transceive cycle, run on a dedicated I/O thread:
 * the DO53-wrapped message goes out in ENVELOPE commands of at most
 * {@code min(commandDataFieldMaxLength, maxTransceiveLength - 7)} bytes, the last
 * one carrying Le; the answer is collected from the ENVELOPE response and any
 * GET RESPONSE follow-ups and delivered as the next inbound message.</p>
 *
 * <p>Sending a zero-length message releases the tag, which the holder observes
 * as a deactivation.</p>
 */
public final class NfcReaderTransport extends MdocTransport
{
    private final NfcIsoTag tag;
    private final int commandChunkSize;
    private final int responseMaxLength;
    private final ExecutorService io;

    public NfcReaderTransport(NfcConnectionMethod connectionMethod,
                              NfcIsoTag tag,
                              MdocTransportOptions options,
                              MdocObservabilitySink sink,
                              MonotonicClock clock)
    {
        super(Role.READER, connectionMethod, options, sink, clock);
        this.tag = Objects.requireNonNull(tag, "tag");
        int limit = tag.maxTransceiveLength() - Nfc.APDU_OVERHEAD;
        this.commandChunkSize = Math.min(connectionMethod.commandDataFieldMaxLength(), limit);
        this.responseMaxLength = Math.min(connectionMethod.responseDataFieldMaxLength(), limit);
        if (commandChunkSize <= 0 || responseMaxLength <= 0) {
            throw new IllegalArgumentException("Tag transceive length too small: " + tag.maxTransceiveLength());
        }
        this.io = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mdoc-nfc-reader-io");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected String name() {
        return "NFC (reader)";
    }

    int commandChunkSize() {
        return commandChunkSize;
    }

    int responseMaxLength() {
        return responseMaxLength;
    }

    @Override
    protected void doOpen(ECPublicKey eDeviceKey, CancellationToken token) {
        ResponseApdu response = transceive(CommandApdu.of(
                0x00, Nfc.INS_SELECT, Nfc.INS_SELECT_P1_APPLICATION, Nfc.INS_SELECT_P2_NO_RESPONSE_DATA,
                Nfc.dataTransferApplicationId(), 0));
        if (response.status() != Nfc.STATUS_SUCCESS) {
            throw new NfcCommandFailedException("SELECT of data transfer application failed", response.status());
        }
    }

    @Override
    protected void doSend(byte[] message) {
        try {
            io.execute(() -> {
                try {
                    deliverMessage(exchange(message));
                } catch (RuntimeException e) {
                    // An exchange cut short by our own termination is not a failure.
                    if (state() == TransportState.CONNECTED) {
                        fail(e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("NFC I/O thread is shut down", e);
        }
    }

    private byte[] exchange(byte[] message) {
        byte[] encapsulated = Do53.wrap(message);
        ResponseApdu last = null;
        for (int offset = 0; offset < encapsulated.length; offset += commandChunkSize) {
            int end = Math.min(encapsulated.length, offset + commandChunkSize);
            boolean more = end < encapsulated.length;
            ResponseApdu response = transceive(CommandApdu.of(
                    more ? Nfc.CLA_CHAIN_NOT_LAST : Nfc.CLA_CHAIN_LAST,
                    Nfc.INS_ENVELOPE, 0x00, 0x00,
                    Arrays.copyOfRange(encapsulated, offset, end),
                    more ? 0 : responseMaxLength));
            if (response.status() != Nfc.STATUS_SUCCESS && !response.hasMoreData()) {
                throw new NfcCommandFailedException("Unexpected ENVELOPE status", response.status());
            }
            last = response;
        }

        ByteArrayOutputStream answer = new ByteArrayOutputStream();
        answer.write(last.data(), 0, last.data().length);
        ResponseApdu response = last;
        while (response.status() != Nfc.STATUS_SUCCESS) {
            int available = response.status() & 0xff;
            int le = available == 0 ? responseMaxLength : Math.min(available, responseMaxLength);
            response = transceive(CommandApdu.of(0x00, Nfc.INS_GET_RESPONSE, 0x00, 0x00, new byte[0], le));
            if (response.status() != Nfc.STATUS_SUCCESS && !response.hasMoreData()) {
                throw new NfcCommandFailedException("Unexpected GET RESPONSE status", response.status());
            }
            answer.write(response.data(), 0, response.data().length);
        }
        return Do53.unwrap(answer.toByteArray());
    }

    private ResponseApdu transceive(CommandApdu command) {
        return ResponseApdu.decode(tag.transceive(command.encode()));
    }

    @Override
    protected void doSendTransportSpecificTermination() {
        tag.close();
    }

    @Override
    protected void doClose() {
        io.shutdownNow();
        tag.close();
    }
}

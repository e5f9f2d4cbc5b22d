package com.questrail.mdoc.transport.nfc;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * The holder answered an APDU with an unexpected status word.
 */
public final class NfcCommandFailedException extends MdocProtocolException
{
    private final int status;

    public NfcCommandFailedException(String message, int status) {
        super(message + " (status " + Nfc.statusHex(status) + ")");
        this.status = status;
    }

    public int status() {
        return status;
    }
}

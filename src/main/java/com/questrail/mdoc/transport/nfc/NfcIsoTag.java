package com.questrail.mdoc.transport.nfc;

/**
 * NfcIsoTag
 * -----------------------------------------------------------------------------
 * Port for an ISO 14443-4 tag as seen by a reader's NFC controller.
 *
 * <p>Radio errors surface as unchecked exceptions.</p>
 */
public interface NfcIsoTag
{
    /** Largest APDU, command or response, the controller can exchange. */
    int maxTransceiveLength();

    /**
     * Sends one command APDU and blocks for its response APDU.
     */
    byte[] transceive(byte[] commandApdu);

    /** Releases the tag; the holder sees a deactivation. Idempotent. */
    void close();
}

package com.questrail.mdoc.presentment;

/**
 * How a presentment session ends once the response has been delivered.
 */
public enum TerminationStyle
{
    /** The holder attaches status 20 to the envelope carrying the response. */
    IN_BAND_STATUS(true),

    /** The holder sends the response, then a data-less status 20 envelope. */
    HOLDER_TERMINATION_MESSAGE(true),

    /** The holder sends the response, then terminates the transport (BLE state END). */
    HOLDER_TRANSPORT_SPECIFIC(true),

    /** The reader sends a status 20 envelope after receiving the response. */
    READER_TERMINATION_MESSAGE(false),

    /** The reader terminates the transport after receiving the response. */
    READER_TRANSPORT_SPECIFIC(false);

    private final boolean holderTerminates;

    TerminationStyle(boolean holderTerminates) {
        this.holderTerminates = holderTerminates;
    }

    public boolean holderTerminates() {
        return holderTerminates;
    }
}

package com.questrail.mdoc.transport;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * The transport is CLOSING or CLOSED. Sends and waits issued after close, or blocked when it happened, fail with this.
 */
public class TransportClosedException extends MdocProtocolException
{
    public TransportClosedException(String message) {
        super(message);
    }

    public TransportClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}

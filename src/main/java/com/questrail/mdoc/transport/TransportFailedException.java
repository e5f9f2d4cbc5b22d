package com.questrail.mdoc.transport;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * An I/O failure moved the transport to FAILED.
 */
public class TransportFailedException extends MdocProtocolException
{
    public TransportFailedException(String message) {
        super(message);
    }

    public TransportFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

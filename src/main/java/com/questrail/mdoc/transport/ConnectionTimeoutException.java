package com.questrail.mdoc.transport;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * The physical link, or a connection method choice, was not established in time.
 */
public class ConnectionTimeoutException extends MdocProtocolException
{
    public ConnectionTimeoutException(String message) {
        super(message);
    }

    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.presentment;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * The peer sent a message the session did not expect at that point.
 */
public final class UnexpectedMessageException extends MdocProtocolException
{
    public UnexpectedMessageException(String message) {
        super(message);
    }

    public UnexpectedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

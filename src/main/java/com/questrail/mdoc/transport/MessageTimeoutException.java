package com.questrail.mdoc.transport;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * No message arrived within the wait timeout. The transport stays usable.
 */
public class MessageTimeoutException extends MdocProtocolException
{
    public MessageTimeoutException(String message) {
        super(message);
    }

    public MessageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.harness;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * Failure of the harness control channel.
 */
public final class HarnessException extends MdocProtocolException
{
    public HarnessException(String message) {
        super(message);
    }

    public HarnessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.connectionmethod;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * A connection method advertised by the peer is self-contradictory.
 * Recoverable by scanning the engagement again.
 */
public final class MalformedEngagementException extends MdocProtocolException
{
    public MalformedEngagementException(String message) {
        super(message);
    }

    public MalformedEngagementException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.engagement;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * Engagement bytes received from the peer could not be decoded.
 * Recoverable by scanning again.
 */
public final class EngagementParseException extends MdocProtocolException
{
    public EngagementParseException(String message) {
        super(message);
    }

    public EngagementParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

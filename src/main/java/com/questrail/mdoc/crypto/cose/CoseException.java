package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * A COSE structure is malformed or uses an unsupported algorithm.
 */
public final class CoseException extends MdocProtocolException
{
    public CoseException(String message) {
        super(message);
    }

    public CoseException(String message, Throwable cause) {
        super(message, cause);
    }
}

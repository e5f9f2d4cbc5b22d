package com.questrail.mdoc.securearea;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * A secure-area operation was rejected: unknown alias or a purpose the key was
 * not created for.
 */
public final class SecureAreaException extends MdocProtocolException
{
    public SecureAreaException(String message) {
        super(message);
    }

    public SecureAreaException(String message, Throwable cause) {
        super(message, cause);
    }
}

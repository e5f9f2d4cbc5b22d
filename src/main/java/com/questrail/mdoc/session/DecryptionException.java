package com.questrail.mdoc.session;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * A session message could not be decrypted.
 *
 * <p>Raised for every cause (malformed envelope, authentication tag failure,
 * counter mismatch, replay) with the same message, and the session is unusable
 * afterwards.</p>
 */
public final class DecryptionException extends MdocProtocolException
{
    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.session;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * The two ephemeral keys cannot be agreed: different or unsupported curves.
 * Fatal to the session.
 */
public final class KeyAgreementException extends MdocProtocolException
{
    public KeyAgreementException(String message) {
        super(message);
    }

    public KeyAgreementException(String message, Throwable cause) {
        super(message, cause);
    }
}

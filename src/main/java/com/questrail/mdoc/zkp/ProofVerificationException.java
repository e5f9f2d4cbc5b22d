package com.questrail.mdoc.zkp;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * A zero-knowledge proof did not verify.
 */
public final class ProofVerificationException extends MdocProtocolException
{
    public ProofVerificationException(String message) {
        super(message);
    }

    public ProofVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

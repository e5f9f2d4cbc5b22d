package com.questrail.mdoc.model;

/**
 * Root of the unchecked exception hierarchy raised by the presentment stack.
 *
 * <p>Subclasses name the failure domain (engagement, session, transport, proof
 * verification). Callers that only care about "the presentment failed" may catch
 * this type; callers that implement recovery policy catch the specific subclass.</p>
 */
public class MdocProtocolException extends RuntimeException
{
    public MdocProtocolException(String message) {
        super(message);
    }

    public MdocProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.mdoc.cbor;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * Indicates that a well-formed CBOR item does not have the shape a structure
 * requires (missing key, wrong major type, wrong tag).
 *
 * <p>Module decoders catch this and rethrow their own, domain-specific exception.</p>
 */
public final class CborStructureException extends MdocProtocolException
{
    public CborStructureException(String message) {
        super(message);
    }

    public CborStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}

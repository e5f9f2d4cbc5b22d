package com.questrail.mdoc.zkp;

import com.questrail.mdoc.model.MdocProtocolException;

/**
 * No registered {@link ZkSystem} serves the system spec a ZK document names.
 */
public final class ProofSystemNotFoundException extends MdocProtocolException
{
    public ProofSystemNotFoundException(String message) {
        super(message);
    }
}

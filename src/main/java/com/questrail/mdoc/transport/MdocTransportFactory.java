package com.questrail.mdoc.transport;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.model.Role;

/**
 * Creates the transport for a connection method and role.
 */
@FunctionalInterface
public interface MdocTransportFactory
{
    /**
     * @throws IllegalArgumentException if the method cannot be served in {@code role}
     */
    MdocTransport createTransport(ConnectionMethod connectionMethod, Role role, MdocTransportOptions options);
}

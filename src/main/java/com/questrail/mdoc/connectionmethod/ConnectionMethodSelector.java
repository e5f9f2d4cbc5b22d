package com.questrail.mdoc.connectionmethod;

import java.util.List;

/**
 * Picks the connection method to use when the peer advertises several.
 *
 * <p>Selection is a plain return value so the transport layer never depends on a
 * UI. {@link #first()} auto-selects; {@link PromptingConnectionMethodSelector}
 * blocks on an externally supplied answer.</p>
 */
@FunctionalInterface
public interface ConnectionMethodSelector
{
    /**
     * @param methods disambiguated, non-empty list
     * @return one of {@code methods}
     */
    ConnectionMethod select(List<ConnectionMethod> methods);

    static ConnectionMethodSelector first() {
        return methods -> {
            if (methods.isEmpty()) {
                throw new IllegalArgumentException("No connection methods to select from");
            }
            return methods.get(0);
        };
    }
}

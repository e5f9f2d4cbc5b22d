package com.questrail.mdoc.securearea;

import com.questrail.mdoc.crypto.EcCurve;

import java.security.interfaces.ECPublicKey;
import java.util.Objects;
import java.util.Set;

/**
 * Public description of a key held by a {@link SecureArea}.
 */
public record KeyInfo(
    String alias,
    ECPublicKey publicKey,
    EcCurve curve,
    Set<KeyPurpose> purposes
) {
    public KeyInfo {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(curve, "curve");
        purposes = Set.copyOf(purposes);
    }
}

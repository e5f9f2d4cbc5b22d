package com.questrail.mdoc.crypto;

import java.util.Optional;

/**
 * COSE algorithm identifiers used by mdoc structures.
 */
public enum CoseAlgorithm
{
    ES256(-7, "SHA256withECDSAinP1363Format"),
    ES384(-35, "SHA384withECDSAinP1363Format"),
    ES512(-36, "SHA512withECDSAinP1363Format"),
    HMAC_256_256(5, "HmacSHA256");

    private final int identifier;
    private final String jcaName;

    CoseAlgorithm(int identifier, String jcaName) {
        this.identifier = identifier;
        this.jcaName = jcaName;
    }

    public int identifier() {
        return identifier;
    }

    public String jcaName() {
        return jcaName;
    }

    public static Optional<CoseAlgorithm> fromIdentifier(int identifier) {
        for (CoseAlgorithm algorithm : values()) {
            if (algorithm.identifier == identifier) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}

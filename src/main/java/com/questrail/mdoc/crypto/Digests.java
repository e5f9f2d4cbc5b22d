package com.questrail.mdoc.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * Digest algorithms named by the mobile security object.
 */
public enum Digests
{
    SHA_256("SHA-256"),
    SHA_384("SHA-384"),
    SHA_512("SHA-512");

    private final String isoName;

    Digests(String isoName) {
        this.isoName = isoName;
    }

    /** The name as it appears in {@code MobileSecurityObject.digestAlgorithm}. */
    public String isoName() {
        return isoName;
    }

    public byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance(isoName).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(isoName + " not available", e);
        }
    }

    public static Optional<Digests> fromIsoName(String name) {
        for (Digests digest : values()) {
            if (digest.isoName.equals(name)) {
                return Optional.of(digest);
            }
        }
        return Optional.empty();
    }
}

package com.questrail.mdoc.session;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Result of {@link SessionEncryption#decryptMessage(byte[])}: the plaintext if the
 * envelope carried data, and the status if it carried one.
 */
public record DecryptedMessage(byte[] plaintext, Integer status)
{
    public Optional<byte[]> plaintextOptional() {
        return Optional.ofNullable(plaintext);
    }

    public OptionalInt statusOptional() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    public boolean isSessionTermination() {
        return status != null && status == SessionData.STATUS_SESSION_TERMINATION;
    }
}

package com.questrail.mdoc.response;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * MSO validity period. {@code expectedUpdate} may be {@code null}.
 */
public record ValidityInfo(Instant signed, Instant validFrom, Instant validUntil, Instant expectedUpdate)
{
    public ValidityInfo {
        Objects.requireNonNull(signed, "signed");
        Objects.requireNonNull(validFrom, "validFrom");
        Objects.requireNonNull(validUntil, "validUntil");
        if (validUntil.isBefore(validFrom)) {
            throw new IllegalArgumentException("validUntil before validFrom");
        }
    }

    public Optional<Instant> expectedUpdateOptional() {
        return Optional.ofNullable(expectedUpdate);
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(validFrom) && !instant.isAfter(validUntil);
    }
}

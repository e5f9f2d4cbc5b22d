package com.questrail.mdoc.securearea;

import com.questrail.mdoc.crypto.EcCurve;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters for {@link SecureArea#createKey(String, CreateKeySettings)}.
 */
public record CreateKeySettings(
    EcCurve curve,
    Set<KeyPurpose> purposes
) {
    public CreateKeySettings {
        Objects.requireNonNull(curve, "curve");
        Objects.requireNonNull(purposes, "purposes");
        if (purposes.isEmpty()) {
            throw new IllegalArgumentException("At least one key purpose is required");
        }
        purposes = Set.copyOf(purposes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EcCurve curve = EcCurve.P256;
        private Set<KeyPurpose> purposes = EnumSet.of(KeyPurpose.SIGN);

        public Builder withCurve(EcCurve curve) {
            this.curve = curve;
            return this;
        }

        public Builder withPurposes(Set<KeyPurpose> purposes) {
            this.purposes = purposes;
            return this;
        }

        public CreateKeySettings build() {
            return new CreateKeySettings(curve, purposes);
        }
    }
}

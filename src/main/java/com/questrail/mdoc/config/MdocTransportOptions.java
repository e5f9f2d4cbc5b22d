package com.questrail.mdoc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables shared by all transports.
 *
 * @param bleUseL2cap    prefer an L2CAP channel over GATT characteristics when the peer offers one
 * @param connectTimeout how long {@code open} waits for the physical link
 * @param bleMaxMtu      MTU requested by the GATT central
 */
public record MdocTransportOptions(
    boolean bleUseL2cap,
    Duration connectTimeout,
    int bleMaxMtu
) {
    public static final int BLE_MIN_MTU = 23;
    public static final int BLE_MAX_MTU = 517;

    public MdocTransportOptions {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (bleMaxMtu < BLE_MIN_MTU || bleMaxMtu > BLE_MAX_MTU) {
            throw new IllegalArgumentException("bleMaxMtu out of range: " + bleMaxMtu);
        }
    }

    public MdocTransportOptions withBleUseL2cap(boolean useL2cap) {
        return new MdocTransportOptions(useL2cap, connectTimeout, bleMaxMtu);
    }

    public static MdocTransportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean bleUseL2cap = false;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int bleMaxMtu = BLE_MAX_MTU;

        public Builder withBleUseL2cap(boolean bleUseL2cap) {
            this.bleUseL2cap = bleUseL2cap;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withBleMaxMtu(int bleMaxMtu) {
            this.bleMaxMtu = bleMaxMtu;
            return this;
        }

        public MdocTransportOptions build() {
            return new MdocTransportOptions(bleUseL2cap, connectTimeout, bleMaxMtu);
        }
    }
}

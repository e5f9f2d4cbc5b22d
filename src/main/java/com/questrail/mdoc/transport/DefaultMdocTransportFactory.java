package com.questrail.mdoc.transport;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.connectionmethod.NfcConnectionMethod;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.transport.ble.BleCentralTransport;
import com.questrail.mdoc.transport.ble.BleMode;
import com.questrail.mdoc.transport.ble.BlePeripheralTransport;
import com.questrail.mdoc.transport.ble.GattCentralLink;
import com.questrail.mdoc.transport.ble.GattPeripheralLink;
import com.questrail.mdoc.transport.nfc.NfcIsoTag;
import com.questrail.mdoc.transport.nfc.NfcMdocTransport;
import com.questrail.mdoc.transport.nfc.NfcReaderTransport;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * DefaultMdocTransportFactory
 * =============================================================================
 * Maps a connection method and role to a transport over the configured radio
 * ports. Each created transport gets a fresh link from the supplier.
 *
 * <h2>BLE role selection</h2>
 * Central-client mode is used whenever the method supports it, peripheral-server
 * mode otherwise. Both sides apply the same rule, so a dual-role method resolves
 * identically on holder and reader.
 * <pre>
 *                     HOLDER                 READER
 * central-client      BleCentralTransport    BlePeripheralTransport
 * peripheral-server   BlePeripheralTransport BleCentralTransport
 * NFC                 NfcMdocTransport       NfcReaderTransport
 * </pre>
 */
public final class DefaultMdocTransportFactory implements MdocTransportFactory
{
    private final Supplier<GattCentralLink> centralLinks;
    private final Supplier<GattPeripheralLink> peripheralLinks;
    private final Supplier<NfcIsoTag> nfcTags;
    private final MdocObservabilitySink sink;
    private final MonotonicClock clock;

    private DefaultMdocTransportFactory(Builder b) {
        this.centralLinks = b.centralLinks;
        this.peripheralLinks = b.peripheralLinks;
        this.nfcTags = b.nfcTags;
        this.sink = b.sink;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public MdocTransport createTransport(ConnectionMethod connectionMethod, Role role, MdocTransportOptions options) {
        Objects.requireNonNull(connectionMethod, "connectionMethod");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(options, "options");

        if (connectionMethod instanceof BleConnectionMethod ble) {
            BleMode mode = ble.supportsCentralClientMode() ? BleMode.CENTRAL_CLIENT : BleMode.PERIPHERAL_SERVER;
            boolean central = BleMode.forCentral(role) == mode;
            if (central) {
                return new BleCentralTransport(role, ble, require(centralLinks, "GATT central link").get(),
                        options, sink, clock);
            }
            return new BlePeripheralTransport(role, ble, require(peripheralLinks, "GATT peripheral link").get(),
                    options, sink, clock);
        }
        if (connectionMethod instanceof NfcConnectionMethod nfc) {
            if (role == Role.HOLDER) {
                return new NfcMdocTransport(nfc, options, sink, clock);
            }
            return new NfcReaderTransport(nfc, require(nfcTags, "NFC tag").get(), options, sink, clock);
        }
        throw new IllegalArgumentException("Unsupported connection method: " + connectionMethod);
    }

    private static <T> Supplier<T> require(Supplier<T> supplier, String what) {
        if (supplier == null) {
            throw new IllegalStateException("No " + what + " configured");
        }
        return supplier;
    }

    public static final class Builder {
        private Supplier<GattCentralLink> centralLinks;
        private Supplier<GattPeripheralLink> peripheralLinks;
        private Supplier<NfcIsoTag> nfcTags;
        private MdocObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withCentralLinks(Supplier<GattCentralLink> centralLinks) {
            this.centralLinks = centralLinks;
            return this;
        }

        public Builder withPeripheralLinks(Supplier<GattPeripheralLink> peripheralLinks) {
            this.peripheralLinks = peripheralLinks;
            return this;
        }

        public Builder withNfcTags(Supplier<NfcIsoTag> nfcTags) {
            this.nfcTags = nfcTags;
            return this;
        }

        public Builder withObservabilitySink(MdocObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public DefaultMdocTransportFactory build() {
            return new DefaultMdocTransportFactory(this);
        }
    }
}

package com.questrail.mdoc.connectionmethod;

/**
 * A way to reach a device, as advertised in engagement.
 *
 * <p>Implementations are immutable value types. Equality is structural, which is
 * what duplicate removal in {@link ConnectionMethods#disambiguate} relies on.</p>
 */
public sealed interface ConnectionMethod permits BleConnectionMethod, NfcConnectionMethod
{
    /** DeviceRetrievalMethod type: 1 for NFC, 2 for BLE. */
    int type();
}

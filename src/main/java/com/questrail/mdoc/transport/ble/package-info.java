/**
 * BLE Transports
 * =============================================================================
 *
 * ISO 18013-5 BLE data retrieval on top of two radio ports,
 * {@link com.questrail.mdoc.transport.ble.GattCentralLink} and
 * {@link com.questrail.mdoc.transport.ble.GattPeripheralLink}.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Port implementations perform radio I/O only. Chunking, the state
 * characteristic, the ident check and L2CAP framing live in
 * {@link com.questrail.mdoc.transport.ble.BleCentralTransport} and
 * {@link com.questrail.mdoc.transport.ble.BlePeripheralTransport}, so that every
 * platform binding behaves identically on the wire.
 */
package com.questrail.mdoc.transport.ble;

package com.questrail.mdoc.engagement;

/**
 * EngagementCodec
 * =============================================================================
 * Boundary between engagement records and their CBOR bytes.
 *
 * <h2>Atomicity</h2>
 * Decoding either returns a complete record or throws
 * {@link EngagementParseException}; nothing is partially populated.
 *
 * <h2>Byte fidelity</h2>
 * The session transcript is computed over the bytes exactly as scanned. Callers
 * therefore keep the original bytes; re-encoding a decoded record is not
 * guaranteed to reproduce them.
 */
public interface EngagementCodec
{
    byte[] encode(DeviceEngagement engagement);

    /**
     * @throws EngagementParseException on unsupported version, missing key, no
     *         connection methods or malformed nested records
     */
    DeviceEngagement decode(byte[] encoded);

    byte[] encodeReaderEngagement(ReaderEngagement engagement);

    ReaderEngagement decodeReaderEngagement(byte[] encoded);
}

package com.questrail.mdoc.session;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORException;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * SessionData
 * =============================================================================
 * The envelope every session message travels in:
 * <pre>
 * SessionData = { ? "data": bstr, ? "status": uint }
 * </pre>
 *
 * <p>{@code status} absent means more data follows. {@link #STATUS_SESSION_TERMINATION}
 * ends the session, with or without a final {@code data} payload.</p>
 */
public record SessionData(byte[] data, Integer status)
{
    public static final int STATUS_SESSION_ENCRYPTION_ERROR = 10;
    public static final int STATUS_CBOR_DECODING_ERROR = 11;
    public static final int STATUS_SESSION_TERMINATION = 20;

    static final String KEY_DATA = "data";
    static final String KEY_STATUS = "status";
    static final String KEY_E_READER_KEY = "eReaderKey";

    public SessionData {
        if (data == null && status == null) {
            throw new IllegalArgumentException("SessionData needs data, status or both");
        }
    }

    public Optional<byte[]> dataOptional() {
        return Optional.ofNullable(data);
    }

    public OptionalInt statusOptional() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    public byte[] encode() {
        CBORObject map = MdocCbor.newMap();
        if (data != null) {
            map.Add(KEY_DATA, data);
        }
        if (status != null) {
            map.Add(KEY_STATUS, status);
        }
        return map.EncodeToBytes();
    }

    /**
     * @throws CborStructureException if {@code encoded} is not a SessionData map
     */
    public static SessionData decode(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "SessionData"), "SessionData");
        CBORObject data = MdocCbor.optionalField(map, KEY_DATA);
        CBORObject status = MdocCbor.optionalField(map, KEY_STATUS);
        if (data == null && status == null) {
            throw new CborStructureException("SessionData carries neither data nor status");
        }
        return new SessionData(
                data == null ? null : MdocCbor.requireBytes(data, KEY_DATA),
                status == null ? null : MdocCbor.requireInt(status, KEY_STATUS));
    }

    /**
     * Peeks at the clear-text status of a message without decrypting it.
     *
     * @return the status, or empty if the bytes are not a SessionData map or carry none
     */
    public static OptionalInt peekStatus(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return OptionalInt.empty();
        }
        CBORObject map;
        try {
            map = CBORObject.DecodeFromBytes(encoded);
        } catch (CBORException e) {
            // Not CBOR at all, so not an envelope.
            return OptionalInt.empty();
        }
        if (map.getType() != CBORType.Map) {
            return OptionalInt.empty();
        }
        CBORObject status = map.get(CBORObject.FromObject(KEY_STATUS));
        if (status == null || status.getType() != CBORType.Integer || !status.AsNumber().CanFitInInt32()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(status.AsInt32Value());
    }
}

package com.questrail.mdoc.cbor;

import com.upokecenter.cbor.CBORException;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * MdocCbor
 * =============================================================================
 * Typed accessors over {@link CBORObject} for the ISO 18013-5 structures.
 *
 * <h2>Containment</h2>
 * The CBOR library's loose accessors throw a mix of {@code IllegalStateException},
 * {@code ArithmeticException} and {@link CBORException}. Every accessor here
 * converts those into a single {@link CborStructureException} carrying the name
 * of the field being read, so decoders can translate one exception type.
 *
 * <h2>Tag 24</h2>
 * "Encoded CBOR data item" ({@code #6.24(bstr .cbor X)}) is used throughout
 * the protocol to pin the exact bytes that were signed, hashed or transcribed.
 * {@link #tag24(byte[])} and {@link #untag24(CBORObject, String)} are the only
 * places that build or strip it.
 */
public final class MdocCbor
{
    public static final int TAG_ENCODED_CBOR = 24;
    public static final int TAG_TDATE = 0;

    private MdocCbor() {}

    // -------------------------------------------------------------------------
    // Encoding
    // -------------------------------------------------------------------------

    /** Creates a map that encodes its keys in insertion order. */
    public static CBORObject newMap() {
        return CBORObject.NewOrderedMap();
    }

    public static CBORObject tag24(byte[] encodedItem) {
        Objects.requireNonNull(encodedItem, "encodedItem");
        return CBORObject.FromObjectAndTag(encodedItem, TAG_ENCODED_CBOR);
    }

    /** Returns {@code encode(#6.24(bstr encodedItem))}. */
    public static byte[] encodeTag24(byte[] encodedItem) {
        return tag24(encodedItem).EncodeToBytes();
    }

    public static CBORObject tdate(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return CBORObject.FromObjectAndTag(instant.truncatedTo(ChronoUnit.SECONDS).toString(), TAG_TDATE);
    }

    // -------------------------------------------------------------------------
    // Decoding
    // -------------------------------------------------------------------------

    public static CBORObject decode(byte[] encoded, String what) {
        Objects.requireNonNull(encoded, what);
        try {
            return CBORObject.DecodeFromBytes(encoded);
        } catch (CBORException e) {
            throw new CborStructureException(what + ": not a well-formed CBOR item", e);
        }
    }

    public static CBORObject requireMap(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.Map) {
            throw new CborStructureException(what + ": expected a map");
        }
        return item;
    }

    public static CBORObject requireArray(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.Array) {
            throw new CborStructureException(what + ": expected an array");
        }
        return item;
    }

    /** Reads a required entry from a map keyed by text. */
    public static CBORObject field(CBORObject map, String key) {
        CBORObject value = requireMap(map, key).get(CBORObject.FromObject(key));
        if (value == null) {
            throw new CborStructureException("missing required key '" + key + "'");
        }
        return value;
    }

    /** Reads a required entry from a map keyed by integer labels. */
    public static CBORObject field(CBORObject map, int label) {
        CBORObject value = requireMap(map, "label " + label).get(CBORObject.FromObject(label));
        if (value == null) {
            throw new CborStructureException("missing required label " + label);
        }
        return value;
    }

    /** Reads an optional entry; returns {@code null} when absent. */
    public static CBORObject optionalField(CBORObject map, String key) {
        return requireMap(map, key).get(CBORObject.FromObject(key));
    }

    public static CBORObject optionalField(CBORObject map, int label) {
        return requireMap(map, "label " + label).get(CBORObject.FromObject(label));
    }

    public static byte[] requireBytes(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.ByteString) {
            throw new CborStructureException(what + ": expected a byte string");
        }
        return item.GetByteString();
    }

    public static String requireString(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.TextString) {
            throw new CborStructureException(what + ": expected a text string");
        }
        return item.AsString();
    }

    public static long requireLong(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.Integer || !item.AsNumber().CanFitInInt64()) {
            throw new CborStructureException(what + ": expected an integer");
        }
        return item.AsInt64Value();
    }

    public static int requireInt(CBORObject item, String what) {
        long value = requireLong(item, what);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new CborStructureException(what + ": integer out of range");
        }
        return (int) value;
    }

    public static boolean requireBoolean(CBORObject item, String what) {
        if (item == null || item.getType() != CBORType.Boolean) {
            throw new CborStructureException(what + ": expected a boolean");
        }
        return item.AsBoolean();
    }

    /**
     * Strips tag 24 and returns the embedded bytes.
     */
    public static byte[] untag24(CBORObject item, String what) {
        if (item == null || !item.HasMostOuterTag(TAG_ENCODED_CBOR)) {
            throw new CborStructureException(what + ": expected tag 24");
        }
        return requireBytes(item.UntagOne(), what);
    }

    /** Strips tag 24 and decodes the embedded item. */
    public static CBORObject decodeTag24(CBORObject item, String what) {
        return decode(untag24(item, what), what);
    }

    public static Instant requireTdate(CBORObject item, String what) {
        CBORObject untagged = item;
        if (item != null && item.HasMostOuterTag(TAG_TDATE)) {
            untagged = item.UntagOne();
        }
        try {
            return Instant.parse(requireString(untagged, what));
        } catch (DateTimeParseException e) {
            throw new CborStructureException(what + ": not an RFC 3339 date-time", e);
        }
    }
}

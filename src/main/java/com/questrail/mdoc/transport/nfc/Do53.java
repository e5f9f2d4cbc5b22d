package com.questrail.mdoc.transport.nfc;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * BER-TLV data object {@code 53} used to wrap messages carried in ENVELOPE
 * commands and their responses.
 */
public final class Do53
{
    private static final int TAG = 0x53;
    private static final int MAX_LENGTH = 0xffffff;

    private Do53() {
    }

    public static byte[] wrap(byte[] payload) {
        int n = payload.length;
        if (n > MAX_LENGTH) {
            throw new IllegalArgumentException("DO53 payload too long: " + n);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(n + 5);
        out.write(TAG);
        if (n < 0x80) {
            out.write(n);
        } else if (n < 0x100) {
            out.write(0x81);
            out.write(n);
        } else if (n < 0x10000) {
            out.write(0x82);
            out.write(n >> 8);
            out.write(n & 0xff);
        } else {
            out.write(0x83);
            out.write(n >> 16);
            out.write((n >> 8) & 0xff);
            out.write(n & 0xff);
        }
        out.write(payload, 0, n);
        return out.toByteArray();
    }

    /**
     * @throws IllegalArgumentException if {@code encoded} is not exactly one DO53
     */
    public static byte[] unwrap(byte[] encoded) {
        if (encoded.length < 2) {
            throw new IllegalArgumentException("DO53 too short: " + encoded.length);
        }
        if ((encoded[0] & 0xff) != TAG) {
            throw new IllegalArgumentException("Expected tag 0x53, got 0x" + Integer.toHexString(encoded[0] & 0xff));
        }
        int first = encoded[1] & 0xff;
        int offset;
        int length;
        if (first < 0x80) {
            length = first;
            offset = 2;
        } else {
            int lengthBytes = first - 0x80;
            if (lengthBytes < 1 || lengthBytes > 3 || encoded.length < 2 + lengthBytes) {
                throw new IllegalArgumentException("Unsupported DO53 length form 0x" + Integer.toHexString(first));
            }
            length = 0;
            for (int i = 0; i < lengthBytes; i++) {
                length = (length << 8) | (encoded[2 + i] & 0xff);
            }
            offset = 2 + lengthBytes;
        }
        if (encoded.length != offset + length) {
            throw new IllegalArgumentException("DO53 length " + length + " does not match " + (encoded.length - offset));
        }
        return Arrays.copyOfRange(encoded, offset, offset + length);
    }
}

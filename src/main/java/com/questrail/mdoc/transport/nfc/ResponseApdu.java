package com.questrail.mdoc.transport.nfc;

import java.util.Arrays;
import java.util.Objects;

/**
 * ISO 7816-4 response APDU: data followed by the two status bytes.
 */
public record ResponseApdu(byte[] data, int status)
{
    public ResponseApdu {
        Objects.requireNonNull(data, "data");
        if (status < 0 || status > 0xffff) {
            throw new IllegalArgumentException("Status out of range: " + status);
        }
    }

    public static ResponseApdu ofStatus(int status) {
        return new ResponseApdu(new byte[0], status);
    }

    public byte[] encode() {
        byte[] out = Arrays.copyOf(data, data.length + 2);
        out[data.length] = (byte) (status >> 8);
        out[data.length + 1] = (byte) status;
        return out;
    }

    public static ResponseApdu decode(byte[] apdu) {
        if (apdu.length < 2) {
            throw new IllegalArgumentException("Response APDU too short: " + apdu.length);
        }
        int status = ((apdu[apdu.length - 2] & 0xff) << 8) | (apdu[apdu.length - 1] & 0xff);
        return new ResponseApdu(Arrays.copyOf(apdu, apdu.length - 2), status);
    }

    /** {@code 61 XX}: more bytes are available through GET RESPONSE. */
    public boolean hasMoreData() {
        return (status & 0xff00) == Nfc.STATUS_BYTES_STILL_AVAILABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResponseApdu that)) {
            return false;
        }
        return status == that.status && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * status + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ResponseApdu[" + data.length + " bytes, status=" + Nfc.statusHex(status) + "]";
    }
}

package com.questrail.mdoc.transport.nfc;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * ISO 7816-4 command APDU, short or extended length.
 *
 * <p>{@code le} is the expected response length: 0 when absent, 256 for a short
 * {@code 00}, 65536 for an extended {@code 0000}.</p>
 */
public record CommandApdu(int cla, int ins, int p1, int p2, byte[] data, int le)
{
    public CommandApdu {
        Objects.requireNonNull(data, "data");
        if (data.length > 65535) {
            throw new IllegalArgumentException("Command data too long: " + data.length);
        }
        if (le < 0 || le > 65536) {
            throw new IllegalArgumentException("Le out of range: " + le);
        }
    }

    public static CommandApdu of(int cla, int ins, int p1, int p2, byte[] data, int le) {
        return new CommandApdu(cla, ins, p1, p2, data, le);
    }

    public byte[] encode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(cla);
        out.write(ins);
        out.write(p1);
        out.write(p2);
        boolean extended = data.length > 255 || le > 256;
        if (data.length > 0) {
            if (extended) {
                out.write(0x00);
                out.write(data.length >> 8);
                out.write(data.length & 0xff);
            } else {
                out.write(data.length);
            }
            out.write(data, 0, data.length);
        }
        if (le > 0) {
            if (extended) {
                if (data.length == 0) {
                    out.write(0x00);
                }
                int value = le == 65536 ? 0 : le;
                out.write(value >> 8);
                out.write(value & 0xff);
            } else {
                out.write(le == 256 ? 0 : le);
            }
        }
        return out.toByteArray();
    }

    /**
     * @throws IllegalArgumentException if {@code apdu} is not a well-formed command APDU
     */
    public static CommandApdu decode(byte[] apdu) {
        if (apdu.length < 4) {
            throw new IllegalArgumentException("APDU too short: " + apdu.length);
        }
        int cla = apdu[0] & 0xff;
        int ins = apdu[1] & 0xff;
        int p1 = apdu[2] & 0xff;
        int p2 = apdu[3] & 0xff;
        if (apdu.length == 4) {
            return new CommandApdu(cla, ins, p1, p2, new byte[0], 0);
        }
        int b4 = apdu[4] & 0xff;
        if (apdu.length == 5) {
            return new CommandApdu(cla, ins, p1, p2, new byte[0], b4 == 0 ? 256 : b4);
        }
        if (b4 != 0) {
            int lc = b4;
            if (apdu.length == 5 + lc) {
                return new CommandApdu(cla, ins, p1, p2, Arrays.copyOfRange(apdu, 5, 5 + lc), 0);
            }
            if (apdu.length == 6 + lc) {
                int le = apdu[5 + lc] & 0xff;
                return new CommandApdu(cla, ins, p1, p2, Arrays.copyOfRange(apdu, 5, 5 + lc), le == 0 ? 256 : le);
            }
            throw new IllegalArgumentException("Malformed short APDU");
        }
        if (apdu.length < 7) {
            throw new IllegalArgumentException("Malformed extended APDU");
        }
        int word = ((apdu[5] & 0xff) << 8) | (apdu[6] & 0xff);
        if (apdu.length == 7) {
            return new CommandApdu(cla, ins, p1, p2, new byte[0], word == 0 ? 65536 : word);
        }
        int lc = word;
        if (apdu.length == 7 + lc) {
            return new CommandApdu(cla, ins, p1, p2, Arrays.copyOfRange(apdu, 7, 7 + lc), 0);
        }
        if (apdu.length == 9 + lc) {
            int le = ((apdu[7 + lc] & 0xff) << 8) | (apdu[8 + lc] & 0xff);
            return new CommandApdu(cla, ins, p1, p2, Arrays.copyOfRange(apdu, 7, 7 + lc), le == 0 ? 65536 : le);
        }
        throw new IllegalArgumentException("Malformed extended APDU");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CommandApdu that)) {
            return false;
        }
        return cla == that.cla && ins == that.ins && p1 == that.p1 && p2 == that.p2
                && le == that.le && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cla, ins, p1, p2, le) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("CommandApdu[cla=%02x, ins=%02x, p1=%02x, p2=%02x, lc=%d, le=%d]",
                cla, ins, p1, p2, data.length, le);
    }
}

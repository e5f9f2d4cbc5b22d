package com.questrail.mdoc.transport.ble;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits messages into characteristic-sized chunks.
 *
 * <p>A chunk is at most {@code min(512, mtu - 3)} bytes, the first of which is
 * {@code 0x01} if more chunks follow and {@code 0x00} on the last one.</p>
 */
public final class BleMessageChunker
{
    public static final byte MORE = 0x01;
    public static final byte LAST = 0x00;
    static final int MAX_CHARACTERISTIC_VALUE = 512;

    private BleMessageChunker() {
    }

    public static int chunkSize(int mtu) {
        int size = Math.min(MAX_CHARACTERISTIC_VALUE, mtu - 3);
        if (size < 2) {
            throw new IllegalArgumentException("MTU too small: " + mtu);
        }
        return size;
    }

    public static List<byte[]> chunk(byte[] message, int mtu) {
        int payloadSize = chunkSize(mtu) - 1;
        List<byte[]> chunks = new ArrayList<>();
        int offset = 0;
        do {
            int length = Math.min(payloadSize, message.length - offset);
            byte[] chunk = new byte[length + 1];
            boolean last = offset + length >= message.length;
            chunk[0] = last ? LAST : MORE;
            System.arraycopy(message, offset, chunk, 1, length);
            chunks.add(chunk);
            offset += length;
        } while (offset < message.length);
        return chunks;
    }

    /**
     * Reassembles chunks written to or notified on the message characteristic.
     * Not thread-safe; one per direction.
     */
    public static final class Assembler
    {
        private byte[] buffer = new byte[0];

        /**
         * @return the complete message once the last chunk arrived, otherwise {@code null}
         * @throws IllegalArgumentException on an empty chunk or an unknown header byte
         */
        public byte[] accept(byte[] chunk) {
            if (chunk.length == 0) {
                throw new IllegalArgumentException("Empty BLE chunk");
            }
            if (chunk[0] != MORE && chunk[0] != LAST) {
                throw new IllegalArgumentException("Unexpected BLE chunk header 0x"
                        + Integer.toHexString(chunk[0] & 0xff));
            }
            int old = buffer.length;
            buffer = Arrays.copyOf(buffer, old + chunk.length - 1);
            System.arraycopy(chunk, 1, buffer, old, chunk.length - 1);
            if (chunk[0] == MORE) {
                return null;
            }
            byte[] message = buffer;
            buffer = new byte[0];
            return message;
        }
    }
}

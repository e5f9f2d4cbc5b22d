package com.questrail.mdoc.transport.ble;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Length-prefixed framing of messages on an L2CAP stream: each message is
 * preceded by its length as a 4-byte big-endian integer.
 */
public final class L2capMessageFramer
{
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public static byte[] frame(byte[] message) {
        return ByteBuffer.allocate(4 + message.length)
                .putInt(message.length)
                .put(message)
                .array();
    }

    /**
     * Feeds stream bytes in and returns every message they complete.
     */
    public synchronized List<byte[]> accept(byte[] bytes) {
        pending.write(bytes, 0, bytes.length);
        List<byte[]> messages = new ArrayList<>();
        ByteBuffer buffer = ByteBuffer.wrap(pending.toByteArray());
        while (buffer.remaining() >= 4) {
            int length = buffer.getInt(buffer.position());
            if (length < 0) {
                throw new IllegalArgumentException("Negative L2CAP message length");
            }
            if (buffer.remaining() - 4 < length) {
                break;
            }
            buffer.getInt();
            byte[] message = new byte[length];
            buffer.get(message);
            messages.add(message);
        }
        pending.reset();
        pending.write(buffer.array(), buffer.position(), buffer.remaining());
        return messages;
    }
}

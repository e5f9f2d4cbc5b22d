package com.questrail.mdoc.transport.ble;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BleMessageChunkerTest
{
    @Test
    void chunkSizeIsBoundedByMtuAndCharacteristicLimit() {
        assertEquals(20, BleMessageChunker.chunkSize(23));
        assertEquals(182, BleMessageChunker.chunkSize(185));
        assertEquals(512, BleMessageChunker.chunkSize(517));
        assertThrows(IllegalArgumentException.class, () -> BleMessageChunker.chunkSize(4));
    }

    @Test
    void headersMarkAllButLastChunkAsMore() {
        byte[] message = new byte[50];
        Arrays.fill(message, (byte) 0x5a);

        List<byte[]> chunks = BleMessageChunker.chunk(message, 23);

        // 19 payload bytes per chunk: 19 + 19 + 12
        assertEquals(3, chunks.size());
        assertEquals(BleMessageChunker.MORE, chunks.get(0)[0]);
        assertEquals(BleMessageChunker.MORE, chunks.get(1)[0]);
        assertEquals(BleMessageChunker.LAST, chunks.get(2)[0]);
        assertEquals(20, chunks.get(0).length);
        assertEquals(13, chunks.get(2).length);
    }

    @Test
    void assemblerRebuildsMessageFromChunks() {
        byte[] message = new byte[1000];
        for (int i = 0; i < message.length; i++) {
            message[i] = (byte) i;
        }
        BleMessageChunker.Assembler assembler = new BleMessageChunker.Assembler();

        byte[] result = null;
        for (byte[] chunk : BleMessageChunker.chunk(message, 185)) {
            assertNull(result);
            result = assembler.accept(chunk);
        }
        assertArrayEquals(message, result);
    }

    @Test
    void emptyMessageIsOneLastChunk() {
        List<byte[]> chunks = BleMessageChunker.chunk(new byte[0], 23);
        assertEquals(1, chunks.size());
        assertArrayEquals(new byte[] { BleMessageChunker.LAST }, chunks.get(0));
    }

    @Test
    void assemblerRejectsUnknownHeader() {
        BleMessageChunker.Assembler assembler = new BleMessageChunker.Assembler();
        assertThrows(IllegalArgumentException.class, () -> assembler.accept(new byte[] { 0x07, 0x01 }));
        assertThrows(IllegalArgumentException.class, () -> assembler.accept(new byte[0]));
    }
}

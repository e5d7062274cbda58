package com.bit.valorium.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QuadritCodecTest {

    @Test
    void emptyInputRoundTrips() {
        assertTrue(QuadritCodec.encode(new byte[0]).isEmpty());
        assertArrayEquals(new byte[0], QuadritCodec.decode(List.of()));
    }

    @Test
    void randomLengthsRoundTrip() {
        Random random = new Random(42);
        // 包含长度不是4的倍数的输入
        for (int length : new int[]{1, 2, 3, 5, 7, 17, 64, 255}) {
            byte[] data = new byte[length];
            random.nextBytes(data);
            List<Quadrit> quadrits = QuadritCodec.encode(data);
            assertEquals(length * QuadritCodec.QUADRITS_PER_BYTE, quadrits.size());
            assertArrayEquals(data, QuadritCodec.decode(quadrits));
        }
    }

    @Test
    void mostSignificantPairComesFirst() {
        // 0x1B = 00 01 10 11
        assertEquals("ATCG", QuadritCodec.encodeToText(new byte[]{0x1B}));
        assertEquals("GGGG", QuadritCodec.encodeToText(new byte[]{(byte) 0xFF}));
    }

    @Test
    void shortSequenceIsPaddedWithA() {
        // "TG" -> T G A A -> 01 11 00 00
        assertArrayEquals(new byte[]{0x70}, QuadritCodec.decodeText("TG"));
        // 5个符号 -> 2个字节，第二个字节只有高两位
        assertArrayEquals(new byte[]{0x1B, (byte) 0xC0}, QuadritCodec.decodeText("ATCGG"));
    }

    @Test
    void textHelpersRoundTripUtf8() {
        String text = "Valorium X 交易备注";
        assertEquals(text, QuadritCodec.textToString(QuadritCodec.stringToText(text)));
    }

    @Test
    void rejectsUnknownSymbols() {
        assertThrows(IllegalArgumentException.class, () -> QuadritCodec.fromText("ATXG"));
    }
}

package com.bit.valorium.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 字节与Quadrit序列互转
 * <p>
 * 编码：每个字节拆成4个Quadrit，高位在前（bit7-6, bit5-4, bit3-2, bit1-0）。
 * 任意字节串（包括空串）编码后长度都是4的倍数，decode(encode(x)) == x。
 * <p>
 * 补齐规则：解码时如果Quadrit数量不是4的倍数，尾部用 A（二进制00）补齐到下一个字节边界，
 * 因此 "TG" 解码为 0b0111_0000。补齐只会出现在外部构造的序列上，不会出现在 encode 的输出上。
 */
public final class QuadritCodec {

    public static final int QUADRITS_PER_BYTE = 4;

    private QuadritCodec() {
    }

    public static List<Quadrit> encode(byte[] data) {
        List<Quadrit> quadrits = new ArrayList<>(data.length * QUADRITS_PER_BYTE);
        for (byte b : data) {
            quadrits.add(Quadrit.ofBits(b >> 6));
            quadrits.add(Quadrit.ofBits(b >> 4));
            quadrits.add(Quadrit.ofBits(b >> 2));
            quadrits.add(Quadrit.ofBits(b));
        }
        return quadrits;
    }

    public static byte[] decode(List<Quadrit> quadrits) {
        int byteCount = (quadrits.size() + QUADRITS_PER_BYTE - 1) / QUADRITS_PER_BYTE;
        byte[] data = new byte[byteCount];
        for (int i = 0; i < byteCount; i++) {
            int value = 0;
            for (int j = 0; j < QUADRITS_PER_BYTE; j++) {
                int index = i * QUADRITS_PER_BYTE + j;
                // 越界部分按 A 补齐
                int bits = index < quadrits.size() ? quadrits.get(index).getBits() : Quadrit.A.getBits();
                value |= bits << (6 - j * 2);
            }
            data[i] = (byte) value;
        }
        return data;
    }

    /**
     * Quadrit序列渲染为 "ATCG" 文本
     */
    public static String toText(List<Quadrit> quadrits) {
        StringBuilder sb = new StringBuilder(quadrits.size());
        for (Quadrit q : quadrits) {
            sb.append(q.name());
        }
        return sb.toString();
    }

    public static List<Quadrit> fromText(String text) {
        List<Quadrit> quadrits = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            quadrits.add(Quadrit.ofSymbol(text.charAt(i)));
        }
        return quadrits;
    }

    public static String encodeToText(byte[] data) {
        return toText(encode(data));
    }

    public static byte[] decodeText(String text) {
        return decode(fromText(text));
    }

    public static String stringToText(String value) {
        return encodeToText(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String textToString(String text) {
        return new String(decodeText(text), StandardCharsets.UTF_8);
    }
}

package com.bit.valorium.util;

import lombok.Getter;

/**
 * 四态信息单元，每个符号承载2位
 */
@Getter
public enum Quadrit {
    A(0b00),
    T(0b01),
    C(0b10),
    G(0b11);

    private final int bits;

    Quadrit(int bits) {
        this.bits = bits;
    }

    private static final Quadrit[] BY_BITS = {A, T, C, G};

    public static Quadrit ofBits(int bits) {
        return BY_BITS[bits & 0b11];
    }

    public static Quadrit ofSymbol(char symbol) {
        switch (symbol) {
            case 'A':
                return A;
            case 'T':
                return T;
            case 'C':
                return C;
            case 'G':
                return G;
            default:
                throw new IllegalArgumentException("非法Quadrit符号: " + symbol);
        }
    }
}

package com.bit.valorium.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节哈希（SHA-256），全链统一的内容寻址标识
 * 区块哈希、交易哈希、提案哈希、CIP证明哈希都用这个类型表示
 */
public final class Hash256 implements Serializable, Comparable<Hash256> {

    private static final long serialVersionUID = 1L;

    // 哈希固定长度为32字节
    public static final int HASH_LENGTH = 32;

    // 零哈希常量（创世区块的父哈希）
    public static final Hash256 ZERO = new Hash256(new byte[HASH_LENGTH]);

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;

    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    /**
     * 私有构造方法，强制校验长度
     * @param value 32字节哈希的原始字节数组
     */
    private Hash256(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = Hex.encodeHexString(this.value);
    }

    public static Hash256 fromBytes(byte[] bytes) {
        return new Hash256(bytes);
    }

    /**
     * 从64位十六进制字符串解析
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Hash256 fromHex(String hex) {
        if (hex == null || hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException("Invalid hex string length for 32-byte hash: " + hex);
        }
        try {
            return new Hash256(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex character in: " + hex, e);
        }
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    @JsonValue
    public String toHex() {
        return hexValue;
    }

    /**
     * 日志里用的短格式
     */
    public String shortHex() {
        return hexValue.substring(0, 12);
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(Hash256 other) {
        return hexValue.compareTo(other.hexValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hash256)) {
            return false;
        }
        return Arrays.equals(value, ((Hash256) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return hexValue;
    }
}

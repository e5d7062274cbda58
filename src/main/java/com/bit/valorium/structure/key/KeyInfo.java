package com.bit.valorium.structure.key;

import lombok.Getter;

import java.util.Arrays;

/**
 * 节点签名密钥对（原始字节形式，格式由注入的密码学原语决定）
 */
@Getter
public class KeyInfo {
    private final byte[] privateKey;
    private final byte[] publicKey;
    private final String owner;

    public KeyInfo(byte[] privateKey, byte[] publicKey, String owner) {
        this.privateKey = Arrays.copyOf(privateKey, privateKey.length);
        this.publicKey = Arrays.copyOf(publicKey, publicKey.length);
        this.owner = owner;
    }

    @Override
    public String toString() {
        // 不输出私钥
        return "KeyInfo(owner=" + owner + ")";
    }
}

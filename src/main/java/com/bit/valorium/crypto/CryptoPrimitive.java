package com.bit.valorium.crypto;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.structure.key.KeyInfo;

/**
 * 密码学原语边界：签名、验签、哈希、密钥派生
 * 协议逻辑只依赖此接口，替换实现不影响共识代码
 */
public interface CryptoPrimitive {

    byte[] sign(byte[] message, byte[] privateKey);

    boolean verify(byte[] message, byte[] signature, byte[] publicKey);

    Hash256 hash(byte[] data);

    /**
     * 由种子确定性派生密钥对
     */
    KeyInfo deriveKeys(String owner, byte[] seed);
}

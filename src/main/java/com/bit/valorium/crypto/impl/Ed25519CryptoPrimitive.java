package com.bit.valorium.crypto.impl;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.structure.key.KeyInfo;
import com.bit.valorium.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.springframework.stereotype.Component;

/**
 * 默认原语：Ed25519 签名（BouncyCastle 轻量级 API）+ SHA-256 哈希
 */
@Slf4j
@Component
public class Ed25519CryptoPrimitive implements CryptoPrimitive {

    // Ed25519核心密钥长度（公钥/私钥均为32字节）
    public static final int CORE_KEY_LENGTH = 32;

    @Override
    public byte[] sign(byte[] message, byte[] privateKey) {
        if (privateKey == null || privateKey.length != CORE_KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519 私钥必须为32字节");
        }
        Ed25519PrivateKeyParameters params = new Ed25519PrivateKeyParameters(privateKey, 0);
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, params);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public boolean verify(byte[] message, byte[] signature, byte[] publicKey) {
        if (message == null || signature == null || publicKey == null || publicKey.length != CORE_KEY_LENGTH) {
            log.warn("Ed25519 验签参数不完整");
            return false;
        }
        Ed25519PublicKeyParameters params = new Ed25519PublicKeyParameters(publicKey, 0);
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, params);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    @Override
    public Hash256 hash(byte[] data) {
        return Hash256.fromBytes(Sha.applySHA256(data));
    }

    @Override
    public KeyInfo deriveKeys(String owner, byte[] seed) {
        // 种子先做一次SHA-256，保证32字节
        Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(Sha.applySHA256(seed), 0);
        byte[] publicKey = privateKey.generatePublicKey().getEncoded();
        return new KeyInfo(privateKey.getEncoded(), publicKey, owner);
    }
}

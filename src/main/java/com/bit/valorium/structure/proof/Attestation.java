package com.bit.valorium.structure.proof;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.util.ByteUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.codec.binary.Hex;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 见证：某个见证节点声明的证明哈希 + 对 (证明哈希, 节点ID) 的签名
 * 轮次结束即被消费，只有获胜区块的见证列表会被保留
 */
@Value
@Builder
@Jacksonized
public class Attestation {

    Hash256 proofHash;

    String attesterId;

    byte[] signature;

    /**
     * 签名消息 = 证明哈希字节 || 节点ID的UTF-8字节
     */
    public static byte[] signingMessage(Hash256 proofHash, String attesterId) {
        return ByteUtils.concat(proofHash.getBytes(), ByteUtils.utf8(attesterId));
    }

    public byte[] signingMessage() {
        return signingMessage(proofHash, attesterId);
    }

    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("proofHash", proofHash);
        fields.put("attesterId", attesterId);
        fields.put("signature", signature == null ? "" : Hex.encodeHexString(signature));
        return fields;
    }
}

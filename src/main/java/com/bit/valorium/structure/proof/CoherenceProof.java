package com.bit.valorium.structure.proof;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CIP证明：hash(提案哈希, 锚点哈希)
 * 每轮只存在一个正确值，诚实节点各自推导必然收敛到它
 */
@Value
@Builder
@Jacksonized
public class CoherenceProof {

    Hash256 proposalHash;

    Hash256 anchorsHash;

    Hash256 proofHash;

    public static CoherenceProof derive(HashChain hashChain, Hash256 proposalHash, Hash256 anchorsHash) {
        return CoherenceProof.builder()
                .proposalHash(proposalHash)
                .anchorsHash(anchorsHash)
                .proofHash(hashChain.digest(canonicalFields(proposalHash, anchorsHash)))
                .build();
    }

    public static CoherenceProof derive(HashChain hashChain, Hash256 proposalHash, CoherenceAnchors anchors) {
        return derive(hashChain, proposalHash, anchors.hash(hashChain));
    }

    private static Map<String, Object> canonicalFields(Hash256 proposalHash, Hash256 anchorsHash) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("proposalHash", proposalHash);
        fields.put("anchorsHash", anchorsHash);
        return fields;
    }

    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = canonicalFields(proposalHash, anchorsHash);
        fields.put("proofHash", proofHash);
        return fields;
    }
}

package com.bit.valorium.structure.proof;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一致性锚点快照：所有诚实节点在本轮都能看到的同一份账本状态
 * 每轮只取一次，本轮所有证明计算共用这份快照
 */
@Value
public class CoherenceAnchors {

    Hash256 lastBlockHash;

    long height;

    double aggregateSupply;

    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("lastBlockHash", lastBlockHash);
        fields.put("height", height);
        fields.put("aggregateSupply", aggregateSupply);
        return fields;
    }

    public Hash256 hash(HashChain hashChain) {
        return hashChain.digest(canonicalFields());
    }
}

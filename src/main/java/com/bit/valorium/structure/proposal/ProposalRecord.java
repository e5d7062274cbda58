package com.bit.valorium.structure.proposal;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RNA模板：提议者对本轮交易集合的承诺
 * 只携带交易哈希的有序列表，不携带交易本体；每轮由当选提议者生成一次，之后只被引用，不被修改
 */
@Value
@Builder
@Jacksonized
public class ProposalRecord {

    String proposer;

    List<Hash256> transactionHashes;

    long timestamp;

    Hash256 hash;

    public static ProposalRecord issue(HashChain hashChain, String proposer, List<Hash256> transactionHashes, long timestamp) {
        List<Hash256> hashes = ImmutableList.copyOf(transactionHashes);
        return ProposalRecord.builder()
                .proposer(proposer)
                .transactionHashes(hashes)
                .timestamp(timestamp)
                .hash(hashChain.digest(canonicalFields(proposer, hashes, timestamp)))
                .build();
    }

    private static Map<String, Object> canonicalFields(String proposer, List<Hash256> hashes, long timestamp) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("proposer", proposer);
        fields.put("txHashes", hashes);
        fields.put("timestamp", timestamp);
        return fields;
    }

    public Hash256 recomputeHash(HashChain hashChain) {
        return hashChain.digest(canonicalFields(proposer, transactionHashes, timestamp));
    }
}

package com.bit.valorium.structure.block;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.tx.Transaction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 区块：追加后不可变
 * <p>
 * 不变量：
 * block[i].previousHash == block[i-1].hash；
 * block[i].hash == hash(block[i] 除 hash 以外的所有字段)。
 * 见证列表按节点ID排序后参与哈希，收集顺序不影响区块哈希。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Block {

    /**
     * 区块序号，从0单调递增
     */
    long sequence;

    long timestamp;

    List<Transaction> transactions;

    Hash256 previousHash;

    /**
     * RNA模板哈希
     */
    Hash256 proposalHash;

    /**
     * 获胜证明，只有创世块允许为空
     */
    CoherenceProof winningProof;

    List<Attestation> attestations;

    Hash256 hash;

    /**
     * 组装区块并计算自身哈希
     */
    public static Block assemble(HashChain hashChain, long sequence, long timestamp, List<Transaction> transactions,
                                 Hash256 previousHash, Hash256 proposalHash, CoherenceProof winningProof,
                                 List<Attestation> attestations) {
        Block unsealed = Block.builder()
                .sequence(sequence)
                .timestamp(timestamp)
                .transactions(ImmutableList.copyOf(transactions))
                .previousHash(previousHash)
                .proposalHash(proposalHash)
                .winningProof(winningProof)
                .attestations(ImmutableList.copyOf(attestations))
                .build();
        return unsealed.toBuilder().hash(unsealed.computeHash(hashChain)).build();
    }

    /**
     * 按当前字段重新计算哈希（不含 hash 字段本身）
     */
    public Hash256 computeHash(HashChain hashChain) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sequence", sequence);
        fields.put("timestamp", timestamp);
        fields.put("transactions", transactions.stream()
                .map(Transaction::canonicalFields)
                .collect(Collectors.toList()));
        fields.put("previousHash", previousHash);
        fields.put("proposalHash", proposalHash);
        fields.put("winningProof", winningProof == null ? null : winningProof.canonicalFields());
        fields.put("attestations", attestations.stream()
                .sorted(Comparator.comparing(Attestation::getAttesterId))
                .map(Attestation::canonicalFields)
                .collect(Collectors.toList()));
        return hashChain.digest(fields);
    }

    @JsonIgnore
    public boolean isGenesis() {
        return sequence == 0;
    }
}

package com.bit.valorium.blockchain;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.proof.CoherenceAnchors;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.tx.Transaction;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 账本：区块链 + 账户余额，单写者
 */
public interface Ledger extends BalanceSink {

    /**
     * 丢弃现有状态，从创世块重新开始
     */
    Block resetToGenesis();

    /**
     * 构造区块、计算哈希并追加到链尾；previousHash 必须等于当前链尾哈希
     */
    Block appendBlock(Hash256 proposalHash, CoherenceProof winningProof, List<Attestation> attestations,
                      List<Transaction> transactions, Hash256 previousHash);

    /**
     * 区块追加之后结算余额：付款方扣款（铸币交易除外），收款方入账；任一付款方透支则整体不生效
     */
    void applyBalances(List<Transaction> transactions);

    /**
     * 在当前余额上模拟顺序结算，不修改状态
     */
    SettlementPlan settleable(List<Transaction> transactions);

    /**
     * 全链重算哈希并检查前向链接，O(n)
     */
    IntegrityReport verifyIntegrity();

    /**
     * 本轮一致性锚点快照
     */
    CoherenceAnchors snapshotAnchors();

    Block getLatestBlock();

    List<Block> getChain();

    Optional<Block> getBlockByHash(Hash256 hash);

    Optional<Block> getBlockBySequence(long sequence);

    long length();

    double balanceOf(String account);

    Map<String, Double> balances();

    double totalSupply();

    String getIssuanceSender();

    /**
     * 用持久化数据整体替换账本；不做修复，完整性由调用方审计
     */
    void restore(List<Block> chain, Map<String, Double> balances);
}

package com.bit.valorium.blockchain.impl;

import com.bit.valorium.blockchain.IntegrityReport;
import com.bit.valorium.blockchain.Ledger;
import com.bit.valorium.blockchain.SettlementPlan;
import com.bit.valorium.common.Hash256;
import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.exception.ValoriumException;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.proof.CoherenceAnchors;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.proposal.ProposalRecord;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.util.ByteUtils;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Component
public class LedgerImpl implements Ledger {

    private final HashChain hashChain;

    private final ValoriumProperties.Ledger config;

    private final Clock clock;

    // chain 与 balances 的单写者锁
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<Block> chain = new ArrayList<>();

    private final Map<String, Double> balances = new ConcurrentHashMap<>();

    /**
     * 区块缓存：hash → Block
     */
    private final LoadingCache<Hash256, Block> blockByHashCache;

    public LedgerImpl(HashChain hashChain, ValoriumProperties properties, Clock clock) {
        this.hashChain = hashChain;
        this.config = properties.getLedger();
        this.clock = clock;
        this.blockByHashCache = Caffeine.newBuilder()
                .maximumSize(1_000)
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .removalListener((RemovalListener<Hash256, Block>) (hash, block, cause) ->
                        log.debug("区块缓存移除: hash={}, cause={}", hash == null ? null : hash.shortHex(), cause))
                .build(this::findBlockByHash);
        resetToGenesis();
    }

    @Override
    public Block resetToGenesis() {
        lock.writeLock().lock();
        try {
            Block genesis = buildGenesis();
            chain.clear();
            chain.add(genesis);
            balances.clear();
            balances.putAll(config.getInitialBalances());
            blockByHashCache.invalidateAll();
            log.info("创世块已生成: {}", genesis.getHash().shortHex());
            return genesis;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 创世块：序号0，父哈希全零，无交易，证明由固定锚点字符串派生；时间戳固定以保证哈希确定
     */
    private Block buildGenesis() {
        ProposalRecord proposal = ProposalRecord.issue(hashChain, config.getGenesisProposer(),
                Collections.emptyList(), config.getGenesisTimestamp());
        Hash256 anchorsHash = hashChain.digestBytes(ByteUtils.utf8(config.getGenesisAnchor()));
        CoherenceProof proof = CoherenceProof.derive(hashChain, proposal.getHash(), anchorsHash);
        return Block.assemble(hashChain, 0, config.getGenesisTimestamp(), Collections.emptyList(),
                Hash256.ZERO, proposal.getHash(), proof, Collections.emptyList());
    }

    @Override
    public Block appendBlock(Hash256 proposalHash, CoherenceProof winningProof, List<Attestation> attestations,
                             List<Transaction> transactions, Hash256 previousHash) {
        if (winningProof == null) {
            throw new ValoriumException(ErrorType.VALIDATION, "非创世块必须携带获胜证明");
        }
        lock.writeLock().lock();
        try {
            Block tail = chain.get(chain.size() - 1);
            if (!tail.getHash().equals(previousHash)) {
                log.error("追加区块失败: previousHash {} 与链尾 {} 不一致", previousHash.shortHex(), tail.getHash().shortHex());
                throw new ValoriumException(ErrorType.CHAIN_INTEGRITY,
                        "previousHash 与链尾不一致, 链尾序号 " + tail.getSequence());
            }
            Block block = Block.assemble(hashChain, tail.getSequence() + 1, clock.millis(), transactions,
                    previousHash, proposalHash, winningProof, attestations);
            chain.add(block);
            log.info("区块#{} 已追加: hash={} 交易{}笔 见证{}个", block.getSequence(), block.getHash().shortHex(),
                    transactions.size(), attestations.size());
            return block;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void applyBalances(List<Transaction> transactions) {
        lock.writeLock().lock();
        try {
            // 先在暂存区计算，全部合法后一次性写回
            Map<String, Double> staged = new HashMap<>();
            for (Transaction tx : transactions) {
                if (!tx.isIssuance(config.getIssuanceSender())) {
                    double senderBalance = staged.getOrDefault(tx.getSender(), balanceOf(tx.getSender())) - tx.getAmount();
                    if (senderBalance < 0) {
                        throw new ValoriumException(ErrorType.VALIDATION,
                                "账户 " + tx.getSender() + " 余额不足, 结算被拒绝");
                    }
                    staged.put(tx.getSender(), senderBalance);
                }
                staged.put(tx.getRecipient(), staged.getOrDefault(tx.getRecipient(), balanceOf(tx.getRecipient())) + tx.getAmount());
            }
            balances.putAll(staged);
            log.debug("余额结算完成: 交易{}笔, 涉及账户{}个", transactions.size(), staged.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public SettlementPlan settleable(List<Transaction> transactions) {
        lock.readLock().lock();
        try {
            Map<String, Double> staged = new HashMap<>();
            List<Transaction> accepted = new ArrayList<>();
            List<Transaction> rejected = new ArrayList<>();
            for (Transaction tx : transactions) {
                if (!tx.isIssuance(config.getIssuanceSender())) {
                    double remaining = staged.getOrDefault(tx.getSender(), balanceOf(tx.getSender())) - tx.getAmount();
                    if (remaining < 0) {
                        rejected.add(tx);
                        continue;
                    }
                    staged.put(tx.getSender(), remaining);
                }
                staged.put(tx.getRecipient(), staged.getOrDefault(tx.getRecipient(), balanceOf(tx.getRecipient())) + tx.getAmount());
                accepted.add(tx);
            }
            return new SettlementPlan(ImmutableList.copyOf(accepted), ImmutableList.copyOf(rejected));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void credit(String account, double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("入账金额不能为负: " + amount);
        }
        lock.writeLock().lock();
        try {
            balances.merge(account, amount, Double::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public IntegrityReport verifyIntegrity() {
        lock.readLock().lock();
        try {
            for (int i = 0; i < chain.size(); i++) {
                Block block = chain.get(i);
                if (block.getSequence() != i) {
                    return broken(i, "序号不连续: 期望" + i + " 实际" + block.getSequence());
                }
                Hash256 expectedPrevious = i == 0 ? Hash256.ZERO : chain.get(i - 1).getHash();
                if (!expectedPrevious.equals(block.getPreviousHash())) {
                    return broken(i, "previousHash 与前一区块哈希不一致");
                }
                if (!block.isGenesis() && block.getWinningProof() == null) {
                    return broken(i, "缺少获胜证明");
                }
                if (!block.computeHash(hashChain).equals(block.getHash())) {
                    return broken(i, "区块哈希与内容不符");
                }
            }
            return IntegrityReport.ok(chain.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    private IntegrityReport broken(long sequence, String reason) {
        log.error("链完整性校验失败: 区块#{} {}", sequence, reason);
        return IntegrityReport.broken(chain.size(), sequence, reason);
    }

    @Override
    public CoherenceAnchors snapshotAnchors() {
        lock.readLock().lock();
        try {
            Block tail = chain.get(chain.size() - 1);
            return new CoherenceAnchors(tail.getHash(), tail.getSequence(), totalSupply());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Block getLatestBlock() {
        lock.readLock().lock();
        try {
            return chain.get(chain.size() - 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Block> getChain() {
        lock.readLock().lock();
        try {
            return ImmutableList.copyOf(chain);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Block> getBlockByHash(Hash256 hash) {
        return Optional.ofNullable(blockByHashCache.get(hash));
    }

    private Block findBlockByHash(Hash256 hash) {
        lock.readLock().lock();
        try {
            return chain.stream().filter(b -> hash.equals(b.getHash())).findFirst().orElse(null);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Block> getBlockBySequence(long sequence) {
        lock.readLock().lock();
        try {
            if (sequence < 0 || sequence >= chain.size()) {
                return Optional.empty();
            }
            return Optional.of(chain.get((int) sequence));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long length() {
        lock.readLock().lock();
        try {
            return chain.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public double balanceOf(String account) {
        return balances.getOrDefault(account, 0.0);
    }

    @Override
    public Map<String, Double> balances() {
        return new TreeMap<>(balances);
    }

    @Override
    public double totalSupply() {
        return balances.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Override
    public String getIssuanceSender() {
        return config.getIssuanceSender();
    }

    @Override
    public void restore(List<Block> restoredChain, Map<String, Double> restoredBalances) {
        if (restoredChain == null || restoredChain.isEmpty()) {
            throw new ValoriumException(ErrorType.CHAIN_INTEGRITY, "恢复的链为空");
        }
        lock.writeLock().lock();
        try {
            chain.clear();
            chain.addAll(restoredChain);
            balances.clear();
            if (restoredBalances != null) {
                balances.putAll(restoredBalances);
            }
            blockByHashCache.invalidateAll();
            log.info("账本已恢复: 区块{}个, 账户{}个", chain.size(), balances.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}

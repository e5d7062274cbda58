package com.bit.valorium.txpool.impl;

import com.bit.valorium.blockchain.Ledger;
import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.txpool.TransactionVerifier;
import com.bit.valorium.txpool.TxPool;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Service
public class TxPoolImpl implements TxPool {

    // 缓冲区上限，防止内存溢出
    private static final int MAX_POOL_SIZE = 1_000_000;

    private final Ledger ledger;

    private final TransactionVerifier verifier;

    private final HashChain hashChain;

    private final Deque<Transaction> pending = new ArrayDeque<>();

    // 缓冲区内交易哈希
    private final Set<Hash256> pendingHashes = new HashSet<>();

    // 已上链交易哈希，防重放
    private final Set<Hash256> committedHashes = new HashSet<>();

    /** 拒绝交易总数 */
    private final LongAdder rejectedCount = new LongAdder();

    public TxPoolImpl(Ledger ledger, TransactionVerifier verifier, HashChain hashChain) {
        this.ledger = ledger;
        this.verifier = verifier;
        this.hashChain = hashChain;
    }

    @Override
    public synchronized Result<String> verifyTransaction(Transaction tx) {
        String failure = verifier.verify(tx);
        if (failure != null) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, failure);
        }
        Hash256 txHash = tx.hash(hashChain);
        if (pendingHashes.contains(txHash) || committedHashes.contains(txHash)) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "重复交易: " + txHash.shortHex());
        }
        if (pending.size() >= MAX_POOL_SIZE) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "交易池已满");
        }
        if (!tx.isIssuance(ledger.getIssuanceSender())) {
            double available = ledger.balanceOf(tx.getSender()) - pendingOutgoing(tx.getSender());
            if (available < tx.getAmount()) {
                return Result.error(Result.SC_VALIDATION_ERROR_400,
                        "余额不足: " + tx.getSender() + " 可用 " + available + " 需要 " + tx.getAmount());
            }
        }
        return Result.OK(txHash.toHex());
    }

    @Override
    public synchronized Result<String> addTransaction(Transaction tx) {
        Result<String> verified = verifyTransaction(tx);
        if (!verified.isSuccess()) {
            rejectedCount.increment();
            log.warn("交易被拒绝: {}", verified.getMessage());
            return verified;
        }
        pending.addLast(tx);
        pendingHashes.add(Hash256.fromHex(verified.getData()));
        log.debug("交易入池: {} -> {} {} hash={}", tx.getSender(), tx.getRecipient(), tx.getAmount(), verified.getData());
        return Result.OK("交易已加入缓冲区", verified.getData());
    }

    @Override
    public synchronized List<Transaction> drain(int maxCount) {
        ImmutableList.Builder<Transaction> batch = ImmutableList.builder();
        for (int i = 0; i < maxCount && !pending.isEmpty(); i++) {
            Transaction tx = pending.pollFirst();
            pendingHashes.remove(tx.hash(hashChain));
            batch.add(tx);
        }
        return batch.build();
    }

    @Override
    public synchronized void requeue(List<Transaction> transactions) {
        ListIterator<Transaction> it = transactions.listIterator(transactions.size());
        while (it.hasPrevious()) {
            Transaction tx = it.previous();
            if (pendingHashes.add(tx.hash(hashChain))) {
                pending.addFirst(tx);
            }
        }
        log.debug("{}笔交易放回缓冲区", transactions.size());
    }

    @Override
    public synchronized void markCommitted(Collection<Transaction> transactions) {
        for (Transaction tx : transactions) {
            committedHashes.add(tx.hash(hashChain));
        }
    }

    @Override
    public synchronized void reject(Collection<Transaction> transactions, String reason) {
        for (Transaction tx : transactions) {
            rejectedCount.increment();
            log.warn("交易结算被拒绝并丢弃: {} -> {} {}，原因: {}", tx.getSender(), tx.getRecipient(), tx.getAmount(), reason);
        }
    }

    @Override
    public synchronized List<Transaction> getPendingTransactions() {
        return ImmutableList.copyOf(pending);
    }

    @Override
    public synchronized int getPoolSize() {
        return pending.size();
    }

    @Override
    public synchronized double pendingOutgoing(String sender) {
        double total = 0;
        Iterator<Transaction> it = pending.iterator();
        while (it.hasNext()) {
            Transaction tx = it.next();
            if (sender.equals(tx.getSender())) {
                total += tx.getAmount();
            }
        }
        return total;
    }

    @Override
    public synchronized void restore(List<Transaction> restoredPending, Collection<Transaction> committed) {
        pending.clear();
        pendingHashes.clear();
        committedHashes.clear();
        markCommitted(committed);
        for (Transaction tx : restoredPending) {
            if (pendingHashes.add(tx.hash(hashChain))) {
                pending.addLast(tx);
            }
        }
        log.info("交易池已恢复: 待处理{}笔, 已上链{}笔", pending.size(), committedHashes.size());
    }

    @Override
    public long getRejectedCount() {
        return rejectedCount.sum();
    }
}

package com.bit.valorium.txpool;

import com.bit.valorium.result.Result;
import com.bit.valorium.structure.tx.Transaction;

import java.util.Collection;
import java.util.List;

/**
 * 待处理交易缓冲区（FIFO）
 */
public interface TxPool {

    /**
     * 交易验证：格式、重复提交、付款方余额（扣除已在缓冲区中的同一付款方支出）
     * @return 成功 data 为交易哈希；失败 code=400 并带失败消息
     */
    Result<String> verifyTransaction(Transaction tx);

    /**
     * 验证通过后加入缓冲区尾部
     */
    Result<String> addTransaction(Transaction tx);

    /**
     * 取出缓冲区前缀（最多 maxCount 笔）
     */
    List<Transaction> drain(int maxCount);

    /**
     * 中止轮次的交易按原顺序放回缓冲区头部
     */
    void requeue(List<Transaction> transactions);

    /**
     * 交易已上链，记入去重集合
     */
    void markCommitted(Collection<Transaction> transactions);

    /**
     * 结算时被拒的交易直接丢弃
     */
    void reject(Collection<Transaction> transactions, String reason);

    List<Transaction> getPendingTransactions();

    int getPoolSize();

    double pendingOutgoing(String sender);

    long getRejectedCount();

    void restore(List<Transaction> pending, Collection<Transaction> committed);
}

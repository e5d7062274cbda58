package com.bit.valorium.txpool;

import com.bit.valorium.structure.tx.Transaction;

/**
 * 交易静态格式验证，不涉及账户状态
 */
public interface TransactionVerifier {

    /**
     * @return null 表示通过，否则为失败原因
     */
    String verify(Transaction tx);
}

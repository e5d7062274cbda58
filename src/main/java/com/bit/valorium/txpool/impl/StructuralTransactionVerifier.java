package com.bit.valorium.txpool.impl;

import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.txpool.TransactionVerifier;
import org.springframework.stereotype.Component;

@Component
public class StructuralTransactionVerifier implements TransactionVerifier {

    // 附加数据上限（字符）
    public static final int MAX_PAYLOAD_LENGTH = 4096;

    @Override
    public String verify(Transaction tx) {
        if (tx == null) {
            return "交易为空";
        }
        if (tx.getSender() == null || tx.getSender().isBlank()) {
            return "付款方不能为空";
        }
        if (tx.getRecipient() == null || tx.getRecipient().isBlank()) {
            return "收款方不能为空";
        }
        if (Double.isNaN(tx.getAmount()) || Double.isInfinite(tx.getAmount()) || tx.getAmount() <= 0) {
            return "金额必须为正数: " + tx.getAmount();
        }
        if (tx.getTimestamp() < 0) {
            return "时间戳非法: " + tx.getTimestamp();
        }
        if (tx.getPayload() != null && tx.getPayload().length() > MAX_PAYLOAD_LENGTH) {
            return "附加数据过长: " + tx.getPayload().length();
        }
        return null;
    }
}

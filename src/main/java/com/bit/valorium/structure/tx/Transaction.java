package com.bit.valorium.structure.tx;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.util.QuadritCodec;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 转账交易，构造后不可变
 * 交易身份 = 规范字段编码的确定性哈希；来自发行账户（Network Reward）的交易跳过余额检查（铸币）
 */
@Value
@Builder
@Jacksonized
public class Transaction {

    /**
     * 付款方账户
     */
    String sender;

    /**
     * 收款方账户
     */
    String recipient;

    /**
     * 金额，必须 > 0
     */
    double amount;

    /**
     * 创建时间（毫秒）
     */
    long timestamp;

    /**
     * 可选附加数据
     */
    String payload;

    /**
     * 参与哈希的规范字段；附加数据以 Quadrit 文本形式编码
     */
    public Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sender", sender);
        fields.put("recipient", recipient);
        fields.put("amount", amount);
        fields.put("timestamp", timestamp);
        fields.put("payload", payload == null ? "" : QuadritCodec.stringToText(payload));
        return fields;
    }

    public Hash256 hash(HashChain hashChain) {
        return hashChain.digest(canonicalFields());
    }

    public boolean isIssuance(String issuanceSender) {
        return issuanceSender.equals(sender);
    }
}

package com.bit.valorium.blockchain;

/**
 * 账户入账能力（奖励发放、罚没资金转入国库）
 */
public interface BalanceSink {

    void credit(String account, double amount);
}

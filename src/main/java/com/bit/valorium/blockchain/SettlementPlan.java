package com.bit.valorium.blockchain;

import com.bit.valorium.structure.tx.Transaction;
import lombok.Value;

import java.util.List;

/**
 * 按当前余额顺序结算后的划分：accepted 可入块，rejected 会让付款方透支
 */
@Value
public class SettlementPlan {

    List<Transaction> accepted;

    List<Transaction> rejected;
}

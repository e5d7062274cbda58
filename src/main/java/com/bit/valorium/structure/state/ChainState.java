package com.bit.valorium.structure.state;

import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.tx.Transaction;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 持久化快照：链、余额、待处理交易、节点质押与信誉
 */
@Value
@Builder
@Jacksonized
public class ChainState {

    List<Block> chain;

    Map<String, Double> balances;

    List<Transaction> pending;

    List<NodeStanding> standings;

    /**
     * 保存时刻（毫秒）
     */
    long savedAt;
}

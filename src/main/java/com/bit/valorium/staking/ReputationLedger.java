package com.bit.valorium.staking;

import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 节点质押与信誉账本
 * <p>
 * 同一节点的罚没/奖励在该节点的独占锁内完成，质押与信誉总是一起更新。
 * 信誉是唯一的长期记忆：信誉为0的节点只能通过 reward 或 rehabilitate 恢复。
 */
public interface ReputationLedger {

    /**
     * 登记节点，质押为配置的初始值，信誉为1；已登记则保持原状
     */
    NodeStanding enroll(String nodeId);

    NodeStanding enroll(String nodeId, double stake);

    /**
     * 按配置罚金罚没
     */
    NodeStanding slash(String nodeId, String reason);

    /**
     * 罚没 min(stake, penalty) 转入国库，信誉减去固定值（下限0）
     */
    NodeStanding slash(String nodeId, double penalty, String reason);

    /**
     * 账户入账 amount，信誉加固定值（上限1）
     */
    NodeStanding reward(String nodeId, double amount);

    /**
     * 信誉 >= floor 且软件合规
     */
    boolean eligible(Node node, double floor);

    /**
     * 运维手动恢复信誉
     */
    NodeStanding rehabilitate(String nodeId, double reputation);

    Optional<NodeStanding> standing(String nodeId);

    List<NodeStanding> standings();

    void restore(Collection<NodeStanding> standings);
}

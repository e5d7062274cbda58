package com.bit.valorium.voting;

import com.bit.valorium.structure.node.Node;

import java.util.Optional;

/**
 * 见证共识协议：轮换提议、并行收集见证、法定票数评估、提交或中止
 */
public interface AttestationProtocol {

    /**
     * 执行一轮共识；各轮严格串行
     */
    RoundOutcome runRound();

    /**
     * 按轮次在验证者集合上轮换，任何节点都能推算
     */
    Optional<Node> expectedProposer(long round);

    /**
     * 下一轮的轮次号
     */
    long currentRound();

    RoundState getState();
}

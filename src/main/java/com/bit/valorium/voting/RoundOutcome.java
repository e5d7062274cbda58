package com.bit.valorium.voting;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.structure.block.Block;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一轮共识的结果；校验、合规、中止都记录在这里，不抛出 runRound
 */
@Value
@Builder
public class RoundOutcome {

    long round;

    /**
     * COMMITTED / ABORTED；缓冲区为空时为 IDLE（本轮未执行）
     */
    RoundState state;

    AbortReason abortReason;

    String proposerId;

    Hash256 proposalHash;

    Hash256 expectedProofHash;

    Hash256 winningProofHash;

    int winningVotes;

    int quorum;

    int eligibleAttesters;

    Map<String, AttesterResponse> responses;

    @Singular("slashed")
    List<String> slashedNodes;

    /**
     * 提交时生成的区块
     */
    Block block;

    int committedTransactions;

    int rejectedTransactions;

    int requeuedTransactions;

    public boolean isCommitted() {
        return state == RoundState.COMMITTED;
    }

    public boolean isAborted() {
        return state == RoundState.ABORTED;
    }

    public static RoundOutcome skipped(long round) {
        return RoundOutcome.builder().round(round).state(RoundState.IDLE).build();
    }
}

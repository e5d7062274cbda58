package com.bit.valorium.voting;

/**
 * 轮次状态：IDLE → PROPOSAL_ISSUED → ATTESTATIONS_COLLECTING → QUORUM_EVALUATED → {COMMITTED | ABORTED}
 */
public enum RoundState {
    IDLE,
    PROPOSAL_ISSUED,
    ATTESTATIONS_COLLECTING,
    QUORUM_EVALUATED,
    COMMITTED,
    ABORTED
}

package com.bit.valorium.structure.node.strategy;

import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.structure.proof.CoherenceAnchors;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.proposal.ProposalRecord;
import lombok.Value;

/**
 * 见证者在本轮能看到的输入：提案 + 本轮锚点快照
 */
@Value
public class AttestationContext {

    long round;

    ProposalRecord proposal;

    CoherenceAnchors anchors;

    HashChain hashChain;

    /**
     * 由公开输入独立推导证明
     */
    public CoherenceProof deriveProof() {
        return CoherenceProof.derive(hashChain, proposal.getHash(), anchors);
    }
}

package com.bit.valorium.voting;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.structure.proof.Attestation;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按声明的证明哈希计票
 */
@Getter
public class QuorumTally {

    private final Map<Hash256, Integer> votes;

    private final int eligibleCount;

    private final int quorum;

    /**
     * 多数哈希，没有任何有效见证时为 null
     */
    private final Hash256 winningHash;

    private final int winningVotes;

    public QuorumTally(Collection<Attestation> attestations, int eligibleCount, Hash256 expectedHash) {
        Map<Hash256, Integer> counts = new TreeMap<>();
        for (Attestation attestation : attestations) {
            counts.merge(attestation.getProofHash(), 1, Integer::sum);
        }
        this.votes = Collections.unmodifiableMap(counts);
        this.eligibleCount = eligibleCount;
        this.quorum = requiredQuorum(eligibleCount);
        Hash256 winner = null;
        int best = 0;
        // TreeMap 按十六进制升序遍历，严格大于才替换，平票时保留字典序最小者；本地期望哈希平票优先
        for (Map.Entry<Hash256, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > best || (count == best && entry.getKey().equals(expectedHash))) {
                winner = entry.getKey();
                best = count;
            }
        }
        this.winningHash = winner;
        this.winningVotes = best;
    }

    /**
     * 法定票数 = floor(n * 2 / 3) + 1
     */
    public static int requiredQuorum(int eligibleCount) {
        return eligibleCount * 2 / 3 + 1;
    }

    public boolean quorumReached() {
        return winningHash != null && winningVotes >= quorum;
    }

    public boolean winnerMatches(Hash256 expectedHash) {
        return winningHash != null && winningHash.equals(expectedHash);
    }
}

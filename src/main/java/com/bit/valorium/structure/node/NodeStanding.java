package com.bit.valorium.structure.node;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 节点质押与信誉的不可变快照；stake >= 0，reputation 在 [0,1]
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NodeStanding {

    public static final double MAX_REPUTATION = 1.0;

    String nodeId;

    double stake;

    double reputation;

    /**
     * 累计被罚次数
     */
    int slashCount;

    public static NodeStanding initial(String nodeId, double stake) {
        return new NodeStanding(nodeId, Math.max(0, stake), MAX_REPUTATION, 0);
    }

    public NodeStanding slashed(double slashedAmount, double reputationDecrement) {
        return new NodeStanding(nodeId, stake - slashedAmount, clamp(reputation - reputationDecrement), slashCount + 1);
    }

    public NodeStanding rewarded(double reputationIncrement) {
        return toBuilder().reputation(clamp(reputation + reputationIncrement)).build();
    }

    public NodeStanding withReputationSet(double value) {
        return toBuilder().reputation(clamp(value)).build();
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(MAX_REPUTATION, value));
    }
}

package com.bit.valorium.staking.impl;

import com.bit.valorium.blockchain.BalanceSink;
import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.staking.ReputationLedger;
import com.bit.valorium.stencil.SoftwareRegistry;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

@Slf4j
@Service
public class ReputationLedgerImpl implements ReputationLedger {

    private final ValoriumProperties.Reputation config;

    private final SoftwareRegistry softwareRegistry;

    private final BalanceSink balanceSink;

    private final Map<String, NodeStanding> standings = new ConcurrentHashMap<>();

    // 按节点ID分段加锁
    private final Striped<Lock> nodeLocks = Striped.lock(64);

    public ReputationLedgerImpl(ValoriumProperties properties, SoftwareRegistry softwareRegistry, BalanceSink balanceSink) {
        this.config = properties.getReputation();
        this.softwareRegistry = softwareRegistry;
        this.balanceSink = balanceSink;
    }

    @Override
    public NodeStanding enroll(String nodeId) {
        return enroll(nodeId, config.getInitialStake());
    }

    @Override
    public NodeStanding enroll(String nodeId, double stake) {
        return standings.computeIfAbsent(nodeId, id -> {
            log.info("节点{}登记质押{}", id, stake);
            return NodeStanding.initial(id, stake);
        });
    }

    @Override
    public NodeStanding slash(String nodeId, String reason) {
        return slash(nodeId, config.getSlashingPenalty(), reason);
    }

    @Override
    public NodeStanding slash(String nodeId, double penalty, String reason) {
        Lock lock = nodeLocks.get(nodeId);
        lock.lock();
        try {
            NodeStanding current = require(nodeId);
            double slashed = Math.min(current.getStake(), Math.max(0, penalty));
            NodeStanding updated = current.slashed(slashed, config.getSlashDecrement());
            if (slashed > 0) {
                balanceSink.credit(config.getTreasuryAccount(), slashed);
            }
            standings.put(nodeId, updated);
            log.warn("节点{}被罚没: 质押 {} -> {}, 信誉 {} -> {}, 原因: {}", nodeId, current.getStake(), updated.getStake(),
                    current.getReputation(), updated.getReputation(), reason);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public NodeStanding reward(String nodeId, double amount) {
        Lock lock = nodeLocks.get(nodeId);
        lock.lock();
        try {
            NodeStanding current = require(nodeId);
            if (amount > 0) {
                balanceSink.credit(nodeId, amount);
            }
            NodeStanding updated = current.rewarded(config.getRewardIncrement());
            standings.put(nodeId, updated);
            log.debug("节点{}获得奖励{}, 信誉 {} -> {}", nodeId, amount, current.getReputation(), updated.getReputation());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean eligible(Node node, double floor) {
        NodeStanding current = standings.get(node.getId());
        if (current == null || current.getReputation() < floor) {
            return false;
        }
        return softwareRegistry.isCompliant(node);
    }

    @Override
    public NodeStanding rehabilitate(String nodeId, double reputation) {
        Lock lock = nodeLocks.get(nodeId);
        lock.lock();
        try {
            NodeStanding current = require(nodeId);
            NodeStanding updated = current.withReputationSet(reputation);
            standings.put(nodeId, updated);
            log.info("节点{}信誉恢复: {} -> {}", nodeId, current.getReputation(), updated.getReputation());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<NodeStanding> standing(String nodeId) {
        return Optional.ofNullable(standings.get(nodeId));
    }

    @Override
    public List<NodeStanding> standings() {
        List<NodeStanding> all = new ArrayList<>(standings.values());
        all.sort(Comparator.comparing(NodeStanding::getNodeId));
        return all;
    }

    @Override
    public void restore(Collection<NodeStanding> restored) {
        for (NodeStanding standing : restored) {
            standings.put(standing.getNodeId(), standing);
        }
        log.info("节点质押信誉已恢复: {}个", restored.size());
    }

    private NodeStanding require(String nodeId) {
        NodeStanding current = standings.get(nodeId);
        if (current == null) {
            throw new IllegalArgumentException("节点未登记: " + nodeId);
        }
        return current;
    }
}

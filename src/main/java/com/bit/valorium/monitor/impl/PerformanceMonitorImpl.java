package com.bit.valorium.monitor.impl;

import com.bit.valorium.blockchain.Ledger;
import com.bit.valorium.genome.FragmentStore;
import com.bit.valorium.monitor.PerformanceMonitor;
import com.bit.valorium.monitor.impl.dto.PerformanceReport;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.staking.ReputationLedger;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.txpool.TxPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.LongAdder;

@Slf4j
@Component
public class PerformanceMonitorImpl implements PerformanceMonitor {

    private final Ledger ledger;

    private final FragmentStore fragmentStore;

    private final ReputationLedger reputationLedger;

    private final NodeDirectory nodeDirectory;

    private final TxPool txPool;

    private final Clock clock;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** 提交轮次 */
    private final LongAdder committedRounds = new LongAdder();
    /** 中止轮次 */
    private final LongAdder abortedRounds = new LongAdder();

    private final Set<String> maliciousNodes = new ConcurrentSkipListSet<>();

    /** 各节点参与的见证次数 */
    private final Map<String, LongAdder> attestationTotals = new ConcurrentHashMap<>();
    /** 各节点与获胜证明一致的见证次数 */
    private final Map<String, LongAdder> attestationSuccesses = new ConcurrentHashMap<>();

    public PerformanceMonitorImpl(Ledger ledger, FragmentStore fragmentStore, ReputationLedger reputationLedger,
                                  NodeDirectory nodeDirectory, TxPool txPool, Clock clock) {
        this.ledger = ledger;
        this.fragmentStore = fragmentStore;
        this.reputationLedger = reputationLedger;
        this.nodeDirectory = nodeDirectory;
        this.txPool = txPool;
        this.clock = clock;
    }

    @Override
    public void recordCommit(long round) {
        committedRounds.increment();
    }

    @Override
    public void recordAbort(long round, String reason) {
        abortedRounds.increment();
        log.debug("轮次{}中止计数+1: {}", round, reason);
    }

    @Override
    public void recordAttestation(String nodeId, boolean agreed) {
        attestationTotals.computeIfAbsent(nodeId, id -> new LongAdder()).increment();
        if (agreed) {
            attestationSuccesses.computeIfAbsent(nodeId, id -> new LongAdder()).increment();
        }
    }

    @Override
    public void markMalicious(String nodeId) {
        maliciousNodes.add(nodeId);
    }

    @Override
    public PerformanceReport report() {
        PerformanceReport report = new PerformanceReport();
        long committed = committedRounds.sum();
        long aborted = abortedRounds.sum();
        report.setChainLength(ledger.length());
        report.setCommittedRounds(committed);
        report.setAbortedRounds(aborted);
        report.setConsensusSuccessRate(committed + aborted == 0 ? 0 : round(committed * 100.0 / (committed + aborted)));
        report.setRegenerationCount(fragmentStore.getRegenerationCount());
        report.setIrrecoverableLossCount(fragmentStore.getIrrecoverableLossCount());
        report.setMaliciousNodes(new ArrayList<>(maliciousNodes));
        report.setMaliciousNodeCount(maliciousNodes.size());
        List<NodeStanding> standings = reputationLedger.standings();
        report.setNetworkHealth(standings.isEmpty() ? 0
                : round(standings.stream().mapToDouble(NodeStanding::getReputation).average().orElse(0) * 100));
        Map<String, Double> successRates = new TreeMap<>();
        for (Node attester : nodeDirectory.attesters()) {
            successRates.put(attester.getId(), round(successRateOf(attester.getId()) * 100));
        }
        report.setNodeSuccessRates(successRates);
        report.setAvgNodeSuccessRate(successRates.isEmpty() ? 0
                : round(successRates.values().stream().mapToDouble(Double::doubleValue).average().orElse(0)));
        report.setHonestNodes((int) nodeDirectory.all().stream()
                .filter(node -> reputationLedger.standing(node.getId())
                        .map(standing -> standing.getSlashCount() == 0)
                        .orElse(true))
                .count());
        report.setTotalNodes(nodeDirectory.size());
        report.setPendingTransactions(txPool.getPoolSize());
        report.setRejectedTransactions(txPool.getRejectedCount());
        report.setGeneratedAt(clock.millis());
        return report;
    }

    @Override
    public String exportJson() {
        try {
            return mapper.writeValueAsString(report());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("运行报告序列化失败", e);
        }
    }

    /**
     * 一致见证数 / 参与见证数；还没参与过见证的节点按 1.0 计
     */
    double successRateOf(String nodeId) {
        LongAdder total = attestationTotals.get(nodeId);
        if (total == null || total.sum() == 0) {
            return 1.0;
        }
        LongAdder successes = attestationSuccesses.get(nodeId);
        return successes == null ? 0 : successes.sum() / (double) total.sum();
    }

    // 保留两位小数
    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}

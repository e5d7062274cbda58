package com.bit.valorium.monitor.impl.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 网络运行报告
 */
@Data
public class PerformanceReport {
    private long chainLength; // 区块数（含创世块）
    private long committedRounds; // 提交轮次
    private long abortedRounds; // 中止轮次
    private double consensusSuccessRate; // 共识成功率(%)
    private long regenerationCount; // 片段再生次数
    private long irrecoverableLossCount; // 不可恢复片段数
    private int maliciousNodeCount; // 因错误/缺失见证被罚没的不同节点数
    private List<String> maliciousNodes;
    private double networkHealth; // 平均信誉(%)
    private double avgNodeSuccessRate; // 见证者平均见证成功率(%)
    private Map<String, Double> nodeSuccessRates; // 各见证者见证成功率(%)，没有记录时按100计
    private int honestNodes; // 从未被罚没的节点数
    private int totalNodes;
    private int pendingTransactions;
    private long rejectedTransactions;
    private long generatedAt;
}

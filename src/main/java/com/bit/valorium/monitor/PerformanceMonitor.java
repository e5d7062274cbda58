package com.bit.valorium.monitor;

import com.bit.valorium.monitor.impl.dto.PerformanceReport;

/**
 * 共识运行指标：轮次结果、恶意节点、片段再生与丢失
 */
public interface PerformanceMonitor {

    void recordCommit(long round);

    void recordAbort(long round, String reason);

    /**
     * 记录一次见证结果；agreed 表示与获胜证明一致
     */
    void recordAttestation(String nodeId, boolean agreed);

    /**
     * 记录因错误或缺失见证被罚没的见证者
     */
    void markMalicious(String nodeId);

    PerformanceReport report();

    /**
     * 报告的 JSON 形式
     */
    String exportJson();
}

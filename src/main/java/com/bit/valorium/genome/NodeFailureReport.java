package com.bit.valorium.genome;

import lombok.Value;

import java.util.List;

/**
 * 节点故障处理结果：重新分发成功的片段与不可恢复的片段
 */
@Value
public class NodeFailureReport {

    List<String> failedNodes;

    List<String> regenerated;

    List<String> lost;

    public boolean hasLoss() {
        return !lost.isEmpty();
    }
}

package com.bit.valorium.genome;

import com.bit.valorium.result.Result;
import com.bit.valorium.structure.genome.GenomeFragment;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 基因片段存储：把账本历史片段连同冗余副本分配给托管节点，检测丢失并再生
 */
public interface FragmentStore {

    /**
     * 构造主片段（计算校验和，冗余因子取配置值）
     */
    GenomeFragment createPrimary(String baseId, byte[] payload);

    /**
     * 主片段交给 targets[0]，第 i 个冗余片段交给 targets[i+1]；少于2个目标节点直接失败
     */
    void distribute(GenomeFragment fragment, List<String> targetNodeIds);

    /**
     * 移除故障节点上的所有位置记录，对失去全部位置的片段尝试再生
     */
    NodeFailureReport onNodeFailure(Collection<String> nodeIds);

    /**
     * 从存活的同组片段解码原文、校验后放到新的托管节点；已有存活位置时不做任何事
     * @return 成功 data 为新托管节点；无存活片段时 code=410
     */
    Result<String> regenerate(String fragmentId);

    /**
     * 从任意存活片段还原原文
     */
    Result<byte[]> reconstruct(String baseId);

    /**
     * 登记可作为再生目标的托管节点
     */
    void registerCustodian(String nodeId);

    boolean isFailed(String nodeId);

    Set<String> locationsOf(String fragmentId);

    /**
     * 该片段组还能承受的托管节点故障数 = 存活托管节点数 - 1
     * <p>
     * 返回解码器的实际容错能力：任一存活片段都能解出主载荷，所以刚分发到 k+1 个节点的组返回 k，
     * 而不是保守估计的 k-1。
     */
    int tolerableFailures(String baseId);

    boolean contains(String baseId);

    long getRegenerationCount();

    long getIrrecoverableLossCount();
}

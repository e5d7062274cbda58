package com.bit.valorium.service;

import com.bit.valorium.blockchain.IntegrityReport;
import com.bit.valorium.genome.NodeFailureReport;
import com.bit.valorium.monitor.impl.dto.PerformanceReport;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.dto.RegisterVersionRequest;
import com.bit.valorium.structure.dto.TransferRequest;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.state.ChainState;
import com.bit.valorium.voting.RoundOutcome;

import java.util.List;
import java.util.Map;

/**
 * 运维命令；返回码 200 成功，400 校验错误，409 完整性失败，410 片段不可恢复
 */
public interface OperatorService {

    /**
     * 启动：登记官方版本、登记节点、加载持久化状态（失败则从创世块开始）、存档区块
     */
    void bootstrap();

    Result<String> registerVersion(RegisterVersionRequest request);

    Result<String> addTransaction(TransferRequest request);

    Result<RoundOutcome> runRound();

    Result<NodeFailureReport> simulateNodeFailure(List<String> nodeIds);

    Result<String> regenerateFragment(String fragmentId);

    Result<NodeStanding> rehabilitate(String nodeId, double reputation);

    Result<List<NodeStanding>> standings();

    Result<IntegrityReport> verifyIntegrity();

    Result<Void> saveState();

    Result<ChainState> loadState();

    Result<PerformanceReport> report();

    Result<String> exportReport();

    Result<Double> balance(String account);

    Result<Map<String, Double>> balances();

    Result<List<Block>> chain();

    Result<Block> block(long sequence);
}

package com.bit.valorium.service.impl;

import com.bit.valorium.blockchain.IntegrityReport;
import com.bit.valorium.blockchain.Ledger;
import com.bit.valorium.common.Hash256;
import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.database.StateStore;
import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.exception.ValoriumException;
import com.bit.valorium.genome.FragmentStore;
import com.bit.valorium.genome.GenomeArchiver;
import com.bit.valorium.genome.NodeFailureReport;
import com.bit.valorium.monitor.PerformanceMonitor;
import com.bit.valorium.monitor.impl.dto.PerformanceReport;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import com.bit.valorium.staking.ReputationLedger;
import com.bit.valorium.stencil.SoftwareRegistry;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.dto.RegisterVersionRequest;
import com.bit.valorium.structure.dto.TransferRequest;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.state.ChainState;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.txpool.TxPool;
import com.bit.valorium.voting.AttestationProtocol;
import com.bit.valorium.voting.RoundOutcome;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class OperatorServiceImpl implements OperatorService {

    private final ValoriumProperties properties;

    private final SoftwareRegistry softwareRegistry;

    private final ReputationLedger reputationLedger;

    private final NodeDirectory nodeDirectory;

    private final Ledger ledger;

    private final TxPool txPool;

    private final AttestationProtocol attestationProtocol;

    private final FragmentStore fragmentStore;

    private final GenomeArchiver genomeArchiver;

    private final PerformanceMonitor performanceMonitor;

    private final StateStore stateStore;

    private final Clock clock;

    public OperatorServiceImpl(ValoriumProperties properties, SoftwareRegistry softwareRegistry,
                               ReputationLedger reputationLedger, NodeDirectory nodeDirectory, Ledger ledger,
                               TxPool txPool, AttestationProtocol attestationProtocol, FragmentStore fragmentStore,
                               GenomeArchiver genomeArchiver, PerformanceMonitor performanceMonitor,
                               StateStore stateStore, Clock clock) {
        this.properties = properties;
        this.softwareRegistry = softwareRegistry;
        this.reputationLedger = reputationLedger;
        this.nodeDirectory = nodeDirectory;
        this.ledger = ledger;
        this.txPool = txPool;
        this.attestationProtocol = attestationProtocol;
        this.fragmentStore = fragmentStore;
        this.genomeArchiver = genomeArchiver;
        this.performanceMonitor = performanceMonitor;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    @PostConstruct
    @Override
    public void bootstrap() {
        properties.getStencil().forEach(softwareRegistry::registerRelease);
        if (properties.getPersistence().isEnabled()) {
            loadState();
        }
        for (Node node : nodeDirectory.all()) {
            reputationLedger.enroll(node.getId());
        }
        archiveChain();
        log.info("Valorium X 启动完成: 区块{}个, 节点{}个, 待处理交易{}笔", ledger.length(), nodeDirectory.size(),
                txPool.getPoolSize());
    }

    private void archiveChain() {
        for (Block block : ledger.getChain()) {
            genomeArchiver.archive(block);
        }
    }

    @Override
    public Result<String> registerVersion(RegisterVersionRequest request) {
        if (request == null || request.getVersion() == null || request.getVersion().isBlank()) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "版本号不能为空");
        }
        try {
            Hash256 trusted;
            if (request.getTrustedHash() == null || request.getTrustedHash().isBlank()) {
                trusted = softwareRegistry.registerRelease(request.getVersion());
            } else {
                trusted = Hash256.fromHex(request.getTrustedHash());
                softwareRegistry.register(request.getVersion(), trusted);
            }
            return Result.OK("版本已登记", trusted.toHex());
        } catch (IllegalArgumentException e) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, e.getMessage());
        }
    }

    @Override
    public Result<String> addTransaction(TransferRequest request) {
        if (request == null) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "请求为空");
        }
        Transaction tx = Transaction.builder()
                .sender(request.getSender())
                .recipient(request.getRecipient())
                .amount(request.getAmount())
                .timestamp(clock.millis())
                .payload(request.getPayload())
                .build();
        return txPool.addTransaction(tx);
    }

    @Override
    public Result<RoundOutcome> runRound() {
        RoundOutcome outcome = attestationProtocol.runRound();
        switch (outcome.getState()) {
            case COMMITTED:
                return Result.OK("轮次已提交，区块#" + outcome.getBlock().getSequence(), outcome);
            case ABORTED:
                return Result.OK("轮次中止: " + outcome.getAbortReason().getDesc(), outcome);
            default:
                return Result.OK("没有待处理交易", outcome);
        }
    }

    @Override
    public Result<NodeFailureReport> simulateNodeFailure(List<String> nodeIds) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "故障节点列表为空");
        }
        NodeFailureReport report = fragmentStore.onNodeFailure(nodeIds);
        if (report.hasLoss()) {
            log.error("节点故障导致{}个片段不可恢复: {}", report.getLost().size(), report.getLost());
            Result<NodeFailureReport> result = Result.error(ErrorType.IRRECOVERABLE_FRAGMENT_LOSS,
                    "片段不可恢复: " + report.getLost());
            result.setData(report);
            return result;
        }
        return Result.OK("已再生片段" + report.getRegenerated().size() + "个", report);
    }

    @Override
    public Result<String> regenerateFragment(String fragmentId) {
        return fragmentStore.regenerate(fragmentId);
    }

    @Override
    public Result<NodeStanding> rehabilitate(String nodeId, double reputation) {
        if (reputationLedger.standing(nodeId).isEmpty()) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "节点未登记: " + nodeId);
        }
        return Result.OK(reputationLedger.rehabilitate(nodeId, reputation));
    }

    @Override
    public Result<List<NodeStanding>> standings() {
        return Result.OK(reputationLedger.standings());
    }

    @Override
    public Result<IntegrityReport> verifyIntegrity() {
        IntegrityReport report = ledger.verifyIntegrity();
        if (!report.isValid()) {
            Result<IntegrityReport> result = Result.error(ErrorType.CHAIN_INTEGRITY,
                    "区块#" + report.getFirstBrokenSequence() + " " + report.getReason());
            result.setData(report);
            return result;
        }
        return Result.OK("链完整性校验通过", report);
    }

    @Override
    public Result<Void> saveState() {
        ChainState state = ChainState.builder()
                .chain(ledger.getChain())
                .balances(ledger.balances())
                .pending(txPool.getPendingTransactions())
                .standings(reputationLedger.standings())
                .savedAt(clock.millis())
                .build();
        return stateStore.saveState(state);
    }

    @Override
    public Result<ChainState> loadState() {
        Result<ChainState> loaded = stateStore.loadState();
        if (!loaded.isSuccess()) {
            log.warn("加载状态失败，从创世块开始: {}", loaded.getMessage());
            ledger.resetToGenesis();
            txPool.restore(List.of(), List.of());
            return loaded;
        }
        ChainState state = loaded.getData();
        try {
            ledger.restore(state.getChain(), state.getBalances());
        } catch (ValoriumException e) {
            log.warn("状态文件中的链不可用，从创世块开始: {}", e.getMessage());
            ledger.resetToGenesis();
            txPool.restore(List.of(), List.of());
            return Result.error(e.getErrorType(), e.getMessage());
        }
        List<Transaction> committed = state.getChain().stream()
                .flatMap(block -> block.getTransactions().stream())
                .collect(Collectors.toList());
        txPool.restore(state.getPending() == null ? List.of() : state.getPending(), committed);
        if (state.getStandings() != null) {
            reputationLedger.restore(state.getStandings());
        }
        IntegrityReport integrity = ledger.verifyIntegrity();
        if (!integrity.isValid()) {
            log.error("加载的链完整性校验失败，按原样保留: 区块#{} {}", integrity.getFirstBrokenSequence(),
                    integrity.getReason());
            Result<ChainState> result = Result.error(ErrorType.CHAIN_INTEGRITY,
                    "加载的链在区块#" + integrity.getFirstBrokenSequence() + "处断裂");
            result.setData(state);
            return result;
        }
        return Result.OK("状态已加载", state);
    }

    @Override
    public Result<PerformanceReport> report() {
        return Result.OK(performanceMonitor.report());
    }

    @Override
    public Result<String> exportReport() {
        return Result.OK(performanceMonitor.exportJson());
    }

    @Override
    public Result<Double> balance(String account) {
        return Result.OK(ledger.balanceOf(account));
    }

    @Override
    public Result<Map<String, Double>> balances() {
        return Result.OK(ledger.balances());
    }

    @Override
    public Result<List<Block>> chain() {
        return Result.OK(ledger.getChain());
    }

    @Override
    public Result<Block> block(long sequence) {
        return ledger.getBlockBySequence(sequence)
                .map(Result::OK)
                .orElseGet(() -> Result.error(Result.SC_VALIDATION_ERROR_400, "区块不存在: " + sequence));
    }
}

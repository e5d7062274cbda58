package com.bit.valorium.voting.impl;

import com.bit.valorium.blockchain.Ledger;
import com.bit.valorium.blockchain.SettlementPlan;
import com.bit.valorium.common.Hash256;
import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.genome.GenomeArchiver;
import com.bit.valorium.monitor.PerformanceMonitor;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.staking.ReputationLedger;
import com.bit.valorium.stencil.SoftwareRegistry;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.node.strategy.AttestationContext;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.proof.CoherenceAnchors;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.proposal.ProposalRecord;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.txpool.TxPool;
import com.bit.valorium.voting.AbortReason;
import com.bit.valorium.voting.AttestationProtocol;
import com.bit.valorium.voting.AttesterResponse;
import com.bit.valorium.voting.QuorumTally;
import com.bit.valorium.voting.RoundOutcome;
import com.bit.valorium.voting.RoundState;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AttestationProtocolImpl implements AttestationProtocol {

    private final Ledger ledger;

    private final TxPool txPool;

    private final NodeDirectory nodeDirectory;

    private final SoftwareRegistry softwareRegistry;

    private final ReputationLedger reputationLedger;

    private final GenomeArchiver genomeArchiver;

    private final PerformanceMonitor performanceMonitor;

    private final HashChain hashChain;

    private final CryptoPrimitive cryptoPrimitive;

    private final ValoriumProperties.Consensus config;

    private final Clock clock;

    // 见证收集线程池
    private final ExecutorService attestationPool;

    private final AtomicLong roundIndex = new AtomicLong();

    private volatile RoundState state = RoundState.IDLE;

    public AttestationProtocolImpl(Ledger ledger, TxPool txPool, NodeDirectory nodeDirectory,
                                   SoftwareRegistry softwareRegistry, ReputationLedger reputationLedger,
                                   GenomeArchiver genomeArchiver, PerformanceMonitor performanceMonitor,
                                   HashChain hashChain, CryptoPrimitive cryptoPrimitive,
                                   ValoriumProperties properties, Clock clock) {
        this.ledger = ledger;
        this.txPool = txPool;
        this.nodeDirectory = nodeDirectory;
        this.softwareRegistry = softwareRegistry;
        this.reputationLedger = reputationLedger;
        this.genomeArchiver = genomeArchiver;
        this.performanceMonitor = performanceMonitor;
        this.hashChain = hashChain;
        this.cryptoPrimitive = cryptoPrimitive;
        this.config = properties.getConsensus();
        this.clock = clock;
        this.attestationPool = Executors.newFixedThreadPool(config.getAttestationParallelism(),
                new ThreadFactoryBuilder().setNameFormat("attest-%d").setDaemon(true).build());
    }

    @Override
    public synchronized RoundOutcome runRound() {
        if (txPool.getPoolSize() == 0) {
            log.info("缓冲区没有待处理交易，跳过本轮");
            return RoundOutcome.skipped(roundIndex.get());
        }
        long round = roundIndex.getAndIncrement();
        RoundOutcome.RoundOutcomeBuilder outcome = RoundOutcome.builder().round(round);

        Optional<Node> elected = expectedProposer(round);
        if (elected.isEmpty()) {
            return abort(outcome, round, AbortReason.NO_VALIDATORS, List.of());
        }
        Node proposer = elected.get();
        outcome.proposerId(proposer.getId());
        log.info("===== 轮次{}开始，提议者 {} =====", round, proposer.getId());

        // 提议前检查提议者
        AbortReason proposerFault = checkProposer(proposer);
        if (proposerFault != null) {
            if (reputationLedger.standing(proposer.getId()).isPresent()) {
                reputationLedger.slash(proposer.getId(), "轮次" + round + proposerFault.getDesc());
                outcome.slashed(proposer.getId());
            }
            return abort(outcome, round, proposerFault, List.of());
        }

        List<Transaction> batch = txPool.drain(config.getMaxTransactionsPerBlock());
        SettlementPlan plan = ledger.settleable(batch);
        if (!plan.getRejected().isEmpty()) {
            txPool.reject(plan.getRejected(), "结算时余额不足");
        }
        List<Transaction> transactions = plan.getAccepted();
        outcome.rejectedTransactions(plan.getRejected().size());
        if (transactions.isEmpty()) {
            return abort(outcome, round, AbortReason.NO_SETTLEABLE_TRANSACTIONS, List.of());
        }

        ProposalRecord proposal = proposer.propose(hashChain, transactions, clock.millis());
        transition(round, RoundState.PROPOSAL_ISSUED);
        outcome.proposalHash(proposal.getHash());

        // 本轮唯一一次锚点快照
        CoherenceAnchors anchors = ledger.snapshotAnchors();
        AttestationContext context = new AttestationContext(round, proposal, anchors, hashChain);
        CoherenceProof expectedProof = context.deriveProof();
        outcome.expectedProofHash(expectedProof.getProofHash());

        List<Node> eligible = eligibleAttesters(round);
        outcome.eligibleAttesters(eligible.size());
        if (eligible.isEmpty()) {
            return abort(outcome, round, AbortReason.NO_ELIGIBLE_ATTESTERS, transactions);
        }

        transition(round, RoundState.ATTESTATIONS_COLLECTING);
        Map<String, Optional<Attestation>> collected = new LinkedHashMap<>();
        Map<String, AttesterResponse> responses = new LinkedHashMap<>();
        collect(round, context, eligible, collected, responses);

        List<Attestation> valid = collected.values().stream()
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        QuorumTally tally = new QuorumTally(valid, eligible.size(), expectedProof.getProofHash());
        transition(round, RoundState.QUORUM_EVALUATED);
        outcome.winningProofHash(tally.getWinningHash())
                .winningVotes(tally.getWinningVotes())
                .quorum(tally.getQuorum());
        log.info("轮次{}计票: 合格见证者{} 法定票数{} 多数证明{} 得票{}", round, eligible.size(), tally.getQuorum(),
                tally.getWinningHash() == null ? "无" : tally.getWinningHash().shortHex(), tally.getWinningVotes());

        List<Attestation> winning = new ArrayList<>();
        for (Node attester : eligible) {
            Optional<Attestation> attestation = collected.getOrDefault(attester.getId(), Optional.empty());
            if (attestation.isPresent() && attestation.get().getProofHash().equals(tally.getWinningHash())) {
                responses.put(attester.getId(), AttesterResponse.AGREED);
                winning.add(attestation.get());
                performanceMonitor.recordAttestation(attester.getId(), true);
                continue;
            }
            performanceMonitor.recordAttestation(attester.getId(), false);
            AttesterResponse response = responses.get(attester.getId());
            if (response == null) {
                response = AttesterResponse.DISAGREED;
                responses.put(attester.getId(), response);
            }
            if (response == AttesterResponse.TIMED_OUT && !config.isSlashOnTimeout()) {
                log.warn("轮次{}见证者{}超时，未罚没", round, attester.getId());
                continue;
            }
            reputationLedger.slash(attester.getId(), "轮次" + round + "见证不一致: " + response);
            performanceMonitor.markMalicious(attester.getId());
            outcome.slashed(attester.getId());
        }
        outcome.responses(responses);

        if (!tally.winnerMatches(expectedProof.getProofHash())) {
            return abort(outcome, round, tally.getWinningHash() == null
                    ? AbortReason.QUORUM_NOT_REACHED : AbortReason.PLURALITY_MISMATCH, transactions);
        }
        if (!tally.quorumReached()) {
            return abort(outcome, round, AbortReason.QUORUM_NOT_REACHED, transactions);
        }

        Block block = ledger.appendBlock(proposal.getHash(), expectedProof, winning, transactions,
                anchors.getLastBlockHash());
        ledger.applyBalances(transactions);
        txPool.markCommitted(transactions);
        distributeRewards(proposer, winning);
        performanceMonitor.recordCommit(round);
        genomeArchiver.archive(block);
        transition(round, RoundState.COMMITTED);
        log.info("===== 轮次{}提交: 区块#{} {} =====", round, block.getSequence(), block.getHash().shortHex());
        return outcome.state(RoundState.COMMITTED)
                .block(block)
                .committedTransactions(transactions.size())
                .build();
    }

    private AbortReason checkProposer(Node proposer) {
        if (!softwareRegistry.isCompliant(proposer)) {
            log.warn("提议者{}软件不合规（版本{}）", proposer.getId(), proposer.getSoftwareVersion());
            return AbortReason.PROPOSER_NON_COMPLIANT;
        }
        double reputation = reputationOf(proposer.getId());
        if (reputation < config.getReputationFloor()) {
            log.warn("提议者{}信誉{}低于下限{}", proposer.getId(), reputation, config.getReputationFloor());
            return AbortReason.PROPOSER_BELOW_FLOOR;
        }
        return null;
    }

    private List<Node> eligibleAttesters(long round) {
        List<Node> eligible = new ArrayList<>();
        for (Node attester : nodeDirectory.attesters()) {
            if (reputationLedger.eligible(attester, config.getReputationFloor())) {
                eligible.add(attester);
            } else {
                log.warn("轮次{}见证者{}不合格（信誉{}，合规{}），排除", round, attester.getId(),
                        reputationOf(attester.getId()), softwareRegistry.isCompliant(attester));
            }
        }
        return eligible;
    }

    /**
     * 并行收集见证，全部返回或超时后才进入计票
     */
    private void collect(long round, AttestationContext context, List<Node> eligible,
                         Map<String, Optional<Attestation>> collected, Map<String, AttesterResponse> responses) {
        List<Callable<Optional<Attestation>>> tasks = eligible.stream()
                .map(node -> (Callable<Optional<Attestation>>) () -> node.attest(context, cryptoPrimitive))
                .collect(Collectors.toList());
        List<Future<Optional<Attestation>>> futures;
        try {
            futures = attestationPool.invokeAll(tasks, config.getAttestationTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("轮次{}见证收集被中断", round);
            eligible.forEach(node -> responses.put(node.getId(), AttesterResponse.TIMED_OUT));
            return;
        }
        for (int i = 0; i < eligible.size(); i++) {
            Node node = eligible.get(i);
            Future<Optional<Attestation>> future = futures.get(i);
            try {
                Optional<Attestation> attestation = future.get();
                if (attestation.isEmpty()) {
                    responses.put(node.getId(), AttesterResponse.DECLINED);
                } else if (!verifySignature(node, attestation.get())) {
                    log.warn("轮次{}见证者{}签名校验失败，见证被丢弃", round, node.getId());
                    responses.put(node.getId(), AttesterResponse.INVALID_SIGNATURE);
                } else {
                    collected.put(node.getId(), attestation);
                }
            } catch (CancellationException e) {
                log.warn("轮次{}见证者{}超时未响应", round, node.getId());
                responses.put(node.getId(), AttesterResponse.TIMED_OUT);
            } catch (ExecutionException e) {
                log.warn("轮次{}见证者{}执行异常: {}", round, node.getId(), e.getCause().getMessage());
                responses.put(node.getId(), AttesterResponse.TIMED_OUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                responses.put(node.getId(), AttesterResponse.TIMED_OUT);
            }
        }
    }

    private boolean verifySignature(Node node, Attestation attestation) {
        return node.getId().equals(attestation.getAttesterId())
                && attestation.getSignature() != null
                && cryptoPrimitive.verify(attestation.signingMessage(), attestation.getSignature(), node.getPublicKey());
    }

    /**
     * 提议者拿 proposerRewardShare，其余由获胜见证者平分
     */
    private void distributeRewards(Node proposer, List<Attestation> winning) {
        double total = config.getBlockReward();
        double proposerShare = winning.isEmpty() ? total : total * config.getProposerRewardShare();
        reputationLedger.reward(proposer.getId(), proposerShare);
        if (winning.isEmpty()) {
            return;
        }
        double perAttester = (total - proposerShare) / winning.size();
        for (Attestation attestation : winning) {
            reputationLedger.reward(attestation.getAttesterId(), perAttester);
        }
    }

    private RoundOutcome abort(RoundOutcome.RoundOutcomeBuilder outcome, long round, AbortReason reason,
                               List<Transaction> transactions) {
        if (!transactions.isEmpty()) {
            txPool.requeue(transactions);
        }
        performanceMonitor.recordAbort(round, reason.name());
        transition(round, RoundState.ABORTED);
        log.warn("===== 轮次{}中止: {}，{}笔交易放回缓冲区 =====", round, reason.getDesc(), transactions.size());
        return outcome.state(RoundState.ABORTED)
                .abortReason(reason)
                .requeuedTransactions(transactions.size())
                .build();
    }

    private void transition(long round, RoundState next) {
        log.debug("轮次{}状态 {} -> {}", round, state, next);
        state = next;
    }

    private double reputationOf(String nodeId) {
        return reputationLedger.standing(nodeId).map(NodeStanding::getReputation).orElse(0.0);
    }

    @Override
    public Optional<Node> expectedProposer(long round) {
        List<Node> validators = nodeDirectory.validators();
        if (validators.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(validators.get((int) Math.floorMod(round, (long) validators.size())));
    }

    @Override
    public long currentRound() {
        return roundIndex.get();
    }

    @Override
    public RoundState getState() {
        return state;
    }

    @PreDestroy
    public void destroy() {
        log.info("关闭见证收集线程池");
        attestationPool.shutdownNow();
    }
}

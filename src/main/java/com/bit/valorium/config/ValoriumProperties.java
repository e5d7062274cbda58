package com.bit.valorium.config;

import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.exception.ValoriumException;
import com.bit.valorium.structure.node.NodeRole;
import com.bit.valorium.structure.node.strategy.StrategyType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 系统配置，绑定 application.yml 中 valorium.* 前缀
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "valorium")
public class ValoriumProperties {

    private Consensus consensus = new Consensus();
    private Reputation reputation = new Reputation();
    private Ledger ledger = new Ledger();
    private Genome genome = new Genome();
    private Persistence persistence = new Persistence();

    /**
     * 网络节点集合（注册顺序即提议者轮换顺序）
     */
    private List<NodeSpec> nodes = new ArrayList<>();

    /**
     * 启动时登记的官方软件版本
     */
    private List<String> stencil = new ArrayList<>();

    @Data
    public static class Consensus {
        // 提议者与见证者的信誉下限
        private double reputationFloor = 0.5;
        // 每轮最多打包的交易数（缓冲区前缀）
        private int maxTransactionsPerBlock = 500;
        // 见证收集超时
        private long attestationTimeoutMillis = 2000;
        // 见证收集线程数
        private int attestationParallelism = 8;
        // 超时未响应的见证者是否罚没
        private boolean slashOnTimeout = true;
        // 每个区块的发行奖励
        private double blockReward = 100;
        // 提议者分成，剩余部分由获胜见证者平分
        private double proposerRewardShare = 0.2;
    }

    @Data
    public static class Reputation {
        private double initialStake = 1000;
        private double slashingPenalty = 100;
        private double slashDecrement = 0.5;
        private double rewardIncrement = 0.02;
        private String treasuryAccount = "ValoriumX_Treasury";
    }

    @Data
    public static class Ledger {
        // 铸币发送方，跳过余额检查
        private String issuanceSender = "Network Reward";
        private long genesisTimestamp = 0;
        private String genesisAnchor = "genesis_anchors";
        private String genesisProposer = "genesis";
        // 新链的初始余额
        private Map<String, Double> initialBalances = new LinkedHashMap<>();
    }

    @Data
    public static class Genome {
        // 冗余因子 k
        private int redundancy = 3;
        private double custodianReputationFloor = 0.3;
        private String maskKey = "valorium-genome";
    }

    @Data
    public static class Persistence {
        private boolean enabled = true;
        private String stateFile = "valorium_state.json";
    }

    @Data
    public static class NodeSpec {
        private String id;
        private String softwareVersion;
        private Set<NodeRole> roles = EnumSet.noneOf(NodeRole.class);
        private StrategyType strategy = StrategyType.HONEST;
        // BYZANTINE 策略使用的伪造证明种子
        private String fakeHash = "fake_anchors";
    }

    @PostConstruct
    public void validate() {
        check(consensus.reputationFloor >= 0 && consensus.reputationFloor <= 1, "reputation-floor 必须在 [0,1]");
        check(consensus.maxTransactionsPerBlock > 0, "max-transactions-per-block 必须 > 0");
        check(consensus.attestationTimeoutMillis > 0, "attestation-timeout-millis 必须 > 0");
        check(consensus.attestationParallelism > 0, "attestation-parallelism 必须 > 0");
        check(consensus.blockReward >= 0, "block-reward 不能为负");
        check(consensus.proposerRewardShare >= 0 && consensus.proposerRewardShare <= 1, "proposer-reward-share 必须在 [0,1]");
        check(reputation.initialStake >= 0, "initial-stake 不能为负");
        check(reputation.slashingPenalty >= 0, "slashing-penalty 不能为负");
        check(reputation.slashDecrement >= 0 && reputation.rewardIncrement >= 0, "信誉增减量不能为负");
        check(genome.redundancy >= 1, "redundancy 必须 >= 1");
        for (NodeSpec spec : nodes) {
            check(spec.id != null && !spec.id.isBlank(), "节点ID不能为空");
            check(spec.softwareVersion != null, "节点 " + spec.id + " 缺少 software-version");
        }
        log.info("配置加载完成: 节点{}个, 法定信誉下限{}, 冗余因子{}", nodes.size(), consensus.reputationFloor, genome.redundancy);
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new ValoriumException(ErrorType.CONFIG_INVALID, message);
        }
    }
}

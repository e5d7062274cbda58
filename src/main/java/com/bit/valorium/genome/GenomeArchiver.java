package com.bit.valorium.genome;

import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.staking.ReputationLedger;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.genome.GenomeFragment;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeStanding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 把区块序列化为基因片段并分发给托管节点
 * 托管节点：信誉不低于托管下限且未故障的见证节点，每组最多 k+1 个
 */
@Slf4j
@Component
public class GenomeArchiver {

    public static final String BLOCK_FRAGMENT_PREFIX = "block_";

    private final FragmentStore fragmentStore;

    private final NodeDirectory nodeDirectory;

    private final ReputationLedger reputationLedger;

    private final ValoriumProperties.Genome config;

    private final ObjectMapper mapper = new ObjectMapper();

    public GenomeArchiver(FragmentStore fragmentStore, NodeDirectory nodeDirectory, ReputationLedger reputationLedger,
                          ValoriumProperties properties) {
        this.fragmentStore = fragmentStore;
        this.nodeDirectory = nodeDirectory;
        this.reputationLedger = reputationLedger;
        this.config = properties.getGenome();
    }

    public static String fragmentIdOf(Block block) {
        return BLOCK_FRAGMENT_PREFIX + block.getSequence();
    }

    /**
     * @return 是否完成分发；托管节点不足2个时跳过
     */
    public boolean archive(Block block) {
        String baseId = fragmentIdOf(block);
        if (fragmentStore.contains(baseId)) {
            return true;
        }
        List<String> candidates = candidateCustodians();
        // 全部合格节点都登记为再生目标，前 k+1 个承担本次分发
        candidates.forEach(fragmentStore::registerCustodian);
        List<String> custodians = candidates.subList(0, Math.min(candidates.size(), config.getRedundancy() + 1));
        if (custodians.size() < 2) {
            log.warn("区块#{}无法冗余存档: 可用托管节点只有{}个", block.getSequence(), custodians.size());
            return false;
        }
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(block);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("区块序列化失败: " + block.getSequence(), e);
        }
        GenomeFragment fragment = fragmentStore.createPrimary(baseId, payload);
        fragmentStore.distribute(fragment, custodians);
        return true;
    }

    /**
     * 还原存档的区块
     */
    public Block restore(String baseId) {
        byte[] payload = fragmentStore.reconstruct(baseId).getData();
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, Block.class);
        } catch (IOException e) {
            throw new IllegalStateException("存档区块反序列化失败: " + baseId, e);
        }
    }

    List<String> candidateCustodians() {
        return nodeDirectory.attesters().stream()
                .filter(node -> !fragmentStore.isFailed(node.getId()))
                .filter(node -> reputationLedger.standing(node.getId())
                        .map(NodeStanding::getReputation)
                        .orElse(0.0) >= config.getCustodianReputationFloor())
                .map(Node::getId)
                .collect(Collectors.toList());
    }
}

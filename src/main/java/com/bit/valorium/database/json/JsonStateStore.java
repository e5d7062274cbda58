package com.bit.valorium.database.json;

import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.database.StateStore;
import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.state.ChainState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * JSON 文件持久化；先写临时文件再替换，避免写到一半的文件
 */
@Slf4j
@Component
public class JsonStateStore implements StateStore {

    private final Path stateFile;

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Autowired
    public JsonStateStore(ValoriumProperties properties) {
        this(Paths.get(properties.getPersistence().getStateFile()));
    }

    public JsonStateStore(Path stateFile) {
        this.stateFile = stateFile.toAbsolutePath();
    }

    @Override
    public Result<Void> saveState(ChainState state) {
        Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            if (stateFile.getParent() != null) {
                Files.createDirectories(stateFile.getParent());
            }
            mapper.writeValue(temp.toFile(), state);
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("状态已保存: {} (区块{}个, 待处理交易{}笔)", stateFile, state.getChain().size(), state.getPending().size());
            return Result.OK();
        } catch (IOException e) {
            log.error("状态保存失败: {}", stateFile, e);
            return Result.error(ErrorType.PERSIST_FAILED, "保存失败: " + e.getMessage());
        }
    }

    @Override
    public Result<ChainState> loadState() {
        if (!Files.exists(stateFile)) {
            log.info("状态文件不存在: {}", stateFile);
            return Result.error(ErrorType.PERSIST_FAILED, "状态文件不存在: " + stateFile);
        }
        try {
            ChainState state = mapper.readValue(stateFile.toFile(), ChainState.class);
            String problem = checkStructure(state);
            if (problem != null) {
                log.error("状态文件结构不完整: {} {}", stateFile, problem);
                return Result.error(ErrorType.PERSIST_FAILED, "状态文件结构不完整: " + problem);
            }
            log.info("状态已加载: {} (区块{}个)", stateFile, state.getChain().size());
            return Result.OK(state);
        } catch (IOException | RuntimeException e) {
            log.error("状态文件损坏: {}", stateFile, e);
            return Result.error(ErrorType.PERSIST_FAILED, "状态文件损坏: " + e.getMessage());
        }
    }

    /**
     * 字段齐全才交给账本恢复；完整性（哈希链接）由 Ledger.verifyIntegrity 负责
     *
     * @return 第一个缺失项，结构完整时为 null
     */
    static String checkStructure(ChainState state) {
        if (state == null || state.getChain() == null || state.getChain().isEmpty()) {
            return "缺少区块链数据";
        }
        for (int i = 0; i < state.getChain().size(); i++) {
            Block block = state.getChain().get(i);
            if (block == null) {
                return "区块[" + i + "]为空";
            }
            if (block.getHash() == null || block.getPreviousHash() == null) {
                return "区块[" + i + "]缺少哈希字段";
            }
            if (block.getTransactions() == null || block.getTransactions().contains(null)) {
                return "区块[" + i + "]交易列表缺失";
            }
            if (block.getAttestations() == null) {
                return "区块[" + i + "]见证列表缺失";
            }
            for (Attestation attestation : block.getAttestations()) {
                if (attestation == null || attestation.getAttesterId() == null) {
                    return "区块[" + i + "]见证缺少节点ID";
                }
            }
        }
        if (state.getBalances() != null && state.getBalances().containsValue(null)) {
            return "余额缺失";
        }
        if (state.getPending() != null && state.getPending().contains(null)) {
            return "待处理交易为空";
        }
        if (state.getStandings() != null) {
            for (NodeStanding standing : state.getStandings()) {
                if (standing == null || standing.getNodeId() == null) {
                    return "节点信誉记录缺少节点ID";
                }
            }
        }
        return null;
    }

    public Path getStateFile() {
        return stateFile;
    }
}

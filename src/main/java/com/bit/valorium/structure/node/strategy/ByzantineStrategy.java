package com.bit.valorium.structure.node.strategy;

import com.bit.valorium.common.Hash256;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 恶意节点：无视输入，总是对同一个伪造哈希签名
 */
@Slf4j
public class ByzantineStrategy implements AttestationStrategy {

    @Getter
    private final Hash256 fakeHash;

    public ByzantineStrategy(Hash256 fakeHash) {
        this.fakeHash = fakeHash;
    }

    @Override
    public Optional<Hash256> claim(AttestationContext context) {
        log.debug("轮次{}：恶意策略声明伪造证明 {}", context.getRound(), fakeHash.shortHex());
        return Optional.of(fakeHash);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BYZANTINE;
    }
}

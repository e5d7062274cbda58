package com.bit.valorium.structure.node.strategy;

import com.bit.valorium.common.Hash256;

import java.util.Optional;

/**
 * 沉默节点：从不投票
 */
public class SilentStrategy implements AttestationStrategy {

    public static final SilentStrategy INSTANCE = new SilentStrategy();

    @Override
    public Optional<Hash256> claim(AttestationContext context) {
        return Optional.empty();
    }

    @Override
    public StrategyType type() {
        return StrategyType.SILENT;
    }
}

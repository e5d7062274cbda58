package com.bit.valorium.structure.node.strategy;

import com.bit.valorium.common.Hash256;

import java.util.Optional;

public class HonestStrategy implements AttestationStrategy {

    public static final HonestStrategy INSTANCE = new HonestStrategy();

    @Override
    public Optional<Hash256> claim(AttestationContext context) {
        return Optional.of(context.deriveProof().getProofHash());
    }

    @Override
    public StrategyType type() {
        return StrategyType.HONEST;
    }
}

package com.bit.valorium.structure.node.strategy;

import com.bit.valorium.common.Hash256;

import java.util.Optional;

/**
 * 节点的见证行为；诚实与否是节点的配置参数，不是运行时类型替换
 */
public interface AttestationStrategy {

    /**
     * @return 该节点声明的证明哈希，空表示不投票
     */
    Optional<Hash256> claim(AttestationContext context);

    StrategyType type();
}

package com.bit.valorium.structure.node;

/**
 * 节点能力（不是类型层级），一个节点可以同时具备两种能力
 */
public enum NodeRole {
    /**
     * 提议者：打包交易生成RNA模板
     */
    VALIDATOR,
    /**
     * 见证者：独立重算证明并投票
     */
    ATTESTER
}

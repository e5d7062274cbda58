package com.bit.valorium.structure.node.strategy;

public enum StrategyType {
    HONEST,
    BYZANTINE,
    SILENT
}

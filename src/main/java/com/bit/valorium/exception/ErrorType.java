package com.bit.valorium.exception;

public enum ErrorType {
    VALIDATION("交易校验失败（格式非法/余额不足/重复提交）"),
    COMPLIANCE("软件合规检查失败（版本未注册/哈希不匹配）"),
    CONSENSUS_ABORTED("共识中止（未达法定票数/多数证明与本地不一致）"),
    IRRECOVERABLE_FRAGMENT_LOSS("基因片段不可恢复（无存活冗余副本）"),
    CHAIN_INTEGRITY("链完整性校验失败（哈希/链接不匹配）"),
    PERSIST_FAILED("状态持久化失败（本地文件读写异常）"),
    CONFIG_INVALID("配置无效（参数非法）");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}

package com.bit.valorium.voting;

public enum AbortReason {
    NO_VALIDATORS("没有可用的提议者"),
    PROPOSER_NON_COMPLIANT("提议者软件不合规"),
    PROPOSER_BELOW_FLOOR("提议者信誉低于下限"),
    NO_SETTLEABLE_TRANSACTIONS("本批交易全部无法结算"),
    NO_ELIGIBLE_ATTESTERS("没有合格的见证者"),
    QUORUM_NOT_REACHED("多数证明票数未达法定数"),
    PLURALITY_MISMATCH("多数证明与本地推导不一致");

    private final String desc;

    AbortReason(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }

    /**
     * 只有提议者自身问题导致的中止才罚没提议者
     */
    public boolean isProposerFault() {
        return this == PROPOSER_NON_COMPLIANT || this == PROPOSER_BELOW_FLOOR;
    }
}

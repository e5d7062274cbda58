package com.bit.valorium.blockchain;

import lombok.Value;

/**
 * 链完整性审计结果；firstBrokenSequence 为 -1 表示全链有效
 */
@Value
public class IntegrityReport {

    public static final long NONE = -1;

    boolean valid;

    long chainLength;

    long firstBrokenSequence;

    String reason;

    public static IntegrityReport ok(long chainLength) {
        return new IntegrityReport(true, chainLength, NONE, "");
    }

    public static IntegrityReport broken(long chainLength, long sequence, String reason) {
        return new IntegrityReport(false, chainLength, sequence, reason);
    }
}

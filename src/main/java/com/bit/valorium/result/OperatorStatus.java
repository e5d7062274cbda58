package com.bit.valorium.result;

import lombok.Getter;

/**
 * 运维命令的退出状态
 */
@Getter
public enum OperatorStatus {
    SUCCESS(0),
    FAILURE(1),
    VALIDATION_ERROR(2),
    INTEGRITY_FAILURE(3);

    private final int exitCode;

    OperatorStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public static OperatorStatus fromCode(Integer code) {
        if (code == null) {
            return FAILURE;
        }
        if (code.equals(Result.SC_OK_200)) {
            return SUCCESS;
        }
        if (code.equals(Result.SC_VALIDATION_ERROR_400)) {
            return VALIDATION_ERROR;
        }
        if (code.equals(Result.SC_INTEGRITY_FAILURE_409)) {
            return INTEGRITY_FAILURE;
        }
        return FAILURE;
    }
}

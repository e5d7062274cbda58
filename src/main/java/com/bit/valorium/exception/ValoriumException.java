package com.bit.valorium.exception;

/**
 * 核心层统一异常：用 ErrorType 区分校验、合规、共识、片段丢失、完整性等错误
 */
public class ValoriumException extends RuntimeException {

    private final ErrorType errorType;

    public ValoriumException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public ValoriumException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}

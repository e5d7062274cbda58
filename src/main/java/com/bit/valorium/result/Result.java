package com.bit.valorium.result;


import com.bit.valorium.exception.ErrorType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.io.Serializable;

/**
 *   接口/服务返回数据格式
 *   保存、加载、片段再生、运维命令都以 Result 形式返回显式的成功/失败
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;
    public static final Integer SC_VALIDATION_ERROR_400 = 400;
    public static final Integer SC_INTEGRITY_FAILURE_409 = 409;
    public static final Integer SC_FRAGMENT_LOSS_410 = 410;
    public static final Integer SC_INTERNAL_SERVER_ERROR_500 = 500;


    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码
     */
    private Integer code = 0;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public Result() {
    }

    public static<T> Result<T> OK() {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        return r;
    }

    public static<T> Result<T> OK(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> OK(String msg, T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setMessage(msg);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(String msg, T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(false);
        r.setCode(SC_INTERNAL_SERVER_ERROR_500);
        r.setMessage(msg);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(String msg) {
        return error(SC_INTERNAL_SERVER_ERROR_500, msg);
    }

    public static<T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<T>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    /**
     * 按错误类型映射返回码
     */
    public static<T> Result<T> error(ErrorType errorType, String msg) {
        return error(codeOf(errorType), msg);
    }

    public static int codeOf(ErrorType errorType) {
        switch (errorType) {
            case VALIDATION:
            case COMPLIANCE:
                return SC_VALIDATION_ERROR_400;
            case CHAIN_INTEGRITY:
                return SC_INTEGRITY_FAILURE_409;
            case IRRECOVERABLE_FRAGMENT_LOSS:
                return SC_FRAGMENT_LOSS_410;
            default:
                return SC_INTERNAL_SERVER_ERROR_500;
        }
    }

    /**
     * 运维退出码：0成功，2校验错误，3完整性失败，1其他
     */
    @JsonIgnore
    public int getExitCode() {
        return OperatorStatus.fromCode(code).getExitCode();
    }

}

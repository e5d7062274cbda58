package com.bit.valorium.voting;

/**
 * 单个合格见证者在本轮的响应类型
 */
public enum AttesterResponse {
    // 声明了获胜证明
    AGREED,
    // 声明了其他证明
    DISAGREED,
    // 主动不投票
    DECLINED,
    // 签名校验失败，见证被丢弃
    INVALID_SIGNATURE,
    // 超时或执行异常
    TIMED_OUT
}

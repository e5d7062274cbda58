package com.bit.valorium.structure.dto;

import lombok.Data;

/**
 * 运维提交交易的请求体，时间戳由节点时钟补齐
 */
@Data
public class TransferRequest {
    private String sender;
    private String recipient;
    private double amount;
    private String payload;
}

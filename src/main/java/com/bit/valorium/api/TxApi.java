package com.bit.valorium.api;

import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import com.bit.valorium.structure.dto.TransferRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/tx")
public class TxApi {

    @Autowired
    private OperatorService operatorService;

    /**
     * 通过Http提交一笔交易
     */
    @PostMapping("/submit")
    public Result<String> submitTx(@RequestBody TransferRequest request) {
        return operatorService.addTransaction(request);
    }

    // 查询账户余额
    @GetMapping("/balance")
    public Result<Double> balance(@RequestParam String account) {
        return operatorService.balance(account);
    }

    @GetMapping("/balances")
    public Result<Map<String, Double>> balances() {
        return operatorService.balances();
    }
}

package com.bit.valorium.api;

import com.bit.valorium.monitor.impl.dto.PerformanceReport;
import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 网络运行报告
 */
@Slf4j
@RestController
@RequestMapping("/monitor")
public class MonitorApi {

    @Autowired
    private OperatorService operatorService;

    @GetMapping("/report")
    public Result<PerformanceReport> report() {
        return operatorService.report();
    }

    // 导出报告原始 JSON
    @GetMapping(value = "/report/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public String export() {
        return operatorService.exportReport().getData();
    }
}

package com.bit.valorium.api;

import com.bit.valorium.genome.NodeFailureReport;
import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/genome")
public class GenomeApi {

    @Autowired
    private OperatorService operatorService;

    // 模拟节点故障
    @PostMapping("/failure")
    public Result<NodeFailureReport> simulateFailure(@RequestBody List<String> nodeIds) {
        return operatorService.simulateNodeFailure(nodeIds);
    }

    @PostMapping("/regenerate")
    public Result<String> regenerate(@RequestParam String fragmentId) {
        return operatorService.regenerateFragment(fragmentId);
    }
}

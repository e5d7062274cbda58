package com.bit.valorium.api;

import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.voting.RoundOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/consensus")
public class ConsensusApi {

    @Autowired
    private OperatorService operatorService;

    // 触发一轮共识
    @PostMapping("/round")
    public Result<RoundOutcome> runRound() {
        return operatorService.runRound();
    }

    // 节点质押与信誉
    @GetMapping("/standings")
    public Result<List<NodeStanding>> standings() {
        return operatorService.standings();
    }

    // 手动恢复节点信誉
    @PostMapping("/rehabilitate")
    public Result<NodeStanding> rehabilitate(@RequestParam String nodeId, @RequestParam double reputation) {
        return operatorService.rehabilitate(nodeId, reputation);
    }
}

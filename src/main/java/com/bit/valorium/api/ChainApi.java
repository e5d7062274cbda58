package com.bit.valorium.api;

import com.bit.valorium.blockchain.IntegrityReport;
import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.state.ChainState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/chain")
public class ChainApi {

    @Autowired
    private OperatorService operatorService;

    @GetMapping
    public Result<List<Block>> chain() {
        return operatorService.chain();
    }

    @GetMapping("/block/{sequence}")
    public Result<Block> block(@PathVariable long sequence) {
        return operatorService.block(sequence);
    }

    // 全链完整性审计
    @GetMapping("/verify")
    public Result<IntegrityReport> verify() {
        return operatorService.verifyIntegrity();
    }

    @PostMapping("/save")
    public Result<Void> save() {
        return operatorService.saveState();
    }

    @PostMapping("/load")
    public Result<ChainState> load() {
        return operatorService.loadState();
    }
}

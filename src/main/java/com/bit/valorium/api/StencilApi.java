package com.bit.valorium.api;

import com.bit.valorium.result.Result;
import com.bit.valorium.service.OperatorService;
import com.bit.valorium.structure.dto.RegisterVersionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/stencil")
public class StencilApi {

    @Autowired
    private OperatorService operatorService;

    // 登记官方软件版本
    @PostMapping("/register")
    public Result<String> register(@RequestBody RegisterVersionRequest request) {
        return operatorService.registerVersion(request);
    }
}

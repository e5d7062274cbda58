package com.bit.valorium;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.valorium")
public class ValoriumApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(ValoriumApplication.class, args);
        log.info("Valorium X 节点启动耗时{}ms", System.currentTimeMillis() - start);
    }
}

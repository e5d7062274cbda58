package com.bit.valorium.config;

import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.strategy.AttestationStrategy;
import com.bit.valorium.structure.node.strategy.ByzantineStrategy;
import com.bit.valorium.structure.node.strategy.HonestStrategy;
import com.bit.valorium.structure.node.strategy.SilentStrategy;
import com.bit.valorium.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CommonConfig {

    /**
     * 所有时间戳的来源，测试中可替换为固定时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 按配置构建网络节点
     */
    @Bean
    public NodeDirectory nodeDirectory(ValoriumProperties properties, HashChain hashChain, CryptoPrimitive cryptoPrimitive) {
        NodeDirectory directory = new NodeDirectory();
        for (ValoriumProperties.NodeSpec spec : properties.getNodes()) {
            directory.register(Node.create(hashChain, cryptoPrimitive, spec.getId(), spec.getSoftwareVersion(),
                    spec.getRoles(), strategyOf(spec, hashChain)));
        }
        log.info("网络节点目录初始化完成: 验证者{}个, 见证者{}个", directory.validators().size(), directory.attesters().size());
        return directory;
    }

    static AttestationStrategy strategyOf(ValoriumProperties.NodeSpec spec, HashChain hashChain) {
        switch (spec.getStrategy()) {
            case BYZANTINE:
                return new ByzantineStrategy(hashChain.digestBytes(ByteUtils.utf8(spec.getFakeHash())));
            case SILENT:
                return SilentStrategy.INSTANCE;
            default:
                return HonestStrategy.INSTANCE;
        }
    }
}

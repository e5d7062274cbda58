package com.bit.valorium.stencil.impl;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.stencil.SoftwareRegistry;
import com.bit.valorium.structure.node.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class SoftwareRegistryImpl implements SoftwareRegistry {

    private final HashChain hashChain;

    // 版本 -> 可信哈希
    private final Map<String, Hash256> trusted = new ConcurrentHashMap<>();

    public SoftwareRegistryImpl(HashChain hashChain) {
        this.hashChain = hashChain;
    }

    @Override
    public void register(String version, Hash256 trustedHash) {
        if (version == null || version.isBlank() || trustedHash == null) {
            throw new IllegalArgumentException("版本号和可信哈希不能为空");
        }
        Hash256 previous = trusted.put(version, trustedHash);
        if (previous != null && !previous.equals(trustedHash)) {
            log.warn("版本{}的可信哈希被覆盖: {} -> {}", version, previous.shortHex(), trustedHash.shortHex());
        } else {
            log.info("登记官方版本{}: {}", version, trustedHash.shortHex());
        }
    }

    @Override
    public Hash256 registerRelease(String version) {
        Hash256 hash = Node.softwareHashOf(hashChain, version);
        register(version, hash);
        return hash;
    }

    @Override
    public boolean isCompliant(Node node) {
        Hash256 expected = trusted.get(node.getSoftwareVersion());
        if (expected == null) {
            log.debug("节点{}声明的版本{}未登记", node.getId(), node.getSoftwareVersion());
            return false;
        }
        boolean compliant = expected.equals(node.getSoftwareHash());
        if (!compliant) {
            log.debug("节点{}软件哈希不匹配: 期望{} 实际{}", node.getId(), expected.shortHex(),
                    node.getSoftwareHash() == null ? "null" : node.getSoftwareHash().shortHex());
        }
        return compliant;
    }

    @Override
    public Optional<Hash256> trustedHash(String version) {
        return Optional.ofNullable(trusted.get(version));
    }

    @Override
    public Map<String, Hash256> snapshot() {
        return new TreeMap<>(trusted);
    }
}

package com.bit.valorium.stencil;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.structure.node.Node;

import java.util.Map;
import java.util.Optional;

/**
 * 官方软件版本登记表（Stencil）
 */
public interface SoftwareRegistry {

    /**
     * 登记版本的可信哈希；重复登记同一版本则覆盖旧值
     */
    void register(String version, Hash256 trustedHash);

    /**
     * 按官方发布规则登记版本（哈希由版本号派生）
     */
    Hash256 registerRelease(String version);

    /**
     * 节点声明的版本已登记且运行软件哈希与可信哈希一致才算合规；未登记版本一律不合规
     */
    boolean isCompliant(Node node);

    Optional<Hash256> trustedHash(String version);

    Map<String, Hash256> snapshot();
}

package com.bit.valorium.network;

import com.bit.valorium.structure.node.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 网络节点目录；登记顺序决定提议者轮换顺序
 */
@Slf4j
public class NodeDirectory {

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    public synchronized void register(Node node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("节点ID重复: " + node.getId());
        }
        nodes.put(node.getId(), node);
        log.info("节点加入网络: {}", node);
    }

    public synchronized List<Node> all() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public synchronized List<Node> validators() {
        return nodes.values().stream().filter(Node::canPropose).collect(Collectors.toUnmodifiableList());
    }

    public synchronized List<Node> attesters() {
        return nodes.values().stream().filter(Node::canAttest).collect(Collectors.toUnmodifiableList());
    }

    public synchronized Optional<Node> byId(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public synchronized int size() {
        return nodes.size();
    }
}

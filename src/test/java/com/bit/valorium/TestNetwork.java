package com.bit.valorium;

import com.bit.valorium.blockchain.impl.LedgerImpl;
import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.crypto.impl.Ed25519CryptoPrimitive;
import com.bit.valorium.database.StateStore;
import com.bit.valorium.genome.GenomeArchiver;
import com.bit.valorium.genome.RedundancyCodec;
import com.bit.valorium.genome.impl.FragmentStoreImpl;
import com.bit.valorium.monitor.impl.PerformanceMonitorImpl;
import com.bit.valorium.network.NodeDirectory;
import com.bit.valorium.service.impl.OperatorServiceImpl;
import com.bit.valorium.staking.impl.ReputationLedgerImpl;
import com.bit.valorium.stencil.impl.SoftwareRegistryImpl;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeRole;
import com.bit.valorium.structure.node.strategy.AttestationStrategy;
import com.bit.valorium.structure.node.strategy.ByzantineStrategy;
import com.bit.valorium.structure.node.strategy.HonestStrategy;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.txpool.impl.StructuralTransactionVerifier;
import com.bit.valorium.txpool.impl.TxPoolImpl;
import com.bit.valorium.util.ByteUtils;
import com.bit.valorium.voting.impl.AttestationProtocolImpl;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 测试用的完整网络装配：不启动 Spring 容器，固定时钟
 */
public class TestNetwork implements AutoCloseable {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

    public static final String VERSION = "1.0";

    public final ValoriumProperties properties;
    public final CryptoPrimitive crypto = new Ed25519CryptoPrimitive();
    public final HashChain hashChain = new HashChain(crypto);
    public final SoftwareRegistryImpl registry;
    public final LedgerImpl ledger;
    public final ReputationLedgerImpl reputation;
    public final NodeDirectory directory = new NodeDirectory();
    public final TxPoolImpl txPool;
    public final FragmentStoreImpl fragments;
    public final GenomeArchiver archiver;
    public final PerformanceMonitorImpl monitor;
    public final AttestationProtocolImpl protocol;

    public TestNetwork() {
        this(defaults());
    }

    public TestNetwork(ValoriumProperties properties) {
        this.properties = properties;
        properties.validate();
        registry = new SoftwareRegistryImpl(hashChain);
        registry.registerRelease(VERSION);
        ledger = new LedgerImpl(hashChain, properties, CLOCK);
        reputation = new ReputationLedgerImpl(properties, registry, ledger);
        txPool = new TxPoolImpl(ledger, new StructuralTransactionVerifier(), hashChain);
        fragments = new FragmentStoreImpl(hashChain, new RedundancyCodec(properties), properties);
        archiver = new GenomeArchiver(fragments, directory, reputation, properties);
        monitor = new PerformanceMonitorImpl(ledger, fragments, reputation, directory, txPool, CLOCK);
        protocol = new AttestationProtocolImpl(ledger, txPool, directory, registry, reputation, archiver, monitor,
                hashChain, crypto, properties, CLOCK);
    }

    /**
     * 默认配置：Alice 初始余额 1000，短超时
     */
    public static ValoriumProperties defaults() {
        ValoriumProperties properties = new ValoriumProperties();
        properties.getLedger().getInitialBalances().put("Alice", 1000.0);
        properties.getConsensus().setAttestationTimeoutMillis(5000);
        properties.getPersistence().setEnabled(false);
        return properties;
    }

    public Node addNode(String id, String version, AttestationStrategy strategy, NodeRole... roles) {
        Node node = Node.create(hashChain, crypto, id, version, EnumSet.of(roles[0], roles), strategy);
        directory.register(node);
        reputation.enroll(id);
        return node;
    }

    public Node addValidator(String id) {
        return addNode(id, VERSION, HonestStrategy.INSTANCE, NodeRole.VALIDATOR);
    }

    public List<Node> addHonestAttesters(String prefix, int count) {
        List<Node> nodes = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            nodes.add(addNode(prefix + i, VERSION, HonestStrategy.INSTANCE, NodeRole.ATTESTER));
        }
        return nodes;
    }

    public List<Node> addByzantineAttesters(String prefix, int count) {
        ByzantineStrategy strategy = new ByzantineStrategy(hashChain.digestBytes(ByteUtils.utf8("fake_anchors")));
        List<Node> nodes = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            nodes.add(addNode(prefix + i, VERSION, strategy, NodeRole.ATTESTER));
        }
        return nodes;
    }

    public Transaction transfer(String sender, String recipient, double amount, long timestamp) {
        return Transaction.builder()
                .sender(sender)
                .recipient(recipient)
                .amount(amount)
                .timestamp(timestamp)
                .build();
    }

    public OperatorServiceImpl operator(StateStore stateStore) {
        return new OperatorServiceImpl(properties, registry, reputation, directory, ledger, txPool, protocol,
                fragments, archiver, monitor, stateStore, CLOCK);
    }

    @Override
    public void close() {
        protocol.destroy();
    }
}

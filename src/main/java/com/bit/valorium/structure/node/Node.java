package com.bit.valorium.structure.node;

import com.bit.valorium.common.Hash256;
import com.bit.valorium.crypto.CryptoPrimitive;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.structure.key.KeyInfo;
import com.bit.valorium.structure.node.strategy.AttestationContext;
import com.bit.valorium.structure.node.strategy.AttestationStrategy;
import com.bit.valorium.structure.proof.Attestation;
import com.bit.valorium.structure.proposal.ProposalRecord;
import com.bit.valorium.structure.tx.Transaction;
import com.bit.valorium.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 网络参与者
 * <p>
 * 质押和信誉不在节点对象上，由 ReputationLedger 统一维护；节点也不持有账本引用，只具备提议/见证能力。
 */
@Getter
public class Node implements CanPropose, CanAttest {

    public static final String SOFTWARE_NAME_PREFIX = "ValoriumX Node Software ";

    private final String id;

    /**
     * 节点声明的软件版本
     */
    private final String softwareVersion;

    /**
     * 节点实际运行软件的哈希
     */
    private final Hash256 softwareHash;

    private final Set<NodeRole> roles;

    @JsonIgnore
    private final AttestationStrategy strategy;

    @JsonIgnore
    private final KeyInfo keys;

    public Node(String id, String softwareVersion, Hash256 softwareHash, Set<NodeRole> roles,
                AttestationStrategy strategy, KeyInfo keys) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("节点ID不能为空");
        }
        this.id = id;
        this.softwareVersion = softwareVersion;
        this.softwareHash = softwareHash;
        this.roles = roles.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        this.strategy = strategy;
        this.keys = keys;
    }

    /**
     * 运行官方发布软件的节点：软件哈希由版本号派生
     */
    public static Node create(HashChain hashChain, CryptoPrimitive cryptoPrimitive, String id, String softwareVersion,
                              Set<NodeRole> roles, AttestationStrategy strategy) {
        KeyInfo keys = cryptoPrimitive.deriveKeys(id, ByteUtils.utf8("valorium-node-key:" + id));
        return new Node(id, softwareVersion, softwareHashOf(hashChain, softwareVersion), roles, strategy, keys);
    }

    /**
     * 某版本官方软件的哈希
     */
    public static Hash256 softwareHashOf(HashChain hashChain, String softwareVersion) {
        return hashChain.digestBytes(ByteUtils.utf8(SOFTWARE_NAME_PREFIX + softwareVersion));
    }

    @JsonIgnore
    public byte[] getPublicKey() {
        return keys.getPublicKey();
    }

    @Override
    public boolean canPropose() {
        return roles.contains(NodeRole.VALIDATOR);
    }

    @Override
    public boolean canAttest() {
        return roles.contains(NodeRole.ATTESTER);
    }

    @Override
    public ProposalRecord propose(HashChain hashChain, List<Transaction> transactions, long timestamp) {
        if (!canPropose()) {
            throw new IllegalStateException("节点 " + id + " 不具备提议能力");
        }
        List<Hash256> txHashes = transactions.stream()
                .map(tx -> tx.hash(hashChain))
                .collect(Collectors.toList());
        return ProposalRecord.issue(hashChain, id, txHashes, timestamp);
    }

    @Override
    public Optional<Attestation> attest(AttestationContext context, CryptoPrimitive cryptoPrimitive) {
        if (!canAttest()) {
            throw new IllegalStateException("节点 " + id + " 不具备见证能力");
        }
        return strategy.claim(context).map(proofHash -> Attestation.builder()
                .proofHash(proofHash)
                .attesterId(id)
                .signature(cryptoPrimitive.sign(Attestation.signingMessage(proofHash, id), keys.getPrivateKey()))
                .build());
    }

    @Override
    public String toString() {
        return "Node(" + id + ", v" + softwareVersion + ", " + roles + ", " + strategy.type() + ")";
    }
}

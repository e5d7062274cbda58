package com.bit.valorium.blockchain;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.common.Hash256;
import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.exception.ValoriumException;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.proof.CoherenceProof;
import com.bit.valorium.structure.tx.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class LedgerTest {

    private final TestNetwork network = new TestNetwork();

    private final Ledger ledger = network.ledger;

    @AfterEach
    void tearDown() {
        network.close();
    }

    private Block append(List<Transaction> txs) {
        Hash256 proposal = network.hashChain.digestBytes(("proposal-" + ledger.length()).getBytes());
        CoherenceProof proof = CoherenceProof.derive(network.hashChain, proposal, ledger.snapshotAnchors());
        Block block = ledger.appendBlock(proposal, proof, List.of(), txs, ledger.getLatestBlock().getHash());
        ledger.applyBalances(txs);
        return block;
    }

    @Test
    void genesisSatisfiesBlockInvariants() {
        Block genesis = ledger.getLatestBlock();

        assertEquals(0, genesis.getSequence());
        assertTrue(genesis.getPreviousHash().isZero());
        assertTrue(genesis.getTransactions().isEmpty());
        assertEquals(genesis.getHash(), genesis.computeHash(network.hashChain));
        assertTrue(ledger.verifyIntegrity().isValid());
    }

    @Test
    void genesisIsDeterministic() {
        try (TestNetwork other = new TestNetwork()) {
            assertEquals(ledger.getLatestBlock().getHash(), other.ledger.getLatestBlock().getHash());
        }
    }

    @Test
    void appendedBlocksLinkToPredecessor() {
        Block first = append(List.of(network.transfer("Alice", "Bob", 100, 1)));
        Block second = append(List.of(network.transfer("Bob", "Carol", 40, 2)));

        assertEquals(first.getHash(), second.getPreviousHash());
        assertEquals(2, second.getSequence());
        assertEquals(900, ledger.balanceOf("Alice"), 1e-9);
        assertEquals(60, ledger.balanceOf("Bob"), 1e-9);
        assertEquals(40, ledger.balanceOf("Carol"), 1e-9);
        assertTrue(ledger.verifyIntegrity().isValid());
        assertEquals(second, ledger.getBlockByHash(second.getHash()).orElseThrow());
    }

    @Test
    void appendRejectsStalePreviousHash() {
        Hash256 staleTail = ledger.getLatestBlock().getHash();
        append(List.of(network.transfer("Alice", "Bob", 1, 1)));
        Hash256 proposal = network.hashChain.digestBytes("late".getBytes());
        CoherenceProof proof = CoherenceProof.derive(network.hashChain, proposal, ledger.snapshotAnchors());

        ValoriumException e = assertThrows(ValoriumException.class,
                () -> ledger.appendBlock(proposal, proof, List.of(), List.of(), staleTail));
        assertEquals(ErrorType.CHAIN_INTEGRITY, e.getErrorType());
        assertEquals(2, ledger.length());
    }

    @Test
    void overdraftLeavesBalancesUntouched() {
        List<Transaction> txs = List.of(
                network.transfer("Alice", "Bob", 600, 1),
                network.transfer("Alice", "Carol", 600, 2));

        assertThrows(ValoriumException.class, () -> ledger.applyBalances(txs));
        assertEquals(1000, ledger.balanceOf("Alice"), 1e-9);
        assertEquals(0, ledger.balanceOf("Bob"), 1e-9);
    }

    @Test
    void issuanceBypassesBalanceCheck() {
        ledger.applyBalances(List.of(network.transfer("Network Reward", "Dave", 500, 1)));
        assertEquals(500, ledger.balanceOf("Dave"), 1e-9);
    }

    @Test
    void settleableSplitsOverdraftsInOrder() {
        SettlementPlan plan = ledger.settleable(List.of(
                network.transfer("Alice", "Bob", 700, 1),
                network.transfer("Alice", "Carol", 400, 2),
                network.transfer("Bob", "Carol", 100, 3)));

        assertEquals(2, plan.getAccepted().size());
        assertEquals(1, plan.getRejected().size());
        assertEquals(400, plan.getRejected().get(0).getAmount(), 1e-9);
    }

    @Test
    void tamperedHistoricalBlockIsDetected() {
        append(List.of(network.transfer("Alice", "Bob", 100, 1)));
        append(List.of(network.transfer("Alice", "Bob", 50, 2)));
        append(List.of(network.transfer("Alice", "Bob", 25, 3)));

        List<Block> chain = new ArrayList<>(ledger.getChain());
        Block original = chain.get(2);
        Transaction forged = network.transfer("Alice", "Mallory", 50, 2);
        chain.set(2, original.toBuilder().transactions(List.of(forged)).build());
        ledger.restore(chain, ledger.balances());

        IntegrityReport report = ledger.verifyIntegrity();
        log.info("篡改检测: {}", report);
        assertFalse(report.isValid());
        assertEquals(2, report.getFirstBrokenSequence());
    }

    @Test
    void rehashedTamperBreaksTheNextLink() {
        append(List.of(network.transfer("Alice", "Bob", 100, 1)));
        append(List.of(network.transfer("Alice", "Bob", 50, 2)));

        List<Block> chain = new ArrayList<>(ledger.getChain());
        Block tampered = chain.get(1).toBuilder().timestamp(12345L).build();
        chain.set(1, tampered.toBuilder().hash(tampered.computeHash(network.hashChain)).build());
        ledger.restore(chain, ledger.balances());

        IntegrityReport report = ledger.verifyIntegrity();
        assertFalse(report.isValid());
        assertEquals(2, report.getFirstBrokenSequence());
    }
}

package com.bit.valorium.staking;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.structure.node.Node;
import com.bit.valorium.structure.node.NodeRole;
import com.bit.valorium.structure.node.NodeStanding;
import com.bit.valorium.structure.node.strategy.HonestStrategy;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class ReputationLedgerTest {

    private final TestNetwork network = new TestNetwork();

    private final ReputationLedger ledger = network.reputation;

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void slashUpdatesStakeReputationAndTreasuryTogether() {
        ledger.enroll("n1", 1000);
        NodeStanding after = ledger.slash("n1", 100, "test");

        assertEquals(900, after.getStake(), 1e-9);
        assertEquals(0.5, after.getReputation(), 1e-9);
        assertEquals(1, after.getSlashCount());
        assertEquals(100, network.ledger.balanceOf("ValoriumX_Treasury"), 1e-9);
    }

    @Test
    void slashNeverTakesMoreThanStake() {
        ledger.enroll("poor", 30);
        NodeStanding after = ledger.slash("poor", 100, "test");

        assertEquals(0, after.getStake(), 1e-9);
        assertEquals(30, network.ledger.balanceOf("ValoriumX_Treasury"), 1e-9);
    }

    @Test
    void reputationIsClampedToZeroAndOne() {
        ledger.enroll("n1", 1000);
        ledger.slash("n1", "first");
        ledger.slash("n1", "second");
        NodeStanding third = ledger.slash("n1", "third");
        assertEquals(0, third.getReputation(), 1e-9);

        ledger.rehabilitate("n1", 0.99);
        NodeStanding rewarded = ledger.reward("n1", 10);
        assertEquals(1.0, rewarded.getReputation(), 1e-9);
        assertEquals(10, network.ledger.balanceOf("n1"), 1e-9);
    }

    @Test
    void zeroReputationNodeStaysExcludedUntilRehabilitated() {
        Node node = network.addNode("n1", TestNetwork.VERSION, HonestStrategy.INSTANCE, NodeRole.ATTESTER);
        ledger.slash("n1", "a");
        ledger.slash("n1", "b");
        assertFalse(ledger.eligible(node, 0.5));

        ledger.rehabilitate("n1", 0.8);
        assertTrue(ledger.eligible(node, 0.5));
    }

    @Test
    void eligibilityRequiresCompliance() {
        Node rogue = network.addNode("rogue", "0.9-beta", HonestStrategy.INSTANCE, NodeRole.VALIDATOR);
        assertFalse(ledger.eligible(rogue, 0.0));
    }

    @Test
    void concurrentSlashesAreNotLost() throws Exception {
        ledger.enroll("busy", 100_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            futures.add(pool.submit(() -> ledger.slash("busy", 10, "concurrent")));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        NodeStanding standing = ledger.standing("busy").orElseThrow();
        log.info("并发罚没后: {}", standing);
        assertEquals(200, standing.getSlashCount());
        assertEquals(100_000 - 2000, standing.getStake(), 1e-6);
        assertEquals(2000, network.ledger.balanceOf("ValoriumX_Treasury"), 1e-6);
    }
}

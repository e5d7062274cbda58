package com.bit.valorium.txpool;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.tx.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TxPoolTest {

    private final TestNetwork network = new TestNetwork();

    private final TxPool pool = network.txPool;

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void acceptsFundedTransaction() {
        Result<String> result = pool.addTransaction(network.transfer("Alice", "Bob", 100, 1));

        assertTrue(result.isSuccess());
        assertEquals(64, result.getData().length());
        assertEquals(1, pool.getPoolSize());
    }

    @Test
    void rejectsMalformedTransactions() {
        assertEquals(Result.SC_VALIDATION_ERROR_400, pool.addTransaction(network.transfer("Alice", "Bob", 0, 1)).getCode());
        assertEquals(Result.SC_VALIDATION_ERROR_400, pool.addTransaction(network.transfer("Alice", "Bob", -5, 1)).getCode());
        assertEquals(Result.SC_VALIDATION_ERROR_400, pool.addTransaction(network.transfer("", "Bob", 5, 1)).getCode());
        assertEquals(Result.SC_VALIDATION_ERROR_400,
                pool.addTransaction(network.transfer("Alice", "Bob", Double.NaN, 1)).getCode());
        assertEquals(0, pool.getPoolSize());
        assertEquals(4, pool.getRejectedCount());
    }

    @Test
    void pendingOutgoingCountsAgainstBalance() {
        assertTrue(pool.addTransaction(network.transfer("Alice", "Bob", 600, 1)).isSuccess());
        Result<String> second = pool.addTransaction(network.transfer("Alice", "Carol", 600, 2));

        assertFalse(second.isSuccess());
        assertEquals(Result.SC_VALIDATION_ERROR_400, second.getCode());
        assertEquals(600, pool.pendingOutgoing("Alice"), 1e-9);
    }

    @Test
    void duplicateIsRejected() {
        Transaction tx = network.transfer("Alice", "Bob", 1, 1);
        assertTrue(pool.addTransaction(tx).isSuccess());
        assertFalse(pool.addTransaction(tx).isSuccess());
    }

    @Test
    void issuanceSkipsBalanceCheck() {
        assertTrue(pool.addTransaction(network.transfer("Network Reward", "Bob", 1_000_000, 1)).isSuccess());
    }

    @Test
    void requeuePutsTransactionsBackAtTheFrontInOrder() {
        Transaction a = network.transfer("Alice", "Bob", 1, 1);
        Transaction b = network.transfer("Alice", "Bob", 2, 2);
        Transaction c = network.transfer("Alice", "Bob", 3, 3);
        pool.addTransaction(a);
        pool.addTransaction(b);
        pool.addTransaction(c);

        List<Transaction> batch = pool.drain(2);
        assertEquals(List.of(a, b), batch);
        pool.requeue(batch);

        assertEquals(List.of(a, b, c), pool.getPendingTransactions());
    }
}

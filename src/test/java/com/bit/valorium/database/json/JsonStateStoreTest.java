package com.bit.valorium.database.json;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.block.Block;
import com.bit.valorium.structure.state.ChainState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonStateStoreTest {

    @TempDir
    Path tempDir;

    private final TestNetwork network = new TestNetwork();

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void savedStateLoadsBack() throws Exception {
        network.addValidator("Validator_Alpha");
        network.addHonestAttesters("Neural_", 4);
        network.txPool.addTransaction(network.transfer("Alice", "Bob", 250, 1));
        assertTrue(network.protocol.runRound().isCommitted());
        network.txPool.addTransaction(network.transfer("Alice", "Carol", 5, 2));

        JsonStateStore store = new JsonStateStore(tempDir.resolve("state.json"));
        ChainState state = ChainState.builder()
                .chain(network.ledger.getChain())
                .balances(network.ledger.balances())
                .pending(network.txPool.getPendingTransactions())
                .standings(network.reputation.standings())
                .savedAt(42)
                .build();
        assertTrue(store.saveState(state).isSuccess());
        assertTrue(Files.exists(store.getStateFile()));
        assertFalse(Files.exists(tempDir.resolve("state.json.tmp")));

        Result<ChainState> loaded = store.loadState();
        assertTrue(loaded.isSuccess());
        List<Block> chain = loaded.getData().getChain();
        assertEquals(2, chain.size());
        assertEquals(network.ledger.getLatestBlock().getHash(), chain.get(1).getHash());
        assertEquals(chain.get(1).getHash(), chain.get(1).computeHash(network.hashChain));
        assertEquals(250, loaded.getData().getBalances().get("Bob"), 1e-9);
        assertEquals(1, loaded.getData().getPending().size());
        assertEquals(5, loaded.getData().getStandings().size());
        assertEquals(42, loaded.getData().getSavedAt());
    }

    @Test
    void missingFileFails() {
        Result<ChainState> loaded = new JsonStateStore(tempDir.resolve("absent.json")).loadState();

        assertFalse(loaded.isSuccess());
        assertEquals(Result.SC_INTERNAL_SERVER_ERROR_500, loaded.getCode());
    }

    @Test
    void corruptFileFails() throws Exception {
        Path file = tempDir.resolve("corrupt.json");
        Files.write(file, "{\"chain\": [ {\"sequence\": ".getBytes(StandardCharsets.UTF_8));

        Result<ChainState> loaded = new JsonStateStore(file).loadState();

        assertFalse(loaded.isSuccess());
        assertEquals(1, loaded.getExitCode());
    }

    @Test
    void blocksWithMissingFieldsAreRejected() throws Exception {
        Path file = tempDir.resolve("partial.json");
        JsonStateStore store = new JsonStateStore(file);

        Files.write(file, "{\"chain\":[{\"sequence\":0}]}".getBytes(StandardCharsets.UTF_8));
        assertFalse(store.loadState().isSuccess());

        Block genesis = network.ledger.getLatestBlock();
        String genesisJson = new ObjectMapper().writeValueAsString(genesis);
        Files.write(file, ("{\"chain\":[" + genesisJson + "],\"pending\":[null]}").getBytes(StandardCharsets.UTF_8));
        assertFalse(store.loadState().isSuccess());

        Files.write(file, ("{\"chain\":[" + genesisJson + "],\"pending\":[]}").getBytes(StandardCharsets.UTF_8));
        assertTrue(store.loadState().isSuccess());
    }

    @Test
    void emptyChainIsRejected() throws Exception {
        Path file = tempDir.resolve("empty.json");
        Files.write(file, "{\"chain\": [], \"balances\": {}}".getBytes(StandardCharsets.UTF_8));

        assertFalse(new JsonStateStore(file).loadState().isSuccess());
    }
}

package com.bit.valorium.service;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.blockchain.IntegrityReport;
import com.bit.valorium.database.json.JsonStateStore;
import com.bit.valorium.genome.NodeFailureReport;
import com.bit.valorium.result.Result;
import com.bit.valorium.service.impl.OperatorServiceImpl;
import com.bit.valorium.structure.dto.RegisterVersionRequest;
import com.bit.valorium.structure.dto.TransferRequest;
import com.bit.valorium.structure.state.ChainState;
import com.bit.valorium.voting.RoundOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OperatorServiceTest {

    @TempDir
    Path tempDir;

    private final TestNetwork network = new TestNetwork();

    private JsonStateStore store;

    private OperatorServiceImpl operator;

    @BeforeEach
    void setUp() {
        store = new JsonStateStore(tempDir.resolve("valorium_state.json"));
        network.addValidator("Validator_Alpha");
        network.addHonestAttesters("Neural_", 4);
        operator = network.operator(store);
        operator.bootstrap();
    }

    @AfterEach
    void tearDown() {
        network.close();
    }

    private TransferRequest transfer(String sender, String recipient, double amount) {
        TransferRequest request = new TransferRequest();
        request.setSender(sender);
        request.setRecipient(recipient);
        request.setAmount(amount);
        return request;
    }

    private void commitTransfer(String recipient, double amount) {
        assertTrue(operator.addTransaction(transfer("Alice", recipient, amount)).isSuccess());
        Result<RoundOutcome> round = operator.runRound();
        assertTrue(round.getData().isCommitted(), round.getMessage());
    }

    @Test
    void bootstrapArchivesGenesis() {
        assertTrue(network.fragments.contains("block_0"));
        assertEquals(0, operator.verifyIntegrity().getExitCode());
    }

    @Test
    void invalidTransferHasValidationExitCode() {
        Result<String> result = operator.addTransaction(transfer("Alice", "Bob", -1));

        assertFalse(result.isSuccess());
        assertEquals(2, result.getExitCode());
    }

    @Test
    void registerVersionReturnsTrustedHash() {
        RegisterVersionRequest request = new RegisterVersionRequest();
        request.setVersion("2.0");

        Result<String> result = operator.registerVersion(request);

        assertTrue(result.isSuccess());
        assertEquals(network.registry.trustedHash("2.0").orElseThrow().toHex(), result.getData());
    }

    @Test
    void saveThenLoadRestoresChain() {
        commitTransfer("Bob", 100);
        commitTransfer("Carol", 50);
        assertTrue(operator.saveState().isSuccess());

        network.ledger.resetToGenesis();
        Result<ChainState> loaded = operator.loadState();

        assertTrue(loaded.isSuccess());
        assertEquals(3, network.ledger.length());
        assertEquals(100, network.ledger.balanceOf("Bob"), 1e-9);
        assertFalse(network.txPool.addTransaction(loaded.getData().getChain().get(1).getTransactions().get(0)).isSuccess());
    }

    @Test
    void tamperedStateFileReportsFirstBrokenBlock() throws Exception {
        commitTransfer("Bob", 100);
        commitTransfer("Carol", 50);
        commitTransfer("Dave", 25);
        assertTrue(operator.saveState().isSuccess());

        ObjectMapper mapper = new ObjectMapper();
        Path file = store.getStateFile();
        ObjectNode root = (ObjectNode) mapper.readTree(file.toFile());
        ObjectNode tx = (ObjectNode) root.get("chain").get(2).get("transactions").get(0);
        tx.put("amount", 5000.0);
        mapper.writeValue(file.toFile(), root);

        Result<ChainState> loaded = operator.loadState();

        assertFalse(loaded.isSuccess());
        assertEquals(Result.SC_INTEGRITY_FAILURE_409, loaded.getCode());
        assertEquals(3, loaded.getExitCode());
        assertEquals(4, network.ledger.length());

        Result<IntegrityReport> verified = operator.verifyIntegrity();
        assertFalse(verified.isSuccess());
        assertEquals(2, verified.getData().getFirstBrokenSequence());
    }

    @Test
    void corruptStateFileStartsFromGenesis() throws Exception {
        commitTransfer("Bob", 100);
        Files.write(store.getStateFile(), "garbage".getBytes(StandardCharsets.UTF_8));

        Result<ChainState> loaded = operator.loadState();

        assertFalse(loaded.isSuccess());
        assertEquals(1, network.ledger.length());
        assertEquals(1000, network.ledger.balanceOf("Alice"), 1e-9);
        assertTrue(network.ledger.verifyIntegrity().isValid());
    }

    @Test
    void stateFileWithMissingBlockFieldsStartsFromGenesis() throws Exception {
        commitTransfer("Bob", 100);
        Files.write(store.getStateFile(), "{\"chain\":[{\"sequence\":0}]}".getBytes(StandardCharsets.UTF_8));

        Result<ChainState> loaded = operator.loadState();

        assertFalse(loaded.isSuccess());
        assertEquals(Result.SC_INTERNAL_SERVER_ERROR_500, loaded.getCode());
        assertEquals(1, network.ledger.length());
        assertEquals(0, network.txPool.getPoolSize());
        assertTrue(network.ledger.verifyIntegrity().isValid());
    }

    @Test
    void tolerableNodeFailuresRegenerate() {
        commitTransfer("Bob", 100);

        Result<NodeFailureReport> result = operator.simulateNodeFailure(List.of("Neural_1", "Neural_2"));

        assertTrue(result.isSuccess());
        assertFalse(result.getData().hasLoss());
        assertTrue(network.fragments.reconstruct("block_1").isSuccess());
    }

    @Test
    void losingEveryCustodianReportsIrrecoverableLoss() {
        commitTransfer("Bob", 100);

        Result<NodeFailureReport> result = operator.simulateNodeFailure(
                List.of("Neural_1", "Neural_2", "Neural_3", "Neural_4"));

        assertFalse(result.isSuccess());
        assertEquals(Result.SC_FRAGMENT_LOSS_410, result.getCode());
        assertTrue(result.getData().hasLoss());
        assertTrue(result.getData().getLost().contains("block_1"));
        assertFalse(network.fragments.reconstruct("block_1").isSuccess());
    }

    @Test
    void rehabilitateUnknownNodeFails() {
        assertEquals(Result.SC_VALIDATION_ERROR_400, operator.rehabilitate("Nobody", 1.0).getCode());
        assertTrue(operator.rehabilitate("Neural_1", 0.8).isSuccess());
    }

    @Test
    void reportReflectsCommittedRounds() {
        commitTransfer("Bob", 100);

        assertEquals(2, operator.report().getData().getChainLength());
        assertEquals(1, operator.report().getData().getCommittedRounds());
        assertTrue(operator.exportReport().getData().contains("consensusSuccessRate"));
    }
}

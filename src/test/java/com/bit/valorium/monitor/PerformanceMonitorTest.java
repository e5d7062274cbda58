package com.bit.valorium.monitor;

import com.bit.valorium.TestNetwork;
import com.bit.valorium.monitor.impl.dto.PerformanceReport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class PerformanceMonitorTest {

    private final TestNetwork network = new TestNetwork();

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void reportTracksPerNodeAttestationSuccess() {
        network.addValidator("Validator_Alpha");
        network.addHonestAttesters("Neural_", 4);
        network.addByzantineAttesters("Rogue_", 1);
        network.txPool.addTransaction(network.transfer("Alice", "Bob", 10, 1));
        assertTrue(network.protocol.runRound().isCommitted());

        PerformanceReport report = network.monitor.report();
        log.info("运行报告: {}", report);

        assertEquals(100.0, report.getNodeSuccessRates().get("Neural_1"), 1e-9);
        assertEquals(0.0, report.getNodeSuccessRates().get("Rogue_1"), 1e-9);
        assertEquals(5, report.getNodeSuccessRates().size());
        assertEquals(80.0, report.getAvgNodeSuccessRate(), 1e-9);
        assertEquals(5, report.getHonestNodes());
        assertEquals(6, report.getTotalNodes());
        assertEquals(1, report.getMaliciousNodeCount());
        assertEquals(100.0, report.getConsensusSuccessRate(), 1e-9);
    }

    @Test
    void successRateAccumulatesAcrossRounds() {
        network.addHonestAttesters("Neural_", 1);
        network.monitor.recordAttestation("Neural_1", true);
        network.monitor.recordAttestation("Neural_1", true);
        network.monitor.recordAttestation("Neural_1", true);
        network.monitor.recordAttestation("Neural_1", false);

        PerformanceReport report = network.monitor.report();

        assertEquals(75.0, report.getNodeSuccessRates().get("Neural_1"), 1e-9);
        assertEquals(75.0, report.getAvgNodeSuccessRate(), 1e-9);
    }

    @Test
    void attestersWithoutRecordsCountAsFullySuccessful() {
        network.addHonestAttesters("Neural_", 2);

        PerformanceReport report = network.monitor.report();

        assertEquals(100.0, report.getAvgNodeSuccessRate(), 1e-9);
        assertEquals(2, report.getHonestNodes());
        assertTrue(network.monitor.exportJson().contains("avgNodeSuccessRate"));
    }
}

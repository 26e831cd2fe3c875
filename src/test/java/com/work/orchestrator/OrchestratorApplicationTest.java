package com.work.orchestrator;

import com.work.orchestrator.blockchain.Bytes32;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.engine.BlockchainOrchestrator;
import com.work.orchestrator.engine.broadcast.BroadcastReceipt;
import com.work.orchestrator.engine.broadcast.BroadcastService;
import com.work.orchestrator.eventstream.EventStreamRuntime;
import com.work.orchestrator.testsupport.Await;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "orchestrator.node-id=node-test",
        "orchestrator.blockchain.connector.confirmation-delay=20ms",
        "orchestrator.blockchain.connector.poll-interval=20ms"
})
public class OrchestratorApplicationTest {

    @Autowired
    private BlockchainOrchestrator<?> orchestrator;

    @Autowired
    private BroadcastService broadcastService;

    @Autowired
    private EventStreamRuntime runtime;

    @Test
    public void default_wiring_broadcasts_through_mock_chain() throws Exception {
        assertTrue(orchestrator.getCapabilities().isGlobalSequencer());
        List<Bytes32> applied = new CopyOnWriteArrayList<>();
        orchestrator.onBroadcastBatch((batch, info) -> applied.add(batch.getBatchId()));

        BroadcastReceipt receipt = broadcastService.broadcast("0xOrg1", "ping".getBytes(StandardCharsets.UTF_8));

        assertEquals(TransactionState.CONFIRMED,
                orchestrator.whenTerminal(receipt.getTrackingId()).get(5, TimeUnit.SECONDS).getState());
        Await.until(() -> applied.contains(receipt.getBatch().getBatchId()), 5000, "batch applied");
        assertEquals("node-test", runtime.status().getActiveMember());
    }
}

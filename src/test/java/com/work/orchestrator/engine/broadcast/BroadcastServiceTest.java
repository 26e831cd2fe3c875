package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.BatchIds;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.HexUUID;
import com.work.orchestrator.engine.BlockchainOrchestrator;
import com.work.orchestrator.sharedstorage.InMemorySharedStorage;
import com.work.orchestrator.sharedstorage.SharedStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.work.orchestrator.testsupport.Batches.batch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class BroadcastServiceTest {

    private InMemorySharedStorage storage;
    private BlockchainOrchestrator<?> orchestrator;
    private BroadcastService service;

    @BeforeEach
    public void setUp() {
        storage = new InMemorySharedStorage();
        orchestrator = mock(BlockchainOrchestrator.class);
        service = new BroadcastService(storage, orchestrator, Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC));
    }

    @Test
    public void uploads_payload_then_submits_derived_batch() {
        when(orchestrator.submitBroadcastBatch(eq("0xOrg1"), any(BroadcastBatch.class))).thenReturn("tx-1");
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);

        BroadcastReceipt receipt = service.broadcast("0xOrg1", payload);

        assertEquals("tx-1", receipt.getTrackingId());
        ArgumentCaptor<BroadcastBatch> captor = ArgumentCaptor.forClass(BroadcastBatch.class);
        verify(orchestrator).submitBroadcastBatch(eq("0xOrg1"), captor.capture());
        BroadcastBatch submitted = captor.getValue();
        assertEquals(receipt.getBatch(), submitted);
        assertEquals(1700000000000L, submitted.getTimestamp());
        assertEquals(HexUUID.fromContent(payload), submitted.getBatchPayloadRef());
        assertEquals(BatchIds.derive("0xOrg1", submitted.getBatchPayloadRef(), 1700000000000L), submitted.getBatchId());
        assertArrayEquals(payload, service.fetchPayload(submitted));
    }

    @Test
    public void submit_failure_surfaces_to_caller() {
        when(orchestrator.submitBroadcastBatch(anyString(), any(BroadcastBatch.class)))
                .thenThrow(new IllegalStateException("orchestrator not started"));

        assertThrows(IllegalStateException.class, () -> service.broadcast("0xOrg1", new byte[]{1}));
        assertEquals(1, storage.size());
    }

    @Test
    public void unknown_payload_ref_cannot_be_fetched() {
        assertThrows(SharedStorageException.class, () -> service.fetchPayload(batch("0xOrg1", 42)));
    }
}

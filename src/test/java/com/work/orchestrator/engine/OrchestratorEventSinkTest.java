package com.work.orchestrator.engine;

import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.engine.broadcast.BroadcastBatchProcessor;
import com.work.orchestrator.engine.tracker.TransactionTracker;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.work.orchestrator.testsupport.Batches.batch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class OrchestratorEventSinkTest {

    private TransactionTracker tracker;
    private BroadcastBatchProcessor processor;
    private OrchestratorMetrics metrics;
    private OrchestratorEventSink sink;

    @BeforeEach
    public void setUp() {
        tracker = mock(TransactionTracker.class);
        processor = mock(BroadcastBatchProcessor.class);
        metrics = mock(OrchestratorMetrics.class);
        sink = new OrchestratorEventSink(tracker, processor, metrics);
    }

    @Test
    public void routes_updates_and_batches() {
        BroadcastBatch b = batch("0xOrg1", 1);

        sink.transactionUpdate("tx-1", TransactionState.CONFIRMED, "", null);
        sink.sequencedBroadcastBatch(b, Collections.<String, Object>emptyMap());

        verify(tracker).applyUpdate(eq("tx-1"), eq(TransactionState.CONFIRMED), eq(""), isNull());
        verify(processor).process(eq(b), anyMap());
    }

    @Test
    public void malformed_input_is_counted_not_thrown() {
        assertDoesNotThrow(() -> sink.transactionUpdate(null, TransactionState.CONFIRMED, "", null));
        assertDoesNotThrow(() -> sink.transactionUpdate("tx-1", null, "", null));
        assertDoesNotThrow(() -> sink.sequencedBroadcastBatch(null, null));

        verify(metrics, times(2)).protocolViolation(eq("malformed_update"));
        verify(metrics).protocolViolation(eq("malformed_batch"));
        verifyNoInteractions(tracker, processor);
    }

    @Test
    public void application_failure_propagates_for_redelivery() {
        BroadcastBatch b = batch("0xOrg1", 1);
        when(processor.process(any(BroadcastBatch.class), any())).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class, () -> sink.sequencedBroadcastBatch(b, null));
    }
}

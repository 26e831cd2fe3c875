package com.work.orchestrator.eventstream;

import com.work.orchestrator.blockchain.BlockchainEvents;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.blockchain.exception.SequenceGapException;
import com.work.orchestrator.eventstream.store.InMemoryDeliveryCursorStore;
import com.work.orchestrator.eventstream.store.InMemorySequencedEventLog;
import com.work.orchestrator.support.metrics.NoopOrchestratorMetrics;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import com.work.orchestrator.testsupport.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.orchestrator.testsupport.Batches.event;
import static org.junit.jupiter.api.Assertions.*;

public class SequencedEventConsumerTest {

    private static final String SUB = "net1-org1";

    private EventStreamRuntime runtime;
    private OrchestratorMetrics metrics;
    private final List<SequencedEventConsumer> consumers = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        metrics = new NoopOrchestratorMetrics();
        runtime = new EventStreamRuntime(SUB, new InMemorySequencedEventLog(), new InMemoryDeliveryCursorStore(), 10, metrics);
        runtime.start();
    }

    @AfterEach
    public void tearDown() {
        for (SequencedEventConsumer c : consumers) {
            c.stop();
        }
        runtime.shutdown();
    }

    @Test
    public void dispatches_in_order_then_acks() {
        RecordingEvents sink = new RecordingEvents();
        start("m1", sink);
        for (long i = 1; i <= 5; i++) {
            runtime.publish(event(i));
        }

        Await.until(() -> sink.sequences.size() == 5, 3000, "five dispatched events");
        assertEquals(Arrays.asList(1L, 2L, 3L, 4L, 5L), sink.sequences);
        Await.until(() -> runtime.status().getAckedSequence() == 5L, 3000, "cursor at 5");

        Map<String, Object> info = sink.infos.get(0);
        assertEquals(1L, info.get(SequencedEventConsumer.INFO_SEQUENCE));
        assertEquals("0xhash1", info.get(SequencedEventConsumer.INFO_TX_HASH));
        assertEquals("0xSender", info.get(SequencedEventConsumer.INFO_SUBMITTER));
    }

    @Test
    public void sink_failure_leaves_event_unacked_and_redelivers() {
        RecordingEvents sink = new RecordingEvents();
        sink.failOnceAt = 3L;
        SequencedEventConsumer c = start("m1", sink);
        for (long i = 1; i <= 5; i++) {
            runtime.publish(event(i));
        }

        Await.until(() -> sink.sequences.size() == 5, 5000, "all events after redelivery");
        assertEquals(Arrays.asList(1L, 2L, 3L, 4L, 5L), sink.sequences);
        assertEquals(1, sink.failures.get());
        assertTrue(c.getLastError() instanceof IllegalStateException);
        Await.until(() -> runtime.status().getAckedSequence() == 5L, 3000, "cursor at 5");
    }

    @Test
    public void stop_hands_the_stream_to_the_standby_member() {
        RecordingEvents first = new RecordingEvents();
        RecordingEvents second = new RecordingEvents();
        SequencedEventConsumer c1 = start("m1", first);
        Await.until(() -> "m1".equals(runtime.status().getActiveMember()), 3000, "m1 active");
        start("m2", second);
        Await.until(() -> runtime.status().getStandbyCount() == 1, 3000, "m2 standby");

        for (long i = 1; i <= 3; i++) {
            runtime.publish(event(i));
        }
        Await.until(() -> runtime.status().getAckedSequence() == 3L, 3000, "m1 acked 3");

        c1.stop();
        Await.until(() -> "m2".equals(runtime.status().getActiveMember()), 3000, "m2 active");
        for (long i = 4; i <= 6; i++) {
            runtime.publish(event(i));
        }

        Await.until(() -> second.sequences.size() == 3, 3000, "m2 received 4..6");
        assertEquals(Arrays.asList(1L, 2L, 3L), first.sequences);
        assertEquals(Arrays.asList(4L, 5L, 6L), second.sequences);
    }

    @Test
    public void keeps_retrying_while_stream_is_failed_until_resynchronized() {
        runtime.publish(event(1));
        assertThrows(SequenceGapException.class, () -> runtime.publish(event(3)));
        assertEquals(StreamState.FAILED, runtime.status().getState());

        RecordingEvents sink = new RecordingEvents();
        SequencedEventConsumer c = start("m1", sink);
        Await.until(() -> c.getLastError() instanceof SequenceGapException, 3000, "gap reported to consumer");
        assertTrue(sink.sequences.isEmpty());

        runtime.resynchronize(1L);
        runtime.publish(event(2));

        Await.until(() -> sink.sequences.size() == 1, 5000, "event after resync");
        assertEquals(Arrays.asList(2L), sink.sequences);
    }

    private SequencedEventConsumer start(String member, BlockchainEvents sink) {
        SequencedEventConsumer c = new SequencedEventConsumer(runtime, member, sink,
                new ReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(50), 2.0d),
                Duration.ofMillis(20), metrics);
        consumers.add(c);
        c.start();
        return c;
    }

    static final class RecordingEvents implements BlockchainEvents {

        final List<Long> sequences = new CopyOnWriteArrayList<>();
        final List<Map<String, Object>> infos = new CopyOnWriteArrayList<>();
        final AtomicInteger failures = new AtomicInteger();
        volatile long failOnceAt = -1L;

        @Override
        public void transactionUpdate(String txTrackingId, TransactionState state, String errorMessage, Map<String, Object> additionalInfo) {
        }

        @Override
        public void sequencedBroadcastBatch(BroadcastBatch batch, Map<String, Object> additionalInfo) {
            long seq = ((Number) additionalInfo.get(SequencedEventConsumer.INFO_SEQUENCE)).longValue();
            if (seq == failOnceAt && failures.getAndIncrement() == 0) {
                throw new IllegalStateException("downstream unavailable");
            }
            sequences.add(seq);
            infos.add(additionalInfo);
        }
    }
}

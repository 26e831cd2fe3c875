package com.work.orchestrator.eventstream;

import com.work.orchestrator.engine.OrchestratorEventSink;
import com.work.orchestrator.engine.broadcast.BroadcastBatchProcessor;
import com.work.orchestrator.engine.broadcast.InMemoryProcessedBatchStore;
import com.work.orchestrator.engine.tracker.TransactionTracker;
import com.work.orchestrator.eventstream.store.InMemoryDeliveryCursorStore;
import com.work.orchestrator.eventstream.store.InMemorySequencedEventLog;
import com.work.orchestrator.support.metrics.NoopOrchestratorMetrics;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import com.work.orchestrator.testsupport.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.orchestrator.testsupport.Batches.event;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 两个集群成员共享一个已处理 batch 存储：active 成员异常断开、计划内下线时，
 * 应用层看到的 batch 仍然严格按 sequence 递增且不重复。
 */
public class FailoverOrderingTest {

    private static final String SUB = "net1-org1";
    private static final int TOTAL = 30;

    private final OrchestratorMetrics metrics = new NoopOrchestratorMetrics();
    private final InMemoryProcessedBatchStore processed = new InMemoryProcessedBatchStore();
    private final List<Long> applied = Collections.synchronizedList(new ArrayList<>());
    private final EventStreamRuntime runtime =
            new EventStreamRuntime(SUB, new InMemorySequencedEventLog(), new InMemoryDeliveryCursorStore(), 4, metrics);

    private SequencedEventConsumer m1;
    private SequencedEventConsumer m2;

    @AfterEach
    public void tearDown() {
        if (m1 != null) {
            m1.stop();
        }
        if (m2 != null) {
            m2.stop();
        }
        runtime.shutdown();
    }

    @Test
    public void application_sees_every_batch_once_in_sequence_order_across_failovers() {
        runtime.start();
        m1 = member("m1");
        m1.start();
        Await.until(() -> "m1".equals(runtime.status().getActiveMember()), 3000, "m1 active");
        m2 = member("m2");
        m2.start();
        Await.until(() -> runtime.status().getStandbyCount() == 1, 3000, "m2 standby");

        publish(1, 10);
        Await.until(() -> applied.size() >= 10, 5000, "first ten applied");

        // active 成员网络中断：生产侧切到 m2，m1 重连后进入 standby
        StreamConnection lost = m1.getCurrentConnection();
        assertNotNull(lost);
        runtime.disconnect(lost, new IllegalStateException("connection reset"));
        Await.until(() -> "m2".equals(runtime.status().getActiveMember()), 3000, "m2 active");

        publish(11, 20);
        Await.until(() -> applied.size() >= 20, 5000, "twenty applied");

        m2.stop();
        Await.until(() -> "m1".equals(runtime.status().getActiveMember()), 3000, "m1 active again");

        publish(21, TOTAL);
        Await.until(() -> applied.size() >= TOTAL, 5000, "all applied");
        Await.until(() -> runtime.status().getAckedSequence() == TOTAL, 3000, "cursor at end");

        List<Long> expected = new ArrayList<>();
        for (long i = 1; i <= TOTAL; i++) {
            expected.add(i);
        }
        synchronized (applied) {
            assertEquals(expected, applied);
        }
        assertEquals(TOTAL, processed.size());
    }

    private SequencedEventConsumer member(String memberId) {
        BroadcastBatchProcessor processor = new BroadcastBatchProcessor(processed, metrics);
        processor.addListener((batch, info) ->
                applied.add(((Number) info.get(SequencedEventConsumer.INFO_SEQUENCE)).longValue()));
        TransactionTracker tracker = new TransactionTracker(Duration.ofMinutes(1), Duration.ofMinutes(1), 1000, metrics);
        OrchestratorEventSink sink = new OrchestratorEventSink(tracker, processor, metrics);
        return new SequencedEventConsumer(runtime, memberId, sink,
                new ReconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(50), 2.0d),
                Duration.ofMillis(20), metrics);
    }

    private void publish(long from, long to) {
        for (long i = from; i <= to; i++) {
            runtime.publish(event(i));
        }
    }
}

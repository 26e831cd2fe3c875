package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Bytes32;
import com.work.orchestrator.eventstream.SequencedEventConsumer;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 排序 batch 的去重与分发：同一个 batchId 只交给应用层监听器一次。
 *
 * 流程：按 batchId 加锁 -> 已处理则跳过 -> 通知监听器 -> 持久化标记。
 * 监听器失败时不做标记，异常抛回消费循环，事件不会被确认。
 * 标记之前崩溃会导致监听器在重放时再次收到同一个 batch，所以监听器需要按 batchId 幂等。
 */
public class BroadcastBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BroadcastBatchProcessor.class);

    private final ProcessedBatchStore store;
    private final OrchestratorMetrics metrics;
    private final List<BroadcastBatchListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Bytes32, BatchLock> inFlight = new ConcurrentHashMap<>();

    public BroadcastBatchProcessor(ProcessedBatchStore store, OrchestratorMetrics metrics) {
        this.store = requireNonNull(store, "store");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public void addListener(BroadcastBatchListener listener) {
        listeners.add(requireNonNull(listener, "listener"));
    }

    public BatchOutcome process(BroadcastBatch batch, Map<String, Object> additionalInfo) {
        requireNonNull(batch, "batch");
        Bytes32 batchId = requireNonNull(batch.getBatchId(), "batchId");
        Map<String, Object> info = additionalInfo == null ? Collections.<String, Object>emptyMap() : additionalInfo;

        // 同一 batchId 串行处理：fail-over 窗口内新旧 active 成员可能同时拿到同一个 batch。
        // 锁条目按持有/等待者计数，最后一个离开时才移除，保证所有竞争者拿到同一把锁
        BatchLock lock = inFlight.compute(batchId, (k, cur) -> {
            BatchLock l = cur == null ? new BatchLock() : cur;
            l.holders++;
            return l;
        });
        try {
            synchronized (lock) {
                return processLocked(batch, batchId, info);
            }
        } finally {
            inFlight.computeIfPresent(batchId, (k, cur) -> --cur.holders == 0 ? null : cur);
        }
    }

    private BatchOutcome processLocked(BroadcastBatch batch, Bytes32 batchId, Map<String, Object> info) {
        if (store.isProcessed(batchId)) {
            metrics.batchDelivered("duplicate");
            log.debug("duplicate batch ignored batchId={} sequence={}", batchId, info.get(SequencedEventConsumer.INFO_SEQUENCE));
            return BatchOutcome.DUPLICATE;
        }
        try {
            for (BroadcastBatchListener l : listeners) {
                l.onBatch(batch, info);
            }
        } catch (RuntimeException e) {
            metrics.batchDelivered("failed");
            log.warn("batch processing failed, will be redelivered batchId={} err={}", batchId, e.getMessage());
            throw e;
        }
        store.markProcessed(batchId, sequenceOf(info));
        metrics.batchDelivered("processed");
        log.info("batch processed batchId={} sequence={} payloadRef={}",
                batchId, info.get(SequencedEventConsumer.INFO_SEQUENCE), batch.getBatchPayloadRef());
        return BatchOutcome.PROCESSED;
    }

    public boolean isProcessed(Bytes32 batchId) {
        return store.isProcessed(batchId);
    }

    private static Long sequenceOf(Map<String, Object> info) {
        Object v = info.get(SequencedEventConsumer.INFO_SEQUENCE);
        return v instanceof Number ? ((Number) v).longValue() : null;
    }

    /**
     * holders 只在 ConcurrentHashMap.compute 内修改。
     */
    private static final class BatchLock {
        private int holders;
    }
}

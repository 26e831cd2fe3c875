package com.work.orchestrator.engine;

import com.work.orchestrator.blockchain.BlockchainEvents;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.engine.broadcast.BroadcastBatchProcessor;
import com.work.orchestrator.engine.tracker.TransactionTracker;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 引擎侧的事件入口：交易更新交给 tracker，排序 batch 交给 batch processor。
 *
 * 格式错误/重复等异常只记录日志和指标，不抛给 connector；
 * 只有应用层处理失败会抛出，使事件保持未确认并被重放。
 */
public class OrchestratorEventSink implements BlockchainEvents {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorEventSink.class);

    private final TransactionTracker tracker;
    private final BroadcastBatchProcessor batchProcessor;
    private final OrchestratorMetrics metrics;

    public OrchestratorEventSink(TransactionTracker tracker, BroadcastBatchProcessor batchProcessor, OrchestratorMetrics metrics) {
        this.tracker = requireNonNull(tracker, "tracker");
        this.batchProcessor = requireNonNull(batchProcessor, "batchProcessor");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    @Override
    public void transactionUpdate(String txTrackingId, TransactionState state, String errorMessage, Map<String, Object> additionalInfo) {
        if (txTrackingId == null || txTrackingId.isEmpty() || state == null) {
            metrics.protocolViolation("malformed_update");
            log.warn("malformed transaction update discarded trackingId={} state={}", txTrackingId, state);
            return;
        }
        tracker.applyUpdate(txTrackingId, state, errorMessage, additionalInfo);
    }

    @Override
    public void sequencedBroadcastBatch(BroadcastBatch batch, Map<String, Object> additionalInfo) {
        if (batch == null || batch.getBatchId() == null) {
            metrics.protocolViolation("malformed_batch");
            log.warn("malformed sequenced batch discarded batch={}", batch);
            return;
        }
        batchProcessor.process(batch, additionalInfo);
    }
}

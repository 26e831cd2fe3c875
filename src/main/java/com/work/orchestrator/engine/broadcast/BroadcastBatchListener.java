package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.BroadcastBatch;

import java.util.Map;

/**
 * 应用层对排序后 batch 的消费者。
 *
 * 抛出异常表示本次未处理成功：事件不会被确认，稍后按原顺序重放。
 * 崩溃恢复场景下同一个 batchId 可能再次到达，实现需按 batchId 幂等。
 */
@FunctionalInterface
public interface BroadcastBatchListener {

    void onBatch(BroadcastBatch batch, Map<String, Object> additionalInfo);
}

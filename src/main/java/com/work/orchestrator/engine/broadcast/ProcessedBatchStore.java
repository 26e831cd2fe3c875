package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.Bytes32;

/**
 * 已处理 batch 的去重记录（按 batchId）。
 */
public interface ProcessedBatchStore {

    boolean isProcessed(Bytes32 batchId);

    /**
     * 记录 batch 已处理。
     *
     * @param sequence 事件流中的 sequence，未知时为 null
     * @return false 表示已经记录过
     */
    boolean markProcessed(Bytes32 batchId, Long sequence);
}

package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.BroadcastBatch;

/**
 * 一次 broadcast 的提交结果。
 */
public final class BroadcastReceipt {

    private final BroadcastBatch batch;
    private final String trackingId;

    public BroadcastReceipt(BroadcastBatch batch, String trackingId) {
        this.batch = batch;
        this.trackingId = trackingId;
    }

    public BroadcastBatch getBatch() {
        return batch;
    }

    public String getTrackingId() {
        return trackingId;
    }

    @Override
    public String toString() {
        return "BroadcastReceipt{batchId=" + batch.getBatchId() + ", trackingId=" + trackingId + "}";
    }
}

package com.work.orchestrator.blockchain.mock;

import com.work.orchestrator.blockchain.BroadcastBatch;

/**
 * 账本上的一条 pin 记录。failureReason 非空表示链侧拒绝（未进入全局顺序，sequence 为 0）。
 */
public final class LedgerPin {

    private final long sequence;
    private final String identity;
    private final BroadcastBatch batch;
    private final String txHash;
    private final String failureReason;
    private final boolean duplicate;

    LedgerPin(long sequence, String identity, BroadcastBatch batch, String txHash, String failureReason, boolean duplicate) {
        this.sequence = sequence;
        this.identity = identity;
        this.batch = batch;
        this.txHash = txHash;
        this.failureReason = failureReason;
        this.duplicate = duplicate;
    }

    LedgerPin asDuplicate() {
        return new LedgerPin(sequence, identity, batch, txHash, failureReason, true);
    }

    public long getSequence() {
        return sequence;
    }

    public String getIdentity() {
        return identity;
    }

    public BroadcastBatch getBatch() {
        return batch;
    }

    public String getTxHash() {
        return txHash;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    /**
     * 同一 batchId 的重复提交：返回的是第一次 pin 的记录。
     */
    public boolean isDuplicate() {
        return duplicate;
    }

    @Override
    public String toString() {
        return "LedgerPin{sequence=" + sequence + ", identity=" + identity + ", batchId=" + batch.getBatchId()
                + ", txHash=" + txHash + (failureReason == null ? "" : ", failure=" + failureReason)
                + (duplicate ? ", duplicate" : "") + "}";
    }
}

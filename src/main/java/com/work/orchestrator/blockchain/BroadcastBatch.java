package com.work.orchestrator.blockchain;

import java.util.Objects;

/**
 * 一批 broadcast 消息在链上 pin 的数据：off-chain payload 的引用 + 明文 batchId。
 *
 * 创建后不可变；payload 本身归存储插件所有，这里只持有引用。
 */
public final class BroadcastBatch {

    /**
     * 提交方本地的提交时间（按无符号 64 位 epoch 解释）。
     */
    private final long timestamp;

    private final HexUUID batchPayloadRef;

    private final Bytes32 batchId;

    public BroadcastBatch(long timestamp, HexUUID batchPayloadRef, Bytes32 batchId) {
        this.timestamp = timestamp;
        this.batchPayloadRef = batchPayloadRef;
        this.batchId = batchId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public HexUUID getBatchPayloadRef() {
        return batchPayloadRef;
    }

    public Bytes32 getBatchId() {
        return batchId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BroadcastBatch)) return false;
        BroadcastBatch that = (BroadcastBatch) o;
        return timestamp == that.timestamp
                && Objects.equals(batchPayloadRef, that.batchPayloadRef)
                && Objects.equals(batchId, that.batchId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, batchPayloadRef, batchId);
    }

    @Override
    public String toString() {
        return "BroadcastBatch{batchId=" + batchId
                + ", batchPayloadRef=" + batchPayloadRef
                + ", timestamp=" + Long.toUnsignedString(timestamp) + "}";
    }
}

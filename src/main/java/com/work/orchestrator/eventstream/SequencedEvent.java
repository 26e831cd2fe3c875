package com.work.orchestrator.eventstream;

import com.work.orchestrator.blockchain.BroadcastBatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 事件流中的一条链上排序事件。sequence 在同一订阅内从 1 开始严格递增，等于该 pin 在链上的全局位置。
 */
public final class SequencedEvent {

    private final long sequence;
    private final BroadcastBatch batch;
    private final String submitter;
    private final String txHash;
    private final Map<String, Object> additionalInfo;

    public SequencedEvent(long sequence, BroadcastBatch batch, String submitter, String txHash, Map<String, Object> additionalInfo) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence 必须大于0");
        }
        if (batch == null) {
            throw new IllegalArgumentException("batch 不能为null");
        }
        this.sequence = sequence;
        this.batch = batch;
        this.submitter = submitter;
        this.txHash = txHash;
        this.additionalInfo = additionalInfo == null
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalInfo));
    }

    public long getSequence() {
        return sequence;
    }

    public BroadcastBatch getBatch() {
        return batch;
    }

    public String getSubmitter() {
        return submitter;
    }

    public String getTxHash() {
        return txHash;
    }

    public Map<String, Object> getAdditionalInfo() {
        return additionalInfo;
    }

    @Override
    public String toString() {
        return "SequencedEvent{sequence=" + sequence + ", batchId=" + batch.getBatchId() + ", txHash=" + txHash + "}";
    }
}

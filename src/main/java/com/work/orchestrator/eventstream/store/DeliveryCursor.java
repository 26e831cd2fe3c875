package com.work.orchestrator.eventstream.store;

import java.time.Instant;

/**
 * 订阅的持久化投递游标：最后一次被确认的 sequence + 当前激活代次（epoch，用作 fencing token）。
 */
public class DeliveryCursor {

    private final String subscription;
    private final long ackedSequence;
    private final long epoch;
    private final Instant updatedAt;

    public DeliveryCursor(String subscription, long ackedSequence, long epoch, Instant updatedAt) {
        this.subscription = subscription;
        this.ackedSequence = ackedSequence;
        this.epoch = epoch;
        this.updatedAt = updatedAt;
    }

    public String getSubscription() {
        return subscription;
    }

    public long getAckedSequence() {
        return ackedSequence;
    }

    public long getEpoch() {
        return epoch;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "DeliveryCursor{subscription=" + subscription + ", acked=" + ackedSequence + ", epoch=" + epoch + "}";
    }
}

package com.work.orchestrator.eventstream;

/**
 * 事件流运行时的只读快照（排障/可观测用）。
 */
public class StreamStatus {

    private final String subscription;
    private final StreamState state;
    private final long ackedSequence;
    private final long lastDelivered;
    private final long lastSequence;
    private final long prunedUpTo;
    private final long epoch;
    private final String activeMember;
    private final int standbyCount;

    public StreamStatus(String subscription, StreamState state, long ackedSequence, long lastDelivered, long lastSequence,
                        long prunedUpTo, long epoch, String activeMember, int standbyCount) {
        this.subscription = subscription;
        this.state = state;
        this.ackedSequence = ackedSequence;
        this.lastDelivered = lastDelivered;
        this.lastSequence = lastSequence;
        this.prunedUpTo = prunedUpTo;
        this.epoch = epoch;
        this.activeMember = activeMember;
        this.standbyCount = standbyCount;
    }

    public String getSubscription() {
        return subscription;
    }

    public StreamState getState() {
        return state;
    }

    public long getAckedSequence() {
        return ackedSequence;
    }

    public long getLastDelivered() {
        return lastDelivered;
    }

    public long getLastSequence() {
        return lastSequence;
    }

    public long getPrunedUpTo() {
        return prunedUpTo;
    }

    public long getEpoch() {
        return epoch;
    }

    public String getActiveMember() {
        return activeMember;
    }

    public int getStandbyCount() {
        return standbyCount;
    }

    @Override
    public String toString() {
        return "StreamStatus{subscription=" + subscription + ", state=" + state + ", acked=" + ackedSequence
                + ", lastDelivered=" + lastDelivered + ", lastSequence=" + lastSequence + ", prunedUpTo=" + prunedUpTo
                + ", epoch=" + epoch + ", active=" + activeMember + ", standby=" + standbyCount + "}";
    }
}

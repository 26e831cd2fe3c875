package com.work.orchestrator.engine.tracker;

import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.TransactionState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 单个 trackingId 的状态机：SUBMITTED -> CONFIRMED | FAILED，终态之后不可变。
 */
public class TrackedTransaction {

    private final String trackingId;
    private final String identity;
    private final BroadcastBatch batch;
    private final Instant submittedAt;
    private final CompletableFuture<TrackedTransaction> terminal = new CompletableFuture<>();

    private TransactionState state = TransactionState.SUBMITTED;
    private String errorMessage;
    private Instant updatedAt;
    private final Map<String, Object> additionalInfo = new LinkedHashMap<>();

    TrackedTransaction(String trackingId, String identity, BroadcastBatch batch, Instant submittedAt) {
        this.trackingId = trackingId;
        this.identity = identity;
        this.batch = batch;
        this.submittedAt = submittedAt;
        this.updatedAt = submittedAt;
    }

    synchronized UpdateOutcome apply(TransactionState newState, String error, Map<String, Object> info, Instant now) {
        if (state.isTerminal()) {
            return UpdateOutcome.IGNORED_AFTER_TERMINAL;
        }
        if (info != null) {
            additionalInfo.putAll(info);
        }
        updatedAt = now;
        if (newState == TransactionState.SUBMITTED) {
            return UpdateOutcome.APPLIED;
        }
        state = newState;
        errorMessage = error == null || error.isEmpty() ? null : error;
        return UpdateOutcome.APPLIED;
    }

    void completeTerminal() {
        terminal.complete(this);
    }

    CompletableFuture<TrackedTransaction> terminalFuture() {
        return terminal;
    }

    public String getTrackingId() {
        return trackingId;
    }

    public String getIdentity() {
        return identity;
    }

    public BroadcastBatch getBatch() {
        return batch;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized TransactionState getState() {
        return state;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized Map<String, Object> getAdditionalInfo() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(additionalInfo));
    }

    @Override
    public synchronized String toString() {
        return "TrackedTransaction{trackingId=" + trackingId + ", identity=" + identity + ", state=" + state
                + (errorMessage == null ? "" : ", error=" + errorMessage) + "}";
    }
}

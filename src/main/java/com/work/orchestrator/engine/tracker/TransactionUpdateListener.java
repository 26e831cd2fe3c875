package com.work.orchestrator.engine.tracker;

/**
 * 交易进入终态时的回调，每个 trackingId 恰好一次。
 */
@FunctionalInterface
public interface TransactionUpdateListener {

    void onTerminal(TrackedTransaction transaction);
}

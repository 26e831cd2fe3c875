package com.work.orchestrator.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可以提供自定义 Bean 接入具体 metrics 实现。
 * 事件侧的异常（重复终态、过期 ack、乱序）只通过这里和日志体现，不会向上抛出。
 */
public interface OrchestratorMetrics {

    default void submit(String result) {
    }

    default void transactionUpdate(String result) {
    }

    default void batchDelivered(String result) {
    }

    default void protocolViolation(String kind) {
    }

    default void streamActivation(String subscription, String memberId) {
    }

    default void streamReconnect(String memberId, int attempt) {
    }

    default void cursorAdvanced(String subscription, long cursor) {
    }

    default void sequenceGap(String subscription) {
    }

    default void inboxDepth(String memberId, int depth) {
    }
}

package com.work.orchestrator.support;

/**
 * 提供集群成员的稳定标识，用于事件流连接的 memberId 与日志/指标标记。
 */
public interface NodeIdProvider {
    String getNodeId();
}

package com.work.orchestrator.eventstream;

/**
 * 集群成员连接事件流的入口（传输层端口）。
 */
@FunctionalInterface
public interface EventStreamEndpoint {

    /**
     * 建立一条连接；运行时不可用时抛 ConnectorUnavailableException，处于缺口状态时抛 SequenceGapException。
     */
    StreamConnection connect(String memberId);
}

package com.work.orchestrator.blockchain;

import java.util.Map;

/**
 * 引擎提供给 connector 的回调端口。
 *
 * 同一集群内，所有链上排序后的事件必须投递给同一个引擎实例，才能保证订阅方看到确定的顺序；
 * 该实例断开后由事件流侧切换到另一个实例，并按正确顺序重放所有未确认的事件。
 *
 * 实现方不得向 connector 抛出异常：重复/乱序等异常情况在本地记录并丢弃。
 */
public interface BlockchainEvents {

    /**
     * 交易状态更新，只有提交方能看到。只建模成功/失败与 errorMessage；
     * additionalInfo 为 connector 附带的协议相关数据（协议交易 ID 等），引擎不解析。
     */
    void transactionUpdate(String txTrackingId, TransactionState state, String errorMessage, Map<String, Object> additionalInfo);

    /**
     * 一个已在全局顺序中定位的 batch 到达（可能由自己或网络中任何有权方提交）。
     * 至少一次投递，按 batchId 去重。
     */
    void sequencedBroadcastBatch(BroadcastBatch batch, Map<String, Object> additionalInfo);
}

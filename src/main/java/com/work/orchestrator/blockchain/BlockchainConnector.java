package com.work.orchestrator.blockchain;

/**
 * 每种区块链技术各自实现的 connector 端口。
 *
 * 具体实现之间互相独立，由配置选择（orchestrator.blockchain.type），不走继承。
 *
 * @param <C> connector 自己声明的配置结构
 */
public interface BlockchainConnector<C> {

    /**
     * connector 类型名（日志/指标用）。
     */
    String name();

    /**
     * 返回一个空值的配置对象，宿主把自己的配置绑定进去后在 {@link #init} 传回。
     * 这里不做任何校验。
     */
    C configInterface();

    /**
     * 一次性初始化，返回该 connector 支持的能力。
     *
     * 约束：
     * - 同一实例只能调用一次，重复调用抛 AlreadyInitializedException
     * - 配置不合法抛 ConfigurationInvalidException
     * - init 不开始消费排序事件，在 {@link #start} 之前不得通过 events 发出任何排序 batch
     */
    Capabilities init(C config, BlockchainEvents events);

    /**
     * 开始消费排序事件。宿主检查过 init 返回的能力并接受该 connector 之后才调用；
     * 被拒绝的 connector 只会被 close，不会 start。
     *
     * @throws IllegalStateException 尚未 init
     */
    void start();

    /**
     * 以 identity 身份提交一个 batch 做链上 pin，返回本 connector 实例内有效的 trackingId。
     *
     * 可并发调用；只等待提交本身，不等待确认。
     * - 输入不合法：SubmissionRejectedException（不可重试）
     * - 网络不可达：ConnectorUnavailableException（可用同一个 batch 重试，链侧按 batchId 去重）
     */
    String submitBroadcastBatch(String identity, BroadcastBatch batch);

    /**
     * 关闭 connector：断开事件流连接（走 fail-over 而不是错误路径）并停止内部线程。
     */
    default void close() {
    }
}

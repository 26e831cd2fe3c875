package com.work.orchestrator.eventstream.store;

/**
 * 持久化游标存储。游标推进必须是原子的 read-modify-write（对并发 ack 安全）。
 */
public interface DeliveryCursorStore {

    /**
     * @return 当前游标；订阅从未激活过（或游标已丢失）时返回 null
     */
    DeliveryCursor load(String subscription);

    /**
     * 激活一条新连接：不存在则以 acked=0 创建，然后 epoch+1。返回激活后的游标。
     */
    DeliveryCursor activate(String subscription);

    /**
     * fenced CAS：仅当 epoch 仍等于传入值且 sequence 大于当前游标时推进。
     *
     * @return true 表示推进成功；false 表示 epoch 已被接管或游标不前进
     */
    boolean advanceFenced(String subscription, long epoch, long sequence);

    /**
     * 显式重新同步：把游标设置为 ackedSequence，并使旧 epoch 失效。
     */
    DeliveryCursor reset(String subscription, long ackedSequence);
}

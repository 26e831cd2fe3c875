package com.work.orchestrator.eventstream.store;

import com.work.orchestrator.eventstream.SequencedEvent;

import java.util.List;

/**
 * 生产侧的事件日志：按订阅保存尚未被确认的事件，供激活/重连时重放。
 */
public interface SequencedEventLog {

    /**
     * 追加一条事件，sequence 必须等于 lastSequence+1。
     *
     * @return true 表示新追加；false 表示重复（sequence 不大于 lastSequence），忽略
     * @throws com.work.orchestrator.blockchain.exception.SequenceGapException sequence 跳号
     */
    boolean append(String subscription, SequencedEvent event);

    /**
     * 读取 sequence 大于 afterSequence 的事件，按 sequence 升序，最多 limit 条。
     */
    List<SequencedEvent> readAfter(String subscription, long afterSequence, int limit);

    /**
     * 曾经追加过的最大 sequence（剪枝后依然保留），空日志为 0。
     */
    long lastSequence(String subscription);

    /**
     * 已剪枝的最大 sequence，从未剪枝为 0。
     */
    long prunedUpTo(String subscription);

    /**
     * 删除 sequence 不大于 upTo 的事件（仅在游标推进后调用）。
     *
     * @return 删除条数
     */
    int pruneUpTo(String subscription, long upTo);
}

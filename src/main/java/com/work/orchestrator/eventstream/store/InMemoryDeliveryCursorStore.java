package com.work.orchestrator.eventstream.store;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNegative;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下运行。
 * 注意：只对同一 JVM 内的运行时实例“持久”，不具备跨进程一致性。
 */
public class InMemoryDeliveryCursorStore implements DeliveryCursorStore {

    private final Map<String, DeliveryCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public DeliveryCursor load(String subscription) {
        requireNonEmpty(subscription, "subscription");
        return cursors.get(subscription);
    }

    @Override
    public DeliveryCursor activate(String subscription) {
        requireNonEmpty(subscription, "subscription");
        return cursors.compute(subscription, (k, cur) -> cur == null
                ? new DeliveryCursor(k, 0L, 1L, Instant.now())
                : new DeliveryCursor(k, cur.getAckedSequence(), cur.getEpoch() + 1L, Instant.now()));
    }

    @Override
    public boolean advanceFenced(String subscription, long epoch, long sequence) {
        requireNonEmpty(subscription, "subscription");
        boolean[] advanced = new boolean[1];
        cursors.computeIfPresent(subscription, (k, cur) -> {
            if (cur.getEpoch() != epoch || sequence <= cur.getAckedSequence()) {
                return cur;
            }
            advanced[0] = true;
            return new DeliveryCursor(k, sequence, epoch, Instant.now());
        });
        return advanced[0];
    }

    @Override
    public DeliveryCursor reset(String subscription, long ackedSequence) {
        requireNonEmpty(subscription, "subscription");
        requireNonNegative(ackedSequence, "ackedSequence");
        return cursors.compute(subscription, (k, cur) ->
                new DeliveryCursor(k, ackedSequence, cur == null ? 1L : cur.getEpoch() + 1L, Instant.now()));
    }

    /**
     * 模拟游标永久丢失（测试/演练用）。
     */
    public void remove(String subscription) {
        cursors.remove(subscription);
    }
}

package com.work.orchestrator.repository.impl;

import com.work.orchestrator.eventstream.store.DeliveryCursor;
import com.work.orchestrator.eventstream.store.DeliveryCursorStore;
import com.work.orchestrator.repository.entity.DeliveryCursorEntity;
import com.work.orchestrator.repository.mapper.DeliveryCursorMapper;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNegative;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的游标存储。游标推进是单条带条件的 UPDATE（fenced CAS）。
 */
public class PostgresDeliveryCursorStore implements DeliveryCursorStore {

    private final DeliveryCursorMapper mapper;

    public PostgresDeliveryCursorStore(DeliveryCursorMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper");
    }

    @Override
    public DeliveryCursor load(String subscription) {
        requireNonEmpty(subscription, "subscription");
        return toCursor(mapper.selectBySubscription(subscription));
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public DeliveryCursor activate(String subscription) {
        requireNonEmpty(subscription, "subscription");
        Instant now = Instant.now();
        mapper.insertIfNotExists(subscription, now);
        mapper.incrementEpoch(subscription, now);
        return loadExisting(subscription);
    }

    @Override
    public boolean advanceFenced(String subscription, long epoch, long sequence) {
        requireNonEmpty(subscription, "subscription");
        return mapper.advanceFenced(subscription, epoch, sequence, Instant.now()) == 1;
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public DeliveryCursor reset(String subscription, long ackedSequence) {
        requireNonEmpty(subscription, "subscription");
        requireNonNegative(ackedSequence, "ackedSequence");
        Instant now = Instant.now();
        mapper.insertIfNotExists(subscription, now);
        mapper.reset(subscription, ackedSequence, now);
        return loadExisting(subscription);
    }

    private DeliveryCursor loadExisting(String subscription) {
        DeliveryCursor cursor = toCursor(mapper.selectBySubscription(subscription));
        if (cursor == null) {
            throw new IllegalStateException("delivery cursor missing after write: " + subscription);
        }
        return cursor;
    }

    private static DeliveryCursor toCursor(DeliveryCursorEntity e) {
        if (e == null) {
            return null;
        }
        return new DeliveryCursor(e.getSubscription(),
                e.getAckedSequence() == null ? 0L : e.getAckedSequence(),
                e.getEpoch() == null ? 0L : e.getEpoch(),
                e.getUpdatedAt());
    }
}

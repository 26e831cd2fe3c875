package com.work.orchestrator.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Bytes32;
import com.work.orchestrator.blockchain.HexUUID;
import com.work.orchestrator.blockchain.exception.SequenceGapException;
import com.work.orchestrator.eventstream.SequencedEvent;
import com.work.orchestrator.eventstream.store.SequencedEventLog;
import com.work.orchestrator.repository.entity.EventLogWatermarkEntity;
import com.work.orchestrator.repository.entity.SequencedEventEntity;
import com.work.orchestrator.repository.mapper.EventLogWatermarkMapper;
import com.work.orchestrator.repository.mapper.SequencedEventMapper;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的事件日志。
 *
 * 追加时先锁水位行（SELECT ... FOR UPDATE），保证同一订阅的 sequence 严格连续；
 * additionalInfo 以 JSON 文本存储。
 */
public class PostgresSequencedEventLog implements SequencedEventLog {

    private static final TypeReference<Map<String, Object>> INFO_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final SequencedEventMapper eventMapper;
    private final EventLogWatermarkMapper watermarkMapper;
    private final ObjectMapper objectMapper;

    public PostgresSequencedEventLog(SequencedEventMapper eventMapper,
                                     EventLogWatermarkMapper watermarkMapper,
                                     ObjectMapper objectMapper) {
        this.eventMapper = requireNonNull(eventMapper, "eventMapper");
        this.watermarkMapper = requireNonNull(watermarkMapper, "watermarkMapper");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public boolean append(String subscription, SequencedEvent event) {
        requireNonEmpty(subscription, "subscription");
        requireNonNull(event, "event");
        Instant now = Instant.now();

        watermarkMapper.insertIfNotExists(subscription, now);
        EventLogWatermarkEntity wm = watermarkMapper.lockBySubscription(subscription);
        long expected = valueOf(wm == null ? null : wm.getLastSequence()) + 1L;
        if (event.getSequence() < expected) {
            return false;
        }
        if (event.getSequence() > expected) {
            throw new SequenceGapException(subscription, expected, event.getSequence());
        }

        BroadcastBatch batch = event.getBatch();
        eventMapper.insertIfNotExists(subscription, event.getSequence(), batch.getTimestamp(),
                batch.getBatchPayloadRef() == null ? null : batch.getBatchPayloadRef().toString(),
                batch.getBatchId() == null ? null : batch.getBatchId().toHex(),
                event.getSubmitter(), event.getTxHash(), writeInfo(event.getAdditionalInfo()), now);
        if (watermarkMapper.advanceLastSequence(subscription, event.getSequence(), now) != 1) {
            throw new IllegalStateException("event log watermark moved concurrently, subscription=" + subscription);
        }
        return true;
    }

    @Override
    public List<SequencedEvent> readAfter(String subscription, long afterSequence, int limit) {
        requireNonEmpty(subscription, "subscription");
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<SequencedEventEntity> rows = eventMapper.selectAfter(subscription, afterSequence, limit);
        List<SequencedEvent> out = new ArrayList<>(rows.size());
        for (SequencedEventEntity row : rows) {
            out.add(toEvent(row));
        }
        return out;
    }

    @Override
    public long lastSequence(String subscription) {
        EventLogWatermarkEntity wm = watermarkMapper.selectBySubscription(requireNonEmpty(subscription, "subscription"));
        return wm == null ? 0L : valueOf(wm.getLastSequence());
    }

    @Override
    public long prunedUpTo(String subscription) {
        EventLogWatermarkEntity wm = watermarkMapper.selectBySubscription(requireNonEmpty(subscription, "subscription"));
        return wm == null ? 0L : valueOf(wm.getPrunedUpTo());
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public int pruneUpTo(String subscription, long upTo) {
        requireNonEmpty(subscription, "subscription");
        int n = eventMapper.deleteUpTo(subscription, upTo);
        watermarkMapper.advancePrunedUpTo(subscription, upTo, Instant.now());
        return n;
    }

    private SequencedEvent toEvent(SequencedEventEntity row) {
        BroadcastBatch batch = new BroadcastBatch(
                valueOf(row.getBatchTimestamp()),
                row.getPayloadRef() == null ? null : HexUUID.parse(row.getPayloadRef()),
                row.getBatchId() == null ? null : Bytes32.fromHex(row.getBatchId()));
        return new SequencedEvent(row.getSequence(), batch, row.getSubmitter(), row.getTxHash(), readInfo(row.getAdditionalInfo()));
    }

    private String writeInfo(Map<String, Object> info) {
        if (info == null || info.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(info);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("additionalInfo 序列化失败", e);
        }
    }

    private Map<String, Object> readInfo(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, INFO_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("additionalInfo 反序列化失败", e);
        }
    }

    private static long valueOf(Long v) {
        return v == null ? 0L : v;
    }
}

package com.work.orchestrator.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * 每个订阅的日志水位：最大 sequence 与已剪枝位置（剪枝后仍保留）。
 */
@TableName("event_log_watermark")
public class EventLogWatermarkEntity {

    @TableId(type = IdType.INPUT)
    private String subscription;

    private Long lastSequence;

    private Long prunedUpTo;

    private Instant updatedAt;

    public String getSubscription() {
        return subscription;
    }

    public void setSubscription(String subscription) {
        this.subscription = subscription;
    }

    public Long getLastSequence() {
        return lastSequence;
    }

    public void setLastSequence(Long lastSequence) {
        this.lastSequence = lastSequence;
    }

    public Long getPrunedUpTo() {
        return prunedUpTo;
    }

    public void setPrunedUpTo(Long prunedUpTo) {
        this.prunedUpTo = prunedUpTo;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

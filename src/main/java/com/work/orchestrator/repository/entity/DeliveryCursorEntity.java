package com.work.orchestrator.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("delivery_cursor")
public class DeliveryCursorEntity {

    @TableId(type = IdType.INPUT)
    private String subscription;

    private Long ackedSequence;

    private Long epoch;

    private Instant updatedAt;

    public String getSubscription() {
        return subscription;
    }

    public void setSubscription(String subscription) {
        this.subscription = subscription;
    }

    public Long getAckedSequence() {
        return ackedSequence;
    }

    public void setAckedSequence(Long ackedSequence) {
        this.ackedSequence = ackedSequence;
    }

    public Long getEpoch() {
        return epoch;
    }

    public void setEpoch(Long epoch) {
        this.epoch = epoch;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

package com.work.orchestrator.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.orchestrator.repository.entity.EventLogWatermarkEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

public interface EventLogWatermarkMapper extends BaseMapper<EventLogWatermarkEntity> {

    @Select("SELECT subscription, last_sequence, pruned_up_to, updated_at FROM event_log_watermark WHERE subscription = #{subscription}")
    EventLogWatermarkEntity selectBySubscription(@Param("subscription") String subscription);

    @Select("SELECT subscription, last_sequence, pruned_up_to, updated_at FROM event_log_watermark WHERE subscription = #{subscription} FOR UPDATE")
    EventLogWatermarkEntity lockBySubscription(@Param("subscription") String subscription);

    @Insert("INSERT INTO event_log_watermark(subscription, last_sequence, pruned_up_to, updated_at) " +
            "VALUES(#{subscription}, 0, 0, #{updatedAt}) " +
            "ON CONFLICT(subscription) DO NOTHING")
    int insertIfNotExists(@Param("subscription") String subscription,
                          @Param("updatedAt") Instant updatedAt);

    @Update("UPDATE event_log_watermark SET last_sequence = #{lastSequence}, updated_at = #{updatedAt} " +
            "WHERE subscription = #{subscription} AND last_sequence = #{lastSequence} - 1")
    int advanceLastSequence(@Param("subscription") String subscription,
                            @Param("lastSequence") long lastSequence,
                            @Param("updatedAt") Instant updatedAt);

    /**
     * 剪枝位置不超过 last_sequence，且只前进不后退。
     */
    @Update("UPDATE event_log_watermark SET pruned_up_to = LEAST(#{upTo}, last_sequence), updated_at = #{updatedAt} " +
            "WHERE subscription = #{subscription} AND pruned_up_to < LEAST(#{upTo}, last_sequence)")
    int advancePrunedUpTo(@Param("subscription") String subscription,
                          @Param("upTo") long upTo,
                          @Param("updatedAt") Instant updatedAt);
}

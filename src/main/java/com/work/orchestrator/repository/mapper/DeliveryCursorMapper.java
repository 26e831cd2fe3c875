package com.work.orchestrator.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.orchestrator.repository.entity.DeliveryCursorEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

public interface DeliveryCursorMapper extends BaseMapper<DeliveryCursorEntity> {

    @Select("SELECT subscription, acked_sequence, epoch, updated_at FROM delivery_cursor WHERE subscription = #{subscription}")
    DeliveryCursorEntity selectBySubscription(@Param("subscription") String subscription);

    @Insert("INSERT INTO delivery_cursor(subscription, acked_sequence, epoch, updated_at) " +
            "VALUES(#{subscription}, 0, 0, #{updatedAt}) " +
            "ON CONFLICT(subscription) DO NOTHING")
    int insertIfNotExists(@Param("subscription") String subscription,
                          @Param("updatedAt") Instant updatedAt);

    @Update("UPDATE delivery_cursor SET epoch = epoch + 1, updated_at = #{updatedAt} WHERE subscription = #{subscription}")
    int incrementEpoch(@Param("subscription") String subscription,
                       @Param("updatedAt") Instant updatedAt);

    /**
     * fenced CAS：epoch 不匹配或游标不前进时影响 0 行。
     */
    @Update("UPDATE delivery_cursor SET acked_sequence = #{sequence}, updated_at = #{updatedAt} " +
            "WHERE subscription = #{subscription} AND epoch = #{epoch} AND acked_sequence < #{sequence}")
    int advanceFenced(@Param("subscription") String subscription,
                      @Param("epoch") long epoch,
                      @Param("sequence") long sequence,
                      @Param("updatedAt") Instant updatedAt);

    @Update("UPDATE delivery_cursor SET acked_sequence = #{ackedSequence}, epoch = epoch + 1, updated_at = #{updatedAt} " +
            "WHERE subscription = #{subscription}")
    int reset(@Param("subscription") String subscription,
              @Param("ackedSequence") long ackedSequence,
              @Param("updatedAt") Instant updatedAt);
}

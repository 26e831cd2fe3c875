package com.work.orchestrator.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.orchestrator.repository.entity.SequencedEventEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

public interface SequencedEventMapper extends BaseMapper<SequencedEventEntity> {

    @Insert("INSERT INTO sequenced_event(subscription, sequence, batch_timestamp, payload_ref, batch_id, submitter, tx_hash, additional_info, created_at) " +
            "VALUES(#{subscription}, #{sequence}, #{batchTimestamp}, #{payloadRef}, #{batchId}, #{submitter}, #{txHash}, #{additionalInfo}, #{createdAt}) " +
            "ON CONFLICT(subscription, sequence) DO NOTHING")
    int insertIfNotExists(@Param("subscription") String subscription,
                          @Param("sequence") long sequence,
                          @Param("batchTimestamp") long batchTimestamp,
                          @Param("payloadRef") String payloadRef,
                          @Param("batchId") String batchId,
                          @Param("submitter") String submitter,
                          @Param("txHash") String txHash,
                          @Param("additionalInfo") String additionalInfo,
                          @Param("createdAt") Instant createdAt);

    @Select("SELECT id, subscription, sequence, batch_timestamp, payload_ref, batch_id, submitter, tx_hash, additional_info, created_at " +
            "FROM sequenced_event " +
            "WHERE subscription = #{subscription} AND sequence > #{afterSequence} " +
            "ORDER BY sequence ASC " +
            "LIMIT #{limit}")
    List<SequencedEventEntity> selectAfter(@Param("subscription") String subscription,
                                           @Param("afterSequence") long afterSequence,
                                           @Param("limit") int limit);

    @Delete("DELETE FROM sequenced_event WHERE subscription = #{subscription} AND sequence <= #{upTo}")
    int deleteUpTo(@Param("subscription") String subscription,
                   @Param("upTo") long upTo);
}

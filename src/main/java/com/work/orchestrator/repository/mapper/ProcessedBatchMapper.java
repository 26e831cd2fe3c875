package com.work.orchestrator.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.orchestrator.repository.entity.ProcessedBatchEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;

public interface ProcessedBatchMapper extends BaseMapper<ProcessedBatchEntity> {

    @Select("SELECT COUNT(1) FROM processed_batch WHERE batch_id = #{batchId}")
    int countByBatchId(@Param("batchId") String batchId);

    @Insert("INSERT INTO processed_batch(batch_id, sequence, processed_at) " +
            "VALUES(#{batchId}, #{sequence}, #{processedAt}) " +
            "ON CONFLICT(batch_id) DO NOTHING")
    int insertIfNotExists(@Param("batchId") String batchId,
                          @Param("sequence") Long sequence,
                          @Param("processedAt") Instant processedAt);
}

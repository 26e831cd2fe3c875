package com.work.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.orchestrator.engine.broadcast.ProcessedBatchStore;
import com.work.orchestrator.eventstream.store.DeliveryCursorStore;
import com.work.orchestrator.eventstream.store.SequencedEventLog;
import com.work.orchestrator.repository.impl.PostgresDeliveryCursorStore;
import com.work.orchestrator.repository.impl.PostgresProcessedBatchStore;
import com.work.orchestrator.repository.impl.PostgresSequencedEventLog;
import com.work.orchestrator.repository.mapper.DeliveryCursorMapper;
import com.work.orchestrator.repository.mapper.EventLogWatermarkMapper;
import com.work.orchestrator.repository.mapper.ProcessedBatchMapper;
import com.work.orchestrator.repository.mapper.SequencedEventMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * orchestrator.store.mode=postgres：游标、事件日志、已处理 batch 落 PostgreSQL（MyBatis-Plus）。
 * 表结构见 schema.sql。
 */
@Configuration
@ConditionalOnProperty(prefix = "orchestrator.store", name = "mode", havingValue = "postgres")
@MapperScan("com.work.orchestrator.repository.mapper")
public class PostgresStoreConfiguration {

    @Bean
    public DeliveryCursorStore postgresDeliveryCursorStore(DeliveryCursorMapper mapper) {
        return new PostgresDeliveryCursorStore(mapper);
    }

    @Bean
    public SequencedEventLog postgresSequencedEventLog(SequencedEventMapper eventMapper,
                                                       EventLogWatermarkMapper watermarkMapper,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
        return new PostgresSequencedEventLog(eventMapper, watermarkMapper, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public ProcessedBatchStore postgresProcessedBatchStore(ProcessedBatchMapper mapper) {
        return new PostgresProcessedBatchStore(mapper);
    }
}

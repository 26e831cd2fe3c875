package com.work.orchestrator.repository.impl;

import com.work.orchestrator.blockchain.Bytes32;
import com.work.orchestrator.engine.broadcast.ProcessedBatchStore;
import com.work.orchestrator.repository.mapper.ProcessedBatchMapper;

import java.time.Instant;

import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

public class PostgresProcessedBatchStore implements ProcessedBatchStore {

    private final ProcessedBatchMapper mapper;

    public PostgresProcessedBatchStore(ProcessedBatchMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper");
    }

    @Override
    public boolean isProcessed(Bytes32 batchId) {
        requireNonNull(batchId, "batchId");
        return mapper.countByBatchId(batchId.toHex()) > 0;
    }

    @Override
    public boolean markProcessed(Bytes32 batchId, Long sequence) {
        requireNonNull(batchId, "batchId");
        return mapper.insertIfNotExists(batchId.toHex(), sequence, Instant.now()) == 1;
    }
}

package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.Bytes32;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存实现（默认）。
 */
public class InMemoryProcessedBatchStore implements ProcessedBatchStore {

    private static final Long UNKNOWN = -1L;

    private final Map<Bytes32, Long> processed = new ConcurrentHashMap<>();

    @Override
    public boolean isProcessed(Bytes32 batchId) {
        return processed.containsKey(batchId);
    }

    @Override
    public boolean markProcessed(Bytes32 batchId, Long sequence) {
        return processed.putIfAbsent(batchId, sequence == null ? UNKNOWN : sequence) == null;
    }

    public int size() {
        return processed.size();
    }
}

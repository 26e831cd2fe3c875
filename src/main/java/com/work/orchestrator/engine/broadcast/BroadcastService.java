package com.work.orchestrator.engine.broadcast;

import com.work.orchestrator.blockchain.BatchIds;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.HexUUID;
import com.work.orchestrator.engine.BlockchainOrchestrator;
import com.work.orchestrator.sharedstorage.SharedStoragePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * broadcast：payload 先上传到共享存储，再把 (timestamp, payloadRef, batchId) pin 到链上。
 */
public class BroadcastService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final SharedStoragePlugin sharedStorage;
    private final BlockchainOrchestrator<?> orchestrator;
    private final Clock clock;

    public BroadcastService(SharedStoragePlugin sharedStorage, BlockchainOrchestrator<?> orchestrator) {
        this(sharedStorage, orchestrator, Clock.systemUTC());
    }

    public BroadcastService(SharedStoragePlugin sharedStorage, BlockchainOrchestrator<?> orchestrator, Clock clock) {
        this.sharedStorage = requireNonNull(sharedStorage, "sharedStorage");
        this.orchestrator = requireNonNull(orchestrator, "orchestrator");
        this.clock = requireNonNull(clock, "clock");
    }

    public BroadcastReceipt broadcast(String identity, byte[] payload) {
        requireNonEmpty(identity, "identity");
        requireNonNull(payload, "payload");

        HexUUID payloadRef = sharedStorage.uploadData(payload);
        BroadcastBatch batch = BatchIds.newBatch(identity, payloadRef, clock.millis());
        String trackingId = orchestrator.submitBroadcastBatch(identity, batch);
        log.info("broadcast submitted identity={} storage={} payloadRef={} batchId={} trackingId={}",
                identity, sharedStorage.name(), payloadRef, batch.getBatchId(), trackingId);
        return new BroadcastReceipt(batch, trackingId);
    }

    /**
     * 取回一个已排序 batch 的 payload。
     */
    public byte[] fetchPayload(BroadcastBatch batch) {
        requireNonNull(batch, "batch");
        return sharedStorage.downloadData(requireNonNull(batch.getBatchPayloadRef(), "batchPayloadRef"));
    }
}

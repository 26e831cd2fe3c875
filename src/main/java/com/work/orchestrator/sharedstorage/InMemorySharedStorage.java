package com.work.orchestrator.sharedstorage;

import com.work.orchestrator.blockchain.HexUUID;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 进程内内容寻址存储，所有参与方共享同一个实例。
 */
public class InMemorySharedStorage implements SharedStoragePlugin {

    public static final String NAME = "memory";

    private final Map<HexUUID, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HexUUID uploadData(byte[] data) {
        requireNonNull(data, "data");
        HexUUID ref = HexUUID.fromContent(data);
        blobs.putIfAbsent(ref, Arrays.copyOf(data, data.length));
        return ref;
    }

    @Override
    public byte[] downloadData(HexUUID payloadRef) {
        requireNonNull(payloadRef, "payloadRef");
        byte[] data = blobs.get(payloadRef);
        if (data == null) {
            throw new SharedStorageException("payload not found: " + payloadRef);
        }
        return Arrays.copyOf(data, data.length);
    }

    public int size() {
        return blobs.size();
    }
}

package com.work.orchestrator.blockchain;

import org.web3j.crypto.Hash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * batchId 的确定性派生：keccak256(identity || payloadRef || timestamp)。
 *
 * 只依赖 pin 上可见的字段，任何观察到 pin 的参与方都能独立算出同一个值；
 * 同一个 batch 重提时 batchId 不变，链侧据此去重。
 */
public final class BatchIds {

    private BatchIds() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Bytes32 derive(String identity, HexUUID payloadRef, long timestamp) {
        requireNonEmpty(identity, "identity");
        requireNonNull(payloadRef, "payloadRef");

        byte[] id = identity.getBytes(StandardCharsets.UTF_8);
        UUID ref = payloadRef.toUUID();
        ByteBuffer buf = ByteBuffer.allocate(id.length + 16 + 8);
        buf.put(id);
        buf.putLong(ref.getMostSignificantBits());
        buf.putLong(ref.getLeastSignificantBits());
        buf.putLong(timestamp);
        return Bytes32.of(Hash.sha3(buf.array()));
    }

    public static BroadcastBatch newBatch(String identity, HexUUID payloadRef, long timestamp) {
        return new BroadcastBatch(timestamp, payloadRef, derive(identity, payloadRef, timestamp));
    }
}

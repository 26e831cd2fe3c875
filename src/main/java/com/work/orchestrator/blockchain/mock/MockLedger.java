package com.work.orchestrator.blockchain.mock;

import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Bytes32;
import com.work.orchestrator.blockchain.exception.BlockchainException;
import com.work.orchestrator.blockchain.exception.ConnectorUnavailableException;
import com.work.orchestrator.eventstream.EventStreamRuntime;
import com.work.orchestrator.eventstream.SequencedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 进程内模拟的区块链网络：所有参与方共享同一个实例。
 *
 * - pin 按到达顺序获得全局 sequence（从 1 开始），按 batchId 去重
 * - 每个新 pin 在锁内按顺序发布到所有已挂载的事件流运行时（每个参与方部署一个）
 * - available=false 模拟网络不可达；dropResponses=true 模拟“已上链但响应丢失”
 */
public class MockLedger {

    private static final Logger log = LoggerFactory.getLogger(MockLedger.class);

    public static final String INFO_NETWORK = "network";
    public static final String INFO_BLOCK_NUMBER = "blockNumber";

    private final String network;
    private final boolean globalSequencer;

    private final Object lock = new Object();
    private final List<LedgerPin> pins = new ArrayList<>();
    private final Map<Bytes32, LedgerPin> pinsByBatchId = new HashMap<>();
    private final Map<Bytes32, String> failingBatches = new ConcurrentHashMap<>();
    private final List<EventStreamRuntime> subscribers = new CopyOnWriteArrayList<>();

    private volatile boolean available = true;
    private volatile boolean dropResponses;
    private final AtomicInteger responsesToDrop = new AtomicInteger();

    public MockLedger(String network) {
        this(network, true);
    }

    public MockLedger(String network, boolean globalSequencer) {
        this.network = requireNonEmpty(network, "network");
        this.globalSequencer = globalSequencer;
    }

    public LedgerPin pin(String identity, BroadcastBatch batch) {
        requireNonEmpty(identity, "identity");
        requireNonNull(batch, "batch");
        if (!available) {
            throw new ConnectorUnavailableException("ledger " + network + " unreachable");
        }

        LedgerPin result;
        synchronized (lock) {
            LedgerPin existing = pinsByBatchId.get(batch.getBatchId());
            if (existing != null) {
                log.info("duplicate pin ignored network={} batchId={} sequence={}", network, batch.getBatchId(), existing.getSequence());
                result = existing.asDuplicate();
            } else {
                String reason = failingBatches.get(batch.getBatchId());
                if (reason != null) {
                    result = new LedgerPin(0L, identity, batch, txHash(batch.getBatchId(), 0L), reason, false);
                    log.info("pin rejected by ledger network={} batchId={} reason={}", network, batch.getBatchId(), reason);
                } else {
                    long sequence = pins.size() + 1L;
                    result = new LedgerPin(sequence, identity, batch, txHash(batch.getBatchId(), sequence), null, false);
                    pins.add(result);
                    pinsByBatchId.put(batch.getBatchId(), result);
                    log.info("batch pinned network={} sequence={} identity={} batchId={}", network, sequence, identity, batch.getBatchId());
                    for (EventStreamRuntime runtime : subscribers) {
                        publish(runtime, result);
                    }
                }
            }
        }

        if (dropResponses || responsesToDrop.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new ConnectorUnavailableException("ledger " + network + " response lost for batchId=" + batch.getBatchId());
        }
        return result;
    }

    /**
     * 挂载一个参与方的事件流运行时，并补发它尚未收到的 pin（生产侧重启后追平）。
     */
    public void attach(EventStreamRuntime runtime) {
        requireNonNull(runtime, "runtime");
        synchronized (lock) {
            long have = runtime.lastSequence();
            for (LedgerPin p : pins) {
                if (p.getSequence() > have) {
                    publish(runtime, p);
                }
            }
            subscribers.add(runtime);
        }
        log.info("event stream attached network={} subscription={}", network, runtime.getSubscription());
    }

    public void detach(EventStreamRuntime runtime) {
        subscribers.remove(runtime);
    }

    /**
     * 让指定 batch 的后续 pin 在链上失败（交易 revert）。
     */
    public void failBatch(Bytes32 batchId, String reason) {
        failingBatches.put(requireNonNull(batchId, "batchId"), requireNonEmpty(reason, "reason"));
    }

    public void clearFailure(Bytes32 batchId) {
        failingBatches.remove(batchId);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setDropResponses(boolean dropResponses) {
        this.dropResponses = dropResponses;
    }

    /**
     * 接下来 n 次 pin 正常上链但响应丢失。
     */
    public void dropNextResponses(int n) {
        responsesToDrop.set(Math.max(0, n));
    }

    public String getNetwork() {
        return network;
    }

    public boolean isGlobalSequencer() {
        return globalSequencer;
    }

    public List<LedgerPin> getPins() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(pins));
        }
    }

    public int pinCount() {
        synchronized (lock) {
            return pins.size();
        }
    }

    private void publish(EventStreamRuntime runtime, LedgerPin pin) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put(INFO_NETWORK, network);
        info.put(INFO_BLOCK_NUMBER, pin.getSequence());
        try {
            runtime.publish(new SequencedEvent(pin.getSequence(), pin.getBatch(), pin.getIdentity(), pin.getTxHash(), info));
        } catch (BlockchainException e) {
            // 运行时已自行进入 FAILED，其余参与方不受影响
            log.error("publish to event stream failed network={} subscription={} sequence={} err={}",
                    network, runtime.getSubscription(), pin.getSequence(), e.getMessage());
        }
    }

    private static String txHash(Bytes32 batchId, long sequence) {
        ByteBuffer buf = ByteBuffer.allocate(Bytes32.LENGTH + 8);
        buf.put(batchId.toBytes());
        buf.putLong(sequence);
        return Numeric.toHexString(Hash.sha3(buf.array()));
    }
}

package com.work.orchestrator.engine.tracker;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;
import static com.work.orchestrator.support.ValidationUtils.requirePositive;

/**
 * 交易状态跟踪：每个 trackingId 一个状态机，并发安全。
 *
 * - 终态只接受一次，后续终态更新记为协议违规并丢弃，不抛给 connector
 * - 没有超时驱动的状态迁移；长时间 SUBMITTED 只能通过 listSubmittedOlderThan 查出来
 * - track 之前就到达的更新先暂存（Caffeine，过期即丢），登记时按到达顺序补放
 * - 终态条目保留一段时间用于识别重复终态，之后淘汰；同名的新交易登记时替换它
 */
public class TransactionTracker {

    private static final Logger log = LoggerFactory.getLogger(TransactionTracker.class);

    private final OrchestratorMetrics metrics;
    private final Clock clock;

    private final Map<String, TrackedTransaction> active = new ConcurrentHashMap<>();
    private final Cache<String, TrackedTransaction> retired;
    private final Cache<String, List<PendingUpdate>> earlyUpdates;
    private final Object registrationLock = new Object();
    private final List<TransactionUpdateListener> listeners = new CopyOnWriteArrayList<>();

    public TransactionTracker(Duration terminalRetention,
                              Duration earlyUpdateRetention,
                              long maxRetained,
                              OrchestratorMetrics metrics) {
        this(terminalRetention, earlyUpdateRetention, maxRetained, metrics, Clock.systemUTC());
    }

    public TransactionTracker(Duration terminalRetention,
                              Duration earlyUpdateRetention,
                              long maxRetained,
                              OrchestratorMetrics metrics,
                              Clock clock) {
        requirePositive(terminalRetention, "terminalRetention");
        requirePositive(earlyUpdateRetention, "earlyUpdateRetention");
        this.metrics = requireNonNull(metrics, "metrics");
        this.clock = requireNonNull(clock, "clock");
        this.retired = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, maxRetained))
                .expireAfterWrite(terminalRetention)
                .build();
        this.earlyUpdates = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, maxRetained))
                .expireAfterWrite(earlyUpdateRetention)
                .build();
    }

    public void addListener(TransactionUpdateListener listener) {
        listeners.add(requireNonNull(listener, "listener"));
    }

    /**
     * 登记一个刚提交成功的交易，初始状态 SUBMITTED。
     *
     * trackingId 只在 connector 实例内唯一：与已终结条目重名时替换旧条目。
     *
     * @throws IllegalStateException trackingId 仍处于非终态（connector 违反了 trackingId 唯一性）
     */
    public TrackedTransaction track(String trackingId, String identity, BroadcastBatch batch) {
        requireNonEmpty(trackingId, "trackingId");
        List<PendingUpdate> early;
        TrackedTransaction tx;
        synchronized (registrationLock) {
            if (active.containsKey(trackingId)) {
                throw new IllegalStateException("trackingId already tracked: " + trackingId);
            }
            TrackedTransaction previous = retired.getIfPresent(trackingId);
            if (previous != null) {
                // connector 重启后 trackingId 会重新计数；已终结的旧条目让位给新交易
                retired.invalidate(trackingId);
                log.info("trackingId reused after terminal, replacing retired entry trackingId={} previousState={} previousBatchId={}",
                        trackingId, previous.getState(), previous.getBatch() == null ? null : previous.getBatch().getBatchId());
            }
            tx = new TrackedTransaction(trackingId, identity, batch, clock.instant());
            active.put(trackingId, tx);
            early = earlyUpdates.asMap().remove(trackingId);
        }
        log.debug("transaction tracked trackingId={} identity={} batchId={}",
                trackingId, identity, batch == null ? null : batch.getBatchId());
        if (early != null) {
            for (PendingUpdate u : early) {
                applyTo(tx, u.state, u.errorMessage, u.additionalInfo);
            }
        }
        return tx;
    }

    public UpdateOutcome applyUpdate(String trackingId, TransactionState state, String errorMessage, Map<String, Object> additionalInfo) {
        requireNonEmpty(trackingId, "trackingId");
        requireNonNull(state, "state");
        TrackedTransaction tx;
        synchronized (registrationLock) {
            tx = active.get(trackingId);
            if (tx == null) {
                TrackedTransaction done = retired.getIfPresent(trackingId);
                if (done != null) {
                    return rejectAfterTerminal(done, state);
                }
                earlyUpdates.asMap()
                        .computeIfAbsent(trackingId, k -> Collections.synchronizedList(new ArrayList<>()))
                        .add(new PendingUpdate(state, errorMessage, additionalInfo));
                metrics.transactionUpdate("buffered");
                log.debug("update for unregistered trackingId buffered trackingId={} state={}", trackingId, state);
                return UpdateOutcome.BUFFERED;
            }
        }
        return applyTo(tx, state, errorMessage, additionalInfo);
    }

    public Optional<TrackedTransaction> get(String trackingId) {
        TrackedTransaction tx = active.get(trackingId);
        if (tx == null) {
            tx = retired.getIfPresent(trackingId);
        }
        return Optional.ofNullable(tx);
    }

    /**
     * 终态时完成的 future。跟踪器不设超时，等待策略由调用方决定。
     *
     * @throws IllegalArgumentException trackingId 未登记或已淘汰
     */
    public CompletableFuture<TrackedTransaction> whenTerminal(String trackingId) {
        return get(trackingId)
                .map(TrackedTransaction::terminalFuture)
                .orElseThrow(() -> new IllegalArgumentException("unknown trackingId: " + trackingId));
    }

    /**
     * 查询提交时间早于 now-age 且仍处于 SUBMITTED 的交易，按提交时间升序。不会改变它们的状态。
     */
    public List<TrackedTransaction> listSubmittedOlderThan(Duration age) {
        requireNonNull(age, "age");
        Instant cutoff = clock.instant().minus(age);
        List<TrackedTransaction> out = new ArrayList<>();
        for (TrackedTransaction tx : active.values()) {
            if (tx.getState() == TransactionState.SUBMITTED && tx.getSubmittedAt().isBefore(cutoff)) {
                out.add(tx);
            }
        }
        out.sort(Comparator.comparing(TrackedTransaction::getSubmittedAt));
        return out;
    }

    public int activeCount() {
        return active.size();
    }

    private UpdateOutcome applyTo(TrackedTransaction tx, TransactionState state, String errorMessage, Map<String, Object> info) {
        UpdateOutcome outcome = tx.apply(state, errorMessage, info, clock.instant());
        if (outcome == UpdateOutcome.IGNORED_AFTER_TERMINAL) {
            return rejectAfterTerminal(tx, state);
        }
        if (!state.isTerminal()) {
            metrics.transactionUpdate(state.getWireValue());
            return outcome;
        }

        synchronized (registrationLock) {
            active.remove(tx.getTrackingId());
            retired.put(tx.getTrackingId(), tx);
        }
        metrics.transactionUpdate(state.getWireValue());
        log.info("transaction terminal trackingId={} state={} error={}", tx.getTrackingId(), state, tx.getErrorMessage());
        tx.completeTerminal();
        for (TransactionUpdateListener l : listeners) {
            l.onTerminal(tx);
        }
        return outcome;
    }

    private UpdateOutcome rejectAfterTerminal(TrackedTransaction tx, TransactionState attempted) {
        metrics.protocolViolation("update_after_terminal");
        log.warn("update after terminal state discarded trackingId={} current={} attempted={}",
                tx.getTrackingId(), tx.getState(), attempted);
        return UpdateOutcome.IGNORED_AFTER_TERMINAL;
    }

    private static final class PendingUpdate {
        private final TransactionState state;
        private final String errorMessage;
        private final Map<String, Object> additionalInfo;

        private PendingUpdate(TransactionState state, String errorMessage, Map<String, Object> additionalInfo) {
            this.state = state;
            this.errorMessage = errorMessage;
            this.additionalInfo = additionalInfo;
        }
    }
}

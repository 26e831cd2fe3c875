package com.work.orchestrator.blockchain.mock;

import com.work.orchestrator.blockchain.BlockchainConnector;
import com.work.orchestrator.blockchain.BlockchainEvents;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Capabilities;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.blockchain.exception.AlreadyInitializedException;
import com.work.orchestrator.blockchain.exception.ConfigurationInvalidException;
import com.work.orchestrator.blockchain.exception.ConnectorUnavailableException;
import com.work.orchestrator.blockchain.exception.SubmissionRejectedException;
import com.work.orchestrator.eventstream.EventStreamEndpoint;
import com.work.orchestrator.eventstream.ReconnectBackoff;
import com.work.orchestrator.eventstream.SequencedEventConsumer;
import com.work.orchestrator.support.NodeIdProvider;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.orchestrator.support.ValidationUtils.requireNonNull;
import static com.work.orchestrator.support.ValidationUtils.requirePositive;

/**
 * 基于 {@link MockLedger} 的进程内 connector，默认 profile 与测试使用。
 *
 * 提交：账本 pin 成功后立即返回 trackingId（tx-1, tx-2, ...），随后异步发出 SUBMITTED 与终态更新。
 * 排序事件：start() 之后通过事件流 endpoint 消费（standby/active 由生产侧决定），交给引擎 sink。
 */
public class MockBlockchainConnector implements BlockchainConnector<MockConnectorConfig> {

    private static final Logger log = LoggerFactory.getLogger(MockBlockchainConnector.class);

    public static final String NAME = "mock";

    static final Duration DEFAULT_CONFIRMATION_DELAY = Duration.ofMillis(50);
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);
    static final Duration DEFAULT_RECONNECT_INITIAL_DELAY = Duration.ofMillis(100);
    static final Duration DEFAULT_RECONNECT_MAX_DELAY = Duration.ofSeconds(5);
    static final double DEFAULT_RECONNECT_FACTOR = 2.0d;

    private final MockLedger ledger;
    private final EventStreamEndpoint endpoint;
    private final NodeIdProvider nodeIdProvider;
    private final OrchestratorMetrics metrics;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicLong trackingSeq = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile boolean closed;
    private volatile BlockchainEvents events;
    private volatile String memberId;
    private volatile Duration confirmationDelay;
    private volatile ScheduledExecutorService confirmer;
    private volatile SequencedEventConsumer consumer;

    public MockBlockchainConnector(MockLedger ledger,
                                   EventStreamEndpoint endpoint,
                                   NodeIdProvider nodeIdProvider,
                                   OrchestratorMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.endpoint = requireNonNull(endpoint, "endpoint");
        this.nodeIdProvider = requireNonNull(nodeIdProvider, "nodeIdProvider");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MockConnectorConfig configInterface() {
        return new MockConnectorConfig();
    }

    @Override
    public Capabilities init(MockConnectorConfig config, BlockchainEvents events) {
        requireNonNull(events, "events");
        if (!initialized.compareAndSet(false, true)) {
            throw new AlreadyInitializedException("connector " + NAME + " already initialized");
        }
        ReconnectBackoff backoff;
        Duration pollInterval;
        try {
            validate(config);
            this.memberId = config.getMemberId() != null && !config.getMemberId().trim().isEmpty()
                    ? config.getMemberId() : nodeIdProvider.getNodeId();
            this.confirmationDelay = orDefault(config.getConfirmationDelay(), DEFAULT_CONFIRMATION_DELAY);
            pollInterval = requirePositive(orDefault(config.getPollInterval(), DEFAULT_POLL_INTERVAL), "pollInterval");
            backoff = new ReconnectBackoff(
                    orDefault(config.getReconnectInitialDelay(), DEFAULT_RECONNECT_INITIAL_DELAY),
                    orDefault(config.getReconnectMaxDelay(), DEFAULT_RECONNECT_MAX_DELAY),
                    config.getReconnectFactor() == null ? DEFAULT_RECONNECT_FACTOR : config.getReconnectFactor());
        } catch (ConfigurationInvalidException e) {
            initialized.set(false);
            throw e;
        } catch (IllegalArgumentException e) {
            initialized.set(false);
            throw new ConfigurationInvalidException("invalid " + NAME + " connector config: " + e.getMessage(), e);
        }

        this.events = events;
        final String member = this.memberId;
        this.confirmer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("mock-confirmer-" + member);
            t.setDaemon(true);
            return t;
        });
        // 消费线程在 start() 里才启动：宿主拒绝该 connector 时不会有任何排序事件到达
        this.consumer = new SequencedEventConsumer(endpoint, member, events, backoff, pollInterval, metrics);

        Capabilities capabilities = new Capabilities(ledger.isGlobalSequencer());
        log.info("connector initialized type={} network={} member={} capabilities={}", NAME, ledger.getNetwork(), member, capabilities);
        return capabilities;
    }

    @Override
    public void start() {
        SequencedEventConsumer c = consumer;
        if (!initialized.get() || c == null) {
            throw new IllegalStateException("connector " + NAME + " not initialized");
        }
        if (closed) {
            throw new ConnectorUnavailableException("connector " + NAME + " closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        c.start();
        log.info("connector started type={} member={}", NAME, memberId);
    }

    @Override
    public String submitBroadcastBatch(String identity, BroadcastBatch batch) {
        if (!initialized.get() || events == null) {
            throw new IllegalStateException("connector " + NAME + " not initialized");
        }
        if (closed) {
            throw new ConnectorUnavailableException("connector " + NAME + " closed");
        }
        if (identity == null || identity.trim().isEmpty()) {
            metrics.submit("rejected");
            throw new SubmissionRejectedException("identity 不能为空");
        }
        if (batch == null || batch.getBatchId() == null || batch.getBatchPayloadRef() == null) {
            metrics.submit("rejected");
            throw new SubmissionRejectedException("batch/batchId/batchPayloadRef 不能为空");
        }

        LedgerPin pin;
        try {
            pin = ledger.pin(identity, batch);
        } catch (ConnectorUnavailableException e) {
            metrics.submit("unavailable");
            throw e;
        }

        String trackingId = "tx-" + trackingSeq.incrementAndGet();
        scheduleUpdates(trackingId, pin);
        metrics.submit("ok");
        log.info("batch submitted member={} trackingId={} batchId={} sequence={} duplicate={}",
                memberId, trackingId, batch.getBatchId(), pin.getSequence(), pin.isDuplicate());
        return trackingId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        SequencedEventConsumer c = consumer;
        if (c != null) {
            c.stop();
        }
        ScheduledExecutorService s = confirmer;
        if (s != null) {
            s.shutdown();
        }
        log.info("connector closed type={} member={}", NAME, memberId);
    }

    public String getMemberId() {
        return memberId;
    }

    public SequencedEventConsumer getConsumer() {
        return consumer;
    }

    private void scheduleUpdates(String trackingId, LedgerPin pin) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put(SequencedEventConsumer.INFO_TX_HASH, pin.getTxHash());
        if (!pin.isFailed()) {
            info.put(SequencedEventConsumer.INFO_SEQUENCE, pin.getSequence());
        }
        final Map<String, Object> additionalInfo = Collections.unmodifiableMap(info);

        confirmer.execute(() -> emit(trackingId, TransactionState.SUBMITTED, "", additionalInfo));
        if (pin.isFailed()) {
            confirmer.schedule(() -> emit(trackingId, TransactionState.FAILED, pin.getFailureReason(), additionalInfo),
                    confirmationDelay.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            confirmer.schedule(() -> emit(trackingId, TransactionState.CONFIRMED, "", additionalInfo),
                    confirmationDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void emit(String trackingId, TransactionState state, String errorMessage, Map<String, Object> info) {
        try {
            events.transactionUpdate(trackingId, state, errorMessage, info);
        } catch (RuntimeException e) {
            log.error("transaction update delivery failed trackingId={} state={}", trackingId, state, e);
        }
    }

    private void validate(MockConnectorConfig config) {
        if (config == null) {
            throw new ConfigurationInvalidException("connector " + NAME + " config missing");
        }
        if (config.getNetwork() == null || config.getNetwork().trim().isEmpty()) {
            throw new ConfigurationInvalidException("connector " + NAME + " config: network is required");
        }
        if (!ledger.getNetwork().equals(config.getNetwork())) {
            throw new ConfigurationInvalidException("connector " + NAME + " config: unknown network " + config.getNetwork());
        }
    }

    private static Duration orDefault(Duration value, Duration def) {
        if (value == null) {
            return def;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException("duration 不能为负数: " + value);
        }
        return value;
    }
}

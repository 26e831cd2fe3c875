package com.work.orchestrator.engine;

import com.work.orchestrator.blockchain.BlockchainConnector;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Capabilities;
import com.work.orchestrator.blockchain.exception.ConfigurationInvalidException;
import com.work.orchestrator.blockchain.exception.ConnectorUnavailableException;
import com.work.orchestrator.config.OrchestratorProperties;
import com.work.orchestrator.engine.broadcast.BroadcastBatchListener;
import com.work.orchestrator.engine.broadcast.BroadcastBatchProcessor;
import com.work.orchestrator.engine.tracker.TrackedTransaction;
import com.work.orchestrator.engine.tracker.TransactionTracker;
import com.work.orchestrator.engine.tracker.TransactionUpdateListener;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 引擎门面：持有一个 connector，负责初始化、提交（含有限重试）与事件路由。
 *
 * @param <C> connector 的配置类型
 */
public class BlockchainOrchestrator<C> {

    private static final Logger log = LoggerFactory.getLogger(BlockchainOrchestrator.class);

    private final BlockchainConnector<C> connector;
    private final ConnectorConfigBinder configBinder;
    private final OrchestratorProperties props;
    private final TransactionTracker tracker;
    private final BroadcastBatchProcessor batchProcessor;
    private final OrchestratorEventSink sink;
    private final OrchestratorMetrics metrics;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Capabilities capabilities;

    public BlockchainOrchestrator(BlockchainConnector<C> connector,
                                  ConnectorConfigBinder configBinder,
                                  OrchestratorProperties props,
                                  TransactionTracker tracker,
                                  BroadcastBatchProcessor batchProcessor,
                                  OrchestratorMetrics metrics) {
        this.connector = requireNonNull(connector, "connector");
        this.configBinder = requireNonNull(configBinder, "configBinder");
        this.props = requireNonNull(props, "props");
        this.tracker = requireNonNull(tracker, "tracker");
        this.batchProcessor = requireNonNull(batchProcessor, "batchProcessor");
        this.metrics = requireNonNull(metrics, "metrics");
        this.sink = new OrchestratorEventSink(tracker, batchProcessor, metrics);
    }

    /**
     * 绑定配置并初始化 connector。引擎要求全局排序而 connector 不支持时启动失败（不会带病运行）：
     * 此时 connector 只被 close，不会 start，应用层监听器收不到任何排序 batch。
     */
    public Capabilities start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("orchestrator already started");
        }
        C config = configBinder.bind(connector.configInterface());
        Capabilities caps;
        try {
            caps = connector.init(config, sink);
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        if (props.isRequireGlobalSequencer() && !caps.isGlobalSequencer()) {
            connector.close();
            started.set(false);
            log.error("connector does not provide a global sequencer, refusing to start connector={}", connector.name());
            throw new ConfigurationInvalidException("connector " + connector.name()
                    + " does not provide a global sequencer but orchestrator.require-global-sequencer=true");
        }
        try {
            connector.start();
        } catch (RuntimeException e) {
            connector.close();
            started.set(false);
            throw e;
        }
        this.capabilities = caps;
        log.info("orchestrator started connector={} capabilities={}", connector.name(), caps);
        return caps;
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        connector.close();
        log.info("orchestrator stopped connector={}", connector.name());
    }

    /**
     * 提交 batch 并登记 trackingId。只有 ConnectorUnavailable 会重试，重试始终使用同一个 batch
     * （链侧按 batchId 去重，重复提交不会产生第二个 pin）。
     */
    public String submitBroadcastBatch(String identity, BroadcastBatch batch) {
        requireNonEmpty(identity, "identity");
        requireNonNull(batch, "batch");
        if (capabilities == null) {
            throw new IllegalStateException("orchestrator not started");
        }

        int maxAttempts = Math.max(1, props.getSubmit().getMaxAttempts());
        String trackingId = null;
        for (int attempt = 1; trackingId == null; attempt++) {
            try {
                trackingId = connector.submitBroadcastBatch(identity, batch);
            } catch (ConnectorUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.warn("submit gave up identity={} batchId={} attempts={} err={}", identity, batch.getBatchId(), attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = backoff(attempt);
                log.warn("submit unavailable, retrying identity={} batchId={} attempt={} backoff={} err={}",
                        identity, batch.getBatchId(), attempt, backoff, e.getMessage());
                sleep(backoff, e);
            }
        }
        tracker.track(trackingId, identity, batch);
        return trackingId;
    }

    public CompletableFuture<TrackedTransaction> whenTerminal(String trackingId) {
        return tracker.whenTerminal(trackingId);
    }

    public void onTransactionTerminal(TransactionUpdateListener listener) {
        tracker.addListener(listener);
    }

    public void onBroadcastBatch(BroadcastBatchListener listener) {
        batchProcessor.addListener(listener);
    }

    public Capabilities getCapabilities() {
        return capabilities;
    }

    public TransactionTracker getTracker() {
        return tracker;
    }

    public BroadcastBatchProcessor getBatchProcessor() {
        return batchProcessor;
    }

    public BlockchainConnector<C> getConnector() {
        return connector;
    }

    private Duration backoff(int attempt) {
        long base = Math.max(1L, props.getSubmit().getInitialBackoff().toMillis());
        long max = Math.max(base, props.getSubmit().getMaxBackoff().toMillis());
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.min(max, base * pow));
    }

    private void sleep(Duration d, ConnectorUnavailableException cause) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ConnectorUnavailableException("submit retry interrupted", cause);
        }
    }
}

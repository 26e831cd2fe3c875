package com.work.orchestrator.config;

import com.work.orchestrator.blockchain.BlockchainConnector;
import com.work.orchestrator.engine.BlockchainOrchestrator;
import com.work.orchestrator.engine.ConnectorConfigBinder;
import com.work.orchestrator.engine.EnvironmentConnectorConfigBinder;
import com.work.orchestrator.engine.broadcast.BroadcastBatchProcessor;
import com.work.orchestrator.engine.broadcast.BroadcastService;
import com.work.orchestrator.engine.broadcast.InMemoryProcessedBatchStore;
import com.work.orchestrator.engine.broadcast.ProcessedBatchStore;
import com.work.orchestrator.engine.tracker.TransactionTracker;
import com.work.orchestrator.eventstream.store.DeliveryCursorStore;
import com.work.orchestrator.eventstream.store.InMemoryDeliveryCursorStore;
import com.work.orchestrator.eventstream.store.InMemorySequencedEventLog;
import com.work.orchestrator.eventstream.store.SequencedEventLog;
import com.work.orchestrator.sharedstorage.InMemorySharedStorage;
import com.work.orchestrator.sharedstorage.SharedStoragePlugin;
import com.work.orchestrator.support.NodeIdProvider;
import com.work.orchestrator.support.SimpleNodeIdProvider;
import com.work.orchestrator.support.metrics.NoopOrchestratorMetrics;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * 引擎核心装配：tracker、batch processor、引擎门面与默认的内存存储。
 * connector 由按 orchestrator.blockchain.type 生效的配置类提供。
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfiguration {

    @Bean
    public NodeIdProvider nodeIdProvider(OrchestratorProperties props) {
        return new SimpleNodeIdProvider(props.getNodeId());
    }

    @Bean
    @ConditionalOnMissingBean(OrchestratorMetrics.class)
    public OrchestratorMetrics orchestratorMetrics() {
        return new NoopOrchestratorMetrics();
    }

    // 存储：默认内存实现；orchestrator.store.mode=postgres 时由 PostgresStoreConfiguration 提供

    @Bean
    @ConditionalOnProperty(prefix = "orchestrator.store", name = "mode", havingValue = "memory", matchIfMissing = true)
    public DeliveryCursorStore inMemoryDeliveryCursorStore() {
        return new InMemoryDeliveryCursorStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "orchestrator.store", name = "mode", havingValue = "memory", matchIfMissing = true)
    public SequencedEventLog inMemorySequencedEventLog() {
        return new InMemorySequencedEventLog();
    }

    @Bean
    @ConditionalOnProperty(prefix = "orchestrator.store", name = "mode", havingValue = "memory", matchIfMissing = true)
    public ProcessedBatchStore inMemoryProcessedBatchStore() {
        return new InMemoryProcessedBatchStore();
    }

    @Bean
    @ConditionalOnMissingBean(SharedStoragePlugin.class)
    public SharedStoragePlugin sharedStoragePlugin() {
        return new InMemorySharedStorage();
    }

    @Bean
    public TransactionTracker transactionTracker(OrchestratorProperties props, OrchestratorMetrics metrics) {
        OrchestratorProperties.Tracker t = props.getTracker();
        return new TransactionTracker(t.getTerminalRetention(), t.getEarlyUpdateRetention(), t.getMaxRetained(), metrics);
    }

    @Bean
    public BroadcastBatchProcessor broadcastBatchProcessor(ProcessedBatchStore store, OrchestratorMetrics metrics) {
        return new BroadcastBatchProcessor(store, metrics);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectorConfigBinder.class)
    public ConnectorConfigBinder connectorConfigBinder(Environment environment) {
        return new EnvironmentConnectorConfigBinder(environment);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public BlockchainOrchestrator<?> blockchainOrchestrator(BlockchainConnector<?> connector,
                                                            ConnectorConfigBinder binder,
                                                            OrchestratorProperties props,
                                                            TransactionTracker tracker,
                                                            BroadcastBatchProcessor processor,
                                                            OrchestratorMetrics metrics) {
        return create(connector, binder, props, tracker, processor, metrics);
    }

    @Bean
    public BroadcastService broadcastService(SharedStoragePlugin sharedStorage, BlockchainOrchestrator<?> orchestrator) {
        return new BroadcastService(sharedStorage, orchestrator);
    }

    private static <C> BlockchainOrchestrator<C> create(BlockchainConnector<C> connector,
                                                        ConnectorConfigBinder binder,
                                                        OrchestratorProperties props,
                                                        TransactionTracker tracker,
                                                        BroadcastBatchProcessor processor,
                                                        OrchestratorMetrics metrics) {
        return new BlockchainOrchestrator<>(connector, binder, props, tracker, processor, metrics);
    }
}

package com.work.orchestrator.config;

import com.work.orchestrator.blockchain.BlockchainConnector;
import com.work.orchestrator.blockchain.mock.MockBlockchainConnector;
import com.work.orchestrator.blockchain.mock.MockLedger;
import com.work.orchestrator.eventstream.EventStreamRuntime;
import com.work.orchestrator.eventstream.store.DeliveryCursorStore;
import com.work.orchestrator.eventstream.store.SequencedEventLog;
import com.work.orchestrator.support.NodeIdProvider;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * orchestrator.blockchain.type=mock（默认）：进程内账本 + 本部署的事件流运行时 + mock connector。
 */
@Configuration
@ConditionalOnProperty(prefix = "orchestrator.blockchain", name = "type", havingValue = MockBlockchainConnector.NAME, matchIfMissing = true)
public class MockConnectorConfiguration {

    @Bean
    @ConditionalOnMissingBean(MockLedger.class)
    public MockLedger mockLedger(@Value("${orchestrator.blockchain.connector.network:local}") String network,
                                 @Value("${orchestrator.blockchain.mock.global-sequencer:true}") boolean globalSequencer) {
        return new MockLedger(network, globalSequencer);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public EventStreamRuntime eventStreamRuntime(OrchestratorProperties props,
                                                 SequencedEventLog eventLog,
                                                 DeliveryCursorStore cursorStore,
                                                 MockLedger ledger,
                                                 OrchestratorMetrics metrics) {
        EventStreamRuntime runtime = new EventStreamRuntime(props.getStream().getSubscription(), eventLog, cursorStore,
                props.getStream().getMaxInFlight(), metrics);
        ledger.attach(runtime);
        return runtime;
    }

    @Bean
    public BlockchainConnector<?> mockBlockchainConnector(MockLedger ledger,
                                                          EventStreamRuntime runtime,
                                                          NodeIdProvider nodeIdProvider,
                                                          OrchestratorMetrics metrics) {
        return new MockBlockchainConnector(ledger, runtime, nodeIdProvider, metrics);
    }
}

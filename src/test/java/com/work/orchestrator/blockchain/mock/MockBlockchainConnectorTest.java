package com.work.orchestrator.blockchain.mock;

import com.work.orchestrator.blockchain.BlockchainEvents;
import com.work.orchestrator.blockchain.BroadcastBatch;
import com.work.orchestrator.blockchain.Capabilities;
import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.blockchain.exception.AlreadyInitializedException;
import com.work.orchestrator.blockchain.exception.ConfigurationInvalidException;
import com.work.orchestrator.blockchain.exception.ConnectorUnavailableException;
import com.work.orchestrator.blockchain.exception.SubmissionRejectedException;
import com.work.orchestrator.eventstream.EventStreamRuntime;
import com.work.orchestrator.eventstream.SequencedEventConsumer;
import com.work.orchestrator.eventstream.store.InMemoryDeliveryCursorStore;
import com.work.orchestrator.eventstream.store.InMemorySequencedEventLog;
import com.work.orchestrator.support.SimpleNodeIdProvider;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;

import static com.work.orchestrator.testsupport.Batches.batch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class MockBlockchainConnectorTest {

    private static final String NETWORK = "net1";

    private MockLedger ledger;
    private EventStreamRuntime runtime;
    private OrchestratorMetrics metrics;
    private BlockchainEvents events;
    private MockBlockchainConnector connector;

    @BeforeEach
    public void setUp() {
        ledger = new MockLedger(NETWORK);
        metrics = mock(OrchestratorMetrics.class);
        runtime = new EventStreamRuntime("net1-org1", new InMemorySequencedEventLog(), new InMemoryDeliveryCursorStore(), 10, metrics);
        ledger.attach(runtime);
        runtime.start();
        events = mock(BlockchainEvents.class);
        connector = new MockBlockchainConnector(ledger, runtime, new SimpleNodeIdProvider("node-a"), metrics);
    }

    @AfterEach
    public void tearDown() {
        connector.close();
        runtime.shutdown();
    }

    @Test
    public void config_interface_is_an_empty_structure() {
        MockConnectorConfig cfg = connector.configInterface();
        assertNull(cfg.getNetwork());
        assertNull(cfg.getConfirmationDelay());
        assertEquals("mock", connector.name());
    }

    @Test
    public void init_reports_capabilities_and_defaults_member_to_node_id() {
        Capabilities caps = connector.init(config(), events);

        assertTrue(caps.isGlobalSequencer());
        assertEquals("node-a", connector.getMemberId());
        assertNotNull(connector.getConsumer());
        assertFalse(connector.getConsumer().isRunning());

        connector.start();
        assertTrue(connector.getConsumer().isRunning());
    }

    @Test
    public void sequenced_batches_wait_for_start() {
        ledger.pin("0xOrg2", batch("0xOrg2", 1));
        connector.init(config(), events);

        verify(events, after(300).never()).sequencedBroadcastBatch(any(BroadcastBatch.class), anyMap());
        assertNull(runtime.status().getActiveMember());

        connector.start();
        verify(events, timeout(3000)).sequencedBroadcastBatch(any(BroadcastBatch.class), anyMap());
    }

    @Test
    public void start_requires_init() {
        assertThrows(IllegalStateException.class, () -> connector.start());
    }

    @Test
    public void second_init_is_rejected() {
        connector.init(config(), events);

        assertThrows(AlreadyInitializedException.class, () -> connector.init(config(), events));
    }

    @Test
    public void missing_or_unknown_network_is_a_configuration_error() {
        assertThrows(ConfigurationInvalidException.class, () -> connector.init(new MockConnectorConfig(), events));

        MockConnectorConfig wrong = config();
        wrong.setNetwork("other");
        assertThrows(ConfigurationInvalidException.class, () -> connector.init(wrong, events));

        MockConnectorConfig badPoll = config();
        badPoll.setPollInterval(Duration.ZERO);
        assertThrows(ConfigurationInvalidException.class, () -> connector.init(badPoll, events));

        // 配置失败不占用初始化机会
        assertTrue(connector.init(config(), events).isGlobalSequencer());
    }

    @Test
    public void capabilities_follow_the_ledger() {
        MockLedger unordered = new MockLedger(NETWORK, false);
        MockBlockchainConnector c = new MockBlockchainConnector(unordered, runtime, new SimpleNodeIdProvider("node-b"), metrics);
        try {
            assertFalse(c.init(config(), events).isGlobalSequencer());
        } finally {
            c.close();
        }
    }

    @Test
    public void submit_before_init_is_illegal() {
        assertThrows(IllegalStateException.class, () -> connector.submitBroadcastBatch("0xOrg1", batch("0xOrg1", 1)));
    }

    @Test
    public void malformed_submission_is_rejected_without_pinning() {
        connector.init(config(), events);

        assertThrows(SubmissionRejectedException.class, () -> connector.submitBroadcastBatch(" ", batch("0xOrg1", 1)));
        assertThrows(SubmissionRejectedException.class, () -> connector.submitBroadcastBatch("0xOrg1", null));
        assertEquals(0, ledger.pinCount());
        verify(metrics, times(2)).submit(eq("rejected"));
    }

    @Test
    public void submissions_get_distinct_tracking_ids_and_confirm() {
        connector.init(config(), events);
        connector.start();
        BroadcastBatch b1 = batch("0xOrg1", 1);
        BroadcastBatch b2 = batch("0xOrg1", 2);

        assertEquals("tx-1", connector.submitBroadcastBatch("0xOrg1", b1));
        assertEquals("tx-2", connector.submitBroadcastBatch("0xOrg1", b2));

        verify(events, timeout(3000)).transactionUpdate(eq("tx-1"), eq(TransactionState.SUBMITTED), eq(""), anyMap());
        verify(events, timeout(3000)).transactionUpdate(eq("tx-1"), eq(TransactionState.CONFIRMED), eq(""), anyMap());
        verify(events, timeout(3000)).transactionUpdate(eq("tx-2"), eq(TransactionState.CONFIRMED), eq(""), anyMap());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> info = ArgumentCaptor.forClass(Map.class);
        verify(events, timeout(3000).times(2)).sequencedBroadcastBatch(any(BroadcastBatch.class), info.capture());
        assertEquals(1L, info.getAllValues().get(0).get(SequencedEventConsumer.INFO_SEQUENCE));
        assertEquals(2L, info.getAllValues().get(1).get(SequencedEventConsumer.INFO_SEQUENCE));
        assertEquals("0xOrg1", info.getAllValues().get(0).get(SequencedEventConsumer.INFO_SUBMITTER));
        assertEquals(NETWORK, info.getAllValues().get(0).get(MockLedger.INFO_NETWORK));
    }

    @Test
    public void reverted_pin_reports_failed_and_is_never_sequenced() {
        connector.init(config(), events);
        connector.start();
        BroadcastBatch b = batch("0xOrg1", 1);
        ledger.failBatch(b.getBatchId(), "execution reverted");

        String id = connector.submitBroadcastBatch("0xOrg1", b);

        verify(events, timeout(3000)).transactionUpdate(eq(id), eq(TransactionState.FAILED), eq("execution reverted"), anyMap());
        assertEquals(0, ledger.pinCount());
        verify(events, after(300).never()).sequencedBroadcastBatch(any(BroadcastBatch.class), anyMap());
    }

    @Test
    public void unreachable_ledger_is_retryable() {
        connector.init(config(), events);
        ledger.setAvailable(false);

        ConnectorUnavailableException e = assertThrows(ConnectorUnavailableException.class,
                () -> connector.submitBroadcastBatch("0xOrg1", batch("0xOrg1", 1)));
        assertTrue(e.isRetryable());
        verify(metrics).submit(eq("unavailable"));
    }

    @Test
    public void resubmitting_a_batch_after_a_lost_response_pins_once() {
        connector.init(config(), events);
        connector.start();
        BroadcastBatch b = batch("0xOrg1", 1);
        ledger.dropNextResponses(1);

        assertThrows(ConnectorUnavailableException.class, () -> connector.submitBroadcastBatch("0xOrg1", b));
        String id = connector.submitBroadcastBatch("0xOrg1", b);

        assertNotNull(id);
        assertEquals(1, ledger.pinCount());
        verify(events, timeout(3000).times(1)).sequencedBroadcastBatch(eq(b), anyMap());
        verify(events, after(300).times(1)).sequencedBroadcastBatch(any(BroadcastBatch.class), anyMap());
    }

    @Test
    public void closed_connector_refuses_submissions() {
        connector.init(config(), events);
        connector.start();
        connector.close();

        assertThrows(ConnectorUnavailableException.class, () -> connector.submitBroadcastBatch("0xOrg1", batch("0xOrg1", 1)));
        assertThrows(ConnectorUnavailableException.class, () -> connector.start());
        assertFalse(connector.getConsumer().isRunning());
    }

    private static MockConnectorConfig config() {
        MockConnectorConfig cfg = new MockConnectorConfig();
        cfg.setNetwork(NETWORK);
        cfg.setConfirmationDelay(Duration.ofMillis(20));
        cfg.setPollInterval(Duration.ofMillis(20));
        cfg.setReconnectInitialDelay(Duration.ofMillis(10));
        cfg.setReconnectMaxDelay(Duration.ofMillis(50));
        return cfg;
    }
}

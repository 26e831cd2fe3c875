package com.work.orchestrator.engine.tracker;

import com.work.orchestrator.blockchain.TransactionState;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import com.work.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.work.orchestrator.testsupport.Batches.batch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class TransactionTrackerTest {

    private MutableClock clock;
    private OrchestratorMetrics metrics;
    private TransactionTracker tracker;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        metrics = mock(OrchestratorMetrics.class);
        tracker = new TransactionTracker(Duration.ofMinutes(10), Duration.ofMinutes(1), 1000, metrics, clock);
    }

    @Test
    public void tracked_transaction_starts_submitted() {
        TrackedTransaction tx = tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));

        assertEquals(TransactionState.SUBMITTED, tx.getState());
        assertFalse(tx.isTerminal());
        assertEquals(1, tracker.activeCount());
        assertTrue(tracker.get("tx-1").isPresent());
    }

    @Test
    public void submitted_update_is_informational_and_confirm_is_terminal() {
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));

        assertEquals(UpdateOutcome.APPLIED, tracker.applyUpdate("tx-1", TransactionState.SUBMITTED, "",
                Collections.<String, Object>singletonMap("txHash", "0xabc")));
        assertEquals(TransactionState.SUBMITTED, tracker.get("tx-1").get().getState());

        assertEquals(UpdateOutcome.APPLIED, tracker.applyUpdate("tx-1", TransactionState.CONFIRMED, "", null));
        TrackedTransaction tx = tracker.get("tx-1").get();
        assertEquals(TransactionState.CONFIRMED, tx.getState());
        assertEquals("0xabc", tx.getAdditionalInfo().get("txHash"));
        assertEquals(0, tracker.activeCount());
    }

    @Test
    public void first_terminal_state_wins() {
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));
        tracker.applyUpdate("tx-1", TransactionState.FAILED, "execution reverted", null);

        assertEquals(UpdateOutcome.IGNORED_AFTER_TERMINAL, tracker.applyUpdate("tx-1", TransactionState.CONFIRMED, "", null));
        assertEquals(UpdateOutcome.IGNORED_AFTER_TERMINAL, tracker.applyUpdate("tx-1", TransactionState.SUBMITTED, "", null));

        TrackedTransaction tx = tracker.get("tx-1").get();
        assertEquals(TransactionState.FAILED, tx.getState());
        assertEquals("execution reverted", tx.getErrorMessage());
        verify(metrics, times(2)).protocolViolation(eq("update_after_terminal"));
    }

    @Test
    public void terminal_future_and_listeners_fire_once() throws Exception {
        TransactionUpdateListener listener = mock(TransactionUpdateListener.class);
        tracker.addListener(listener);
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));
        CompletableFuture<TrackedTransaction> done = tracker.whenTerminal("tx-1");
        assertFalse(done.isDone());

        tracker.applyUpdate("tx-1", TransactionState.CONFIRMED, "", null);
        tracker.applyUpdate("tx-1", TransactionState.CONFIRMED, "", null);

        assertTrue(done.isDone());
        assertEquals(TransactionState.CONFIRMED, done.get().getState());
        verify(listener, times(1)).onTerminal(any(TrackedTransaction.class));
    }

    @Test
    public void update_arriving_before_track_is_replayed_on_registration() {
        assertEquals(UpdateOutcome.BUFFERED, tracker.applyUpdate("tx-9", TransactionState.CONFIRMED, "", null));
        verify(metrics).transactionUpdate(eq("buffered"));

        TrackedTransaction tx = tracker.track("tx-9", "0xOrg1", batch("0xOrg1", 9));

        assertEquals(TransactionState.CONFIRMED, tx.getState());
        assertTrue(tx.terminalFuture().isDone());
    }

    @Test
    public void duplicate_tracking_id_is_refused_while_in_flight() {
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));

        assertThrows(IllegalStateException.class, () -> tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 2)));
    }

    @Test
    public void tracking_id_reused_after_connector_restart_replaces_retired_entry() throws Exception {
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));
        tracker.applyUpdate("tx-1", TransactionState.FAILED, "execution reverted", null);

        TrackedTransaction reused = tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 2));

        assertEquals(TransactionState.SUBMITTED, reused.getState());
        assertEquals(batch("0xOrg1", 2), tracker.get("tx-1").get().getBatch());
        assertEquals(UpdateOutcome.APPLIED, tracker.applyUpdate("tx-1", TransactionState.CONFIRMED, "", null));
        assertEquals(TransactionState.CONFIRMED, tracker.whenTerminal("tx-1").get().getState());
        verify(metrics, never()).protocolViolation(eq("update_after_terminal"));
    }

    @Test
    public void unknown_tracking_id_has_no_future() {
        assertFalse(tracker.get("nope").isPresent());
        assertThrows(IllegalArgumentException.class, () -> tracker.whenTerminal("nope"));
    }

    @Test
    public void stuck_submissions_are_listed_but_never_timed_out() {
        tracker.track("tx-1", "0xOrg1", batch("0xOrg1", 1));
        clock.advance(Duration.ofMinutes(5));
        tracker.track("tx-2", "0xOrg1", batch("0xOrg1", 2));
        tracker.track("tx-3", "0xOrg1", batch("0xOrg1", 3));
        tracker.applyUpdate("tx-3", TransactionState.CONFIRMED, "", null);
        clock.advance(Duration.ofMinutes(2));

        List<TrackedTransaction> old = tracker.listSubmittedOlderThan(Duration.ofMinutes(1));
        assertEquals(2, old.size());
        assertEquals("tx-1", old.get(0).getTrackingId());
        assertEquals("tx-2", old.get(1).getTrackingId());

        assertEquals(1, tracker.listSubmittedOlderThan(Duration.ofMinutes(3)).size());
        assertEquals(TransactionState.SUBMITTED, tracker.get("tx-1").get().getState());
    }
}

package com.work.orchestrator.blockchain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionStateTest {

    @Test
    public void failed_travels_as_error_on_the_wire() {
        assertEquals("submitted", TransactionState.SUBMITTED.getWireValue());
        assertEquals("confirmed", TransactionState.CONFIRMED.getWireValue());
        assertEquals("error", TransactionState.FAILED.getWireValue());
        assertSame(TransactionState.FAILED, TransactionState.fromWireValue("error"));
        assertThrows(IllegalArgumentException.class, () -> TransactionState.fromWireValue("pending"));
    }

    @Test
    public void only_submitted_is_non_terminal() {
        assertFalse(TransactionState.SUBMITTED.isTerminal());
        assertTrue(TransactionState.CONFIRMED.isTerminal());
        assertTrue(TransactionState.FAILED.isTerminal());
    }
}

package com.work.orchestrator.engine.broadcast;

public enum BatchOutcome {
    PROCESSED,
    DUPLICATE
}

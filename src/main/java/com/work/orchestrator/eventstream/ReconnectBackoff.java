package com.work.orchestrator.eventstream;

import java.time.Duration;

import static com.work.orchestrator.support.ValidationUtils.requirePositive;

/**
 * 有界指数退避：delay = min(max, initial * factor^(attempt-1))。
 */
public class ReconnectBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double factor;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay, double factor) {
        this.initialDelay = requirePositive(initialDelay, "initialDelay");
        this.maxDelay = requirePositive(maxDelay, "maxDelay");
        if (factor < 1.0d) {
            throw new IllegalArgumentException("factor 不能小于1");
        }
        this.factor = factor;
    }

    public Duration delayFor(int attempt) {
        int n = Math.max(1, attempt);
        double ms = initialDelay.toMillis() * Math.pow(factor, Math.min(30, n - 1));
        long capped = (long) Math.min((double) maxDelay.toMillis(), ms);
        return Duration.ofMillis(Math.max(1L, capped));
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getFactor() {
        return factor;
    }
}

package com.work.orchestrator.blockchain.exception;

/**
 * 持久化游标丢失或检测到序列不连续。致命错误：必须显式重新同步，不能静默跳过。
 */
public class SequenceGapException extends BlockchainException {

    private final String subscription;
    private final long expectedSequence;
    private final long availableSequence;

    public SequenceGapException(String subscription, long expectedSequence, long availableSequence) {
        super("sequence gap on subscription=" + subscription
                + " expected=" + expectedSequence + " available=" + availableSequence);
        this.subscription = subscription;
        this.expectedSequence = expectedSequence;
        this.availableSequence = availableSequence;
    }

    public String getSubscription() {
        return subscription;
    }

    public long getExpectedSequence() {
        return expectedSequence;
    }

    public long getAvailableSequence() {
        return availableSequence;
    }
}

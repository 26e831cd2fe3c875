package com.work.orchestrator.blockchain.exception;

/**
 * 底层网络/后端暂时不可用。调用方可用完全相同的输入重试。
 */
public class ConnectorUnavailableException extends BlockchainException {

    public ConnectorUnavailableException(String message) {
        super(message);
    }

    public ConnectorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

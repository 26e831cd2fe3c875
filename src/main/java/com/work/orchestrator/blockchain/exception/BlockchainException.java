package com.work.orchestrator.blockchain.exception;

/**
 * connector 契约与事件流的统一异常类型，便于调用方捕获或转换为错误码。
 */
public class BlockchainException extends RuntimeException {

    public BlockchainException(String message) {
        super(message);
    }

    public BlockchainException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可以用相同输入重试解决。默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}

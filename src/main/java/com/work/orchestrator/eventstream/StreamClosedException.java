package com.work.orchestrator.eventstream;

import com.work.orchestrator.blockchain.exception.BlockchainException;

/**
 * 连接已关闭。cause 为 null 表示计划内关闭（主动 close / 运行时停止）。
 */
public class StreamClosedException extends BlockchainException {

    private final boolean planned;

    public StreamClosedException(String message, Throwable cause) {
        super(message, cause);
        this.planned = cause == null;
    }

    public boolean isPlanned() {
        return planned;
    }
}

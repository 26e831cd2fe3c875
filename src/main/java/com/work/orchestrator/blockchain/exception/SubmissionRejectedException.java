package com.work.orchestrator.blockchain.exception;

/**
 * batch 输入不合法（如缺少 batchId），不可重试。
 */
public class SubmissionRejectedException extends BlockchainException {

    public SubmissionRejectedException(String message) {
        super(message);
    }
}

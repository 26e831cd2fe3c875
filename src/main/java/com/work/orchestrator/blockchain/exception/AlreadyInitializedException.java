package com.work.orchestrator.blockchain.exception;

/**
 * 同一个 connector 实例被 init 了两次（编程错误）。
 */
public class AlreadyInitializedException extends BlockchainException {

    public AlreadyInitializedException(String message) {
        super(message);
    }
}

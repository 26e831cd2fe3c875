package com.work.orchestrator.blockchain.exception;

/**
 * init 时配置与 connector 声明的结构不匹配，或能力不满足引擎要求。
 */
public class ConfigurationInvalidException extends BlockchainException {

    public ConfigurationInvalidException(String message) {
        super(message);
    }

    public ConfigurationInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}

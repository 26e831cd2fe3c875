package com.work.orchestrator.blockchain;

/**
 * 引擎对链上交易唯一关心的状态。其余协议细节（gas、区块号、receipt hash 等）都放在 additionalInfo 里，不做解析。
 */
public enum TransactionState {

    SUBMITTED("submitted"),

    /**
     * 按该链的规则已终局。
     */
    CONFIRMED("confirmed"),

    /**
     * 出错且大概率不会终局（但不排除之后仍被打包）。
     */
    FAILED("error");

    private final String wireValue;

    TransactionState(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != SUBMITTED;
    }

    public static TransactionState fromWireValue(String value) {
        for (TransactionState s : values()) {
            if (s.wireValue.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown transaction state: " + value);
    }
}

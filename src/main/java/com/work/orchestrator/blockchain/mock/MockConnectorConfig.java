package com.work.orchestrator.blockchain.mock;

import java.time.Duration;

/**
 * mock connector 的配置结构。由 configInterface() 返回空值实例，宿主绑定
 * orchestrator.blockchain.connector.* 后传回 init；未设置的可选项在 init 时取默认值。
 */
public class MockConnectorConfig {

    /**
     * 要连接的网络名，必须与账本一致。必填。
     */
    private String network;

    /**
     * 事件流连接使用的成员 ID，不填则取节点 ID。
     */
    private String memberId;

    /**
     * 提交成功到发出终态更新的延迟。
     */
    private Duration confirmationDelay;

    private Duration pollInterval;

    /**
     * 事件流重连退避。
     */
    private Duration reconnectInitialDelay;
    private Duration reconnectMaxDelay;
    private Double reconnectFactor;

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }

    public Duration getConfirmationDelay() {
        return confirmationDelay;
    }

    public void setConfirmationDelay(Duration confirmationDelay) {
        this.confirmationDelay = confirmationDelay;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getReconnectInitialDelay() {
        return reconnectInitialDelay;
    }

    public void setReconnectInitialDelay(Duration reconnectInitialDelay) {
        this.reconnectInitialDelay = reconnectInitialDelay;
    }

    public Duration getReconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public void setReconnectMaxDelay(Duration reconnectMaxDelay) {
        this.reconnectMaxDelay = reconnectMaxDelay;
    }

    public Double getReconnectFactor() {
        return reconnectFactor;
    }

    public void setReconnectFactor(Double reconnectFactor) {
        this.reconnectFactor = reconnectFactor;
    }
}

package com.work.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 编排引擎配置项（orchestrator.*）。
 *
 * connector 自己的配置在 orchestrator.blockchain.connector.* 下，由 connector 的 configInterface() 描述，
 * 这里不重复声明。
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /**
     * 引擎是否依赖链提供的全局排序。为 true 时 connector 不具备该能力则启动失败。
     */
    private boolean requireGlobalSequencer = true;

    /**
     * 节点 ID（事件流成员 ID 的默认值），不填则由主机名生成。
     */
    private String nodeId;

    @Valid
    private Blockchain blockchain = new Blockchain();

    @Valid
    private Submit submit = new Submit();

    @Valid
    private Tracker tracker = new Tracker();

    @Valid
    private Stream stream = new Stream();

    @Valid
    private Store store = new Store();

    public static class Blockchain {

        /**
         * connector 类型，按类型装配具体实现。
         */
        @NotBlank
        private String type = "mock";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Submit {

        /**
         * 提交的最大尝试次数（只有 ConnectorUnavailable 会重试，且始终使用同一个 batch）。
         */
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Tracker {

        /**
         * 终态条目保留时长（用于识别重复终态）。
         */
        @NotNull
        private Duration terminalRetention = Duration.ofMinutes(10);

        /**
         * 未登记 trackingId 的提前更新暂存时长。
         */
        @NotNull
        private Duration earlyUpdateRetention = Duration.ofMinutes(1);

        @Min(1)
        private long maxRetained = 100_000L;

        public Duration getTerminalRetention() {
            return terminalRetention;
        }

        public void setTerminalRetention(Duration terminalRetention) {
            this.terminalRetention = terminalRetention;
        }

        public Duration getEarlyUpdateRetention() {
            return earlyUpdateRetention;
        }

        public void setEarlyUpdateRetention(Duration earlyUpdateRetention) {
            this.earlyUpdateRetention = earlyUpdateRetention;
        }

        public long getMaxRetained() {
            return maxRetained;
        }

        public void setMaxRetained(long maxRetained) {
            this.maxRetained = maxRetained;
        }
    }

    public static class Stream {

        /**
         * 本部署在该网络上的订阅名（持久化游标的 key）。
         */
        @NotBlank
        private String subscription = "default";

        /**
         * active 连接上未确认事件的上限。
         */
        @Min(1)
        private int maxInFlight = 50;

        public String getSubscription() {
            return subscription;
        }

        public void setSubscription(String subscription) {
            this.subscription = subscription;
        }

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }
    }

    public static class Store {

        /**
         * memory | postgres
         */
        @NotBlank
        private String mode = "memory";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public boolean isRequireGlobalSequencer() {
        return requireGlobalSequencer;
    }

    public void setRequireGlobalSequencer(boolean requireGlobalSequencer) {
        this.requireGlobalSequencer = requireGlobalSequencer;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Blockchain getBlockchain() {
        return blockchain;
    }

    public void setBlockchain(Blockchain blockchain) {
        this.blockchain = blockchain;
    }

    public Submit getSubmit() {
        return submit;
    }

    public void setSubmit(Submit submit) {
        this.submit = submit;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public void setTracker(Tracker tracker) {
        this.tracker = tracker;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }
}

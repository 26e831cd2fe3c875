package com.work.orchestrator.eventstream;

import com.work.orchestrator.blockchain.BlockchainEvents;
import com.work.orchestrator.blockchain.exception.BlockchainException;
import com.work.orchestrator.blockchain.exception.SequenceGapException;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;
import static com.work.orchestrator.support.ValidationUtils.requirePositive;

/**
 * 集群成员侧的事件流消费循环（每个 connector 实例一个线程）。
 *
 * - 连接断开后按有界指数退避重连；standby 时阻塞等待，被选为 active 后才会收到事件
 * - 每个事件先交给引擎 sink，sink 返回后才 ack；sink 抛异常则不 ack，关闭连接迫使重放
 * - 小于等于已分发 sequence 的事件（重放的重复项）直接 ack，不再分发
 * - 同一连接上 sequence 不连续视为协议违规，关闭连接由生产侧从游标重放
 */
public class SequencedEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(SequencedEventConsumer.class);

    public static final String INFO_SEQUENCE = "sequence";
    public static final String INFO_TX_HASH = "txHash";
    public static final String INFO_SUBMITTER = "submitter";

    private final EventStreamEndpoint endpoint;
    private final String memberId;
    private final BlockchainEvents sink;
    private final ReconnectBackoff backoff;
    private final Duration pollInterval;
    private final OrchestratorMetrics metrics;

    private volatile boolean running;
    private volatile Thread worker;
    private volatile StreamConnection current;
    private volatile Throwable lastError;
    private volatile long lastDispatched;

    public SequencedEventConsumer(EventStreamEndpoint endpoint,
                                  String memberId,
                                  BlockchainEvents sink,
                                  ReconnectBackoff backoff,
                                  Duration pollInterval,
                                  OrchestratorMetrics metrics) {
        this.endpoint = requireNonNull(endpoint, "endpoint");
        this.memberId = requireNonEmpty(memberId, "memberId");
        this.sink = requireNonNull(sink, "sink");
        this.backoff = requireNonNull(backoff, "backoff");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("consumer already started, member=" + memberId);
        }
        running = true;
        Thread t = new Thread(this::runLoop, "stream-consumer-" + memberId);
        t.setDaemon(true);
        worker = t;
        t.start();
    }

    /**
     * 计划内停止：关闭当前连接（生产侧走 fail-over 交给其他成员），然后结束循环。
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        StreamConnection c = current;
        if (c != null) {
            c.close();
        }
        Thread t = worker;
        if (t != null) {
            t.interrupt();
            try {
                t.join(1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("stream consumer stopped member={} lastDispatched={}", memberId, lastDispatched);
    }

    public String getMemberId() {
        return memberId;
    }

    public boolean isRunning() {
        return running;
    }

    public long getLastDispatched() {
        return lastDispatched;
    }

    public Throwable getLastError() {
        return lastError;
    }

    public StreamConnection getCurrentConnection() {
        return current;
    }

    private void runLoop() {
        int attempt = 0;
        while (running) {
            if (attempt > 0) {
                metrics.streamReconnect(memberId, attempt);
                if (!sleep(backoff.delayFor(attempt))) {
                    return;
                }
            }
            attempt++;

            StreamConnection conn;
            try {
                conn = endpoint.connect(memberId);
            } catch (SequenceGapException gap) {
                lastError = gap;
                log.error("event stream refused connection, resynchronize required member={} attempt={} err={}",
                        memberId, attempt, gap.getMessage());
                continue;
            } catch (BlockchainException e) {
                lastError = e;
                log.warn("event stream connect failed member={} attempt={} err={}", memberId, attempt, e.getMessage());
                continue;
            }

            current = conn;
            try {
                if (consume(conn)) {
                    attempt = 0;
                }
            } catch (StreamClosedException closed) {
                if (closed.isPlanned()) {
                    log.info("stream connection closed by producer member={} conn={}", memberId, conn.getId());
                } else {
                    lastError = closed.getCause();
                    log.warn("stream connection closed member={} conn={} cause={}",
                            memberId, conn.getId(), String.valueOf(closed.getCause()));
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                conn.close();
                return;
            } catch (RuntimeException e) {
                // sink 失败：不 ack，断开后由生产侧重放
                lastError = e;
                log.warn("event dispatch failed, reconnecting for redelivery member={} conn={}", memberId, conn.getId(), e);
                conn.close();
            } finally {
                current = null;
            }
        }
    }

    /**
     * 消费一条连接直到关闭或停止。
     *
     * @return true 表示本连接上至少成功分发过一个事件
     */
    private boolean consume(StreamConnection conn) throws InterruptedException {
        boolean progressed = false;
        long lastOnConnection = -1L;
        while (running) {
            SequencedEvent e = conn.next(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            if (e == null) {
                continue;
            }
            long seq = e.getSequence();
            if (lastOnConnection >= 0 && seq != lastOnConnection + 1L) {
                metrics.protocolViolation("out_of_order");
                log.warn("non-contiguous event on stream connection, reconnecting member={} conn={} expected={} got={}",
                        memberId, conn.getId(), lastOnConnection + 1L, seq);
                conn.close();
                return progressed;
            }
            lastOnConnection = seq;

            if (seq > lastDispatched) {
                sink.sequencedBroadcastBatch(e.getBatch(), dispatchInfo(e));
                lastDispatched = seq;
                progressed = true;
            } else {
                log.debug("replayed event acked without dispatch member={} seq={}", memberId, seq);
            }

            if (!conn.ack(seq)) {
                log.warn("ack rejected, reconnecting member={} conn={} seq={}", memberId, conn.getId(), seq);
                conn.close();
                return progressed;
            }
        }
        return progressed;
    }

    private static Map<String, Object> dispatchInfo(SequencedEvent e) {
        Map<String, Object> info = new LinkedHashMap<>(e.getAdditionalInfo());
        info.put(INFO_SEQUENCE, e.getSequence());
        if (e.getTxHash() != null) {
            info.put(INFO_TX_HASH, e.getTxHash());
        }
        if (e.getSubmitter() != null) {
            info.put(INFO_SUBMITTER, e.getSubmitter());
        }
        return info;
    }

    private boolean sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.work.orchestrator.eventstream;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 集群成员到事件流运行时的一条连接。
 *
 * 运行时同一时刻只把一条连接设为 active 并向其 inbox 投递；其余连接处于 standby。
 * inbox 是有界队列，容量等于在途窗口，消费慢时投递方停止推送（背压）。
 */
public class StreamConnection implements AutoCloseable {

    private static final long POLL_SLICE_MS = 50L;

    private final long id;
    private final String memberId;
    private final EventStreamRuntime runtime;
    private final BlockingQueue<SequencedEvent> inbox;

    /**
     * 0 表示 standby；激活后为运行时分配的 epoch。
     */
    private volatile long epoch;
    private volatile boolean closed;
    private volatile Throwable closeCause;

    StreamConnection(long id, String memberId, EventStreamRuntime runtime, int capacity) {
        this.id = id;
        this.memberId = memberId;
        this.runtime = runtime;
        this.inbox = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /**
     * 取下一条事件，超时返回 null。
     *
     * @throws StreamClosedException 连接已关闭（未确认的事件会在下一条 active 连接上重放）
     */
    public SequencedEvent next(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            if (closed) {
                throw new StreamClosedException("stream connection " + id + " closed", closeCause);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_SLICE_MS));
            SequencedEvent e = inbox.poll(slice, TimeUnit.NANOSECONDS);
            if (e != null) {
                return e;
            }
        }
    }

    /**
     * 累积确认：确认 sequence 及之前的所有事件。
     *
     * @return false 表示被拒绝（连接已被取代、超出已投递范围等）
     */
    public boolean ack(long sequence) {
        return runtime.acknowledge(this, sequence);
    }

    /**
     * 计划内关闭：与断线走同一条 fail-over 路径。
     */
    @Override
    public void close() {
        runtime.disconnect(this, null);
    }

    public long getId() {
        return id;
    }

    public String getMemberId() {
        return memberId;
    }

    public long getEpoch() {
        return epoch;
    }

    public boolean isActive() {
        return !closed && epoch > 0;
    }

    public boolean isClosed() {
        return closed;
    }

    public Throwable getCloseCause() {
        return closeCause;
    }

    public int inboxDepth() {
        return inbox.size();
    }

    void activate(long epoch) {
        this.epoch = epoch;
    }

    boolean offer(SequencedEvent event) {
        return !closed && inbox.offer(event);
    }

    void markClosed(Throwable cause) {
        if (closed) {
            return;
        }
        this.closeCause = cause;
        this.closed = true;
        inbox.clear();
    }

    @Override
    public String toString() {
        return "StreamConnection{id=" + id + ", member=" + memberId + ", epoch=" + epoch + ", closed=" + closed + "}";
    }
}

package com.work.orchestrator.eventstream;

import com.work.orchestrator.blockchain.exception.ConnectorUnavailableException;
import com.work.orchestrator.blockchain.exception.SequenceGapException;
import com.work.orchestrator.eventstream.store.DeliveryCursor;
import com.work.orchestrator.eventstream.store.DeliveryCursorStore;
import com.work.orchestrator.eventstream.store.SequencedEventLog;
import com.work.orchestrator.support.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNegative;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 单个订阅（一个网络 × 一个部署）的事件流运行时，即排序事件的生产侧。
 *
 * 投递规则：
 * - 同一时刻最多一条 active 连接（先到先得，其余按 FIFO 排队 standby），选择权完全在这里，成员之间无需协调
 * - 每次激活 epoch+1（持久化，作为 fencing token），并从持久化游标之后重放全部事件：重放由确认状态驱动，与连接身份无关
 * - 消费方 ack 后游标以 fenced CAS 原子推进，然后剪枝日志；旧 epoch 的 ack 一律拒绝
 * - 没有 active 连接时新事件只追加到日志，等待下一次激活，顺序不变
 * - 激活时若游标之后的事件已被剪枝（游标丢失），进入 FAILED 并显式报出 SequenceGapException，直到 resynchronize
 */
public class EventStreamRuntime implements EventStreamEndpoint {

    private static final Logger log = LoggerFactory.getLogger(EventStreamRuntime.class);

    private static final long IDLE_WAIT_MS = 200L;

    private final String subscription;
    private final SequencedEventLog eventLog;
    private final DeliveryCursorStore cursorStore;
    private final int maxInFlight;
    private final OrchestratorMetrics metrics;

    private final Object monitor = new Object();
    private final Deque<StreamConnection> standby = new ArrayDeque<>();
    private final AtomicLong connectionIds = new AtomicLong();

    private StreamConnection active;
    private long activeEpoch;
    private long ackedSequence;
    private long lastDelivered;
    private StreamState state = StreamState.NEW;
    private SequenceGapException fatalError;
    private Thread dispatcher;

    public EventStreamRuntime(String subscription,
                              SequencedEventLog eventLog,
                              DeliveryCursorStore cursorStore,
                              int maxInFlight,
                              OrchestratorMetrics metrics) {
        this.subscription = requireNonEmpty(subscription, "subscription");
        this.eventLog = requireNonNull(eventLog, "eventLog");
        this.cursorStore = requireNonNull(cursorStore, "cursorStore");
        this.maxInFlight = Math.max(1, maxInFlight);
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public void start() {
        synchronized (monitor) {
            if (state != StreamState.NEW) {
                throw new IllegalStateException("event stream " + subscription + " already " + state);
            }
            DeliveryCursor cursor = cursorStore.load(subscription);
            ackedSequence = cursor == null ? 0L : cursor.getAckedSequence();
            lastDelivered = ackedSequence;
            state = StreamState.RUNNING;
        }
        Thread t = new Thread(this::dispatchLoop, "event-stream-" + subscription);
        t.setDaemon(true);
        dispatcher = t;
        t.start();
        log.info("event stream started subscription={} acked={} lastSequence={} maxInFlight={}",
                subscription, ackedSequence, eventLog.lastSequence(subscription), maxInFlight);
    }

    public void shutdown() {
        synchronized (monitor) {
            if (state == StreamState.STOPPED) {
                return;
            }
            state = StreamState.STOPPED;
            if (active != null) {
                active.markClosed(null);
                active = null;
            }
            for (StreamConnection c : standby) {
                c.markClosed(null);
            }
            standby.clear();
            monitor.notifyAll();
        }
        Thread t = dispatcher;
        if (t != null) {
            t.interrupt();
            try {
                t.join(1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("event stream stopped subscription={}", subscription);
    }

    @Override
    public StreamConnection connect(String memberId) {
        requireNonEmpty(memberId, "memberId");
        synchronized (monitor) {
            if (state == StreamState.FAILED) {
                throw fatalError;
            }
            if (state != StreamState.RUNNING) {
                throw new ConnectorUnavailableException("event stream " + subscription + " is " + state);
            }
            StreamConnection c = new StreamConnection(connectionIds.incrementAndGet(), memberId, this, maxInFlight);
            standby.addLast(c);
            log.info("stream connection attached subscription={} member={} conn={}", subscription, memberId, c.getId());
            if (active == null) {
                activateNext();
            }
            monitor.notifyAll();
            if (state == StreamState.FAILED) {
                throw fatalError;
            }
            return c;
        }
    }

    /**
     * 追加一条链上已排序的事件（由 connector/账本侧按链上顺序调用）。重复 sequence 被忽略。
     *
     * @return true 表示新事件
     * @throws SequenceGapException 事件跳号；运行时同时进入 FAILED
     */
    public boolean publish(SequencedEvent event) {
        requireNonNull(event, "event");
        boolean appended;
        try {
            appended = eventLog.append(subscription, event);
        } catch (SequenceGapException gap) {
            synchronized (monitor) {
                fail(gap);
            }
            throw gap;
        }
        if (appended) {
            synchronized (monitor) {
                monitor.notifyAll();
            }
        }
        return appended;
    }

    public long lastSequence() {
        return eventLog.lastSequence(subscription);
    }

    /**
     * 显式重新同步：把游标设置为 resumeAfter（调用方依据链上历史/应用侧记录确定），解除 FAILED。
     * resumeAfter 之后的事件必须仍在日志中。
     */
    public void resynchronize(long resumeAfter) {
        requireNonNegative(resumeAfter, "resumeAfter");
        synchronized (monitor) {
            if (state == StreamState.NEW || state == StreamState.STOPPED) {
                throw new IllegalStateException("event stream " + subscription + " is " + state);
            }
            long pruned = eventLog.prunedUpTo(subscription);
            if (resumeAfter < pruned) {
                throw new SequenceGapException(subscription, resumeAfter + 1L, pruned + 1L);
            }
            if (active != null) {
                active.markClosed(null);
                active = null;
            }
            DeliveryCursor cursor = cursorStore.reset(subscription, resumeAfter);
            ackedSequence = cursor.getAckedSequence();
            lastDelivered = ackedSequence;
            fatalError = null;
            state = StreamState.RUNNING;
            log.warn("event stream resynchronized subscription={} resumeAfter={} epoch={}",
                    subscription, resumeAfter, cursor.getEpoch());
            eventLog.pruneUpTo(subscription, resumeAfter);
            activateNext();
            monitor.notifyAll();
        }
    }

    /**
     * 断开一条连接。cause 为 null 表示计划内关闭；两者都走同一条 fail-over 路径。
     */
    public void disconnect(StreamConnection connection, Throwable cause) {
        requireNonNull(connection, "connection");
        synchronized (monitor) {
            boolean wasActive = connection == active;
            standby.remove(connection);
            connection.markClosed(cause);
            if (wasActive) {
                active = null;
                if (cause == null) {
                    log.info("active stream connection closed, handing over subscription={} member={} conn={} acked={}",
                            subscription, connection.getMemberId(), connection.getId(), ackedSequence);
                } else {
                    log.warn("active stream connection lost, failing over subscription={} member={} conn={} acked={} cause={}",
                            subscription, connection.getMemberId(), connection.getId(), ackedSequence, cause.toString());
                }
                lastDelivered = ackedSequence;
                activateNext();
            }
            monitor.notifyAll();
        }
    }

    boolean acknowledge(StreamConnection connection, long sequence) {
        synchronized (monitor) {
            if (connection != active || connection.isClosed() || connection.getEpoch() != activeEpoch) {
                metrics.protocolViolation("stale_ack");
                log.warn("ack from inactive stream connection discarded subscription={} conn={} epoch={} seq={}",
                        subscription, connection.getId(), connection.getEpoch(), sequence);
                return false;
            }
            if (sequence <= ackedSequence) {
                return true;
            }
            if (sequence > lastDelivered) {
                metrics.protocolViolation("ack_out_of_range");
                log.warn("ack beyond delivered range discarded subscription={} conn={} seq={} lastDelivered={}",
                        subscription, connection.getId(), sequence, lastDelivered);
                return false;
            }
            if (!cursorStore.advanceFenced(subscription, activeEpoch, sequence)) {
                metrics.protocolViolation("fenced_ack_rejected");
                log.warn("fenced cursor advance rejected subscription={} epoch={} seq={}", subscription, activeEpoch, sequence);
                return false;
            }
            ackedSequence = sequence;
            metrics.cursorAdvanced(subscription, sequence);
            // 剪枝与游标推进在同一临界区内，resynchronize 不会夹在两者之间丢掉重放区间
            eventLog.pruneUpTo(subscription, sequence);
            monitor.notifyAll();
        }
        return true;
    }

    public StreamStatus status() {
        synchronized (monitor) {
            return new StreamStatus(subscription, state, ackedSequence, lastDelivered,
                    eventLog.lastSequence(subscription), eventLog.prunedUpTo(subscription), activeEpoch,
                    active == null ? null : active.getMemberId(), standby.size());
        }
    }

    public String getSubscription() {
        return subscription;
    }

    public SequenceGapException getFatalError() {
        synchronized (monitor) {
            return fatalError;
        }
    }

    private void dispatchLoop() {
        while (true) {
            boolean errored = false;
            synchronized (monitor) {
                try {
                    while (!readyToDispatch()) {
                        if (state == StreamState.STOPPED) {
                            return;
                        }
                        monitor.wait(IDLE_WAIT_MS);
                    }
                    dispatchOnce();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (SequenceGapException gap) {
                    fail(gap);
                } catch (RuntimeException e) {
                    log.error("event stream dispatch error subscription={}", subscription, e);
                    errored = true;
                }
            }
            if (errored) {
                try {
                    Thread.sleep(IDLE_WAIT_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    // 以下方法都在 monitor 内调用

    private boolean readyToDispatch() {
        return state == StreamState.RUNNING
                && active != null
                && lastDelivered - ackedSequence < maxInFlight
                && lastDelivered < eventLog.lastSequence(subscription);
    }

    private void dispatchOnce() throws InterruptedException {
        int window = (int) (maxInFlight - (lastDelivered - ackedSequence));
        List<SequencedEvent> events = eventLog.readAfter(subscription, lastDelivered, window);
        if (events.isEmpty()) {
            throw new SequenceGapException(subscription, lastDelivered + 1L, eventLog.prunedUpTo(subscription) + 1L);
        }
        StreamConnection target = active;
        for (SequencedEvent e : events) {
            if (e.getSequence() != lastDelivered + 1L) {
                throw new SequenceGapException(subscription, lastDelivered + 1L, e.getSequence());
            }
            if (!target.offer(e)) {
                log.warn("stream inbox full subscription={} conn={} seq={}", subscription, target.getId(), e.getSequence());
                monitor.wait(IDLE_WAIT_MS);
                break;
            }
            lastDelivered = e.getSequence();
        }
        metrics.inboxDepth(target.getMemberId(), target.inboxDepth());
    }

    private void activateNext() {
        while (active == null && state == StreamState.RUNNING) {
            StreamConnection next = standby.pollFirst();
            if (next == null) {
                return;
            }
            if (next.isClosed()) {
                continue;
            }
            DeliveryCursor cursor = cursorStore.activate(subscription);
            long pruned = eventLog.prunedUpTo(subscription);
            if (cursor.getAckedSequence() < pruned) {
                standby.addFirst(next);
                fail(new SequenceGapException(subscription, cursor.getAckedSequence() + 1L, pruned + 1L));
                return;
            }
            active = next;
            activeEpoch = cursor.getEpoch();
            ackedSequence = cursor.getAckedSequence();
            lastDelivered = ackedSequence;
            next.activate(activeEpoch);
            metrics.streamActivation(subscription, next.getMemberId());
            log.info("stream connection activated subscription={} member={} conn={} epoch={} replayFrom={}",
                    subscription, next.getMemberId(), next.getId(), activeEpoch, ackedSequence + 1L);
        }
    }

    private void fail(SequenceGapException gap) {
        state = StreamState.FAILED;
        fatalError = gap;
        metrics.sequenceGap(subscription);
        log.error("sequence gap detected, delivery halted until resynchronize subscription={} expected={} available={}",
                subscription, gap.getExpectedSequence(), gap.getAvailableSequence());
        List<StreamConnection> all = new ArrayList<>(standby);
        if (active != null) {
            all.add(active);
            active = null;
        }
        standby.clear();
        for (StreamConnection c : all) {
            c.markClosed(gap);
        }
        monitor.notifyAll();
    }
}

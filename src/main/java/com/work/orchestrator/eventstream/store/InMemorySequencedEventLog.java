package com.work.orchestrator.eventstream.store;

import com.work.orchestrator.blockchain.exception.SequenceGapException;
import com.work.orchestrator.eventstream.SequencedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.orchestrator.support.ValidationUtils.requireNonEmpty;
import static com.work.orchestrator.support.ValidationUtils.requireNonNull;

/**
 * 纯内存事件日志，按订阅加锁。
 */
public class InMemorySequencedEventLog implements SequencedEventLog {

    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

    private Partition partition(String subscription) {
        requireNonEmpty(subscription, "subscription");
        return partitions.computeIfAbsent(subscription, k -> new Partition());
    }

    @Override
    public boolean append(String subscription, SequencedEvent event) {
        requireNonNull(event, "event");
        Partition p = partition(subscription);
        synchronized (p) {
            long expected = p.lastSequence + 1L;
            if (event.getSequence() < expected) {
                return false;
            }
            if (event.getSequence() > expected) {
                throw new SequenceGapException(subscription, expected, event.getSequence());
            }
            p.events.put(event.getSequence(), event);
            p.lastSequence = event.getSequence();
            return true;
        }
    }

    @Override
    public List<SequencedEvent> readAfter(String subscription, long afterSequence, int limit) {
        Partition p = partition(subscription);
        synchronized (p) {
            List<SequencedEvent> out = new ArrayList<>(Math.max(0, Math.min(limit, p.events.size())));
            for (SequencedEvent e : p.events.tailMap(afterSequence, false).values()) {
                if (out.size() >= limit) {
                    break;
                }
                out.add(e);
            }
            return out;
        }
    }

    @Override
    public long lastSequence(String subscription) {
        Partition p = partition(subscription);
        synchronized (p) {
            return p.lastSequence;
        }
    }

    @Override
    public long prunedUpTo(String subscription) {
        Partition p = partition(subscription);
        synchronized (p) {
            return p.prunedUpTo;
        }
    }

    @Override
    public int pruneUpTo(String subscription, long upTo) {
        Partition p = partition(subscription);
        synchronized (p) {
            NavigableMap<Long, SequencedEvent> head = p.events.headMap(upTo, true);
            int n = head.size();
            head.clear();
            if (upTo > p.prunedUpTo) {
                p.prunedUpTo = Math.min(upTo, p.lastSequence);
            }
            return n;
        }
    }

    public int size(String subscription) {
        Partition p = partition(subscription);
        synchronized (p) {
            return p.events.size();
        }
    }

    private static class Partition {
        final TreeMap<Long, SequencedEvent> events = new TreeMap<>();
        long lastSequence;
        long prunedUpTo;
    }
}

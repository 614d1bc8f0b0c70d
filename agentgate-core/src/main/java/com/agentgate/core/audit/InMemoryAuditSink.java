package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存审计日志（有界，只追加）
 * <p>
 * 超过容量时淘汰最旧的事件。适用于测试与运维控制台查询；生产中通常与持久化 sink 组合使用。
 * </p>
 */
public class InMemoryAuditSink implements AuditSink {

    public static final int DEFAULT_CAPACITY = 10_000;

    @Getter
    private final int capacity;
    private final Deque<AuditEvent> events = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long evicted;

    public InMemoryAuditSink() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryAuditSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public void record(AuditEvent event) {
        lock.writeLock().lock();
        try {
            if (events.size() == capacity) {
                events.pollFirst();
                evicted++;
            }
            events.addLast(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按条件检索，返回最近的 limit 条，按写入顺序排列
     */
    public List<AuditEvent> query(AuditQuery query) {
        int limit = Math.max(0, query.getLimit());
        List<AuditEvent> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            // 从最新往回扫，够数即停
            Iterator<AuditEvent> it = events.descendingIterator();
            while (it.hasNext() && matched.size() < limit) {
                AuditEvent event = it.next();
                if (query.matches(event)) {
                    matched.add(event);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        Collections.reverse(matched);
        return List.copyOf(matched);
    }

    public List<AuditEvent> events() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 因容量淘汰的事件总数
     */
    public long evictedCount() {
        lock.readLock().lock();
        try {
            return evicted;
        } finally {
            lock.readLock().unlock();
        }
    }
}

package com.agentgate.core.dispatch;

import com.agentgate.api.tool.ToolExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 执行历史（只追加）
 * <p>
 * 并发派发之间唯一共享的可变状态，读写锁保护。
 * 只在运维显式调用 {@link #clear()} 时清空，不会自动压缩。
 * </p>
 */
@Slf4j
public class ExecutionHistory {

    private final List<ToolExecutionResult> results = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void append(ToolExecutionResult result) {
        lock.writeLock().lock();
        try {
            results.add(result);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ToolExecutionResult> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(results);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 最近 limit 条，按追加顺序
     */
    public List<ToolExecutionResult> recent(int limit) {
        lock.readLock().lock();
        try {
            int from = Math.max(0, results.size() - Math.max(0, limit));
            return List.copyOf(results.subList(from, results.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ToolExecutionResult> forTool(String toolName) {
        lock.readLock().lock();
        try {
            List<ToolExecutionResult> matched = new ArrayList<>();
            for (ToolExecutionResult result : results) {
                if (result.toolName().equals(toolName)) {
                    matched.add(result);
                }
            }
            return matched;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return results.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            results.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared execution history");
    }
}

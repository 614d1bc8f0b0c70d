package com.agentgate.core.dispatch;

import com.agentgate.api.tool.ToolExecutionRequest;
import com.agentgate.api.tool.ToolExecutionResult;
import com.agentgate.api.tool.ToolExecutionStatus;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 单个请求的状态机
 * <p>
 * 状态只前进不回退；进入终态后所有变更都被忽略，
 * 终态结果只会被第一个到达者（工作线程或截止时间）写入一次。
 * </p>
 */
final class ExecutionTracker {

    private final ToolExecutionRequest request;
    private final int maxRetries;
    private final Duration timeout;

    private ToolExecutionStatus status = ToolExecutionStatus.PENDING;
    private int attempts;
    private long firstAttemptNanos = -1;
    private String lastError;
    private ToolExecutionResult terminal;

    ExecutionTracker(ToolExecutionRequest request, int maxRetries, Duration timeout) {
        this.request = request;
        this.maxRetries = maxRetries;
        this.timeout = timeout;
    }

    ToolExecutionRequest request() {
        return request;
    }

    int maxRetries() {
        return maxRetries;
    }

    Duration timeout() {
        return timeout;
    }

    synchronized int attempts() {
        return attempts;
    }

    synchronized ToolExecutionStatus status() {
        return status;
    }

    synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 开始一次尝试
     *
     * @return 已进入终态或次数耗尽时返回 false
     */
    synchronized boolean beginAttempt() {
        if (status.isTerminal() || attempts >= maxRetries) {
            return false;
        }
        if (firstAttemptNanos < 0) {
            firstAttemptNanos = System.nanoTime();
        }
        attempts++;
        status = ToolExecutionStatus.RUNNING;
        return true;
    }

    synchronized void markRetrying(String error) {
        if (status.isTerminal()) {
            return;
        }
        lastError = error;
        status = ToolExecutionStatus.RETRYING;
    }

    /**
     * 进入终态
     *
     * @return 本次调用赢得终态时返回快照，否则为空
     */
    synchronized Optional<ToolExecutionResult> complete(ToolExecutionStatus terminalStatus,
                                                        Map<String, Object> result,
                                                        String error) {
        if (status.isTerminal()) {
            return Optional.empty();
        }
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        status = terminalStatus;
        if (error != null) {
            lastError = error;
        }
        terminal = new ToolExecutionResult(
                request.getToolName(),
                terminalStatus,
                terminalStatus == ToolExecutionStatus.SUCCESS ? result : null,
                terminalStatus == ToolExecutionStatus.SUCCESS ? null : lastError,
                elapsedMillis(),
                attempts,
                request.getMetadata());
        return Optional.of(terminal);
    }

    /**
     * 终态快照；尚未结束时返回当前状态的临时快照
     */
    synchronized ToolExecutionResult result() {
        if (terminal != null) {
            return terminal;
        }
        return new ToolExecutionResult(request.getToolName(), status, null, lastError,
                elapsedMillis(), attempts, request.getMetadata());
    }

    private long elapsedMillis() {
        return firstAttemptNanos < 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - firstAttemptNanos);
    }
}

package com.agentgate.core.dispatch.event;

import com.agentgate.api.tool.ToolExecutionResult;

import java.time.Duration;

/**
 * 派发器内部事件（用于指标/监控）
 */
public sealed interface DispatchEvent {

    String toolName();

    /**
     * 单次尝试开始
     */
    record AttemptStarted(String toolName, int attempt, int maxRetries) implements DispatchEvent {
    }

    /**
     * 单次尝试失败
     */
    record AttemptFailed(String toolName, int attempt, String error, boolean timedOut) implements DispatchEvent {
    }

    /**
     * 已安排重试
     */
    record RetryScheduled(String toolName, int attempt, long backoffMs) implements DispatchEvent {
    }

    /**
     * 请求进入终态
     */
    record ExecutionCompleted(String toolName, ToolExecutionResult result) implements DispatchEvent {
    }

    /**
     * 整体截止时间到达，该请求被强制超时
     */
    record DeadlineExceeded(String toolName, Duration overallTimeout) implements DispatchEvent {
    }
}

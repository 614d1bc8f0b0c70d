package com.agentgate.core.dispatch;

import com.agentgate.api.exception.ToolTerminalFailureException;
import com.agentgate.api.tool.ToolExecutionRequest;
import com.agentgate.api.tool.ToolExecutionResult;
import com.agentgate.api.tool.ToolExecutionStatus;
import com.agentgate.api.tool.ToolInvoker;
import com.agentgate.core.dispatch.event.DispatchEvent;
import com.agentgate.core.dispatch.event.DispatchEventBus;
import jakarta.annotation.PreDestroy;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 工具派发器
 * 职责：并发执行、单次超时、指数退避重试、整体截止时间、执行历史
 * <p>
 * 两个线程池：
 * - 工作池（固定宽度）运行每个请求的重试状态机，限制 dispatchMany 的并行度
 * - 调用池运行真正的下游调用，使工作线程可以按超时放弃等待
 * 超时只保证“结果”被强制为 TIMEOUT，下游调用本身不保证被终止。
 * </p>
 */
@Slf4j
public class ToolDispatcher {

    // 2^30 之后的退避已无实际意义
    private static final int MAX_BACKOFF_SHIFT = 30;

    private final ToolInvoker invoker;
    private final DispatcherConfig config;
    private final ExecutionHistory history;
    private final ExecutorService workerPool;
    private final ExecutorService invocationPool;

    @Setter
    private DispatchEventBus eventBus; // 可选，用于发布派发事件

    public ToolDispatcher(ToolInvoker invoker, DispatcherConfig config, ExecutionHistory history) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.config = config != null ? config : DispatcherConfig.defaults();
        this.config.validate();
        this.history = history != null ? history : new ExecutionHistory();
        this.workerPool = Executors.newFixedThreadPool(this.config.getMaxWorkers(), threadFactory("agentgate-dispatch"));
        this.invocationPool = Executors.newCachedThreadPool(threadFactory("agentgate-invoke"));
        log.info("Initialized ToolDispatcher with {} workers", this.config.getMaxWorkers());
    }

    public ToolDispatcher(ToolInvoker invoker, DispatcherConfig config) {
        this(invoker, config, new ExecutionHistory());
    }

    /**
     * 在调用线程上执行单个请求（下游调用仍在调用池中执行以便超时控制）
     */
    public ToolExecutionResult dispatchOne(ToolExecutionRequest request) {
        ExecutionTracker tracker = track(request);
        run(tracker);
        return tracker.result();
    }

    public List<ToolExecutionResult> dispatchMany(List<ToolExecutionRequest> requests) {
        return dispatchMany(requests, null);
    }

    /**
     * 并发执行多个请求
     *
     * @param requests       请求列表
     * @param overallTimeout 整体截止时间，可为 null；到期后所有未结束的请求被强制为 TIMEOUT
     * @return 与入参一一对应（按下标，而非完成顺序）的结果
     */
    public List<ToolExecutionResult> dispatchMany(List<ToolExecutionRequest> requests, Duration overallTimeout) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        log.info("Dispatching {} tools in parallel{}", requests.size(),
                overallTimeout == null ? "" : " (overall timeout " + overallTimeout.toMillis() + "ms)");

        List<ExecutionTracker> trackers = new ArrayList<>(requests.size());
        List<Future<?>> futures = new ArrayList<>(requests.size());
        for (ToolExecutionRequest request : requests) {
            ExecutionTracker tracker = track(request);
            trackers.add(tracker);
            futures.add(submit(tracker));
        }

        long deadline = overallTimeout == null ? 0 : System.nanoTime() + overallTimeout.toNanos();
        String abortReason = null;
        for (int i = 0; i < futures.size() && abortReason == null; i++) {
            try {
                if (overallTimeout == null) {
                    futures.get(i).get();
                } else {
                    futures.get(i).get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                }
            } catch (TimeoutException e) {
                abortReason = "Overall timeout (" + overallTimeout.toMillis() + "ms) exceeded";
            } catch (ExecutionException e) {
                // run() 自身已兜底，这里只防御线程池层面的异常
                finish(trackers.get(i), ToolExecutionStatus.FAILED, null, describe(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abortReason = "Dispatch interrupted";
            }
        }

        if (abortReason != null) {
            forceTimeout(trackers, futures, abortReason, overallTimeout);
        }

        List<ToolExecutionResult> results = new ArrayList<>(trackers.size());
        for (ExecutionTracker tracker : trackers) {
            results.add(tracker.result());
        }
        return results;
    }

    // ==================== 统计 ====================

    public ExecutionStats stats() {
        return ExecutionStats.of(history.snapshot());
    }

    public ExecutionStats toolStats(String toolName) {
        return ExecutionStats.forTool(history.snapshot(), toolName);
    }

    public List<ToolExecutionResult> recentExecutions(int limit) {
        return history.recent(limit);
    }

    public void clearHistory() {
        history.clear();
    }

    public ExecutionHistory history() {
        return history;
    }

    public DispatcherConfig config() {
        return config;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ToolDispatcher...");
        workerPool.shutdownNow();
        invocationPool.shutdownNow();
    }

    // ==================== 内部逻辑 ====================

    private ExecutionTracker track(ToolExecutionRequest request) {
        int maxRetries = request.getMaxRetries() != null ? request.getMaxRetries() : config.getDefaultMaxRetries();
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : config.getDefaultTimeout();
        return new ExecutionTracker(request, maxRetries, timeout);
    }

    private Future<?> submit(ExecutionTracker tracker) {
        try {
            return workerPool.submit(() -> run(tracker));
        } catch (RejectedExecutionException e) {
            finish(tracker, ToolExecutionStatus.FAILED, null, "Dispatcher rejected request: " + e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * 单个请求的完整执行，任何异常都只影响该请求本身
     */
    private void run(ExecutionTracker tracker) {
        try {
            executeWithRetry(tracker);
        } catch (Throwable t) {
            log.error("Tool '{}' crashed in dispatcher", tracker.request().getToolName(), t);
            finish(tracker, ToolExecutionStatus.FAILED, null, describe(t));
        }
    }

    private void executeWithRetry(ExecutionTracker tracker) {
        ToolExecutionRequest request = tracker.request();
        String toolName = request.getToolName();
        int maxRetries = tracker.maxRetries();

        while (tracker.attempts() < maxRetries) {
            if (!tracker.beginAttempt()) {
                // 已被截止时间强制结束
                return;
            }
            int attempt = tracker.attempts();
            log.info("Executing tool '{}' (attempt {}/{})", toolName, attempt, maxRetries);
            publish(new DispatchEvent.AttemptStarted(toolName, attempt, maxRetries));

            AttemptOutcome outcome = attempt(request, tracker.timeout());
            switch (outcome.kind()) {
                case SUCCESS -> {
                    finish(tracker, ToolExecutionStatus.SUCCESS, outcome.response(), null);
                    return;
                }
                case INTERRUPTED -> {
                    finish(tracker, ToolExecutionStatus.FAILED, null, "Interrupted during attempt " + attempt);
                    return;
                }
                case NON_RETRYABLE -> {
                    log.error("Tool '{}' failed with non-retryable error: {}", toolName, outcome.error());
                    publish(new DispatchEvent.AttemptFailed(toolName, attempt, outcome.error(), false));
                    finish(tracker, ToolExecutionStatus.FAILED, null, outcome.error());
                    return;
                }
                default -> {
                    boolean timedOut = outcome.kind() == AttemptKind.TIMEOUT;
                    if (timedOut) {
                        log.warn("Tool '{}' timed out (attempt {}/{})", toolName, attempt, maxRetries);
                    } else {
                        log.error("Tool '{}' failed: {} (attempt {}/{})", toolName, outcome.error(), attempt, maxRetries);
                    }
                    publish(new DispatchEvent.AttemptFailed(toolName, attempt, outcome.error(), timedOut));

                    if (attempt >= maxRetries) {
                        finish(tracker, timedOut ? ToolExecutionStatus.TIMEOUT : ToolExecutionStatus.FAILED,
                                null, outcome.error());
                        return;
                    }
                    if (!backoff(tracker, attempt, outcome.error())) {
                        return;
                    }
                }
            }
        }
    }

    /**
     * 退避等待
     *
     * @return 被中断时返回 false
     */
    private boolean backoff(ExecutionTracker tracker, int attempt, String error) {
        long backoffMs = config.getBaseBackoff().toMillis() << Math.min(attempt - 1, MAX_BACKOFF_SHIFT);
        String toolName = tracker.request().getToolName();
        tracker.markRetrying(error);
        publish(new DispatchEvent.RetryScheduled(toolName, attempt, backoffMs));
        log.info("Retrying tool '{}' in {}ms...", toolName, backoffMs);
        try {
            TimeUnit.MILLISECONDS.sleep(backoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(tracker, ToolExecutionStatus.FAILED, null, "Interrupted during backoff after attempt " + attempt);
            return false;
        }
    }

    private AttemptOutcome attempt(ToolExecutionRequest request, Duration timeout) {
        Future<Map<String, Object>> future;
        try {
            future = invocationPool.submit(() -> invoker.invoke(request.getTargetIdentifier(), request.getInputData()));
        } catch (RejectedExecutionException e) {
            return new AttemptOutcome(AttemptKind.FAILURE, null, "Invocation rejected: " + e.getMessage());
        }

        try {
            Map<String, Object> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response != null && response.containsKey(ToolInvoker.ERROR_KEY)) {
                // 下游以结构化结果报告的应用层错误
                return new AttemptOutcome(AttemptKind.FAILURE, null, String.valueOf(response.get(ToolInvoker.ERROR_KEY)));
            }
            return new AttemptOutcome(AttemptKind.SUCCESS, response == null ? Map.of() : response, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new AttemptOutcome(AttemptKind.TIMEOUT, null, "Timeout after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            AttemptKind kind = cause instanceof ToolTerminalFailureException ? AttemptKind.NON_RETRYABLE : AttemptKind.FAILURE;
            return new AttemptOutcome(kind, null, describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new AttemptOutcome(AttemptKind.INTERRUPTED, null, "Interrupted");
        }
    }

    private void forceTimeout(List<ExecutionTracker> trackers, List<Future<?>> futures, String reason, Duration overallTimeout) {
        int forced = 0;
        for (int i = 0; i < trackers.size(); i++) {
            ExecutionTracker tracker = trackers.get(i);
            if (finish(tracker, ToolExecutionStatus.TIMEOUT, null, reason)) {
                forced++;
                publish(new DispatchEvent.DeadlineExceeded(tracker.request().getToolName(), overallTimeout));
                // 协作式取消：中断退避或等待中的工作线程
                futures.get(i).cancel(true);
            }
        }
        log.error("{}: {} of {} tools forced to TIMEOUT", reason, forced, trackers.size());
    }

    /**
     * 写入终态；只有第一个到达者生效
     *
     * @return 本次调用是否生效
     */
    private boolean finish(ExecutionTracker tracker, ToolExecutionStatus status, Map<String, Object> response, String error) {
        return tracker.complete(status, response, error)
                .map(result -> {
                    history.append(result);
                    if (result.isSuccess()) {
                        log.info("Tool '{}' succeeded in {}ms (attempt {})",
                                result.toolName(), result.executionTimeMs(), result.attempts());
                    }
                    publish(new DispatchEvent.ExecutionCompleted(result.toolName(), result));
                    return true;
                })
                .orElse(false);
    }

    private void publish(DispatchEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "Unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Thread {} failed: {}", t.getName(), e.getMessage()));
            return thread;
        };
    }

    // ==================== 内部类 ====================

    private enum AttemptKind {
        SUCCESS, FAILURE, TIMEOUT, NON_RETRYABLE, INTERRUPTED
    }

    private record AttemptOutcome(AttemptKind kind, Map<String, Object> response, String error) {
    }
}

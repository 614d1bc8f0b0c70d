package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 异步审计输出 (非阻塞)
 * <p>
 * 独立单线程保证写入顺序；队列满时丢弃事件，保全业务线程。
 * </p>
 */
@Slf4j
public class AsyncAuditSink implements AuditSink {

    private final AuditSink delegate;
    private final ExecutorService executor;

    public AsyncAuditSink(AuditSink delegate, int queueCapacity) {
        this.delegate = delegate;
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread thread = new Thread(r, "agentgate-audit-writer");
                    thread.setDaemon(true);
                    thread.setUncaughtExceptionHandler((t, e) ->
                            log.error("Thread {} failed: {}", t.getName(), e.getMessage()));
                    return thread;
                },
                (r, pool) -> log.warn("[AUDIT] Queue full, audit event dropped")
        );
    }

    @Override
    public void record(AuditEvent event) {
        try {
            executor.execute(() -> {
                try {
                    delegate.record(event);
                } catch (RuntimeException e) {
                    log.warn("[AUDIT] Async audit write failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            // 已关闭
            log.warn("[AUDIT] Audit writer is shut down, event dropped: {}/{}",
                    event.getResourceType(), event.getResourceName());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down audit writer...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

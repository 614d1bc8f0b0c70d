package com.agentgate.core.dispatch.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * 派发事件总线
 * <p>
 * 监听器按事件记录类型分桶，订阅 {@link DispatchEvent} 本身则接收全部事件。
 * 同步模式下在工作线程上回调；异步模式下由独立单线程按发布顺序投递，
 * 慢监听器不会拉长尝试耗时，队列满时丢弃并计数。
 * </p>
 */
@Slf4j
public class DispatchEventBus {

    private final String name;
    private final Map<Class<? extends DispatchEvent>, List<Consumer<DispatchEvent>>> listenersByType =
            new ConcurrentHashMap<>();
    private final List<Consumer<DispatchEvent>> allEventListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor; // null 表示同步投递
    private final LongAdder listenerFailures = new LongAdder();
    private final LongAdder droppedEvents = new LongAdder();

    public DispatchEventBus(String name) {
        this.name = name;
        this.deliveryExecutor = null;
    }

    private DispatchEventBus(String name, int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.name = name;
        this.deliveryExecutor = new ThreadPoolExecutor(
                1,
                1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread thread = new Thread(r, name + "-events");
                    thread.setDaemon(true);
                    return thread;
                },
                (r, pool) -> {
                    droppedEvents.increment();
                    log.warn("[{}] Event dropped, {}", name, pool.isShutdown() ? "bus is shut down" : "queue full");
                });
    }

    /**
     * 在独立线程上投递事件的总线
     */
    public static DispatchEventBus async(String name, int queueCapacity) {
        return new DispatchEventBus(name, queueCapacity);
    }

    public boolean isAsync() {
        return deliveryExecutor != null;
    }

    /**
     * 订阅某一类事件；传入 {@code DispatchEvent.class} 订阅全部事件
     */
    public <E extends DispatchEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler) {
        Consumer<DispatchEvent> listener = event -> handler.accept(eventType.cast(event));
        List<Consumer<DispatchEvent>> bucket = eventType == DispatchEvent.class
                ? allEventListeners
                : listenersByType.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        bucket.add(listener);
        log.debug("[{}] Subscribed to {}", name, eventType.getSimpleName());
        return () -> bucket.remove(listener);
    }

    public void publish(DispatchEvent event) {
        List<Consumer<DispatchEvent>> typed = listenersByType.getOrDefault(event.getClass(), List.of());
        if (typed.isEmpty() && allEventListeners.isEmpty()) {
            return;
        }
        if (deliveryExecutor == null) {
            deliver(event, typed);
            return;
        }
        // 拒绝时由拒绝策略计数
        deliveryExecutor.execute(() -> deliver(event, typed));
    }

    private void deliver(DispatchEvent event, List<Consumer<DispatchEvent>> typed) {
        for (Consumer<DispatchEvent> listener : typed) {
            notify(listener, event);
        }
        for (Consumer<DispatchEvent> listener : allEventListeners) {
            notify(listener, event);
        }
    }

    private void notify(Consumer<DispatchEvent> listener, DispatchEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            listenerFailures.increment();
            log.error("[{}] Listener failed on {} for tool {}",
                    name, event.getClass().getSimpleName(), event.toolName(), e);
        }
    }

    public int subscriberCount() {
        int count = allEventListeners.size();
        for (List<Consumer<DispatchEvent>> bucket : listenersByType.values()) {
            count += bucket.size();
        }
        return count;
    }

    public long listenerFailureCount() {
        return listenerFailures.sum();
    }

    public long droppedEventCount() {
        return droppedEvents.sum();
    }

    /**
     * 异步模式下等待已入队事件投递完毕后关闭
     */
    @PreDestroy
    public void shutdown() {
        if (deliveryExecutor == null) {
            return;
        }
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 订阅句柄
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}

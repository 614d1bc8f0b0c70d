package com.agentgate.core.dispatch;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 派发器运行时配置
 * 请求未指定超时或重试次数时使用这里的默认值。不可变，派发器构造时校验一次。
 */
@Value
@Builder(toBuilder = true)
public class DispatcherConfig {

    /**
     * 并发工作线程上限（dispatchMany 的并行宽度）
     */
    @Builder.Default
    int maxWorkers = 10;

    /**
     * 单次尝试的默认超时
     */
    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * 默认最大尝试次数（包含第一次）
     */
    @Builder.Default
    int defaultMaxRetries = 3;

    /**
     * 指数退避基数：第 n 次失败后等待 baseBackoff * 2^(n-1)
     */
    @Builder.Default
    Duration baseBackoff = Duration.ofSeconds(1);

    /**
     * 派发事件是否在独立线程上投递
     */
    @Builder.Default
    boolean asyncEvents = false;

    /**
     * 异步投递队列容量，满时丢弃
     */
    @Builder.Default
    int eventQueueCapacity = 1000;

    public static DispatcherConfig defaults() {
        return DispatcherConfig.builder().build();
    }

    void validate() {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        if (defaultMaxRetries < 1) {
            throw new IllegalArgumentException("defaultMaxRetries must be >= 1, got " + defaultMaxRetries);
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must not be negative");
        }
        if (asyncEvents && eventQueueCapacity < 1) {
            throw new IllegalArgumentException("eventQueueCapacity must be >= 1, got " + eventQueueCapacity);
        }
    }
}
